package com.anthem.acctctl.core.account;

import com.anthem.acctctl.core.creds.CredentialsProvider;
import com.anthem.acctctl.core.ctl.Ctl;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.services.iam.IamClient;

import java.util.EnumSet;
import java.util.Set;

/**
 * Control state and IAM access for one AWS account.
 *
 * {@code ctl} is the desired local state and {@code ref} the last state
 * confirmed in the account. An account is mutated by at most one bulk task
 * at a time.
 */
public class Account {

    private static final int HTTP_FORBIDDEN = 403;

    private final String id;
    private String name;
    private final EnumSet<AccountFlag> flags = EnumSet.noneOf(AccountFlag.class);
    private Ctl ctl = Ctl.EMPTY;
    private Ctl ref = Ctl.EMPTY;
    private RuntimeException err;
    private CredentialsProvider credsProvider;
    private IamClient iam;

    public Account(String id, String name) {
        if (!AccountIds.isId(id)) {
            throw new IllegalArgumentException("invalid account id: " + id);
        }
        this.id = id;
        this.name = name == null ? "" : name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name == null ? "" : name;
    }

    public Ctl getCtl() {
        return ctl;
    }

    public void setCtl(Ctl ctl) {
        this.ctl = ctl == null ? Ctl.EMPTY : ctl;
    }

    public Ctl getRef() {
        return ref;
    }

    public void setRef(Ctl ref) {
        this.ref = ref == null ? Ctl.EMPTY : ref;
    }

    public RuntimeException getErr() {
        return err;
    }

    public void setErr(RuntimeException err) {
        this.err = err;
    }

    public CredentialsProvider getCredsProvider() {
        return credsProvider;
    }

    public void setCredsProvider(CredentialsProvider credsProvider) {
        this.credsProvider = credsProvider;
    }

    public IamClient getIam() {
        return iam;
    }

    public void setIam(IamClient iam) {
        this.iam = iam;
    }

    public void set(AccountFlag... fs) {
        for (AccountFlag f : fs) {
            flags.add(f);
        }
    }

    public void clear(AccountFlag... fs) {
        for (AccountFlag f : fs) {
            flags.remove(f);
        }
    }

    public boolean test(AccountFlag f) {
        return flags.contains(f);
    }

    public Set<AccountFlag> getFlags() {
        return flags.isEmpty() ? EnumSet.noneOf(AccountFlag.class) : EnumSet.copyOf(flags);
    }

    public void setFlags(Set<AccountFlag> fs) {
        flags.clear();
        flags.addAll(fs);
    }

    public boolean isCredsValid() {
        return flags.contains(AccountFlag.CREDS);
    }

    public boolean isCtlValid() {
        return flags.contains(AccountFlag.CTL);
    }

    /**
     * Updates flags after a control init, load or store call and returns
     * {@code e}. A 403 response invalidates both credentials and control state;
     * any other failure degrades the account to unmanaged.
     */
    public RuntimeException ctlUpdate(RuntimeException e) {
        set(AccountFlag.CREDS, AccountFlag.LOADED, AccountFlag.CTL);
        if (e != null) {
            if (e instanceof SdkServiceException && ((SdkServiceException) e).statusCode() == HTTP_FORBIDDEN) {
                clear(AccountFlag.CREDS, AccountFlag.CTL);
            } else {
                clear(AccountFlag.CTL);
            }
        }
        return e;
    }

    public ControlState controlState() {
        if (!test(AccountFlag.LOADED)) {
            return ControlState.UNKNOWN;
        }
        if (!isCtlValid()) {
            return ControlState.UNMANAGED;
        }
        return ctl.isOwned() ? ControlState.OWNED : ControlState.FREE;
    }

    @Override
    public String toString() {
        return "Account{id=" + id + ", name=" + name + ", flags=" + flags + ", ctl=" + ctl + "}";
    }
}
