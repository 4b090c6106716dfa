package com.anthem.acctctl.core.context;

import com.anthem.acctctl.core.AcctCtlProperties;
import com.anthem.acctctl.core.AwsClientFactory;
import com.anthem.acctctl.core.account.Account;
import com.anthem.acctctl.core.account.AccountOps;
import com.anthem.acctctl.core.account.AccountRegistry;
import com.anthem.acctctl.core.creds.CallerIdentity;
import com.anthem.acctctl.core.creds.CredentialProxy;
import com.anthem.acctctl.core.creds.CredentialSnapshot;
import com.anthem.acctctl.core.creds.CredentialsProvider;
import com.anthem.acctctl.core.exception.AcctCtlException;
import com.anthem.acctctl.core.exception.ErrorKind;
import com.anthem.acctctl.core.org.AccountDirectory;
import com.anthem.acctctl.core.org.OrgInfo;
import com.anthem.acctctl.core.session.SavedAccount;
import com.anthem.acctctl.core.session.SavedCredentials;
import com.anthem.acctctl.core.session.SavedSession;
import com.anthem.acctctl.core.spec.AccountSpec;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Gateway identity, organization and account state shared by all account
 * operations.
 *
 * A context is initialized once, either from AWS ({@link #init()}) or from a
 * persisted session ({@link #restore(SavedSession)}), and then provides
 * account matching and credentials for the configured common role.
 */
@Slf4j
public class AccountContext implements AutoCloseable {

    private final AcctCtlProperties properties;
    private final CredentialProxy proxy;
    private final CredentialsProvider baseCreds;
    private final AccountRegistry registry;
    private final AccountOps ops;
    private final AwsClientFactory clients;
    private final Clock clock;

    private OrgInfo orgInfo = OrgInfo.none();
    private AccountDirectory directory;
    private boolean initialized;

    public AccountContext(AcctCtlProperties properties, CredentialProxy proxy, CredentialsProvider baseCreds,
                          AccountRegistry registry, AccountOps ops, AwsClientFactory clients, Clock clock) {
        this.properties = properties;
        this.proxy = proxy;
        this.baseCreds = baseCreds;
        this.registry = registry;
        this.ops = ops;
        this.clients = clients;
        this.clock = clock;
    }

    /**
     * Loads the gateway identity and organization information from AWS.
     */
    public synchronized void init() {
        requireNotInitialized();
        proxy.init();
        directory = clients.directory(baseCreds);
        orgInfo = directory.describeOrganization();
        applyCommonRole();
        applyMasterCreds();
        initialized = true;
        log.info("Account context initialized: account={}, org={}, commonRole={}",
                proxy.getIdentity().getAccount(), orgInfo.getId(), registry.getCommonRole());
    }

    /**
     * Initializes the context from a persisted session. Accounts are
     * registered with their saved control state; credentials are restored
     * only if the session used the same common role.
     */
    public synchronized void restore(SavedSession s) {
        requireNotInitialized();
        if (s.getIdentity() == null || s.getSessionName() == null) {
            throw new IllegalArgumentException("saved session has no gateway identity");
        }
        proxy.restore(s.getIdentity(), s.getSessionName());
        orgInfo = s.getOrg() != null ? s.getOrg() : OrgInfo.none();
        directory = clients.directory(baseCreds);
        applyCommonRole();
        if (s.getAccounts() != null && !s.getAccounts().isEmpty()) {
            List<Account> acs = new ArrayList<>(s.getAccounts().size());
            for (SavedAccount sa : s.getAccounts()) {
                Account ac = new Account(sa.getId(), sa.getName());
                if (sa.getFlags() != null) {
                    ac.setFlags(sa.getFlags());
                }
                ac.setCtl(sa.getCtl());
                ac.setRef(sa.getCtl());
                acs.add(ac);
            }
            registry.register(acs);
        }
        int restored = 0;
        if (registry.getCommonRole().equals(s.getCommonRole()) && s.getCredentials() != null) {
            for (SavedCredentials sc : s.getCredentials()) {
                RuntimeException err = sc.getError() == null ? null
                        : new AcctCtlException(ErrorKind.SAVED, sc.getError());
                CredentialSnapshot cr = sc.getSnapshot() != null ? sc.getSnapshot() : CredentialSnapshot.EMPTY;
                registry.credsProvider(sc.getAccountId()).store(cr, err);
                restored++;
            }
        }
        applyMasterCreds();
        initialized = true;
        log.info("Account context restored: accounts={}, credentials={}", registry.accounts().size(), restored);
    }

    /**
     * Returns a serializable copy of the context state. Credentials are saved
     * if they carry an error or remain valid past the configured margin.
     */
    public synchronized SavedSession save() {
        requireInit();
        Instant t = clock.instant().plus(properties.getSession().getSaveMargin());
        List<SavedCredentials> crs = new ArrayList<>();
        for (Map.Entry<String, CredentialsProvider> e : new TreeMap<>(registry.providers()).entrySet()) {
            CredentialSnapshot cr = e.getValue().creds();
            if (cr.getError() == null && (!cr.hasKeys() || !cr.validUntil(t))) {
                continue;
            }
            crs.add(SavedCredentials.builder()
                    .accountId(e.getKey())
                    .snapshot(cr.withError(null))
                    .error(cr.getError() == null ? null : cr.getError().getMessage())
                    .build());
        }
        List<SavedAccount> acs = new ArrayList<>();
        for (Account ac : registry.accounts()) {
            acs.add(SavedAccount.builder()
                    .id(ac.getId())
                    .name(ac.getName())
                    .flags(ac.getFlags())
                    .ctl(ac.getCtl())
                    .build());
        }
        return SavedSession.builder()
                .version(SavedSession.VERSION)
                .identity(proxy.getIdentity())
                .sessionName(proxy.getSessionName())
                .commonRole(registry.getCommonRole())
                .org(orgInfo)
                .credentials(crs)
                .accounts(acs)
                .build();
    }

    /**
     * Updates the list of known accounts from the organization.
     */
    public synchronized List<Account> refresh() {
        requireInit();
        if (!orgInfo.exists()) {
            log.info("No organization, skipping account refresh");
            return registry.accounts();
        }
        return registry.refresh(directory.listAccounts());
    }

    /**
     * Returns all accounts that match {@code spec}. Accounts are refreshed
     * first if none are known, errors of previous operations are cleared and
     * control records are loaded for accounts that were never loaded.
     */
    public List<Account> match(String spec) {
        requireInit();
        if (registry.isEmpty()) {
            refresh();
        }
        AccountSpec s = AccountSpec.parse(spec, owner());
        List<Account> all = ops.loadCtl(ops.clearErr(registry.accounts()), false);
        return s.filter(all);
    }

    /**
     * Owner name written to control records claimed by this gateway: the base
     * name of the common role.
     */
    public String owner() {
        String role = registry.getCommonRole();
        return role.substring(role.lastIndexOf('/') + 1);
    }

    public CallerIdentity getIdentity() {
        return proxy.getIdentity();
    }

    public OrgInfo getOrg() {
        return orgInfo;
    }

    public String getCommonRole() {
        return registry.getCommonRole();
    }

    public AccountRegistry getRegistry() {
        return registry;
    }

    public AccountOps getOps() {
        return ops;
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Releases the organization directory and the IAM clients of all
     * registered accounts.
     */
    @Override
    public synchronized void close() {
        if (directory != null) {
            directory.close();
            directory = null;
        }
        registry.close();
    }

    private void applyCommonRole() {
        String role = properties.getIam().getCommonRole();
        if (role == null || role.isEmpty()) {
            role = properties.getIam().getPath() + proxy.getSessionName();
        }
        registry.setCommonRole(role);
    }

    /**
     * Switches the directory to master-role credentials if the gateway is not
     * the organization master.
     */
    private void applyMasterCreds() {
        String master = orgInfo.getMasterId();
        if (master == null || master.isEmpty() || master.equals(proxy.getIdentity().getAccount())) {
            return;
        }
        AcctCtlProperties.Iam iam = properties.getIam();
        AssumeRoleRequest in = AssumeRoleRequest.builder()
                .externalId(CredentialProxy.externalId(orgInfo, iam.getNamespace()))
                .roleArn(proxy.role(master, iam.qualify(iam.getMasterRole())).toString())
                .roleSessionName(proxy.getSessionName())
                .build();
        AccountDirectory base = directory;
        directory = clients.directory(proxy.provider(in));
        if (base != null) {
            base.close();
        }
        log.info("Using master role for organization access: master={}, role={}", master, in.roleArn());
    }

    private void requireInit() {
        if (!initialized) {
            throw new IllegalStateException("account context not initialized");
        }
    }

    private void requireNotInitialized() {
        if (initialized) {
            throw new IllegalStateException("account context already initialized");
        }
    }
}
