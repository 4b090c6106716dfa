package com.anthem.acctctl.core.account;

import com.anthem.acctctl.core.AwsClientFactory;
import com.anthem.acctctl.core.creds.Arn;
import com.anthem.acctctl.core.creds.CredentialProxy;
import com.anthem.acctctl.core.creds.CredentialsProvider;
import com.anthem.acctctl.core.org.AccountInfo;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.iam.IamClient;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Set of known accounts with their credentials providers and IAM clients.
 * Providers are cached per account ID and survive de-registration, so
 * re-registering an account reuses its credentials. IAM clients are owned by
 * the registry and closed when their account is replaced or removed.
 */
@Slf4j
public class AccountRegistry implements AutoCloseable {

    private final Map<String, Account> accounts = new HashMap<>();
    private final Map<String, CredentialsProvider> providers = new HashMap<>();
    private final CredentialProxy proxy;
    private final CredentialsProvider baseCreds;
    private final AwsClientFactory clients;
    private final Clock clock;
    private String commonRole = "";
    private Duration sessionDuration = Duration.ZERO;

    public AccountRegistry(CredentialProxy proxy, CredentialsProvider baseCreds,
                           AwsClientFactory clients, Clock clock) {
        this.proxy = proxy;
        this.baseCreds = baseCreds;
        this.clients = clients;
        this.clock = clock;
    }

    public String getCommonRole() {
        return commonRole;
    }

    /**
     * Sets the role assumed in every account. Cached providers are dropped
     * when the role changes.
     */
    public synchronized void setCommonRole(String role) {
        if (!role.equals(commonRole)) {
            providers.clear();
            commonRole = role;
        }
    }

    public void setSessionDuration(Duration d) {
        this.sessionDuration = d == null ? Duration.ZERO : d;
    }

    /**
     * Adds accounts and configures their credentials and IAM clients. An
     * existing account with the same ID is replaced.
     */
    public synchronized List<Account> register(Collection<Account> acs) {
        List<Account> out = new ArrayList<>(acs.size());
        for (Account ac : acs) {
            CredentialsProvider cp = credsProvider(ac.getId());
            Account prev = accounts.get(ac.getId());
            if (prev != null && prev != ac) {
                closeIam(prev);
            }
            closeIam(ac);
            ac.setCredsProvider(cp);
            ac.setIam(clients.iam(cp));
            accounts.put(ac.getId(), ac);
            out.add(ac);
        }
        return out;
    }

    public synchronized Account deregister(String id) {
        Account ac = accounts.remove(id);
        if (ac != null) {
            closeIam(ac);
        }
        return ac;
    }

    public synchronized Account get(String id) {
        return accounts.get(id);
    }

    public synchronized boolean isEmpty() {
        return accounts.isEmpty();
    }

    /**
     * Returns all registered accounts in natural name order.
     */
    public synchronized List<Account> accounts() {
        List<Account> out = new ArrayList<>(accounts.values());
        out.sort(NaturalOrder.INSTANCE);
        return out;
    }

    /**
     * Updates names of known accounts and registers new ones. All accounts
     * in {@code infos} are marked as organization members.
     */
    public synchronized List<Account> refresh(List<AccountInfo> infos) {
        List<Account> added = new ArrayList<>();
        for (AccountInfo info : infos) {
            Account ac = accounts.get(info.getId());
            if (ac == null) {
                ac = new Account(info.getId(), info.getName());
                added.add(ac);
            } else {
                ac.setName(info.getName());
            }
            ac.set(AccountFlag.ORG);
        }
        register(added);
        log.debug("Registry refreshed: known={}, added={}", accounts.size(), added.size());
        return accounts();
    }

    /**
     * Returns the credentials provider for {@code accountId}, creating it on
     * first use. For the gateway's own account the common role is tried first,
     * falling back to the base credentials if it cannot be assumed.
     */
    public synchronized CredentialsProvider credsProvider(String accountId) {
        CredentialsProvider cp = providers.get(accountId);
        if (cp != null) {
            return cp;
        }
        Arn role = proxy.role(accountId, commonRole);
        cp = proxy.assumeRole(role, sessionDuration);
        if (accountId.equals(proxy.getIdentity().getAccount())) {
            cp = gatewayProvider(cp);
        }
        providers.put(accountId, cp);
        return cp;
    }

    public synchronized Map<String, CredentialsProvider> providers() {
        return new HashMap<>(providers);
    }

    /**
     * Closes the IAM clients of all registered accounts and removes them.
     */
    @Override
    public synchronized void close() {
        for (Account ac : accounts.values()) {
            closeIam(ac);
        }
        accounts.clear();
    }

    private static void closeIam(Account ac) {
        IamClient iam = ac.getIam();
        if (iam != null) {
            ac.setIam(null);
            iam.close();
        }
    }

    private CredentialsProvider gatewayProvider(CredentialsProvider commonRoleCreds) {
        AtomicReference<CredentialsProvider> src = new AtomicReference<>();
        return CredentialsProvider.renewable(() -> {
            CredentialsProvider s = src.get();
            if (s == null) {
                try {
                    commonRoleCreds.ensure(CredentialsProvider.FORCE_RENEWAL);
                    src.set(commonRoleCreds);
                    return commonRoleCreds.creds();
                } catch (RuntimeException e) {
                    log.info("Common role unavailable in gateway account, using base credentials: error={}",
                            e.getMessage());
                    s = baseCreds;
                    src.set(s);
                }
            }
            s.ensure(CredentialsProvider.FORCE_RENEWAL);
            return s.creds();
        }, clock);
    }
}
