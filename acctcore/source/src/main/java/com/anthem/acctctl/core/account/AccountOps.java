package com.anthem.acctctl.core.account;

import com.anthem.acctctl.core.bulk.BulkRunner;
import com.anthem.acctctl.core.bulk.Outcome;
import com.anthem.acctctl.core.creds.CredentialSnapshot;
import com.anthem.acctctl.core.ctl.Ctl;
import com.anthem.acctctl.core.ctl.CtlRoleStore;
import com.anthem.acctctl.core.exception.AcctCtlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Bulk operations over groups of accounts. Each operation runs one task per
 * account on the {@link BulkRunner}; failures are stored in the account's
 * {@code err} field and never abort the rest of the group. All operations
 * return their input for chaining.
 */
public class AccountOps {

    private static final Logger log = LoggerFactory.getLogger(AccountOps.class);

    private final BulkRunner runner;
    private final CtlRoleStore store;
    private final Clock clock;

    public AccountOps(BulkRunner runner, CtlRoleStore store, Clock clock) {
        this.runner = runner;
        this.store = store;
        this.clock = clock;
    }

    public CtlRoleStore getStore() {
        return store;
    }

    /**
     * Runs {@code fn} for every account concurrently. A returned or thrown
     * error is stored in the account.
     */
    public List<Account> map(List<Account> acs, Function<Account, RuntimeException> fn) {
        if (acs.isEmpty()) {
            return acs;
        }
        List<Outcome<RuntimeException>> out = runner.map(acs, fn);
        for (int i = 0; i < acs.size(); i++) {
            Outcome<RuntimeException> o = out.get(i);
            RuntimeException e = o.isSuccess() ? o.getValue() : o.getError();
            if (e != null) {
                acs.get(i).setErr(e);
            }
        }
        return acs;
    }

    /**
     * Ensures that credentials of all accounts remain valid for {@code d},
     * renewing them if necessary. Negative {@code d} forces renewal.
     */
    public List<Account> ensureCreds(List<Account> acs, Duration d) {
        List<Account> ensure;
        if (!d.isNegative()) {
            Instant t = clock.instant().plus(d);
            ensure = new ArrayList<>();
            for (Account ac : acs) {
                CredentialSnapshot cr = ac.getCredsProvider().creds();
                if (cr.getError() != null) {
                    ac.clear(AccountFlag.CREDS);
                    ac.setErr(cr.getError());
                } else if (cr.validUntil(t)) {
                    ac.set(AccountFlag.CREDS);
                } else {
                    ensure.add(ac);
                }
            }
        } else {
            ensure = acs;
        }
        map(ensure, ac -> {
            try {
                ac.getCredsProvider().ensure(d);
                ac.set(AccountFlag.CREDS);
                return null;
            } catch (RuntimeException e) {
                ac.clear(AccountFlag.CREDS);
                return e;
            }
        });
        return acs;
    }

    /**
     * Creates control records in accounts that do not have a valid one.
     */
    public List<Account> initCtl(List<Account> acs) {
        return map(acs, ac -> {
            if (!ac.isCtlValid()) {
                RuntimeException e = ac.ctlUpdate(call(() -> store.init(ac.getIam(), ac.getCtl())));
                // Always assigned so a previous NO_CTL error is cleared
                ac.setErr(e);
                if (e == null) {
                    ac.setRef(ac.getCtl());
                    log.info("Initialized account control: account={}", ac.getId());
                }
            }
            return null;
        });
    }

    /**
     * Loads control records for accounts that were never loaded, or for all
     * accounts if {@code reload} is true. On failure the cached copy is reset.
     */
    public List<Account> loadCtl(List<Account> acs, boolean reload) {
        List<Account> load = acs;
        if (!reload) {
            load = new ArrayList<>();
            for (Account ac : acs) {
                if (!ac.test(AccountFlag.LOADED)) {
                    load.add(ac);
                }
            }
        }
        map(load, ac -> {
            Ctl ref = Ctl.EMPTY;
            RuntimeException e;
            try {
                ref = store.load(ac.getIam());
                e = null;
            } catch (RuntimeException ex) {
                e = ex;
            }
            ac.setRef(ref);
            ac.setCtl(ref);
            return ac.ctlUpdate(e);
        });
        return acs;
    }

    public List<Account> refreshCtl(List<Account> acs) {
        return loadCtl(acs, true);
    }

    /**
     * Stores modified control records. The current remote state is read first
     * and local changes are merged into it. Changing the owner requires the
     * remote owner to equal either the new owner or the reference owner. When
     * setting an owner, callers must reload after a delay to confirm it.
     */
    public List<Account> storeCtl(List<Account> acs) {
        return map(acs, ac -> {
            if (!ac.isCtlValid()) {
                return ac.getErr() == null ? AcctCtlException.noCtl() : null;
            }
            Ctl cur;
            try {
                cur = store.load(ac.getIam());
            } catch (RuntimeException e) {
                return ac.ctlUpdate(e);
            }
            ac.ctlUpdate(null);
            Ctl merged = ac.getCtl().merge(cur, ac.getRef());
            ac.setCtl(merged);
            if (merged.equals(cur)) {
                ac.setRef(cur);
                return null;
            }
            if (!cur.getOwner().equals(merged.getOwner()) && !cur.getOwner().equals(ac.getRef().getOwner())) {
                log.warn("Account owner changed concurrently: account={}, expected={}, found={}",
                        ac.getId(), ac.getRef().getOwner(), cur.getOwner());
                ac.setRef(cur);
                return AcctCtlException.ctlUpdate();
            }
            RuntimeException e = ac.ctlUpdate(call(() -> store.store(ac.getIam(), merged)));
            if (e == null) {
                ac.setRef(merged);
            }
            return e;
        });
    }

    public List<Account> clearErr(List<Account> acs) {
        for (Account ac : acs) {
            ac.setErr(null);
        }
        return acs;
    }

    /**
     * Sets NO_ACCESS on accounts without valid credentials or an existing error.
     */
    public List<Account> credsOrErr(List<Account> acs) {
        for (Account ac : acs) {
            if (!ac.isCredsValid() && ac.getErr() == null) {
                ac.setErr(AcctCtlException.noAccess());
            }
        }
        return acs;
    }

    /**
     * Sets NO_ACCESS or NO_CTL on accounts without a valid control record or
     * an existing error.
     */
    public List<Account> ctlOrErr(List<Account> acs) {
        for (Account ac : acs) {
            if (!ac.isCtlValid() && ac.getErr() == null) {
                ac.setErr(ac.isCredsValid() ? AcctCtlException.noCtl() : AcctCtlException.noAccess());
            }
        }
        return acs;
    }

    private static RuntimeException call(Runnable r) {
        try {
            r.run();
            return null;
        } catch (RuntimeException e) {
            return e;
        }
    }
}
