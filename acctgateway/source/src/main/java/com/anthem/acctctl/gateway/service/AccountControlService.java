package com.anthem.acctctl.gateway.service;

import com.anthem.acctctl.core.AcctCtlProperties;
import com.anthem.acctctl.core.account.Account;
import com.anthem.acctctl.core.account.AccountFlag;
import com.anthem.acctctl.core.account.AccountOps;
import com.anthem.acctctl.core.account.NaturalOrder;
import com.anthem.acctctl.core.bulk.DeadlineRetry;
import com.anthem.acctctl.core.context.AccountContext;
import com.anthem.acctctl.core.creds.CredentialSnapshot;
import com.anthem.acctctl.core.creds.CredentialsProvider;
import com.anthem.acctctl.core.ctl.Ctl;
import com.anthem.acctctl.core.ctl.Tags;
import com.anthem.acctctl.core.exception.AcctCtlException;
import com.anthem.acctctl.core.exception.ErrorKind;
import com.anthem.acctctl.gateway.model.AccountCredentials;
import com.anthem.acctctl.gateway.model.AccountView;
import com.anthem.acctctl.gateway.model.UpdateRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Account operations exposed by the gateway: listing, allocation and release
 * of accounts, control record maintenance and credentials.
 *
 * Ownership claims are confirmed by re-loading the control records after
 * {@code acctctl.alloc.confirm-delay}; conflicts are reported, never retried.
 * Operations hold the session lock, so concurrent requests never modify the
 * same account.
 */
@Slf4j
@Service
public class AccountControlService {

    /** Allocate all matching free accounts. */
    public static final int ALL = -1;

    private static final List<String> DEFAULT_INIT_TAGS = List.of("init");

    private final SessionStateService session;
    private final AcctCtlProperties properties;
    private final Sleeper sleeper;
    private final DeadlineRetry credsReady;
    private final Random random = new Random();

    public AccountControlService(SessionStateService session, AcctCtlProperties properties, Sleeper sleeper) {
        this.session = session;
        this.properties = properties;
        this.sleeper = sleeper;
        this.credsReady = new DeadlineRetry(properties.getCreds().getReadyTimeout(),
                properties.getCreds().getReadyInterval(), sleeper);
    }

    /**
     * Lists accounts that match {@code spec}, optionally refreshing the
     * account list from the organization first.
     */
    public List<AccountView> list(String spec, boolean refresh) {
        return session.exclusive(ctx -> list(ctx, spec, refresh));
    }

    private List<AccountView> list(AccountContext ctx, String spec, boolean refresh) {
        if (refresh) {
            ctx.refresh();
            ctx.getOps().refreshCtl(ctx.getRegistry().accounts());
        }
        List<Account> acs = ctx.getOps().ctlOrErr(ctx.match(spec));
        session.save();
        return AccountView.of(acs);
    }

    /**
     * Claims {@code num} free accounts matching {@code spec} for {@code owner}
     * (the gateway owner if blank). Claims are made in random order and in
     * batches; each batch is confirmed after the propagation delay and lost
     * claims are replaced from the remaining candidates. If there are not
     * enough candidates, every confirmed claim is released again.
     *
     * @throws AcctCtlException of kind ALLOC_FAILED if not enough accounts could be claimed
     */
    public List<AccountView> alloc(int num, String spec, String owner) {
        int max = properties.getAlloc().getMaxAccounts();
        if (num != ALL && (num < 1 || num > max)) {
            throw new IllegalArgumentException("number of accounts must be between 1 and " + max);
        }
        return session.exclusive(ctx -> alloc(ctx, num, spec, owner));
    }

    private List<AccountView> alloc(AccountContext ctx, int num, String spec, String owner) {
        AccountOps ops = ctx.getOps();
        List<Account> acs = new ArrayList<>();
        for (Account ac : ctx.match(spec)) {
            if (ac.getErr() == null && ac.isCtlValid() && !ac.getCtl().isOwned()) {
                acs.add(ac);
            }
        }
        int n = num == ALL ? acs.size() : num;
        Collections.shuffle(acs, random);
        String who = owner == null || owner.isBlank() ? ctx.owner() : owner;
        log.info("Allocating accounts: num={}, candidates={}, owner={}", n, acs.size(), who);

        List<Account> alloc = new ArrayList<>(n);
        int next = 0;
        while (n > 0) {
            int avail = acs.size() - next;
            if (avail < n) {
                for (Account ac : alloc) {
                    ac.setCtl(ac.getCtl().withOwner(""));
                }
                ops.storeCtl(alloc);
                session.save();
                n -= avail;
                log.warn("Allocation failed: owner={}, missing={}, released={}", who, n, alloc.size());
                throw new AcctCtlException(ErrorKind.ALLOC_FAILED,
                        "allocation failed (need " + n + " more account" + (n == 1 ? "" : "s") + ")");
            }
            List<Account> batch = new ArrayList<>(acs.subList(next, next + n));
            next += n;
            for (Account ac : batch) {
                ac.setCtl(ac.getCtl().withOwner(who));
            }
            ops.storeCtl(batch);
            batch.removeIf(ac -> ac.getErr() != null);

            pause(properties.getAlloc().getConfirmDelay());

            ops.refreshCtl(batch);
            batch.removeIf(ac -> ac.getErr() != null || !who.equals(ac.getCtl().getOwner()));
            n -= batch.size();
            alloc.addAll(batch);
        }
        session.save();
        alloc.sort(NaturalOrder.INSTANCE);
        log.info("Allocated accounts: owner={}, count={}", who, alloc.size());
        return AccountView.of(alloc);
    }

    /**
     * Releases accounts owned by the gateway owner, or all matching owned
     * accounts if {@code force} is set.
     */
    public List<AccountView> free(String spec, boolean force) {
        return session.exclusive(ctx -> free(ctx, spec, force));
    }

    private List<AccountView> free(AccountContext ctx, String spec, boolean force) {
        String me = ctx.owner();
        List<Account> acs = new ArrayList<>();
        for (Account ac : ctx.match(spec)) {
            if (ac.getErr() == null && ac.isCtlValid() && (force || me.equals(ac.getCtl().getOwner()))) {
                ac.setCtl(ac.getCtl().withOwner(""));
                acs.add(ac);
            }
        }
        ctx.getOps().storeCtl(acs);
        session.save();
        log.info("Freed accounts: count={}, force={}", acs.size(), force);
        return AccountView.of(acs);
    }

    /**
     * Updates description, owner and tags of managed accounts.
     */
    public List<AccountView> update(String spec, UpdateRequest req) {
        Tags.Diff diff = Tags.parse(req.getTags());
        if (req.getDescription() == null && req.getOwner() == null && diff.isEmpty()) {
            throw new IllegalArgumentException("either description, owner or tags must be specified");
        }
        return session.exclusive(ctx -> update(ctx, spec, req, diff));
    }

    private List<AccountView> update(AccountContext ctx, String spec, UpdateRequest req, Tags.Diff diff) {
        List<Account> mod = new ArrayList<>();
        for (Account ac : ctx.match(spec)) {
            if (ac.getErr() != null || !ac.isCtlValid()) {
                continue;
            }
            Ctl c = ac.getCtl();
            if (req.getDescription() != null) {
                c = c.withDesc(req.getDescription());
            }
            if (req.getOwner() != null) {
                c = c.withOwner(req.getOwner());
            }
            ac.setCtl(c.withTags(Tags.apply(c.getTags(), diff)));
            mod.add(ac);
        }
        ctx.getOps().storeCtl(mod);
        session.save();
        return AccountView.of(mod);
    }

    public List<AccountView> tag(String spec, String tags) {
        return update(spec, UpdateRequest.builder().tags(tags).build());
    }

    /**
     * Places unmanaged accounts under management. Accounts whose credentials
     * are not usable yet are polled until {@code acctctl.creds.ready-timeout}.
     */
    public List<AccountView> initCtl(String spec, String tags) {
        Tags.Diff diff = Tags.parse(tags);
        List<String> initTags = diff.isEmpty() ? DEFAULT_INIT_TAGS : Tags.apply(List.of(), diff);
        return session.exclusive(ctx -> initCtl(ctx, spec, initTags));
    }

    private List<AccountView> initCtl(AccountContext ctx, String spec, List<String> initTags) {
        AccountOps ops = ctx.getOps();
        List<Account> acs = ctx.match(spec);
        ops.ensureCreds(acs, CredentialsProvider.DEFAULT_VALIDITY);
        List<Account> waiting = new ArrayList<>();
        for (Account ac : acs) {
            if (!ac.isCredsValid()) {
                waiting.add(ac);
            }
        }
        ops.map(waiting, this::awaitCreds);

        List<Account> init = new ArrayList<>();
        for (Account ac : acs) {
            if (!ac.isCredsValid()) {
                continue;
            }
            if (ac.isCtlValid()) {
                if (ac.getErr() == null) {
                    ac.setErr(new IllegalStateException("already initialized"));
                }
                continue;
            }
            ac.setCtl(Ctl.EMPTY.withTags(initTags));
            init.add(ac);
        }
        ops.initCtl(init);
        ops.credsOrErr(acs);
        session.save();
        log.info("Initialized account control: requested={}, initialized={}", acs.size(), init.size());
        return AccountView.of(acs);
    }

    /**
     * Deletes control records, returning accounts to the unmanaged state.
     * Accounts owned by someone other than the gateway owner are skipped
     * unless {@code force} is set.
     */
    public List<AccountView> removeCtl(String spec, boolean force) {
        return session.exclusive(ctx -> removeCtl(ctx, spec, force));
    }

    private List<AccountView> removeCtl(AccountContext ctx, String spec, boolean force) {
        AccountOps ops = ctx.getOps();
        String me = ctx.owner();
        List<Account> acs = ops.ctlOrErr(ctx.match(spec));
        List<Account> rm = new ArrayList<>();
        for (Account ac : acs) {
            if (ac.getErr() != null) {
                continue;
            }
            String o = ac.getCtl().getOwner();
            if (force || o.isEmpty() || o.equals(me)) {
                rm.add(ac);
            } else {
                ac.setErr(new AcctCtlException(ErrorKind.CTL_UPDATE, "account is owned by \"" + o + "\""));
            }
        }
        ops.map(rm, ac -> {
            try {
                ops.getStore().delete(ac.getIam());
            } catch (RuntimeException e) {
                return ac.ctlUpdate(e);
            }
            ac.clear(AccountFlag.CTL);
            ac.setCtl(Ctl.EMPTY);
            ac.setRef(Ctl.EMPTY);
            log.info("Removed account control: account={}", ac.getId());
            return null;
        });
        session.save();
        return AccountView.of(acs);
    }

    /**
     * Returns credentials valid for at least {@code validity}, renewing all of
     * them if {@code renew} is set.
     */
    public List<AccountCredentials> creds(String spec, Duration validity, boolean renew) {
        return session.exclusive(ctx -> creds(ctx, spec, validity, renew));
    }

    private List<AccountCredentials> creds(AccountContext ctx, String spec, Duration validity, boolean renew) {
        AccountOps ops = ctx.getOps();
        List<Account> acs = ctx.match(spec);
        ops.credsOrErr(ops.ensureCreds(acs, renew ? CredentialsProvider.FORCE_RENEWAL : validity));
        session.save();
        List<AccountCredentials> out = new ArrayList<>(acs.size());
        for (Account ac : acs) {
            AccountCredentials.AccountCredentialsBuilder b = AccountCredentials.builder()
                    .accountId(ac.getId())
                    .name(ac.getName());
            if (ac.getErr() != null) {
                b.error(ac.getErr().getMessage());
            } else {
                CredentialSnapshot cr = ac.getCredsProvider().creds();
                b.accessKeyId(cr.getAccessKeyId())
                        .secretAccessKey(cr.getSecretAccessKey())
                        .sessionToken(cr.getSessionToken())
                        .expires(cr.isCanExpire() ? cr.getExpires() : null);
            }
            out.add(b.build());
        }
        return out;
    }

    private RuntimeException awaitCreds(Account ac) {
        try {
            credsReady.call(() -> {
                ac.getCredsProvider().ensure(CredentialsProvider.FORCE_RENEWAL);
                return null;
            });
        } catch (RuntimeException e) {
            log.warn("Account credentials not ready: account={}, error={}", ac.getId(), e.getMessage());
            return e;
        }
        ac.set(AccountFlag.CREDS);
        ac.setErr(null);
        return null;
    }

    private void pause(Duration d) {
        if (d.isZero() || d.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while confirming account ownership", e);
        }
    }
}
