package com.anthem.acctctl.gateway.service;

import com.anthem.acctctl.core.AcctCtlProperties;
import com.anthem.acctctl.core.account.Account;
import com.anthem.acctctl.core.context.AccountContext;
import com.anthem.acctctl.core.ctl.Ctl;
import com.anthem.acctctl.core.ctl.CtlRoleStore;
import com.anthem.acctctl.core.exception.AcctCtlException;
import com.anthem.acctctl.core.exception.ErrorKind;
import com.anthem.acctctl.gateway.model.MutexTestReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.iam.IamClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Measures how often the optimistic ownership protocol produces a false
 * claim. In each test all workers race to claim one free account; the single
 * apparent winner is re-checked after the confirm delay. A test fails if
 * there is not exactly one apparent winner or if the final owner differs.
 */
@Slf4j
@Service
public class MutexTestService {

    static final String STEP_GET = "get";
    static final String STEP_SET = "set";
    static final String STEP_VERIFY = "verify";

    private final SessionStateService session;
    private final AcctCtlProperties properties;
    private final Sleeper sleeper;

    public MutexTestService(SessionStateService session, AcctCtlProperties properties, Sleeper sleeper) {
        this.session = session;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    /**
     * Runs the configured number of tests against the single free account
     * selected by {@code spec}.
     */
    public MutexTestReport run(String spec, int workers, int tests, Duration verifyDelay) {
        if (workers < 1) {
            throw new IllegalArgumentException("number of workers must be > 0");
        }
        if (tests < 1) {
            throw new IllegalArgumentException("number of tests must be > 0");
        }
        return session.exclusive(ctx -> run(ctx, spec, workers, tests, verifyDelay));
    }

    private MutexTestReport run(AccountContext ctx, String spec, int workers, int tests, Duration verifyDelay) {
        List<Account> acs = ctx.match(spec);
        if (acs.size() != 1) {
            throw new AcctCtlException(ErrorKind.INVALID_SPEC,
                    "account spec must match exactly one account (matched " + acs.size() + ")");
        }
        Account ac = acs.get(0);
        CtlRoleStore store = ctx.getOps().getStore();
        IamClient iam = ac.getIam();
        Ctl initial = store.load(iam);
        if (initial.isOwned()) {
            throw new AcctCtlException(ErrorKind.CTL_UPDATE,
                    "account is currently owned by \"" + initial.getOwner() + "\"");
        }
        log.info("Mutex test started: account={}, workers={}, tests={}, verifyDelay={}",
                ac.getId(), workers, tests, verifyDelay);

        MutexTestReport.Summary summary = MutexTestReport.Summary.builder()
                .workers(workers)
                .delay(verifyDelay)
                .build();
        List<MutexTestReport.TestResult> results = new ArrayList<>(tests);
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            for (int num = 1; num <= tests; num++) {
                MutexTestReport.TestResult t = runOne(num, pool, store, iam, workers, verifyDelay);
                store.store(iam, initial);
                summary.setTests(summary.getTests() + 1);
                if (!t.isPass()) {
                    summary.setFailures(summary.getFailures() + 1);
                }
                results.add(t);
                pause(verifyDelay);
            }
        } finally {
            pool.shutdownNow();
        }
        log.info("Mutex test finished: account={}, tests={}, failures={}",
                ac.getId(), summary.getTests(), summary.getFailures());
        return MutexTestReport.builder().summary(summary).results(results).build();
    }

    private MutexTestReport.TestResult runOne(int num, ExecutorService pool, CtlRoleStore store, IamClient iam,
                                              int workers, Duration verifyDelay) {
        MutexTestReport.TestResult t = MutexTestReport.TestResult.builder()
                .num(num)
                .verifyDelay(verifyDelay)
                .build();
        CountDownLatch start = new CountDownLatch(1);
        List<Future<WorkerResult>> futures = new ArrayList<>(workers);
        for (int i = 1; i <= workers; i++) {
            String name = String.format("W%03d", i);
            futures.add(pool.submit(() -> {
                start.await();
                return claim(name, store, iam, verifyDelay);
            }));
        }
        start.countDown();

        List<WorkerResult> owners = new ArrayList<>();
        for (Future<WorkerResult> f : futures) {
            WorkerResult r = await(f);
            if (!STEP_GET.equals(r.step)) {
                t.setSetters(t.getSetters() + 1);
            }
            if (r.error != null) {
                t.setErrors(t.getErrors() + 1);
                log.debug("Mutex worker error: worker={}, step={}, error={}", r.name, r.step, r.error.getMessage());
            } else if (r.name.equals(r.owner)) {
                t.setOwners(t.getOwners() + 1);
                owners.add(r);
            } else {
                t.setMisses(t.getMisses() + 1);
            }
        }

        if (owners.size() == 1) {
            t.setAssumedOwner(owners.get(0).name);
            pause(properties.getAlloc().getConfirmDelay());
            t.setFinalOwner(store.load(iam).getOwner());
            t.setPass(t.getAssumedOwner().equals(t.getFinalOwner()));
        }
        log.info("Mutex test result: num={}, owners={}, assumedOwner={}, finalOwner={}, pass={}",
                num, t.getOwners(), t.getAssumedOwner(), t.getFinalOwner(), t.isPass());
        return t;
    }

    private WorkerResult claim(String name, CtlRoleStore store, IamClient iam, Duration verifyDelay) {
        WorkerResult r = new WorkerResult(name);
        try {
            r.step = STEP_GET;
            Ctl c = store.load(iam);
            r.owner = c.getOwner();
            if (c.isOwned()) {
                return r;
            }
            r.step = STEP_SET;
            store.store(iam, c.withOwner(name));
            r.step = STEP_VERIFY;
            pause(verifyDelay);
            r.owner = store.load(iam).getOwner();
        } catch (RuntimeException e) {
            r.error = e;
        }
        return r;
    }

    private static WorkerResult await(Future<WorkerResult> f) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("mutex test interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("mutex test worker failed", e.getCause());
        }
    }

    private void pause(Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("mutex test interrupted", e);
        }
    }

    private static final class WorkerResult {
        private final String name;
        private String step;
        private String owner;
        private RuntimeException error;

        private WorkerResult(String name) {
            this.name = name;
        }
    }
}
