package com.anthem.acctctl.core.bulk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs one task per item on a bounded worker pool and collects an
 * {@link Outcome} per item. A failing item never affects its siblings.
 *
 * Tasks must not submit nested bulk operations to the same runner.
 */
public class BulkRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BulkRunner.class);

    private final ExecutorService executor;

    public BulkRunner(int workers) {
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, workers), r -> {
            Thread t = new Thread(r, "acctctl-bulk-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Applies {@code fn} to every item concurrently. Outcomes are returned in
     * input order.
     */
    public <T, R> List<Outcome<R>> map(List<T> items, Function<? super T, ? extends R> fn) {
        List<Future<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(executor.submit(() -> fn.apply(item)));
        }
        List<Outcome<R>> out = new ArrayList<>(items.size());
        for (Future<R> f : futures) {
            out.add(await(f));
        }
        return out;
    }

    private static <R> Outcome<R> await(Future<R> f) {
        try {
            return Outcome.success(f.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                return Outcome.failure((RuntimeException) cause);
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            return Outcome.failure(new IllegalStateException(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            return Outcome.failure(new IllegalStateException("bulk operation interrupted", e));
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        log.debug("Bulk runner stopped");
    }
}
