package com.anthem.acctctl.core.bulk;

import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.TimeoutRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry loop for narrow waits, such as credentials of a new account
 * becoming usable. Retries any runtime failure at a fixed interval until the
 * deadline passes, then rethrows the last failure.
 */
public final class DeadlineRetry {

    private final RetryTemplate template;

    public DeadlineRetry(Duration timeout, Duration interval, Sleeper sleeper) {
        TimeoutRetryPolicy policy = new TimeoutRetryPolicy();
        policy.setTimeout(timeout.toMillis());
        FixedBackOffPolicy backOff = new FixedBackOffPolicy();
        backOff.setBackOffPeriod(interval.toMillis());
        backOff.setSleeper(sleeper);
        this.template = new RetryTemplate();
        template.setRetryPolicy(policy);
        template.setBackOffPolicy(backOff);
    }

    public <T> T call(Supplier<T> fn) {
        return template.execute(ctx -> fn.get());
    }
}
