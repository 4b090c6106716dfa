package com.anthem.acctctl.core.creds;

import com.anthem.acctctl.core.exception.AcctCtlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkServiceException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caching credentials provider that lets clients ensure credential validity for
 * a period of time in the future.
 *
 * Readers see an immutable {@link CredentialSnapshot}; renewals are serialized
 * by a single lock and re-check the cache after acquiring it, so concurrent
 * callers that observe an expired snapshot trigger only one upstream call.
 * Renewal errors are cached to avoid hammering a failing upstream.
 */
public class CredentialsProvider implements AwsCredentialsProvider {

    private static final Logger log = LoggerFactory.getLogger(CredentialsProvider.class);

    public static final String PROXY_SOURCE = "ProxyCredentialsProvider";
    public static final String STATIC_SOURCE = "StaticCredentialsProvider";

    /** Negative validity that forces unconditional renewal. */
    public static final Duration FORCE_RENEWAL = Duration.ofSeconds(-1);

    /** Validity required by {@link #retrieve()}. */
    public static final Duration DEFAULT_VALIDITY = Duration.ofMinutes(1);

    /** How long a throttling error is cached. */
    static final Duration THROTTLE_ERROR_TTL = Duration.ofMinutes(2);

    /** How long any other error without its own expiry is cached. */
    static final Duration ERROR_TTL = Duration.ofHours(2);

    private final AtomicReference<CredentialSnapshot> cached = new AtomicReference<>();
    private final ReentrantLock renewLock = new ReentrantLock();
    private final RenewFunction renew;
    private final Clock clock;

    private CredentialsProvider(RenewFunction renew, Clock clock) {
        this.renew = renew;
        this.clock = clock;
    }

    /**
     * Provider that renews its credentials through {@code fn} as they expire.
     */
    public static CredentialsProvider renewable(RenewFunction fn, Clock clock) {
        return new CredentialsProvider(fn, clock);
    }

    /**
     * Provider that always returns the same credentials and/or error.
     */
    public static CredentialsProvider ofStatic(CredentialSnapshot cr, RuntimeException err, Clock clock) {
        if (cr.getSource() == null || cr.getSource().isEmpty()) {
            cr = cr.withSource(STATIC_SOURCE);
        }
        CredentialsProvider p = new CredentialsProvider(null, clock);
        p.store(cr, err);
        return p;
    }

    /**
     * Adapts any SDK credentials provider. Providers of this type are returned
     * unchanged.
     */
    public static CredentialsProvider wrap(AwsCredentialsProvider cp, Clock clock) {
        if (cp instanceof CredentialsProvider) {
            return (CredentialsProvider) cp;
        }
        String source = cp.getClass().getSimpleName();
        return renewable(() -> CredentialSnapshot.fromAws(cp.resolveCredentials(), source), clock);
    }

    @Override
    public AwsCredentials resolveCredentials() {
        CredentialSnapshot cr = retrieve();
        if (!cr.hasKeys()) {
            throw AcctCtlException.unable();
        }
        return cr.toAwsCredentials();
    }

    /**
     * Same as {@code ensure(1 minute)}, returning the credentials.
     */
    public CredentialSnapshot retrieve() {
        return ensureValid(DEFAULT_VALIDITY);
    }

    /**
     * Returns the cached snapshot without renewal. An error whose backoff has
     * elapsed is no longer reported.
     */
    public CredentialSnapshot creds() {
        CredentialSnapshot cr = cached.get();
        if (cr == null) {
            return CredentialSnapshot.EMPTY;
        }
        if (cr.getError() != null && cr.isCanExpire()
                && !cr.getExpires().isAfter(clock.instant())) {
            return cr.withError(null);
        }
        return cr;
    }

    /**
     * Replaces any cached credentials and error.
     */
    public void store(CredentialSnapshot cr, RuntimeException err) {
        cached.set(cr.withError(err));
    }

    /**
     * Ensures that credentials remain valid for {@code d}, renewing them if
     * necessary. A negative duration forces unconditional renewal.
     *
     * @throws AcctCtlException of kind UNABLE if the validity period cannot be satisfied
     */
    public void ensure(Duration d) {
        ensureValid(d);
    }

    private CredentialSnapshot ensureValid(Duration d) {
        CredentialSnapshot cr = cached.get();
        if (keepCurrent(cr, d)) {
            return result(cr);
        }
        if (renew != null) {
            renewLock.lock();
            try {
                cr = cached.get();
                if (keepCurrent(cr, d)) {
                    return result(cr);
                }
                cr = renewNow();
                cached.set(cr);
            } finally {
                renewLock.unlock();
            }
        } else if (cr == null) {
            throw AcctCtlException.unable();
        }
        if (d.isNegative()) {
            d = Duration.ZERO;
        }
        if (keepCurrent(cr, d) || cr.getError() != null) {
            return result(cr);
        }
        throw AcctCtlException.unable();
    }

    private CredentialSnapshot renewNow() {
        CredentialSnapshot cr;
        try {
            cr = renew.renew();
            if (cr == null) {
                cr = CredentialSnapshot.EMPTY;
            }
        } catch (RuntimeException e) {
            cr = CredentialSnapshot.failed(e);
        }
        RuntimeException err = cr.getError();
        if (err != null && !cr.isCanExpire()) {
            Duration ttl = isThrottle(err) ? THROTTLE_ERROR_TTL : ERROR_TTL;
            cr = cr.withExpiry(clock.instant().plus(ttl));
            log.warn("Credential renewal failed, retry after {}: {}", ttl, err.getMessage());
        }
        return cr;
    }

    private boolean keepCurrent(CredentialSnapshot cr, Duration d) {
        if (cr == null || d.isNegative()) {
            return false;
        }
        if (!cr.isCanExpire()) {
            return true;
        }
        Instant now = clock.instant();
        Instant exp = cr.getExpires();
        return exp != null && (exp.isAfter(now.plus(d)) || (cr.getError() != null && exp.isAfter(now)));
    }

    private static CredentialSnapshot result(CredentialSnapshot cr) {
        if (cr.getError() != null) {
            throw cr.getError();
        }
        return cr;
    }

    static boolean isThrottle(Throwable err) {
        return err instanceof SdkServiceException && ((SdkServiceException) err).isThrottlingException();
    }
}
