package com.anthem.acctctl.core.creds;

import com.anthem.acctctl.core.exception.AcctCtlException;
import com.anthem.acctctl.core.exception.ErrorKind;
import com.anthem.acctctl.core.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class CredentialsProviderTest {

    private MutableClock clock;
    private AtomicInteger renewals;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        renewals = new AtomicInteger();
    }

    private CredentialsProvider expiringIn(Duration ttl) {
        return CredentialsProvider.renewable(() -> {
            int n = renewals.incrementAndGet();
            return CredentialSnapshot.temporary("AKID" + n, "secret", "token",
                    clock.instant().plus(ttl), "test");
        }, clock);
    }

    @Test
    void creds_shouldReturnEmptySnapshotBeforeFirstRenewal() {
        CredentialsProvider cp = expiringIn(Duration.ofHours(1));

        CredentialSnapshot cr = cp.creds();

        assertFalse(cr.hasKeys());
        assertNull(cr.getError());
        assertEquals(0, renewals.get());
    }

    @Test
    void ensure_shouldRenewOnlyWhenValidityIsInsufficient() {
        // Given: credentials valid for one hour
        CredentialsProvider cp = expiringIn(Duration.ofHours(1));

        // When: ensuring shorter validity twice
        cp.ensure(Duration.ofMinutes(5));
        cp.ensure(Duration.ofMinutes(30));

        // Then: only one renewal happened
        assertEquals(1, renewals.get());
        assertEquals("AKID1", cp.creds().getAccessKeyId());

        // When: time moves close to expiry
        clock.advance(Duration.ofMinutes(50));
        cp.ensure(Duration.ofMinutes(15));

        // Then: credentials were renewed
        assertEquals(2, renewals.get());
        assertEquals("AKID2", cp.creds().getAccessKeyId());
    }

    @Test
    void ensure_shouldForceRenewalForNegativeDuration() {
        CredentialsProvider cp = expiringIn(Duration.ofHours(1));
        cp.ensure(Duration.ZERO);

        cp.ensure(CredentialsProvider.FORCE_RENEWAL);

        assertEquals(2, renewals.get());
    }

    @Test
    void ensure_shouldFailWhenRenewedCredentialsAreTooShortLived() {
        CredentialsProvider cp = expiringIn(Duration.ofMinutes(10));

        assertThatThrownBy(() -> cp.ensure(Duration.ofMinutes(30)))
                .isInstanceOf(AcctCtlException.class)
                .satisfies(e -> assertEquals(ErrorKind.UNABLE, ((AcctCtlException) e).getKind()));

        // Credentials are still cached and usable for shorter periods
        assertTrue(cp.creds().hasKeys());
        cp.ensure(Duration.ofMinutes(5));
        assertEquals(1, renewals.get());
    }

    @Test
    void ensure_shouldBackOffAfterThrottlingError() {
        // Given: upstream always throttles
        AwsServiceException throttled = AwsServiceException.builder()
                .statusCode(429)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("Throttling").build())
                .message("Rate exceeded")
                .build();
        CredentialsProvider cp = CredentialsProvider.renewable(() -> {
            renewals.incrementAndGet();
            throw throttled;
        }, clock);

        // When/Then: first call fails and is cached
        assertThatThrownBy(() -> cp.ensure(Duration.ofMinutes(5))).isSameAs(throttled);
        assertEquals(1, renewals.get());

        // Within the backoff window no new attempt is made
        clock.advance(Duration.ofSeconds(119));
        assertThatThrownBy(() -> cp.ensure(Duration.ofMinutes(5))).isSameAs(throttled);
        assertEquals(1, renewals.get());
        assertSame(throttled, cp.creds().getError());

        // After two minutes the error expires and a retry occurs
        clock.advance(Duration.ofSeconds(1));
        assertNull(cp.creds().getError());
        assertThatThrownBy(() -> cp.ensure(Duration.ofMinutes(5))).isSameAs(throttled);
        assertEquals(2, renewals.get());
    }

    @Test
    void ensure_shouldCacheOtherErrorsForTwoHours() {
        IllegalStateException boom = new IllegalStateException("access denied");
        CredentialsProvider cp = CredentialsProvider.renewable(() -> {
            renewals.incrementAndGet();
            throw boom;
        }, clock);

        assertThrows(IllegalStateException.class, cp::retrieve);
        clock.advance(Duration.ofMinutes(119));
        assertThrows(IllegalStateException.class, cp::retrieve);
        assertEquals(1, renewals.get());

        clock.advance(Duration.ofMinutes(1));
        assertThrows(IllegalStateException.class, cp::retrieve);
        assertEquals(2, renewals.get());
    }

    @Test
    void ensure_shouldTreatPermanentCredentialsAsAlwaysValid() {
        CredentialsProvider cp = CredentialsProvider.ofStatic(
                CredentialSnapshot.permanent("AKIAEXAMPLE", "secret", null), null, clock);

        clock.advance(Duration.ofDays(365));
        cp.ensure(Duration.ofDays(30));

        assertEquals(CredentialsProvider.STATIC_SOURCE, cp.creds().getSource());
        assertTrue(cp.creds().validUntil(clock.instant().plus(Duration.ofDays(3650))));
    }

    @Test
    void ensure_shouldFailWithoutRenewFunctionOrCache() {
        CredentialsProvider cp = CredentialsProvider.renewable(null, clock);

        AcctCtlException e = assertThrows(AcctCtlException.class, () -> cp.ensure(Duration.ZERO));
        assertEquals(ErrorKind.UNABLE, e.getKind());
    }

    @Test
    void store_shouldOverwriteCachedStateIncludingError() {
        CredentialsProvider cp = expiringIn(Duration.ofHours(1));
        cp.ensure(Duration.ZERO);
        RuntimeException saved = new AcctCtlException(ErrorKind.SAVED, "restored");

        cp.store(CredentialSnapshot.EMPTY.withExpiry(clock.instant().plus(Duration.ofMinutes(10))), saved);

        assertSame(saved, cp.creds().getError());
        assertThatThrownBy(cp::retrieve).isSameAs(saved);
        assertEquals(1, renewals.get());
    }

    @Test
    void resolveCredentials_shouldReturnSessionCredentials() {
        CredentialsProvider cp = expiringIn(Duration.ofHours(1));

        AwsCredentials cr = cp.resolveCredentials();

        assertThat(cr).isInstanceOf(AwsSessionCredentials.class);
        assertEquals("AKID1", cr.accessKeyId());
        assertEquals("token", ((AwsSessionCredentials) cr).sessionToken());
    }

    @Test
    void wrap_shouldAdaptSdkProviders() {
        CredentialsProvider cp = CredentialsProvider.wrap(
                StaticCredentialsProvider.create(AwsBasicCredentials.create("AKIAWRAP", "secret")), clock);

        CredentialSnapshot cr = cp.retrieve();

        assertEquals("AKIAWRAP", cr.getAccessKeyId());
        assertFalse(cr.isCanExpire());
        assertSame(cp, CredentialsProvider.wrap(cp, clock));
    }

    @Test
    void ensure_shouldSerializeConcurrentRenewals() throws Exception {
        // Given: a slow upstream
        CountDownLatch inRenew = new CountDownLatch(1);
        CredentialsProvider cp = CredentialsProvider.renewable(() -> {
            renewals.incrementAndGet();
            inRenew.countDown();
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return CredentialSnapshot.temporary("AKID", "secret", "token",
                    clock.instant().plus(Duration.ofHours(1)), "test");
        }, clock);

        // When: many callers ensure at once
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> cp.ensure(Duration.ofMinutes(5))));
            }
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // Then: a single upstream call served everyone
        assertEquals(1, renewals.get());
        assertEquals(0, inRenew.getCount());
    }

    @Test
    void creds_validityShouldBeMonotonicInDuration() {
        Instant exp = clock.instant().plus(Duration.ofMinutes(30));
        CredentialSnapshot cr = CredentialSnapshot.temporary("AKID", "secret", "token", exp, "test");

        for (int m = 0; m <= 60; m += 5) {
            Instant t = clock.instant().plus(Duration.ofMinutes(m));
            if (cr.validUntil(t)) {
                assertTrue(cr.validUntil(t.minus(Duration.ofMinutes(5))));
            }
        }
        assertTrue(cr.validUntil(exp));
        assertFalse(cr.validUntil(exp.plusSeconds(1)));
    }
}
