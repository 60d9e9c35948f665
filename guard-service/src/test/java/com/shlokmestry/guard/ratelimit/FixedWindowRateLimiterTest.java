package com.shlokmestry.guard.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.shlokmestry.guard.config.AppProps;
import com.shlokmestry.guard.config.FailurePolicy;
import com.shlokmestry.guard.config.RateLimitProps;
import com.shlokmestry.guard.observability.RateLimitMetrics;
import com.shlokmestry.guard.ratelimit.storage.LocalCounterStore;
import com.shlokmestry.guard.ratelimit.storage.RateLimitEntry;
import com.shlokmestry.guard.ratelimit.storage.RateLimitStorage;
import com.shlokmestry.guard.ratelimit.storage.StorageException;
import com.shlokmestry.guard.testutil.MutableClock;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class FixedWindowRateLimiterTest {

    private static final long WINDOW_MS = 60_000;
    // 40s into a minute window
    private static final long START = 1_700_000_080_000L;

    private final MutableClock clock = new MutableClock(START);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final LocalCounterStore local = new LocalCounterStore(clock);

    @AfterEach
    void tearDown() {
        local.close();
    }

    private FixedWindowRateLimiter limiter(RateLimitStorage storage, String mode, FailurePolicy policy) {
        RateLimitProps props = new RateLimitProps(null, policy, null, null);
        return new FixedWindowRateLimiter(storage, props, new AppProps(mode), clock, new RateLimitMetrics(registry));
    }

    private FixedWindowRateLimiter localLimiter() {
        return limiter(local, "development", FailurePolicy.AUTO);
    }

    @Nested
    @DisplayName("check")
    class Check {

        @Test
        void allowsUpToLimit_thenLimits() {
            FixedWindowRateLimiter limiter = localLimiter();

            assertThat(limiter.check("alice", 3, WINDOW_MS).remaining()).isEqualTo(2);
            assertThat(limiter.check("alice", 3, WINDOW_MS).remaining()).isEqualTo(1);
            RateLimitResult third = limiter.check("alice", 3, WINDOW_MS);
            assertThat(third.limited()).isFalse();
            assertThat(third.remaining()).isZero();

            RateLimitResult fourth = limiter.check("alice", 3, WINDOW_MS);
            assertThat(fourth.limited()).isTrue();
            assertThat(fourth.remaining()).isZero();
            assertThat(fourth.resetTime()).isEqualTo(1_700_000_100_000L);
            assertThat(fourth.retryAfterSeconds()).isEqualTo(20);
        }

        @Test
        void resetTime_isEndOfAlignedWindow() {
            RateLimitResult r = localLimiter().check("alice", 10, WINDOW_MS);

            assertThat(r.resetTime() % WINDOW_MS).isZero();
            assertThat(r.resetTime()).isGreaterThan(START).isLessThanOrEqualTo(START + WINDOW_MS);
            assertThat(r.retryAfterSeconds()).isZero();
        }

        @Test
        void newWindow_startsFresh() {
            FixedWindowRateLimiter limiter = localLimiter();
            for (int i = 0; i < 4; i++) {
                limiter.check("alice", 3, WINDOW_MS);
            }

            clock.advance(Duration.ofSeconds(20));

            RateLimitResult r = limiter.check("alice", 3, WINDOW_MS);
            assertThat(r.limited()).isFalse();
            assertThat(r.remaining()).isEqualTo(2);
        }

        @Test
        void identifiersAreIsolated() {
            FixedWindowRateLimiter limiter = localLimiter();
            for (int i = 0; i < 5; i++) {
                limiter.check("alice", 3, WINDOW_MS);
            }

            assertThat(limiter.check("bob", 3, WINDOW_MS).remaining()).isEqualTo(2);
        }

        @Test
        void zeroLimit_limitsFirstRequest() {
            RateLimitResult r = localLimiter().check("alice", 0, WINDOW_MS);

            assertThat(r.limited()).isTrue();
            assertThat(r.retryAfterSeconds()).isGreaterThanOrEqualTo(1);
        }

        @Test
        void retryAfter_isAtLeastOneSecond() {
            clock.set(1_700_000_099_900L);
            FixedWindowRateLimiter limiter = localLimiter();
            limiter.check("alice", 1, WINDOW_MS);

            assertThat(limiter.check("alice", 1, WINDOW_MS).retryAfterSeconds()).isEqualTo(1);
        }

        @Test
        void rejectsInvalidArguments() {
            FixedWindowRateLimiter limiter = localLimiter();

            assertThatThrownBy(() -> limiter.check("alice", -1, WINDOW_MS)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> limiter.check("alice", 1, 0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("storage failure")
    class StorageFailure {

        private final RateLimitStorage broken = new RateLimitStorage() {
            @Override
            public Optional<RateLimitEntry> get(String key) {
                throw new StorageException("down");
            }

            @Override
            public void set(String key, RateLimitEntry entry, long ttlMs) {
                throw new StorageException("down");
            }

            @Override
            public long increment(String key, long ttlMs) {
                throw new StorageException("down");
            }

            @Override
            public String type() {
                return "remote";
            }
        };

        @Test
        void production_failsClosed() {
            RateLimitResult r = limiter(broken, "production", FailurePolicy.AUTO).check("alice", 100, WINDOW_MS);

            assertThat(r.limited()).isTrue();
            assertThat(r.remaining()).isZero();
            assertThat(r.retryAfterSeconds()).isEqualTo(60);
            assertThat(registry.get("ratelimit.storage_failures.total")
                    .tag("operation", "check").tag("outcome", "fail_closed").counter().count()).isEqualTo(1.0);
        }

        @Test
        void development_failsOpen() {
            RateLimitResult r = limiter(broken, "development", FailurePolicy.AUTO).check("alice", 100, WINDOW_MS);

            assertThat(r.limited()).isFalse();
            assertThat(r.remaining()).isEqualTo(99);
            assertThat(r.retryAfterSeconds()).isZero();
        }

        @Test
        void explicitPolicy_overridesMode() {
            assertThat(limiter(broken, "development", FailurePolicy.FAIL_CLOSED).check("a", 5, WINDOW_MS).limited())
                    .isTrue();
            assertThat(limiter(broken, "production", FailurePolicy.FAIL_OPEN).check("a", 5, WINDOW_MS).limited())
                    .isFalse();
        }

        @Test
        void status_followsTheSamePolicy() {
            RateLimitResult open = limiter(broken, "test", FailurePolicy.AUTO).status("alice", 100, WINDOW_MS);
            RateLimitResult closed = limiter(broken, "prod", FailurePolicy.AUTO).status("alice", 100, WINDOW_MS);

            assertThat(open.limited()).isFalse();
            assertThat(open.remaining()).isEqualTo(100);
            assertThat(closed.limited()).isTrue();
        }

        @Test
        void clear_swallowsFailure() {
            LocalCounterStore failingClear = new LocalCounterStore(clock) {
                @Override
                public int clearMatching(Predicate<String> keyFilter) {
                    throw new StorageException("down");
                }
            };
            try {
                assertThat(limiter(failingClear, "development", FailurePolicy.AUTO).clear("alice")).isZero();
            } finally {
                failingClear.close();
            }
        }
    }

    @Nested
    @DisplayName("status and clear")
    class StatusAndClear {

        @Test
        void status_doesNotConsumeQuota() {
            FixedWindowRateLimiter limiter = localLimiter();
            limiter.check("alice", 3, WINDOW_MS);

            RateLimitResult first = limiter.status("alice", 3, WINDOW_MS);
            RateLimitResult second = limiter.status("alice", 3, WINDOW_MS);

            assertThat(first).isEqualTo(second);
            assertThat(first.remaining()).isEqualTo(2);
            assertThat(limiter.check("alice", 3, WINDOW_MS).remaining()).isEqualTo(1);
        }

        @Test
        void status_unknownIdentifier_hasFullQuota() {
            RateLimitResult r = localLimiter().status("nobody", 3, WINDOW_MS);

            assertThat(r.limited()).isFalse();
            assertThat(r.remaining()).isEqualTo(3);
        }

        @Test
        void status_reportsLimited_onceLimitIsReached() {
            FixedWindowRateLimiter limiter = localLimiter();
            for (int i = 0; i < 3; i++) {
                limiter.check("alice", 3, WINDOW_MS);
            }

            RateLimitResult r = limiter.status("alice", 3, WINDOW_MS);
            assertThat(r.limited()).isTrue();
            assertThat(r.remaining()).isZero();
            assertThat(r.retryAfterSeconds()).isEqualTo(20);
        }

        @Test
        void clear_resetsOnlyThatIdentifier() {
            FixedWindowRateLimiter limiter = localLimiter();
            for (int i = 0; i < 4; i++) {
                limiter.check("alice", 3, WINDOW_MS);
            }
            limiter.check("bob", 3, WINDOW_MS);

            assertThat(limiter.clear("alice")).isEqualTo(1);

            assertThat(limiter.check("alice", 3, WINDOW_MS).remaining()).isEqualTo(2);
            assertThat(limiter.status("bob", 3, WINDOW_MS).remaining()).isEqualTo(2);
        }

        @Test
        void clear_leavesIdentifiersThatExtendTheClearedOne() {
            FixedWindowRateLimiter limiter = localLimiter();
            limiter.check("2001:db8", 3, WINDOW_MS);
            limiter.check("2001:db8:1", 3, WINDOW_MS);

            assertThat(limiter.clear("2001:db8")).isEqualTo(1);

            assertThat(limiter.status("2001:db8", 3, WINDOW_MS).remaining()).isEqualTo(3);
            assertThat(limiter.status("2001:db8:1", 3, WINDOW_MS).remaining()).isEqualTo(2);
        }

        @Test
        void isWindowOf_requiresNumericWindowStart() {
            assertThat(FixedWindowRateLimiter.isWindowOf("ratelimit:a:1700000040000", "a")).isTrue();
            assertThat(FixedWindowRateLimiter.isWindowOf("ratelimit:a:b:1700000040000", "a")).isFalse();
            assertThat(FixedWindowRateLimiter.isWindowOf("ratelimit:a:", "a")).isFalse();
            assertThat(FixedWindowRateLimiter.isWindowOf("ratelimit:ab:1700000040000", "a")).isFalse();
        }

        @Test
        void keyFormat_includesWindowStart() {
            assertThat(FixedWindowRateLimiter.key("alice", 1_699_999_980_000L))
                    .isEqualTo("ratelimit:alice:1699999980000");
        }
    }
}
