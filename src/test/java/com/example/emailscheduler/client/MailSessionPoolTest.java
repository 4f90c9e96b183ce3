package com.example.emailscheduler.client;

import com.example.emailscheduler.client.ClientModels.MailSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MailSessionPool Tests")
class MailSessionPoolTest {

    @Mock
    private MailFetchClient mailFetchClient;

    private MutableClock clock;

    private MailSessionPool pool;

    private final AtomicInteger opened = new AtomicInteger();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        pool = new MailSessionPool(mailFetchClient, 2, Duration.ofMinutes(10), clock);
        lenient().when(mailFetchClient.openSession(anyString())).thenAnswer(invocation -> MailSession.builder()
                .sessionId("session-" + opened.incrementAndGet())
                .accountId(invocation.getArgument(0))
                .build());
    }

    @Nested
    @DisplayName("Lease Tests")
    class LeaseTests {

        @Test
        @DisplayName("Should reuse a returned session")
        void shouldReuseReturnedSession() {
            // Given
            MailSession first;
            try (var lease = pool.lease("account-1")) {
                first = lease.getSession();
            }

            // When
            MailSession second;
            try (var lease = pool.lease("account-1")) {
                second = lease.getSession();
            }

            // Then
            assertThat(second).isSameAs(first);
            verify(mailFetchClient, times(1)).openSession("account-1");
        }

        @Test
        @DisplayName("Should keep sessions of different accounts apart")
        void shouldSeparateAccounts() {
            try (var a = pool.lease("account-1"); var b = pool.lease("account-2")) {
                assertThat(a.getSession().getAccountId()).isEqualTo("account-1");
                assertThat(b.getSession().getAccountId()).isEqualTo("account-2");
            }
        }

        @Test
        @DisplayName("Should close an invalidated session instead of pooling it")
        void shouldCloseInvalidatedSession() {
            // Given
            MailSession broken;
            try (var lease = pool.lease("account-1")) {
                broken = lease.getSession();
                lease.invalidate();
            }

            // Then
            verify(mailFetchClient).closeSession(broken);
            assertThat(pool.idleCount("account-1")).isZero();
        }

        @Test
        @DisplayName("Closing a lease twice should return it once")
        void shouldIgnoreSecondClose() {
            var lease = pool.lease("account-1");
            lease.close();
            lease.close();

            assertThat(pool.idleCount("account-1")).isEqualTo(1);
        }

        @Test
        @DisplayName("Should give the permit back when opening a session fails")
        void shouldReleasePermitOnOpenFailure() {
            when(mailFetchClient.openSession("account-3"))
                    .thenThrow(new IllegalStateException("gateway down"))
                    .thenThrow(new IllegalStateException("gateway down"))
                    .thenReturn(MailSession.builder().sessionId("late").accountId("account-3").build());

            assertThatThrownBy(() -> pool.lease("account-3")).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> pool.lease("account-3")).isInstanceOf(IllegalStateException.class);

            try (var lease = pool.lease("account-3")) {
                assertThat(lease.getSession().getSessionId()).isEqualTo("late");
            }
        }

        @Test
        @DisplayName("Should block a third lease until one is returned")
        void shouldLimitLeasesPerAccount() throws Exception {
            // Given
            var first = pool.lease("account-1");
            var second = pool.lease("account-1");
            var acquired = new CountDownLatch(1);
            var executor = Executors.newSingleThreadExecutor();

            try {
                // When
                executor.submit(() -> {
                    try (var third = pool.lease("account-1")) {
                        acquired.countDown();
                    }
                });

                // Then
                assertThat(acquired.await(200, TimeUnit.MILLISECONDS)).isFalse();
                first.close();
                assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();
            } finally {
                second.close();
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Eviction Tests")
    class EvictionTests {

        @Test
        @DisplayName("Should close sessions idle longer than the limit")
        void shouldEvictIdleSessions() {
            // Given
            MailSession session;
            try (var lease = pool.lease("account-1")) {
                session = lease.getSession();
            }
            clock.advance(Duration.ofMinutes(11));

            // When
            pool.evictIdle();

            // Then
            verify(mailFetchClient).closeSession(session);
            assertThat(pool.idleCount("account-1")).isZero();
        }

        @Test
        @DisplayName("Should keep recently returned sessions")
        void shouldKeepRecentSessions() {
            try (var lease = pool.lease("account-1")) {
                lease.getSession();
            }
            clock.advance(Duration.ofMinutes(5));

            pool.evictIdle();

            assertThat(pool.idleCount("account-1")).isEqualTo(1);
            verify(mailFetchClient, never()).closeSession(any());
        }

        @Test
        @DisplayName("Should open a fresh session instead of reusing an expired one")
        void shouldNotReuseExpiredSession() {
            MailSession first;
            try (var lease = pool.lease("account-1")) {
                first = lease.getSession();
            }
            clock.advance(Duration.ofMinutes(15));

            try (var lease = pool.lease("account-1")) {
                assertThat(lease.getSession()).isNotSameAs(first);
            }
            verify(mailFetchClient).closeSession(first);
        }

        @Test
        @DisplayName("Should drop accounts left without sessions and still serve them later")
        void shouldDropInactiveAccounts() {
            // Given
            try (var lease = pool.lease("account-1")) {
                lease.getSession();
            }
            try (var lease = pool.lease("account-2")) {
                lease.getSession();
            }
            clock.advance(Duration.ofMinutes(11));

            // When
            pool.evictIdle();

            // Then
            assertThat(pool.accountCount()).isZero();
            try (var lease = pool.lease("account-1")) {
                assertThat(lease.getSession().getAccountId()).isEqualTo("account-1");
            }
            assertThat(pool.accountCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should keep accounts with a leased session")
        void shouldKeepAccountsInUse() {
            try (var lease = pool.lease("account-1")) {
                clock.advance(Duration.ofMinutes(11));

                pool.evictIdle();

                assertThat(pool.accountCount()).isEqualTo(1);
            }
            assertThat(pool.idleCount("account-1")).isEqualTo(1);
        }

        @Test
        @DisplayName("Shutdown should close every idle session")
        void shutdownShouldCloseAll() {
            try (var a = pool.lease("account-1"); var b = pool.lease("account-2")) {
                a.getSession();
                b.getSession();
            }

            pool.shutdown();

            verify(mailFetchClient, times(2)).closeSession(any());
        }
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
