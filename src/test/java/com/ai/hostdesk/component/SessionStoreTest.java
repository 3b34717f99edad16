package com.ai.hostdesk.component;

import com.ai.hostdesk.conversation.ConversationState;
import com.ai.hostdesk.conversation.Role;
import com.ai.hostdesk.conversation.Session;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-06-01T12:00:00Z"));
    private final SessionStore store = new SessionStore(clock);

    @Test
    void unseenPartyGetsDefaultCustomerSession() {
        Session session = store.get("+15550001");

        assertThat(session.getState()).isEqualTo(ConversationState.INITIAL);
        assertThat(session.getRole()).isEqualTo(Role.CUSTOMER);
        assertThat(session.getScratch()).isEmpty();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void putReplacesStoredSession() {
        Session waiting = store.get("+15550001").moveTo(ConversationState.AWAITING_WAITER_PASSWORD, clock.instant());

        store.put("+15550001", waiting);

        assertThat(store.get("+15550001")).isEqualTo(waiting);
        assertThat(store.get("+15550001").getRole()).isEqualTo(Role.WAITER);
    }

    @Test
    void blankPartyIdIsRejected() {
        assertThatThrownBy(() -> store.get(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void evictsOnlyIdleSessions() {
        store.get("old");
        clock.advance(Duration.ofHours(3));
        store.get("fresh");

        int evicted = store.evictIdle(Duration.ofHours(2));

        assertThat(evicted).isEqualTo(1);
        assertThat(store.contains("old")).isFalse();
        assertThat(store.contains("fresh")).isTrue();
    }

    @Test
    void sessionInUseIsNotEvicted() throws Exception {
        store.get("busy");
        clock.advance(Duration.ofHours(3));
        CountDownLatch insideLock = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> work = executor.submit(() -> store.withPartyLock("busy", () -> {
                insideLock.countDown();
                try {
                    return release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }));
            assertThat(insideLock.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(store.evictIdle(Duration.ofHours(2))).isZero();

            release.countDown();
            assertThat(work.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(store.contains("busy")).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void partyLockSerializesWork() throws Exception {
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 200; i++) {
                executor.submit(() -> store.withPartyLock("+15550001", () -> {
                    int now = concurrent.incrementAndGet();
                    maxConcurrent.accumulateAndGet(now, Math::max);
                    concurrent.decrementAndGet();
                    return null;
                }));
            }
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(maxConcurrent.get()).isEqualTo(1);
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
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
