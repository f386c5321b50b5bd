package com.phillippitts.mockinterview.service.timer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class QuestionTimerTest {

    private ScheduledThreadPoolExecutor scheduler;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        scheduler = new ScheduledThreadPoolExecutor(1);
        scheduler.setRemoveOnCancelPolicy(true);
        listener = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void deliversDurationTicksThenExactlyOneExpiry() {
        QuestionTimer timer = new QuestionTimer(scheduler, 5, 60_000, listener);

        for (int i = 0; i < 8; i++) {
            timer.tick();
        }

        assertThat(listener.ticks).containsExactly(4L, 3L, 2L, 1L, 0L);
        assertThat(listener.expiries.get()).isEqualTo(1);
        assertThat(timer.remainingSeconds()).isZero();
        assertThat(timer.isExpired()).isTrue();
        assertThat(timer.elapsedSeconds()).isEqualTo(5);
    }

    @Test
    void remainingNeverGoesNegative() {
        QuestionTimer timer = new QuestionTimer(scheduler, 1, 60_000, listener);

        timer.tick();
        timer.tick();
        timer.tick();

        assertThat(listener.ticks).containsExactly(0L);
        assertThat(timer.remainingSeconds()).isZero();
    }

    @Test
    void cancelSuppressesFurtherTicksAndExpiry() {
        QuestionTimer timer = new QuestionTimer(scheduler, 3, 60_000, listener);
        timer.start();

        timer.tick();
        timer.cancel();
        timer.tick();
        timer.tick();

        assertThat(listener.ticks).containsExactly(2L);
        assertThat(listener.expiries.get()).isZero();
        assertThat(timer.isRunning()).isFalse();
        assertThat(timer.elapsedSeconds()).isEqualTo(1);
    }

    @Test
    void cancelIsIdempotentAndRemovesScheduledTask() {
        QuestionTimer timer = new QuestionTimer(scheduler, 60, 60_000, listener);
        timer.start();
        assertThat(scheduler.getQueue()).hasSize(1);

        timer.cancel();
        timer.cancel();

        assertThat(scheduler.getQueue()).isEmpty();
    }

    @Test
    void startAfterCancelDoesNothing() {
        QuestionTimer timer = new QuestionTimer(scheduler, 60, 60_000, listener);
        timer.cancel();

        timer.start();

        assertThat(timer.isRunning()).isFalse();
        assertThat(scheduler.getQueue()).isEmpty();
    }

    @Test
    void runsToExpiryOnScheduler() {
        QuestionTimer timer = new QuestionTimer(scheduler, 3, 10, listener);
        timer.start();

        await().atMost(Duration.ofSeconds(2)).until(() -> listener.expiries.get() == 1);

        assertThat(listener.ticks).containsExactly(2L, 1L, 0L);
        assertThat(timer.isRunning()).isFalse();
        await().atMost(Duration.ofSeconds(1)).until(() -> scheduler.getQueue().isEmpty());
    }

    @Test
    void failingListenerDoesNotStopCountdown() {
        AtomicInteger calls = new AtomicInteger();
        TimerListener failing = new TimerListener() {
            @Override
            public void onTick(QuestionTimer timer, long remaining) {
                calls.incrementAndGet();
                throw new IllegalStateException("listener bug");
            }

            @Override
            public void onExpired(QuestionTimer timer) {
            }
        };
        QuestionTimer timer = new QuestionTimer(scheduler, 3, 10, failing);
        timer.start();

        await().atMost(Duration.ofSeconds(2)).until(() -> calls.get() == 3);
        assertThat(timer.isExpired()).isTrue();
    }

    @Test
    void rejectsNonPositiveDuration() {
        assertThatThrownBy(() -> new QuestionTimer(scheduler, 0, 1000, listener))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new QuestionTimer(scheduler, 10, 0, listener))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class RecordingListener implements TimerListener {
        final List<Long> ticks = new CopyOnWriteArrayList<>();
        final AtomicInteger expiries = new AtomicInteger();

        @Override
        public void onTick(QuestionTimer timer, long remaining) {
            ticks.add(remaining);
        }

        @Override
        public void onExpired(QuestionTimer timer) {
            expiries.incrementAndGet();
        }
    }
}
