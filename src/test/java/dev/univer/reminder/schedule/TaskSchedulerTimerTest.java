package dev.univer.reminder.schedule;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskSchedulerTimerTest {

    private ThreadPoolTaskScheduler scheduler;
    private TaskSchedulerTimer timer;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("reminder-scheduler-test-");
        scheduler.initialize();
        timer = new TaskSchedulerTimer(scheduler, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void submitRunsOnTheSchedulingThread() {
        String thread = timer.submit(() -> Thread.currentThread().getName());

        assertThat(thread).startsWith("reminder-scheduler-test-");
    }

    @Test
    void nestedSubmitRunsInline() {
        String inner = timer.submit(() -> timer.submit(() -> Thread.currentThread().getName()));

        assertThat(inner).startsWith("reminder-scheduler-test-");
    }

    @Test
    void submitRethrowsRuntimeExceptions() {
        assertThatThrownBy(() -> timer.submit(() -> { throw new IllegalArgumentException("bad id"); }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("bad id");
    }

    @Test
    void armedTaskRunsAfterDelay() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);

        timer.arm(Duration.ofMillis(20), fired::countDown);

        assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void cancelledTaskDoesNotRun() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean();

        SchedulerTimer.Handle handle = timer.arm(Duration.ofMillis(200), () -> ran.set(true));
        handle.cancel();
        Thread.sleep(400);

        assertThat(ran).isFalse();
    }
}
