package dev.univer.reminder.schedule;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;

@RequiredArgsConstructor
public class TaskSchedulerTimer implements SchedulerTimer {

    private final ThreadPoolTaskScheduler scheduler;
    private final Clock clock;

    @Override
    public Handle arm(Duration delay, Runnable task) {
        ScheduledFuture<?> future = scheduler.schedule(task, clock.instant().plus(delay));
        return () -> future.cancel(false);
    }

    @Override
    public <T> T submit(Callable<T> action) {
        if (onSchedulerThread()) {
            return callInline(action);
        }
        try {
            return scheduler.getScheduledExecutor().submit(action).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error error) throw error;
            throw new IllegalStateException("Scheduler task failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the scheduler thread", e);
        }
    }

    private boolean onSchedulerThread() {
        return Thread.currentThread().getName().startsWith(scheduler.getThreadNamePrefix());
    }

    private static <T> T callInline(Callable<T> action) {
        try {
            return action.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Scheduler task failed", e);
        }
    }
}
