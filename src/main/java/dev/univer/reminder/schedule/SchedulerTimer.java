package dev.univer.reminder.schedule;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * The single scheduling thread: one-shot timers plus a way to run work on
 * that thread from outside.
 */
public interface SchedulerTimer {

    Handle arm(Duration delay, Runnable task);

    /**
     * Runs {@code action} on the scheduling thread and waits for it. Runs
     * inline when already on it. Runtime exceptions from the action are
     * rethrown as-is.
     */
    <T> T submit(Callable<T> action);

    interface Handle {
        void cancel();
    }
}
