package dev.univer.reminder.schedule;

import dev.univer.reminder.model.Envelope;
import dev.univer.reminder.model.Job;
import dev.univer.reminder.model.JobMessageInfo;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fires due reminders. One timer is armed for the head of the queue; when it
 * goes off every due job is taken, recurring ones are advanced past now and
 * put back, the snapshot is written, and only then are messages sent.
 * <p>
 * Runs on the scheduling thread only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulerLoop {

    private final JobStore store;
    private final SchedulerState state;
    private final SchedulerTimer timer;
    private final ReminderSender sender;
    private final Clock clock;

    private volatile LoopState loopState = LoopState.IDLE;
    private SchedulerTimer.Handle armed;

    // before the bot starts polling, see TelegramBotConfig
    @EventListener(ApplicationReadyEvent.class)
    @Order(Ordered.HIGHEST_PRECEDENCE)
    public void start() {
        timer.submit(() -> {
            int loaded = store.load();
            log.info("Loaded {} reminder job(s)", loaded);
            drain();
            return null;
        });
    }

    @EventListener
    public void onQueueHeadChanged(QueueHeadChangedEvent event) {
        timer.submit(() -> {
            restart();
            return null;
        });
    }

    void restart() {
        if (loopState == LoopState.DRAINING) return;
        cancelArmed();
        drain();
    }

    void drain() {
        loopState = LoopState.DRAINING;
        armed = null;
        try {
            Instant now = clock.instant();
            List<Job> due = store.takeDue(now);
            if (due.isEmpty()) return;

            List<Job> requeue = new ArrayList<>();
            for (Job job : due) {
                if (job.isRecurring()) {
                    requeue.add(job.withNext(RecurrenceCalculator.nextOccurrenceAfter(job.getNext(), job.getSpec(), now)));
                }
            }
            try {
                store.requeueAll(requeue);
            } catch (JobPersistenceException e) {
                log.error("Could not save jobs after taking {} due job(s)", due.size(), e);
            }
            log.debug("Dispatching {} job(s), {} requeued", due.size(), requeue.size());
            due.forEach(this::dispatch);
        } catch (RuntimeException e) {
            log.error("Draining pass failed", e);
        } finally {
            arm();
        }
    }

    @PreDestroy
    public void stop() {
        cancelArmed();
        loopState = LoopState.IDLE;
    }

    public LoopState getLoopState() {
        return loopState;
    }

    private void dispatch(Job job) {
        JobMessageInfo info = job.getMessageInfo();
        try {
            sender.send(Envelope.of(info), info.getMessage()).whenComplete((ignored, error) -> {
                if (error != null) {
                    log.error("Failed to deliver job {} to {}", job.getId(), info.getRoom(), error);
                } else {
                    log.debug("Delivered job {} to {}", job.getId(), info.getRoom());
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to deliver job {} to {}", job.getId(), info.getRoom(), e);
        }
    }

    private void arm() {
        Optional<Job> head = state.head();
        if (head.isEmpty()) {
            loopState = LoopState.IDLE;
            return;
        }
        Duration delay = Duration.between(clock.instant(), head.get().getNext());
        if (delay.isNegative()) delay = Duration.ZERO;
        try {
            armed = timer.arm(delay, this::drain);
            loopState = LoopState.ARMED;
            log.debug("Armed for job {} in {}", head.get().getId(), delay);
        } catch (RuntimeException e) {
            // executor already shut down
            log.warn("Could not arm scheduler timer", e);
            loopState = LoopState.IDLE;
        }
    }

    private void cancelArmed() {
        if (armed != null) {
            armed.cancel();
            armed = null;
        }
    }
}
