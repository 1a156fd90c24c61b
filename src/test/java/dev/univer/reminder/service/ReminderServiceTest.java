package dev.univer.reminder.service;

import dev.univer.reminder.config.ReminderProperties;
import dev.univer.reminder.model.Envelope;
import dev.univer.reminder.model.Job;
import dev.univer.reminder.model.SingleShotDefinition;
import dev.univer.reminder.model.WeeklyDefinition;
import dev.univer.reminder.parser.ParseFailure;
import dev.univer.reminder.parser.ParseResult;
import dev.univer.reminder.parser.SpecParser;
import dev.univer.reminder.schedule.InMemoryJobStorage;
import dev.univer.reminder.schedule.JobStore;
import dev.univer.reminder.schedule.ManualSchedulerTimer;
import dev.univer.reminder.schedule.MutableClock;
import dev.univer.reminder.schedule.ReminderSender;
import dev.univer.reminder.schedule.SchedulerState;
import dev.univer.reminder.schedule.SpecUpdateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReminderServiceTest {

    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final Envelope ALICE = new Envelope("@alice", "-100", null);

    private InMemoryJobStorage storage;
    private ReminderService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T10:00:00Z"));
        SpecParser parser = new SpecParser(clock);
        storage = new InMemoryJobStorage();
        JobStore store = new JobStore(new SchedulerState(), storage, parser, event -> { }, new ReminderProperties());
        store.load();
        ReminderSender sender = (envelope, text) -> CompletableFuture.completedFuture(null);
        service = new ReminderService(parser, store, new ManualSchedulerTimer(), sender);
    }

    @Test
    void remindMeMentionsTheAuthor() {
        Job job = service.addJobFromText("remind me in 5 minutes to stretch", ALICE, UTC).getValue();

        assertThat(job.getId()).isEqualTo(1L);
        assertThat(job.getMessageInfo().getMessage()).isEqualTo("@alice, stretch");
        assertThat(job.getMessageInfo().getRoom()).isEqualTo("-100");
        assertThat(job.getNext()).isEqualTo(Instant.parse("2024-01-01T10:05:00Z"));
        assertThat(storage.lastSaved("jobs")).containsExactly(job);
    }

    @Test
    void remindTeamTagsTheRoom() {
        Job job = service.addJobFromText("remind team every Monday at 9 to plan the week", new Envelope("@bob", "-100", "7"), UTC).getValue();

        assertThat(job.getMessageInfo().getMessage()).isEqualTo("@team, plan the week");
        assertThat(job.getMessageInfo().getThreadId()).isEqualTo("7");
        assertThat(job.getSpec()).isEqualTo(WeeklyDefinition.of(1, 1, 9, 0));
        assertThat(job.getNext()).isEqualTo(Instant.parse("2024-01-08T09:00:00Z"));
    }

    @Test
    void offsetJustBeforeTheWeekTurnsIsNotPushedAWeekOut() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-06T23:58:00Z")) {
            @Override
            public Clock withZone(ZoneId zone) {
                Clock read = super.withZone(zone);
                advance(Duration.ofMinutes(2));
                return read;
            }
        };
        SpecParser parser = new SpecParser(clock);
        JobStore store = new JobStore(new SchedulerState(), new InMemoryJobStorage(), parser, event -> { }, new ReminderProperties());
        store.load();
        ReminderService weekEnd = new ReminderService(parser, store, new ManualSchedulerTimer(),
                (envelope, text) -> CompletableFuture.completedFuture(null));

        Job job = weekEnd.addJobFromText("remind me in 5 minutes to stretch", ALICE, UTC).getValue();

        assertThat(job.getSpec()).isEqualTo(SingleShotDefinition.of(7, 0, 3));
        assertThat(job.getNext()).isEqualTo(Instant.parse("2024-01-07T00:03:00Z"));
    }

    @Test
    void parseFailureAddsNothing() {
        ParseResult<Job> result = service.addJobFromText("remind me to do it sometime", ALICE, UTC);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailure().reason()).isEqualTo(ParseFailure.Reason.NO_SCHEDULE);
        assertThat(service.jobsForRooms()).isEmpty();
        assertThat(storage.saves).isZero();
    }

    @Test
    void updateAndRemove() {
        Job job = service.addJobFromText("remind me every Friday at 17:00 to log hours", ALICE, UTC).getValue();

        assertThat(service.updateJobMessage(job.getId(), "log hours!"))
                .hasValueSatisfying(j -> assertThat(j.getMessageInfo().getMessage()).isEqualTo("log hours!"));
        assertThatThrownBy(() -> service.updateJobSpec(job.getId(), "every blorf", UTC)).isInstanceOf(SpecUpdateException.class);
        assertThat(service.updateJobSpec(job.getId(), "every Thursday at 17:00", UTC))
                .hasValueSatisfying(j -> assertThat(j.getSpec()).isEqualTo(WeeklyDefinition.of(4, 1, 17, 0)));
        assertThat(service.findJob(job.getId())).isPresent();
        assertThat(service.jobsForRooms("-100")).hasSize(1);
        assertThat(service.jobsForRooms("-200")).isEmpty();

        assertThat(service.removeJob(job.getId())).isPresent();
        assertThat(service.findJob(job.getId())).isEmpty();
    }
}
