package dev.univer.reminder.service;

import dev.univer.reminder.model.Audience;
import dev.univer.reminder.model.Envelope;
import dev.univer.reminder.model.Job;
import dev.univer.reminder.model.JobMessageInfo;
import dev.univer.reminder.model.RecurrenceDefinition;
import dev.univer.reminder.parser.ParseResult;
import dev.univer.reminder.parser.ParsedReminder;
import dev.univer.reminder.parser.ParsedSpec;
import dev.univer.reminder.parser.SpecParser;
import dev.univer.reminder.schedule.JobStore;
import dev.univer.reminder.schedule.RecurrenceCalculator;
import dev.univer.reminder.schedule.ReminderSender;
import dev.univer.reminder.schedule.SchedulerTimer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderService {

    private final SpecParser specParser;
    private final JobStore store;
    private final SchedulerTimer timer;
    private final ReminderSender sender;

    public ParseResult<Job> addJobFromText(String text, Envelope envelope, ZoneId zone) {
        ParseResult<ParsedReminder> parsed = specParser.parse(text, zone);
        if (!parsed.isSuccess()) return ParseResult.failure(parsed.getFailure());

        ParsedReminder reminder = parsed.getValue();
        ParsedSpec schedule = reminder.getSchedule();
        RecurrenceDefinition definition = schedule.getDefinition();
        String prefix = reminder.getAudience() == Audience.ME
                        ? sender.mention(envelope.userId())
                        : sender.roomTag(reminder.getAudience());

        Job job = Job.builder()
                .messageInfo(JobMessageInfo.builder()
                        .userId(envelope.userId())
                        .room(envelope.room())
                        .threadId(envelope.threadId())
                        .message(prefix + reminder.getMessage())
                        .build())
                .spec(definition)
                .next(RecurrenceCalculator.nextOccurrence(schedule.getResolvedAt(), definition))
                .build();
        return ParseResult.success(timer.submit(() -> store.addJob(job)));
    }

    public Optional<Job> updateJobMessage(long id, String message) {
        return timer.submit(() -> store.updateMessage(id, message));
    }

    public Optional<Job> updateJobSpec(long id, String specText, ZoneId zone) {
        return timer.submit(() -> store.updateSpec(id, specText, zone));
    }

    public Optional<Job> removeJob(long id) {
        return timer.submit(() -> store.removeJob(id));
    }

    public List<Job> jobsForRooms(String... rooms) {
        return timer.submit(() -> store.jobsForRooms(rooms));
    }

    public Optional<Job> findJob(long id) {
        return timer.submit(() -> store.findJob(id));
    }
}
