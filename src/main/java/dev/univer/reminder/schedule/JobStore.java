package dev.univer.reminder.schedule;

import dev.univer.reminder.config.ReminderProperties;
import dev.univer.reminder.model.Job;
import dev.univer.reminder.model.RecurrenceDefinition;
import dev.univer.reminder.parser.ParseResult;
import dev.univer.reminder.parser.ParsedSpec;
import dev.univer.reminder.parser.SpecParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Owns {@link SchedulerState}. Every mutation writes the full snapshot through
 * {@link JobStorage}; when that write fails the in-memory change is undone and
 * {@link JobPersistenceException} propagates. Mutations are refused until
 * {@link #load()} has run, since a snapshot written from an empty state would
 * replace the stored jobs.
 * <p>
 * Callers must be on the scheduling thread (see {@link SchedulerTimer#submit}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStore {

    private final SchedulerState state;
    private final JobStorage storage;
    private final SpecParser specParser;
    private final ApplicationEventPublisher publisher;
    private final ReminderProperties properties;

    private volatile boolean loaded;

    public Job addJob(Job job) {
        checkLoaded();
        Job stored;
        if (job.getId() == null) {
            stored = job.withId(state.allocateId());
        } else {
            if (state.contains(job.getId())) throw new IllegalArgumentException("Job " + job.getId() + " already exists");
            state.observeId(job.getId());
            stored = job;
        }

        int index = state.insert(stored);
        try {
            persist();
        } catch (JobPersistenceException e) {
            state.remove(stored.getId());
            throw e;
        }
        log.info("Added job {} ({}) due {}", stored.getId(), stored.getType(), stored.getNext());
        if (index == 0) publishHead();
        return stored;
    }

    public Optional<Job> removeJob(long id) {
        checkLoaded();
        Optional<Job> existing = state.find(id);
        if (existing.isEmpty()) return Optional.empty();

        int index = state.remove(id);
        try {
            persist();
        } catch (JobPersistenceException e) {
            state.insertAt(index, existing.get());
            throw e;
        }
        log.info("Removed job {}", id);
        if (index == 0) publishHead();
        return existing;
    }

    public Optional<Job> updateMessage(long id, String message) {
        checkLoaded();
        Optional<Job> existing = state.find(id);
        if (existing.isEmpty()) return Optional.empty();

        Job original = existing.get();
        Job updated = original.withMessageInfo(original.getMessageInfo().withMessage(message));
        state.replace(updated);
        try {
            persist();
        } catch (JobPersistenceException e) {
            state.replace(original);
            throw e;
        }
        log.info("Updated message of job {}", id);
        return Optional.of(updated);
    }

    /**
     * Gives the job a new schedule and recomputes {@code next} from now.
     *
     * @throws SpecUpdateException when {@code specText} does not parse; the job is untouched
     */
    public Optional<Job> updateSpec(long id, String specText, ZoneId zone) {
        checkLoaded();
        Optional<Job> existing = state.find(id);
        if (existing.isEmpty()) return Optional.empty();

        ParseResult<ParsedSpec> parsed = specParser.parseSpec(specText, zone);
        if (!parsed.isSuccess()) {
            log.debug("Rejected new schedule \"{}\" for job {}: {}", specText, id, parsed.getFailure().reason());
            throw new SpecUpdateException(id, parsed.getFailure());
        }

        Job original = existing.get();
        ParsedSpec spec = parsed.getValue();
        RecurrenceDefinition definition = spec.getDefinition();
        Job updated = original
                .withSpec(definition)
                .withNext(RecurrenceCalculator.nextOccurrence(spec.getResolvedAt(), definition));

        int oldIndex = state.remove(id);
        int newIndex = state.insert(updated);
        try {
            persist();
        } catch (JobPersistenceException e) {
            state.remove(id);
            state.insertAt(oldIndex, original);
            throw e;
        }
        log.info("Rescheduled job {} to {}", id, updated.getNext());
        if (oldIndex == 0 || newIndex == 0) publishHead();
        return Optional.of(updated);
    }

    public List<Job> jobsForRooms(String... rooms) {
        List<Job> all = state.snapshot();
        if (rooms == null || rooms.length == 0) return all;
        Set<String> wanted = Set.copyOf(Arrays.asList(rooms));
        return all.stream().filter(j -> wanted.contains(j.getMessageInfo().getRoom())).toList();
    }

    public Optional<Job> findJob(long id) {
        return state.find(id);
    }

    public int load() {
        state.clear();
        Optional<List<Job>> stored = storage.load(properties.getStorageKey());
        if (stored.isEmpty()) {
            log.info("No stored jobs under key '{}'", properties.getStorageKey());
        } else {
            List<Job> jobs = stored.get();
            jobs.stream().filter(Job::isPersisted).forEach(j -> state.observeId(j.getId()));
            for (Job job : jobs) {
                state.insert(job.isPersisted() ? job : job.withId(state.allocateId()));
            }
        }
        loaded = true;
        return state.size();
    }

    List<Job> takeDue(Instant now) {
        return state.takeDue(now);
    }

    /**
     * Puts advanced recurring jobs back and writes one snapshot, which also
     * records the removal of the single shots taken with them. Not rolled back
     * on failure: the jobs have already fired.
     */
    void requeueAll(List<Job> jobs) {
        jobs.forEach(state::insert);
        persist();
    }

    private void checkLoaded() {
        if (!loaded) throw new IllegalStateException("Reminder jobs are not loaded yet");
    }

    private void persist() {
        String key = properties.getStorageKey();
        try {
            storage.save(key, state.snapshot());
        } catch (JobPersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new JobPersistenceException("Failed to save jobs under key '" + key + "'", e);
        }
    }

    private void publishHead() {
        publisher.publishEvent(new QueueHeadChangedEvent(state.head().map(Job::getNext).orElse(null)));
    }
}
