package dev.univer.reminder.schedule;

import dev.univer.reminder.model.Job;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pending jobs, sorted ascending by {@code next} (ties keep insertion order),
 * plus an id index over the same set and the id counter.
 * <p>
 * Not thread-safe: only the scheduling thread touches it. Mutators are
 * package-private and go through {@link JobStore}.
 */
public class SchedulerState {

    private final List<Job> queue = new ArrayList<>();
    private final Map<Long, Job> jobsById = new HashMap<>();
    private long maxId;

    long allocateId() {
        return ++maxId;
    }

    void observeId(long id) {
        maxId = Math.max(maxId, id);
    }

    /** Inserts after every job due at or before it; returns the queue index. */
    int insert(Job job) {
        int index = 0;
        while (index < queue.size() && !job.getNext().isBefore(queue.get(index).getNext())) {
            index++;
        }
        insertAt(index, job);
        return index;
    }

    void insertAt(int index, Job job) {
        queue.add(index, job);
        jobsById.put(job.getId(), job);
    }

    int remove(long id) {
        int index = indexOf(id);
        if (index < 0) return -1;
        queue.remove(index);
        jobsById.remove(id);
        return index;
    }

    void replace(Job job) {
        int index = indexOf(job.getId());
        if (index < 0) throw new IllegalStateException("Job " + job.getId() + " is not scheduled");
        queue.set(index, job);
        jobsById.put(job.getId(), job);
    }

    List<Job> takeDue(Instant now) {
        List<Job> due = new ArrayList<>();
        while (!queue.isEmpty() && !queue.get(0).getNext().isAfter(now)) {
            Job job = queue.remove(0);
            jobsById.remove(job.getId());
            due.add(job);
        }
        return due;
    }

    void clear() {
        queue.clear();
        jobsById.clear();
    }

    public Optional<Job> find(long id) {
        return Optional.ofNullable(jobsById.get(id));
    }

    public boolean contains(long id) {
        return jobsById.containsKey(id);
    }

    public Optional<Job> head() {
        return queue.isEmpty() ? Optional.empty() : Optional.of(queue.get(0));
    }

    public boolean isHead(long id) {
        return !queue.isEmpty() && queue.get(0).getId() == id;
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public List<Job> snapshot() {
        return List.copyOf(queue);
    }

    public Map<Long, Job> index() {
        return Map.copyOf(jobsById);
    }

    private int indexOf(long id) {
        for (int i = 0; i < queue.size(); i++) {
            if (queue.get(i).getId() == id) return i;
        }
        return -1;
    }
}
