package dev.univer.reminder.schedule;

import dev.univer.reminder.model.Job;

import java.util.List;
import java.util.Optional;

/**
 * Key-value persistence for the job snapshot. Every save replaces whatever was
 * stored under the key.
 */
public interface JobStorage {

    Optional<List<Job>> load(String key);

    void save(String key, List<Job> jobs);
}
