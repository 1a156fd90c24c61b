package dev.univer.reminder.repo;

import dev.univer.reminder.model.Job;
import dev.univer.reminder.model.ReminderJobEntity;
import dev.univer.reminder.schedule.JobPersistenceException;
import dev.univer.reminder.schedule.JobStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaJobStorage implements JobStorage {

    private final ReminderJobRepository repo;

    @Override
    @Transactional(readOnly = true)
    public Optional<List<Job>> load(String key) {
        List<ReminderJobEntity> rows = repo.findAllByStorageKeyOrderByQueueOrderAsc(key);
        if (rows.isEmpty()) return Optional.empty();
        return Optional.of(rows.stream().map(ReminderJobEntity::toJob).toList());
    }

    @Override
    @Transactional
    public void save(String key, List<Job> jobs) {
        try {
            repo.deleteAllByStorageKey(key);
            List<ReminderJobEntity> rows = new ArrayList<>(jobs.size());
            for (int i = 0; i < jobs.size(); i++) {
                rows.add(ReminderJobEntity.fromJob(key, jobs.get(i), i));
            }
            repo.saveAll(rows);
            log.debug("Saved {} job(s) under '{}'", rows.size(), key);
        } catch (DataAccessException e) {
            throw new JobPersistenceException("Failed to save jobs under key '" + key + "'", e);
        }
    }
}
