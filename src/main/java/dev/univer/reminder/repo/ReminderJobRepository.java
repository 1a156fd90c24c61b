package dev.univer.reminder.repo;

import dev.univer.reminder.model.ReminderJobEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ReminderJobRepository extends JpaRepository<ReminderJobEntity, Long> {
    List<ReminderJobEntity> findAllByStorageKeyOrderByQueueOrderAsc(String storageKey);
    long countByStorageKey(String storageKey);
    void deleteAllByStorageKey(String storageKey);
}
