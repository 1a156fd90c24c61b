package dev.univer.reminder.repo;

import dev.univer.reminder.model.ChatSettings;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ChatSettingsRepository extends JpaRepository<ChatSettings, Long> {
    Optional<ChatSettings> findByChatId(Long chatId);
}
