package dev.univer.reminder.service;

import dev.univer.reminder.model.ChatSettings;
import dev.univer.reminder.repo.ChatSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DateTimeException;
import java.time.ZoneId;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChatSettingsService {
    private final ChatSettingsRepository repo;

    @Value("${bot.defaultZoneId:UTC}")
    private String defaultZoneId;

    @Transactional
    public ChatSettings ensure(Long chatId, String chatTitle) {
        return repo.findByChatId(chatId).orElseGet(() -> {
            ChatSettings s = ChatSettings.builder()
                    .chatId(chatId)
                    .chatTitle(chatTitle)
                    .zoneId(defaultZoneId)
                    .build();
            return repo.save(s);
        });
    }

    @Transactional
    public ChatSettings updateTimezone(Long chatId, ZoneId zoneId) {
        ChatSettings s = repo.findByChatId(chatId).orElseThrow();
        s.setZoneId(zoneId.getId());
        return s;
    }

    public ZoneId zoneFor(ChatSettings s) {
        String id = s.getZoneId() == null ? defaultZoneId : s.getZoneId();
        try {
            return ZoneId.of(id);
        } catch (DateTimeException e) {
            log.warn("Chat {} has unknown zone '{}', using UTC", s.getChatId(), id);
            return ZoneId.of("UTC");
        }
    }
}
