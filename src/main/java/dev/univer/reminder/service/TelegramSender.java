package dev.univer.reminder.service;

import dev.univer.reminder.model.Envelope;
import dev.univer.reminder.schedule.ReminderSender;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.concurrent.CompletableFuture;

@Service
@RequiredArgsConstructor
public class TelegramSender implements ReminderSender {
    private final TelegramWrapper wrapper;

    public void send(Long chatId, Integer threadId, String text) throws TelegramApiException {
        wrapper.execute(message(chatId.toString(), threadId, text));
    }

    @Override
    public CompletableFuture<Void> send(Envelope envelope, String text) {
        Integer threadId = envelope.threadId() == null ? null : Integer.valueOf(envelope.threadId());
        try {
            return wrapper.executeAsync(message(envelope.room(), threadId, text)).thenAccept(sent -> { });
        } catch (TelegramApiException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static SendMessage message(String chatId, Integer threadId, String text) {
        SendMessage sm = SendMessage.builder()
                .chatId(chatId)
                .text(text)
                .build();
        if (threadId != null) sm.setMessageThreadId(threadId);
        return sm;
    }
}
