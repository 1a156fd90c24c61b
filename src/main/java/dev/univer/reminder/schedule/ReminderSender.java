package dev.univer.reminder.schedule;

import dev.univer.reminder.model.Audience;
import dev.univer.reminder.model.Envelope;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;

public interface ReminderSender {

    CompletableFuture<Void> send(Envelope envelope, String text);

    default String mention(String userId) {
        return userId + ", ";
    }

    default String roomTag(Audience audience) {
        return "@" + audience.name().toLowerCase(Locale.ROOT) + ", ";
    }
}
