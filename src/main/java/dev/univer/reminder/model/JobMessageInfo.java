package dev.univer.reminder.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

@Value
@With
@Builder(toBuilder = true)
public class JobMessageInfo {
    @NonNull String userId;
    @NonNull String message;
    @NonNull String room;
    // null unless the reminder was created inside a thread (forum topic)
    String threadId;
}
