package dev.univer.reminder.model;

public record Envelope(String userId, String room, String threadId) {

    public static Envelope of(JobMessageInfo info) {
        return new Envelope(info.getUserId(), info.getRoom(), info.getThreadId());
    }
}
