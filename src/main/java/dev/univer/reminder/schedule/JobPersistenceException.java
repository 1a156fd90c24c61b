package dev.univer.reminder.schedule;

public class JobPersistenceException extends RuntimeException {
    public JobPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
