package dev.univer.reminder.model;

public interface RecurrenceDefinition {
    int getHour();
    int getMinute();
}
