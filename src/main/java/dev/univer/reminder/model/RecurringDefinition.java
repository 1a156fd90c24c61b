package dev.univer.reminder.model;

public interface RecurringDefinition extends RecurrenceDefinition {
}
