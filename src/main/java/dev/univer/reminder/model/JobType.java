package dev.univer.reminder.model;

public enum JobType {
    SINGLE,
    RECURRING
}
