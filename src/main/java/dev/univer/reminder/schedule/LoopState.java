package dev.univer.reminder.schedule;

public enum LoopState {
    IDLE,
    ARMED,
    DRAINING
}
