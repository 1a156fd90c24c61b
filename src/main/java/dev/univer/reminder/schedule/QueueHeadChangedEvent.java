package dev.univer.reminder.schedule;

import java.time.Instant;

public record QueueHeadChangedEvent(Instant nextDue) {}
