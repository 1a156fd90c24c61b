package dev.univer.reminder.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.Instant;

@Value
@With
@Builder(toBuilder = true)
public class Job {
    Long id;
    @NonNull JobMessageInfo messageInfo;
    @NonNull RecurrenceDefinition spec;
    @NonNull Instant next;

    public JobType getType() {
        return spec instanceof RecurringDefinition ? JobType.RECURRING : JobType.SINGLE;
    }

    public boolean isRecurring() {
        return getType() == JobType.RECURRING;
    }

    public boolean isPersisted() {
        return id != null;
    }
}
