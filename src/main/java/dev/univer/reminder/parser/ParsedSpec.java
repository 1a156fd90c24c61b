package dev.univer.reminder.parser;

import dev.univer.reminder.model.JobType;
import dev.univer.reminder.model.RecurrenceDefinition;
import dev.univer.reminder.model.RecurringDefinition;
import lombok.Value;

import java.time.Instant;

@Value
public class ParsedSpec {
    RecurrenceDefinition definition;
    int start;
    int end;
    // single shot days count from the UTC week of this instant
    Instant resolvedAt;

    public JobType getType() {
        return definition instanceof RecurringDefinition ? JobType.RECURRING : JobType.SINGLE;
    }
}
