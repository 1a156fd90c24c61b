package dev.univer.reminder.parser;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Value
@With
@Builder
class ScheduleClause {

    enum Kind {
        // "in 5 minutes", "in 2 weeks on Monday"
        OFFSET,
        // "on Tuesday", "next Fri"
        ON,
        // "every other Tuesday", "every weekday"
        EVERY_WEEK,
        // "every 5th", "every 12th day of the month"
        EVERY_MONTH,
        // bare "at 17:00"
        AT
    }

    Kind kind;
    int amount;
    ChronoUnit unit;
    List<Integer> days;
    int interval;
    int dayOfMonth;
    LocalTime time;
    int start;
    int end;
}
