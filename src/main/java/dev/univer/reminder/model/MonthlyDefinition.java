package dev.univer.reminder.model;

import lombok.Value;

@Value
public class MonthlyDefinition implements RecurringDefinition {
    int dayOfMonth;
    int hour;
    int minute;

    public MonthlyDefinition(int dayOfMonth, int hour, int minute) {
        if (dayOfMonth < 1 || dayOfMonth > 31) throw new IllegalArgumentException("Day of month out of range: " + dayOfMonth);
        this.dayOfMonth = dayOfMonth;
        this.hour = TimeChecks.hour(hour);
        this.minute = TimeChecks.minute(minute);
    }
}
