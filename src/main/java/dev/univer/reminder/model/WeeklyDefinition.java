package dev.univer.reminder.model;

import lombok.Value;

import java.util.List;

@Value
public class WeeklyDefinition implements RecurringDefinition {
    List<Integer> daysOfWeek;
    int interval;
    int hour;
    int minute;

    public WeeklyDefinition(List<Integer> daysOfWeek, int interval, int hour, int minute) {
        if (daysOfWeek == null || daysOfWeek.isEmpty()) {
            throw new IllegalArgumentException("At least one weekday is required");
        }
        for (Integer day : daysOfWeek) {
            if (day == null || day < 0 || day > 6) throw new IllegalArgumentException("Weekday out of range: " + day);
        }
        if (interval < 1) throw new IllegalArgumentException("Interval must be at least 1: " + interval);
        this.daysOfWeek = daysOfWeek.stream().distinct().sorted().toList();
        this.interval = interval;
        this.hour = TimeChecks.hour(hour);
        this.minute = TimeChecks.minute(minute);
    }

    public static WeeklyDefinition of(int dayOfWeek, int interval, int hour, int minute) {
        return new WeeklyDefinition(List.of(dayOfWeek), interval, hour, minute);
    }
}
