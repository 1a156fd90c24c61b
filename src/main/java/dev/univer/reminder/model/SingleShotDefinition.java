package dev.univer.reminder.model;

import lombok.Value;

import java.util.List;

@Value
public class SingleShotDefinition implements RecurrenceDefinition {
    // 7 and above: that many days after the start of the week ("in 6 days")
    List<Integer> daysOfWeek;
    int hour;
    int minute;

    public SingleShotDefinition(List<Integer> daysOfWeek, int hour, int minute) {
        if (daysOfWeek == null || daysOfWeek.isEmpty()) {
            throw new IllegalArgumentException("At least one day is required");
        }
        this.daysOfWeek = List.copyOf(daysOfWeek);
        this.hour = TimeChecks.hour(hour);
        this.minute = TimeChecks.minute(minute);
    }

    public static SingleShotDefinition of(int dayOfWeek, int hour, int minute) {
        return new SingleShotDefinition(List.of(dayOfWeek), hour, minute);
    }
}
