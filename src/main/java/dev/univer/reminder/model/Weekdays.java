package dev.univer.reminder.model;

import java.time.DayOfWeek;
import java.time.LocalDate;

public final class Weekdays {
    private Weekdays() {}

    public static int index(DayOfWeek day) {
        return day.getValue() % 7;
    }

    public static DayOfWeek dayOfWeek(int index) {
        int normalized = Math.floorMod(index, 7);
        return DayOfWeek.of(normalized == 0 ? 7 : normalized);
    }

    public static LocalDate weekStart(LocalDate date) {
        return date.minusDays(index(date.getDayOfWeek()));
    }
}
