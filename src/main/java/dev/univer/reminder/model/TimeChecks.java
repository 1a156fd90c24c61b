package dev.univer.reminder.model;

final class TimeChecks {
    private TimeChecks() {}

    static int hour(int hour) {
        if (hour < 0 || hour > 23) throw new IllegalArgumentException("Hour out of range: " + hour);
        return hour;
    }

    static int minute(int minute) {
        if (minute < 0 || minute > 59) throw new IllegalArgumentException("Minute out of range: " + minute);
        return minute;
    }
}
