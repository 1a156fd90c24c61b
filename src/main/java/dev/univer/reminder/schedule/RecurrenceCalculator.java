package dev.univer.reminder.schedule;

import dev.univer.reminder.model.MonthlyDefinition;
import dev.univer.reminder.model.RecurrenceDefinition;
import dev.univer.reminder.model.SingleShotDefinition;
import dev.univer.reminder.model.WeeklyDefinition;
import dev.univer.reminder.model.Weekdays;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Next-occurrence arithmetic, in UTC only. Weeks start on Sunday.
 * The result is always strictly after the previous occurrence and has no
 * seconds.
 */
public final class RecurrenceCalculator {

    private RecurrenceCalculator() {}

    public static String nextOccurrence(String previousIso, RecurrenceDefinition spec) {
        return nextOccurrence(Instant.parse(previousIso), spec).toString();
    }

    public static Instant nextOccurrence(Instant previous, RecurrenceDefinition spec) {
        ZonedDateTime prev = previous.atZone(ZoneOffset.UTC);
        ZonedDateTime next;
        if (spec instanceof MonthlyDefinition monthly) {
            next = nextMonthly(prev, monthly);
        } else if (spec instanceof WeeklyDefinition weekly) {
            next = nextWeekly(prev, weekly.getDaysOfWeek(), weekly.getInterval(), weekly.getHour(), weekly.getMinute());
        } else if (spec instanceof SingleShotDefinition single) {
            // a single shot resolves like a weekly recurrence with interval 1
            List<Integer> days = single.getDaysOfWeek().stream().map(d -> d < 0 ? d + 7 : d).sorted().toList();
            next = nextWeekly(prev, days, 1, single.getHour(), single.getMinute());
        } else {
            throw new IllegalArgumentException("Unsupported recurrence definition: " + spec);
        }
        return next.toInstant();
    }

    /**
     * Advances {@code next} until it is after {@code now}. Any occurrences
     * missed in between are skipped: a job that was due several times fires
     * once.
     */
    public static Instant nextOccurrenceAfter(Instant next, RecurrenceDefinition spec, Instant now) {
        Instant candidate = next;
        while (!candidate.isAfter(now)) {
            candidate = nextOccurrence(candidate, spec);
        }
        return candidate;
    }

    private static ZonedDateTime nextMonthly(ZonedDateTime prev, MonthlyDefinition spec) {
        YearMonth month = YearMonth.from(prev);
        ZonedDateTime candidate = monthlyCandidate(month, spec);
        if (!candidate.isAfter(prev)) {
            candidate = monthlyCandidate(month.plusMonths(1), spec);
        }
        return candidate;
    }

    // days past the end of the month clamp to its last day
    private static ZonedDateTime monthlyCandidate(YearMonth month, MonthlyDefinition spec) {
        int day = Math.min(spec.getDayOfMonth(), month.lengthOfMonth());
        return month.atDay(day).atTime(spec.getHour(), spec.getMinute()).atZone(ZoneOffset.UTC);
    }

    private static ZonedDateTime nextWeekly(ZonedDateTime prev, List<Integer> days, int interval, int hour, int minute) {
        List<Integer> sorted = days.stream().sorted().toList();
        LocalDate weekStart = Weekdays.weekStart(prev.toLocalDate());
        for (int day : sorted) {
            ZonedDateTime candidate = weekStart.plusDays(day).atTime(hour, minute).atZone(ZoneOffset.UTC);
            if (candidate.isAfter(prev)) return candidate;
        }
        return weekStart.plusWeeks(interval).plusDays(sorted.get(0)).atTime(hour, minute).atZone(ZoneOffset.UTC);
    }
}
