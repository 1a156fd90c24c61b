package dev.univer.reminder.format;

import dev.univer.reminder.model.Job;
import dev.univer.reminder.model.JobMessageInfo;
import dev.univer.reminder.model.MonthlyDefinition;
import dev.univer.reminder.model.RecurrenceDefinition;
import dev.univer.reminder.model.WeeklyDefinition;
import dev.univer.reminder.model.Weekdays;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class JobFormatter {

    private static final ZoneId DEFAULT_ZONE = ZoneId.of("UTC");
    private static final DateTimeFormatter NEXT_FMT = DateTimeFormatter.ofPattern("EEE, MMM d, yyyy h:mm a z", Locale.ENGLISH);
    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ofPattern("HH:mm", Locale.ENGLISH);
    private static final List<Integer> WORKDAYS = List.of(1, 2, 3, 4, 5);
    private static final List<Integer> ALL_DAYS = List.of(0, 1, 2, 3, 4, 5, 6);

    // applied in order; keeps listings from pinging people or tags
    private static final Map<String, String> ESCAPES = new LinkedHashMap<>();
    static {
        ESCAPES.put("(@@?)", "[$1]");
        ESCAPES.put("```", "\n```\n");
        ESCAPES.put("#", "[#]");
        ESCAPES.put("\n", "\n>");
    }

    public String format(Job job, ZoneId zone) {
        ZoneId z = zone == null ? DEFAULT_ZONE : zone;
        JobMessageInfo info = job.getMessageInfo();

        StringBuilder sb = new StringBuilder();
        sb.append("ID ").append(job.getId()).append(": ");
        sb.append(NEXT_FMT.format(job.getNext().atZone(z)));
        if (job.isRecurring()) {
            sb.append(" (").append(describeRecurrence(job, z)).append(')');
        }
        sb.append(' ').append(target(info)).append(":\n>").append(escape(info.getMessage()));
        return sb.toString();
    }

    public String formatList(List<Job> jobs, ZoneId zone) {
        return jobs.stream().map(j -> format(j, zone)).collect(Collectors.joining("\n\n"));
    }

    String describeRecurrence(Job job, ZoneId zone) {
        RecurrenceDefinition spec = job.getSpec();
        if (spec instanceof WeeklyDefinition weekly) return describeWeekly(job, weekly, zone);
        if (spec instanceof MonthlyDefinition monthly) return describeMonthly(job, monthly, zone);
        throw new IllegalArgumentException("Not a recurring definition: " + spec);
    }

    private String describeWeekly(Job job, WeeklyDefinition spec, ZoneId zone) {
        // anchor on the week of the next run so DST matches what the user will see
        LocalDate weekStart = Weekdays.weekStart(job.getNext().atZone(ZoneOffset.UTC).toLocalDate());
        List<Integer> localDays = new ArrayList<>();
        ZonedDateTime local = null;
        for (int day : spec.getDaysOfWeek()) {
            local = weekStart.plusDays(day).atTime(spec.getHour(), spec.getMinute()).atZone(ZoneOffset.UTC).withZoneSameInstant(zone);
            localDays.add(Weekdays.index(local.getDayOfWeek()));
        }
        List<Integer> days = localDays.stream().distinct().sorted().toList();
        String time = TIME_FMT.format(local);

        String every = spec.getInterval() == 1 ? "weekly" : "every " + spec.getInterval() + " weeks";
        if (days.equals(ALL_DAYS)) {
            return spec.getInterval() == 1 ? "recurs daily at " + time : "recurs every day, " + every + ", at " + time;
        }
        String on = days.equals(WORKDAYS) ? "weekdays" : joinDayNames(days);
        return "recurs " + every + " on " + on + " at " + time;
    }

    private String describeMonthly(Job job, MonthlyDefinition spec, ZoneId zone) {
        YearMonth month = YearMonth.from(job.getNext().atZone(ZoneOffset.UTC));
        LocalDate anchor = month.atDay(Math.min(spec.getDayOfMonth(), month.lengthOfMonth()));
        ZonedDateTime local = anchor.atTime(spec.getHour(), spec.getMinute()).atZone(ZoneOffset.UTC).withZoneSameInstant(zone);
        int day = spec.getDayOfMonth() + (int) ChronoUnit.DAYS.between(anchor, local.toLocalDate());
        String on;
        if (day < 1) on = "the last day";
        else if (day > 31) on = "the 1st";
        else on = "the " + ordinal(day);
        return "recurs monthly on " + on + " at " + TIME_FMT.format(local);
    }

    private static String target(JobMessageInfo info) {
        if (info.getThreadId() == null) return "(to " + info.getRoom() + ")";
        return "(to thread " + info.getThreadId() + " in " + info.getRoom() + ")";
    }

    static String escape(String message) {
        String result = message;
        for (Map.Entry<String, String> e : ESCAPES.entrySet()) {
            result = result.replaceAll(e.getKey(), e.getValue());
        }
        return result;
    }

    private static String joinDayNames(List<Integer> days) {
        List<String> names = days.stream()
                .map(d -> Weekdays.dayOfWeek(d).getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                .toList();
        if (names.size() == 1) return names.get(0);
        return String.join(", ", names.subList(0, names.size() - 1)) + " and " + names.get(names.size() - 1);
    }

    static String ordinal(int n) {
        if (n % 100 >= 11 && n % 100 <= 13) return n + "th";
        return switch (n % 10) {
            case 1 -> n + "st";
            case 2 -> n + "nd";
            case 3 -> n + "rd";
            default -> n + "th";
        };
    }
}
