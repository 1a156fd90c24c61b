package dev.univer.reminder.parser;

import dev.univer.reminder.model.MonthlyDefinition;
import dev.univer.reminder.model.RecurrenceDefinition;
import dev.univer.reminder.model.SingleShotDefinition;
import dev.univer.reminder.model.WeeklyDefinition;
import dev.univer.reminder.model.Weekdays;
import dev.univer.reminder.util.ParseUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns free text such as "remind me every 2nd Tuesday at 16:33 to ship" into a
 * {@link RecurrenceDefinition} and the remaining message.
 * <p>
 * Wall-clock arithmetic happens in the caller's zone (the JVM default when
 * none is given); the stored hour, minute and weekdays are converted to UTC.
 * When that conversion moves the calendar day, weekdays move with it so the
 * definition still means the user's local day.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpecParser {

    private final Clock clock;

    public ParseResult<ParsedReminder> parse(String text, ZoneId zone) {
        ParseResult<ParsedSpec> spec = parseSpec(text, zone);
        if (!spec.isSuccess()) return ParseResult.failure(spec.getFailure());

        ParsedSpec parsed = spec.getValue();
        String residual = (text.substring(0, parsed.getStart()).stripTrailing() + " "
                           + text.substring(parsed.getEnd()).stripLeading()).strip();
        ParseUtil.ReminderLine line = ParseUtil.parseReminderLine(residual);
        if (line == null) return ParseResult.failure(ParseFailure.of(ParseFailure.Reason.NOT_A_REMINDER));
        if (line.message.isEmpty()) return ParseResult.failure(ParseFailure.of(ParseFailure.Reason.MISSING_MESSAGE));
        return ParseResult.success(new ParsedReminder(parsed, line.audience, line.message));
    }

    public ParseResult<ParsedSpec> parseSpec(String text, ZoneId zone) {
        if (text == null || text.isBlank()) return ParseResult.failure(ParseFailure.of(ParseFailure.Reason.NO_SCHEDULE));
        ZoneId userZone = zone == null ? ZoneId.systemDefault() : zone;

        ScheduleClause clause;
        try {
            clause = new ClauseReader(Token.tokenize(text)).find();
        } catch (ClauseReader.InvalidTimeException e) {
            return ParseResult.failure(ParseFailure.invalidTime(e.getMessage()));
        }
        if (clause == null) {
            log.debug("No schedule clause in \"{}\"", text);
            return ParseResult.failure(ParseFailure.of(ParseFailure.Reason.NO_SCHEDULE));
        }

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(userZone));
        RecurrenceDefinition definition = resolve(clause, now);
        return ParseResult.success(new ParsedSpec(definition, clause.getStart(), clause.getEnd(), now.toInstant()));
    }

    private RecurrenceDefinition resolve(ScheduleClause clause, ZonedDateTime now) {
        return switch (clause.getKind()) {
            case OFFSET -> resolveOffset(clause, now);
            case ON -> {
                ShiftedDays shifted = shiftWeekdays(clause.getDays(), orMidnight(clause.getTime()), now);
                yield new SingleShotDefinition(shifted.days(), shifted.time().getHour(), shifted.time().getMinute());
            }
            case EVERY_WEEK -> {
                ShiftedDays shifted = shiftWeekdays(clause.getDays(), orMidnight(clause.getTime()), now);
                yield new WeeklyDefinition(shifted.days(), clause.getInterval(), shifted.time().getHour(), shifted.time().getMinute());
            }
            case EVERY_MONTH -> resolveMonthly(clause.getDayOfMonth(), orMidnight(clause.getTime()), now);
            case AT -> {
                ZonedDateTime target = now.with(clause.getTime());
                if (!target.isAfter(now)) target = target.plusDays(1);
                yield singleShotAt(List.of(target), now);
            }
        };
    }

    private RecurrenceDefinition resolveOffset(ScheduleClause clause, ZonedDateTime now) {
        if (clause.getDays() == null) {
            ZonedDateTime target = now.plus(clause.getAmount(), clause.getUnit()).truncatedTo(ChronoUnit.MINUTES);
            if (clause.getTime() != null) {
                target = target.with(clause.getTime());
                if (!target.isAfter(now)) target = target.plusDays(1);
            }
            return singleShotAt(List.of(target), now);
        }
        // "in 2 weeks on Monday": the offset is added to that weekday of the current week
        LocalDate weekStart = Weekdays.weekStart(now.toLocalDate());
        LocalTime time = orMidnight(clause.getTime());
        List<ZonedDateTime> targets = new ArrayList<>();
        for (int day : clause.getDays()) {
            targets.add(ZonedDateTime.of(weekStart.plusDays(day), time, now.getZone())
                    .plus(clause.getAmount(), clause.getUnit()));
        }
        return singleShotAt(targets, now);
    }

    /**
     * Single shot for exact target times: days are counted from the start of
     * the current UTC week, so values past 6 mean a later week.
     */
    private SingleShotDefinition singleShotAt(List<ZonedDateTime> targets, ZonedDateTime now) {
        LocalDate utcWeekStart = Weekdays.weekStart(now.withZoneSameInstant(ZoneOffset.UTC).toLocalDate());
        List<Integer> days = new ArrayList<>();
        LocalTime time = null;
        for (ZonedDateTime target : targets) {
            ZonedDateTime utc = target.withZoneSameInstant(ZoneOffset.UTC);
            days.add((int) ChronoUnit.DAYS.between(utcWeekStart, utc.toLocalDate()));
            if (time == null) time = utc.toLocalTime();
        }
        return new SingleShotDefinition(days.stream().distinct().sorted().toList(), time.getHour(), time.getMinute());
    }

    private ShiftedDays shiftWeekdays(List<Integer> localDays, LocalTime localTime, ZonedDateTime now) {
        List<Integer> days = new ArrayList<>();
        LocalTime utcTime = null;
        for (int day : localDays) {
            LocalDate date = now.toLocalDate().with(TemporalAdjusters.nextOrSame(Weekdays.dayOfWeek(day)));
            ZonedDateTime utc = ZonedDateTime.of(date, localTime, now.getZone()).withZoneSameInstant(ZoneOffset.UTC);
            long delta = ChronoUnit.DAYS.between(date, utc.toLocalDate());
            days.add((int) Math.floorMod(day + delta, 7L));
            if (utcTime == null) utcTime = utc.toLocalTime();
        }
        return new ShiftedDays(days.stream().distinct().sorted().toList(), utcTime);
    }

    private MonthlyDefinition resolveMonthly(int dayOfMonth, LocalTime localTime, ZonedDateTime now) {
        LocalDate anchor = now.toLocalDate().withDayOfMonth(Math.min(dayOfMonth, now.toLocalDate().lengthOfMonth()));
        ZonedDateTime utc = ZonedDateTime.of(anchor, localTime, now.getZone()).withZoneSameInstant(ZoneOffset.UTC);
        long delta = ChronoUnit.DAYS.between(anchor, utc.toLocalDate());
        int utcDay = (int) (dayOfMonth + delta);
        // 0 is the last day of the previous month, which the calculator reaches by clamping 31
        if (utcDay < 1) utcDay = 31;
        if (utcDay > 31) utcDay = 1;
        return new MonthlyDefinition(utcDay, utc.getHour(), utc.getMinute());
    }

    private static LocalTime orMidnight(LocalTime time) {
        return time == null ? LocalTime.MIDNIGHT : time;
    }

    private record ShiftedDays(List<Integer> days, LocalTime time) {}
}
