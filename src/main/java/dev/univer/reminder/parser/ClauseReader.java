package dev.univer.reminder.parser;

import dev.univer.reminder.util.ParseUtil;

import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent reader for schedule clauses:
 * <pre>
 * clause   := 'in' amount unit [['on'] weekdays] [time]
 *           | ('on' | 'next') weekdays [time]
 *           | 'every' [interval] target [time]
 *           | time
 * weekdays := weekday ((',' | 'and' | '&amp;') weekday)*
 * target   := weekdays | 'day' ['of' the month] | 'of' the month | ε
 * time     := 'at' (H | H:MM | HhMM) [am | pm]
 * </pre>
 * Every {@code read*} method either consumes its production and returns a
 * value, or leaves the cursor where it was and returns null.
 */
final class ClauseReader {

    private static final Set<String> KEYWORDS = Set.of("in", "on", "next", "every");

    private static final Map<String, ChronoUnit> UNITS = Map.ofEntries(
            Map.entry("min", ChronoUnit.MINUTES), Map.entry("mins", ChronoUnit.MINUTES),
            Map.entry("minute", ChronoUnit.MINUTES), Map.entry("minutes", ChronoUnit.MINUTES),
            Map.entry("hour", ChronoUnit.HOURS), Map.entry("hours", ChronoUnit.HOURS),
            Map.entry("day", ChronoUnit.DAYS), Map.entry("days", ChronoUnit.DAYS),
            Map.entry("week", ChronoUnit.WEEKS), Map.entry("weeks", ChronoUnit.WEEKS));

    // units that make "every N <unit>" something we don't schedule
    private static final Set<String> UNSUPPORTED_EVERY_UNITS = Set.of(
            "min", "mins", "minute", "minutes", "hour", "hours", "days", "week", "weeks", "month", "months");

    private static final Pattern TIME = Pattern.compile("^(?<h>\\d{1,2})(?:[:h.](?<m>\\d{2}))?(?<ampm>am|pm)?$");

    private static final List<Integer> WORKDAYS = List.of(1, 2, 3, 4, 5);
    private static final List<Integer> WEEKEND = List.of(0, 6);
    private static final List<Integer> ALL_DAYS = List.of(0, 1, 2, 3, 4, 5, 6);

    private final List<Token> tokens;
    private int pos;

    ClauseReader(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * The first keyword clause, left to right; failing that, the first bare
     * "at &lt;time&gt;". Null when the text has no schedule.
     *
     * @throws InvalidTimeException when a clause carries an impossible time
     */
    ScheduleClause find() {
        for (int i = 0; i < tokens.size(); i++) {
            if (!KEYWORDS.contains(tokens.get(i).word())) continue;
            pos = i;
            ScheduleClause clause = readKeywordClause();
            if (clause != null) return withLeadingTime(clause, i);
        }
        for (int i = 0; i < tokens.size(); i++) {
            if (!"at".equals(tokens.get(i).word())) continue;
            pos = i;
            LocalTime time = readTime();
            if (time != null) {
                return ScheduleClause.builder()
                        .kind(ScheduleClause.Kind.AT)
                        .time(time)
                        .start(tokens.get(i).start())
                        .end(lastConsumedEnd())
                        .build();
            }
        }
        return null;
    }

    private ScheduleClause readKeywordClause() {
        Token keyword = tokens.get(pos++);
        ScheduleClause clause = switch (keyword.word()) {
            case "in" -> readOffset();
            case "on", "next" -> readOn();
            case "every" -> readEvery();
            default -> null;
        };
        if (clause == null) return null;
        LocalTime time = readTime();
        return clause.withTime(time).withStart(keyword.start()).withEnd(lastConsumedEnd());
    }

    private ScheduleClause readOffset() {
        Integer amount = ParseUtil.parseAmount(peekWord());
        if (amount == null) return null;
        pos++;
        ChronoUnit unit = UNITS.get(peekWord());
        if (unit == null) return null;
        pos++;

        int mark = pos;
        if ("on".equals(peekWord())) pos++;
        List<Integer> days = readWeekdays();
        if (days == null) pos = mark;

        return ScheduleClause.builder()
                .kind(ScheduleClause.Kind.OFFSET)
                .amount(amount)
                .unit(unit)
                .days(days)
                .build();
    }

    private ScheduleClause readOn() {
        List<Integer> days = readWeekdays();
        if (days == null) return null;
        return ScheduleClause.builder().kind(ScheduleClause.Kind.ON).days(days).build();
    }

    private ScheduleClause readEvery() {
        String intervalWord = peekWord();
        Integer interval = ParseUtil.normalizeInterval(intervalWord);
        boolean numeric = ParseUtil.isNumeric(intervalWord);
        if (interval != null) pos++;

        List<Integer> days = readWeekdays();
        if (days != null) {
            int weeks = interval == null ? 1 : interval;
            if (weeks < 1) return null;
            return ScheduleClause.builder().kind(ScheduleClause.Kind.EVERY_WEEK).days(days).interval(weeks).build();
        }

        if (interval == null) {
            if (!"day".equals(peekWord())) return null;
            pos++;
            return ScheduleClause.builder().kind(ScheduleClause.Kind.EVERY_WEEK).days(ALL_DAYS).interval(1).build();
        }

        // "every other" / "every second" only make sense with a weekday
        if (!numeric || interval < 1 || interval > 31) return null;
        if (UNSUPPORTED_EVERY_UNITS.contains(peekWord())) return null;
        if (!readMonthSuffix()) return null;
        return ScheduleClause.builder().kind(ScheduleClause.Kind.EVERY_MONTH).dayOfMonth(interval).build();
    }

    /**
     * Optional "of the month", "of each month", or "day" followed by one of
     * them. A bare "day" ("every 2 day") is rejected.
     */
    private boolean readMonthSuffix() {
        int mark = pos;
        boolean day = "day".equals(peekWord());
        if (day) pos++;
        if ("of".equals(peekWord())) {
            pos++;
            String article = peekWord();
            if ("the".equals(article) || "each".equals(article) || "every".equals(article)) pos++;
            if ("month".equals(peekWord())) {
                pos++;
                return true;
            }
        }
        pos = mark;
        return !day;
    }

    private List<Integer> readWeekdays() {
        List<Integer> first = readWeekday();
        if (first == null) return null;
        List<Integer> days = new ArrayList<>(first);
        while (pos < tokens.size()) {
            int mark = pos;
            boolean separated = tokens.get(pos - 1).endsWithComma();
            String word = peekWord();
            if ("and".equals(word) || "&".equals(word)) {
                pos++;
                separated = true;
            }
            if (!separated) break;
            List<Integer> more = readWeekday();
            if (more == null) {
                pos = mark;
                break;
            }
            days.addAll(more);
        }
        return days.stream().distinct().sorted().toList();
    }

    private List<Integer> readWeekday() {
        String word = peekWord();
        if (word == null) return null;
        List<Integer> days;
        if (word.equals("weekday") || word.equals("weekdays")) {
            days = WORKDAYS;
        } else if (word.equals("weekend") || word.equals("weekends")) {
            days = WEEKEND;
        } else if (ParseUtil.isWeekdayWord(word)) {
            days = List.of(ParseUtil.normalizeDayOfWeek(word));
        } else {
            return null;
        }
        pos++;
        return days;
    }

    private LocalTime readTime() {
        if (!"at".equals(peekWord())) return null;
        int mark = pos;
        pos++;
        Token token = pos < tokens.size() ? tokens.get(pos) : null;
        if (token == null) {
            pos = mark;
            return null;
        }
        String word = token.word();
        if (word.equals("noon")) {
            pos++;
            return LocalTime.NOON;
        }
        if (word.equals("midnight")) {
            pos++;
            return LocalTime.MIDNIGHT;
        }
        Matcher m = TIME.matcher(word);
        if (!m.matches()) {
            pos = mark;
            return null;
        }
        pos++;
        String ampm = m.group("ampm");
        if (ampm == null && ("am".equals(peekWord()) || "pm".equals(peekWord()))) {
            ampm = peekWord();
            pos++;
        }

        int hour = Integer.parseInt(m.group("h"));
        int minute = m.group("m") == null ? 0 : Integer.parseInt(m.group("m"));
        if ("pm".equals(ampm) && hour < 12) hour += 12;
        if ("am".equals(ampm) && hour == 12) hour = 0;
        if (hour > 23 || minute > 59) throw new InvalidTimeException(token.raw());
        return LocalTime.of(hour, minute);
    }

    private ScheduleClause withLeadingTime(ScheduleClause clause, int keywordIndex) {
        if (clause.getTime() != null) return clause;
        for (int back = 2; back <= 3; back++) {
            int at = keywordIndex - back;
            if (at < 0 || !"at".equals(tokens.get(at).word())) continue;
            pos = at;
            LocalTime time = readTime();
            if (time != null && pos == keywordIndex) {
                return clause.withTime(time).withStart(tokens.get(at).start());
            }
        }
        return clause;
    }

    private String peekWord() {
        return pos < tokens.size() ? tokens.get(pos).word() : null;
    }

    private int lastConsumedEnd() {
        return tokens.get(pos - 1).end();
    }

    static final class InvalidTimeException extends RuntimeException {
        InvalidTimeException(String rawTime) {
            super(rawTime);
        }
    }
}
