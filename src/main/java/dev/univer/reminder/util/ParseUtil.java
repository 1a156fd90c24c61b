package dev.univer.reminder.util;

import dev.univer.reminder.model.Audience;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ParseUtil {
    // "remind me|team|here|room [to] <message>", anywhere in the text
    private static final Pattern REMINDER_LINE = Pattern.compile(
            "\\bremind\\s+(?<who>me|team|here|room)\\b\\s*(?:to(?:\\s+|$))?(?<message>.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    // "2", "2nd", "21st", "3rd", "5th"
    private static final Pattern ORDINAL = Pattern.compile("^(?<n>\\d{1,2})(?:st|nd|rd|th)?$");

    private static final Map<String, Integer> INTERVAL_WORDS = Map.of(
            "other", 2,
            "second", 2,
            "third", 3,
            "fourth", 4,
            "fifth", 5);

    private static final Map<String, Integer> NUMBER_WORDS = Map.ofEntries(
            Map.entry("a", 1), Map.entry("an", 1), Map.entry("one", 1),
            Map.entry("two", 2), Map.entry("three", 3), Map.entry("four", 4),
            Map.entry("five", 5), Map.entry("six", 6), Map.entry("seven", 7),
            Map.entry("eight", 8), Map.entry("nine", 9), Map.entry("ten", 10));

    private static final List<String> WEEKDAY_NAMES = List.of(
            "sunday", "monday", "tuesday", "wednesday", "thursday", "friday", "saturday");

    public static class ReminderLine {
        public final Audience audience;
        public final String message; // never null, may be empty
        public ReminderLine(Audience audience, String message) {
            this.audience = audience;
            this.message = message == null ? "" : message.trim();
        }
    }

    public static ReminderLine parseReminderLine(String text) {
        if (text == null) return null;
        Matcher m = REMINDER_LINE.matcher(text);
        if (!m.find()) return null;
        return new ReminderLine(Audience.fromWord(m.group("who")), m.group("message"));
    }

    public static boolean isWeekdayWord(String word) {
        if (word == null || word.isEmpty()) return false;
        String w = word.toLowerCase(Locale.ROOT);
        for (String name : WEEKDAY_NAMES) {
            if (name.startsWith(w)) return true;
        }
        return w.endsWith("s") && WEEKDAY_NAMES.contains(w.substring(0, w.length() - 1));
    }

    /**
     * Maps a weekday word to Sunday-based numbering. Prefixes that the table
     * does not resolve ("t", "s") fall back to Sunday.
     */
    public static int normalizeDayOfWeek(String word) {
        String w = word.toLowerCase(Locale.ROOT);
        if (w.startsWith("m")) return 1;
        if (w.startsWith("tu")) return 2;
        if (w.startsWith("w")) return 3;
        if (w.startsWith("th")) return 4;
        if (w.startsWith("f")) return 5;
        if (w.startsWith("sa")) return 6;
        return 0;
    }

    public static Integer normalizeInterval(String word) {
        if (word == null) return null;
        String w = word.toLowerCase(Locale.ROOT);
        Integer named = INTERVAL_WORDS.get(w);
        if (named != null) return named;
        Matcher m = ORDINAL.matcher(w);
        return m.matches() ? Integer.valueOf(m.group("n")) : null;
    }

    public static boolean isNumeric(String word) {
        return word != null && ORDINAL.matcher(word.toLowerCase(Locale.ROOT)).matches();
    }

    public static Integer parseAmount(String word) {
        if (word == null) return null;
        String w = word.toLowerCase(Locale.ROOT);
        Integer named = NUMBER_WORDS.get(w);
        if (named != null) return named;
        if (!w.matches("\\d{1,4}")) return null;
        int n = Integer.parseInt(w);
        return n > 0 ? n : null;
    }
}
