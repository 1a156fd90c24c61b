package dev.univer.reminder.model;

import java.util.Locale;

public enum Audience {
    ME,
    TEAM,
    HERE,
    ROOM;

    public static Audience fromWord(String word) {
        return valueOf(word.trim().toUpperCase(Locale.ROOT));
    }
}
