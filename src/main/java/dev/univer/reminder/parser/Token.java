package dev.univer.reminder.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

record Token(String raw, String word, int start, int end) {

    private static final Pattern WORD = Pattern.compile("\\S+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[,.;:!?]+$");

    boolean endsWithComma() {
        return raw.endsWith(",");
    }

    static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            String raw = m.group();
            String word = TRAILING_PUNCTUATION.matcher(raw).replaceAll("").toLowerCase(Locale.ROOT);
            tokens.add(new Token(raw, word, m.start(), m.end()));
        }
        return tokens;
    }
}
