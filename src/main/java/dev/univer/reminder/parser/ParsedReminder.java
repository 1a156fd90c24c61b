package dev.univer.reminder.parser;

import dev.univer.reminder.model.Audience;
import lombok.Value;

@Value
public class ParsedReminder {
    ParsedSpec schedule;
    Audience audience;
    String message;
}
