package dev.univer.reminder.parser;

public record ParseFailure(Reason reason, String message) {

    public enum Reason {
        NO_SCHEDULE("I couldn't find a schedule in that. Try \"remind me every Tuesday at 9am to ...\" or \"remind me in 5 minutes to ...\"."),
        MISSING_MESSAGE("Got the schedule, but what should I remind you about?"),
        NOT_A_REMINDER("Start with \"remind me\", \"remind team\", \"remind here\" or \"remind room\"."),
        INVALID_TIME("That time doesn't look right. Use H, H:MM or HhMM, optionally with am/pm.");

        private final String defaultMessage;

        Reason(String defaultMessage) {
            this.defaultMessage = defaultMessage;
        }
    }

    public static ParseFailure of(Reason reason) {
        return new ParseFailure(reason, reason.defaultMessage);
    }

    public static ParseFailure invalidTime(String rawTime) {
        return new ParseFailure(Reason.INVALID_TIME, "\"" + rawTime + "\" is not a valid time. Use H, H:MM or HhMM, optionally with am/pm.");
    }
}
