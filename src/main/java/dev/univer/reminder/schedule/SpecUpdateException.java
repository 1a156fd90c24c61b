package dev.univer.reminder.schedule;

import dev.univer.reminder.parser.ParseFailure;
import lombok.Getter;

@Getter
public class SpecUpdateException extends RuntimeException {
    private final long jobId;
    private final ParseFailure failure;

    public SpecUpdateException(long jobId, ParseFailure failure) {
        super("Could not parse recurrence spec for job " + jobId + ": " + failure.message());
        this.jobId = jobId;
        this.failure = failure;
    }
}
