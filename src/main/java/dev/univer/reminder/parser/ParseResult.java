package dev.univer.reminder.parser;

import java.util.Objects;
import java.util.function.Function;

public final class ParseResult<T> {
    private final T value;
    private final ParseFailure failure;

    private ParseResult(T value, ParseFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> ParseResult<T> success(T value) {
        return new ParseResult<>(Objects.requireNonNull(value), null);
    }

    public static <T> ParseResult<T> failure(ParseFailure failure) {
        return new ParseResult<>(null, Objects.requireNonNull(failure));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public T getValue() {
        if (failure != null) throw new IllegalStateException("No value: " + failure.message());
        return value;
    }

    public ParseFailure getFailure() {
        if (failure == null) throw new IllegalStateException("Parse succeeded");
        return failure;
    }

    public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(failure);
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult[" + value + "]" : "ParseResult[" + failure + "]";
    }
}
