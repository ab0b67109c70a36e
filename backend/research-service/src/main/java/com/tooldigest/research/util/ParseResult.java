package com.tooldigest.research.util;

/**
 * Outcome of parsing model output: either a value or the reason it could not be parsed.
 */
public final class ParseResult<T> {

    private final T value;
    private final String error;

    private ParseResult(T value, String error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ParseResult<T> success(T value) {
        return new ParseResult<>(value, null);
    }

    public static <T> ParseResult<T> failure(String error) {
        return new ParseResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value: " + error);
        }
        return value;
    }

    public String getError() {
        return error;
    }
}
