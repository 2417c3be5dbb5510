package com.example.intent.llm;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of decoding a model response: either a value or a {@link ParseError}, never both.
 */
public final class ParseResult<T> {

    private final T value;
    private final ParseError error;

    private ParseResult(T value, ParseError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ParseResult<T> ok(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ParseResult<T> error(ParseError error) {
        return new ParseResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value: " + error.reason());
        }
        return value;
    }

    public ParseError error() {
        if (error == null) {
            throw new IllegalStateException("Result holds a value");
        }
        return error;
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
        return error == null ? ParseResult.ok(mapper.apply(value)) : ParseResult.error(error);
    }

    @Override
    public String toString() {
        return error == null ? "Ok[" + value + "]" : "Error[" + error.reason() + "]";
    }
}
