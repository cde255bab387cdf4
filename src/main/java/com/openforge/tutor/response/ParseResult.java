package com.openforge.tutor.response;

import java.util.function.Supplier;

/**
 * Tagged outcome of a best-effort parse: either a value or the reason the
 * attempt failed.  Parsers return this instead of throwing so that callers
 * can chain fallback strategies and stop at the first success.
 */
public record ParseResult<T>(T value, String error, String strategy) {

    public static <T> ParseResult<T> ok(T value, String strategy) {
        return new ParseResult<>(value, null, strategy);
    }

    public static <T> ParseResult<T> err(String error) {
        return new ParseResult<>(null, error, null);
    }

    public boolean isOk() {
        return error == null;
    }

    /** Returns this result when ok, otherwise the result of the next strategy. */
    public ParseResult<T> orElseTry(Supplier<ParseResult<T>> next) {
        return isOk() ? this : next.get();
    }
}
