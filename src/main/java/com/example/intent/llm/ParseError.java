package com.example.intent.llm;

/**
 * Why a model response could not be decoded. {@code raw} is the response as received,
 * truncated for logging.
 */
public record ParseError(String reason, String raw) {

    private static final int MAX_RAW = 200;

    public static ParseError of(String reason, String raw) {
        String clipped = raw == null ? "" : raw.length() > MAX_RAW ? raw.substring(0, MAX_RAW) + "..." : raw;
        return new ParseError(reason, clipped);
    }
}
