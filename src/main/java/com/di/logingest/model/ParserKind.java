package com.di.logingest.model;

import com.di.logingest.exception.UnsupportedSourceException;

import java.util.Locale;

/**
 * How the bytes of a source object are split into raw records.
 */
public enum ParserKind {

    /** Sequence of concatenated JSON values (JSON Lines included). */
    JSON("json");

    private final String value;

    ParserKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ParserKind of(String value) {
        if (value == null || value.isBlank()) {
            throw new UnsupportedSourceException("Parser kind is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ParserKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        throw new UnsupportedSourceException("Unsupported parser kind: '" + value + "'");
    }
}
