package com.di.logingest.model;

import com.di.logingest.exception.UnsupportedSourceException;

import java.util.Locale;

/**
 * Compression applied to a source object.
 */
public enum CompressionKind {

    NONE(""),
    GZIP("gzip");

    private final String value;

    CompressionKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** A blank value means "not compressed". */
    public static CompressionKind of(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CompressionKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        throw new UnsupportedSourceException("Unsupported compression kind: '" + value + "'");
    }
}
