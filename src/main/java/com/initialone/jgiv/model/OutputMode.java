package com.initialone.jgiv.model;

import java.util.Locale;

public enum OutputMode {
    AUTO, PREPEND, APPEND, UPDATE, OVERWRITE, NONE;

    /** Case-insensitive lookup; throws IllegalArgumentException on unknown names. */
    public static OutputMode parse(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("empty output mode");
        return OutputMode.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
