package com.initialone.jgiv.git;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

public final class CommitMetadata {
    /** git show format matching {@link #parse}: fields separated by NUL, body last. */
    static final String SHOW_FORMAT = "%H%x00%h%x00%an%x00%cI%x00%B";

    public final String id;
    public final String shortId;
    public final String author;
    public final OffsetDateTime date;
    public final String message;

    public CommitMetadata(String id, String shortId, String author, OffsetDateTime date, String message) {
        this.id = id;
        this.shortId = shortId;
        this.author = author;
        this.date = date;
        this.message = message;
    }

    /** Parses one record of {@link #SHOW_FORMAT} output; returns null on malformed input. */
    static CommitMetadata parse(String raw) {
        if (raw == null) return null;
        String[] f = raw.split("\u0000", 5);
        if (f.length < 5 || f[0].isBlank()) return null;
        OffsetDateTime date;
        try {
            date = OffsetDateTime.parse(f[3].trim());
        } catch (DateTimeParseException e) {
            date = null;
        }
        return new CommitMetadata(f[0].trim(), f[1].trim(), f[2].trim(), date, f[4].strip());
    }
}
