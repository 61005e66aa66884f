package com.initialone.jgiv.model;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * One change set: a real commit, or the synthetic working-tree / staged
 * pseudo-commit. Synthetic commits never reach the cache.
 */
public final class Commit {
    public static final String WORKING_TREE_ID = "working-tree";
    public static final String STAGED_ID = "staged";

    public final String id;
    public final String shortId;
    public final String author;
    public final OffsetDateTime timestamp;
    public final String message;
    /** Diff against the logical predecessor. */
    public final String diff;
    public final boolean synthetic;

    private Commit(String id, String shortId, String author, OffsetDateTime timestamp,
                   String message, String diff, boolean synthetic) {
        this.id = Objects.requireNonNull(id, "id");
        this.shortId = shortId == null || shortId.isBlank() ? id : shortId;
        this.author = author == null ? "" : author;
        this.timestamp = timestamp;
        this.message = message == null ? "" : message;
        this.diff = diff == null ? "" : diff;
        this.synthetic = synthetic;
    }

    public static Commit real(String id, String shortId, String author, OffsetDateTime timestamp,
                              String message, String diff) {
        return new Commit(id, shortId, author, timestamp, message, diff, false);
    }

    public static Commit synthetic(String id, String message, String diff) {
        return new Commit(id, id, "", OffsetDateTime.now(), message, diff, true);
    }

    /** yyyy-MM-dd, or empty when the timestamp is unknown. */
    public String date() {
        return timestamp == null ? "" : timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    /** First line of the message. */
    public String subject() {
        int nl = message.indexOf('\n');
        return (nl < 0 ? message : message.substring(0, nl)).trim();
    }

    @Override
    public String toString() {
        return synthetic ? id : shortId + " " + subject();
    }
}
