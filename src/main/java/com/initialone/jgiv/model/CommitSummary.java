package com.initialone.jgiv.model;

/** A commit paired with its (possibly cached) summary. */
public final class CommitSummary {
    public final Commit commit;
    public final String summary;

    public CommitSummary(Commit commit, String summary) {
        this.commit = commit;
        this.summary = summary;
    }
}
