package com.initialone.jgiv.git;

public final class CommitDiff {
    public final String id;
    public final String diff;

    public CommitDiff(String id, String diff) {
        this.id = id;
        this.diff = diff == null ? "" : diff;
    }
}
