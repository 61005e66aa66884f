package com.initialone.jgiv.core;

import com.initialone.jgiv.model.OutputMode;

import java.nio.file.Path;

/** Result of applying a payload to a target. */
public final class MergeOutcome {
    public enum Action { DISPLAYED, CREATED, OVERWRITTEN, APPENDED, PREPENDED, SECTION_REPLACED, SECTION_INSERTED }

    public final OutputMode mode;
    public final Action action;
    /** Null when the document has no file; set but untouched for a dry run. */
    public final Path target;
    /** Full file content after the merge, or the payload for {@link Action#DISPLAYED}. */
    public final String content;

    public MergeOutcome(OutputMode mode, Action action, Path target, String content) {
        this.mode = mode;
        this.action = action;
        this.target = target;
        this.content = content;
    }

    public boolean written() {
        return action != Action.DISPLAYED;
    }
}
