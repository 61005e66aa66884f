package com.initialone.jgiv.core;

import com.initialone.jgiv.model.GeneratedPayload;
import com.initialone.jgiv.model.ProjectMetadata;

public final class GenerationResult {
    public final GeneratedPayload payload;
    public final MergeOutcome outcome;
    public final int commitCount;
    public final ProjectMetadata project;

    public GenerationResult(GeneratedPayload payload, MergeOutcome outcome, int commitCount, ProjectMetadata project) {
        this.payload = payload;
        this.outcome = outcome;
        this.commitCount = commitCount;
        this.project = project;
    }
}
