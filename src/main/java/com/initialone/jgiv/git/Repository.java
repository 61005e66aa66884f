package com.initialone.jgiv.git;

import com.initialone.jgiv.model.RevisionSpec;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Version-control collaborator. Every failure surfaces as
 * {@link com.initialone.jgiv.errors.RevisionException}.
 */
public interface Repository {

    /**
     * Commits selected by a RANGE or SINGLE spec, oldest first, each with its
     * diff against its immediate parent.
     */
    List<CommitDiff> resolveCommits(RevisionSpec spec, List<String> pathFilters);

    CommitMetadata getMetadata(String commitId);

    /** Uncommitted changes: staged ones when {@code staged}, else the working tree incl. untracked files. */
    String uncommittedDiff(boolean staged, List<String> pathFilters);

    String currentBranch();

    Path root();

    /** Most recent tag reachable from HEAD. */
    Optional<String> latestTag();
}
