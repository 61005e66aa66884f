package com.initialone.jgiv.core;

import com.initialone.jgiv.git.CommitDiff;
import com.initialone.jgiv.git.CommitMetadata;
import com.initialone.jgiv.git.Repository;
import com.initialone.jgiv.model.Commit;
import com.initialone.jgiv.model.RevisionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a revision spec into the ordered commits to document.
 *
 * Ranges come back oldest first. A working-tree or staged sentinel becomes
 * a single synthetic commit, or nothing at all when there are no changes.
 */
public class RevisionResolver {
    private static final Logger log = LoggerFactory.getLogger(RevisionResolver.class);

    private final Repository repo;

    public RevisionResolver(Repository repo) {
        this.repo = repo;
    }

    public List<Commit> resolve(String revision, List<String> pathFilters) {
        return resolve(RevisionSpec.parse(revision, pathFilters));
    }

    public List<Commit> resolve(RevisionSpec spec) {
        if (spec.isSynthetic()) {
            boolean staged = spec.kind == RevisionSpec.Kind.STAGED;
            String diff = repo.uncommittedDiff(staged, spec.pathFilters);
            if (diff.isBlank()) {
                log.debug("no {} changes", spec.text);
                return List.of();
            }
            String id = staged ? Commit.STAGED_ID : Commit.WORKING_TREE_ID;
            return List.of(Commit.synthetic(id, staged ? "Staged changes" : "Uncommitted changes", diff));
        }

        List<CommitDiff> diffs = repo.resolveCommits(spec, spec.pathFilters);
        List<Commit> out = new ArrayList<>(diffs.size());
        for (CommitDiff d : diffs) {
            CommitMetadata md = repo.getMetadata(d.id);
            out.add(Commit.real(md.id == null || md.id.isBlank() ? d.id : md.id,
                    md.shortId, md.author, md.date, md.message, d.diff));
        }
        log.debug("resolved {} to {} commit(s)", spec, out.size());
        return out;
    }
}
