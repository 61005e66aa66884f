package com.initialone.jgiv.git;

import com.initialone.jgiv.errors.RevisionException;
import com.initialone.jgiv.model.RevisionSpec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** {@link Repository} backed by the git command line. */
public class GitCliRepository implements Repository {

    private final GitCommandRunner git;
    private Path root;

    public GitCliRepository(Path workDir) {
        this(new GitCommandRunner(workDir));
    }

    public GitCliRepository(GitCommandRunner git) {
        this.git = git;
    }

    @Override
    public List<CommitDiff> resolveCommits(RevisionSpec spec, List<String> pathFilters) {
        switch (spec.kind) {
            case SINGLE: {
                String id = verify(spec.to, spec.text);
                return List.of(new CommitDiff(id, commitDiff(id, pathFilters, spec.text)));
            }
            case RANGE: {
                verify(spec.from, spec.text);
                verify(spec.to, spec.text);
                // --reverse: oldest first, so summaries read as a chronological narrative
                List<String> args = new ArrayList<>(List.of("rev-list", "--reverse", spec.rangeExpression()));
                appendPaths(args, pathFilters);
                GitCommandRunner.Result r = run(args, spec.text);
                if (!r.ok()) {
                    throw new RevisionException(spec.text, "cannot list commits for '" + spec.text + "': " + firstLine(r.stderr));
                }
                List<CommitDiff> out = new ArrayList<>();
                for (String line : r.stdout.split("\\R")) {
                    String id = line.trim();
                    if (!id.isEmpty()) out.add(new CommitDiff(id, commitDiff(id, pathFilters, spec.text)));
                }
                return out;
            }
            default:
                throw new IllegalArgumentException("synthetic revision has no commits: " + spec.text);
        }
    }

    @Override
    public CommitMetadata getMetadata(String commitId) {
        GitCommandRunner.Result r = run(List.of("show", "-s", "--no-color", "--format=" + CommitMetadata.SHOW_FORMAT, commitId), commitId);
        CommitMetadata md = r.ok() ? CommitMetadata.parse(r.stdout) : null;
        if (md == null) {
            throw new RevisionException(commitId, "cannot read metadata of commit " + commitId + ": " + firstLine(r.stderr));
        }
        return md;
    }

    @Override
    public String uncommittedDiff(boolean staged, List<String> pathFilters) {
        String label = staged ? "staged" : "working-tree";
        List<String> args = new ArrayList<>(List.of("--no-pager", "diff", "--unified=3", "--no-prefix", "--no-color"));
        if (staged) args.add("--cached");
        appendPaths(args, pathFilters);
        StringBuilder sb = new StringBuilder(diffOutput(args, label));
        if (staged) return sb.toString();

        List<String> ls = new ArrayList<>(List.of("ls-files", "--others", "--exclude-standard"));
        appendPaths(ls, pathFilters);
        GitCommandRunner.Result untracked = run(ls, label);
        if (!untracked.ok()) return sb.toString();
        for (String line : untracked.stdout.split("\\R")) {
            String file = line.trim();
            if (file.isEmpty()) continue;
            String d = diffOutput(List.of("--no-pager", "diff", "--no-index", "--unified=3", "--no-prefix", "--no-color",
                    "/dev/null", file), label);
            if (d.isBlank()) continue;
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') sb.append('\n');
            sb.append(d);
        }
        return sb.toString();
    }

    @Override
    public String currentBranch() {
        GitCommandRunner.Result r = run(List.of("branch", "--show-current"), "HEAD");
        return r.ok() ? r.stdout.trim() : "";
    }

    @Override
    public Path root() {
        if (root == null) {
            GitCommandRunner.Result r = run(List.of("rev-parse", "--show-toplevel"), "HEAD");
            if (!r.ok()) {
                throw new RevisionException("HEAD", "not a git repository: " + git.workDir().toAbsolutePath());
            }
            root = Path.of(r.stdout.trim());
        }
        return root;
    }

    @Override
    public Optional<String> latestTag() {
        GitCommandRunner.Result r = run(List.of("describe", "--tags", "--abbrev=0"), "HEAD");
        String tag = r.stdout.trim();
        return r.ok() && !tag.isEmpty() ? Optional.of(tag) : Optional.empty();
    }

    /* ---------- helpers ---------- */

    private String verify(String rev, String specText) {
        GitCommandRunner.Result r = run(List.of("rev-parse", "--verify", "--quiet", rev + "^{commit}"), specText);
        String id = r.stdout.trim();
        if (!r.ok() || id.isEmpty()) {
            throw new RevisionException(specText, "unknown revision '" + rev + "' in '" + specText + "'");
        }
        return id;
    }

    /** Diff of one commit against its first parent; root commits diff against the empty tree. */
    private String commitDiff(String id, List<String> pathFilters, String specText) {
        List<String> args = new ArrayList<>(List.of("--no-pager", "show", "--format=", "--no-color", "--unified=3",
                "--no-prefix", "-m", "--first-parent", id));
        appendPaths(args, pathFilters);
        GitCommandRunner.Result r = run(args, specText);
        if (!r.ok()) {
            throw new RevisionException(specText, "cannot diff commit " + id + ": " + firstLine(r.stderr));
        }
        return r.stdout;
    }

    /** git diff exits 1 when differences exist; only 2+ is a failure. */
    private String diffOutput(List<String> args, String label) {
        GitCommandRunner.Result r = run(args, label);
        if (r.exitCode > 1) {
            throw new RevisionException(label, "git diff failed for " + label + ": " + firstLine(r.stderr));
        }
        return r.stdout;
    }

    private GitCommandRunner.Result run(List<String> args, String specText) {
        try {
            return git.run(args);
        } catch (IOException e) {
            throw new RevisionException(specText, "cannot run git for '" + specText + "': " + e.getMessage(), e);
        }
    }

    private static void appendPaths(List<String> args, List<String> pathFilters) {
        if (pathFilters != null && !pathFilters.isEmpty()) {
            args.add("--");
            args.addAll(pathFilters);
        }
    }

    private static String firstLine(String s) {
        if (s == null || s.isBlank()) return "no details";
        String t = s.strip();
        int nl = t.indexOf('\n');
        return nl < 0 ? t : t.substring(0, nl);
    }
}
