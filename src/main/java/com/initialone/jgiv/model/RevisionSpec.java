package com.initialone.jgiv.model;

import com.initialone.jgiv.errors.RevisionException;

import java.util.List;
import java.util.Set;

/**
 * Parsed revision expression plus path filters.
 *
 * Accepted forms:
 *   working tree : "" | working-tree | --current | current
 *   staged       : staged | --cached | cached
 *   range        : A..B, A...B (an empty side means HEAD)
 *   single       : anything else git can resolve (HEAD, v1.2.0, abc1234)
 */
public final class RevisionSpec {

    public enum Kind { WORKING_TREE, STAGED, RANGE, SINGLE }

    private static final Set<String> WORKING_TREE_ALIASES = Set.of("working-tree", "--current", "current");
    private static final Set<String> STAGED_ALIASES = Set.of("staged", "--cached", "cached");

    public final String text;
    public final Kind kind;
    /** Range start (exclusive); null unless RANGE. */
    public final String from;
    /** Range end, or the single revision; null for sentinels. */
    public final String to;
    /** True for the three-dot symmetric-difference form. */
    public final boolean symmetric;
    public final List<String> pathFilters;

    private RevisionSpec(String text, Kind kind, String from, String to, boolean symmetric, List<String> pathFilters) {
        this.text = text;
        this.kind = kind;
        this.from = from;
        this.to = to;
        this.symmetric = symmetric;
        this.pathFilters = pathFilters == null ? List.of() : List.copyOf(pathFilters);
    }

    public static RevisionSpec parse(String text, List<String> pathFilters) {
        String t = text == null ? "" : text.trim();
        if (t.isEmpty() || WORKING_TREE_ALIASES.contains(t)) {
            return new RevisionSpec(Commit.WORKING_TREE_ID, Kind.WORKING_TREE, null, null, false, pathFilters);
        }
        if (STAGED_ALIASES.contains(t)) {
            return new RevisionSpec(Commit.STAGED_ID, Kind.STAGED, null, null, false, pathFilters);
        }
        if (t.chars().anyMatch(Character::isWhitespace)) {
            throw new RevisionException(t, "invalid revision '" + t + "': whitespace is not allowed");
        }
        if (t.startsWith("-")) {
            throw new RevisionException(t, "invalid revision '" + t + "': unknown option-like revision");
        }

        String sep = t.contains("...") ? "..." : (t.contains("..") ? ".." : null);
        if (sep == null) {
            return new RevisionSpec(t, Kind.SINGLE, null, t, false, pathFilters);
        }

        int at = t.indexOf(sep);
        String left = t.substring(0, at);
        String right = t.substring(at + sep.length());
        if (left.isEmpty() && right.isEmpty()) {
            throw new RevisionException(t, "invalid revision range '" + t + "': both endpoints are empty");
        }
        if (left.contains("..") || right.contains("..")) {
            throw new RevisionException(t, "invalid revision range '" + t + "': more than one range separator");
        }
        return new RevisionSpec(t, Kind.RANGE,
                left.isEmpty() ? "HEAD" : left,
                right.isEmpty() ? "HEAD" : right,
                "...".equals(sep), pathFilters);
    }

    public boolean isSynthetic() {
        return kind == Kind.WORKING_TREE || kind == Kind.STAGED;
    }

    /** Normalized git range expression; only meaningful for RANGE. */
    public String rangeExpression() {
        return from + (symmetric ? "..." : "..") + to;
    }

    @Override
    public String toString() {
        return pathFilters.isEmpty() ? text : text + " -- " + String.join(" ", pathFilters);
    }
}
