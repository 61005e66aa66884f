package com.initialone.jgiv.core;

import com.initialone.jgiv.errors.CacheException;
import com.initialone.jgiv.llm.SummarizationClient;
import com.initialone.jgiv.model.Commit;
import com.initialone.jgiv.model.CommitSummary;
import com.initialone.jgiv.model.ProjectMetadata;
import com.initialone.jgiv.template.TemplateEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Produces one summary per commit, cache first.
 *
 * Commits are processed one at a time in resolver order. A commit whose
 * summarization exhausts its retries aborts the whole run, so no document is
 * ever built from a partial set of summaries.
 */
public class CommitSummarizer {
    private static final Logger log = LoggerFactory.getLogger(CommitSummarizer.class);

    static final String COMMIT_TEMPLATE = "commit_summary_prompt.md";
    /** Diffs longer than this keep only their head and tail. */
    static final int MAX_DIFF_LINES = 1200;

    private final CommitCache cache;
    private final SummarizationClient client;
    private final TemplateEngine templates;
    private final RetryPolicy retry;
    private final ProjectMetadata project;
    private final boolean dryRun;

    /** {@code client} may be null in dry-run mode. */
    public CommitSummarizer(CommitCache cache, SummarizationClient client, TemplateEngine templates,
                            RetryPolicy retry, ProjectMetadata project, boolean dryRun) {
        if (client == null && !dryRun) throw new IllegalArgumentException("client is required unless dry-run");
        this.cache = cache;
        this.client = client;
        this.templates = templates;
        this.retry = retry;
        this.project = project;
        this.dryRun = dryRun;
    }

    public List<CommitSummary> summarizeAll(List<Commit> commits) {
        List<CommitSummary> out = new ArrayList<>(commits.size());
        for (Commit c : commits) {
            out.add(new CommitSummary(c, summarize(c)));
        }
        return out;
    }

    public String summarize(Commit commit) {
        if (dryRun) {
            // the prompt stands in for the summary; the cache is neither read nor written
            return buildPrompt(commit);
        }

        boolean cacheable = !commit.synthetic;
        if (cacheable) {
            Optional<String> hit = cache.get(commit.id);
            if (hit.isPresent()) return hit.get();
        }

        String prompt = buildPrompt(commit);
        String summary = retry.call(commit.id, () -> client.summarize(prompt));

        if (cacheable) {
            try {
                cache.put(commit.id, summary);
            } catch (CacheException e) {
                log.warn("{}; the summary will be regenerated next time", e.getMessage());
            }
        }
        return summary;
    }

    String buildPrompt(Commit c) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put("COMMIT_ID", c.id);
        ctx.put("SHORT_COMMIT_ID", c.shortId);
        ctx.put("AUTHOR", c.author);
        ctx.put("DATE", c.date());
        ctx.put("MESSAGE", c.message);
        ctx.put("DIFF", trimDiff(c.diff));
        ctx.put("PROJECT_TITLE", project.title);
        ctx.put("VERSION", project.version);
        return templates.render(COMMIT_TEMPLATE, ctx);
    }

    static String trimDiff(String diff) {
        String[] lines = diff.split("\\R", -1);
        if (lines.length <= MAX_DIFF_LINES) return diff;
        int head = MAX_DIFF_LINES * 2 / 3;
        int tail = MAX_DIFF_LINES - head;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < head; i++) sb.append(lines[i]).append('\n');
        sb.append("... (").append(lines.length - head - tail).append(" lines trimmed) ...\n");
        for (int i = lines.length - tail; i < lines.length; i++) {
            sb.append(lines[i]);
            if (i < lines.length - 1) sb.append('\n');
        }
        return sb.toString();
    }
}
