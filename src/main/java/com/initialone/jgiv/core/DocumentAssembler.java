package com.initialone.jgiv.core;

import com.initialone.jgiv.errors.TemplateException;
import com.initialone.jgiv.llm.SummarizationClient;
import com.initialone.jgiv.model.CommitSummary;
import com.initialone.jgiv.model.DocumentType;
import com.initialone.jgiv.model.GeneratedPayload;
import com.initialone.jgiv.model.ProjectMetadata;
import com.initialone.jgiv.template.TemplateEngine;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the final document from ordered commit summaries.
 *
 * The document template gets the summaries plus project metadata; the
 * rendered prompt then goes through one more model call, or is returned as
 * is in dry-run mode. An empty range never reaches the model.
 */
public class DocumentAssembler {

    private final TemplateEngine templates;
    private final SummarizationClient client;
    private final RetryPolicy retry;
    private final boolean dryRun;
    private final String customTemplate;
    private final Map<String, String> extraTokens;

    public DocumentAssembler(TemplateEngine templates, SummarizationClient client, RetryPolicy retry,
                             boolean dryRun, String customTemplate, Map<String, String> extraTokens) {
        if (client == null && !dryRun) throw new IllegalArgumentException("client is required unless dry-run");
        this.templates = templates;
        this.client = client;
        this.retry = retry;
        this.dryRun = dryRun;
        this.customTemplate = customTemplate;
        this.extraTokens = extraTokens == null ? Map.of() : Map.copyOf(extraTokens);
    }

    public GeneratedPayload assemble(DocumentType type, List<CommitSummary> summaries, ProjectMetadata project) {
        return assemble(type, summaries, project, "");
    }

    public GeneratedPayload assemble(DocumentType type, List<CommitSummary> summaries, ProjectMetadata project,
                                     String revision) {
        if (summaries.isEmpty()) {
            return new GeneratedPayload(normalize(type.emptyPayload), project.version, type, true, dryRun);
        }

        String prompt = templates.render(templateFor(type), context(summaries, project, revision));
        if (dryRun) {
            return new GeneratedPayload(normalize(prompt), project.version, type, false, true);
        }
        String text = retry.call(type.tag, () -> client.summarize(prompt));
        return new GeneratedPayload(normalize(text), project.version, type, false, false);
    }

    String templateFor(DocumentType type) {
        if (type == DocumentType.DOCUMENT) {
            if (customTemplate == null || customTemplate.isBlank()) {
                throw new TemplateException("the document command needs --prompt-file");
            }
            return customTemplate;
        }
        return customTemplate != null && !customTemplate.isBlank() ? customTemplate : type.templateName;
    }

    Map<String, String> context(List<CommitSummary> summaries, ProjectMetadata project, String revision) {
        String history = formatSummaries(summaries);
        String lastDate = summaries.get(summaries.size() - 1).commit.date();

        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put("EXAMPLE", "");
        ctx.put("RULES", "");
        ctx.putAll(extraTokens);
        ctx.put("SUMMARY", history);
        ctx.put("HISTORY", history);
        ctx.put("PROJECT_TITLE", project.title);
        ctx.put("VERSION", project.version);
        ctx.put("REVISION", revision == null ? "" : revision);
        ctx.put("DATE", lastDate.isEmpty() ? LocalDate.now().toString() : lastDate);
        ctx.put("COMMIT_COUNT", String.valueOf(summaries.size()));
        return ctx;
    }

    static String formatSummaries(List<CommitSummary> summaries) {
        StringBuilder sb = new StringBuilder();
        for (CommitSummary cs : summaries) {
            if (sb.length() > 0) sb.append("\n\n");
            sb.append("### ");
            if (cs.commit.synthetic) {
                sb.append(cs.commit.message.isEmpty() ? cs.commit.id : cs.commit.message);
            } else {
                sb.append("Commit ").append(cs.commit.shortId);
                if (!cs.commit.date().isEmpty()) sb.append(" (").append(cs.commit.date()).append(')');
            }
            sb.append("\n\n").append(cs.summary.strip());
        }
        return sb.toString();
    }

    /** Trimmed, ending in exactly one newline. */
    static String normalize(String s) {
        return s == null ? "\n" : s.strip() + "\n";
    }
}
