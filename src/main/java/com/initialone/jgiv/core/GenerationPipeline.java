package com.initialone.jgiv.core;

import com.initialone.jgiv.config.GivConfig;
import com.initialone.jgiv.git.Repository;
import com.initialone.jgiv.llm.SummarizationClient;
import com.initialone.jgiv.model.Commit;
import com.initialone.jgiv.model.CommitSummary;
import com.initialone.jgiv.model.DocumentType;
import com.initialone.jgiv.model.GeneratedPayload;
import com.initialone.jgiv.model.OutputMode;
import com.initialone.jgiv.model.ProjectMetadata;
import com.initialone.jgiv.template.TemplateEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * resolve -> summarize -> assemble -> merge.
 *
 * Runs strictly in sequence. Nothing is written until the payload is
 * complete, so any failure before the merge leaves the target untouched.
 */
public class GenerationPipeline {
    private static final Logger log = LoggerFactory.getLogger(GenerationPipeline.class);

    private final Repository repo;
    private final GivConfig config;
    private final TemplateEngine templates;
    private final CommitCache cache;
    private final Function<DocumentType, SummarizationClient> clientFactory;
    private final RetryPolicy retry;
    private final SectionMerger merger = new SectionMerger();

    public GenerationPipeline(Repository repo, GivConfig config, TemplateEngine templates, CommitCache cache,
                              Function<DocumentType, SummarizationClient> clientFactory, RetryPolicy retry) {
        this.repo = repo;
        this.config = config;
        this.templates = templates;
        this.cache = cache;
        this.clientFactory = clientFactory;
        this.retry = retry;
    }

    public GenerationResult run(GenerationRequest req) {
        DocumentType type = req.documentType;

        ProjectMetadata detected = new ProjectMetadataDetector(config.projectDir(), config, repo).detect();
        String version = firstNonBlank(req.outputVersion,
                config.get(GivConfig.OUTPUT_VERSION).orElse(null), detected.version);
        ProjectMetadata project = detected.withVersion(version);

        // settle target and mode up front so config mistakes fail before any model call
        OutputMode requested = req.outputMode != null ? req.outputMode : config.outputMode(type);
        Path target = resolveTarget(req, project.version);
        OutputMode mode = AutoModeTable.resolve(type, requested);
        if (mode == OutputMode.NONE && requested == OutputMode.AUTO && req.outputFile != null) {
            mode = OutputMode.OVERWRITE;
        }
        if (mode != OutputMode.NONE && target == null) {
            log.warn("{} has no output file; printing instead of '{}'", type.tag, mode.tag());
            mode = OutputMode.NONE;
        }

        List<Commit> commits = new RevisionResolver(repo).resolve(req.revision, req.pathFilters);
        log.debug("{} commit(s) for '{}'", commits.size(), req.revision);

        SummarizationClient client = req.dryRun ? null : new LazyClient(() -> clientFactory.apply(type));
        CommitSummarizer summarizer = new CommitSummarizer(cache, client, templates, retry, project, req.dryRun);
        List<CommitSummary> summaries = summarizer.summarizeAll(commits);

        DocumentAssembler assembler = new DocumentAssembler(templates, client, retry, req.dryRun,
                req.customTemplate, extraTokens());
        GeneratedPayload payload = assembler.assemble(type, summaries, project, req.revision);

        MergeOutcome outcome;
        if (req.dryRun) {
            outcome = new MergeOutcome(mode, MergeOutcome.Action.DISPLAYED, target, payload.text);
        } else {
            outcome = merger.merge(mode == OutputMode.NONE ? null : target, payload, mode);
        }
        return new GenerationResult(payload, outcome, commits.size(), project);
    }

    Path resolveTarget(GenerationRequest req, String version) {
        if (req.outputFile != null) return req.outputFile.toAbsolutePath();
        String pattern = config.outputFilePattern(req.documentType);
        if (pattern == null) return null;
        return config.projectDir().resolve(pattern.replace("{VERSION}", version));
    }

    private Map<String, String> extraTokens() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("EXAMPLE", config.getOr(GivConfig.EXAMPLE, ""));
        m.put("RULES", config.getOr(GivConfig.RULES, ""));
        return m;
    }

    private static String firstNonBlank(String... candidates) {
        for (String c : candidates) {
            if (c != null && !c.isBlank()) return c.trim();
        }
        return null;
    }

    /** Builds the real client on first use, so cached or empty runs need no credentials. */
    private static final class LazyClient implements SummarizationClient {
        private final Supplier<SummarizationClient> factory;
        private SummarizationClient delegate;

        LazyClient(Supplier<SummarizationClient> factory) {
            this.factory = factory;
        }

        @Override
        public String summarize(String prompt) throws IOException {
            if (delegate == null) delegate = factory.get();
            return delegate.summarize(prompt);
        }
    }
}
