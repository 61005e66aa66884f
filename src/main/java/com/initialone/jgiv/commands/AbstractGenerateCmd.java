package com.initialone.jgiv.commands;

import com.initialone.jgiv.config.GivConfig;
import com.initialone.jgiv.core.CommitCache;
import com.initialone.jgiv.core.GenerationPipeline;
import com.initialone.jgiv.core.GenerationRequest;
import com.initialone.jgiv.core.GenerationResult;
import com.initialone.jgiv.core.RetryPolicy;
import com.initialone.jgiv.git.GitCliRepository;
import com.initialone.jgiv.git.Repository;
import com.initialone.jgiv.llm.LlmOptions;
import com.initialone.jgiv.llm.SummarizationClients;
import com.initialone.jgiv.model.Commit;
import com.initialone.jgiv.model.DocumentType;
import com.initialone.jgiv.template.TemplateEngine;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared body of the document-generating subcommands. Subclasses only name
 * their {@link DocumentType}.
 */
public abstract class AbstractGenerateCmd implements Runnable {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    CommonOptions common;

    @CommandLine.Mixin
    LlmOptions llm;

    @CommandLine.Mixin
    OutputOptions out;

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "REVISION",
            description = "Commit, range (A..B, A...B), 'staged' or 'working-tree' (default: working tree)")
    String revision;

    @CommandLine.Parameters(index = "1..*", paramLabel = "PATHSPEC",
            description = "Limit the diff to these paths")
    List<String> pathspec = new ArrayList<>();

    @CommandLine.Option(names = "--current", description = "Summarize the working tree (same as 'working-tree')")
    boolean current;

    @CommandLine.Option(names = "--cached", description = "Summarize staged changes (same as 'staged')")
    boolean cached;

    protected abstract DocumentType type();

    /** Custom template path, or null for the type's bundled one. */
    protected String customTemplate() {
        return null;
    }

    @Override
    public void run() {
        GenerationRequest req = request();
        GivConfig cfg = common.init();
        Repository repo = new GitCliRepository(CommonOptions.workDir());
        GenerationPipeline pipeline = new GenerationPipeline(
                repo, cfg,
                new TemplateEngine(cfg.projectDir(), CommonOptions.userHome()),
                new CommitCache(cfg.cacheDir()),
                t -> SummarizationClients.create(llm, cfg, t.temperature),
                RetryPolicy.defaults());

        GenerationResult r = pipeline.run(req);
        report(r);
    }

    GenerationRequest request() {
        return GenerationRequest.builder(type())
                .revision(effectiveRevision())
                .pathFilters(effectivePathspec())
                .customTemplate(customTemplate())
                .outputFile(out.outputFile)
                .outputMode(out.outputMode)
                .outputVersion(out.outputVersion)
                .dryRun(out.dryRun)
                .build();
    }

    /** --current/--cached win over the positional revision, which then counts as a path. */
    String effectiveRevision() {
        if (current && cached) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--current and --cached are mutually exclusive");
        }
        if (cached) return Commit.STAGED_ID;
        if (current) return Commit.WORKING_TREE_ID;
        return revision;
    }

    List<String> effectivePathspec() {
        if ((current || cached) && revision != null) {
            List<String> paths = new ArrayList<>();
            paths.add(revision);
            paths.addAll(pathspec);
            return paths;
        }
        return pathspec;
    }

    void report(GenerationResult r) {
        PrintWriter stdout = spec.commandLine().getOut();
        PrintWriter stderr = spec.commandLine().getErr();
        String tag = "[" + type().tag + "] ";
        if (r.payload.empty) {
            stderr.println(tag + "no commits in '" + (effectiveRevision() == null ? Commit.WORKING_TREE_ID : effectiveRevision()) + "'");
        }
        if (r.outcome.written()) {
            stdout.println(tag + r.outcome.mode.tag() + " -> " + r.outcome.target);
        } else {
            if (r.payload.dryRun && r.outcome.target != null) {
                stderr.println(tag + "dry-run, would " + r.outcome.mode.tag() + " -> " + r.outcome.target);
            }
            stdout.print(r.payload.text);
        }
        stdout.flush();
        stderr.flush();
    }
}
