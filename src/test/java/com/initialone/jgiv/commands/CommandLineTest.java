package com.initialone.jgiv.commands;

import com.initialone.jgiv.Main;
import com.initialone.jgiv.core.GenerationRequest;
import com.initialone.jgiv.errors.ConfigException;
import com.initialone.jgiv.model.DocumentType;
import com.initialone.jgiv.model.OutputMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CommandLineTest {

    @TempDir
    Path tmp;

    private CommandLine cl;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        cl = Main.newCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        cl.setOut(new PrintWriter(out, true));
        cl.setErr(new PrintWriter(err, true));
    }

    private Object parsed(String... args) {
        return cl.parseArgs(args).subcommand().commandSpec().userObject();
    }

    @Test
    void generationFlagsBecomeARequest() {
        ChangelogCmd cmd = (ChangelogCmd) parsed("changelog", "v1.0.0..HEAD", "src", "docs",
                "--output-mode", "update", "--output-version", "1.1.0", "--dry-run",
                "--provider", "local", "--local-api", "ollama", "--timeout-sec", "30");

        GenerationRequest req = cmd.request();

        assertThat(req.documentType).isEqualTo(DocumentType.CHANGELOG);
        assertThat(req.revision).isEqualTo("v1.0.0..HEAD");
        assertThat(req.pathFilters).containsExactly("src", "docs");
        assertThat(req.outputMode).isEqualTo(OutputMode.UPDATE);
        assertThat(req.outputVersion).isEqualTo("1.1.0");
        assertThat(req.dryRun).isTrue();
        assertThat(cmd.llm.provider).isEqualTo("local");
        assertThat(cmd.llm.localApi).isEqualTo("ollama");
        assertThat(cmd.llm.timeoutSec).isEqualTo(30);
    }

    @Test
    void defaultsWhenNothingIsGiven() {
        MessageCmd cmd = (MessageCmd) parsed("msg");

        GenerationRequest req = cmd.request();

        assertThat(req.revision).isEmpty();
        assertThat(req.pathFilters).isEmpty();
        assertThat(req.outputMode).isNull();
        assertThat(cmd.llm.timeoutSec).isEqualTo(60);
        assertThat(cmd.llm.localApi).isEqualTo("openai");
    }

    @Test
    void currentAndCachedSelectTheSyntheticRevisions() {
        MessageCmd current = (MessageCmd) parsed("message", "--current", "--dry-run");
        assertThat(current.request().revision).isEqualTo("working-tree");

        SummaryCmd cached = (SummaryCmd) parsed("summary", "--cached", "src", "docs");
        GenerationRequest req = cached.request();
        assertThat(req.revision).isEqualTo("staged");
        assertThat(req.pathFilters).containsExactly("src", "docs");
    }

    @Test
    void currentAndCachedTogetherIsAUsageError() {
        assertThat(cl.execute("message", "--current", "--cached", "--dry-run")).isEqualTo(2);
    }

    @Test
    void documentCarriesItsPromptFile() {
        DocumentCmd cmd = (DocumentCmd) parsed("document", "--prompt-file", "blog.md", "HEAD~5..HEAD");

        assertThat(cmd.request().customTemplate).isEqualTo("blog.md");
        assertThat(cmd.request().documentType).isEqualTo(DocumentType.DOCUMENT);
    }

    @Test
    void documentWithoutPromptFileIsAUsageError() {
        assertThat(cl.execute("document")).isEqualTo(2);
        assertThat(err.toString()).contains("--prompt-file");
    }

    @Test
    void unknownOutputModeIsAUsageError() {
        assertThat(cl.execute("summary", "--output-mode", "sideways")).isEqualTo(2);
    }

    @Test
    void errorsPrintOneLineAndMapToExitCode() {
        int code = cl.execute("config", "get", "api.model", "--config-file", tmp.resolve("missing.conf").toString());

        assertThat(code).isEqualTo(ConfigException.EXIT_CODE);
        assertThat(err.toString().strip()).startsWith("[giv] error: config file not found").doesNotContain("\n\tat ");
    }

    @Test
    void configSetThenGet() throws Exception {
        Path file = tmp.resolve(".giv/config");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "# project settings\n");

        assertThat(cl.execute("config", "set", "project.title", "Demo App", "--config-file", file.toString())).isZero();
        assertThat(cl.execute("config", "get", "project.title", "--config-file", file.toString())).isZero();

        assertThat(out.toString()).contains("Demo App");
        assertThat(Files.readString(file)).contains("GIV_PROJECT_TITLE=\"Demo App\"");
    }

    @Test
    void configUnsetOfMissingKeyFails() throws Exception {
        Path file = tmp.resolve(".giv/config");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "api.model=x\n");

        assertThat(cl.execute("config", "unset", "api.url", "--config-file", file.toString())).isEqualTo(ConfigException.EXIT_CODE);
        assertThat(cl.execute("config", "unset", "api.model", "--config-file", file.toString())).isZero();
        assertThat(Files.readString(file)).doesNotContain("MODEL");
    }

    @Test
    void cachePathAndClear() throws Exception {
        Path file = tmp.resolve(".giv/config");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
        Path cacheDir = tmp.resolve(".giv/cache");
        Files.createDirectories(cacheDir);
        Files.writeString(cacheDir.resolve("abc-summary.md"), "s");

        assertThat(cl.execute("cache", "path", "--config-file", file.toString())).isZero();
        assertThat(cl.execute("cache", "clear", "--config-file", file.toString())).isZero();

        assertThat(out.toString()).contains(cacheDir.toString()).contains("removed 1 entry");
        assertThat(cacheDir.resolve("abc-summary.md")).doesNotExist();
    }

    @Test
    void maskHidesSecrets() {
        assertThat(ConfigCmd.mask("api.key", "sk-1234567890")).isEqualTo("****7890");
        assertThat(ConfigCmd.mask("api.key", "abc")).isEqualTo("****");
        assertThat(ConfigCmd.mask("api.model", "gpt-4o")).isEqualTo("gpt-4o");
    }
}
