package com.initialone.jgiv.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/** Runs the git executable and captures its output. */
public class GitCommandRunner {
    private static final Logger log = LoggerFactory.getLogger(GitCommandRunner.class);
    static final long DEFAULT_TIMEOUT_SEC = 120;

    public static final class Result {
        public final int exitCode;
        public final String stdout;
        public final String stderr;

        Result(int exitCode, String stdout, String stderr) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderr = stderr;
        }

        public boolean ok() {
            return exitCode == 0;
        }
    }

    private final Path workDir;
    private final String gitExecutable;
    private final long timeoutSec;

    public GitCommandRunner(Path workDir) {
        this(workDir, "git", DEFAULT_TIMEOUT_SEC);
    }

    public GitCommandRunner(Path workDir, String gitExecutable, long timeoutSec) {
        this.workDir = workDir;
        this.gitExecutable = gitExecutable;
        this.timeoutSec = timeoutSec;
    }

    public Path workDir() {
        return workDir;
    }

    public Result run(List<String> args) throws IOException {
        List<String> cmd = new ArrayList<>(args.size() + 1);
        cmd.add(gitExecutable);
        cmd.addAll(args);
        log.debug("git {}", String.join(" ", args));

        ProcessBuilder pb = new ProcessBuilder(cmd).directory(workDir.toFile());
        pb.environment().put("GIT_PAGER", "cat");
        pb.environment().put("LC_ALL", "C");
        Process p = pb.start();
        p.getOutputStream().close();

        CompletableFuture<String> out = CompletableFuture.supplyAsync(() -> drain(p.getInputStream()));
        CompletableFuture<String> err = CompletableFuture.supplyAsync(() -> drain(p.getErrorStream()));
        try {
            if (!p.waitFor(timeoutSec, TimeUnit.SECONDS)) {
                p.destroyForcibly();
                throw new IOException("git " + String.join(" ", args) + " timed out after " + timeoutSec + "s");
            }
            return new Result(p.exitValue(), out.join(), err.join());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
            throw new IOException("interrupted while running git", ie);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } catch (CompletionException e) {
            if (e.getCause() instanceof UncheckedIOException) {
                throw ((UncheckedIOException) e.getCause()).getCause();
            }
            throw e;
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
