package com.initialone.jgiv.git;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class GitCommandRunnerTest {

    @TempDir
    Path tmp;

    @BeforeEach
    void requirePosixShell() {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
    }

    private Path script(String body) throws IOException {
        Path exe = tmp.resolve("fake-git");
        Files.writeString(exe, "#!/bin/sh\n" + body + "\n");
        Files.setPosixFilePermissions(exe, PosixFilePermissions.fromString("rwxr-xr-x"));
        return exe;
    }

    @Test
    void capturesBothStreamsAndExitCode() throws Exception {
        Path exe = script("echo \"$@\"\necho warn >&2\nexit 3");
        GitCommandRunner runner = new GitCommandRunner(tmp, exe.toString(), 10);

        GitCommandRunner.Result r = runner.run(List.of("log", "--oneline"));

        assertThat(r.exitCode).isEqualTo(3);
        assertThat(r.ok()).isFalse();
        assertThat(r.stdout).isEqualTo("log --oneline\n");
        assertThat(r.stderr).isEqualTo("warn\n");
    }

    @Test
    @Timeout(20)
    void stalledGitTimesOutEvenWithOpenStdout() throws Exception {
        Path exe = script("echo partial\nsleep 60");
        GitCommandRunner runner = new GitCommandRunner(tmp, exe.toString(), 1);

        assertThatThrownBy(() -> runner.run(List.of("show", "HEAD")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("timed out");
    }
}
