package com.initialone.jgiv.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class AtomicFilesTest {

    @TempDir
    Path tmp;

    @Test
    void createsParentsAndWrites() throws Exception {
        Path target = tmp.resolve("a/b/out.md");

        AtomicFiles.writeString(target, "hello\n");

        assertThat(Files.readString(target)).isEqualTo("hello\n");
    }

    @Test
    void replacesExistingFile() throws Exception {
        Path target = tmp.resolve("out.md");
        Files.writeString(target, "old");

        AtomicFiles.writeString(target, "new");

        assertThat(Files.readString(target)).isEqualTo("new");
    }

    @Test
    void keepsModeOfReplacedFile() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path target = tmp.resolve("CHANGELOG.md");
        Files.writeString(target, "old");
        Files.setPosixFilePermissions(target, PosixFilePermissions.fromString("rw-r--r--"));

        AtomicFiles.writeString(target, "new");

        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(target))).isEqualTo("rw-r--r--");
    }

    @Test
    void newFileIsNotOwnerOnly() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path target = tmp.resolve("RELEASE_NOTES.md");

        AtomicFiles.writeString(target, "notes");

        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(target))).isEqualTo("rw-r--r--");
    }

    @Test
    void failedMoveLeavesNoTempFile() throws Exception {
        Path target = tmp.resolve("occupied");
        Files.createDirectories(target.resolve("child"));

        assertThatThrownBy(() -> AtomicFiles.writeString(target, "x")).isInstanceOf(IOException.class);

        try (var files = Files.list(tmp)) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    void recognizesTempFiles() {
        assertThat(AtomicFiles.isTempFile(Path.of(".CHANGELOG.md.8123.tmp"))).isTrue();
        assertThat(AtomicFiles.isTempFile(Path.of("CHANGELOG.md"))).isFalse();
    }
}
