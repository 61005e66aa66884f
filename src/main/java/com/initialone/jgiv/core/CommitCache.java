package com.initialone.jgiv.core;

import com.initialone.jgiv.errors.CacheException;
import com.initialone.jgiv.util.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Directory-backed summary cache: one UTF-8 file per commit id.
 *
 * Entries are never invalidated automatically. A summary stays valid for as
 * long as its commit id exists, even if the prompt templates change later;
 * {@link #clear()} is the only way to drop them.
 */
public class CommitCache {
    private static final Logger log = LoggerFactory.getLogger(CommitCache.class);
    static final String ENTRY_SUFFIX = "-summary.md";

    private final Path dir;

    public CommitCache(Path dir) {
        this.dir = dir;
    }

    public Path directory() {
        return dir;
    }

    /** Missing or unreadable entries are a miss, never an error. */
    public Optional<String> get(String commitId) {
        Path file = entryPath(commitId);
        try {
            String s = Files.readString(file, StandardCharsets.UTF_8);
            log.debug("cache hit {}", commitId);
            return Optional.of(s);
        } catch (NoSuchFileException e) {
            log.debug("cache miss {}", commitId);
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            log.warn("cannot read cache entry {}, treating as miss: {}", file, e.toString());
            return Optional.empty();
        }
    }

    public void put(String commitId, String summary) {
        Path file = entryPath(commitId);
        try {
            AtomicFiles.writeString(file, summary);
            log.debug("cached summary for {} at {}", commitId, file);
        } catch (IOException e) {
            throw new CacheException(file, "cannot write cache entry", e);
        }
    }

    /** Removes every entry (and stale temp files). Returns how many entries were removed. */
    public int clear() {
        if (!Files.isDirectory(dir)) return 0;
        int removed = 0;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir)) {
            for (Path p : ds) {
                if (isEntry(p)) {
                    Files.deleteIfExists(p);
                    removed++;
                } else if (AtomicFiles.isTempFile(p)) {
                    Files.deleteIfExists(p);
                }
            }
        } catch (IOException e) {
            throw new CacheException(dir, "cannot clear cache", e);
        }
        log.debug("cleared {} cache entries from {}", removed, dir);
        return removed;
    }

    public int size() {
        if (!Files.isDirectory(dir)) return 0;
        int n = 0;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir)) {
            for (Path p : ds) {
                if (isEntry(p)) n++;
            }
        } catch (IOException e) {
            log.warn("cannot list cache directory {}: {}", dir, e.toString());
        }
        return n;
    }

    Path entryPath(String commitId) {
        return dir.resolve(fileNameFor(commitId));
    }

    static String fileNameFor(String commitId) {
        return commitId.replaceAll("[^A-Za-z0-9._-]", "_") + ENTRY_SUFFIX;
    }

    private static boolean isEntry(Path p) {
        String name = p.getFileName().toString();
        return name.endsWith(ENTRY_SUFFIX) && !AtomicFiles.isTempFile(p) && Files.isRegularFile(p);
    }
}
