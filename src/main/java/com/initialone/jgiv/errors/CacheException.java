package com.initialone.jgiv.errors;

import java.nio.file.Path;

/**
 * Cache entry could not be written or removed. Inside the pipeline this is
 * always recovered (logged, summary regenerated next time); only the
 * {@code cache clear} command lets it reach the user.
 */
public class CacheException extends GivException {
    public static final int EXIT_CODE = 8;

    public CacheException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
