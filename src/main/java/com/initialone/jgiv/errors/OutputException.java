package com.initialone.jgiv.errors;

import java.nio.file.Path;

/** Target document could not be read or written. */
public class OutputException extends GivException {
    public static final int EXIT_CODE = 5;

    private final Path path;

    public OutputException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
