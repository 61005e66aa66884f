package com.initialone.jgiv.errors;

public class ConfigException extends GivException {
    public static final int EXIT_CODE = 7;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
