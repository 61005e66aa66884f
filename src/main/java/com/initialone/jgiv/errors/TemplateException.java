package com.initialone.jgiv.errors;

public class TemplateException extends GivException {
    public static final int EXIT_CODE = 6;

    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
