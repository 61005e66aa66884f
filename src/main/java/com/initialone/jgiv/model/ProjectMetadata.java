package com.initialone.jgiv.model;

public final class ProjectMetadata {
    public static final String UNRELEASED = "Unreleased";

    public final String title;
    public final String version;

    public ProjectMetadata(String title, String version) {
        this.title = title == null || title.isBlank() ? "project" : title;
        this.version = version == null || version.isBlank() ? UNRELEASED : version;
    }

    public ProjectMetadata withVersion(String v) {
        return v == null || v.isBlank() ? this : new ProjectMetadata(title, v);
    }
}
