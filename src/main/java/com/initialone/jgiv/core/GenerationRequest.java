package com.initialone.jgiv.core;

import com.initialone.jgiv.model.DocumentType;
import com.initialone.jgiv.model.OutputMode;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/** One generation run as requested on the command line. */
public final class GenerationRequest {
    public final String revision;
    public final List<String> pathFilters;
    public final DocumentType documentType;
    /** Template path for {@link DocumentType#DOCUMENT}, optional override for the others. */
    public final String customTemplate;
    public final Path outputFile;
    public final OutputMode outputMode;
    public final String outputVersion;
    public final boolean dryRun;

    private GenerationRequest(Builder b) {
        this.revision = b.revision == null ? "" : b.revision;
        this.pathFilters = b.pathFilters == null ? List.of() : List.copyOf(b.pathFilters);
        this.documentType = Objects.requireNonNull(b.documentType, "documentType");
        this.customTemplate = b.customTemplate;
        this.outputFile = b.outputFile;
        this.outputMode = b.outputMode;
        this.outputVersion = b.outputVersion;
        this.dryRun = b.dryRun;
    }

    public static Builder builder(DocumentType type) {
        return new Builder(type);
    }

    public static final class Builder {
        private final DocumentType documentType;
        private String revision;
        private List<String> pathFilters;
        private String customTemplate;
        private Path outputFile;
        private OutputMode outputMode;
        private String outputVersion;
        private boolean dryRun;

        private Builder(DocumentType documentType) {
            this.documentType = documentType;
        }

        public Builder revision(String revision) {
            this.revision = revision;
            return this;
        }

        public Builder pathFilters(List<String> pathFilters) {
            this.pathFilters = pathFilters;
            return this;
        }

        public Builder customTemplate(String customTemplate) {
            this.customTemplate = customTemplate;
            return this;
        }

        public Builder outputFile(Path outputFile) {
            this.outputFile = outputFile;
            return this;
        }

        public Builder outputMode(OutputMode outputMode) {
            this.outputMode = outputMode;
            return this;
        }

        public Builder outputVersion(String outputVersion) {
            this.outputVersion = outputVersion;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public GenerationRequest build() {
            return new GenerationRequest(this);
        }
    }
}
