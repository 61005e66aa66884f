package com.initialone.jgiv.commands;

import com.initialone.jgiv.model.OutputMode;
import picocli.CommandLine;

import java.nio.file.Path;

public class OutputOptions {

    @CommandLine.Option(names = "--output-file",
            description = "Write here instead of the configured / default file")
    public Path outputFile;

    @CommandLine.Option(names = "--output-mode",
            description = "auto | prepend | append | update | overwrite | none (default: config, else auto)")
    public OutputMode outputMode;

    @CommandLine.Option(names = "--output-version",
            description = "Version label for the section / file name (default: detected from the project)")
    public String outputVersion;

    @CommandLine.Option(names = "--dry-run",
            description = "Print the final prompt instead of calling the model; writes nothing")
    public boolean dryRun;
}
