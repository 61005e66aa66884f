package com.initialone.jgiv.commands;

import com.initialone.jgiv.model.DocumentType;
import picocli.CommandLine;

@CommandLine.Command(
        name = "summary",
        description = "Summarize the changes in a revision or range"
)
public class SummaryCmd extends AbstractGenerateCmd {
    @Override
    protected DocumentType type() {
        return DocumentType.SUMMARY;
    }
}
