package com.initialone.jgiv.commands;

import com.initialone.jgiv.model.DocumentType;
import picocli.CommandLine;

@CommandLine.Command(
        name = "document",
        description = "Generate a free-form document from a custom prompt template"
)
public class DocumentCmd extends AbstractGenerateCmd {
    @CommandLine.Option(names = "--prompt-file", required = true,
            description = "Template file; {{SUMMARY}}, {{VERSION}}, {{PROJECT_TITLE}} etc. are filled in")
    String promptFile;

    @Override
    protected DocumentType type() {
        return DocumentType.DOCUMENT;
    }

    @Override
    protected String customTemplate() {
        return promptFile;
    }
}
