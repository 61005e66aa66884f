package com.initialone.jgiv.llm;

import picocli.CommandLine;

/** LLM flags shared by every generating command. Unset flags fall back to config, then env. */
public class LlmOptions {

    @CommandLine.Option(names = "--provider",
            description = "openai | deepseek | local (default: config api.provider, else openai)")
    public String provider;

    @CommandLine.Option(names = "--local-api", defaultValue = "openai",
            description = "When --provider=local: openai | ollama (default: ${DEFAULT-VALUE})")
    public String localApi;

    @CommandLine.Option(names = {"--model", "--api-model"},
            description = "Model name (default: config api.model, else provider default)")
    public String model;

    @CommandLine.Option(names = {"--endpoint", "--api-url"},
            description = "Override base URL, e.g. https://api.openai.com or http://localhost:11434")
    public String endpoint;

    @CommandLine.Option(names = "--api-key",
            description = "API key (default: config api.key, OPENAI_API_KEY / DEEPSEEK_API_KEY)")
    public String apiKey;

    @CommandLine.Option(names = "--timeout-sec", defaultValue = "60",
            description = "Per-call timeout in seconds (default: ${DEFAULT-VALUE})")
    public int timeoutSec;

    @CommandLine.Option(names = "--max-tokens",
            description = "Max tokens per completion (default: config max_tokens, else 8192)")
    public Integer maxTokens;
}
