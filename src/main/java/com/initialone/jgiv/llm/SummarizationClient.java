package com.initialone.jgiv.llm;

import java.io.IOException;

/**
 * Text-in, text-out language model call. One attempt per invocation;
 * retries and backoff are the caller's business.
 */
public interface SummarizationClient {
    String summarize(String prompt) throws IOException;
}
