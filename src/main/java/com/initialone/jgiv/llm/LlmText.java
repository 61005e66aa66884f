package com.initialone.jgiv.llm;

/** Prompt and response clean-up shared by the HTTP clients. */
final class LlmText {
    static final String SYSTEM_PROMPT =
            "You are a senior software engineer who writes clear, accurate release documentation "
                    + "from git history. Do not invent changes that are not in the input.";

    private LlmText() {}

    /** Unwraps a reply that is entirely one fenced block, e.g. ```markdown ... ```. */
    static String stripOuterFence(String s) {
        String t = s == null ? "" : s.strip();
        if (!t.startsWith("```") || !t.endsWith("```") || t.length() < 6) return t;
        int firstNl = t.indexOf('\n');
        if (firstNl < 0) return t;
        String inner = t.substring(firstNl + 1, t.length() - 3);
        if (inner.contains("```")) return t;
        return inner.strip();
    }

    /** Truncates error bodies so they fit on one log line. */
    static String safeTrim(String s) {
        s = s == null ? "" : s.replaceAll("\\s+", " ");
        return s.length() > 300 ? s.substring(0, 300) + "..." : s;
    }

    static String stripTrailingSlash(String u) {
        return u.endsWith("/") ? u.substring(0, u.length() - 1) : u;
    }
}
