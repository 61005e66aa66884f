package com.initialone.jgiv.core;

import com.initialone.jgiv.errors.OutputException;
import com.initialone.jgiv.model.GeneratedPayload;
import com.initialone.jgiv.model.OutputMode;
import com.initialone.jgiv.util.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies a generated payload to its target according to an output mode.
 *
 * <ul>
 *   <li>{@code none}: nothing is written, the payload is handed back for display.</li>
 *   <li>{@code overwrite}: the file becomes the payload.</li>
 *   <li>{@code append} / {@code prepend}: the payload is added verbatim after / before the existing text.</li>
 *   <li>{@code update}: the {@code ## <version>} section is replaced in place, or inserted
 *       as the newest section when the file has none.</li>
 * </ul>
 *
 * Every write goes through a temporary file and an atomic rename, so a failed
 * merge leaves the previous content in place.
 */
public class SectionMerger {
    private static final Logger log = LoggerFactory.getLogger(SectionMerger.class);

    private static final Pattern HEADING = Pattern.compile("(#{1,6})[ \\t]+(.*)");

    public MergeOutcome merge(Path target, GeneratedPayload payload, OutputMode mode) {
        OutputMode resolved = AutoModeTable.resolve(payload.documentType, mode);
        if (resolved == OutputMode.NONE || target == null) {
            return new MergeOutcome(OutputMode.NONE, MergeOutcome.Action.DISPLAYED, null, payload.text);
        }
        if (Files.isDirectory(target)) {
            throw new OutputException(target, "output target is a directory", null);
        }

        boolean exists = Files.exists(target);
        String existing = exists ? read(target) : "";
        String content;
        MergeOutcome.Action action;
        switch (resolved) {
            case OVERWRITE:
                content = stripTrailingNewlines(payload.text) + "\n";
                action = exists ? MergeOutcome.Action.OVERWRITTEN : MergeOutcome.Action.CREATED;
                break;
            case APPEND:
                content = existing + payload.text;
                action = exists ? MergeOutcome.Action.APPENDED : MergeOutcome.Action.CREATED;
                break;
            case PREPEND:
                content = payload.text + existing;
                action = exists ? MergeOutcome.Action.PREPENDED : MergeOutcome.Action.CREATED;
                break;
            case UPDATE: {
                String body = sectionBody(payload);
                String title = payload.documentType.title;
                List<Heading> headings = headings(existing);
                Heading section = findVersionHeading(headings, payload.versionLabel);
                if (section != null) {
                    content = replaceSection(existing, headings, section, body);
                    action = MergeOutcome.Action.SECTION_REPLACED;
                } else {
                    content = insertSection(existing, headings, payload.versionLabel, body, title);
                    action = exists ? MergeOutcome.Action.SECTION_INSERTED : MergeOutcome.Action.CREATED;
                }
                break;
            }
            default:
                throw new IllegalStateException("unresolved output mode: " + resolved);
        }

        try {
            AtomicFiles.writeString(target, content);
        } catch (IOException e) {
            throw new OutputException(target, "failed to write output", e);
        }
        log.debug("{} {} ({} chars)", action, target, content.length());
        return new MergeOutcome(resolved, action, target, content);
    }

    private static String read(Path target) {
        try {
            return Files.readString(target, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OutputException(target, "failed to read existing output", e);
        }
    }

    // ---- update mode ----

    static String replaceSection(String text, List<Heading> headings, Heading section, String body) {
        String nl = lineSeparator(text);
        int end = text.length();
        for (Heading h : headings) {
            if (h.start > section.start && h.level <= 2) {
                end = h.start;
                break;
            }
        }
        StringBuilder sb = new StringBuilder();
        sb.append(text, 0, section.end).append(nl).append(nl);
        sb.append(withSeparator(body, nl)).append(nl);
        if (end < text.length()) {
            sb.append(nl).append(text, end, text.length());
        }
        return sb.toString();
    }

    static String insertSection(String text, List<Heading> headings, String version, String body, String title) {
        String nl = lineSeparator(text);
        String section = "## " + version + nl + nl + withSeparator(body, nl) + nl;
        if (text.isBlank()) {
            return title == null ? section : title + nl + nl + section;
        }

        Heading first = headings.isEmpty() ? null : headings.get(0);
        boolean titled = first != null && first.level == 1 && text.substring(0, first.start).isBlank();
        if (!titled) {
            return section + nl + text;
        }

        // newest section goes before the first existing one, after any intro text
        int at = text.length();
        for (Heading h : headings) {
            if (h.start > first.start && h.level <= 2) {
                at = h.start;
                break;
            }
        }
        StringBuilder sb = new StringBuilder(text.substring(0, at));
        if (!endsWith(sb, nl)) sb.append(nl);
        if (!endsWith(sb, nl + nl)) sb.append(nl);
        sb.append(section);
        if (at < text.length()) {
            sb.append(nl).append(text, at, text.length());
        }
        return sb.toString();
    }

    static Heading findVersionHeading(List<Heading> headings, String version) {
        for (Heading h : headings) {
            if (h.level == 2 && version.equals(label(h.text))) return h;
        }
        return null;
    }

    /** Version part of a heading: {@code [1.2.0] - 2024-05-01} and {@code 1.2.0 (beta)} both give 1.2.0. */
    static String label(String headingText) {
        String t = headingText.trim();
        if (t.startsWith("[")) {
            int close = t.indexOf(']');
            return close < 0 ? t.substring(1) : t.substring(1, close);
        }
        int ws = 0;
        while (ws < t.length() && !Character.isWhitespace(t.charAt(ws))) ws++;
        return t.substring(0, ws);
    }

    /**
     * Payload text as a section body: a leading heading that repeats the
     * version is dropped and level 1-2 headings are demoted, so the file
     * keeps one section per version.
     */
    static String sectionBody(GeneratedPayload payload) {
        String text = payload.text.strip();
        List<Heading> hs = headings(text);
        if (!hs.isEmpty() && hs.get(0).start == 0 && hs.get(0).level <= 3
                && payload.versionLabel.equals(label(hs.get(0).text))) {
            text = text.substring(hs.get(0).end).strip();
        }
        if (text.isEmpty()) {
            text = payload.documentType.emptyPayload.strip();
        }

        StringBuilder sb = new StringBuilder();
        boolean inFence = false;
        for (String line : text.split("\\R", -1)) {
            if (sb.length() > 0) sb.append('\n');
            if (isFence(line)) {
                inFence = !inFence;
            } else if (!inFence) {
                Matcher m = HEADING.matcher(line);
                if (m.matches() && m.group(1).length() <= 2) {
                    sb.append("### ").append(m.group(2));
                    continue;
                }
            }
            sb.append(line);
        }
        return sb.toString();
    }

    /** ATX headings outside fenced code blocks. */
    static List<Heading> headings(String s) {
        List<Heading> out = new ArrayList<>();
        boolean inFence = false;
        int pos = 0;
        int n = s.length();
        while (pos < n) {
            int eol = s.indexOf('\n', pos);
            int next = eol < 0 ? n : eol + 1;
            int contentEnd = eol < 0 ? n : eol;
            if (contentEnd > pos && s.charAt(contentEnd - 1) == '\r') contentEnd--;
            String line = s.substring(pos, contentEnd);
            if (isFence(line)) {
                inFence = !inFence;
            } else if (!inFence) {
                Matcher m = HEADING.matcher(line);
                if (m.matches() && !m.group(2).isBlank()) {
                    out.add(new Heading(m.group(1).length(), m.group(2).trim(), pos, contentEnd));
                }
            }
            pos = next;
        }
        return out;
    }

    private static boolean isFence(String line) {
        String t = line.stripLeading();
        return t.startsWith("```") || t.startsWith("~~~");
    }

    private static String lineSeparator(String text) {
        return text.contains("\r\n") ? "\r\n" : "\n";
    }

    private static String withSeparator(String body, String nl) {
        return "\n".equals(nl) ? body : body.replace("\n", nl);
    }

    private static boolean endsWith(StringBuilder sb, String suffix) {
        int from = sb.length() - suffix.length();
        return from >= 0 && sb.indexOf(suffix, from) == from;
    }

    private static String stripTrailingNewlines(String s) {
        int end = s.length();
        while (end > 0 && (s.charAt(end - 1) == '\n' || s.charAt(end - 1) == '\r')) end--;
        return s.substring(0, end);
    }

    static final class Heading {
        final int level;
        final String text;
        /** Offset of the first '#'. */
        final int start;
        /** Offset just past the heading text, before its line break. */
        final int end;

        Heading(int level, String text, int start, int end) {
            this.level = level;
            this.text = text;
            this.start = start;
            this.end = end;
        }
    }
}
