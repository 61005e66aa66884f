package com.initialone.jgiv.template;

import com.initialone.jgiv.errors.TemplateException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds prompt templates and substitutes {{TOKEN}} / [TOKEN] placeholders.
 *
 * Search order for a bare name: project .giv/templates (walking up),
 * ~/.giv/templates, then the templates bundled in the jar. A name that is an
 * existing file, or contains a path separator, is used as a path.
 * Unknown tokens are left as they are.
 */
public class TemplateEngine {
    static final String BUNDLED_ROOT = "/templates/";
    // {{TOKEN}} or the legacy [TOKEN]
    private static final Pattern TOKEN = Pattern.compile("\\{\\{([A-Z][A-Z0-9_]*)}}|\\[([A-Z][A-Z0-9_]*)]");

    private final Path projectDir;
    private final Path userHome;

    public TemplateEngine(Path projectDir, Path userHome) {
        this.projectDir = projectDir;
        this.userHome = userHome;
    }

    public String render(String nameOrPath, Map<String, String> context) {
        return renderText(load(nameOrPath), context);
    }

    public String load(String nameOrPath) {
        if (nameOrPath == null || nameOrPath.isBlank()) {
            throw new TemplateException("template name is empty");
        }
        Path direct = Path.of(nameOrPath);
        if (Files.isRegularFile(direct)) return read(direct);
        if (nameOrPath.contains("/") || nameOrPath.contains("\\")) {
            throw new TemplateException("template not found: " + direct.toAbsolutePath());
        }

        for (Path dir = projectDir.toAbsolutePath(); dir != null; dir = dir.getParent()) {
            Path p = dir.resolve(".giv").resolve("templates").resolve(nameOrPath);
            if (Files.isRegularFile(p)) return read(p);
        }
        if (userHome != null) {
            Path p = userHome.resolve(".giv").resolve("templates").resolve(nameOrPath);
            if (Files.isRegularFile(p)) return read(p);
        }
        try (InputStream in = TemplateEngine.class.getResourceAsStream(BUNDLED_ROOT + nameOrPath)) {
            if (in != null) return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TemplateException("cannot read bundled template " + nameOrPath, e);
        }
        throw new TemplateException("template not found: " + nameOrPath);
    }

    /** Single pass, so placeholders inside substituted values (e.g. a diff) stay untouched. */
    public static String renderText(String template, Map<String, String> context) {
        Matcher m = TOKEN.matcher(template);
        StringBuilder sb = new StringBuilder(template.length() + 256);
        while (m.find()) {
            String key = m.group(1) != null ? m.group(1) : m.group(2);
            String replacement = context.containsKey(key)
                    ? (context.get(key) == null ? "" : context.get(key))
                    : m.group();
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String read(Path p) {
        try {
            return Files.readString(p, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TemplateException("cannot read template " + p, e);
        }
    }
}
