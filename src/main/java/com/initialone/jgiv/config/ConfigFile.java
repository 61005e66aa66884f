package com.initialone.jgiv.config;

import com.initialone.jgiv.errors.ConfigException;
import com.initialone.jgiv.util.AtomicFiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * KEY=VALUE config file as used by {@code .giv/config}.
 *
 * Keys are stored in their environment form (GIV_API_KEY); {@code api.key},
 * {@code api_key} and {@code GIV_API_KEY} all name the same entry.
 */
public final class ConfigFile {
    public static final String ENV_PREFIX = "GIV_";

    private static final List<String> KNOWN_KEYS = List.of(
            "api.url", "api.key", "api.model", "api.provider",
            "temperature", "max_tokens",
            "output_mode", "output_version",
            "changelog_file", "release_notes_file", "announcement_file",
            "cache_dir",
            "project.title", "project.version",
            "example", "rules");

    private static final Map<String, String> DISPLAY_KEYS = new LinkedHashMap<>();

    static {
        for (String k : KNOWN_KEYS) DISPLAY_KEYS.put(normalizeKey(k), k);
    }

    private ConfigFile() {}

    /** api.key / max_tokens / release-notes.output_mode -> GIV_API_KEY / GIV_MAX_TOKENS / GIV_RELEASE_NOTES_OUTPUT_MODE */
    public static String normalizeKey(String key) {
        String k = key == null ? "" : key.trim();
        if (k.isEmpty() || k.contains("/") || k.contains("=")) {
            throw new ConfigException("invalid config key '" + key + "'");
        }
        if (k.startsWith(ENV_PREFIX)) return k;
        return ENV_PREFIX + k.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }

    /** GIV_API_KEY -> api.key, GIV_MAX_TOKENS -> max_tokens; unknown keys stay in lower-case env form. */
    public static String displayKey(String envKey) {
        String known = DISPLAY_KEYS.get(envKey);
        if (known != null) return known;
        String k = envKey.startsWith(ENV_PREFIX) ? envKey.substring(ENV_PREFIX.length()) : envKey;
        return k.toLowerCase(Locale.ROOT);
    }

    public static Map<String, String> read(Path file) {
        Map<String, String> out = new LinkedHashMap<>();
        if (file == null || !Files.isRegularFile(file)) return out;
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("cannot read config file " + file, e);
        }
        for (String raw : content.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("export ")) line = line.substring("export ".length()).strip();
            int eq = line.indexOf('=');
            if (eq <= 0) continue;
            String key = line.substring(0, eq).strip();
            if (key.isEmpty()) continue;
            out.put(normalizeKey(key), unquote(line.substring(eq + 1)));
        }
        return out;
    }

    public static void write(Path file, Map<String, String> values) {
        StringBuilder sb = new StringBuilder();
        values.forEach((k, v) -> sb.append(k).append('=').append(quote(v)).append('\n'));
        try {
            AtomicFiles.writeString(file, sb.toString());
        } catch (IOException e) {
            throw new ConfigException("cannot write config file " + file, e);
        }
    }

    static String unquote(String v) {
        String t = v.strip();
        if (t.length() >= 2
                && ((t.startsWith("\"") && t.endsWith("\"")) || (t.startsWith("'") && t.endsWith("'")))) {
            return t.substring(1, t.length() - 1);
        }
        return t;
    }

    static String quote(String v) {
        if (v == null) return "\"\"";
        if (v.isEmpty() || v.chars().anyMatch(c -> c == ' ' || c == '"' || c == '\'' || c == '`' || c == '$' || c == '\\' || c == '#')) {
            return "\"" + v + "\"";
        }
        return v;
    }
}
