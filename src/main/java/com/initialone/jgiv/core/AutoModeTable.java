package com.initialone.jgiv.core;

import com.initialone.jgiv.model.DocumentType;
import com.initialone.jgiv.model.OutputMode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** What {@code auto} means for each document type. */
public final class AutoModeTable {
    private static final Map<DocumentType, OutputMode> MODES;

    static {
        EnumMap<DocumentType, OutputMode> m = new EnumMap<>(DocumentType.class);
        m.put(DocumentType.CHANGELOG, OutputMode.UPDATE);
        m.put(DocumentType.RELEASE_NOTES, OutputMode.OVERWRITE);
        m.put(DocumentType.ANNOUNCEMENT, OutputMode.OVERWRITE);
        m.put(DocumentType.MESSAGE, OutputMode.NONE);
        m.put(DocumentType.SUMMARY, OutputMode.NONE);
        m.put(DocumentType.DOCUMENT, OutputMode.NONE);
        MODES = Collections.unmodifiableMap(m);
    }

    private AutoModeTable() {}

    /** Concrete mode for {@code mode}; anything but AUTO passes through. */
    public static OutputMode resolve(DocumentType type, OutputMode mode) {
        if (mode != OutputMode.AUTO) return mode;
        return MODES.getOrDefault(type, OutputMode.NONE);
    }

    public static Map<DocumentType, OutputMode> table() {
        return MODES;
    }
}
