package com.agentflow.fgc.api;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonValue;

/** Languages the emitters can produce, with the few syntax facts converters need. */
public enum TargetLanguage {
    TYPESCRIPT("typescript", "ts", "null", "//"),
    PYTHON("python", "py", "None", "#");

    private final String id;
    private final String extension;
    private final String nullLiteral;
    private final String lineComment;

    TargetLanguage(String id, String extension, String nullLiteral, String lineComment) {
        this.id = id;
        this.extension = extension;
        this.nullLiteral = nullLiteral;
        this.lineComment = lineComment;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String extension() {
        return extension;
    }

    public String nullLiteral() {
        return nullLiteral;
    }

    public String lineComment() {
        return lineComment;
    }

    public String booleanLiteral(boolean b) {
        if (this == PYTHON)
            return b ? "True" : "False";
        return Boolean.toString(b);
    }

    public String listLiteral(List<String> items) {
        return "[" + String.join(", ", items) + "]";
    }

    /** Accepts the id, the extension or the enum name, case-insensitively. */
    public static TargetLanguage fromId(String value) {
        if (value != null) {
            for (TargetLanguage l : values())
                if (l.id.equalsIgnoreCase(value) || l.extension.equalsIgnoreCase(value)
                        || l.name().equalsIgnoreCase(value))
                    return l;
        }
        throw new IllegalArgumentException("Unknown language: " + value);
    }
}
