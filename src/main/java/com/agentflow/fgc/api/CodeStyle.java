package com.agentflow.fgc.api;

/**
 * Formatting options for generated code.
 */
public record CodeStyle(int indentSize, boolean useSpaces, boolean semicolons, boolean singleQuotes) {

    public CodeStyle {
        if (indentSize < 0)
            throw new IllegalArgumentException("indentSize must not be negative: " + indentSize);
    }

    public static CodeStyle forLanguage(TargetLanguage language) {
        return language == TargetLanguage.PYTHON
                ? new CodeStyle(4, true, false, false)
                : new CodeStyle(2, true, true, true);
    }

    public String indent(int level) {
        String unit = useSpaces ? " ".repeat(indentSize) : "\t";
        return unit.repeat(level);
    }

    public String terminator() {
        return semicolons ? ";" : "";
    }

    public char quote() {
        return singleQuotes ? '\'' : '"';
    }
}
