package com.agentflow.fgc.api;

import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Per-run generation options. Passed to every converter call and never
 * mutated; derive variants with {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class GenerationContext {
    @Builder.Default
    TargetLanguage language = TargetLanguage.TYPESCRIPT;
    @Builder.Default
    String projectName = "langchain-app";
    @Builder.Default
    String environment = "development";
    boolean includeTracing;
    @Builder.Default
    boolean includeComments = true;
    CodeStyle codeStyle;
    /** Node id to generated variable, assigned once per conversion run. */
    @Builder.Default
    Map<String, String> variableNames = Map.of();

    /** Style to use; falls back to the language default when none was set. */
    public CodeStyle style() {
        return codeStyle != null ? codeStyle : CodeStyle.forLanguage(language);
    }

    /** Variable assigned to the node for this run, or null when none was. */
    public String variableFor(String nodeId) {
        return variableNames.get(nodeId);
    }

    public static GenerationContext forLanguage(TargetLanguage language) {
        return builder().language(language).build();
    }
}
