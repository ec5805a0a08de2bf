package com.agentflow.fgc.engine;

import java.util.List;

import com.agentflow.fgc.api.CodeFragment;
import com.agentflow.fgc.api.ValidationIssue;

/**
 * Outcome of one conversion run.
 *
 * @param fragments      fragments in emission order
 * @param dependencies   external packages, de-duplicated and sorted
 * @param convertedNodes node ids whose converter ran, in traversal order
 * @param skippedNodes   node ids left out of the fragment stream
 * @param aborted        true when the graph was unsound and nothing was converted
 */
public record ConversionResult(
        List<CodeFragment> fragments,
        List<String> dependencies,
        List<ValidationIssue> warnings,
        List<ValidationIssue> errors,
        List<String> convertedNodes,
        List<String> skippedNodes,
        boolean aborted) {

    public ConversionResult {
        fragments = List.copyOf(fragments);
        dependencies = List.copyOf(dependencies);
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
        convertedNodes = List.copyOf(convertedNodes);
        skippedNodes = List.copyOf(skippedNodes);
    }

    static ConversionResult aborted(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        return new ConversionResult(List.of(), List.of(), warnings, errors, List.of(), List.of(), true);
    }

    public boolean isSuccess() {
        return !aborted && errors.isEmpty();
    }
}
