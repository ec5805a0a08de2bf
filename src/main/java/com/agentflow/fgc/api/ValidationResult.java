package com.agentflow.fgc.api;

import java.util.List;

/**
 * Outcome of a validation pass. Produced fresh per call.
 */
public record ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings,
        List<ValidationSuggestion> suggestions) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        suggestions = List.copyOf(suggestions);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationIssue> errorsOfType(IssueType type) {
        return errors.stream().filter(e -> e.getType() == type).toList();
    }

    public boolean hasFatalErrors() {
        for (ValidationIssue e : errors)
            if (e.getType().isFatalForConversion())
                return true;
        return false;
    }
}
