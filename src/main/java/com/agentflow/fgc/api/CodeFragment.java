package com.agentflow.fgc.api;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One named, ordered, language-tagged chunk of generated source.
 *
 * <p>
 * {@code order} sorts fragments of the same kind produced by one node.
 * {@code exports} lists the variables the fragment defines; the first one is
 * what downstream nodes reference. {@code nodeId} is null for graph-level
 * fragments.
 */
@Value
@Builder(toBuilder = true)
public class CodeFragment {
    String id;
    FragmentKind kind;
    String content;
    @Singular
    List<String> dependencies;
    TargetLanguage language;
    int order;
    String nodeId;
    @Singular
    List<String> exports;
    String description;

    public String primaryExport() {
        return exports.isEmpty() ? null : exports.get(0);
    }
}
