package com.agentflow.fgc.api;

import java.util.List;

import com.agentflow.fgc.ir.IRNode;

/**
 * Maps one IR node type to code fragments plus the external packages the
 * generated code needs.
 *
 * <p>
 * Implementations must be stateless: {@link #convert} may not mutate the node
 * or the context and may not perform I/O. A converter instance is shared by
 * every conversion running in the process.
 */
public interface Converter {

    /** Primary node type this converter handles, e.g. {@code chatOpenAI}. */
    String nodeType();

    String category();

    /** Additional type identifiers resolved to this converter. */
    default List<String> aliases() {
        return List.of();
    }

    /** Supported component versions; empty accepts any version. */
    default List<String> supportedVersions() {
        return List.of();
    }

    default boolean isDeprecated() {
        return false;
    }

    /** Type to migrate to when {@link #isDeprecated()} is true. */
    default String replacementType() {
        return null;
    }

    /** Type and version guard. */
    default boolean canConvert(IRNode node) {
        boolean typeMatches = nodeType().equals(node.type()) || aliases().contains(node.type());
        if (!typeMatches)
            return false;
        List<String> versions = supportedVersions();
        return versions.isEmpty() || node.version() == null || versions.contains(node.version());
    }

    List<CodeFragment> convert(IRNode node, GenerationContext context);

    List<String> getDependencies(IRNode node, GenerationContext context);
}
