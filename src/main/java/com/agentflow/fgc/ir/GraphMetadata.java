package com.agentflow.fgc.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Flow-level information carried alongside the IR graph. */
public record GraphMetadata(String name, String description, String version, Map<String, Object> attributes) {

    public GraphMetadata {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static GraphMetadata named(String name) {
        return new GraphMetadata(name, null, null, Map.of());
    }
}
