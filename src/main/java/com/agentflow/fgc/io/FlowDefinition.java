package com.agentflow.fgc.io;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * POJO representation of an exported flow.
 *
 * <p>
 * Fields the converter does not understand are kept in each object's
 * {@code extras} map rather than rejected, so newer exports still load.
 */
@Data
public final class FlowDefinition {
    private List<NodeDef> nodes;
    private List<EdgeDef> edges;
    @JsonIgnore
    private Map<String, Object> extras = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extras.put(key, value);
    }

    /** A node as placed on the canvas. */
    @Data
    public static final class NodeDef {
        private String id, type;
        private NodeData data;
        @JsonIgnore
        private Map<String, Object> extras = new LinkedHashMap<>();

        @JsonAnySetter
        public void putExtra(String key, Object value) {
            extras.put(key, value);
        }
    }

    /** Component payload of a node: identity, declared inputs and configured values. */
    @Data
    public static final class NodeData {
        private String id, label, name, type, category, description, version;
        private List<ParamDef> inputParams;
        private List<AnchorDef> inputAnchors;
        private List<AnchorDef> outputAnchors;
        private Map<String, Object> inputs;
        private Map<String, Object> outputs;
        @JsonIgnore
        private Map<String, Object> extras = new LinkedHashMap<>();

        @JsonAnySetter
        public void putExtra(String key, Object value) {
            extras.put(key, value);
        }
    }

    /** Declared configuration parameter. */
    @Data
    public static final class ParamDef {
        private String id, name, label, type, description;
        private Boolean optional;
        private Boolean list;
        @JsonProperty("default")
        private Object defaultValue;
        @JsonIgnore
        private Map<String, Object> extras = new LinkedHashMap<>();

        @JsonAnySetter
        public void putExtra(String key, Object value) {
            extras.put(key, value);
        }
    }

    /** Input or output anchor a connection attaches to. */
    @Data
    public static final class AnchorDef {
        private String id, name, label, type, description;
        private Boolean optional;
        private Boolean list;
        @JsonIgnore
        private Map<String, Object> extras = new LinkedHashMap<>();

        @JsonAnySetter
        public void putExtra(String key, Object value) {
            extras.put(key, value);
        }
    }

    @Data
    public static final class EdgeDef {
        private String id, source, target, sourceHandle, targetHandle, type;
        @JsonIgnore
        private Map<String, Object> extras = new LinkedHashMap<>();

        @JsonAnySetter
        public void putExtra(String key, Object value) {
            extras.put(key, value);
        }
    }
}
