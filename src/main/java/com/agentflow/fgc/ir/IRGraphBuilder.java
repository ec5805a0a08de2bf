package com.agentflow.fgc.ir;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.agentflow.fgc.io.FlowDefinition;
import com.agentflow.fgc.io.FlowDefinition.AnchorDef;
import com.agentflow.fgc.io.FlowDefinition.EdgeDef;
import com.agentflow.fgc.io.FlowDefinition.NodeData;
import com.agentflow.fgc.io.FlowDefinition.NodeDef;
import com.agentflow.fgc.io.FlowDefinition.ParamDef;

import lombok.extern.log4j.Log4j2;

/**
 * Lifts a parsed {@link FlowDefinition} into an {@link IRGraph}.
 *
 * <p>
 * The builder is deliberately lenient: dangling edge endpoints and duplicate
 * node ids pass through untouched and are reported by
 * {@code IRGraphAnalyzer.validate}, which is the single authoritative check.
 */
@Log4j2
public final class IRGraphBuilder {
    public static final String DEFAULT_FLOW_NAME = "untitled-flow";
    static final String UNKNOWN_CATEGORY = "unknown";

    public IRGraph build(FlowDefinition def) {
        return build(def, DEFAULT_FLOW_NAME);
    }

    public IRGraph build(FlowDefinition def, String flowName) {
        List<NodeDef> nodeDefs = def.getNodes() == null ? List.of() : def.getNodes();
        List<EdgeDef> edgeDefs = def.getEdges() == null ? List.of() : def.getEdges();

        List<IRNode> nodes = new ArrayList<>(nodeDefs.size());
        for (NodeDef nd : nodeDefs)
            nodes.add(toNode(nd));

        List<IRConnection> connections = new ArrayList<>(edgeDefs.size());
        for (int i = 0; i < edgeDefs.size(); i++)
            connections.add(toConnection(edgeDefs.get(i), i));

        Map<String, Object> extras = def.getExtras();
        GraphMetadata metadata = new GraphMetadata(
                flowName == null || flowName.isBlank() ? DEFAULT_FLOW_NAME : flowName,
                asString(extras.get("description")),
                asString(extras.get("version")),
                extras);

        IRGraph graph = new IRGraph(nodes, connections, metadata);
        log.debug("Built {}", graph);
        return graph;
    }

    private IRNode toNode(NodeDef nd) {
        NodeData data = nd.getData() == null ? new NodeData() : nd.getData();
        String type = notBlank(data.getName()) ? data.getName() : nd.getType();
        String label = notBlank(data.getLabel()) ? data.getLabel() : type;
        String category = notBlank(data.getCategory()) ? data.getCategory() : UNKNOWN_CATEGORY;
        Map<String, Object> inputs = data.getInputs() == null ? Map.of() : data.getInputs();

        List<IRPort> inputPorts = toPorts(data.getInputAnchors());
        List<IRPort> outputPorts = toPorts(data.getOutputAnchors());
        Set<String> anchorNames = new HashSet<>();
        for (IRPort p : inputPorts)
            anchorNames.add(p.name());

        List<IRParameter> parameters = new ArrayList<>();
        Set<String> declared = new HashSet<>();
        if (data.getInputParams() != null) {
            for (ParamDef pd : data.getInputParams()) {
                if (pd == null || !notBlank(pd.getName()))
                    continue;
                declared.add(pd.getName());
                boolean required = !Boolean.TRUE.equals(pd.getOptional());
                Object value = inputs.containsKey(pd.getName()) ? inputs.get(pd.getName()) : null;
                if (isUnset(value))
                    value = pd.getDefaultValue() != null ? pd.getDefaultValue() : value;
                parameters.add(new IRParameter(pd.getName(), value, orDefault(pd.getType(), "string"), required,
                        pd.getDefaultValue()));
            }
        }
        // values configured without a declaration are kept as optional untyped params
        for (Map.Entry<String, Object> e : inputs.entrySet()) {
            if (declared.contains(e.getKey()) || anchorNames.contains(e.getKey()))
                continue;
            parameters.add(new IRParameter(e.getKey(), e.getValue(), "any", false, null));
        }

        Map<String, Object> attributes = new LinkedHashMap<>(nd.getExtras());
        attributes.put("nodeType", nd.getType());
        if (notBlank(data.getType()))
            attributes.put("componentClass", data.getType());
        if (notBlank(data.getDescription()))
            attributes.put("description", data.getDescription());
        if (data.getOutputs() != null && !data.getOutputs().isEmpty())
            attributes.put("outputs", data.getOutputs());

        return new IRNode(nd.getId(), type, category, label, data.getVersion(), parameters, inputPorts, outputPorts,
                attributes);
    }

    private static List<IRPort> toPorts(List<AnchorDef> anchors) {
        if (anchors == null)
            return List.of();
        List<IRPort> ports = new ArrayList<>(anchors.size());
        for (AnchorDef a : anchors) {
            if (a == null)
                continue;
            String name = notBlank(a.getName()) ? a.getName() : a.getId();
            ports.add(new IRPort(a.getId(), name, a.getLabel(), a.getType(),
                    Boolean.TRUE.equals(a.getOptional()), Boolean.TRUE.equals(a.getList())));
        }
        return ports;
    }

    private static IRConnection toConnection(EdgeDef ed, int index) {
        String id = notBlank(ed.getId()) ? ed.getId() : ed.getSource() + "-" + ed.getTarget() + "-" + index;
        return new IRConnection(id, ed.getSource(), ed.getTarget(), ed.getSourceHandle(), ed.getTargetHandle(),
                portName(ed.getSourceHandle(), ed.getSource(), "-output-"),
                portName(ed.getTargetHandle(), ed.getTarget(), "-input-"));
    }

    /**
     * Decodes a handle of the form {@code <nodeId>-input-<port>-<types>} (or
     * {@code -output-}) to the port name. Unrecognized handles are returned as-is.
     */
    static String portName(String handle, String nodeId, String marker) {
        if (handle == null)
            return null;
        int start;
        if (nodeId != null && handle.startsWith(nodeId + marker))
            start = nodeId.length() + marker.length();
        else {
            int at = handle.indexOf(marker);
            if (at < 0)
                return handle;
            start = at + marker.length();
        }
        int end = handle.indexOf('-', start);
        return end < 0 ? handle.substring(start) : handle.substring(start, end);
    }

    private static boolean isUnset(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    private static String orDefault(String s, String fallback) {
        return notBlank(s) ? s : fallback;
    }

    private static String asString(Object o) {
        return o == null ? null : o.toString();
    }
}
