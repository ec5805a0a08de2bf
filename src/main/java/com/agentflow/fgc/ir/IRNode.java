package com.agentflow.fgc.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A unit of computation in the IR graph. Immutable once built.
 */
public record IRNode(String id, String type, String category, String label, String version,
        List<IRParameter> parameters, List<IRPort> inputPorts, List<IRPort> outputPorts,
        Map<String, Object> attributes) {

    public IRNode {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        inputPorts = inputPorts == null ? List.of() : List.copyOf(inputPorts);
        outputPorts = outputPorts == null ? List.of() : List.copyOf(outputPorts);
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /** Returns the named parameter, or null if the node declares none. */
    public IRParameter parameter(String name) {
        for (IRParameter p : parameters)
            if (p.name().equals(name))
                return p;
        return null;
    }

    /** Returns the parameter value, or null when absent or unset. */
    public Object parameterValue(String name) {
        IRParameter p = parameter(name);
        return p != null && p.isSet() ? p.value() : null;
    }

    public IRPort inputPort(String name) {
        for (IRPort p : inputPorts)
            if (p.name().equals(name))
                return p;
        return null;
    }
}
