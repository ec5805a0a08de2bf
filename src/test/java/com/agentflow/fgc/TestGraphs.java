package com.agentflow.fgc;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.agentflow.fgc.ir.GraphMetadata;
import com.agentflow.fgc.ir.IRConnection;
import com.agentflow.fgc.ir.IRGraph;
import com.agentflow.fgc.ir.IRNode;
import com.agentflow.fgc.ir.IRParameter;
import com.agentflow.fgc.ir.IRPort;

/** Shorthand for building IR graphs and loading fixtures in tests. */
public final class TestGraphs {

    private TestGraphs() {
        // Utility class
    }

    public static IRNode node(String id, String type, IRParameter... params) {
        return new IRNode(id, type, "Test", id, "1", Arrays.asList(params), List.of(), List.of(), Map.of());
    }

    public static IRNode node(String id, String type, List<IRParameter> params, List<IRPort> inputs) {
        return new IRNode(id, type, "Test", id, "1", params, inputs, List.of(), Map.of());
    }

    public static IRParameter param(String name, Object value) {
        return new IRParameter(name, value, "string", true, null);
    }

    public static IRParameter optionalParam(String name, Object value) {
        return new IRParameter(name, value, "string", false, null);
    }

    public static IRPort port(String name) {
        return new IRPort(name, name, name, "any", false, false);
    }

    public static IRConnection edge(String source, String target) {
        return edge(source, target, null);
    }

    public static IRConnection edge(String source, String target, String targetPort) {
        return new IRConnection(source + "->" + target, source, target, null, null, null, targetPort);
    }

    public static IRGraph graph(List<IRNode> nodes, IRConnection... edges) {
        return new IRGraph(nodes, Arrays.asList(edges), GraphMetadata.named("test-flow"));
    }

    /** A linear chain {@code n0 -> n1 -> ... }. */
    public static IRGraph chain(int length, String type) {
        List<IRNode> nodes = new ArrayList<>(length);
        List<IRConnection> edges = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            nodes.add(node("n" + i, type));
            if (i > 0)
                edges.add(edge("n" + (i - 1), "n" + i));
        }
        return new IRGraph(nodes, edges, GraphMetadata.named("chain"));
    }

    public static byte[] fixture(String name) {
        try (InputStream in = TestGraphs.class.getClassLoader().getResourceAsStream("flows/" + name)) {
            if (in == null)
                throw new IllegalArgumentException("Missing fixture: " + name);
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
