package com.agentflow.fgc.util;

import java.util.List;

import com.agentflow.fgc.engine.GraphStats;
import com.agentflow.fgc.engine.IRGraphAnalyzer;
import com.agentflow.fgc.engine.TopologicalSortResult;
import com.agentflow.fgc.ir.IRConnection;
import com.agentflow.fgc.ir.IRGraph;
import com.agentflow.fgc.ir.IRNode;
import com.agentflow.fgc.ir.IRParameter;

/**
 * Diagnostic renderings of an IR graph.
 *
 * <p>
 * Intended for the CLI {@code analyze} command, logs and error reports.
 */
public final class FlowExplain {
    private final IRGraph graph;

    public FlowExplain(IRGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(String nodeId) {
        IRNode node = graph.node(nodeId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeId).append('\n')
                .append("  Type: ").append(node.type()).append('\n')
                .append("  Category: ").append(node.category()).append('\n')
                .append("  Label: ").append(node.label()).append('\n');
        sb.append("  Parameters (").append(node.parameters().size()).append("):\n");
        for (IRParameter p : node.parameters()) {
            sb.append("    ").append(p.name()).append(" = ")
                    .append(p.isSecret() && p.isSet() ? "******" : String.valueOf(p.value()));
            if (p.required())
                sb.append(" (required)");
            sb.append('\n');
        }
        List<String> parents = graph.predecessors(nodeId), children = graph.successors(nodeId);
        sb.append("  Inputs (").append(parents.size()).append("): ").append(String.join(", ", parents)).append('\n');
        sb.append("  Outputs (").append(children.size()).append("): ").append(String.join(", ", children));
        return sb.append('\n').toString();
    }

    /**
     * Dumps the topology in conversion order, one node per line.
     */
    public String dumpTopology() {
        TopologicalSortResult topo = IRGraphAnalyzer.topologicalSort(graph);
        List<String> order = topo.isAcyclic() ? topo.sorted() : graph.nodeIds();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Flow '").append(graph.metadata().name()).append("' (").append(graph.nodeCount())
                .append(" nodes");
        if (!topo.isAcyclic())
            sb.append(", CYCLIC");
        sb.append("):\n");
        for (int i = 0; i < order.size(); i++) {
            String id = order.get(i);
            IRNode node = graph.node(id);
            sb.append("  [").append(i).append("] ").append(id).append(" <").append(node.type()).append('>');
            List<String> children = graph.successors(id);
            if (graph.predecessors(id).isEmpty())
                sb.append(" (ENTRY)");
            if (!children.isEmpty())
                sb.append(" -> ").append(String.join(", ", children));
            sb.append('\n');
        }
        return sb.toString();
    }

    /** Multi-line summary of {@link IRGraphAnalyzer#analyzeGraph}. */
    public String summary() {
        GraphStats stats = IRGraphAnalyzer.analyzeGraph(graph);
        StringBuilder sb = new StringBuilder(512);
        sb.append(String.format("%-16s %s%n", "Flow:", graph.metadata().name()));
        sb.append(String.format("%-16s %d%n", "Nodes:", stats.nodeCount()));
        sb.append(String.format("%-16s %d%n", "Connections:", stats.connectionCount()));
        sb.append(String.format("%-16s %.2f%n", "Avg degree:", stats.averageDegree()));
        sb.append(String.format("%-16s %d%n", "Max depth:", stats.maxDepth()));
        sb.append(String.format("%-16s %s%n", "Complexity:", stats.complexity().code()));
        sb.append(String.format("%-16s %s%n", "Entry points:", stats.entryPoints()));
        sb.append(String.format("%-16s %s%n", "Exit points:", stats.exitPoints()));
        sb.append(String.format("%-16s %s%n", "Isolated:", stats.isolatedNodes()));
        sb.append(String.format("%-16s %s%n", "Bottlenecks:", stats.bottlenecks()));
        sb.append(String.format("%-16s %s%n", "Critical path:", String.join(" -> ", stats.criticalPath())));
        sb.append(String.format("%-16s %s%n", "Node types:", stats.nodeTypes()));
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart.
     * <p>
     * Edges carry the target port name as label when one is known.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("graph TD;\n");

        // 1. Declare nodes in declaration order
        for (String id : graph.nodeIds()) {
            IRNode node = graph.node(id);
            sb.append("  ").append(sanitize(id)).append("[\"").append(escape(node.label()))
                    .append("<br/><i>").append(escape(node.type())).append("</i>\"];\n");
        }

        // 2. Then every resolvable edge
        for (IRConnection c : graph.connections()) {
            if (!graph.hasNode(c.source()) || !graph.hasNode(c.target()))
                continue;
            sb.append("  ").append(sanitize(c.source()));
            if (c.targetPort() != null)
                sb.append(" -- \"").append(escape(c.targetPort())).append("\" --> ");
            else
                sb.append(" --> ");
            sb.append(sanitize(c.target())).append(";\n");
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private static String escape(String text) {
        return text == null ? "" : text.replace("\"", "#quot;");
    }
}
