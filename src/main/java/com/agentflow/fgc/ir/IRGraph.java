package com.agentflow.fgc.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable node/connection model the conversion pipeline operates on.
 *
 * <p>
 * The constructor precomputes an id index and adjacency lists so the analyzer
 * never scans the connection list per node. When several nodes share an id the
 * index keeps the first one; the duplicates are still listed in
 * {@link #nodes()} so validation can report them.
 *
 * <p>
 * Two adjacency views are kept:
 * <ul>
 * <li>{@link #incoming(String)}/{@link #outgoing(String)}: every connection
 * touching the id, including ones whose other endpoint does not exist.</li>
 * <li>{@link #predecessors(String)}/{@link #successors(String)}: node ids
 * reachable over resolvable connections only. Graph algorithms use these.</li>
 * </ul>
 */
public final class IRGraph {
    private final List<IRNode> nodes;
    private final List<IRConnection> connections;
    private final GraphMetadata metadata;

    // first occurrence wins
    private final Map<String, IRNode> nodeIndex;
    private final Map<String, Integer> positionIndex;
    private final List<String> nodeIds;

    private final Map<String, List<IRConnection>> incoming = new HashMap<>();
    private final Map<String, List<IRConnection>> outgoing = new HashMap<>();
    private final Map<String, List<String>> predecessors = new HashMap<>();
    private final Map<String, List<String>> successors = new HashMap<>();

    public IRGraph(List<IRNode> nodes, List<IRConnection> connections, GraphMetadata metadata) {
        this.nodes = List.copyOf(nodes);
        this.connections = List.copyOf(connections);
        this.metadata = metadata == null ? GraphMetadata.named("untitled") : metadata;

        Map<String, IRNode> index = new LinkedHashMap<>(nodes.size() * 2);
        Map<String, Integer> positions = new HashMap<>(nodes.size() * 2);
        List<String> ids = new ArrayList<>(nodes.size());
        for (IRNode node : this.nodes) {
            if (index.putIfAbsent(node.id(), node) == null) {
                positions.put(node.id(), ids.size());
                ids.add(node.id());
            }
        }
        this.nodeIndex = Collections.unmodifiableMap(index);
        this.positionIndex = positions;
        this.nodeIds = Collections.unmodifiableList(ids);

        for (IRConnection c : this.connections) {
            outgoing.computeIfAbsent(c.source(), k -> new ArrayList<>()).add(c);
            incoming.computeIfAbsent(c.target(), k -> new ArrayList<>()).add(c);
            if (index.containsKey(c.source()) && index.containsKey(c.target())) {
                successors.computeIfAbsent(c.source(), k -> new ArrayList<>()).add(c.target());
                predecessors.computeIfAbsent(c.target(), k -> new ArrayList<>()).add(c.source());
            }
        }
    }

    /** All nodes in declaration order, duplicates included. */
    public List<IRNode> nodes() {
        return nodes;
    }

    public List<IRConnection> connections() {
        return connections;
    }

    public GraphMetadata metadata() {
        return metadata;
    }

    /** Distinct node ids in first-occurrence order. */
    public List<String> nodeIds() {
        return nodeIds;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public boolean hasNode(String id) {
        return nodeIndex.containsKey(id);
    }

    public IRNode node(String id) {
        IRNode node = nodeIndex.get(id);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return node;
    }

    /** Position of the id in {@link #nodeIds()}, used as a stable tie-break. */
    public int position(String id) {
        Integer pos = positionIndex.get(id);
        if (pos == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return pos;
    }

    public List<IRConnection> incoming(String id) {
        return incoming.getOrDefault(id, List.of());
    }

    public List<IRConnection> outgoing(String id) {
        return outgoing.getOrDefault(id, List.of());
    }

    /** Source ids of resolvable connections into {@code id}, one entry per edge. */
    public List<String> predecessors(String id) {
        return predecessors.getOrDefault(id, List.of());
    }

    /** Target ids of resolvable connections out of {@code id}, one entry per edge. */
    public List<String> successors(String id) {
        return successors.getOrDefault(id, List.of());
    }

    @Override
    public String toString() {
        return "IRGraph[" + metadata.name() + ", nodes=" + nodes.size() + ", connections=" + connections.size() + "]";
    }
}
