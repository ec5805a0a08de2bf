package com.agentflow.fgc.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;

import com.agentflow.fgc.api.IssueType;
import com.agentflow.fgc.api.Severity;
import com.agentflow.fgc.api.ValidationIssue;
import com.agentflow.fgc.api.ValidationResult;
import com.agentflow.fgc.api.ValidationSuggestion;
import com.agentflow.fgc.ir.GraphMetadata;
import com.agentflow.fgc.ir.IRConnection;
import com.agentflow.fgc.ir.IRGraph;
import com.agentflow.fgc.ir.IRNode;
import com.agentflow.fgc.ir.IRParameter;

/**
 * Pure, stateless algorithms over an {@link IRGraph}.
 *
 * <p>
 * Every traversal uses an explicit stack or queue, so chains of any depth are
 * handled without growing the call stack. Graph algorithms only follow
 * resolvable connections; dangling endpoints are a validation concern.
 */
public final class IRGraphAnalyzer {
    private static final int ON_STACK = 1, DONE = 2;

    private IRGraphAnalyzer() {
        // Utility class
    }

    // ── Validation ────────────────────────────────────────────────────

    /**
     * Validates the graph. Checks run in a fixed order: connection endpoints,
     * duplicate ids, required parameters, cycles, then isolated nodes (which
     * are warnings only).
     */
    public static ValidationResult validate(IRGraph graph) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        List<ValidationSuggestion> suggestions = new ArrayList<>();

        // 1. Reference integrity
        for (IRConnection c : graph.connections()) {
            if (!graph.hasNode(c.source()))
                errors.add(missingNode(c, c.source(), "source"));
            if (!graph.hasNode(c.target()))
                errors.add(missingNode(c, c.target(), "target"));
        }

        // 1b. Unique ids
        Set<String> seen = new HashSet<>();
        for (IRNode node : graph.nodes()) {
            if (!seen.add(node.id())) {
                errors.add(ValidationIssue.builder()
                        .type(IssueType.DUPLICATE_NODE)
                        .message("Duplicate node id '" + node.id() + "'")
                        .nodeId(node.id())
                        .severity(Severity.HIGH)
                        .fixSuggestion("Give every node a unique id")
                        .build());
            }
        }

        // 2. Required parameters
        for (IRNode node : graph.nodes()) {
            for (IRParameter p : node.parameters()) {
                if (p.required() && !p.isSet()) {
                    errors.add(ValidationIssue.builder()
                            .type(IssueType.MISSING_PARAMETER)
                            .message("Node '" + node.id() + "' is missing required parameter '" + p.name() + "'")
                            .nodeId(node.id())
                            .parameterName(p.name())
                            .severity(Severity.HIGH)
                            .fixSuggestion("Set a value for '" + p.name() + "'")
                            .build());
                }
            }
        }

        // 3. Cycles
        for (List<String> cycle : findCycles(graph)) {
            errors.add(ValidationIssue.builder()
                    .type(IssueType.CIRCULAR_DEPENDENCY)
                    .message("Circular dependency detected: " + String.join(" -> ", cycle))
                    .nodeId(cycle.get(0))
                    .severity(Severity.CRITICAL)
                    .fixSuggestion("Remove one of the connections in the cycle")
                    .build());
        }

        // 4. Isolated nodes
        for (String id : findIsolatedNodes(graph)) {
            warnings.add(ValidationIssue.builder()
                    .type(IssueType.ISOLATED_NODE)
                    .message("Node '" + id + "' has no connections")
                    .nodeId(id)
                    .severity(Severity.LOW)
                    .fixSuggestion("Connect the node or remove it")
                    .build());
        }

        if (calculateComplexity(graph) == Complexity.COMPLEX) {
            List<List<String>> chains = findParallelizableChains(graph);
            if (chains.size() > 1) {
                List<String> heads = chains.stream().map(ch -> ch.get(0)).toList();
                suggestions.add(new ValidationSuggestion("optimization",
                        chains.size() + " independent chains could run in parallel", heads, "performance"));
            }
        }
        return new ValidationResult(errors, warnings, suggestions);
    }

    private static ValidationIssue missingNode(IRConnection c, String missingId, String end) {
        return ValidationIssue.builder()
                .type(IssueType.MISSING_NODE)
                .message("Connection '" + c.id() + "' references missing " + end + " node '" + missingId + "'")
                .connectionId(c.id())
                .nodeId(missingId)
                .severity(Severity.HIGH)
                .fixSuggestion("Remove the connection or add node '" + missingId + "'")
                .build();
    }

    // ── Ordering ──────────────────────────────────────────────────────

    /**
     * Finds every cycle reachable by depth-first search. Each back edge to a
     * node on the current path yields one cycle, listed from that node's
     * first occurrence on the path up to and including the repeated node.
     */
    public static List<List<String>> findCycles(IRGraph graph) {
        List<List<String>> cycles = new ArrayList<>();
        Map<String, Integer> state = new HashMap<>();
        Map<String, Integer> pathIndex = new HashMap<>();
        List<String> path = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (String start : graph.nodeIds()) {
            if (state.containsKey(start))
                continue;
            enter(start, stack, state, pathIndex, path);
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                List<String> children = graph.successors(frame.id);
                if (frame.next < children.size()) {
                    String child = children.get(frame.next++);
                    Integer s = state.get(child);
                    if (s == null) {
                        enter(child, stack, state, pathIndex, path);
                    } else if (s == ON_STACK) {
                        List<String> cycle = new ArrayList<>(path.subList(pathIndex.get(child), path.size()));
                        cycle.add(child);
                        cycles.add(cycle);
                    }
                } else {
                    stack.pop();
                    state.put(frame.id, DONE);
                    pathIndex.remove(frame.id);
                    path.remove(path.size() - 1);
                }
            }
        }
        return cycles;
    }

    private static void enter(String id, Deque<Frame> stack, Map<String, Integer> state,
            Map<String, Integer> pathIndex, List<String> path) {
        stack.push(new Frame(id));
        state.put(id, ON_STACK);
        pathIndex.put(id, path.size());
        path.add(id);
    }

    private static final class Frame {
        final String id;
        int next;

        Frame(String id) {
            this.id = id;
        }
    }

    /**
     * Kahn's algorithm. Among ready nodes the one declared first goes first.
     * A cyclic graph yields an empty order rather than a partial one.
     */
    public static TopologicalSortResult topologicalSort(IRGraph graph) {
        List<List<String>> cycles = findCycles(graph);
        if (!cycles.isEmpty())
            return new TopologicalSortResult(List.of(), cycles, false);

        List<String> ids = graph.nodeIds();
        int[] inDegree = new int[ids.size()];
        for (int i = 0; i < ids.size(); i++)
            inDegree[i] = graph.predecessors(ids.get(i)).size();

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < inDegree.length; i++)
            if (inDegree[i] == 0)
                ready.add(i);

        List<String> sorted = new ArrayList<>(ids.size());
        while (!ready.isEmpty()) {
            String id = ids.get(ready.poll());
            sorted.add(id);
            for (String child : graph.successors(id)) {
                int pos = graph.position(child);
                if (--inDegree[pos] == 0)
                    ready.add(pos);
            }
        }
        if (sorted.size() != ids.size())
            throw new IllegalStateException("Cycle detected! Processed " + sorted.size() + " of " + ids.size());
        return new TopologicalSortResult(sorted, List.of(), true);
    }

    // ── Structure ─────────────────────────────────────────────────────

    /** Nodes without incoming connections. */
    public static List<String> findEntryPoints(IRGraph graph) {
        List<String> entries = new ArrayList<>();
        for (String id : graph.nodeIds())
            if (graph.predecessors(id).isEmpty())
                entries.add(id);
        return entries;
    }

    /** Nodes without outgoing connections. */
    public static List<String> findExitPoints(IRGraph graph) {
        List<String> exits = new ArrayList<>();
        for (String id : graph.nodeIds())
            if (graph.successors(id).isEmpty())
                exits.add(id);
        return exits;
    }

    /** Nodes that no connection touches, dangling ones included. */
    public static List<String> findIsolatedNodes(IRGraph graph) {
        List<String> isolated = new ArrayList<>();
        for (String id : graph.nodeIds())
            if (graph.incoming(id).isEmpty() && graph.outgoing(id).isEmpty())
                isolated.add(id);
        return isolated;
    }

    /** Shortest path by hop count, or an empty list when {@code to} is unreachable. */
    public static List<String> findPath(IRGraph graph, String from, String to) {
        if (!graph.hasNode(from) || !graph.hasNode(to))
            return List.of();
        return pathTo(breadthFirstParents(graph, from), to);
    }

    /**
     * Longest of the hop-count shortest paths over all (entry, exit) pairs.
     * Ties keep the first path found, scanning entries then exits in
     * declaration order.
     */
    public static List<String> findCriticalPath(IRGraph graph) {
        List<String> exits = findExitPoints(graph);
        List<String> longest = List.of();
        for (String entry : findEntryPoints(graph)) {
            Map<String, String> parents = breadthFirstParents(graph, entry);
            for (String exit : exits) {
                List<String> path = pathTo(parents, exit);
                if (path.size() > longest.size())
                    longest = path;
            }
        }
        return longest;
    }

    private static Map<String, String> breadthFirstParents(IRGraph graph, String from) {
        Map<String, String> parents = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        parents.put(from, null);
        queue.add(from);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            for (String child : graph.successors(id)) {
                if (!parents.containsKey(child)) {
                    parents.put(child, id);
                    queue.add(child);
                }
            }
        }
        return parents;
    }

    private static List<String> pathTo(Map<String, String> parents, String to) {
        if (!parents.containsKey(to))
            return List.of();
        ArrayDeque<String> path = new ArrayDeque<>();
        for (String at = to; at != null; at = parents.get(at))
            path.addFirst(at);
        return new ArrayList<>(path);
    }

    /**
     * Maximal straight chains: starting from each unvisited node, follow the
     * single outgoing connection while there is exactly one. Only chains of
     * two or more nodes are returned.
     */
    public static List<List<String>> findParallelizableChains(IRGraph graph) {
        List<List<String>> chains = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String id : graph.nodeIds()) {
            if (visited.contains(id))
                continue;
            List<String> chain = new ArrayList<>();
            String current = id;
            while (current != null && visited.add(current)) {
                chain.add(current);
                List<String> next = graph.successors(current);
                current = next.size() == 1 ? next.get(0) : null;
            }
            if (chain.size() > 1)
                chains.add(chain);
        }
        return chains;
    }

    /** Nodes where paths fan in or fan out. */
    public static List<String> findBottlenecks(IRGraph graph) {
        List<String> bottlenecks = new ArrayList<>();
        for (String id : graph.nodeIds())
            if (graph.predecessors(id).size() > 1 || graph.successors(id).size() > 1)
                bottlenecks.add(id);
        return bottlenecks;
    }

    /**
     * Number of hops on the longest entry-to-node chain. For cyclic graphs the
     * breadth-first distance from the entry points is used instead.
     */
    public static int calculateMaxDepth(IRGraph graph) {
        TopologicalSortResult topo = topologicalSort(graph);
        if (topo.isAcyclic()) {
            int max = 0;
            for (int level : levels(graph, topo.sorted()).values())
                max = Math.max(max, level);
            return max;
        }
        Map<String, Integer> distance = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String entry : findEntryPoints(graph)) {
            distance.put(entry, 0);
            queue.add(entry);
        }
        int max = 0;
        while (!queue.isEmpty()) {
            String id = queue.poll();
            int d = distance.get(id);
            max = Math.max(max, d);
            for (String child : graph.successors(id))
                if (distance.putIfAbsent(child, d + 1) == null)
                    queue.add(child);
        }
        return max;
    }

    public static Complexity calculateComplexity(IRGraph graph) {
        return Complexity.classify(graph.nodeCount(), graph.connections().size());
    }

    public static GraphStats analyzeGraph(IRGraph graph) {
        Map<String, Integer> nodeTypes = new LinkedHashMap<>();
        Map<String, Integer> categories = new LinkedHashMap<>();
        for (IRNode node : graph.nodes()) {
            nodeTypes.merge(node.type(), 1, Integer::sum);
            categories.merge(node.category(), 1, Integer::sum);
        }
        int n = graph.nodeCount(), e = graph.connections().size();
        return new GraphStats(n, e,
                (e * 2.0) / Math.max(n, 1),
                calculateMaxDepth(graph),
                Complexity.classify(n, e),
                nodeTypes,
                categories,
                findEntryPoints(graph),
                findExitPoints(graph),
                findIsolatedNodes(graph),
                findParallelizableChains(graph),
                findBottlenecks(graph),
                findCriticalPath(graph));
    }

    // ── Dependencies ──────────────────────────────────────────────────

    /**
     * Per-node dependency summary, in topological order.
     *
     * @throws IllegalStateException if the graph is cyclic
     */
    public static List<DependencyInfo> analyzeDependencies(IRGraph graph) {
        List<String> order = requireAcyclic(graph);
        Map<String, Integer> levels = levels(graph, order);
        Map<Integer, Integer> levelSizes = new HashMap<>();
        for (int level : levels.values())
            levelSizes.merge(level, 1, Integer::sum);
        Set<String> critical = new HashSet<>(findCriticalPath(graph));

        List<DependencyInfo> infos = new ArrayList<>(order.size());
        for (String id : order) {
            int level = levels.get(id);
            infos.add(new DependencyInfo(id,
                    List.copyOf(new LinkedHashSet<>(graph.predecessors(id))),
                    List.copyOf(new LinkedHashSet<>(graph.successors(id))),
                    level,
                    critical.contains(id),
                    levelSizes.get(level) > 1));
        }
        return infos;
    }

    /**
     * Groups nodes into phases by dependency level.
     *
     * @throws IllegalStateException if the graph is cyclic
     */
    public static ExecutionPlan createExecutionPlan(IRGraph graph) {
        List<String> order = requireAcyclic(graph);
        Map<String, Integer> levels = levels(graph, order);
        TreeMap<Integer, List<String>> byLevel = new TreeMap<>();
        for (String id : order)
            byLevel.computeIfAbsent(levels.get(id), k -> new ArrayList<>()).add(id);

        List<ExecutionPlan.Phase> phases = new ArrayList<>(byLevel.size());
        for (var entry : byLevel.entrySet())
            phases.add(new ExecutionPlan.Phase("phase-" + entry.getKey(), entry.getKey(),
                    List.copyOf(entry.getValue())));
        double factor = phases.isEmpty() ? 0 : (double) order.size() / phases.size();
        return new ExecutionPlan(phases, findCriticalPath(graph), factor);
    }

    private static List<String> requireAcyclic(IRGraph graph) {
        TopologicalSortResult topo = topologicalSort(graph);
        if (!topo.isAcyclic())
            throw new IllegalStateException("Graph '" + graph.metadata().name() + "' has cycles: " + topo.cycles());
        return topo.sorted();
    }

    // longest-path level of each node, computed along a topological order
    private static Map<String, Integer> levels(IRGraph graph, List<String> order) {
        Map<String, Integer> levels = new HashMap<>(order.size() * 2);
        for (String id : order) {
            int level = 0;
            for (String parent : graph.predecessors(id))
                level = Math.max(level, levels.get(parent) + 1);
            levels.put(id, level);
        }
        return levels;
    }

    // ── Extraction ────────────────────────────────────────────────────

    /**
     * Induced subgraph on {@code nodeIds}. With {@code includeDependencies}
     * every upstream node is pulled in until closure, so the result is
     * self-contained.
     *
     * @throws IllegalArgumentException if a requested id is not in the graph
     */
    public static Subgraph extractSubgraph(IRGraph graph, Collection<String> nodeIds, boolean includeDependencies) {
        Set<String> selected = new LinkedHashSet<>();
        for (String id : nodeIds) {
            if (!graph.hasNode(id))
                throw new IllegalArgumentException("Unknown node: " + id);
            selected.add(id);
        }

        if (includeDependencies) {
            Deque<String> queue = new ArrayDeque<>(selected);
            while (!queue.isEmpty()) {
                for (String parent : graph.predecessors(queue.poll()))
                    if (selected.add(parent))
                        queue.add(parent);
            }
        }

        List<IRNode> nodes = graph.nodes().stream().filter(n -> selected.contains(n.id())).toList();
        List<IRConnection> connections = new ArrayList<>();
        Set<String> external = new LinkedHashSet<>();
        for (IRConnection c : graph.connections()) {
            boolean inSource = selected.contains(c.source()), inTarget = selected.contains(c.target());
            if (inSource && inTarget)
                connections.add(c);
            else if (inTarget)
                external.add(c.source());
        }

        GraphMetadata source = graph.metadata();
        GraphMetadata metadata = new GraphMetadata(source.name() + "-subgraph", "Subgraph extraction",
                source.version(), Map.of("extractedFrom", source.name()));
        return new Subgraph(new IRGraph(nodes, connections, metadata), source.name(), List.copyOf(external));
    }
}
