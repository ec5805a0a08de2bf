package com.agentflow.fgc.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.agentflow.fgc.api.CodeFragment;
import com.agentflow.fgc.api.ConversionListener;
import com.agentflow.fgc.api.Converter;
import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.IssueType;
import com.agentflow.fgc.api.Severity;
import com.agentflow.fgc.api.ValidationIssue;
import com.agentflow.fgc.api.ValidationResult;
import com.agentflow.fgc.convert.AbstractConverter;
import com.agentflow.fgc.convert.TracingSupport;
import com.agentflow.fgc.ir.IRGraph;
import com.agentflow.fgc.ir.IRNode;
import com.agentflow.fgc.registry.ConverterRegistry;

import lombok.Setter;
import lombok.extern.log4j.Log4j2;

/**
 * Drives one conversion: validate, order, dispatch every node to its
 * converter, resolve cross-node references, aggregate dependencies and sort
 * the fragment stream for emission.
 *
 * <p>
 * Conversion is best-effort. Only an unsound graph (dangling connections,
 * duplicate ids, cycles) aborts the run; a node with a missing required
 * parameter, an unsupported type or a failing converter is skipped and
 * reported while the rest of the graph is still converted.
 *
 * <p>
 * Emission order is {@code (kind, declared order, node traversal index,
 * production index)}. Among fragments of one kind and order, topologically
 * earlier nodes come first, so no generated variable is referenced before it
 * is defined. Graph-level fragments (no node id) go ahead of node fragments of
 * the same kind and order when their order is negative and after them
 * otherwise.
 *
 * <p>
 * Every node gets a distinct variable name for the run; when two ids map to
 * the same identifier the later node in traversal order gets a numeric
 * suffix.
 *
 * <p>
 * Holds no per-run state; one instance can serve concurrent conversions.
 */
@Log4j2
public final class ConversionOrchestrator {
    private static final Comparator<Staged> EMISSION_ORDER = Comparator
            .<Staged>comparingInt(s -> s.fragment.getKind().priority())
            .thenComparingInt(s -> s.fragment.getOrder())
            .thenComparingInt(s -> s.traversal)
            .thenComparingInt(s -> s.emission);

    private final ConverterRegistry registry;

    @Setter
    private volatile ConversionListener listener;

    public ConversionOrchestrator(ConverterRegistry registry) {
        this.registry = registry;
    }

    public ConverterRegistry registry() {
        return registry;
    }

    /**
     * Structural validation plus one {@code UNSUPPORTED_TYPE} warning per node
     * no converter accepts.
     */
    public ValidationResult validate(IRGraph graph) {
        ValidationResult base = IRGraphAnalyzer.validate(graph);
        List<ValidationIssue> warnings = new ArrayList<>(base.warnings());
        List<IRNode> distinct = new ArrayList<>();
        for (String id : graph.nodeIds())
            distinct.add(graph.node(id));
        warnings.addAll(registry.checkSupport(distinct));
        return new ValidationResult(base.errors(), warnings, base.suggestions());
    }

    public ConversionResult convert(IRGraph graph, GenerationContext ctx) {
        final long startNanos = System.nanoTime();
        final String flow = graph.metadata().name();
        final ConversionListener l = listener;
        if (l != null)
            l.onConversionStart(flow, graph.nodeCount());

        // 1. Validate
        ValidationResult validation = IRGraphAnalyzer.validate(graph);
        List<ValidationIssue> warnings = new ArrayList<>(validation.warnings());
        if (validation.hasFatalErrors()) {
            log.warn("Conversion of '{}' aborted: {} errors", flow, validation.errors().size());
            return finishAborted(l, flow, validation.errors(), warnings);
        }

        // 2. Order
        TopologicalSortResult topo = IRGraphAnalyzer.topologicalSort(graph);
        if (!topo.isAcyclic()) {
            List<ValidationIssue> errors = new ArrayList<>(validation.errors());
            errors.add(ValidationIssue.builder()
                    .type(IssueType.CIRCULAR_DEPENDENCY)
                    .message("Graph has cycles: " + topo.cycles())
                    .severity(Severity.CRITICAL)
                    .build());
            return finishAborted(l, flow, errors, warnings);
        }

        List<ValidationIssue> errors = new ArrayList<>(validation.errors());
        Set<String> missingParams = new HashSet<>();
        for (ValidationIssue e : validation.errorsOfType(IssueType.MISSING_PARAMETER))
            missingParams.add(e.getNodeId());

        // 3. Dispatch
        GenerationContext runCtx = ctx.toBuilder()
                .variableNames(assignVariables(graph, topo.sorted(), ctx))
                .build();
        List<Staged> staged = new ArrayList<>();
        Map<String, CodeFragment> primaryByNode = new HashMap<>();
        Set<String> dependencies = new TreeSet<>();
        List<String> converted = new ArrayList<>(), skipped = new ArrayList<>();
        int traversal = 0, emission = 0;

        for (String id : topo.sorted()) {
            IRNode node = graph.node(id);
            int ti = traversal++;

            if (missingParams.contains(id)) {
                skip(l, skipped, node, IssueType.MISSING_PARAMETER);
                continue;
            }
            Converter converter = registry.converterFor(node);
            if (converter == null) {
                warnings.add(ConverterRegistry.unsupported(node));
                skip(l, skipped, node, IssueType.UNSUPPORTED_TYPE);
                continue;
            }

            long t0 = System.nanoTime();
            List<CodeFragment> produced;
            List<String> declared;
            try {
                produced = converter.convert(node, runCtx);
                declared = converter.getDependencies(node, runCtx);
                if (produced == null)
                    throw new IllegalStateException("converter returned no fragment list");
                for (CodeFragment f : produced) {
                    if (f == null)
                        throw new IllegalStateException("converter returned a null fragment");
                }
            } catch (RuntimeException e) {
                log.error("Converter '{}' failed on node {}: {}", converter.nodeType(), id, e.getMessage(), e);
                errors.add(ValidationIssue.builder()
                        .type(IssueType.CONVERSION_FAILED)
                        .message("Converting node '" + id + "' failed: " + e.getMessage())
                        .nodeId(id)
                        .severity(Severity.HIGH)
                        .build());
                skipped.add(id);
                if (l != null)
                    l.onNodeError(id, node.type(), e);
                continue;
            }

            for (CodeFragment f : produced) {
                CodeFragment tagged = id.equals(f.getNodeId()) ? f : f.toBuilder().nodeId(id).build();
                staged.add(new Staged(tagged, ti, emission++));
                if (tagged.primaryExport() != null) {
                    CodeFragment current = primaryByNode.get(id);
                    if (current == null || tagged.getKind().priority() < current.getKind().priority())
                        primaryByNode.put(id, tagged);
                }
            }
            if (declared != null)
                dependencies.addAll(declared);
            converted.add(id);
            if (l != null)
                l.onNodeConverted(id, node.type(), produced.size(), System.nanoTime() - t0);
        }

        if (ctx.isIncludeTracing()) {
            for (CodeFragment f : TracingSupport.fragments(ctx))
                staged.add(new Staged(f, f.getOrder() < 0 ? Integer.MIN_VALUE : Integer.MAX_VALUE, emission++));
        }

        // 4. Resolve references
        Map<String, String> exports = new HashMap<>();
        primaryByNode.forEach((id, f) -> exports.put(id, f.primaryExport()));
        ReferenceResolver resolver = new ReferenceResolver(graph, exports, ctx.getLanguage());
        for (Staged s : staged)
            s.fragment = resolver.resolve(s.fragment, warnings);

        // 5. Aggregate dependencies, exact match
        for (Staged s : staged)
            dependencies.addAll(s.fragment.getDependencies());

        // 6. Emission order
        staged.sort(EMISSION_ORDER);
        List<CodeFragment> fragments = new ArrayList<>(staged.size());
        for (Staged s : staged)
            fragments.add(s.fragment);

        ConversionResult result = new ConversionResult(fragments, new ArrayList<>(dependencies), warnings, errors,
                converted, skipped, false);
        log.info("Converted '{}' to {}: {} nodes converted, {} skipped, {} fragments in {} ms",
                flow, ctx.getLanguage().id(), converted.size(), skipped.size(), fragments.size(),
                (System.nanoTime() - startNanos) / 1_000_000);
        if (l != null)
            l.onConversionEnd(flow, converted.size(), skipped.size(), false);
        return result;
    }

    /** One distinct identifier per node, in traversal order; the tracer name is reserved when tracing. */
    static Map<String, String> assignVariables(IRGraph graph, List<String> order, GenerationContext ctx) {
        Set<String> taken = new HashSet<>();
        if (ctx.isIncludeTracing())
            taken.add(TracingSupport.TRACER_VARIABLE);
        Map<String, String> names = new HashMap<>();
        for (String id : order) {
            String base = AbstractConverter.variableName(graph.node(id), ctx.getLanguage());
            String name = base;
            for (int n = 2; !taken.add(name); n++)
                name = base + "_" + n;
            if (!name.equals(base))
                log.debug("Variable '{}' already taken, node {} uses '{}'", base, id, name);
            names.put(id, name);
        }
        return names;
    }

    private static void skip(ConversionListener l, List<String> skipped, IRNode node, IssueType reason) {
        log.debug("Skipping node {} ({}): {}", node.id(), node.type(), reason);
        skipped.add(node.id());
        if (l != null)
            l.onNodeSkipped(node.id(), node.type(), reason);
    }

    private static ConversionResult finishAborted(ConversionListener l, String flow, List<ValidationIssue> errors,
            List<ValidationIssue> warnings) {
        if (l != null)
            l.onConversionEnd(flow, 0, 0, true);
        return ConversionResult.aborted(errors, warnings);
    }

    private static final class Staged {
        CodeFragment fragment;
        final int traversal;
        final int emission;

        Staged(CodeFragment fragment, int traversal, int emission) {
            this.fragment = fragment;
            this.traversal = traversal;
            this.emission = emission;
        }
    }
}
