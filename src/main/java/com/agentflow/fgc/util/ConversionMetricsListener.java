package com.agentflow.fgc.util;

import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

import com.agentflow.fgc.api.ConversionListener;
import com.agentflow.fgc.api.IssueType;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Counts conversions, nodes and converter latency.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Runs:</b> total, aborted.</li>
 * <li><b>Nodes:</b> converted, skipped, failed.</li>
 * <li><b>Latency:</b> min/max/average converter time per node.</li>
 * </ul>
 * Counters are thread-safe since the HTTP layer and the job consumer may
 * convert concurrently.
 */
public final class ConversionMetricsListener implements ConversionListener {
    private static final Logger log = LogManager.getLogger(ConversionMetricsListener.class);

    private final LongAdder conversions = new LongAdder();
    private final LongAdder aborted = new LongAdder();
    private final LongAdder nodesConverted = new LongAdder();
    private final LongAdder nodesSkipped = new LongAdder();
    private final LongAdder nodesFailed = new LongAdder();
    private final LongAdder totalNodeNanos = new LongAdder();
    private final LongAccumulator minNodeNanos = new LongAccumulator(Math::min, Long.MAX_VALUE);
    private final LongAccumulator maxNodeNanos = new LongAccumulator(Math::max, Long.MIN_VALUE);

    @Override
    public void onConversionStart(String flowName, int nodeCount) {
        conversions.increment();
    }

    @Override
    public void onNodeConverted(String nodeId, String nodeType, int fragmentCount, long durationNanos) {
        nodesConverted.increment();
        totalNodeNanos.add(durationNanos);
        minNodeNanos.accumulate(durationNanos);
        maxNodeNanos.accumulate(durationNanos);
    }

    @Override
    public void onNodeSkipped(String nodeId, String nodeType, IssueType reason) {
        nodesSkipped.increment();
    }

    @Override
    public void onNodeError(String nodeId, String nodeType, Throwable error) {
        nodesFailed.increment();
        log.warn("Node '{}' ({}) failed: {}", nodeId, nodeType, error.getMessage());
    }

    @Override
    public void onConversionEnd(String flowName, int convertedNodes, int skippedNodes, boolean wasAborted) {
        if (wasAborted)
            aborted.increment();
    }

    public long totalConversions() {
        return conversions.sum();
    }

    public long abortedConversions() {
        return aborted.sum();
    }

    public long nodesConverted() {
        return nodesConverted.sum();
    }

    public long nodesSkipped() {
        return nodesSkipped.sum();
    }

    public long nodesFailed() {
        return nodesFailed.sum();
    }

    public double avgNodeMicros() {
        long n = nodesConverted.sum();
        return n > 0 ? totalNodeNanos.sum() / 1000.0 / n : 0;
    }

    public long minNodeNanos() {
        long v = minNodeNanos.get();
        return v == Long.MAX_VALUE ? 0 : v;
    }

    public long maxNodeNanos() {
        long v = maxNodeNanos.get();
        return v == Long.MIN_VALUE ? 0 : v;
    }

    public void reset() {
        conversions.reset();
        aborted.reset();
        nodesConverted.reset();
        nodesSkipped.reset();
        nodesFailed.reset();
        totalNodeNanos.reset();
        minNodeNanos.reset();
        maxNodeNanos.reset();
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-20s | %10s%n", "Metric", "Value"));
        sb.append("-----------------------------------\n");
        sb.append(String.format("%-20s | %10d%n", "Conversions", totalConversions()));
        sb.append(String.format("%-20s | %10d%n", "Aborted", abortedConversions()));
        sb.append(String.format("%-20s | %10d%n", "Nodes converted", nodesConverted()));
        sb.append(String.format("%-20s | %10d%n", "Nodes skipped", nodesSkipped()));
        sb.append(String.format("%-20s | %10d%n", "Nodes failed", nodesFailed()));
        sb.append(String.format("%-20s | %10.2f%n", "Avg node (us)", avgNodeMicros()));
        sb.append(String.format("%-20s | %10.2f%n", "Max node (us)", maxNodeNanos() / 1000.0));
        return sb.toString();
    }
}
