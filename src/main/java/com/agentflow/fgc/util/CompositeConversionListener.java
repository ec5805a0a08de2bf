package com.agentflow.fgc.util;

import java.util.Arrays;

import com.agentflow.fgc.api.ConversionListener;
import com.agentflow.fgc.api.IssueType;

/**
 * Fans callbacks out to several {@link ConversionListener}s. Listeners are
 * held in a copy-on-write array, so adding one never disturbs a run in
 * progress.
 */
public class CompositeConversionListener implements ConversionListener {
    private volatile ConversionListener[] listeners = new ConversionListener[0];

    public synchronized CompositeConversionListener add(ConversionListener listener) {
        ConversionListener[] old = listeners;
        ConversionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onConversionStart(String flowName, int nodeCount) {
        for (ConversionListener l : listeners)
            l.onConversionStart(flowName, nodeCount);
    }

    @Override
    public void onNodeConverted(String nodeId, String nodeType, int fragmentCount, long durationNanos) {
        for (ConversionListener l : listeners)
            l.onNodeConverted(nodeId, nodeType, fragmentCount, durationNanos);
    }

    @Override
    public void onNodeSkipped(String nodeId, String nodeType, IssueType reason) {
        for (ConversionListener l : listeners)
            l.onNodeSkipped(nodeId, nodeType, reason);
    }

    @Override
    public void onNodeError(String nodeId, String nodeType, Throwable error) {
        for (ConversionListener l : listeners)
            l.onNodeError(nodeId, nodeType, error);
    }

    @Override
    public void onConversionEnd(String flowName, int convertedNodes, int skippedNodes, boolean aborted) {
        for (ConversionListener l : listeners)
            l.onConversionEnd(flowName, convertedNodes, skippedNodes, aborted);
    }
}
