package com.agentflow.fgc.api;

/**
 * Hooks into a conversion run. Called on the converting thread; keep the
 * callbacks cheap.
 */
public interface ConversionListener {

    void onConversionStart(String flowName, int nodeCount);

    void onNodeConverted(String nodeId, String nodeType, int fragmentCount, long durationNanos);

    void onNodeSkipped(String nodeId, String nodeType, IssueType reason);

    void onNodeError(String nodeId, String nodeType, Throwable error);

    void onConversionEnd(String flowName, int convertedNodes, int skippedNodes, boolean aborted);
}
