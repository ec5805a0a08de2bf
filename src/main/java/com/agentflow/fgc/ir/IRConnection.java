package com.agentflow.fgc.ir;

/**
 * A directed edge between two node ports.
 * <p>
 * {@code sourcePort}/{@code targetPort} are the port names decoded from the
 * raw handles. Endpoints are not guaranteed to exist, see
 * {@link com.agentflow.fgc.engine.IRGraphAnalyzer#validate(IRGraph)}.
 */
public record IRConnection(String id, String source, String target, String sourceHandle, String targetHandle,
        String sourcePort, String targetPort) {
}
