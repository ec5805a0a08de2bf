package com.agentflow.fgc.wiring;

import com.agentflow.fgc.api.GenerationContext;

/**
 * A mutable holder for a queued conversion, living in the Disruptor ring
 * buffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every job; producers copy references in, the consumer clears them once the
 * job finished so payloads do not outlive their job.
 */
public final class ConversionEvent {
    private String jobId;
    private byte[] payload;
    private String flowName;
    private GenerationContext context;

    public void set(String jobId, byte[] payload, String flowName, GenerationContext context) {
        this.jobId = jobId;
        this.payload = payload;
        this.flowName = flowName;
        this.context = context;
    }

    public String jobId() {
        return jobId;
    }

    public byte[] payload() {
        return payload;
    }

    public String flowName() {
        return flowName;
    }

    public GenerationContext context() {
        return context;
    }

    public void clear() {
        jobId = null;
        payload = null;
        flowName = null;
        context = null;
    }
}
