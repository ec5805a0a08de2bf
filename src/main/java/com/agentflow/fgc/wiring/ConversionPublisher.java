package com.agentflow.fgc.wiring;

import java.util.List;

import com.agentflow.fgc.ConversionReport;
import com.agentflow.fgc.FlowGraphConverter;
import com.agentflow.fgc.io.FlowParseException;
import com.agentflow.fgc.io.ParseIssue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor event handler that runs queued conversions.
 *
 * Runs on the single consumer thread, so conversions execute one at a time in
 * submission order and never share a graph. A failing job is recorded as
 * FAILED and never takes the consumer thread down.
 */
public final class ConversionPublisher {
    private static final Logger log = LogManager.getLogger(ConversionPublisher.class);

    private final FlowGraphConverter converter;
    private final JobTracker jobs;

    public ConversionPublisher(FlowGraphConverter converter, JobTracker jobs) {
        this.converter = converter;
        this.jobs = jobs;
    }

    /**
     * Process a single event from the ring buffer.
     *
     * @param event      The event carried by the ring buffer.
     * @param sequence   The sequence ID of the event.
     * @param endOfBatch Flag indicating if this is the last event in the current
     *                   batch.
     */
    public void onEvent(ConversionEvent event, long sequence, boolean endOfBatch) {
        final String jobId = event.jobId();
        if (jobId == null) {
            log.error("Received event without job id at sequence {}", sequence);
            return;
        }
        try {
            jobs.markRunning(jobId);
            ConversionReport report = converter.convert(event.payload(), event.flowName(), event.context());
            jobs.complete(jobId, report);
            log.debug("Job {} completed (seq={}, endOfBatch={})", jobId, sequence, endOfBatch);
        } catch (FlowParseException e) {
            log.info("Job {} rejected: {}", jobId, e.getMessage());
            jobs.fail(jobId, e.issues().stream().map(ParseIssue::toString).toList());
        } catch (Exception e) {
            // Do not rethrow, to keep consumer thread alive.
            log.error("Job {} failed: {}", jobId, e.getMessage(), e);
            jobs.fail(jobId, List.of(String.valueOf(e.getMessage())));
        } finally {
            event.clear();
        }
    }
}
