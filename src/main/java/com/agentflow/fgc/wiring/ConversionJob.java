package com.agentflow.fgc.wiring;

import java.time.Instant;
import java.util.List;

import com.agentflow.fgc.ConversionReport;

/**
 * Immutable snapshot of an asynchronous conversion job. Every state change
 * replaces the snapshot held by {@link JobTracker}.
 *
 * @param report set once the job completed
 * @param errors parse or processing errors of a failed job
 */
public record ConversionJob(String id, String flowName, JobStatus status, Instant submittedAt, Instant finishedAt,
        ConversionReport report, List<String> errors) {

    public ConversionJob {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    static ConversionJob queued(String id, String flowName) {
        return new ConversionJob(id, flowName, JobStatus.QUEUED, Instant.now(), null, null, List.of());
    }

    ConversionJob running() {
        return new ConversionJob(id, flowName, JobStatus.RUNNING, submittedAt, null, null, List.of());
    }

    ConversionJob completed(ConversionReport report) {
        return new ConversionJob(id, flowName, JobStatus.COMPLETED, submittedAt, Instant.now(), report, List.of());
    }

    ConversionJob failed(List<String> errors) {
        return new ConversionJob(id, flowName, JobStatus.FAILED, submittedAt, Instant.now(), null, errors);
    }
}
