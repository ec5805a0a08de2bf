package com.agentflow.fgc.wiring;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

import com.agentflow.fgc.ConversionReport;

import lombok.extern.log4j.Log4j2;

/**
 * Holds the latest snapshot of every submitted job and notifies listeners on
 * each state change. Written by the consumer thread, read by HTTP threads.
 * <p>
 * At most {@code maxRetained} finished jobs are kept; the oldest finished ones
 * are evicted first. Queued and running jobs are never evicted.
 */
@Log4j2
public final class JobTracker {
    public static final int DEFAULT_MAX_RETAINED = 256;

    private final Map<String, ConversionJob> jobs = new ConcurrentHashMap<>();
    private final List<JobListener> listeners = new CopyOnWriteArrayList<>();
    private final int maxRetained;

    public JobTracker() {
        this(DEFAULT_MAX_RETAINED);
    }

    public JobTracker(int maxRetained) {
        if (maxRetained <= 0)
            throw new IllegalArgumentException("maxRetained must be positive: " + maxRetained);
        this.maxRetained = maxRetained;
    }

    /** Callback for job state changes; runs on the thread making the change. */
    @FunctionalInterface
    public interface JobListener {
        void onJobUpdate(ConversionJob job);
    }

    public void addListener(JobListener listener) {
        listeners.add(listener);
    }

    public ConversionJob register(String jobId, String flowName) {
        ConversionJob job = ConversionJob.queued(jobId, flowName);
        if (jobs.putIfAbsent(jobId, job) != null)
            throw new IllegalArgumentException("Duplicate job id: " + jobId);
        notifyListeners(job);
        return job;
    }

    public void markRunning(String jobId) {
        update(jobId, ConversionJob::running);
    }

    public void complete(String jobId, ConversionReport report) {
        update(jobId, job -> job.completed(report));
        evictFinished();
    }

    public void fail(String jobId, List<String> errors) {
        update(jobId, job -> job.failed(errors));
        evictFinished();
    }

    /**
     * Forgets a finished job.
     *
     * @return the removed snapshot, or null for an unknown id
     * @throws IllegalStateException if the job is still queued or running
     */
    public ConversionJob remove(String jobId) {
        ConversionJob job = jobs.get(jobId);
        if (job == null)
            return null;
        if (!job.status().isTerminal())
            throw new IllegalStateException("Job " + jobId + " is still " + job.status().code());
        return jobs.remove(jobId, job) ? job : null;
    }

    /** Latest snapshot, or null for an unknown id. */
    public ConversionJob get(String jobId) {
        return jobs.get(jobId);
    }

    /** All jobs, oldest first. */
    public List<ConversionJob> list() {
        List<ConversionJob> all = new ArrayList<>(jobs.values());
        all.sort(Comparator.comparing(ConversionJob::submittedAt).thenComparing(ConversionJob::id));
        return all;
    }

    public int size() {
        return jobs.size();
    }

    private void evictFinished() {
        if (jobs.size() <= maxRetained)
            return;
        List<ConversionJob> finished = new ArrayList<>();
        for (ConversionJob job : jobs.values()) {
            if (job.status().isTerminal())
                finished.add(job);
        }
        finished.sort(Comparator.comparing(ConversionJob::finishedAt).thenComparing(ConversionJob::id));
        int excess = finished.size() - maxRetained;
        for (int i = 0; i < excess; i++) {
            ConversionJob old = finished.get(i);
            if (jobs.remove(old.id(), old))
                log.debug("Evicted finished job {}", old.id());
        }
    }

    private void update(String jobId, UnaryOperator<ConversionJob> change) {
        ConversionJob next = jobs.computeIfPresent(jobId, (id, job) -> change.apply(job));
        if (next == null)
            throw new IllegalArgumentException("Unknown job: " + jobId);
        notifyListeners(next);
    }

    private void notifyListeners(ConversionJob job) {
        for (JobListener l : listeners) {
            try {
                l.onJobUpdate(job);
            } catch (RuntimeException e) {
                log.error("Job listener failed for {}: {}", job.id(), e.getMessage(), e);
            }
        }
    }
}
