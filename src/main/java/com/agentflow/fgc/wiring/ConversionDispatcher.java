package com.agentflow.fgc.wiring;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

import com.agentflow.fgc.FlowGraphConverter;
import com.agentflow.fgc.api.GenerationContext;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import lombok.extern.log4j.Log4j2;

/**
 * Asynchronous conversion queue.
 *
 * <p>
 * Producers (HTTP handler threads) claim a ring-buffer slot, copy the job in
 * and publish; a single {@link ConversionPublisher} consumes. The ring buffer
 * applies back-pressure: {@link #submit} blocks while all slots are taken.
 */
@Log4j2
public final class ConversionDispatcher implements AutoCloseable {
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Disruptor<ConversionEvent> disruptor;
    private final RingBuffer<ConversionEvent> ringBuffer;
    private final JobTracker jobs;

    public ConversionDispatcher(FlowGraphConverter converter, JobTracker jobs, int ringBufferSize) {
        this.jobs = jobs;
        this.disruptor = new Disruptor<>(
                ConversionEvent::new,
                ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());

        ConversionPublisher publisher = new ConversionPublisher(converter, jobs);
        disruptor.handleEventsWith((event, sequence, endOfBatch) -> publisher.onEvent(event, sequence, endOfBatch));
        this.ringBuffer = disruptor.start();
        log.info("Conversion dispatcher started, ring buffer size {}", ringBufferSize);
    }

    public JobTracker jobs() {
        return jobs;
    }

    /**
     * Queues a conversion.
     *
     * @return the job id to poll with {@link JobTracker#get(String)}
     */
    public String submit(byte[] json, String flowName, GenerationContext ctx) {
        String jobId = UUID.randomUUID().toString();
        jobs.register(jobId, flowName);
        long seq = ringBuffer.next();
        try {
            ringBuffer.get(seq).set(jobId, json, flowName, ctx);
        } finally {
            ringBuffer.publish(seq);
        }
        log.debug("Queued job {} for '{}' at sequence {}", jobId, flowName, seq);
        return jobId;
    }

    /** Drains queued jobs, then stops the consumer thread. */
    @Override
    public void close() {
        try {
            disruptor.shutdown(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Dispatcher did not drain within {}s, halting", SHUTDOWN_TIMEOUT_SECONDS);
            disruptor.halt();
        }
    }
}
