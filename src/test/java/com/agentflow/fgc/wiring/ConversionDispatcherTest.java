package com.agentflow.fgc.wiring;

import static org.junit.Assert.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import com.agentflow.fgc.FlowGraphConverter;
import com.agentflow.fgc.TestGraphs;
import com.agentflow.fgc.api.GenerationContext;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class ConversionDispatcherTest {

    private JobTracker jobs;
    private ConversionDispatcher dispatcher;
    private CountDownLatch finished;
    private final List<JobStatus> seen = new CopyOnWriteArrayList<>();

    @Before
    public void setUp() {
        jobs = new JobTracker();
        finished = new CountDownLatch(2);
        jobs.addListener(job -> {
            seen.add(job.status());
            if (job.status().isTerminal())
                finished.countDown();
        });
        dispatcher = new ConversionDispatcher(new FlowGraphConverter(), jobs, 8);
    }

    @After
    public void tearDown() {
        dispatcher.close();
    }

    @Test
    public void testJobsRunToCompletion() throws InterruptedException {
        GenerationContext ctx = GenerationContext.builder().build();
        String ok = dispatcher.submit(TestGraphs.fixture("llm-chain.json"), "llm-chain", ctx);
        String bad = dispatcher.submit("{\"nodes\":{}}".getBytes(StandardCharsets.UTF_8), "broken", ctx);

        assertTrue("jobs did not finish", finished.await(10, TimeUnit.SECONDS));

        ConversionJob done = jobs.get(ok);
        assertEquals(JobStatus.COMPLETED, done.status());
        assertNotNull(done.finishedAt());
        assertTrue(done.report().hasOutput());
        assertNotNull(done.report().output().file("src/index.ts"));

        ConversionJob failed = jobs.get(bad);
        assertEquals(JobStatus.FAILED, failed.status());
        assertNull(failed.report());
        assertEquals(2, failed.errors().size());
        assertTrue(failed.errors().get(0).contains("$.nodes"));

        assertEquals(2, jobs.size());
        assertTrue(seen.contains(JobStatus.QUEUED));
        assertTrue(seen.contains(JobStatus.RUNNING));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateJobId() {
        jobs.register("same", "a");
        jobs.register("same", "b");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownJobUpdate() {
        jobs.markRunning("missing");
    }
}
