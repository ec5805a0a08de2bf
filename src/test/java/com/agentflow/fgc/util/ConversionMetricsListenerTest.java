package com.agentflow.fgc.util;

import static com.agentflow.fgc.TestGraphs.*;
import static org.junit.Assert.*;

import java.util.List;

import com.agentflow.fgc.FlowGraphConverter;
import com.agentflow.fgc.StubConverter;
import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.io.FlowParser;
import com.agentflow.fgc.registry.ConverterRegistry;

import org.junit.Test;

public class ConversionMetricsListenerTest {

    @Test
    public void testCountsNodesAndRuns() {
        ConversionMetricsListener metrics = new ConversionMetricsListener();
        ConverterRegistry registry = ConverterRegistry.builder()
                .register(new StubConverter("stub"))
                .register(new StubConverter("broken").failing())
                .build();
        FlowGraphConverter converter = new FlowGraphConverter(registry, new FlowParser()).addListener(metrics);
        GenerationContext ctx = GenerationContext.builder().build();

        converter.convert(graph(List.of(node("a", "stub"), node("b", "mystery"), node("c", "broken"))), ctx);
        converter.convert(graph(List.of(node("a", "stub"), node("b", "stub")), edge("a", "b"), edge("b", "a")), ctx);

        assertEquals(2, metrics.totalConversions());
        assertEquals(1, metrics.abortedConversions());
        assertEquals(1, metrics.nodesConverted());
        assertEquals(1, metrics.nodesSkipped());
        assertEquals(1, metrics.nodesFailed());
        assertTrue(metrics.maxNodeNanos() >= metrics.minNodeNanos());
        assertTrue(metrics.dump().contains("Nodes converted"));

        metrics.reset();
        assertEquals(0, metrics.totalConversions());
        assertEquals(0, metrics.maxNodeNanos());
    }

    @Test
    public void testCompositeFansOut() {
        ConversionMetricsListener first = new ConversionMetricsListener();
        ConversionMetricsListener second = new ConversionMetricsListener();
        CompositeConversionListener composite = new CompositeConversionListener().add(first).add(second);

        composite.onConversionStart("flow", 1);
        composite.onConversionEnd("flow", 0, 0, true);

        assertEquals(2, composite.size());
        assertEquals(1, first.abortedConversions());
        assertEquals(1, second.totalConversions());
    }
}
