package com.agentflow.fgc.util;

import static com.agentflow.fgc.TestGraphs.*;
import static org.junit.Assert.*;

import java.util.List;

import com.agentflow.fgc.ir.IRGraph;
import com.agentflow.fgc.ir.IRParameter;

import org.junit.Test;

public class FlowExplainTest {

    private static IRGraph sample() {
        IRParameter key = new IRParameter("apiKey", "sk-secret", "password", true, null);
        return graph(List.of(node("model", "chatOpenAI", key, param("modelName", "gpt-4o")), node("chain", "llmChain")),
                edge("model", "chain", "model"));
    }

    @Test
    public void testExplainNodeMasksSecrets() {
        String text = new FlowExplain(sample()).explainNode("model");

        assertTrue(text.contains("Type: chatOpenAI"));
        assertTrue(text.contains("apiKey = ****** (required)"));
        assertFalse(text.contains("sk-secret"));
        assertTrue(text.contains("modelName = gpt-4o"));
        assertTrue(text.contains("Outputs (1): chain"));
    }

    @Test
    public void testDumpTopology() {
        String text = new FlowExplain(sample()).dumpTopology();
        assertTrue(text.startsWith("Flow 'test-flow' (2 nodes):\n"));
        assertTrue(text.contains("[0] model <chatOpenAI> (ENTRY) -> chain"));
        assertTrue(text.contains("[1] chain <llmChain>"));
    }

    @Test
    public void testMermaid() {
        String text = new FlowExplain(sample()).toMermaid();
        assertTrue(text.startsWith("graph TD;\n"));
        assertTrue(text.contains("model -- \"model\" --> chain;"));
    }

    @Test
    public void testSummary() {
        String text = new FlowExplain(sample()).summary();
        assertTrue(text.contains("Critical path:"));
        assertTrue(text.contains("model -> chain"));
        assertTrue(text.contains("simple"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownNode() {
        new FlowExplain(sample()).explainNode("nope");
    }
}
