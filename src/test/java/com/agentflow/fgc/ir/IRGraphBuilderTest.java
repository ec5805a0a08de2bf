package com.agentflow.fgc.ir;

import static org.junit.Assert.*;

import java.util.List;

import com.agentflow.fgc.TestGraphs;
import com.agentflow.fgc.io.FlowDefinition;
import com.agentflow.fgc.io.FlowParser;

import org.junit.Test;

public class IRGraphBuilderTest {

    private final FlowParser parser = new FlowParser();
    private final IRGraphBuilder builder = new IRGraphBuilder();

    private IRGraph fixture() {
        return builder.build(parser.parse(TestGraphs.fixture("llm-chain.json")), "llm-chain");
    }

    @Test
    public void testNodesKeepDeclarationOrder() {
        IRGraph graph = fixture();
        assertEquals(List.of("chatOpenAI_0", "promptTemplate_0", "llmChain_0"), graph.nodeIds());
        assertEquals("llm-chain", graph.metadata().name());
        assertEquals("Prompt and chat model wired into an LLM chain", graph.metadata().description());
    }

    @Test
    public void testTypeComesFromDataName() {
        IRNode model = fixture().node("chatOpenAI_0");
        assertEquals("chatOpenAI", model.type());
        assertEquals("Chat Models", model.category());
        assertEquals("ChatOpenAI", model.label());
        assertEquals("customNode", model.attributes().get("nodeType"));
        assertEquals("ChatOpenAI", model.attributes().get("componentClass"));
    }

    @Test
    public void testParameterValuesAndRequiredness() {
        IRNode model = fixture().node("chatOpenAI_0");
        IRParameter name = model.parameter("modelName");
        assertEquals("gpt-4o", name.value());
        assertTrue(name.required());
        assertEquals("gpt-4o-mini", name.defaultValue());

        IRParameter temperature = model.parameter("temperature");
        assertFalse(temperature.required());
        assertEquals("0.2", temperature.value());
    }

    @Test
    public void testAnchorValuesAreNotParameters() {
        IRNode chain = fixture().node("llmChain_0");
        assertNull(chain.parameter("model"));
        assertNull(chain.parameter("prompt"));
        assertEquals("cats", chain.parameterValue("input"));
        assertEquals(2, chain.inputPorts().size());
        assertNotNull(chain.inputPort("model"));
    }

    @Test
    public void testConnectionsDecodePortNames() {
        IRGraph graph = fixture();
        IRConnection first = graph.connections().get(0);
        assertEquals("e1", first.id());
        assertEquals("chatOpenAI", first.sourcePort());
        assertEquals("model", first.targetPort());
        assertEquals(List.of("chatOpenAI_0", "promptTemplate_0"), graph.predecessors("llmChain_0"));
    }

    @Test
    public void testDefaultFillsUnsetValue() {
        String json = "{\"nodes\":[{\"id\":\"a\",\"type\":\"customNode\",\"data\":{\"name\":\"x\","
                + "\"inputParams\":[{\"name\":\"k\",\"type\":\"number\",\"default\":4}],"
                + "\"inputs\":{\"k\":\"\",\"extra\":true}}}],\"edges\":[]}";
        IRNode node = builder.build(parser.parse(json)).node("a");
        assertEquals(4, node.parameterValue("k"));

        IRParameter extra = node.parameter("extra");
        assertEquals("any", extra.type());
        assertFalse(extra.required());
    }

    @Test
    public void testMissingEdgeIdIsSynthesized() {
        FlowDefinition def = parser.parse("{\"nodes\":[],\"edges\":[{\"source\":\"a\",\"target\":\"b\"}]}");
        IRGraph graph = builder.build(def);
        assertEquals("a-b-0", graph.connections().get(0).id());
        assertEquals(IRGraphBuilder.DEFAULT_FLOW_NAME, graph.metadata().name());
    }

    @Test
    public void testDanglingAndDuplicatePassThrough() {
        String json = "{\"nodes\":[{\"id\":\"a\",\"type\":\"t\",\"data\":{}},{\"id\":\"a\",\"type\":\"t\",\"data\":{}}],"
                + "\"edges\":[{\"id\":\"e\",\"source\":\"a\",\"target\":\"ghost\"}]}";
        IRGraph graph = builder.build(parser.parse(json));
        assertEquals(2, graph.nodes().size());
        assertEquals(List.of("a"), graph.nodeIds());
        assertEquals(1, graph.outgoing("a").size());
        assertTrue(graph.successors("a").isEmpty());
    }

    @Test
    public void testPortName() {
        assertEquals("model", IRGraphBuilder.portName("llmChain_0-input-model-BaseLanguageModel", "llmChain_0", "-input-"));
        assertEquals("memory", IRGraphBuilder.portName("other-input-memory-BaseMemory", "x", "-input-"));
        assertEquals("plain", IRGraphBuilder.portName("plain", "x", "-input-"));
        assertNull(IRGraphBuilder.portName(null, "x", "-input-"));
    }
}
