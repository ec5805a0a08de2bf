package com.agentflow.fgc.io;

import static org.junit.Assert.*;

import java.util.List;

import com.agentflow.fgc.TestGraphs;

import org.junit.Test;

public class FlowParserTest {

    private final FlowParser parser = new FlowParser();

    @Test
    public void testParsesFixture() {
        FlowDefinition def = parser.parse(TestGraphs.fixture("llm-chain.json"));

        assertEquals(3, def.getNodes().size());
        assertEquals(2, def.getEdges().size());
        FlowDefinition.NodeDef chain = def.getNodes().get(2);
        assertEquals("llmChain_0", chain.getId());
        assertEquals("llmChain", chain.getData().getName());
        assertEquals(2, chain.getData().getInputAnchors().size());
        assertEquals("cats", chain.getData().getInputs().get("input"));
        // unknown fields are kept, not rejected
        assertTrue(chain.getExtras().containsKey("position"));
        assertEquals("Prompt and chat model wired into an LLM chain", def.getExtras().get("description"));
    }

    @Test
    public void testMissingArraysAreReportedTogether() {
        try {
            parser.parse("{}");
            fail("expected FlowParseException");
        } catch (FlowParseException e) {
            List<ParseIssue> issues = e.issues();
            assertEquals(2, issues.size());
            assertEquals("$.nodes", issues.get(0).path());
            assertEquals("required array is missing", issues.get(0).message());
            assertEquals("$.edges", issues.get(1).path());
        }
    }

    @Test
    public void testEveryBrokenNodeAndEdgeIsReported() {
        String json = "{\"nodes\":[{\"type\":\"customNode\",\"data\":{}},{\"id\":\"\",\"type\":\"x\"}],"
                + "\"edges\":[{\"source\":\"a\"}]}";
        try {
            parser.parse(json);
            fail("expected FlowParseException");
        } catch (FlowParseException e) {
            List<String> paths = e.issues().stream().map(ParseIssue::path).toList();
            assertEquals(List.of("$.nodes[0].id", "$.nodes[1].id", "$.nodes[1].data", "$.edges[0].target"), paths);
            assertEquals("must be a non-empty string", e.issues().get(1).message());
        }
    }

    @Test
    public void testNonArrayNodes() {
        try {
            parser.parse("{\"nodes\":{},\"edges\":[]}");
            fail("expected FlowParseException");
        } catch (FlowParseException e) {
            assertEquals(1, e.issues().size());
            assertEquals("must be an array", e.issues().get(0).message());
        }
    }

    @Test
    public void testTrailingContentIsRejected() {
        for (String json : List.of("{\"nodes\":[],\"edges\":[]} garbage", "{\"nodes\":[],\"edges\":[]} {}")) {
            try {
                parser.parse(json);
                fail("expected FlowParseException for " + json);
            } catch (FlowParseException e) {
                assertEquals("$", e.issues().get(0).path());
                assertTrue(e.issues().get(0).message().startsWith("malformed JSON"));
            }
        }
    }

    @Test
    public void testMalformedJsonCarriesLocation() {
        try {
            parser.parse("{\"nodes\": [");
            fail("expected FlowParseException");
        } catch (FlowParseException e) {
            assertTrue(e.issues().get(0).message().startsWith("malformed JSON at line 1"));
        }
    }

    @Test
    public void testRootMustBeObject() {
        try {
            parser.parse("[1, 2]");
            fail("expected FlowParseException");
        } catch (FlowParseException e) {
            assertEquals("root must be a JSON object", e.issues().get(0).message());
        }
    }

    @Test(expected = FlowParseException.class)
    public void testEmptyInput() {
        parser.parse(new byte[0]);
    }

    @Test
    public void testInputLimit() {
        FlowParser small = new FlowParser(16);
        try {
            small.parse("{\"nodes\":[],\"edges\":[]}");
            fail("expected FlowParseException");
        } catch (FlowParseException e) {
            assertTrue(e.issues().get(0).message().contains("maximum is 16"));
        }
    }

    @Test
    public void testEmptyFlowIsValid() {
        FlowDefinition def = parser.parse("{\"nodes\":[],\"edges\":[]}");
        assertTrue(def.getNodes().isEmpty());
        assertTrue(def.getEdges().isEmpty());
    }
}
