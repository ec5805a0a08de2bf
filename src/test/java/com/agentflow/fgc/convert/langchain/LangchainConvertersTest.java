package com.agentflow.fgc.convert.langchain;

import static com.agentflow.fgc.TestGraphs.*;
import static org.junit.Assert.*;

import java.util.List;

import com.agentflow.fgc.FlowGraphConverter;
import com.agentflow.fgc.TestGraphs;
import com.agentflow.fgc.api.CodeFragment;
import com.agentflow.fgc.api.FragmentKind;
import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.IssueType;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.convert.AbstractConverter;
import com.agentflow.fgc.engine.ConversionOrchestrator;
import com.agentflow.fgc.engine.ConversionResult;
import com.agentflow.fgc.ir.IRGraph;
import com.agentflow.fgc.ir.IRNode;
import com.agentflow.fgc.registry.ConverterRegistry;

import org.junit.Test;

public class LangchainConvertersTest {

    private static final GenerationContext TS = GenerationContext.forLanguage(TargetLanguage.TYPESCRIPT);
    private static final GenerationContext PY = GenerationContext.forLanguage(TargetLanguage.PYTHON);

    private final ConversionOrchestrator orchestrator = new ConversionOrchestrator(ConverterRegistry.builtIns());

    private IRGraph llmChainFlow() {
        return new FlowGraphConverter().load(TestGraphs.fixture("llm-chain.json"), "llm-chain");
    }

    private static String content(ConversionResult result, String nodeId, FragmentKind kind) {
        return result.fragments().stream()
                .filter(f -> nodeId.equals(f.getNodeId()) && f.getKind() == kind)
                .map(CodeFragment::getContent)
                .findFirst()
                .orElseThrow();
    }

    @Test
    public void testTypeScriptChatModel() {
        ConversionResult result = orchestrator.convert(llmChainFlow(), TS);
        assertEquals("const chatOpenAI_0 = new ChatOpenAI({\n"
                + "  model: 'gpt-4o',\n"
                + "  temperature: 0.2,\n"
                + "  apiKey: process.env.OPENAI_API_KEY,\n"
                + "});", content(result, "chatOpenAI_0", FragmentKind.DECLARATION));
        assertEquals("import { ChatOpenAI } from '@langchain/openai';",
                content(result, "chatOpenAI_0", FragmentKind.IMPORT));
    }

    @Test
    public void testTypeScriptChainWiresUpstreamVariables() {
        ConversionResult result = orchestrator.convert(llmChainFlow(), TS);

        assertTrue(result.isSuccess());
        assertEquals("const llmChain_0 = new LLMChain({\n"
                + "  llm: chatOpenAI_0,\n"
                + "  prompt: promptTemplate_0,\n"
                + "});", content(result, "llmChain_0", FragmentKind.INITIALIZATION));
        assertEquals("const llmChain_0Result = await llmChain_0.invoke({ 'input': 'cats' });\n"
                + "console.log(llmChain_0Result);", content(result, "llmChain_0", FragmentKind.EXECUTION));
        assertEquals(List.of("@langchain/core", "@langchain/openai", "langchain"), result.dependencies());
    }

    @Test
    public void testPythonUsesSnakeCase() {
        ConversionResult result = orchestrator.convert(llmChainFlow(), PY);

        assertEquals("chat_open_ai_0 = ChatOpenAI(\n"
                + "    model=\"gpt-4o\",\n"
                + "    temperature=0.2,\n"
                + "    api_key=os.environ[\"OPENAI_API_KEY\"],\n"
                + ")", content(result, "chatOpenAI_0", FragmentKind.DECLARATION));
        assertEquals("llm_chain_0_result = await llm_chain_0.ainvoke({\"input\": \"cats\"})\n"
                + "print(llm_chain_0_result)", content(result, "llmChain_0", FragmentKind.EXECUTION));
        assertTrue(content(result, "llmChain_0", FragmentKind.INITIALIZATION).contains("llm=chat_open_ai_0,"));
        assertTrue(result.dependencies().contains("langchain-openai"));
    }

    @Test
    public void testTracingPassesCallbacks() {
        ConversionResult result = orchestrator.convert(llmChainFlow(), TS.toBuilder().includeTracing(true).build());
        assertTrue(content(result, "llmChain_0", FragmentKind.EXECUTION).contains("{ callbacks: [tracer] }"));
    }

    @Test
    public void testWindowMemoryDefaultsK() {
        IRGraph graph = graph(List.of(node("memory_0", "bufferWindowMemory")));
        String body = content(orchestrator.convert(graph, TS), "memory_0", FragmentKind.DECLARATION);

        assertTrue(body.startsWith("const memory_0 = new BufferWindowMemory({"));
        assertTrue(body.contains("  k: 4,\n"));
        assertTrue(body.contains("  memoryKey: 'chat_history',\n"));
    }

    @Test
    public void testAliasResolves() {
        IRGraph graph = graph(List.of(node("search", "serpApi")));
        ConversionResult result = orchestrator.convert(graph, PY);

        assertEquals(List.of("search"), result.convertedNodes());
        assertEquals(List.of("google-search-results", "langchain-community"), result.dependencies());
    }

    @Test
    public void testNonNumericParameterFailsNode() {
        IRGraph graph = graph(List.of(node("llm", "openAI", optionalParam("temperature", "warm"))));
        ConversionResult result = orchestrator.convert(graph, TS);

        assertEquals(List.of("llm"), result.skippedNodes());
        assertEquals(IssueType.CONVERSION_FAILED, result.errors().get(0).getType());
        assertTrue(result.errors().get(0).getMessage().contains("not a number: warm"));
    }

    @Test
    public void testUnconnectedRequiredInputBecomesNull() {
        IRGraph graph = graph(List.of(node("chain", "conversationChain")));
        ConversionResult result = orchestrator.convert(graph, TS);

        assertTrue(content(result, "chain", FragmentKind.INITIALIZATION).contains("  llm: null,\n"));
        assertTrue(result.warnings().stream().anyMatch(w -> w.getType() == IssueType.UNRESOLVED_REFERENCE));
    }

    @Test
    public void testVariableNames() {
        IRNode node = node("chatOpenAI_0", "chatOpenAI");
        assertEquals("chatOpenAI_0", AbstractConverter.variableName(node, TargetLanguage.TYPESCRIPT));
        assertEquals("chat_open_ai_0", AbstractConverter.variableName(node, TargetLanguage.PYTHON));
        assertEquals("_1_step", AbstractConverter.variableName(node("1-step", "x"), TargetLanguage.TYPESCRIPT));
    }

    @Test
    public void testCollidingNodeIdsDeclareDistinctVariables() {
        IRGraph graph = graph(List.of(node("llm-0", "chatOpenAI"), node("llm_0", "chatOpenAI"),
                node("chain", "conversationChain")), edge("llm_0", "chain", "model"));
        ConversionResult result = orchestrator.convert(graph, TS);

        assertTrue(content(result, "llm-0", FragmentKind.DECLARATION).startsWith("const llm_0 = new ChatOpenAI({"));
        assertTrue(content(result, "llm_0", FragmentKind.DECLARATION).startsWith("const llm_0_2 = new ChatOpenAI({"));
        assertTrue(content(result, "chain", FragmentKind.INITIALIZATION).contains("  llm: llm_0_2,\n"));
    }

    @Test
    public void testNodeNamedLikeTracerIsRenamedWhenTracing() {
        GenerationContext traced = TS.toBuilder().includeTracing(true).build();
        ConversionResult result = orchestrator.convert(graph(List.of(node("tracer", "chatOpenAI"))), traced);

        assertTrue(content(result, "tracer", FragmentKind.DECLARATION).startsWith("const tracer_2 = new ChatOpenAI({"));
    }
}
