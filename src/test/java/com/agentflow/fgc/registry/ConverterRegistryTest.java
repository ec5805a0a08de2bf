package com.agentflow.fgc.registry;

import static com.agentflow.fgc.TestGraphs.node;
import static org.junit.Assert.*;

import java.util.List;

import com.agentflow.fgc.StubConverter;
import com.agentflow.fgc.api.IssueType;
import com.agentflow.fgc.api.ValidationIssue;
import com.agentflow.fgc.ir.IRNode;

import org.junit.Test;

public class ConverterRegistryTest {

    @Test
    public void testLookupByTypeAndAlias() {
        StubConverter stub = new StubConverter("stub", "oldStub");
        ConverterRegistry registry = ConverterRegistry.builder().register(stub).build();

        assertSame(stub, registry.converterFor("stub"));
        assertSame(stub, registry.converterFor("oldStub"));
        assertNull(registry.converterFor("other"));
        assertNull(registry.converterFor((String) null));
        assertTrue(registry.isSupported("oldStub"));
        assertEquals(1, registry.size());
        assertEquals("stub", registry.aliases().get("oldStub"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateTypeFails() {
        ConverterRegistry.builder().register(new StubConverter("stub")).register(new StubConverter("stub"));
    }

    @Test
    public void testAliasCollidingWithTypeFails() {
        try {
            ConverterRegistry.builder().register(new StubConverter("stub")).register(new StubConverter("other", "stub"));
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("Alias already bound: stub"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTypeCollidingWithAliasFails() {
        ConverterRegistry.builder().register(new StubConverter("a", "b")).register(new StubConverter("b"));
    }

    @Test
    public void testCheckSupport() {
        ConverterRegistry registry = ConverterRegistry.builder().register(new StubConverter("stub")).build();
        List<IRNode> nodes = List.of(node("a", "stub"), node("b", "mystery"));

        List<ValidationIssue> issues = registry.checkSupport(nodes);
        assertEquals(1, issues.size());
        assertEquals(IssueType.UNSUPPORTED_TYPE, issues.get(0).getType());
        assertEquals("b", issues.get(0).getNodeId());
    }

    @Test
    public void testVersionGuard() {
        StubConverter v2Only = new StubConverter("stub") {
            @Override
            public List<String> supportedVersions() {
                return List.of("2");
            }
        };
        ConverterRegistry registry = ConverterRegistry.builder().register(v2Only).build();
        // TestGraphs nodes are version "1"
        assertNull(registry.converterFor(node("a", "stub")));
    }

    @Test
    public void testBuiltIns() {
        ConverterRegistry registry = ConverterRegistry.builtIns();
        RegistryStatistics stats = registry.statistics();

        assertEquals(10, stats.totalConverters());
        assertEquals(0, stats.deprecatedConverters());
        assertTrue(registry.isSupported("chatOpenAI"));
        assertTrue(registry.isSupported("LLMChain"));
        assertTrue(registry.supportedTypes().contains("serpApi"));
        assertEquals(List.of("llmChain", "conversationChain"), registry.convertersByCategory().get("Chains"));
    }
}
