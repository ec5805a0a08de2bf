package com.agentflow.fgc.convert.langchain;

import java.util.List;

import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.convert.AbstractConverter;
import com.agentflow.fgc.ir.IRNode;

/**
 * Conversation memory, optionally windowed to the last {@code k} exchanges.
 */
public final class BufferMemoryConverter extends AbstractConverter {
    private final boolean windowed;

    private BufferMemoryConverter(String nodeType, boolean windowed, String... aliases) {
        super(nodeType, "Memory", aliases);
        this.windowed = windowed;
    }

    public static BufferMemoryConverter buffer() {
        return new BufferMemoryConverter("bufferMemory", false, "conversationBufferMemory");
    }

    public static BufferMemoryConverter window() {
        return new BufferMemoryConverter("bufferWindowMemory", true);
    }

    private String className(TargetLanguage language) {
        if (language == TargetLanguage.PYTHON)
            return windowed ? "ConversationBufferWindowMemory" : "ConversationBufferMemory";
        return windowed ? "BufferWindowMemory" : "BufferMemory";
    }

    @Override
    protected List<String> imports(IRNode node, GenerationContext ctx) {
        String cls = className(ctx.getLanguage());
        if (ctx.getLanguage() == TargetLanguage.PYTHON)
            return List.of(pyImport("langchain.memory", cls));
        return List.of(tsImport(ctx, cls, "langchain/memory"));
    }

    @Override
    protected String body(IRNode node, GenerationContext ctx, String var) {
        String k = windowed ? numberParam(node, "k") : null;
        return construct(ctx, var, className(ctx.getLanguage()), List.of(
                Arg.of("memoryKey", "memory_key", literal(stringParam(node, "memoryKey", "chat_history"), ctx)),
                Arg.of("returnMessages", "return_messages", literal(Boolean.TRUE, ctx)),
                Arg.of("k", "k", windowed && k == null ? "4" : k)));
    }

    @Override
    protected List<String> packages(TargetLanguage language) {
        return List.of("langchain");
    }
}
