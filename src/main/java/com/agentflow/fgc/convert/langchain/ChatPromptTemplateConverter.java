package com.agentflow.fgc.convert.langchain;

import java.util.List;

import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.convert.AbstractConverter;
import com.agentflow.fgc.ir.IRNode;

/** System plus human message prompt. */
public final class ChatPromptTemplateConverter extends AbstractConverter {

    public ChatPromptTemplateConverter() {
        super("chatPromptTemplate", "Prompts");
    }

    @Override
    protected List<String> imports(IRNode node, GenerationContext ctx) {
        if (ctx.getLanguage() == TargetLanguage.PYTHON)
            return List.of(pyImport("langchain_core.prompts", "ChatPromptTemplate"));
        return List.of(tsImport(ctx, "ChatPromptTemplate", "@langchain/core/prompts"));
    }

    @Override
    protected String body(IRNode node, GenerationContext ctx, String var) {
        boolean py = ctx.getLanguage() == TargetLanguage.PYTHON;
        String system = literal(stringParam(node, "systemMessagePrompt", "You are a helpful assistant."), ctx);
        String human = literal(stringParam(node, "humanMessagePrompt", "{input}"), ctx);
        String indent = ctx.style().indent(1);
        String open = py ? "(" : "[", close = py ? ")" : "]";
        String systemRole = literal("system", ctx), humanRole = literal("human", ctx);

        StringBuilder messages = new StringBuilder("[\n")
                .append(indent).append(open).append(systemRole).append(", ").append(system).append(close).append(",\n")
                .append(indent).append(open).append(humanRole).append(", ").append(human).append(close).append(",\n")
                .append(']');
        String factory = py ? "ChatPromptTemplate.from_messages(" : "ChatPromptTemplate.fromMessages(";
        return assign(ctx, var, factory + messages + ")");
    }

    @Override
    protected List<String> packages(TargetLanguage language) {
        return language == TargetLanguage.PYTHON ? List.of("langchain-core") : List.of("@langchain/core");
    }
}
