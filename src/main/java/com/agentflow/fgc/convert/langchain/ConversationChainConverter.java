package com.agentflow.fgc.convert.langchain;

import java.util.List;

import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.ir.IRNode;

public final class ConversationChainConverter extends ChainConverter {

    public ConversationChainConverter() {
        super("conversationChain");
    }

    @Override
    protected List<String> imports(IRNode node, GenerationContext ctx) {
        if (ctx.getLanguage() == TargetLanguage.PYTHON)
            return List.of(pyImport("langchain.chains", "ConversationChain"));
        return List.of(tsImport(ctx, "ConversationChain", "langchain/chains"));
    }

    @Override
    protected String body(IRNode node, GenerationContext ctx, String var) {
        return construct(ctx, var, "ConversationChain", List.of(
                Arg.of("llm", "llm", input("model")),
                Arg.of("memory", "memory", optionalInput("memory")),
                Arg.of("prompt", "prompt", optionalInput("chatPromptTemplate"))));
    }

    @Override
    protected List<String> packages(TargetLanguage language) {
        return List.of("langchain");
    }
}
