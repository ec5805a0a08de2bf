package com.agentflow.fgc.convert.langchain;

import java.util.List;

import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.ir.IRNode;

public final class LlmChainConverter extends ChainConverter {

    public LlmChainConverter() {
        super("llmChain", "LLMChain");
    }

    @Override
    protected List<String> imports(IRNode node, GenerationContext ctx) {
        if (ctx.getLanguage() == TargetLanguage.PYTHON)
            return List.of(pyImport("langchain.chains", "LLMChain"));
        return List.of(tsImport(ctx, "LLMChain", "langchain/chains"));
    }

    @Override
    protected String body(IRNode node, GenerationContext ctx, String var) {
        return construct(ctx, var, "LLMChain", List.of(
                Arg.of("llm", "llm", input("model")),
                Arg.of("prompt", "prompt", input("prompt")),
                Arg.of("memory", "memory", optionalInput("memory")),
                Arg.of("outputParser", "output_parser", optionalInput("outputParser"))));
    }

    @Override
    protected List<String> packages(TargetLanguage language) {
        return List.of("langchain");
    }
}
