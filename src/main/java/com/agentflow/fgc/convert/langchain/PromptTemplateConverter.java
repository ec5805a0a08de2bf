package com.agentflow.fgc.convert.langchain;

import java.util.List;

import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.convert.AbstractConverter;
import com.agentflow.fgc.ir.IRNode;

public final class PromptTemplateConverter extends AbstractConverter {

    public PromptTemplateConverter() {
        super("promptTemplate", "Prompts");
    }

    @Override
    protected List<String> imports(IRNode node, GenerationContext ctx) {
        if (ctx.getLanguage() == TargetLanguage.PYTHON)
            return List.of(pyImport("langchain_core.prompts", "PromptTemplate"));
        return List.of(tsImport(ctx, "PromptTemplate", "@langchain/core/prompts"));
    }

    @Override
    protected String body(IRNode node, GenerationContext ctx, String var) {
        String template = literal(stringParam(node, "template", "{input}"), ctx);
        if (ctx.getLanguage() == TargetLanguage.PYTHON)
            return assign(ctx, var, "PromptTemplate.from_template(" + template + ")");
        return assign(ctx, var, "PromptTemplate.fromTemplate(" + template + ")");
    }

    @Override
    protected List<String> packages(TargetLanguage language) {
        return language == TargetLanguage.PYTHON ? List.of("langchain-core") : List.of("@langchain/core");
    }
}
