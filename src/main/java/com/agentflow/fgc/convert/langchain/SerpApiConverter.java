package com.agentflow.fgc.convert.langchain;

import java.util.List;

import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.convert.AbstractConverter;
import com.agentflow.fgc.ir.IRNode;

/** Web search tool backed by SerpAPI. */
public final class SerpApiConverter extends AbstractConverter {

    public SerpApiConverter() {
        super("serpAPI", "Tools", "serpApi");
    }

    @Override
    protected List<String> imports(IRNode node, GenerationContext ctx) {
        if (ctx.getLanguage() == TargetLanguage.PYTHON)
            return List.of(pyImport("langchain_community.utilities", "SerpAPIWrapper"), "import os");
        return List.of(tsImport(ctx, "SerpAPI", "@langchain/community/tools/serpapi"));
    }

    @Override
    protected String body(IRNode node, GenerationContext ctx, String var) {
        if (ctx.getLanguage() == TargetLanguage.PYTHON)
            return construct(ctx, var, "SerpAPIWrapper",
                    List.of(Arg.of("apiKey", "serpapi_api_key", env(ctx, "SERPAPI_API_KEY"))));
        return assign(ctx, var, "new SerpAPI(" + env(ctx, "SERPAPI_API_KEY") + ")");
    }

    @Override
    protected List<String> packages(TargetLanguage language) {
        return language == TargetLanguage.PYTHON
                ? List.of("langchain-community", "google-search-results")
                : List.of("@langchain/community");
    }
}
