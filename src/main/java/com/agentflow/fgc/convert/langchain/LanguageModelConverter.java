package com.agentflow.fgc.convert.langchain;

import java.util.ArrayList;
import java.util.List;

import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.convert.AbstractConverter;
import com.agentflow.fgc.ir.IRNode;

/**
 * Chat models and completion LLMs. Providers differ only in class, package
 * and API-key variable, so one converter class serves them all.
 */
public final class LanguageModelConverter extends AbstractConverter {
    private final String className;
    private final String tsModule;
    private final String pyModule;
    private final String pyPackage;
    private final String apiKeyEnv;
    private final String defaultModel;

    public LanguageModelConverter(String nodeType, String category, String className, String tsModule,
            String pyModule, String pyPackage, String apiKeyEnv, String defaultModel, String... aliases) {
        super(nodeType, category, aliases);
        this.className = className;
        this.tsModule = tsModule;
        this.pyModule = pyModule;
        this.pyPackage = pyPackage;
        this.apiKeyEnv = apiKeyEnv;
        this.defaultModel = defaultModel;
    }

    @Override
    protected List<String> imports(IRNode node, GenerationContext ctx) {
        if (ctx.getLanguage() == TargetLanguage.PYTHON)
            return List.of(pyImport(pyModule, className), "import os");
        return List.of(tsImport(ctx, className, tsModule));
    }

    @Override
    protected String body(IRNode node, GenerationContext ctx, String var) {
        List<Arg> args = new ArrayList<>();
        args.add(Arg.of("model", "model", literal(stringParam(node, "modelName", defaultModel), ctx)));
        args.add(Arg.of("temperature", "temperature", numberParam(node, "temperature")));
        args.add(Arg.of("maxTokens", "max_tokens", numberParam(node, "maxTokens")));
        args.add(Arg.of("topP", "top_p", numberParam(node, "topP")));
        Object streaming = node.parameterValue("streaming");
        if (streaming != null)
            args.add(Arg.of("streaming", "streaming", literal(Boolean.valueOf(streaming.toString()), ctx)));
        args.add(Arg.of("apiKey", "api_key", env(ctx, apiKeyEnv)));
        return construct(ctx, var, className, args);
    }

    @Override
    protected List<String> packages(TargetLanguage language) {
        return language == TargetLanguage.PYTHON ? List.of(pyPackage) : List.of(tsModule);
    }
}
