package com.agentflow.fgc.convert;

import java.util.List;

import com.agentflow.fgc.api.CodeFragment;
import com.agentflow.fgc.api.FragmentKind;
import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;

/**
 * Graph-level fragments declaring the console tracer chains report to when
 * tracing is enabled.
 */
public final class TracingSupport {
    public static final String TRACER_VARIABLE = "tracer";

    private TracingSupport() {
        // Utility class
    }

    /** Import and declaration of the tracer; negative order puts them ahead of node fragments. */
    public static List<CodeFragment> fragments(GenerationContext ctx) {
        TargetLanguage lang = ctx.getLanguage();
        boolean py = lang == TargetLanguage.PYTHON;
        String q = String.valueOf(ctx.style().quote());
        String end = ctx.style().terminator();

        CodeFragment imp = CodeFragment.builder()
                .id("tracing-import")
                .kind(FragmentKind.IMPORT)
                .content(py ? "from langchain_core.tracers.stdout import ConsoleCallbackHandler"
                        : "import { ConsoleCallbackHandler } from " + q + "@langchain/core/tracers/console" + q + end)
                .dependency(py ? "langchain-core" : "@langchain/core")
                .language(lang)
                .order(-1)
                .build();
        CodeFragment decl = CodeFragment.builder()
                .id("tracing-declaration")
                .kind(FragmentKind.DECLARATION)
                .content(py ? TRACER_VARIABLE + " = ConsoleCallbackHandler()"
                        : "const " + TRACER_VARIABLE + " = new ConsoleCallbackHandler()" + end)
                .language(lang)
                .order(-1)
                .export(TRACER_VARIABLE)
                .description("Console tracing callback")
                .build();
        return List.of(imp, decl);
    }
}
