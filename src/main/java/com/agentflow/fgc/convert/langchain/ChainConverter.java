package com.agentflow.fgc.convert.langchain;

import com.agentflow.fgc.api.FragmentKind;
import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.convert.AbstractConverter;
import com.agentflow.fgc.convert.TracingSupport;
import com.agentflow.fgc.ir.IRNode;

/**
 * Chains are built inside {@code main} from their upstream components and
 * then invoked once with the configured input.
 */
abstract class ChainConverter extends AbstractConverter {

    protected ChainConverter(String nodeType, String... aliases) {
        super(nodeType, "Chains", aliases);
    }

    @Override
    protected FragmentKind bodyKind() {
        return FragmentKind.INITIALIZATION;
    }

    @Override
    protected String execution(IRNode node, GenerationContext ctx, String var) {
        boolean py = ctx.getLanguage() == TargetLanguage.PYTHON;
        String result = resultName(var, ctx.getLanguage());
        String input = literal(stringParam(node, "input", "Hello"), ctx);
        String key = literal(stringParam(node, "inputKey", "input"), ctx);
        String end = ctx.style().terminator();

        if (py) {
            String config = ctx.isIncludeTracing()
                    ? ", config={\"callbacks\": [" + TracingSupport.TRACER_VARIABLE + "]}"
                    : "";
            return result + " = await " + var + ".ainvoke({" + key + ": " + input + "}" + config + ")\n"
                    + "print(" + result + ")";
        }
        String options = ctx.isIncludeTracing() ? ", { callbacks: [" + TracingSupport.TRACER_VARIABLE + "] }" : "";
        return "const " + result + " = await " + var + ".invoke({ " + key + ": " + input + " }" + options + ")" + end
                + "\nconsole.log(" + result + ")" + end;
    }
}
