package com.agentflow.fgc;

import java.util.List;

import com.agentflow.fgc.api.CodeFragment;
import com.agentflow.fgc.api.Converter;
import com.agentflow.fgc.api.FragmentKind;
import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.ir.IRNode;

/**
 * Minimal converter for tests: one import, one declaration wiring in
 * whatever feeds the {@code in} port and one execution per node.
 */
public class StubConverter implements Converter {
    private final String nodeType;
    private final List<String> aliases;
    private boolean failing;

    public StubConverter(String nodeType, String... aliases) {
        this.nodeType = nodeType;
        this.aliases = List.of(aliases);
    }

    public StubConverter failing() {
        this.failing = true;
        return this;
    }

    @Override
    public String nodeType() {
        return nodeType;
    }

    @Override
    public String category() {
        return "Stub";
    }

    @Override
    public List<String> aliases() {
        return aliases;
    }

    @Override
    public List<CodeFragment> convert(IRNode node, GenerationContext context) {
        if (failing)
            throw new IllegalStateException("boom");
        String var = node.id();
        return List.of(
                CodeFragment.builder().id(var + "-import").kind(FragmentKind.IMPORT)
                        .content("import { Stub } from 'stub';").dependency("stub-pkg").dependency("shared")
                        .language(context.getLanguage()).nodeId(var).build(),
                CodeFragment.builder().id(var + "-exec").kind(FragmentKind.EXECUTION)
                        .content("run(" + var + ");").language(context.getLanguage()).nodeId(var).build(),
                CodeFragment.builder().id(var + "-decl").kind(FragmentKind.DECLARATION)
                        .content("const " + var + " = new Stub();\n" + var + ".use({{input?:in}});").export(var)
                        .language(context.getLanguage()).nodeId(var).build());
    }

    @Override
    public List<String> getDependencies(IRNode node, GenerationContext context) {
        return List.of("shared");
    }
}
