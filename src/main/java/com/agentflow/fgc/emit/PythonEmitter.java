package com.agentflow.fgc.emit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.agentflow.fgc.api.CodeFragment;
import com.agentflow.fgc.api.FragmentKind;
import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.engine.ConversionResult;
import com.agentflow.fgc.ir.IRGraph;

import lombok.extern.log4j.Log4j2;

/**
 * Writes {@code main.py}, {@code requirements.txt} and {@code .env.example}.
 */
@Log4j2
public final class PythonEmitter extends AbstractEmitter {
    static final String DOTENV = "python-dotenv";

    @Override
    public TargetLanguage language() {
        return TargetLanguage.PYTHON;
    }

    @Override
    public EmitResult emit(IRGraph graph, ConversionResult result, GenerationContext ctx) {
        Map<FragmentKind, List<CodeFragment>> groups = groupByKind(result.fragments());
        Set<String> envVars = environmentVariables(result.fragments());
        Set<String> dependencies = new TreeSet<>(result.dependencies());
        String indent = ctx.style().indent(1);

        List<String> imports = new ArrayList<>();
        imports.add("import asyncio");
        if (!envVars.isEmpty()) {
            imports.add("from dotenv import load_dotenv");
            dependencies.add(DOTENV);
        }
        for (String line : importLines(groups.get(FragmentKind.IMPORT)))
            if (!imports.contains(line))
                imports.add(line);

        StringBuilder src = new StringBuilder(2048);
        if (ctx.isIncludeComments())
            src.append("# Generated from flow '").append(graph.metadata().name()).append("'\n\n");
        for (String line : imports)
            src.append(line).append('\n');
        if (!envVars.isEmpty())
            src.append("\nload_dotenv()\n");

        List<String> declarations = blocks(groups.get(FragmentKind.DECLARATION), ctx);
        if (!declarations.isEmpty())
            src.append('\n').append(String.join("\n\n", declarations)).append('\n');

        List<String> body = new ArrayList<>();
        body.addAll(blocks(groups.get(FragmentKind.INITIALIZATION), ctx));
        body.addAll(blocks(groups.get(FragmentKind.EXECUTION), ctx));
        src.append("\n\nasync def main():\n");
        if (body.isEmpty()) {
            src.append(indent).append("pass\n");
        } else {
            List<String> indented = new ArrayList<>(body.size());
            for (String block : body)
                indented.add(indent(block, indent));
            src.append(String.join("\n\n", indented)).append('\n');
        }
        src.append("\n\nif __name__ == \"__main__\":\n")
                .append(indent).append("asyncio.run(main())\n");

        StringBuilder requirements = new StringBuilder();
        for (String d : dependencies)
            requirements.append(d).append('\n');

        List<EmittedFile> files = List.of(
                new EmittedFile("main.py", src.toString(), "source"),
                new EmittedFile("requirements.txt", requirements.toString(), "manifest"),
                new EmittedFile(".env.example", envExample(ctx.getProjectName(), envVars), "env"));
        log.debug("Emitted {} Python files for '{}'", files.size(), graph.metadata().name());
        return new EmitResult(files, new ArrayList<>(dependencies));
    }
}
