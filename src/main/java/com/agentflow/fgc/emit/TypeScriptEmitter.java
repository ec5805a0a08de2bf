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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.log4j.Log4j2;

/**
 * Writes {@code src/index.ts}, {@code package.json}, {@code tsconfig.json}
 * and {@code .env.example}.
 *
 * <p>
 * Imports and declarations live at module level; initializations and
 * executions run inside {@code main()}, initializations first.
 */
@Log4j2
public final class TypeScriptEmitter extends AbstractEmitter {
    static final String DOTENV = "dotenv";

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public TargetLanguage language() {
        return TargetLanguage.TYPESCRIPT;
    }

    @Override
    public EmitResult emit(IRGraph graph, ConversionResult result, GenerationContext ctx) {
        Map<FragmentKind, List<CodeFragment>> groups = groupByKind(result.fragments());
        Set<String> envVars = environmentVariables(result.fragments());
        Set<String> dependencies = new TreeSet<>(result.dependencies());
        String end = ctx.style().terminator();
        String q = String.valueOf(ctx.style().quote());
        String indent = ctx.style().indent(1);

        List<String> imports = new ArrayList<>();
        if (!envVars.isEmpty()) {
            imports.add("import " + q + "dotenv/config" + q + end);
            dependencies.add(DOTENV);
        }
        imports.addAll(importLines(groups.get(FragmentKind.IMPORT)));

        StringBuilder src = new StringBuilder(2048);
        if (ctx.isIncludeComments())
            src.append("// Generated from flow '").append(graph.metadata().name()).append("'\n\n");
        for (String line : imports)
            src.append(line).append('\n');

        List<String> declarations = blocks(groups.get(FragmentKind.DECLARATION), ctx);
        if (!declarations.isEmpty())
            src.append('\n').append(String.join("\n\n", declarations)).append('\n');

        List<String> body = new ArrayList<>();
        body.addAll(blocks(groups.get(FragmentKind.INITIALIZATION), ctx));
        body.addAll(blocks(groups.get(FragmentKind.EXECUTION), ctx));
        src.append("\nexport async function main(): Promise<void> {\n");
        List<String> indented = new ArrayList<>(body.size());
        for (String block : body)
            indented.add(indent(block, indent));
        if (!indented.isEmpty())
            src.append(String.join("\n\n", indented)).append('\n');
        src.append("}\n\n")
                .append("main().catch((error) => {\n")
                .append(indent).append("console.error(error)").append(end).append('\n')
                .append(indent).append("process.exit(1)").append(end).append('\n')
                .append("})").append(end).append('\n');

        List<EmittedFile> files = List.of(
                new EmittedFile("src/index.ts", src.toString(), "source"),
                new EmittedFile("package.json", packageJson(ctx, dependencies), "manifest"),
                new EmittedFile("tsconfig.json", tsconfig(), "config"),
                new EmittedFile(".env.example", envExample(ctx.getProjectName(), envVars), "env"));
        log.debug("Emitted {} TypeScript files for '{}'", files.size(), graph.metadata().name());
        return new EmitResult(files, new ArrayList<>(dependencies));
    }

    String packageJson(GenerationContext ctx, Set<String> dependencies) {
        ObjectNode root = mapper.createObjectNode();
        root.put("name", packageName(ctx.getProjectName()));
        root.put("version", "1.0.0");
        root.put("private", true);
        root.put("type", "module");
        root.put("main", "dist/index.js");
        ObjectNode scripts = root.putObject("scripts");
        scripts.put("build", "tsc");
        scripts.put("start", "node dist/index.js");
        scripts.put("dev", "tsx src/index.ts");
        ObjectNode deps = root.putObject("dependencies");
        for (String d : dependencies)
            deps.put(d, "latest");
        ObjectNode devDeps = root.putObject("devDependencies");
        devDeps.put("@types/node", "^20.0.0");
        devDeps.put("tsx", "^4.7.0");
        devDeps.put("typescript", "^5.4.0");
        return write(root);
    }

    private String tsconfig() {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode options = root.putObject("compilerOptions");
        options.put("target", "ES2022");
        options.put("module", "NodeNext");
        options.put("moduleResolution", "NodeNext");
        options.put("outDir", "dist");
        options.put("rootDir", "src");
        options.put("strict", true);
        options.put("esModuleInterop", true);
        options.put("skipLibCheck", true);
        root.putArray("include").add("src");
        return write(root);
    }

    private String write(ObjectNode node) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize manifest", e);
        }
    }

    /** npm package names are lower case, URL-safe. */
    static String packageName(String projectName) {
        String name = projectName == null ? "" : projectName.toLowerCase().replaceAll("[^a-z0-9._-]+", "-");
        name = name.replaceAll("^[-._]+", "").replaceAll("-+$", "");
        return name.isEmpty() ? "langchain-app" : name;
    }
}
