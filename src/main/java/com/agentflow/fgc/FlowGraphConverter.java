package com.agentflow.fgc;

import java.io.IOException;
import java.nio.file.Path;

import com.agentflow.fgc.api.ConversionListener;
import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.ValidationResult;
import com.agentflow.fgc.config.ConverterSettings;
import com.agentflow.fgc.emit.EmitResult;
import com.agentflow.fgc.emit.Emitters;
import com.agentflow.fgc.engine.ConversionOrchestrator;
import com.agentflow.fgc.engine.ConversionResult;
import com.agentflow.fgc.engine.GraphStats;
import com.agentflow.fgc.engine.IRGraphAnalyzer;
import com.agentflow.fgc.io.FlowParser;
import com.agentflow.fgc.io.OutputWriter;
import com.agentflow.fgc.ir.IRGraph;
import com.agentflow.fgc.ir.IRGraphBuilder;
import com.agentflow.fgc.registry.ConverterRegistry;
import com.agentflow.fgc.util.CompositeConversionListener;

import lombok.extern.log4j.Log4j2;

/**
 * Entry point wiring the pipeline together:
 * JSON, {@link FlowParser}, {@link IRGraphBuilder}, {@link IRGraphAnalyzer},
 * {@link ConversionOrchestrator}, then an emitter.
 *
 * <p>
 * Thread-safe once constructed: every call owns its graph and fragments, and
 * the registry is read-only.
 *
 * <pre>{@code
 * FlowGraphConverter converter = new FlowGraphConverter();
 * IRGraph graph = converter.loadFile(Path.of("flow.json"));
 * ConversionReport report = converter.convert(graph, GenerationContext.forLanguage(TargetLanguage.PYTHON));
 * }</pre>
 */
@Log4j2
public final class FlowGraphConverter {
    private final FlowParser parser;
    private final IRGraphBuilder builder = new IRGraphBuilder();
    private final ConversionOrchestrator orchestrator;
    private final CompositeConversionListener listeners = new CompositeConversionListener();

    public FlowGraphConverter() {
        this(ConverterRegistry.builtIns(), new FlowParser());
    }

    public FlowGraphConverter(ConverterRegistry registry, FlowParser parser) {
        this.parser = parser;
        this.orchestrator = new ConversionOrchestrator(registry);
        this.orchestrator.setListener(listeners);
    }

    public static FlowGraphConverter fromSettings(ConverterSettings settings) {
        return new FlowGraphConverter(ConverterRegistry.builtIns(), new FlowParser(settings.getMaxInputBytes()));
    }

    public FlowGraphConverter addListener(ConversionListener listener) {
        listeners.add(listener);
        return this;
    }

    public ConverterRegistry registry() {
        return orchestrator.registry();
    }

    /**
     * Parses and lifts a flow.
     *
     * @throws com.agentflow.fgc.io.FlowParseException on structurally invalid input
     */
    public IRGraph load(byte[] json, String flowName) {
        return builder.build(parser.parse(json), flowName);
    }

    /** Loads a flow file; the flow is named after the file. */
    public IRGraph loadFile(Path path) throws IOException {
        return builder.build(parser.parseFile(path), flowName(path));
    }

    public ValidationResult validate(IRGraph graph) {
        return orchestrator.validate(graph);
    }

    public GraphStats analyze(IRGraph graph) {
        return IRGraphAnalyzer.analyzeGraph(graph);
    }

    public ConversionReport convert(IRGraph graph, GenerationContext ctx) {
        ValidationResult validation = orchestrator.validate(graph);
        ConversionResult result = orchestrator.convert(graph, ctx);
        EmitResult output = result.aborted() ? null : Emitters.forLanguage(ctx.getLanguage()).emit(graph, result, ctx);
        return new ConversionReport(graph, validation, result, output);
    }

    public ConversionReport convert(byte[] json, String flowName, GenerationContext ctx) {
        return convert(load(json, flowName), ctx);
    }

    /**
     * Converts a flow file and writes the emitted files below {@code outputDir}.
     * Nothing is written when the conversion aborted.
     */
    public ConversionReport convertFile(Path input, Path outputDir, GenerationContext ctx, boolean overwrite)
            throws IOException {
        ConversionReport report = convert(loadFile(input), ctx);
        if (report.hasOutput())
            new OutputWriter(overwrite).write(report.output(), outputDir);
        else
            log.warn("Nothing written for {}: conversion aborted", input);
        return report;
    }

    static String flowName(Path path) {
        String file = path.getFileName().toString();
        return file.endsWith(".json") ? file.substring(0, file.length() - 5) : file;
    }
}
