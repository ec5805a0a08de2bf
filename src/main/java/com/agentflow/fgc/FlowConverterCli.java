package com.agentflow.fgc;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.api.ValidationIssue;
import com.agentflow.fgc.api.ValidationResult;
import com.agentflow.fgc.api.ValidationSuggestion;
import com.agentflow.fgc.config.ConverterSettings;
import com.agentflow.fgc.io.FlowParseException;
import com.agentflow.fgc.io.ParseIssue;
import com.agentflow.fgc.ir.IRGraph;
import com.agentflow.fgc.registry.RegistryStatistics;
import com.agentflow.fgc.util.ConversionMetricsListener;
import com.agentflow.fgc.util.FlowExplain;
import com.agentflow.fgc.web.ConversionApi;
import com.agentflow.fgc.web.ConversionServer;
import com.agentflow.fgc.wiring.ConversionDispatcher;
import com.agentflow.fgc.wiring.JobTracker;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Command line front end.
 *
 * <pre>
 * convert  &lt;flow.json&gt; [-o dir] [-l typescript|python] [--tracing] [--no-comments] [--overwrite]
 * validate &lt;flow.json&gt;
 * analyze  &lt;flow.json&gt; [--mermaid]
 * batch    &lt;dir&gt; [-o dir] [-l typescript|python] [--overwrite]
 * serve    [--port n]
 * info
 * </pre>
 */
public final class FlowConverterCli {
    private static final Logger log = LogManager.getLogger(FlowConverterCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private final ConverterSettings settings;
    private final FlowGraphConverter converter;
    private final PrintStream out;
    private final PrintStream err;

    FlowConverterCli(ConverterSettings settings, PrintStream out, PrintStream err) {
        this.settings = settings;
        this.converter = FlowGraphConverter.fromSettings(settings);
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code;
        try {
            code = new FlowConverterCli(ConverterSettings.load(), System.out, System.err).run(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Configuration error: " + e.getMessage());
            code = EXIT_USAGE;
        }
        System.exit(code);
    }

    int run(String[] args) {
        if (args.length == 0)
            return usage("No command given");
        Options opts;
        try {
            opts = Options.parse(args);
        } catch (IllegalArgumentException e) {
            return usage(e.getMessage());
        }

        try {
            switch (opts.command) {
            case "convert":
                return convert(opts);
            case "validate":
                return validate(opts);
            case "analyze":
                return analyze(opts);
            case "batch":
                return batch(opts);
            case "serve":
                return serve(opts);
            case "info":
                return info();
            default:
                return usage("Unknown command: " + opts.command);
            }
        } catch (FlowParseException e) {
            err.println("Invalid flow: " + e.getMessage());
            for (ParseIssue issue : e.issues())
                err.println("  " + issue);
            return EXIT_INVALID;
        } catch (IllegalArgumentException e) {
            return usage(e.getMessage());
        } catch (IOException e) {
            log.error("I/O failure running '{}'", opts.command, e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        }
    }

    // ── Commands ────────────────────────────────────────────────────

    private int convert(Options opts) throws IOException {
        Path input = opts.requirePositional("convert");
        Path outDir = opts.outputDir(settings);
        ConversionMetricsListener metrics = new ConversionMetricsListener();
        converter.addListener(metrics);

        ConversionReport report = converter.convertFile(input, outDir, opts.context(settings), opts.flag("--overwrite"));
        printIssues(report.conversion().errors(), report.conversion().warnings());
        if (!report.hasOutput()) {
            err.println("Conversion aborted, nothing written");
            return EXIT_INVALID;
        }
        out.printf("Wrote %d files to %s (%d nodes converted, %d skipped)%n",
                report.output().files().size(), outDir,
                report.conversion().convertedNodes().size(), report.conversion().skippedNodes().size());
        log.debug("Metrics:\n{}", metrics.dump());
        return report.conversion().errors().isEmpty() ? EXIT_OK : EXIT_INVALID;
    }

    private int validate(Options opts) throws IOException {
        IRGraph graph = converter.loadFile(opts.requirePositional("validate"));
        ValidationResult result = converter.validate(graph);
        printIssues(result.errors(), result.warnings());
        for (ValidationSuggestion s : result.suggestions())
            out.println("suggestion: " + s.message());
        out.println(result.isValid() ? "Flow is valid" : "Flow is invalid");
        return result.isValid() ? EXIT_OK : EXIT_INVALID;
    }

    private int analyze(Options opts) throws IOException {
        FlowExplain explain = new FlowExplain(converter.loadFile(opts.requirePositional("analyze")));
        out.print(opts.flag("--mermaid") ? explain.toMermaid() : explain.summary());
        return EXIT_OK;
    }

    private int batch(Options opts) throws IOException {
        Path dir = opts.requirePositional("batch");
        if (!Files.isDirectory(dir))
            throw new IllegalArgumentException("Not a directory: " + dir);
        Path outRoot = opts.outputDir(settings);
        GenerationContext ctx = opts.context(settings);

        List<Path> inputs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
            stream.forEach(inputs::add);
        }
        inputs.sort(null);

        int failed = 0;
        for (Path input : inputs) {
            Path target = outRoot.resolve(FlowGraphConverter.flowName(input));
            try {
                ConversionReport report = converter.convertFile(input, target, ctx, opts.flag("--overwrite"));
                boolean ok = report.hasOutput() && report.conversion().errors().isEmpty();
                out.printf("%-40s %s%n", input.getFileName(), ok ? "ok" : "failed");
                if (!ok)
                    failed++;
            } catch (FlowParseException e) {
                out.printf("%-40s invalid: %s%n", input.getFileName(), e.getMessage());
                failed++;
            }
        }
        out.printf("%d flows, %d failed%n", inputs.size(), failed);
        return failed == 0 ? EXIT_OK : EXIT_INVALID;
    }

    private int serve(Options opts) {
        int port = opts.value("--port") != null ? Integer.parseInt(opts.value("--port")) : settings.getServerPort();
        JobTracker jobs = new JobTracker(settings.getMaxRetainedJobs());
        ConversionDispatcher dispatcher = new ConversionDispatcher(converter, jobs, settings.getRingBufferSize());
        ConversionServer server = new ConversionServer(
                new ConversionApi(converter, dispatcher, settings.generationContext()), jobs);
        server.start(port);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            server.stop();
            dispatcher.close();
            stopped.countDown();
        }));
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return EXIT_OK;
    }

    private int info() {
        RegistryStatistics stats = converter.registry().statistics();
        out.printf("Converters: %d (aliases: %d, deprecated: %d)%n",
                stats.totalConverters(), stats.totalAliases(), stats.deprecatedConverters());
        converter.registry().convertersByCategory()
                .forEach((category, types) -> out.printf("  %-16s %s%n", category, types));
        return EXIT_OK;
    }

    private void printIssues(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        for (ValidationIssue e : errors)
            err.println("error:   " + e);
        for (ValidationIssue w : warnings)
            err.println("warning: " + w);
    }

    private int usage(String problem) {
        err.println(problem);
        err.println("Usage: fgc <convert|validate|analyze|batch|serve|info> [args]");
        err.println("  convert  <flow.json> [-o dir] [-l typescript|python] [--tracing] [--no-comments] [--overwrite]");
        err.println("  validate <flow.json>");
        err.println("  analyze  <flow.json> [--mermaid]");
        err.println("  batch    <dir> [-o dir] [-l typescript|python] [--overwrite]");
        err.println("  serve    [--port n]");
        err.println("  info");
        return EXIT_USAGE;
    }

    // ── Argument parsing ────────────────────────────────────────────

    static final class Options {
        private static final List<String> VALUED = List.of("-o", "--output", "-l", "--language", "--port", "--project");

        final String command;
        final List<String> positionals = new ArrayList<>();
        final Map<String, String> values = new LinkedHashMap<>();

        private Options(String command) {
            this.command = command;
        }

        static Options parse(String[] args) {
            Options opts = new Options(args[0]);
            for (int i = 1; i < args.length; i++) {
                String arg = args[i];
                if (VALUED.contains(arg)) {
                    if (i + 1 >= args.length)
                        throw new IllegalArgumentException("Missing value for " + arg);
                    opts.values.put(canonical(arg), args[++i]);
                } else if (arg.startsWith("-")) {
                    opts.values.put(arg, "true");
                } else {
                    opts.positionals.add(arg);
                }
            }
            return opts;
        }

        private static String canonical(String option) {
            switch (option) {
            case "--output":
                return "-o";
            case "--language":
                return "-l";
            default:
                return option;
            }
        }

        String value(String option) {
            return values.get(option);
        }

        boolean flag(String option) {
            return values.containsKey(option);
        }

        Path requirePositional(String what) {
            if (positionals.isEmpty())
                throw new IllegalArgumentException("Missing input path for " + what);
            return Path.of(positionals.get(0));
        }

        Path outputDir(ConverterSettings settings) {
            return value("-o") != null ? Path.of(value("-o")) : settings.getOutputDir();
        }

        GenerationContext context(ConverterSettings settings) {
            GenerationContext.GenerationContextBuilder b = settings.generationContext().toBuilder();
            if (value("-l") != null)
                b.language(TargetLanguage.fromId(value("-l")));
            if (value("--project") != null)
                b.projectName(value("--project"));
            b.includeTracing(flag("--tracing"));
            b.includeComments(!flag("--no-comments"));
            return b.build();
        }
    }
}
