package com.agentflow.fgc;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.config.ConverterSettings;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class FlowConverterCliTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private FlowConverterCli cli;
    private Path flows;

    @Before
    public void setUp() throws IOException {
        ConverterSettings settings = ConverterSettings.resolve(new Properties(), Map.of()).toBuilder()
                .outputDir(tmp.getRoot().toPath().resolve("generated"))
                .build();
        cli = new FlowConverterCli(settings, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        flows = tmp.newFolder("flows").toPath();
        Files.write(flows.resolve("llm-chain.json"), TestGraphs.fixture("llm-chain.json"));
        Files.write(flows.resolve("conversation-memory.json"), TestGraphs.fixture("conversation-memory.json"));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testConvertPython() {
        Path target = tmp.getRoot().toPath().resolve("py");
        int code = cli.run(new String[] { "convert", flows.resolve("llm-chain.json").toString(), "-o", target.toString(),
                "-l", TargetLanguage.PYTHON.id() });

        assertEquals(FlowConverterCli.EXIT_OK, code);
        assertTrue(Files.exists(target.resolve("main.py")));
        assertTrue(out().contains("Wrote 3 files"));
    }

    @Test
    public void testConvertUsesConfiguredOutputDir() {
        int code = cli.run(new String[] { "convert", flows.resolve("llm-chain.json").toString() });

        assertEquals(FlowConverterCli.EXIT_OK, code);
        assertTrue(Files.exists(tmp.getRoot().toPath().resolve("generated/src/index.ts")));
    }

    @Test
    public void testValidate() {
        assertEquals(FlowConverterCli.EXIT_OK,
                cli.run(new String[] { "validate", flows.resolve("conversation-memory.json").toString() }));
        assertTrue(out().contains("Flow is valid"));
        assertTrue(err().contains("warning: [unsupported_type]"));
    }

    @Test
    public void testInvalidFlowExitCode() throws IOException {
        Path broken = flows.resolve("broken.json");
        Files.writeString(broken, "{\"nodes\":[]}");

        assertEquals(FlowConverterCli.EXIT_INVALID, cli.run(new String[] { "validate", broken.toString() }));
        assertTrue(err().contains("$.edges: required array is missing"));
    }

    @Test
    public void testAnalyzeMermaid() {
        assertEquals(FlowConverterCli.EXIT_OK,
                cli.run(new String[] { "analyze", flows.resolve("llm-chain.json").toString(), "--mermaid" }));
        assertTrue(out().startsWith("graph TD;"));
    }

    @Test
    public void testBatch() {
        Path target = tmp.getRoot().toPath().resolve("batch");
        int code = cli.run(new String[] { "batch", flows.toString(), "-o", target.toString() });

        // conversation-memory has an unsupported node but still converts
        assertEquals(FlowConverterCli.EXIT_OK, code);
        assertTrue(Files.exists(target.resolve("llm-chain/src/index.ts")));
        assertTrue(Files.exists(target.resolve("conversation-memory/src/index.ts")));
        assertTrue(out().contains("2 flows, 0 failed"));
    }

    @Test
    public void testInfo() {
        assertEquals(FlowConverterCli.EXIT_OK, cli.run(new String[] { "info" }));
        assertTrue(out().startsWith("Converters: 10"));
    }

    @Test
    public void testUsageErrors() {
        assertEquals(FlowConverterCli.EXIT_USAGE, cli.run(new String[0]));
        assertEquals(FlowConverterCli.EXIT_USAGE, cli.run(new String[] { "explode" }));
        assertEquals(FlowConverterCli.EXIT_USAGE, cli.run(new String[] { "convert" }));
        assertEquals(FlowConverterCli.EXIT_USAGE, cli.run(new String[] { "convert", "x.json", "-o" }));
        assertEquals(FlowConverterCli.EXIT_USAGE,
                cli.run(new String[] { "convert", flows.resolve("llm-chain.json").toString(), "-l", "cobol" }));
    }

    @Test
    public void testMissingFileIsIoError() {
        assertEquals(FlowConverterCli.EXIT_IO,
                cli.run(new String[] { "validate", flows.resolve("absent.json").toString() }));
    }
}
