package com.agentflow.fgc.config;

import static org.junit.Assert.*;

import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;

import org.junit.Test;

public class ConverterSettingsTest {

    @Test
    public void testDefaults() {
        ConverterSettings settings = ConverterSettings.resolve(new Properties(), Map.of());

        assertEquals(7070, settings.getServerPort());
        assertEquals(1024, settings.getRingBufferSize());
        assertEquals(256, settings.getMaxRetainedJobs());
        assertEquals(TargetLanguage.TYPESCRIPT, settings.getDefaultLanguage());
        assertEquals(Path.of("generated"), settings.getOutputDir());
    }

    @Test
    public void testEnvironmentOverridesProperties() {
        Properties props = new Properties();
        props.setProperty("server.port", "8080");
        props.setProperty("output.language", "typescript");
        props.setProperty("output.projectName", "from-props");

        ConverterSettings settings = ConverterSettings.resolve(props,
                Map.of("FGC_DEFAULT_LANGUAGE", "py", "FGC_RING_BUFFER_SIZE", "64"));

        assertEquals(8080, settings.getServerPort());
        assertEquals(TargetLanguage.PYTHON, settings.getDefaultLanguage());
        assertEquals(64, settings.getRingBufferSize());

        GenerationContext ctx = settings.generationContext();
        assertEquals(TargetLanguage.PYTHON, ctx.getLanguage());
        assertEquals("from-props", ctx.getProjectName());
    }

    @Test
    public void testBlankEnvironmentValueIsIgnored() {
        Properties props = new Properties();
        props.setProperty("server.port", "9000");
        assertEquals(9000, ConverterSettings.resolve(props, Map.of("FGC_SERVER_PORT", " ")).getServerPort());
    }

    @Test
    public void testMaxRetainedJobsFromEnvironment() {
        Properties props = new Properties();
        props.setProperty("jobs.maxRetained", "10");
        assertEquals(10, ConverterSettings.resolve(props, Map.of()).getMaxRetainedJobs());
        assertEquals(3, ConverterSettings.resolve(props, Map.of("FGC_MAX_RETAINED_JOBS", "3")).getMaxRetainedJobs());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMaxRetainedJobsMustBePositive() {
        ConverterSettings.resolve(new Properties(), Map.of("FGC_MAX_RETAINED_JOBS", "0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRingBufferMustBePowerOfTwo() {
        ConverterSettings.resolve(new Properties(), Map.of("FGC_RING_BUFFER_SIZE", "100"));
    }

    @Test
    public void testMalformedInteger() {
        try {
            ConverterSettings.resolve(new Properties(), Map.of("FGC_SERVER_PORT", "http"));
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Invalid integer for server.port: http", e.getMessage());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownLanguage() {
        ConverterSettings.resolve(new Properties(), Map.of("FGC_DEFAULT_LANGUAGE", "cobol"));
    }

    @Test
    public void testClasspathResource() {
        Properties props = ConverterSettings.loadResource("fgc.properties");
        assertEquals("7070", props.getProperty("server.port"));
        assertTrue(ConverterSettings.loadResource("missing.properties").isEmpty());
    }
}
