package com.agentflow.fgc.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import com.agentflow.fgc.api.GenerationContext;
import com.agentflow.fgc.api.TargetLanguage;
import com.agentflow.fgc.io.FlowParser;
import com.agentflow.fgc.wiring.JobTracker;

import lombok.Builder;
import lombok.Value;
import lombok.extern.log4j.Log4j2;

/**
 * Process-wide settings.
 * <p>
 * Resolution order, later wins: built-in defaults, classpath
 * {@code fgc.properties}, environment variables ({@code FGC_SERVER_PORT},
 * {@code FGC_MAX_INPUT_BYTES}, {@code FGC_RING_BUFFER_SIZE},
 * {@code FGC_MAX_RETAINED_JOBS},
 * {@code FGC_DEFAULT_LANGUAGE}, {@code FGC_OUTPUT_DIR},
 * {@code FGC_PROJECT_NAME}).
 */
@Value
@Builder(toBuilder = true)
@Log4j2
public class ConverterSettings {
    private static final String RESOURCE = "fgc.properties";

    private static final String ENV_SERVER_PORT = "FGC_SERVER_PORT";
    private static final String ENV_MAX_INPUT_BYTES = "FGC_MAX_INPUT_BYTES";
    private static final String ENV_RING_BUFFER_SIZE = "FGC_RING_BUFFER_SIZE";
    private static final String ENV_MAX_RETAINED_JOBS = "FGC_MAX_RETAINED_JOBS";
    private static final String ENV_DEFAULT_LANGUAGE = "FGC_DEFAULT_LANGUAGE";
    private static final String ENV_OUTPUT_DIR = "FGC_OUTPUT_DIR";
    private static final String ENV_PROJECT_NAME = "FGC_PROJECT_NAME";

    private static final int DEFAULT_SERVER_PORT = 7070;
    private static final int DEFAULT_RING_BUFFER_SIZE = 1024;
    private static final String DEFAULT_OUTPUT_DIR = "generated";
    private static final String DEFAULT_PROJECT_NAME = "langchain-app";

    @Builder.Default
    int serverPort = DEFAULT_SERVER_PORT;
    @Builder.Default
    int maxInputBytes = FlowParser.DEFAULT_MAX_INPUT_BYTES;
    /** Must be a power of two. */
    @Builder.Default
    int ringBufferSize = DEFAULT_RING_BUFFER_SIZE;
    /** Finished jobs kept for polling before the oldest are evicted. */
    @Builder.Default
    int maxRetainedJobs = JobTracker.DEFAULT_MAX_RETAINED;
    @Builder.Default
    TargetLanguage defaultLanguage = TargetLanguage.TYPESCRIPT;
    @Builder.Default
    Path outputDir = Path.of(DEFAULT_OUTPUT_DIR);
    @Builder.Default
    String projectName = DEFAULT_PROJECT_NAME;

    /** Loads from the classpath resource and the process environment. */
    public static ConverterSettings load() {
        return resolve(loadResource(RESOURCE), System.getenv());
    }

    /**
     * Applies {@code properties} then {@code env} over the defaults.
     *
     * @throws IllegalArgumentException on a malformed value
     */
    public static ConverterSettings resolve(Properties properties, Map<String, String> env) {
        ConverterSettingsBuilder b = builder();
        String v;
        if ((v = pick(properties, "server.port", env, ENV_SERVER_PORT)) != null)
            b.serverPort(parseInt(v, "server.port"));
        if ((v = pick(properties, "parser.maxInputBytes", env, ENV_MAX_INPUT_BYTES)) != null)
            b.maxInputBytes(parseInt(v, "parser.maxInputBytes"));
        if ((v = pick(properties, "jobs.ringBufferSize", env, ENV_RING_BUFFER_SIZE)) != null)
            b.ringBufferSize(parseInt(v, "jobs.ringBufferSize"));
        if ((v = pick(properties, "jobs.maxRetained", env, ENV_MAX_RETAINED_JOBS)) != null)
            b.maxRetainedJobs(parseInt(v, "jobs.maxRetained"));
        if ((v = pick(properties, "output.language", env, ENV_DEFAULT_LANGUAGE)) != null)
            b.defaultLanguage(TargetLanguage.fromId(v));
        if ((v = pick(properties, "output.dir", env, ENV_OUTPUT_DIR)) != null)
            b.outputDir(Path.of(v));
        if ((v = pick(properties, "output.projectName", env, ENV_PROJECT_NAME)) != null)
            b.projectName(v);

        ConverterSettings settings = b.build();
        settings.check();
        return settings;
    }

    private void check() {
        if (serverPort < 0 || serverPort > 65535)
            throw new IllegalArgumentException("server.port out of range: " + serverPort);
        if (maxInputBytes <= 0)
            throw new IllegalArgumentException("parser.maxInputBytes must be positive: " + maxInputBytes);
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1)
            throw new IllegalArgumentException("jobs.ringBufferSize must be a power of two: " + ringBufferSize);
        if (maxRetainedJobs <= 0)
            throw new IllegalArgumentException("jobs.maxRetained must be positive: " + maxRetainedJobs);
    }

    /** Default generation options for this process. */
    public GenerationContext generationContext() {
        return GenerationContext.builder().language(defaultLanguage).projectName(projectName).build();
    }

    private static String pick(Properties properties, String key, Map<String, String> env, String envKey) {
        String fromEnv = env.get(envKey);
        if (fromEnv != null && !fromEnv.isBlank())
            return fromEnv.trim();
        String fromProps = properties.getProperty(key);
        return fromProps != null && !fromProps.isBlank() ? fromProps.trim() : null;
    }

    private static int parseInt(String value, String key) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    static Properties loadResource(String name) {
        Properties props = new Properties();
        try (InputStream in = ConverterSettings.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", name);
                return props;
            }
            props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + name, e);
        }
        return props;
    }
}
