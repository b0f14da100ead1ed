package pipeline;

import errors.CpgIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Pipeline settings. Defaults come from {@code cpg-pipeline.properties} on the classpath; any key
 * set as a system property ({@code -Dcpg.workers=8}) wins.
 */
public final class PipelineConfig {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String RESOURCE = "cpg-pipeline.properties";
    public static final String WORKERS = "cpg.workers";
    public static final String MODULE_GRAPH = "cpg.moduleGraph";
    public static final String RESOLVE_CALLS = "cpg.resolveCalls";
    public static final String DOT_EXPORT = "cpg.dotExport";

    private final int workers;
    private final boolean moduleGraph;
    private final boolean resolveCalls;
    private final boolean dotExport;

    public PipelineConfig(int workers, boolean moduleGraph, boolean resolveCalls, boolean dotExport) {
        if (workers < 1) {
            throw new IllegalArgumentException(WORKERS + " must be at least 1, got " + workers);
        }
        this.workers = workers;
        this.moduleGraph = moduleGraph;
        this.resolveCalls = resolveCalls;
        this.dotExport = dotExport;
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(Runtime.getRuntime().availableProcessors(), true, true, true);
    }

    public static PipelineConfig load() {
        Properties properties = new Properties();
        try (InputStream in = PipelineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.debug("No {} on the classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new CpgIoException("Could not read " + RESOURCE, e);
        }
        return fromProperties(properties);
    }

    static PipelineConfig fromProperties(Properties properties) {
        PipelineConfig defaults = defaults();
        int workers = defaults.workers;
        String workersValue = value(properties, WORKERS);
        if (workersValue != null && !workersValue.isEmpty() && !"auto".equalsIgnoreCase(workersValue)) {
            try {
                workers = Integer.parseInt(workersValue);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(WORKERS + " is not a number: " + workersValue, e);
            }
        }
        PipelineConfig config = new PipelineConfig(workers,
                flag(properties, MODULE_GRAPH, defaults.moduleGraph),
                flag(properties, RESOLVE_CALLS, defaults.resolveCalls),
                flag(properties, DOT_EXPORT, defaults.dotExport));
        logger.debug("Pipeline config: {}", config);
        return config;
    }

    private static String value(Properties properties, String key) {
        String value = System.getProperty(key);
        if (value == null) {
            value = properties.getProperty(key);
        }
        return value == null ? null : value.trim();
    }

    private static boolean flag(Properties properties, String key, boolean fallback) {
        String value = value(properties, key);
        return value == null || value.isEmpty() ? fallback : Boolean.parseBoolean(value);
    }

    public int getWorkers() { return workers; }
    public boolean isModuleGraph() { return moduleGraph; }
    public boolean isResolveCalls() { return resolveCalls; }
    public boolean isDotExport() { return dotExport; }

    public PipelineConfig withWorkers(int count) {
        return new PipelineConfig(count, moduleGraph, resolveCalls, dotExport);
    }

    @Override
    public String toString() {
        return WORKERS + "=" + workers + ", " + MODULE_GRAPH + "=" + moduleGraph + ", "
                + RESOLVE_CALLS + "=" + resolveCalls + ", " + DOT_EXPORT + "=" + dotExport;
    }
}
