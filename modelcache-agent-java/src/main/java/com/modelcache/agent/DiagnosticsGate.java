package com.modelcache.agent;

/**
 * Process-wide switch for profiling output, independent of per-request config.
 * Both this gate and the {@code log_active} flag must be on for a report to be written.
 */
@FunctionalInterface
public interface DiagnosticsGate {

    String PROPERTY = "modelcache.profiler";

    String ENV_VAR = "MODELCACHE_PROFILER";

    boolean isEnabled();

    static DiagnosticsGate of(boolean enabled) {
        return () -> enabled;
    }

    /** Reads the {@value #PROPERTY} system property, then the {@value #ENV_VAR} environment variable. */
    static DiagnosticsGate fromEnvironment() {
        String value = System.getProperty(PROPERTY);
        if (value == null) {
            value = System.getenv(ENV_VAR);
        }
        return of(ConfigReader.isTrue(value));
    }
}
