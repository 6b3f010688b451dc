package com.modelcache.agent;

import java.util.List;

/**
 * Collects entity loads for one request and reports repeated loads when closed.
 *
 * Lifecycle: CREATED (records accepted) -> FLUSHING -> DONE. {@link #close()} flushes at most once;
 * records arriving after close are ignored. Not thread-safe: one instance per request thread.
 */
public class ModelLoadCollector implements AutoCloseable {

    enum State { CREATED, FLUSHING, DONE }

    private final ConfigReader config;
    private final RepeatedLoadReporter reporter;
    private final String currentUrl;
    private final LoadLog log = new LoadLog();

    private State state = State.CREATED;

    public ModelLoadCollector(ConfigReader config, RepeatedLoadReporter reporter, String currentUrl) {
        this.config = config;
        this.reporter = reporter;
        this.currentUrl = currentUrl;
    }

    /**
     * Records one load of {@code (entityType, identifier)}.
     * {@code callStack} is the full stack, innermost frame first; see {@link CallSite}.
     */
    public void record(String entityType, String identifier, List<CallSite.Frame> callStack) {
        if (state != State.CREATED) return;
        if (!config.isFlag(ConfigReader.LOG_ACTIVE)) return;

        log.append(entityType, identifier, CallSite.describe(callStack));
    }

    /** Flushes the report. Never throws; a failing flush is reported on stderr. */
    @Override
    public void close() {
        if (state != State.CREATED) return;
        state = State.FLUSHING;
        try {
            reporter.flush(log, currentUrl);
        } catch (Exception e) {
            System.err.println("[modelcache] ERROR writing repeated-load report: " + e.getMessage());
        } finally {
            state = State.DONE;
        }
    }

    public long totalLoaded() {
        return log.totalLoaded();
    }

    LoadLog log() {
        return log;
    }

    State state() {
        return state;
    }
}
