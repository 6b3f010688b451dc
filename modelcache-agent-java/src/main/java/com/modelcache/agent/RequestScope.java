package com.modelcache.agent;

/**
 * One request's lifetime on the current thread. Closing the outermost scope
 * unbinds the collector and writes its report.
 */
public final class RequestScope implements AutoCloseable {

    private final ModelLoadCollector collector;
    private final boolean owner;

    RequestScope(ModelLoadCollector collector, boolean owner) {
        this.collector = collector;
        this.owner = owner;
    }

    public ModelLoadCollector collector() {
        return collector;
    }

    @Override
    public void close() {
        if (!owner) return;
        try {
            collector.close();
        } finally {
            ModelLoadTracker.unbind(collector);
        }
    }
}
