package com.modelcache.agent;

/**
 * Binds a {@link ModelLoadCollector} to the current request thread and routes load events to it.
 *
 * Called from {@link LoadAdvice} (inlined into instrumented classes), so the entry points
 * are public static.
 */
public final class ModelLoadTracker {

    private ModelLoadTracker() {}

    static volatile TrackerSettings settings;

    // Collector of the request running on this thread, null outside a request
    static final ThreadLocal<ModelLoadCollector> current = new ThreadLocal<>();

    public static void install(TrackerSettings trackerSettings) {
        settings = trackerSettings;
    }

    /**
     * Opens the request scope for the current thread. If a scope is already open the
     * returned scope shares its collector and does not flush on close.
     */
    public static RequestScope open(String currentUrl) {
        ModelLoadCollector existing = current.get();
        if (existing != null) {
            return new RequestScope(existing, false);
        }
        TrackerSettings s = settings;
        if (s == null) {
            s = new TrackerSettings(ConfigReader.empty(), (file, message) -> {}, DiagnosticsGate.of(false), null, null);
        }
        ModelLoadCollector collector = new ModelLoadCollector(s.config(), s.reporter(), currentUrl);
        current.set(collector);
        return new RequestScope(collector, true);
    }

    /** Collector of the request running on this thread, or null. */
    public static ModelLoadCollector current() {
        return current.get();
    }

    /**
     * Load notification from an instrumented load method. Ignored outside a request scope.
     *
     * The stack depth from here to the load method's caller is fixed by
     * {@link CallSite#DISPATCH_FRAME_SKIP}; keep this call chain as it is.
     */
    public static void afterLoad(String typeName, String identifier) {
        dispatch(typeName, identifier);
    }

    private static void dispatch(String typeName, String identifier) {
        ModelLoadCollector collector = current.get();
        if (collector == null) return;
        StackTraceElement[] stack = captureStack();
        TrackerSettings s = settings;
        collector.record(typeName, identifier, CallSite.fromStackTrace(stack, s != null ? s.sourceRoot() : null));
    }

    private static StackTraceElement[] captureStack() {
        return Thread.currentThread().getStackTrace();
    }

    static void unbind(ModelLoadCollector collector) {
        if (current.get() == collector) {
            current.remove();
        }
    }

    public static void reset() {
        current.remove();
        settings = null;
    }
}
