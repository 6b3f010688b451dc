package com.modelcache.agent;

/**
 * Key-value lookup of runtime settings by slash-separated path,
 * e.g. {@code dev/aoe_modelcache/log_active}.
 */
@FunctionalInterface
public interface ConfigReader {

    String LOG_ACTIVE = "dev/aoe_modelcache/log_active";

    String LOG_FILE = "dev/aoe_modelcache/log_file";

    /** Returns the value at {@code path}, or null if it is not set. */
    String get(String path);

    default boolean isFlag(String path) {
        return isTrue(get(path));
    }

    /** A value is true unless it is null, empty, "0" or "false". */
    static boolean isTrue(String value) {
        if (value == null) return false;
        String v = value.trim();
        return !v.isEmpty() && !v.equals("0") && !v.equalsIgnoreCase("false");
    }

    static ConfigReader empty() {
        return path -> null;
    }
}
