package com.modelcache.agent;

/**
 * Append-only destination for report text, addressed by log file name.
 */
@FunctionalInterface
public interface LogSink {

    void append(String file, String message);
}
