package com.modelcache.agent;

import java.nio.file.Path;

/**
 * Process-wide collaborators shared by every request scope.
 *
 * @param baseDir    prefix stripped from reported locations; may be null
 * @param sourceRoot prefix prepended to frame source paths; may be null
 */
public record TrackerSettings(
    ConfigReader config,
    LogSink sink,
    DiagnosticsGate gate,
    String baseDir,
    Path sourceRoot
) {

    RepeatedLoadReporter reporter() {
        return new RepeatedLoadReporter(config, sink, gate, baseDir);
    }
}
