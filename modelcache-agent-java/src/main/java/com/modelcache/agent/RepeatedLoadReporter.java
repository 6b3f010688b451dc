package com.modelcache.agent;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.StringEscapeUtils;

import java.io.File;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes the end-of-request summary of entities that were loaded more than once.
 *
 * Report layout:
 * <pre>
 * ------------------------ https://shop.example/cart ------------------------
 *
 * Total number of loaded models: 12
 *
 * Repeated model loads:
 * com.example.Product:
 * - ID: 7, Count: 2, Locations:
 *   - com/example/CartController.java:41
 *   - com/example/PriceRenderer.java:88
 * </pre>
 */
public class RepeatedLoadReporter {

    static final int HEADER_WIDTH = 220;

    private static final String EOL = "\n";

    private final ConfigReader config;
    private final LogSink sink;
    private final DiagnosticsGate gate;
    private final String locationPrefix;

    /**
     * @param baseDir directory stripped from the start of every reported location; may be null
     */
    public RepeatedLoadReporter(ConfigReader config, LogSink sink, DiagnosticsGate gate, String baseDir) {
        this.config = config;
        this.sink = sink;
        this.gate = gate;
        this.locationPrefix = baseDir == null || baseDir.isEmpty() || baseDir.endsWith(File.separator)
            ? baseDir
            : baseDir + File.separator;
    }

    /**
     * Appends the report for {@code log} to the configured log file.
     * Does nothing if diagnostics are off, logging is inactive, or no entity was loaded twice.
     */
    public void flush(LoadLog log, String currentUrl) {
        if (!gate.isEnabled()) return;
        if (!config.isFlag(ConfigReader.LOG_ACTIVE)) return;

        Map<String, Map<String, List<String>>> repeated = log.repeatedLoads();
        if (repeated.isEmpty()) return;

        String report = envelope(currentUrl, log.totalLoaded(), summarize(repeated));
        sink.append(config.get(ConfigReader.LOG_FILE), report);
    }

    String summarize(Map<String, Map<String, List<String>>> repeated) {
        StringBuilder summary = new StringBuilder("Repeated model loads:").append(EOL);
        for (Map.Entry<String, Map<String, List<String>>> type : repeated.entrySet()) {
            summary.append(type.getKey()).append(':').append(EOL);
            for (Map.Entry<String, List<String>> id : type.getValue().entrySet()) {
                List<String> locations = id.getValue().stream()
                    .map(this::shorten)
                    .collect(Collectors.toList());
                summary.append("- ID: ").append(id.getKey())
                       .append(", Count: ").append(locations.size())
                       .append(", Locations:").append(EOL);
                summary.append("  - ").append(String.join(EOL + "  - ", locations)).append(EOL);
            }
        }
        return summary.toString();
    }

    String envelope(String currentUrl, long totalLoaded, String summary) {
        // the request URL may arrive entity-encoded
        String url = currentUrl == null ? "" : StringEscapeUtils.unescapeHtml4(currentUrl);
        return String.join(EOL + EOL,
            EOL + EOL,
            StringUtils.center(" " + url + " ", HEADER_WIDTH, '-'),
            "Total number of loaded models: " + totalLoaded,
            summary);
    }

    String shorten(String location) {
        return locationPrefix == null ? location : StringUtils.removeStart(location, locationPrefix);
    }
}
