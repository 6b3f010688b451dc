package com.modelcache.agent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RepeatedLoadReporterTest {

    private final Map<String, String> values = new HashMap<>();
    private final List<String[]> written = new ArrayList<>();
    private final ConfigReader config = values::get;
    private final LogSink sink = (file, message) -> written.add(new String[]{ file, message });

    @BeforeEach
    void activate() {
        values.put(ConfigReader.LOG_ACTIVE, "1");
        values.put(ConfigReader.LOG_FILE, "modelcache.log");
    }

    private RepeatedLoadReporter reporter(boolean diagnostics, String baseDir) {
        return new RepeatedLoadReporter(config, sink, DiagnosticsGate.of(diagnostics), baseDir);
    }

    private static LoadLog sampleLog() {
        LoadLog log = new LoadLog();
        log.append("TypeA", "7", "/app/src/Foo.php:12");
        log.append("TypeA", "7", "/app/src/Bar.php:30, /app/src/Baz.php:4");
        log.append("TypeB", "3", "/app/src/Foo.php:15");
        return log;
    }

    // --- Gates ---

    @Test
    void writesNothingWhenDiagnosticsOff() {
        reporter(false, null).flush(sampleLog(), "https://shop.test/");
        assertTrue(written.isEmpty());
    }

    @Test
    void writesNothingWhenLoggingInactive() {
        values.put(ConfigReader.LOG_ACTIVE, "0");
        reporter(true, null).flush(sampleLog(), "https://shop.test/");
        assertTrue(written.isEmpty());
    }

    @Test
    void writesNothingWhenEveryEntityLoadedOnce() {
        LoadLog log = new LoadLog();
        log.append("TypeA", "1", "x");
        log.append("TypeA", "2", "x");
        log.append("TypeB", "1", "x");

        reporter(true, null).flush(log, "https://shop.test/");
        assertTrue(written.isEmpty());
    }

    // --- Report content ---

    @Test
    void reportsRepeatedEntityOnly() {
        reporter(true, "/app/").flush(sampleLog(), "https://shop.test/");

        assertEquals(1, written.size());
        assertEquals("modelcache.log", written.get(0)[0]);
        String report = written.get(0)[1];
        assertTrue(report.contains("TypeA:\n- ID: 7, Count: 2, Locations:\n"
            + "  - src/Foo.php:12\n"
            + "  - src/Bar.php:30, /app/src/Baz.php:4\n"), report);
        assertFalse(report.contains("TypeB"));
        assertTrue(report.contains("Total number of loaded models: 3"));
    }

    @Test
    void summaryLayout() {
        LoadLog log = new LoadLog();
        log.append("Product", "1", "a");
        log.append("Product", "1", "b");
        log.append("Product", "2", "c");
        log.append("Product", "2", "d");
        log.append("Product", "2", "e");
        log.append("Category", "5", "f");
        log.append("Category", "5", "g");

        String summary = reporter(true, null).summarize(log.repeatedLoads());

        assertEquals("Repeated model loads:\n"
            + "Product:\n"
            + "- ID: 1, Count: 2, Locations:\n"
            + "  - a\n"
            + "  - b\n"
            + "- ID: 2, Count: 3, Locations:\n"
            + "  - c\n"
            + "  - d\n"
            + "  - e\n"
            + "Category:\n"
            + "- ID: 5, Count: 2, Locations:\n"
            + "  - f\n"
            + "  - g\n", summary);
    }

    @Test
    void envelopeCentersDecodedUrl() {
        String envelope = reporter(true, null).envelope("https://shop.test/?a=1&amp;b=2", 4, "S\n");

        String[] sections = envelope.split("\n\n", -1);
        // leading blank section, then the empty text before the header
        assertEquals("", sections[0]);
        assertEquals("", sections[1]);
        String header = sections[2];
        assertEquals(RepeatedLoadReporter.HEADER_WIDTH, header.length());
        assertTrue(header.contains(" https://shop.test/?a=1&b=2 "));
        assertTrue(header.startsWith("---"));
        assertTrue(header.endsWith("---"));
        assertEquals("Total number of loaded models: 4", sections[3]);
        assertEquals("S\n", sections[4]);
    }

    @Test
    void headerPaddingPutsExtraDashOnTheRight() {
        String header = reporter(true, null).envelope("ab", 0, "").split("\n\n", -1)[2];
        // " ab " is 4 chars, 216 dashes split evenly
        assertEquals("-".repeat(108) + " ab " + "-".repeat(108), header);

        header = reporter(true, null).envelope("abc", 0, "").split("\n\n", -1)[2];
        assertEquals("-".repeat(107) + " abc " + "-".repeat(108), header);
    }

    // --- Location shortening ---

    @Test
    void stripsBaseDirWithTrailingSeparator() {
        assertEquals("src/Foo.php:12", reporter(true, "/app/").shorten("/app/src/Foo.php:12"));
    }

    @Test
    void appendsSeparatorToBaseDir() {
        assertEquals("src/Foo.php:12", reporter(true, "/app").shorten("/app/src/Foo.php:12"));
    }

    @Test
    void leavesForeignLocationsAlone() {
        assertEquals("/opt/lib/X.java:1", reporter(true, "/app").shorten("/opt/lib/X.java:1"));
        assertEquals("unknown", reporter(true, null).shorten("unknown"));
    }
}
