package com.modelcache.agent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-request record of entity loads: typeName -> identifier -> call sites in load order.
 *
 * Not thread-safe; owned by a single {@link ModelLoadCollector}.
 */
public final class LoadLog {

    private final Map<String, Map<String, List<String>>> loads = new LinkedHashMap<>();

    private long totalLoaded;

    public void append(String typeName, String identifier, String callSite) {
        loads.computeIfAbsent(typeName, k -> new LinkedHashMap<>())
             .computeIfAbsent(identifier, k -> new ArrayList<>())
             .add(callSite);
        totalLoaded++;
    }

    /** Total number of appends so far, including entities loaded only once. */
    public long totalLoaded() {
        return totalLoaded;
    }

    public boolean isEmpty() {
        return loads.isEmpty();
    }

    /** Call sites recorded for one entity, empty if it was never loaded. */
    public List<String> callSites(String typeName, String identifier) {
        Map<String, List<String>> byId = loads.get(typeName);
        if (byId == null) return Collections.emptyList();
        List<String> sites = byId.get(identifier);
        return sites == null ? Collections.emptyList() : Collections.unmodifiableList(sites);
    }

    /**
     * Copy of the log holding only entities loaded at least twice.
     * Type buckets left without entries are dropped. This log is not modified.
     */
    public Map<String, Map<String, List<String>>> repeatedLoads() {
        Map<String, Map<String, List<String>>> repeated = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, List<String>>> type : loads.entrySet()) {
            Map<String, List<String>> ids = new LinkedHashMap<>();
            for (Map.Entry<String, List<String>> id : type.getValue().entrySet()) {
                if (id.getValue().size() > 1) {
                    ids.put(id.getKey(), List.copyOf(id.getValue()));
                }
            }
            if (!ids.isEmpty()) {
                repeated.put(type.getKey(), ids);
            }
        }
        return repeated;
    }
}
