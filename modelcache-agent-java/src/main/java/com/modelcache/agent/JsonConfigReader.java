package com.modelcache.agent;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/**
 * Reads settings from a nested JSON document:
 * <pre>
 * { "dev": { "aoe_modelcache": { "log_active": true, "log_file": "modelcache.log" } } }
 * </pre>
 * The path {@code dev/aoe_modelcache/log_active} walks one object per segment.
 *
 * The file is read again whenever its modification time changes, so flags can be
 * flipped while the application runs. If a re-read fails the last good document is kept.
 */
public class JsonConfigReader implements ConfigReader {

    private final Path configPath;

    // Shared by every request thread; replaced as a whole on reload
    private volatile Snapshot snapshot;

    private record Snapshot(JsonObject root, FileTime loadedAt) {}

    /**
     * @throws ConfigReadException if the file is missing or malformed
     */
    public JsonConfigReader(Path configPath) {
        this.configPath = configPath;
        FileTime loadedAt = modifiedTime(configPath);
        this.snapshot = new Snapshot(parse(configPath), loadedAt);
    }

    @Override
    public String get(String path) {
        JsonElement node = refreshIfChanged().root();
        for (String segment : path.split("/")) {
            if (node == null || !node.isJsonObject()) return null;
            node = node.getAsJsonObject().get(segment);
        }
        if (node == null || !node.isJsonPrimitive()) return null;
        return node.getAsString();
    }

    private Snapshot refreshIfChanged() {
        Snapshot seen = snapshot;
        FileTime current = modifiedTime(configPath);
        if (current == null || current.equals(seen.loadedAt())) return seen;
        return reload(current);
    }

    private synchronized Snapshot reload(FileTime current) {
        Snapshot seen = snapshot;
        if (current.equals(seen.loadedAt())) return seen;
        try {
            seen = new Snapshot(parse(configPath), current);
        } catch (ConfigReadException e) {
            System.err.println("[modelcache] WARN keeping previous config: " + e.getMessage());
            // remember the broken timestamp so it is not re-parsed on every lookup
            seen = new Snapshot(seen.root(), current);
        }
        snapshot = seen;
        return seen;
    }

    static JsonObject parse(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (FileReader reader = new FileReader(configPath.toFile())) {
            JsonElement element = JsonParser.parseReader(reader);
            if (!element.isJsonObject()) {
                throw new ConfigReadException("Config file is empty or not a JSON object: " + configPath);
            }
            return element.getAsJsonObject();
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (IOException | JsonParseException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    private static FileTime modifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return null;
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
