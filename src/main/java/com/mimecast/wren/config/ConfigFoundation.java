package com.mimecast.wren.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Holds a JSON/JSON5 document as a map and provides type safe accessors with defaults.
 * <p>Gson reads numbers in untyped maps as doubles so numeric accessors convert accordingly.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation {

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        if (map != null) {
            this.map = map;
        }
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws ConfigurationException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws ConfigurationException {
        Path file = Paths.get(path);
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read config file: " + path + " (" + e.getMessage() + ")");
        }
        this.map = parse(content, path);
    }

    /**
     * Parses JSON or JSON5 content into a map.
     *
     * @param content Configuration content.
     * @param source  Source name for error messages.
     * @return Configuration map.
     * @throws ConfigurationException Content is not a JSON object.
     */
    static Map<String, Object> parse(String content, String source) throws ConfigurationException {
        try (Reader reader = new StringReader(content)) {
            JsonReader jsonReader = new JsonReader(reader);
            jsonReader.setLenient(true);
            Map<String, Object> parsed = new Gson().fromJson(jsonReader, MAP_TYPE);
            if (parsed == null) {
                throw new ConfigurationException("Empty config file: " + source);
            }
            return parsed;
        } catch (JsonParseException | IOException | IllegalStateException e) {
            throw new ConfigurationException("Invalid config file: " + source + " (" + e.getMessage() + ")");
        }
    }

    /**
     * Checks if property exists.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name);
    }

    /**
     * Gets String property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return String.
     */
    public String getStringProperty(String name, String def) {
        Object value = map.get(name);
        return value != null ? String.valueOf(value) : def;
    }

    /**
     * Gets Long property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long def) {
        Object value = map.get(name);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String string) {
            try {
                return Long.parseLong(string.trim());
            } catch (NumberFormatException e) {
                return def;
            }
        }
        return def;
    }

    /**
     * Gets Double property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Double.
     */
    public Double getDoubleProperty(String name, Double def) {
        Object value = map.get(name);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String string) {
            try {
                return Double.parseDouble(string.trim());
            } catch (NumberFormatException e) {
                return def;
            }
        }
        return def;
    }

    /**
     * Gets Boolean property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean def) {
        Object value = map.get(name);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String string) {
            return Boolean.parseBoolean(string.trim());
        }
        return def;
    }

    /**
     * Gets Map property.
     *
     * @param name Property name.
     * @return Map, empty if not found.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = map.get(name);
        return value instanceof Map ? (Map<String, Object>) value : new HashMap<>();
    }

    /**
     * Gets List property.
     *
     * @param name Property name.
     * @return List, empty if not found.
     */
    public List<Object> getListProperty(String name) {
        Object value = map.get(name);
        return value instanceof List ? (List<Object>) value : new ArrayList<>();
    }
}
