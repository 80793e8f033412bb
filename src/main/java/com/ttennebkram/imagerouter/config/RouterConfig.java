package com.ttennebkram.imagerouter.config;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Router settings.
 *
 * Loaded from the {@code imagerouter.json} classpath resource when present, then
 * overridden by system properties named {@code imagerouter.<key>}
 * (list values comma-separated).
 *
 * <pre>
 * {
 *   "disabledBackends": ["opencv"],
 *   "pathCacheEnabled": true,
 *   "jpegQuality": 85,
 *   "webpQuality": 80
 * }
 * </pre>
 */
public final class RouterConfig {

    private static final Logger LOG = Logger.getLogger(RouterConfig.class.getName());
    private static final Gson GSON = new Gson();

    public static final String RESOURCE_NAME = "imagerouter.json";
    public static final String PROPERTY_PREFIX = "imagerouter.";

    public static final int DEFAULT_JPEG_QUALITY = 85;
    public static final int DEFAULT_WEBP_QUALITY = 80;

    private final Set<String> disabledBackends;
    private final boolean pathCacheEnabled;
    private final int jpegQuality;
    private final int webpQuality;

    private RouterConfig(Set<String> disabledBackends, boolean pathCacheEnabled, int jpegQuality, int webpQuality) {
        this.disabledBackends = Collections.unmodifiableSet(new LinkedHashSet<>(disabledBackends));
        this.pathCacheEnabled = pathCacheEnabled;
        this.jpegQuality = checkQuality("jpegQuality", jpegQuality);
        this.webpQuality = checkQuality("webpQuality", webpQuality);
    }

    public static RouterConfig defaults() {
        return new RouterConfig(Collections.emptySet(), true, DEFAULT_JPEG_QUALITY, DEFAULT_WEBP_QUALITY);
    }

    /**
     * Load from the classpath resource and system properties.
     */
    public static RouterConfig load() {
        RouterConfig config = defaults();
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = RouterConfig.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                config = fromJson(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + RESOURCE_NAME, e);
        }
        return config.withOverrides(System.getProperties());
    }

    /**
     * Parse a JSON config document. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if the document is malformed
     */
    public static RouterConfig fromJson(Reader reader) {
        JsonObject json;
        try {
            JsonElement element = JsonParser.parseReader(reader);
            if (!element.isJsonObject()) {
                throw new IllegalArgumentException("Router config must be a JSON object");
            }
            json = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed router config: " + e.getMessage(), e);
        }

        Set<String> disabled = new LinkedHashSet<>();
        if (json.has("disabledBackends")) {
            JsonArray array = json.getAsJsonArray("disabledBackends");
            for (JsonElement name : array) {
                disabled.add(name.getAsString());
            }
        }
        return new RouterConfig(
            disabled,
            getJsonBoolean(json, "pathCacheEnabled", true),
            getJsonInt(json, "jpegQuality", DEFAULT_JPEG_QUALITY),
            getJsonInt(json, "webpQuality", DEFAULT_WEBP_QUALITY));
    }

    /**
     * Apply {@code imagerouter.*} properties on top of this config.
     */
    public RouterConfig withOverrides(Properties properties) {
        Set<String> disabled = disabledBackends;
        String disabledValue = properties.getProperty(PROPERTY_PREFIX + "disabledBackends");
        if (disabledValue != null) {
            disabled = new LinkedHashSet<>();
            for (String name : disabledValue.split(",")) {
                if (!name.isBlank()) {
                    disabled.add(name.trim());
                }
            }
        }
        String cacheValue = properties.getProperty(PROPERTY_PREFIX + "pathCacheEnabled");
        boolean cache = cacheValue != null ? Boolean.parseBoolean(cacheValue.trim()) : pathCacheEnabled;

        return new RouterConfig(disabled, cache,
            getInt(properties, "jpegQuality", jpegQuality),
            getInt(properties, "webpQuality", webpQuality));
    }

    public Set<String> getDisabledBackends() {
        return disabledBackends;
    }

    public boolean isBackendEnabled(String backendName) {
        return !disabledBackends.contains(backendName);
    }

    public boolean isPathCacheEnabled() {
        return pathCacheEnabled;
    }

    public int getJpegQuality() {
        return jpegQuality;
    }

    public int getWebpQuality() {
        return webpQuality;
    }

    /**
     * Serialize back to the JSON form accepted by {@link #fromJson}.
     */
    public String toJson() {
        JsonObject json = new JsonObject();
        JsonArray disabled = new JsonArray();
        disabledBackends.forEach(disabled::add);
        json.add("disabledBackends", disabled);
        json.addProperty("pathCacheEnabled", pathCacheEnabled);
        json.addProperty("jpegQuality", jpegQuality);
        json.addProperty("webpQuality", webpQuality);
        return GSON.toJson(json);
    }

    private static int checkQuality(String key, int quality) {
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException(key + " must be between 1 and 100, got " + quality);
        }
        return quality;
    }

    private static int getInt(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(PROPERTY_PREFIX + key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning("Ignoring non-numeric " + PROPERTY_PREFIX + key + "=" + value);
            return defaultValue;
        }
    }

    private static int getJsonInt(JsonObject json, String key, int defaultValue) {
        if (json.has(key)) {
            return json.get(key).getAsInt();
        }
        return defaultValue;
    }

    private static boolean getJsonBoolean(JsonObject json, String key, boolean defaultValue) {
        if (json.has(key)) {
            return json.get(key).getAsBoolean();
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return "RouterConfig" + toJson();
    }
}
