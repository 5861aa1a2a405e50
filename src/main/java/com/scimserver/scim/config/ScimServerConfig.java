package com.scimserver.scim.config;

import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Configuration class for SCIM Server settings.
 * Reads configuration from environment variables or system properties.
 */
public class ScimServerConfig {

    private static final Logger LOGGER = Logger.getLogger(ScimServerConfig.class.getName());

    static final String PORT_KEY = "PORT";
    static final String SCIM_SERVER_BASE_URL_KEY = "SCIM_SERVER_BASE_URL";
    static final String DEFAULT_COUNT_KEY = "SCIM_DEFAULT_COUNT";
    static final String MAX_COUNT_KEY = "SCIM_MAX_COUNT";

    // Default values
    private static final int DEFAULT_PORT = 8080;
    private static final int DEFAULT_COUNT = 100;
    private static final int DEFAULT_MAX_COUNT = 200;

    private final int port;
    private final String scimServerBaseUrl;
    private final int defaultCount;
    private final int maxCount;

    // Singleton instance
    private static final ScimServerConfig INSTANCE =
            new ScimServerConfig(key -> Optional.ofNullable(System.getenv(key))
                    .or(() -> Optional.ofNullable(System.getProperty(key)))
                    .orElse(null));

    /**
     * Loads configuration through a key lookup; {@code null} from the lookup means "use the default".
     */
    ScimServerConfig(UnaryOperator<String> lookup) {
        this.port = getIntValue(lookup, PORT_KEY, DEFAULT_PORT);
        String baseUrl = lookup.apply(SCIM_SERVER_BASE_URL_KEY);
        if (baseUrl == null || baseUrl.isEmpty()) {
            baseUrl = "http://localhost:" + port + "/scim/v2";
        }
        this.scimServerBaseUrl = stripTrailingSlash(baseUrl);
        this.maxCount = getIntValue(lookup, MAX_COUNT_KEY, DEFAULT_MAX_COUNT);
        this.defaultCount = Math.min(getIntValue(lookup, DEFAULT_COUNT_KEY, DEFAULT_COUNT), maxCount);
    }

    /**
     * Get singleton instance of configuration.
     */
    public static ScimServerConfig getInstance() {
        return INSTANCE;
    }

    /**
     * Get the HTTP port the embedded server listens on.
     */
    public int getPort() {
        return port;
    }

    /**
     * Get SCIM server base URL (used for log output and as fallback for resource locations).
     */
    public String getScimServerBaseUrl() {
        return scimServerBaseUrl;
    }

    /**
     * Get the page size used when a list request has no {@code count}.
     */
    public int getDefaultCount() {
        return defaultCount;
    }

    /**
     * Get the largest page size a list request may ask for; also advertised as filter.maxResults.
     */
    public int getMaxCount() {
        return maxCount;
    }

    private static int getIntValue(UnaryOperator<String> lookup, String key, int defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            LOGGER.warning("Invalid " + key + " value: " + value + ", using default " + defaultValue);
            return defaultValue;
        }
        LOGGER.warning(key + " must be positive, using default " + defaultValue);
        return defaultValue;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String toString() {
        return "ScimServerConfig{" +
                "port=" + port +
                ", scimServerBaseUrl='" + scimServerBaseUrl + '\'' +
                ", defaultCount=" + defaultCount +
                ", maxCount=" + maxCount +
                '}';
    }
}
