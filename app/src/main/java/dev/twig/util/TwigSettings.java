package dev.twig.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Engine settings read from the {@code twig.properties} classpath resource. A JVM system property with the same key
 * wins over the file.
 *
 * <ul>
 *   <li>{@code twig.history.maxDepth}: max entries kept in an undo log, {@code 0} for unbounded
 *   <li>{@code twig.render.timestampPattern}: {@link DateTimeFormatter} pattern used when rendering commits
 * </ul>
 */
public record TwigSettings(int maxHistoryDepth, String timestampPattern) {
    private static final Logger logger = LogManager.getLogger(TwigSettings.class);

    public static final String RESOURCE = "twig.properties";
    public static final String KEY_MAX_DEPTH = "twig.history.maxDepth";
    public static final String KEY_TIMESTAMP_PATTERN = "twig.render.timestampPattern";

    public static final int DEFAULT_MAX_DEPTH = 0;
    public static final String DEFAULT_TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss.SSSSSS";

    private static volatile @Nullable TwigSettings cached;

    public TwigSettings {
        if (maxHistoryDepth < 0) {
            throw new IllegalArgumentException("maxHistoryDepth must be >= 0: " + maxHistoryDepth);
        }
        // fail fast on a bad pattern rather than on first render
        DateTimeFormatter.ofPattern(timestampPattern);
    }

    public static TwigSettings defaults() {
        return new TwigSettings(DEFAULT_MAX_DEPTH, DEFAULT_TIMESTAMP_PATTERN);
    }

    /** Settings from the classpath resource and system properties, loaded once per JVM. */
    public static TwigSettings load() {
        var local = cached;
        if (local != null) {
            return local;
        }
        synchronized (TwigSettings.class) {
            if (cached == null) {
                cached = fromProperties(readResource(RESOURCE), System.getProperties());
            }
            return cached;
        }
    }

    /**
     * Resolves settings from {@code base} with {@code overrides} taking precedence. Unparseable values fall back to the
     * defaults with a warning.
     */
    public static TwigSettings fromProperties(Properties base, Properties overrides) {
        var depthRaw = lookup(KEY_MAX_DEPTH, base, overrides);
        int depth = DEFAULT_MAX_DEPTH;
        if (depthRaw != null) {
            try {
                depth = Integer.parseInt(depthRaw.trim());
                if (depth < 0) {
                    logger.warn("Negative {}={}, using {}", KEY_MAX_DEPTH, depthRaw, DEFAULT_MAX_DEPTH);
                    depth = DEFAULT_MAX_DEPTH;
                }
            } catch (NumberFormatException e) {
                logger.warn("Invalid {}={}, using {}", KEY_MAX_DEPTH, depthRaw, DEFAULT_MAX_DEPTH);
            }
        }

        var pattern = lookup(KEY_TIMESTAMP_PATTERN, base, overrides);
        if (pattern == null || pattern.isBlank()) {
            pattern = DEFAULT_TIMESTAMP_PATTERN;
        } else {
            try {
                DateTimeFormatter.ofPattern(pattern);
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid {}='{}': {}", KEY_TIMESTAMP_PATTERN, pattern, e.getMessage());
                pattern = DEFAULT_TIMESTAMP_PATTERN;
            }
        }
        return new TwigSettings(depth, pattern);
    }

    static Properties readResource(String resource) {
        var props = new Properties();
        try (InputStream in = TwigSettings.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.debug("No {} on classpath, using defaults", resource);
                return props;
            }
            try (var reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", resource, e.getMessage());
        }
        return props;
    }

    private static @Nullable String lookup(String key, Properties base, Properties overrides) {
        var value = overrides.getProperty(key);
        return value != null ? value : base.getProperty(key);
    }
}
