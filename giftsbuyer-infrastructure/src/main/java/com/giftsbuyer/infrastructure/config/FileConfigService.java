package com.giftsbuyer.infrastructure.config;

import com.giftsbuyer.application.config.ConfigKey;
import com.giftsbuyer.application.ports.ConfigPort;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

/**
 * File + env configuration.
 *
 * Load order (low -> high priority):
 *  1) config.properties (config dir)
 *  2) .env (config dir, optional)
 *  3) secrets.properties (config dir, optional)
 *  4) OS environment variables (highest priority)
 *
 * Env overrides: every known key may be set as GIFTS_&lt;KEY&gt; (telegram.channelId ->
 * GIFTS_TELEGRAM_CHANNEL_ID), and keys that are already env-style (TELEGRAM_BOT_TOKEN) may be
 * set directly.
 */
public final class FileConfigService implements ConfigPort {

    static final String ENV_PREFIX = "GIFTS_";

    private final Properties props = new Properties();
    private final Path configDir;

    FileConfigService(Path configDir, Map<String, String> env) throws IOException {
        this.configDir = configDir;
        loadAll();
        applyEnvOverrides(env);
    }

    public static FileConfigService defaultFromWorkingDir() throws IOException {
        return fromDirectory(Path.of(System.getProperty("user.dir")).resolve("config"));
    }

    public static FileConfigService fromDirectory(Path configDir) throws IOException {
        return new FileConfigService(configDir, System.getenv());
    }

    private void loadAll() throws IOException {
        if (configDir == null) return;

        loadPropsIfExists(configDir.resolve("config.properties"));

        Map<String, String> env = DotEnv.loadIfExists(configDir.resolve(".env"));
        for (Map.Entry<String, String> e : env.entrySet()) {
            props.setProperty(e.getKey(), e.getValue());
        }

        loadPropsIfExists(configDir.resolve("secrets.properties"));
    }

    private void loadPropsIfExists(Path file) throws IOException {
        if (file == null || !Files.exists(file)) return;
        try (Reader in = new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8)) {
            props.load(in);
        }
    }

    private void applyEnvOverrides(Map<String, String> env) {
        for (ConfigKey ck : ConfigKey.values()) {
            String key = ck.key();
            String prefixed = env.get(toEnvKey(key));
            if (prefixed != null) {
                props.setProperty(key, prefixed);
                continue;
            }
            String direct = env.get(key);
            if (direct != null) props.setProperty(key, direct);
        }
    }

    /**
     * Maps a Java-properties key into an env-var key.
     *
     * Examples:
     * - telegram.channelId -> GIFTS_TELEGRAM_CHANNEL_ID
     * - bot.interval       -> GIFTS_BOT_INTERVAL
     * - TELEGRAM_BOT_TOKEN -> GIFTS_TELEGRAM_BOT_TOKEN
     */
    static String toEnvKey(String key) {
        String s = key.replace('.', '_');
        s = s.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return ENV_PREFIX + s.toUpperCase(Locale.ROOT);
    }

    @Override
    public String get(String key) {
        String v = props.getProperty(key);
        return (v == null) ? null : v.trim();
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = get(key);
        return (v == null) ? defaultValue : v;
    }

    @Override
    public int getInt(String key, int defaultValue) {
        return typed(key, defaultValue, Integer::parseInt);
    }

    @Override
    public double getDouble(String key, double defaultValue) {
        return typed(key, defaultValue, Double::parseDouble);
    }

    @Override
    public boolean getBoolean(String key, boolean defaultValue) {
        return typed(key, defaultValue, FileConfigService::parseBoolean);
    }

    /** Blank or unparsable values fall back to the default. */
    private <T> T typed(String key, T defaultValue, Function<String, T> parser) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            T parsed = parser.apply(raw.trim());
            return (parsed == null) ? defaultValue : parsed;
        } catch (IllegalArgumentException e) {
            return defaultValue;
        }
    }

    private static Boolean parseBoolean(String v) {
        return switch (v.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on", "1" -> Boolean.TRUE;
            case "false", "no", "off", "0" -> Boolean.FALSE;
            default -> null;
        };
    }

    /** Secrets share the property namespace; only the load sources differ. */
    @Override
    public String getSecret(String key) {
        return get(key);
    }
}
