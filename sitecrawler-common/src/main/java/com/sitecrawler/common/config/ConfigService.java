package com.sitecrawler.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the sitecrawler configuration file.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, SiteCrawlerConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        this.configPath = expandHome(configPath.toString());
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public SiteCrawlerConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public SiteCrawlerConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Expand a leading {@code ~} to the user's home directory.
     */
    public static Path expandHome(String path) {
        if (path.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }

    /**
     * Replace {@code ${VAR}} and {@code ${VAR:-default}} with environment values.
     * Unset variables without a default are left untouched.
     */
    String substituteEnvVars(String raw) {
        Matcher m = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = env.apply(m.group(1));
            if (value == null) {
                value = m.group(2) != null ? m.group(2) : m.group(0);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private SiteCrawlerConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new SiteCrawlerConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            SiteCrawlerConfig config = raw.isBlank()
                    ? new SiteCrawlerConfig()
                    : objectMapper.readValue(raw, SiteCrawlerConfig.class);
            config = applyDefaults(config);
            log.info("Config loaded from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new SiteCrawlerConfig());
        }
    }

    static SiteCrawlerConfig applyDefaults(SiteCrawlerConfig config) {
        if (config.getScheduler() == null) {
            config.setScheduler(SchedulerConfig.defaults());
        }
        if (config.getNotify() == null) {
            config.setNotify(new SiteCrawlerConfig.NotifyConfig());
        }
        if (config.getStore() == null) {
            config.setStore(new SiteCrawlerConfig.StoreConfig());
        }
        return config;
    }
}
