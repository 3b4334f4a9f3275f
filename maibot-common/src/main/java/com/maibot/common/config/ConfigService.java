package com.maibot.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the MaiBot JSON configuration.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, MaiBotConfig> cache;
    private final Path configPath;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
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
    public MaiBotConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public MaiBotConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private MaiBotConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new MaiBotConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            MaiBotConfig config = objectMapper.readValue(raw, MaiBotConfig.class);
            if (config == null) {
                config = new MaiBotConfig();
            }
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new MaiBotConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        return substituteEnvVars(raw, System.getenv());
    }

    String substituteEnvVars(String raw, Map<String, String> env) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config sections.
     */
    MaiBotConfig applyDefaults(MaiBotConfig config) {
        if (config.getBot() == null) {
            config.setBot(new MaiBotConfig.BotConfig());
        }
        if (config.getModels() == null) {
            config.setModels(new MaiBotConfig.ModelsConfig());
        }
        if (config.getFollowUp() == null) {
            config.setFollowUp(new MaiBotConfig.FollowUpConfig());
        }
        MaiBotConfig.FollowUpConfig followUp = config.getFollowUp();
        if (followUp.getLlmPrompt() == null || followUp.getLlmPrompt().isBlank()) {
            followUp.setLlmPrompt(MaiBotConfig.FollowUpDefaults.PROMPT);
        }
        if (followUp.getAffirmativeMarker() == null || followUp.getAffirmativeMarker().isEmpty()) {
            followUp.setAffirmativeMarker("是");
        }
        return config;
    }
}
