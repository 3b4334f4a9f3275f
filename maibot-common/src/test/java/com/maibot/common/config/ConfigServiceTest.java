package com.maibot.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("bot_config.json");
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "followUp": {
                    "enabled": false,
                    "timeoutSeconds": 12.5,
                    "maxMessages": 3,
                    "policy": "close",
                    "model": { "name": "Qwen/Qwen2.5-7B-Instruct", "provider": "siliconflow" }
                  },
                  "models": {
                    "normalMinor": { "name": "deepseek-chat" }
                  },
                  "unknownSection": { "ignored": true }
                }
                """;
        Files.writeString(configPath, json);

        MaiBotConfig config = new ConfigService(configPath).loadConfig();

        assertNotNull(config.getFollowUp());
        assertFalse(config.getFollowUp().isEnabled());
        assertEquals(12.5, config.getFollowUp().getTimeoutSeconds());
        assertEquals(3, config.getFollowUp().getMaxMessages());
        assertEquals("close", config.getFollowUp().getPolicy());
        assertEquals("Qwen/Qwen2.5-7B-Instruct", config.getFollowUp().getModel().getName());
        assertEquals("deepseek-chat", config.getModels().getNormalMinor().getName());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        MaiBotConfig config = new ConfigService(tempDir.resolve("nonexistent.json")).loadConfig();

        assertNotNull(config.getBot());
        assertNotNull(config.getModels());
        MaiBotConfig.FollowUpConfig followUp = config.getFollowUp();
        assertTrue(followUp.isEnabled());
        assertEquals(30, followUp.getTimeoutSeconds());
        assertEquals(5, followUp.getMaxMessages());
        assertEquals(1000, followUp.getPollIntervalMs());
        assertEquals("restart", followUp.getPolicy());
        assertEquals(-1, followUp.getMaxRestarts());
        assertEquals("是", followUp.getAffirmativeMarker());
        assertEquals(2.0, followUp.getReplyWillingness());
    }

    @Test
    void loadConfig_malformedJson_fallsBackToDefaults() throws IOException {
        Files.writeString(configPath, "{ not json");

        MaiBotConfig config = new ConfigService(configPath).loadConfig();

        assertNotNull(config.getFollowUp());
        assertEquals(MaiBotConfig.FollowUpDefaults.PROMPT, config.getFollowUp().getLlmPrompt());
    }

    @Test
    void loadConfig_blankPrompt_restoresDefaultPrompt() throws IOException {
        Files.writeString(configPath, """
                { "followUp": { "llmPrompt": "  " } }
                """);

        MaiBotConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(MaiBotConfig.FollowUpDefaults.PROMPT, config.getFollowUp().getLlmPrompt());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        ConfigService service = new ConfigService(configPath);
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_withDefault_usesDefault() {
        ConfigService service = new ConfigService(configPath);
        String result = service.substituteEnvVars("${__UNLIKELY_VAR_XYZ:-fallback}");
        assertEquals("fallback", result);
    }

    @Test
    void substituteEnvVars_presentVariable_wins() {
        ConfigService service = new ConfigService(configPath);
        String result = service.substituteEnvVars("key=${SILICONFLOW_KEY:-none}",
                Map.of("SILICONFLOW_KEY", "sk-123"));
        assertEquals("key=sk-123", result);
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, """
                { "followUp": { "maxMessages": 7 } }
                """);

        ConfigService service = new ConfigService(configPath);
        MaiBotConfig first = service.loadConfig();
        MaiBotConfig second = service.loadConfig();

        assertSame(first, second);
    }

    @Test
    void reloadConfig_picksUpChanges() throws IOException {
        Files.writeString(configPath, """
                { "followUp": { "maxMessages": 7 } }
                """);
        ConfigService service = new ConfigService(configPath);
        assertEquals(7, service.loadConfig().getFollowUp().getMaxMessages());

        Files.writeString(configPath, """
                { "followUp": { "maxMessages": 9 } }
                """);
        assertEquals(9, service.reloadConfig().getFollowUp().getMaxMessages());
    }

    @Test
    void modelConfig_hasName() {
        MaiBotConfig.ModelConfig model = new MaiBotConfig.ModelConfig();
        assertFalse(model.hasName());
        model.setName(" ");
        assertFalse(model.hasName());
        model.setName("deepseek-chat");
        assertTrue(model.hasName());
    }
}
