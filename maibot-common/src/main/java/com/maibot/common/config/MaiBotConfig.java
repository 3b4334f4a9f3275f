package com.maibot.common.config;

import lombok.Data;

/**
 * Root configuration type for MaiBot.
 * Only the sections consumed by the chat pipeline are modelled; unknown keys
 * in the config file are ignored on load.
 */
@Data
public class MaiBotConfig {

    /** Bot identity settings. */
    private BotConfig bot;

    /** Named model slots. */
    private ModelsConfig models;

    /** Follow-up tracking settings. */
    private FollowUpConfig followUp;

    // --- Nested config types ---

    @Data
    public static class BotConfig {
        private String qq;
        private String nickname = "麦麦";
    }

    @Data
    public static class ModelsConfig {
        /** Small general-purpose model, the default judge for follow-ups. */
        private ModelConfig normalMinor;
        private ModelConfig normal;
        private ModelConfig reasoning;
    }

    @Data
    public static class ModelConfig {
        /** Model name as understood by the provider. */
        private String name;
        /** Provider id (e.g. "siliconflow", "deepseek"). */
        private String provider;
        private String baseUrl;
        private String key;

        public boolean hasName() {
            return name != null && !name.isBlank();
        }
    }

    @Data
    public static class FollowUpConfig {
        private boolean enabled = true;
        /** Observation window length in seconds. */
        private double timeoutSeconds = 30;
        /** Number of follow-up messages that closes the window early. */
        private int maxMessages = 5;
        /** How often the window is re-checked, in milliseconds. */
        private long pollIntervalMs = 1000;
        /** "restart" keeps listening after a negative verdict, "close" stops. */
        private String policy = "restart";
        /** Upper bound on re-arms of one window; negative means unlimited. */
        private int maxRestarts = -1;
        /** Prompt placed before the collected conversation. */
        private String llmPrompt = FollowUpDefaults.PROMPT;
        /** Substring of the judge's answer that means "reply". */
        private String affirmativeMarker = "是";
        /** Willingness set on the conversation after a positive verdict. */
        private double replyWillingness = 2.0;
        /** Dedicated judge model; falls back to models.normalMinor. */
        private ModelConfig model;
    }

    /** Built-in follow-up defaults. */
    public static final class FollowUpDefaults {
        public static final String PROMPT = "请判断以下对话是否需要你（机器人）进行回复。"
                + "如果对话内容是在询问你、提到你、或者需要你参与，请回答\"是\"，否则回答\"否\"。";

        private FollowUpDefaults() {
        }
    }
}
