package com.maibot.chat.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Chat completion backend. Implementations live with the platform wiring; the
 * chat core only sends requests through this contract.
 */
public interface ModelProvider {

    /** Provider identifier (e.g. "siliconflow", "deepseek"). */
    String getId();

    /**
     * Send a chat completion request and return the full response.
     */
    CompletableFuture<ChatResponse> chat(ChatRequest request);

    // --- Supporting types ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ChatRequest {
        private String model;
        private List<ChatMessage> messages;
        private int maxTokens;
        private double temperature;
        private String systemPrompt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ChatResponse {
        private String id;
        private String model;
        private ChatMessage message;
        private Usage usage;
        private String stopReason;

        /** Text content of the reply, or an empty string. */
        public String text() {
            return message != null && message.getContent() != null ? message.getContent() : "";
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ChatMessage {
        /** "system" | "user" | "assistant" */
        private String role;
        private String content;
        /** Reasoning content from thinking models. */
        private String reasoningContent;

        public static ChatMessage user(String content) {
            return ChatMessage.builder().role("user").content(content).build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class Usage {
        private int inputTokens;
        private int outputTokens;
    }
}
