package com.maibot.chat.followup;

import com.maibot.chat.llm.ModelProvider;
import com.maibot.chat.llm.ModelProviderRegistry;
import com.maibot.chat.llm.ModelSelection;
import com.maibot.common.config.MaiBotConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asks a chat model whether the collected follow-up conversation needs the
 * bot to answer. The verdict is positive when the model's reply contains the
 * affirmative marker.
 */
@Slf4j
public class ModelNecessityEvaluator implements NecessityEvaluator {

    static final String CONTEXT_HEADER = "\n\n对话内容：\n";
    static final double TEMPERATURE = 0.7;
    static final int MAX_TOKENS = 200;

    private final ModelProvider provider;
    private final String model;
    private final String promptTemplate;
    private final String affirmativeMarker;

    public ModelNecessityEvaluator(ModelProvider provider, String model,
            String promptTemplate, String affirmativeMarker) {
        this.provider = provider;
        this.model = model;
        this.promptTemplate = promptTemplate != null ? promptTemplate : "";
        this.affirmativeMarker = affirmativeMarker != null && !affirmativeMarker.isEmpty()
                ? affirmativeMarker
                : "是";
    }

    /**
     * Build the judge from config: the follow-up model (or normalMinor) served
     * by its registered provider.
     */
    public static ModelNecessityEvaluator fromConfig(MaiBotConfig config, ModelProviderRegistry registry) {
        MaiBotConfig.ModelConfig modelConfig = ModelSelection.resolveFollowUpModel(config);
        ModelProvider provider = registry.resolve(modelConfig);
        if (provider == null) {
            log.warn("No model provider available for follow-up judging, every window will close unanswered");
        }
        MaiBotConfig.FollowUpConfig followUp = config.getFollowUp() != null
                ? config.getFollowUp()
                : new MaiBotConfig.FollowUpConfig();
        return new ModelNecessityEvaluator(provider,
                modelConfig != null ? modelConfig.getName() : null,
                followUp.getLlmPrompt(),
                followUp.getAffirmativeMarker());
    }

    @Override
    public CompletableFuture<Boolean> evaluate(String conversationId, String context) {
        if (provider == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("no model provider configured for follow-up judging"));
        }
        ModelProvider.ChatRequest request = ModelProvider.ChatRequest.builder()
                .model(model)
                .messages(List.of(ModelProvider.ChatMessage.user(buildPrompt(context))))
                .temperature(TEMPERATURE)
                .maxTokens(MAX_TOKENS)
                .build();
        return provider.chat(request).thenApply(response -> {
            String answer = response != null ? response.text() : "";
            boolean necessary = answer.contains(affirmativeMarker);
            log.debug("Follow-up judge for {} answered '{}' -> {}", conversationId, answer.trim(), necessary);
            return necessary;
        });
    }

    String buildPrompt(String context) {
        return promptTemplate + CONTEXT_HEADER + context;
    }

    public String getModel() {
        return model;
    }
}
