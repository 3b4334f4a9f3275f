package com.maibot.chat.llm;

import com.maibot.common.config.MaiBotConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks the configured model for a chat task.
 */
@Slf4j
public final class ModelSelection {

    private ModelSelection() {
    }

    /**
     * The follow-up judge uses {@code followUp.model} when it names a model,
     * otherwise {@code models.normalMinor}.
     *
     * @return the chosen model, or null when neither is configured
     */
    public static MaiBotConfig.ModelConfig resolveFollowUpModel(MaiBotConfig config) {
        MaiBotConfig.FollowUpConfig followUp = config.getFollowUp();
        if (followUp != null && followUp.getModel() != null && followUp.getModel().hasName()) {
            log.info("[follow-up] using dedicated judge model: {}", followUp.getModel().getName());
            return followUp.getModel();
        }
        MaiBotConfig.ModelsConfig models = config.getModels();
        MaiBotConfig.ModelConfig fallback = models != null ? models.getNormalMinor() : null;
        log.info("[follow-up] using default normalMinor model: {}",
                fallback != null ? fallback.getName() : null);
        return fallback;
    }
}
