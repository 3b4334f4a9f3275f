package com.maibot.chat.llm;

import com.maibot.common.config.MaiBotConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of model providers keyed by provider id.
 */
@Slf4j
public class ModelProviderRegistry {

    private final Map<String, ModelProvider> providers = new ConcurrentHashMap<>();
    private volatile String defaultProviderId;

    /**
     * Register a model provider. The first registered provider becomes the
     * default for models that do not name one.
     */
    public void register(ModelProvider provider) {
        providers.put(provider.getId(), provider);
        if (defaultProviderId == null) {
            defaultProviderId = provider.getId();
        }
        log.info("Registered model provider: {}", provider.getId());
    }

    public void setDefaultProvider(String providerId) {
        this.defaultProviderId = providerId;
    }

    public ModelProvider getProvider(String providerId) {
        return providers.get(providerId);
    }

    /**
     * Resolve the provider serving a configured model: its own provider when
     * named and registered, else the default provider.
     *
     * @return the provider, or null when none is registered
     */
    public ModelProvider resolve(MaiBotConfig.ModelConfig model) {
        if (model != null && model.getProvider() != null) {
            ModelProvider named = providers.get(model.getProvider());
            if (named != null) {
                return named;
            }
            log.warn("Model provider {} is not registered, using default {}",
                    model.getProvider(), defaultProviderId);
        }
        return defaultProviderId != null ? providers.get(defaultProviderId) : null;
    }

    public boolean hasProvider(String providerId) {
        return providers.containsKey(providerId);
    }

    public Set<String> getProviderIds() {
        return Collections.unmodifiableSet(providers.keySet());
    }

    public int size() {
        return providers.size();
    }
}
