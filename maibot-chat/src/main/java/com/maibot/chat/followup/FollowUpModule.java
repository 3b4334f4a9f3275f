package com.maibot.chat.followup;

import com.maibot.chat.llm.ModelProviderRegistry;
import com.maibot.chat.willing.WillingnessSink;
import com.maibot.common.config.MaiBotConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Wires a {@link FollowUpManager} for production use: settings and judge from
 * config, a daemon executor as scheduler. Build once at startup and hand the
 * manager to the message pipeline; close on shutdown.
 */
@Slf4j
public class FollowUpModule implements AutoCloseable {

    private final ExecutorTrackingScheduler scheduler;
    private final FollowUpManager manager;

    public FollowUpModule(MaiBotConfig config, ModelProviderRegistry providers, WillingnessSink willingness) {
        this.scheduler = new ExecutorTrackingScheduler();
        this.manager = new FollowUpManager(
                FollowUpSettings.from(config.getFollowUp()),
                ModelNecessityEvaluator.fromConfig(config, providers),
                willingness,
                scheduler);
    }

    public FollowUpManager getManager() {
        return manager;
    }

    @Override
    public void close() {
        manager.stopAll();
        scheduler.close();
        log.debug("Follow-up module closed");
    }
}
