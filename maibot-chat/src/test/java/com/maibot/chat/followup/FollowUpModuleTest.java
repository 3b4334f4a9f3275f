package com.maibot.chat.followup;

import com.maibot.chat.llm.ModelProvider;
import com.maibot.chat.llm.ModelProviderRegistry;
import com.maibot.chat.willing.WillingManager;
import com.maibot.common.config.MaiBotConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FollowUpModuleTest {

    private FollowUpModule module;

    @AfterEach
    void tearDown() {
        if (module != null) {
            module.close();
        }
    }

    @Test
    void realScheduler_judgesAndRaisesWillingness() throws Exception {
        var latch = new CountDownLatch(1);
        var willing = new WillingManager() {
            @Override
            public void setWilling(String conversationId, double value) {
                super.setWilling(conversationId, value);
                latch.countDown();
            }
        };
        var registry = new ModelProviderRegistry();
        registry.register(new ModelProvider() {
            @Override
            public String getId() {
                return "stub";
            }

            @Override
            public CompletableFuture<ChatResponse> chat(ChatRequest request) {
                return CompletableFuture.supplyAsync(() -> ChatResponse.builder()
                        .message(ChatMessage.builder().role("assistant").content("是").build())
                        .build());
            }
        });
        var config = new MaiBotConfig();
        var followUp = new MaiBotConfig.FollowUpConfig();
        followUp.setTimeoutSeconds(0.2);
        followUp.setPollIntervalMs(20);
        config.setFollowUp(followUp);

        module = new FollowUpModule(config, registry, willing);
        FollowUpManager manager = module.getManager();
        manager.start("group-9", "bot-1");
        manager.feed("group-9", TestMessages.text("alice", "麦麦你好"));

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(2.0, willing.getWilling("group-9"));
        long deadline = System.currentTimeMillis() + 2000;
        while (manager.isTracking("group-9") && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(manager.isTracking("group-9"));
        assertFalse(manager.isTrackedMessage("bot-1"));
    }

    @Test
    void start_afterClose_isIgnored() {
        module = new FollowUpModule(new MaiBotConfig(), new ModelProviderRegistry(), new WillingManager());
        FollowUpManager manager = module.getManager();
        module.close();

        assertDoesNotThrow(() -> manager.start("group-9", "bot-1"));

        assertFalse(manager.isTracking("group-9"));
        assertFalse(manager.isTrackedMessage("bot-1"));
        module = null;
    }

    @Test
    void close_stopsAllTrackers() {
        var config = new MaiBotConfig();
        config.setFollowUp(new MaiBotConfig.FollowUpConfig());
        module = new FollowUpModule(config, new ModelProviderRegistry(), new WillingManager());
        module.getManager().start("group-1", "bot-1");

        module.close();

        assertEquals(0, module.getManager().activeCount());
        module = null;
    }
}
