package com.mystery.api;

import com.mystery.ai_engine.LocalLLMClient;
import com.mystery.analysis.ConsistencyChecker;
import com.mystery.analysis.NegationOverlapChecker;
import com.mystery.gossip.GossipMemoryProvider;
import com.mystery.gossip.HyperspellMemoryClient;
import com.mystery.service.GossipMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Collaborators shared by every game session
 */
@Configuration
public class MysteryEngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(MysteryEngineConfig.class);

    @Bean
    public LocalLLMClient localLLMClient(@Value("${ollama.base.url:}") String ollamaBaseUrl,
                                         @Value("${mystery.llm.model:mistral:7b}") String modelName,
                                         @Value("${mystery.llm.max-tokens:2000}") int maxTokens) {
        String baseUrl = ollamaBaseUrl.isEmpty() ? LocalLLMClient.getOllamaBaseUrlFromEnv() : ollamaBaseUrl;
        LocalLLMClient client = new LocalLLMClient(new LocalLLMClient.LocalLLMConfig(modelName, maxTokens), baseUrl);
        if (!client.checkAvailability()) {
            logger.warn("⚠️ [MysteryEngineConfig] Starting without a reachable model; only the sample case will be playable");
        }
        return client;
    }

    /**
     * Hosted memory store when an API key is configured, the application database otherwise
     */
    @Bean
    @Primary
    public GossipMemoryProvider gossipMemoryProvider(@Value("${hyperspell.api.key:}") String apiKey,
                                                     @Value("${hyperspell.base.url:}") String baseUrl,
                                                     GossipMemoryStore gossipMemoryStore) {
        if (apiKey == null || apiKey.isBlank()) {
            logger.info("💾 [MysteryEngineConfig] Gossip memory kept in the application database");
            return gossipMemoryStore;
        }
        logger.info("💾 [MysteryEngineConfig] Gossip memory kept in Hyperspell");
        return HyperspellMemoryClient.provider(apiKey, baseUrl);
    }

    @Bean
    public ConsistencyChecker consistencyChecker() {
        return new NegationOverlapChecker();
    }
}
