package com.phillippitts.speakermatch.config.scoring;

import com.phillippitts.speakermatch.config.properties.ScoringProviderProperties;
import com.phillippitts.speakermatch.config.properties.ScoringProviderProperties.ModelSettings;
import com.phillippitts.speakermatch.exception.ProviderException;
import com.phillippitts.speakermatch.service.scoring.ScoringClient;
import com.phillippitts.speakermatch.service.scoring.anthropic.AnthropicScoringClient;
import com.phillippitts.speakermatch.service.scoring.openai.OpenAiScoringClient;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires exactly one {@link ScoringClient} according to {@code scoring.provider}.
 *
 * <p>Model settings are fixed here, at construction. Retries are disabled on both SDKs:
 * a failed call is reported once and scored as a failure. A missing API key aborts startup.
 */
@Configuration
public class ScoringClientConfig {

    private static final Logger LOG = LogManager.getLogger(ScoringClientConfig.class);

    /**
     * OpenAI client. Active when scoring.provider is openai or missing.
     */
    @Bean
    @ConditionalOnProperty(prefix = "scoring", name = "provider", havingValue = "openai", matchIfMissing = true)
    public ScoringClient openAiScoringClient(ScoringProviderProperties properties) {
        ModelSettings settings = properties.getOpenai();
        requireApiKey(settings, OpenAiScoringClient.PROVIDER_NAME, "OPENAI_API_KEY");
        LOG.info("Scoring provider: {}, model={}, maxTokens={}, timeoutMs={}",
                properties.getProvider(), settings.getModel(), settings.getMaxTokens(), settings.getTimeoutMs());
        OpenAiChatModel model = OpenAiChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(settings.getModel())
                .temperature(settings.getTemperature())
                .maxTokens(settings.getMaxTokens())
                .timeout(Duration.ofMillis(settings.getTimeoutMs()))
                .maxRetries(0)
                .build();
        return new OpenAiScoringClient(model);
    }

    /**
     * Anthropic client. Active when scoring.provider=anthropic.
     */
    @Bean
    @ConditionalOnProperty(prefix = "scoring", name = "provider", havingValue = "anthropic")
    public ScoringClient anthropicScoringClient(ScoringProviderProperties properties) {
        ModelSettings settings = properties.getAnthropic();
        requireApiKey(settings, AnthropicScoringClient.PROVIDER_NAME, "ANTHROPIC_API_KEY");
        LOG.info("Scoring provider: {}, model={}, maxTokens={}, timeoutMs={}",
                properties.getProvider(), settings.getModel(), settings.getMaxTokens(), settings.getTimeoutMs());
        AnthropicChatModel model = AnthropicChatModel.builder()
                .apiKey(settings.getApiKey())
                .modelName(settings.getModel())
                .temperature(settings.getTemperature())
                .maxTokens(settings.getMaxTokens())
                .timeout(Duration.ofMillis(settings.getTimeoutMs()))
                .maxRetries(0)
                .build();
        return new AnthropicScoringClient(model);
    }

    static void requireApiKey(ModelSettings settings, String provider, String envVar) {
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new ProviderException("API key not configured; set " + envVar, provider);
        }
    }
}
