package com.phillippitts.speakermatch.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Scoring provider selection and per-provider model settings.
 *
 * <p>Properties:
 * <ul>
 *   <li>scoring.provider - {@code openai} (default) or {@code anthropic}</li>
 *   <li>scoring.openai.* / scoring.anthropic.* - api-key, model, temperature, max-tokens, timeout-ms</li>
 * </ul>
 *
 * <p>API keys are normally supplied through {@code OPENAI_API_KEY} / {@code ANTHROPIC_API_KEY}.
 */
@Validated
@ConfigurationProperties(prefix = "scoring")
public class ScoringProviderProperties {

    /**
     * Accepted values of {@code scoring.provider}. Bean selection itself matches the raw property
     * in {@code ScoringClientConfig}; binding to this enum makes an unknown provider fail startup
     * instead of leaving the context without a client.
     */
    public enum Provider { OPENAI, ANTHROPIC }

    @NotNull
    private Provider provider = Provider.OPENAI;

    @Valid
    private ModelSettings openai = new ModelSettings("gpt-4.1", 1024);

    @Valid
    private ModelSettings anthropic = new ModelSettings("claude-sonnet-4-5-20250929", 4096);

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public ModelSettings getOpenai() {
        return openai;
    }

    public void setOpenai(ModelSettings openai) {
        this.openai = openai;
    }

    public ModelSettings getAnthropic() {
        return anthropic;
    }

    public void setAnthropic(ModelSettings anthropic) {
        this.anthropic = anthropic;
    }

    /**
     * Settings fixed at client construction. Immutable once the client is built.
     */
    public static class ModelSettings {
        private String apiKey;

        @NotBlank
        private String model;

        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature = 0.1;

        @Positive
        private int maxTokens;

        @Positive
        private long timeoutMs = 60_000L;

        public ModelSettings() {
        }

        public ModelSettings(String model, int maxTokens) {
            this.model = model;
            this.maxTokens = maxTokens;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}
