package com.phillippitts.speakermatch.service.scoring;

import com.phillippitts.speakermatch.exception.ProviderException;

/**
 * Contract for text-completion providers used to score speakers.
 * Implementations adapt a concrete model API (OpenAI, Anthropic) behind a single call.
 *
 * <p>Configuration (model id, sampling temperature, output size limit) is fixed at construction.
 * Implementations hold no other mutable state and must be safe for concurrent use.
 *
 * <p>No retries happen at this layer; callers decide whether and how to retry.
 *
 * @see AbstractScoringClient
 */
public interface ScoringClient {

    /**
     * Sends one prompt and returns the model's raw reply text.
     *
     * <p>Issues exactly one outbound network call.
     *
     * @param prompt complete prompt text
     * @return non-blank completion text
     * @throws ProviderException on network failure, authentication failure, provider-side rejection
     *         (rate limit, content policy) or an empty completion
     * @throws IllegalArgumentException if prompt is null or blank
     */
    String complete(String prompt);

    /**
     * Returns the provider name for logging and metrics.
     *
     * @return provider name (e.g., "openai", "anthropic")
     */
    String getProviderName();
}
