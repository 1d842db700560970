package com.phillippitts.speakermatch.service.scoring;

import com.phillippitts.speakermatch.exception.ProviderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Base class for scoring providers implementing the Template Method pattern.
 *
 * <p>{@link #complete(String)} validates the prompt, delegates to {@link #doComplete(String)},
 * and normalizes every outcome:
 * <ul>
 *   <li>Provider SDK exceptions are wrapped in {@link ProviderException} with the provider name</li>
 *   <li>{@link ProviderException}s thrown by subclasses pass through without double-wrapping</li>
 *   <li>A null or blank completion is reported as a {@link ProviderException}</li>
 * </ul>
 *
 * <p>Subclasses implement the provider-specific call shape only.
 *
 * @see com.phillippitts.speakermatch.service.scoring.openai.OpenAiScoringClient
 * @see com.phillippitts.speakermatch.service.scoring.anthropic.AnthropicScoringClient
 */
public abstract class AbstractScoringClient implements ScoringClient {

    private static final Logger LOG = LogManager.getLogger(AbstractScoringClient.class);

    @Override
    public final String complete(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
        long t0 = System.nanoTime();
        String text;
        try {
            text = doComplete(prompt);
        } catch (ProviderException pe) {
            throw pe;
        } catch (RuntimeException e) {
            throw new ProviderException(
                    "completion failed: " + e.getClass().getSimpleName() + ": " + e.getMessage(),
                    getProviderName(),
                    e
            );
        }
        long ms = (System.nanoTime() - t0) / 1_000_000L;
        if (text == null || text.isBlank()) {
            throw new ProviderException("empty completion after " + ms + " ms", getProviderName());
        }
        LOG.debug("{} completion: {} chars in {} ms", getProviderName(), text.length(), ms);
        return text;
    }

    /**
     * Provider-specific call. May throw any runtime exception; the caller wraps it.
     *
     * @param prompt validated, non-blank prompt
     * @return completion text (null or blank is treated as a failure)
     */
    protected abstract String doComplete(String prompt);
}
