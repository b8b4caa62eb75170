package uk.gegc.examgen.features.ai.application;

import uk.gegc.examgen.features.ai.domain.model.ModelSettings;
import uk.gegc.examgen.shared.exception.AiServiceException;

/**
 * The one latency-bearing call of a generation unit. Retry and backoff live behind this
 * interface; callers see either the raw reply text or an {@link AiServiceException}.
 */
public interface ModelCallClient {

    /**
     * @param wantJson ask the provider for a single JSON object reply
     * @return raw reply text, possibly empty
     * @throws AiServiceException on network failure, timeout, missing reply or exhausted retries
     */
    String call(String systemPrompt, String userPrompt, boolean wantJson, ModelSettings settings);
}
