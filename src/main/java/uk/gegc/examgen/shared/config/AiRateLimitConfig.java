package uk.gegc.examgen.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Retry behaviour of the model-call collaborator. The ingestion pipeline itself never retries.
 */
@Component
@ConfigurationProperties(prefix = "ai.rate-limit")
@Data
public class AiRateLimitConfig {

    /**
     * Maximum number of retry attempts for a model call
     */
    private int maxRetries = 5;

    /**
     * Base delay in milliseconds for exponential backoff
     */
    private long baseDelayMs = 1000;

    /**
     * Cap for the exponential backoff delay
     */
    private long maxDelayMs = 60000;

    /**
     * Jitter factor for backoff calculation (0.0 = no jitter, 0.5 = ±50% variation)
     */
    private double jitterFactor = 0.25;
}
