package uk.gegc.examgen.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.stereotype.Service;
import uk.gegc.examgen.features.ai.application.ModelCallClient;
import uk.gegc.examgen.features.ai.domain.model.ModelSettings;
import uk.gegc.examgen.shared.config.AiRateLimitConfig;
import uk.gegc.examgen.shared.exception.AiServiceException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class SpringAiModelCallClient implements ModelCallClient {

    static final String JSON_ONLY_INSTRUCTION =
            "Respond with exactly one minified JSON object. No prose, no markdown code fences.";

    private final ChatClient chatClient;
    private final AiRateLimitConfig rateLimitConfig;

    @Override
    public String call(String systemPrompt, String userPrompt, boolean wantJson, ModelSettings settings) {
        if (userPrompt == null || userPrompt.isBlank()) {
            throw new AiServiceException("User prompt cannot be null or empty");
        }

        Prompt prompt = new Prompt(buildMessages(systemPrompt, userPrompt, wantJson), buildChatOptions(settings, wantJson));
        int maxRetries = Math.max(1, rateLimitConfig.getMaxRetries());
        int retryCount = 0;

        while (retryCount < maxRetries) {
            Instant start = Instant.now();
            try {
                ChatResponse response = chatClient.prompt(prompt)
                        .call()
                        .chatResponse();

                if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                    throw new AiServiceException("No response received from AI service");
                }

                String text = response.getResult().getOutput().getText();
                long latency = Duration.between(start, Instant.now()).toMillis();
                Integer tokensUsed = response.getMetadata() != null && response.getMetadata().getUsage() != null
                        ? response.getMetadata().getUsage().getTotalTokens()
                        : null;
                log.info("Model call completed - Model: {}, Tokens: {}, Latency: {}ms",
                        settings.model(), tokensUsed, latency);
                return text == null ? "" : text;

            } catch (Exception e) {
                log.error("Error calling model {} (attempt {} of {})", settings.model(), retryCount + 1, maxRetries, e);

                if (retryCount >= maxRetries - 1) {
                    if (isRateLimitError(e)) {
                        throw new AiServiceException("Rate limit exceeded after " + maxRetries + " attempts. Please try again later.", e);
                    }
                    throw new AiServiceException("Failed to get AI response after " + maxRetries + " attempts: " + e.getMessage(), e);
                }

                if (isRateLimitError(e)) {
                    long delayMs = calculateBackoffDelay(retryCount);
                    log.warn("Rate limit hit (attempt {}). Waiting {} ms before retry.", retryCount + 1, delayMs);
                    sleepForRateLimit(delayMs);
                }
                retryCount++;
            }
        }

        throw new AiServiceException("Failed to get AI response after " + maxRetries + " attempts");
    }

    private List<Message> buildMessages(String systemPrompt, String userPrompt, boolean wantJson) {
        List<Message> messages = new ArrayList<>();
        String system = systemPrompt == null ? "" : systemPrompt.strip();
        if (wantJson) {
            system = system.isEmpty() ? JSON_ONLY_INSTRUCTION : system + "\n\n" + JSON_ONLY_INSTRUCTION;
        }
        if (!system.isEmpty()) {
            messages.add(new SystemMessage(system));
        }
        messages.add(new UserMessage(userPrompt));
        return messages;
    }

    OpenAiChatOptions buildChatOptions(ModelSettings settings, boolean wantJson) {
        OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder()
                .model(settings.model())
                .temperature(settings.temperature());
        if (wantJson) {
            builder.responseFormat(ResponseFormat.builder().type(ResponseFormat.Type.JSON_OBJECT).build());
        }
        return builder.build();
    }

    /**
     * Check if the exception is a rate limit error (429)
     */
    private boolean isRateLimitError(Exception e) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        return message.contains("429") ||
               message.contains("rate limit") ||
               message.contains("rate_limit_exceeded") ||
               message.contains("Too Many Requests");
    }

    /**
     * Exponential backoff with jitter, capped at the configured maximum
     */
    long calculateBackoffDelay(int retryCount) {
        long exponentialDelay = rateLimitConfig.getBaseDelayMs() * (long) Math.pow(2, retryCount);
        double jitterRange = rateLimitConfig.getJitterFactor();
        double jitter = (1.0 - jitterRange) + (Math.random() * 2 * jitterRange);
        long delayWithJitter = (long) (exponentialDelay * jitter);
        return Math.min(delayWithJitter, rateLimitConfig.getMaxDelayMs());
    }

    /**
     * Overridden in tests to avoid actual sleeping
     */
    protected void sleepForRateLimit(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AiServiceException("Interrupted while waiting for rate limit", ie);
        }
    }
}
