package uk.gegc.examgen.features.ai.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pre-authored model replies under {@code classpath:examples/}. They are fed through the same
 * pipeline as live replies when the application runs offline.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExamplePayloadCatalog {

    public static final String PASSAGE = "passage";
    public static final String READING_MATERIAL = "reading-material";

    private final ResourceLoader resourceLoader;
    private final Map<String, Optional<String>> cache = new ConcurrentHashMap<>();

    /**
     * Literal example text for a shape name, e.g. {@code reading-comprehension-mc}.
     */
    public Optional<String> find(String shape) {
        return cache.computeIfAbsent(shape, this::load);
    }

    private Optional<String> load(String shape) {
        Resource resource = resourceLoader.getResource("classpath:examples/" + shape + ".json");
        if (!resource.exists()) {
            log.debug("No example payload for shape {}", shape);
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("Failed to read example payload: {}", shape, e);
            throw new IllegalStateException("Failed to read example payload: " + shape, e);
        }
    }
}
