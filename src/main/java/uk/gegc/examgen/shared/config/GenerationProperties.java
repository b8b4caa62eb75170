package uk.gegc.examgen.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "exam.generation")
@Data
public class GenerationProperties {

    /**
     * Serve pre-authored example payloads instead of calling the model
     */
    private boolean offline = false;

    /**
     * Model name passed to every model call
     */
    private String model = "gpt-4o-mini";

    private double temperature = 0.7;

    /**
     * Default number of questions requested per batch
     */
    private int questionsPerBatch = 3;

    /**
     * Length of the raw-text snippet kept in rejection logs
     */
    private int rawSnippetLength = 200;
}
