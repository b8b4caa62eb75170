package uk.gegc.examgen.features.ai.domain.model;

/**
 * Provider settings threaded into every model call. There is no process-wide "current model".
 */
public record ModelSettings(String model, Double temperature) {

    public static ModelSettings of(String model, Double temperature) {
        return new ModelSettings(model, temperature);
    }
}
