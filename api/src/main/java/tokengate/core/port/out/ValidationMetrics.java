package tokengate.core.port.out;

import tokengate.core.model.auth.TokenValidationResult;

/**
 * Port for recording token validation metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface ValidationMetrics {

    /**
     * Record the outcome of one validation call.
     *
     * @param result the validation result
     */
    void recordValidation(TokenValidationResult result);

    /**
     * Record one key set fetch.
     *
     * @param success whether the fetch produced a key set
     */
    void recordKeySetFetch(boolean success);

    /**
     * Metrics implementation that records nothing.
     */
    static ValidationMetrics noop() {
        return new ValidationMetrics() {
            @Override
            public void recordValidation(TokenValidationResult result) {}

            @Override
            public void recordKeySetFetch(boolean success) {}
        };
    }
}
