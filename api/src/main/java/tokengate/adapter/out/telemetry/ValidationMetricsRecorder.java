package tokengate.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import tokengate.core.model.auth.TokenValidationResult;
import tokengate.core.port.out.ValidationMetrics;

/**
 * Records token validation metrics using Micrometer.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code tokengate.validations.total} - Validation outcomes, tagged {@code outcome=valid} or the
 *       lower-cased failure kind</li>
 *   <li>{@code tokengate.jwks.fetches.total} - JWKS fetches, tagged {@code result=success|failure}</li>
 * </ul>
 */
@ApplicationScoped
public class ValidationMetricsRecorder implements ValidationMetrics {

    static final String VALIDATIONS = "tokengate.validations.total";
    static final String FETCHES = "tokengate.jwks.fetches.total";

    private final MeterRegistry registry;

    @Inject
    public ValidationMetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordValidation(TokenValidationResult result) {
        final String outcome;
        if (result instanceof TokenValidationResult.Invalid invalid) {
            outcome = invalid.failure().name().toLowerCase(Locale.ROOT);
        } else {
            outcome = "valid";
        }

        Counter.builder(VALIDATIONS)
                .description("Bearer token validations by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    @Override
    public void recordKeySetFetch(boolean success) {
        Counter.builder(FETCHES)
                .description("JWKS fetches from the identity provider")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }
}
