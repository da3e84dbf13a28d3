package tokengate.adapter.in.health;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import tokengate.core.port.out.KeySource;

/**
 * Readiness check for the signing key cache.
 *
 * <p>UP while a key set is held and has not expired. Tokens cannot be verified without one,
 * so a missing or expired key set reports DOWN until the next successful fetch.
 */
@Readiness
@ApplicationScoped
public class KeySourceHealthCheck implements HealthCheck {

    static final String NAME = "jwks";

    private final KeySource keySource;
    private final Clock clock;

    @Inject
    public KeySourceHealthCheck(KeySource keySource, Clock clock) {
        this.keySource = keySource;
        this.clock = clock;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name(NAME);

        final var snapshot = keySource.currentSnapshot();
        if (snapshot.isEmpty()) {
            return builder.down().withData("reason", "key set not fetched yet").build();
        }

        final var current = snapshot.get();
        builder.withData("keys", current.size())
                .withData("fetchedAt", current.fetchedAt().toString())
                .withData("expiresAt", current.expiresAt().toString());

        return current.isFresh(clock.instant()) ? builder.up().build() : builder.down().build();
    }
}
