package tokengate.config;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import tokengate.core.config.TokenGateConfig;
import tokengate.core.model.auth.TrustPolicy;
import tokengate.core.port.out.KeySetFetcher;
import tokengate.core.port.out.KeySource;
import tokengate.core.port.out.ValidationMetrics;
import tokengate.core.service.auth.KeySourceCache;

/**
 * CDI producers for the trust policy, the key source and the clock.
 *
 * <p>The key source is built here once per application; nothing else constructs one.
 */
@ApplicationScoped
public class TokenGateProducers {

    private static final Logger LOG = Logger.getLogger(TokenGateProducers.class);

    private final TokenGateConfig config;

    @Inject
    public TokenGateProducers(TokenGateConfig config) {
        this.config = config;
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Produces the trust policy.
     *
     * @throws IllegalStateException if tenant, client or policy settings are missing or invalid
     */
    @Produces
    @Singleton
    public TrustPolicy trustPolicy() {
        requireValue(config.tenantId(), "tokengate.tenant-id (AZURE_TENANT_ID)");
        requireValue(config.clientId(), "tokengate.client-id (AZURE_CLIENT_ID)");

        final var trust = config.trust();
        try {
            final var policy = TrustPolicy.builder(trust.audience())
                    .issuers(trust.issuers())
                    .allowedAlgorithms(trust.allowedAlgorithms())
                    .clockSkewTolerance(trust.clockSkew())
                    .build();
            LOG.infov(
                    "Trust policy: audience={0}, issuers={1}, algorithms={2}, clockSkew={3}",
                    policy.expectedAudience(),
                    policy.expectedIssuers(),
                    policy.allowedAlgorithms(),
                    policy.clockSkewTolerance());
            return policy;
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid trust policy configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Produces the key source for the configured JWKS endpoint.
     */
    @Produces
    @ApplicationScoped
    public KeySource keySource(KeySetFetcher fetcher, Clock clock, ValidationMetrics metrics) {
        final var settings = KeySourceCache.Settings.from(config.jwks());
        LOG.infov(
                "Key source: uri={0}, ttl={1}, fetchTimeout={2}, refreshAhead={3}, serveStaleOnFailure={4}",
                fetcher.describe(),
                settings.cacheTtl(),
                settings.fetchTimeout(),
                settings.refreshAhead(),
                settings.serveStaleOnFailure());
        return new KeySourceCache(fetcher, settings, clock, metrics);
    }

    private static void requireValue(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required configuration: " + name);
        }
    }
}
