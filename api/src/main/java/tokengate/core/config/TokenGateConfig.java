package tokengate.core.config;

import java.time.Duration;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for bearer-token validation.
 *
 * <p>Configuration prefix: {@code tokengate}
 *
 * <p>Deployment supplies the tenant and client identifiers (usually through
 * {@code AZURE_TENANT_ID} and {@code AZURE_CLIENT_ID}); issuer, audience and JWKS URI
 * defaults are derived from them in {@code application.properties}.
 */
@ConfigMapping(prefix = "tokengate")
public interface TokenGateConfig {

    /**
     * Directory tenant that issues tokens.
     */
    String tenantId();

    /**
     * Application (client) identifier of this API.
     */
    String clientId();

    /**
     * Trust policy settings.
     */
    TrustConfig trust();

    /**
     * JWKS fetch and cache settings.
     */
    JwksConfig jwks();

    /**
     * Trust policy settings.
     */
    interface TrustConfig {

        /**
         * Every accepted issuer, matched exactly.
         */
        Set<String> issuers();

        /**
         * Required audience.
         */
        String audience();

        /**
         * Accepted JWS algorithms.
         *
         * @return algorithm allow-list (default: RS256)
         */
        @WithDefault("RS256")
        Set<String> allowedAlgorithms();

        /**
         * Tolerance applied to exp, nbf and iat checks.
         *
         * @return clock skew (default: 30 seconds)
         */
        @WithDefault("PT30S")
        Duration clockSkew();
    }

    /**
     * JWKS (JSON Web Key Set) configuration.
     */
    interface JwksConfig {

        /**
         * Endpoint publishing the provider's signing keys.
         */
        String uri();

        /**
         * Maximum time to wait when fetching the JWKS.
         *
         * <p>If exceeded, the fetch fails and lookups report the key source as unavailable.
         *
         * @return Fetch timeout duration (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration fetchTimeout();

        /**
         * Lifetime of a fetched key set.
         *
         * @return Cache TTL duration (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration cacheTtl();

        /**
         * Window before expiry in which lookups trigger a background refresh.
         *
         * @return refresh-ahead window (default: 5 minutes); zero disables it
         */
        @WithDefault("PT5M")
        Duration refreshAhead();

        /**
         * Whether an expired key set may still be used when a refresh fails.
         *
         * @return true to serve stale keys (default: false)
         */
        @WithDefault("false")
        boolean serveStaleOnFailure();

        /**
         * Whether keys are fetched when the application starts.
         *
         * @return true to warm the cache (default: true)
         */
        @WithDefault("true")
        boolean warmOnStartup();
    }
}
