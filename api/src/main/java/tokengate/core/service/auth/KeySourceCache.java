package tokengate.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.jwk.Use;

import tokengate.core.config.TokenGateConfig;
import tokengate.core.model.auth.KeyLookupResult;
import tokengate.core.model.auth.KeySetSnapshot;
import tokengate.core.model.auth.SigningKey;
import tokengate.core.port.out.KeySetFetcher;
import tokengate.core.port.out.KeySetFetcher.KeySetFetchException;
import tokengate.core.port.out.KeySource;
import tokengate.core.port.out.ValidationMetrics;

/**
 * In-memory cache of the identity provider's signing keys.
 *
 * <p>Features:
 * <ul>
 *   <li>Snapshot held for a configurable TTL and replaced atomically</li>
 *   <li>Refresh on lookup when the snapshot is missing or expired</li>
 *   <li>Background refresh shortly before expiry</li>
 *   <li>Thundering herd protection: concurrent refreshes share one fetch</li>
 * </ul>
 *
 * <p>A lookup that misses against a fresh snapshot is answered with
 * {@link KeyLookupResult.NotFound} immediately, so probing with random key IDs never
 * reaches the provider.
 *
 * <p>One instance serves one JWKS endpoint. Instances are created explicitly and owned by
 * whoever created them.
 */
public class KeySourceCache implements KeySource {

    private static final Logger LOG = Logger.getLogger(KeySourceCache.class);

    private final KeySetFetcher fetcher;
    private final Settings settings;
    private final Clock clock;
    private final ValidationMetrics metrics;

    private final AtomicReference<KeySetSnapshot> snapshot = new AtomicReference<>();
    private final AtomicReference<KeySetSnapshot> backgroundRefreshedFor = new AtomicReference<>();

    private final Object refreshLock = new Object();
    // guarded by refreshLock
    private Uni<KeySetSnapshot> inFlight;

    public KeySourceCache(KeySetFetcher fetcher, Settings settings, Clock clock, ValidationMetrics metrics) {
        this.fetcher = fetcher;
        this.settings = settings;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public Uni<KeyLookupResult> getKey(String keyId) {
        return Uni.createFrom().deferred(() -> {
            final var now = clock.instant();
            final var current = snapshot.get();

            if (current != null && current.isFresh(now)) {
                if (current.isNearExpiry(now, settings.refreshAhead())) {
                    refreshInBackground(current);
                }
                return Uni.createFrom().item(lookup(current, keyId));
            }

            LOG.debugv("Key set {0} for {1}, refreshing", current == null ? "missing" : "expired", fetcher.describe());
            return refresh()
                    .map(fresh -> lookup(fresh, keyId))
                    .onFailure()
                    .recoverWithItem(error -> fallback(current, keyId, error));
        });
    }

    @Override
    public Uni<KeySetSnapshot> refresh() {
        return Uni.createFrom().deferred(this::joinOrStartFetch);
    }

    @Override
    public Optional<KeySetSnapshot> currentSnapshot() {
        return Optional.ofNullable(snapshot.get());
    }

    /**
     * Return the in-flight fetch, or start one when none is running.
     */
    private Uni<KeySetSnapshot> joinOrStartFetch() {
        synchronized (refreshLock) {
            if (inFlight == null) {
                inFlight = fetchAndStore()
                        .onTermination()
                        .invoke(this::clearInFlight)
                        .memoize()
                        .indefinitely();
            } else {
                LOG.debugv("Joining in-flight JWKS fetch for {0}", fetcher.describe());
            }
            return inFlight;
        }
    }

    private void clearInFlight() {
        synchronized (refreshLock) {
            inFlight = null;
        }
    }

    private Uni<KeySetSnapshot> fetchAndStore() {
        LOG.infov("Fetching JWKS from {0}", fetcher.describe());

        return Uni.createFrom()
                .deferred(fetcher::fetch)
                .ifNoItem()
                .after(settings.fetchTimeout())
                .failWith(() -> new KeySetFetchException(
                        "Timeout fetching JWKS from " + fetcher.describe() + " after " + settings.fetchTimeout()))
                .map(this::toSnapshot)
                .invoke(fresh -> {
                    snapshot.set(fresh);
                    metrics.recordKeySetFetch(true);
                    LOG.infov(
                            "Cached {0} signing keys from {1}, fresh until {2}",
                            fresh.size(), fetcher.describe(), fresh.expiresAt());
                })
                .onFailure()
                .transform(error -> {
                    metrics.recordKeySetFetch(false);
                    LOG.warnv(error, "Failed to fetch JWKS from {0}", fetcher.describe());
                    if (error instanceof KeySetFetchException) {
                        return error;
                    }
                    return new KeySetFetchException(
                            "Failed to fetch JWKS from " + fetcher.describe() + ": " + error.getMessage(), error);
                });
    }

    private void refreshInBackground(KeySetSnapshot current) {
        final var previous = backgroundRefreshedFor.get();
        if (previous == current || !backgroundRefreshedFor.compareAndSet(previous, current)) {
            return;
        }
        LOG.debugv("Key set for {0} expires at {1}, refreshing in background", fetcher.describe(), current.expiresAt());
        refresh()
                .subscribe()
                .with(
                        fresh -> LOG.debugv("Background JWKS refresh completed with {0} keys", fresh.size()),
                        error -> LOG.warnv(
                                "Background JWKS refresh failed, keeping current key set until {0}: {1}",
                                current.expiresAt(), error.getMessage()));
    }

    private KeyLookupResult fallback(KeySetSnapshot stale, String keyId, Throwable error) {
        if (settings.serveStaleOnFailure() && stale != null) {
            LOG.warnv(
                    "Using stale JWKS for {0} (expired {1}) due to: {2}",
                    fetcher.describe(), stale.expiresAt(), error.getMessage());
            return lookup(stale, keyId);
        }
        return new KeyLookupResult.Unavailable(error.getMessage());
    }

    private KeyLookupResult lookup(KeySetSnapshot source, String keyId) {
        return source.find(keyId)
                .<KeyLookupResult>map(KeyLookupResult.Found::new)
                .orElseGet(() -> new KeyLookupResult.NotFound(keyId));
    }

    private KeySetSnapshot toSnapshot(JsonWebKeySet keySet) {
        final Map<String, SigningKey> keys = new LinkedHashMap<>();

        for (JsonWebKey jwk : keySet.getJsonWebKeys()) {
            final var keyId = jwk.getKeyId();
            if (keyId == null || keyId.isBlank()) {
                LOG.debugv("Skipping JWK without kid from {0}", fetcher.describe());
                continue;
            }
            if (jwk.getUse() != null && !Use.SIGNATURE.equals(jwk.getUse())) {
                LOG.debugv("Skipping JWK {0} with use={1}", keyId, jwk.getUse());
                continue;
            }
            if (!(jwk instanceof PublicJsonWebKey publicJwk) || publicJwk.getPublicKey() == null) {
                LOG.debugv("Skipping JWK {0} of type {1}: not an asymmetric key", keyId, jwk.getKeyType());
                continue;
            }
            if (keys.containsKey(keyId)) {
                LOG.warnv("Duplicate kid {0} in JWKS from {1}, keeping the first", keyId, fetcher.describe());
                continue;
            }
            keys.put(keyId, new SigningKey(keyId, jwk.getAlgorithm(), publicJwk.getPublicKey()));
        }

        final var now = clock.instant();
        return new KeySetSnapshot(keys, now, now.plus(settings.cacheTtl()));
    }

    /**
     * Cache behaviour settings.
     *
     * @param fetchTimeout        bound on one JWKS fetch
     * @param cacheTtl            lifetime of a fetched snapshot
     * @param refreshAhead        window before expiry that triggers a background refresh
     * @param serveStaleOnFailure whether an expired snapshot may answer lookups when a refresh fails
     */
    public record Settings(
            Duration fetchTimeout, Duration cacheTtl, Duration refreshAhead, boolean serveStaleOnFailure) {

        public Settings {
            if (fetchTimeout == null || fetchTimeout.isZero() || fetchTimeout.isNegative()) {
                throw new IllegalArgumentException("Fetch timeout must be positive");
            }
            if (cacheTtl == null || cacheTtl.isZero() || cacheTtl.isNegative()) {
                throw new IllegalArgumentException("Cache TTL must be positive");
            }
            if (refreshAhead == null) {
                refreshAhead = Duration.ZERO;
            }
        }

        public static Settings from(TokenGateConfig.JwksConfig config) {
            return new Settings(
                    config.fetchTimeout(), config.cacheTtl(), config.refreshAhead(), config.serveStaleOnFailure());
        }

        /**
         * Defaults matching the configuration defaults.
         */
        public static Settings defaults() {
            return new Settings(Duration.ofSeconds(5), Duration.ofHours(1), Duration.ofMinutes(5), false);
        }
    }
}
