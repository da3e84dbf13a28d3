package tokengate.core.model.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the provider's signing keys as fetched at one point in time.
 *
 * @param keys      keys indexed by key ID
 * @param fetchedAt when the key set was fetched
 * @param expiresAt when the snapshot stops being fresh
 */
public record KeySetSnapshot(Map<String, SigningKey> keys, Instant fetchedAt, Instant expiresAt) {

    public KeySetSnapshot {
        if (fetchedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("Snapshot validity window cannot be null");
        }
        if (expiresAt.isBefore(fetchedAt)) {
            throw new IllegalArgumentException("Snapshot cannot expire before it was fetched");
        }
        keys = keys == null ? Map.of() : Map.copyOf(keys);
    }

    public Optional<SigningKey> find(String keyId) {
        if (keyId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keys.get(keyId));
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isFresh(Instant now) {
        return !isExpired(now);
    }

    /**
     * Whether the snapshot is still fresh but close enough to expiry that a refresh should start.
     */
    public boolean isNearExpiry(Instant now, Duration refreshAhead) {
        if (refreshAhead == null || refreshAhead.isZero() || refreshAhead.isNegative()) {
            return false;
        }
        return isFresh(now) && now.plus(refreshAhead).isAfter(expiresAt);
    }

    public int size() {
        return keys.size();
    }
}
