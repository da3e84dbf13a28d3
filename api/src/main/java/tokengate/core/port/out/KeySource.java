package tokengate.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import tokengate.core.model.auth.KeyLookupResult;
import tokengate.core.model.auth.KeySetSnapshot;

/**
 * Port for resolving verification keys by key ID.
 *
 * <p>Implementations are responsible for:
 * <ul>
 *   <li>Fetching the key set from the identity provider</li>
 *   <li>Caching it for a bounded time</li>
 *   <li>Collapsing concurrent refreshes into one fetch</li>
 * </ul>
 */
public interface KeySource {

    /**
     * Resolve a key by ID.
     *
     * <p>A miss against a fresh key set is reported as {@link KeyLookupResult.NotFound} without
     * contacting the provider. A miss or hit against a missing or expired key set refreshes first.
     *
     * @param keyId the key ID (kid) to resolve
     * @return the lookup outcome; never a failed {@link Uni}
     */
    Uni<KeyLookupResult> getKey(String keyId);

    /**
     * Fetch the key set from the provider and replace the held snapshot.
     *
     * @return the new snapshot, or a failure with {@link KeySetFetcher.KeySetFetchException}
     */
    Uni<KeySetSnapshot> refresh();

    /**
     * The snapshot currently held, expired or not.
     */
    Optional<KeySetSnapshot> currentSnapshot();
}
