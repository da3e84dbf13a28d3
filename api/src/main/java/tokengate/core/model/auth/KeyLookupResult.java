package tokengate.core.model.auth;

/**
 * Outcome of resolving a key ID against the key source.
 */
public sealed interface KeyLookupResult {

    /**
     * The key was found in a usable snapshot.
     *
     * @param key the matching key
     */
    record Found(SigningKey key) implements KeyLookupResult {}

    /**
     * No key with this ID exists in the current key set.
     *
     * @param keyId the requested key ID
     */
    record NotFound(String keyId) implements KeyLookupResult {}

    /**
     * The key set could not be fetched and no usable snapshot was available.
     *
     * @param reason why the fetch failed
     */
    record Unavailable(String reason) implements KeyLookupResult {}
}
