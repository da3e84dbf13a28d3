package tokengate.core.port.out;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKeySet;

/**
 * Port for retrieving the identity provider's published key set.
 *
 * <p>Implementations fail the returned {@link Uni} with {@link KeySetFetchException} when the
 * endpoint is unreachable, answers with an error status, or returns a body that is not a JWKS.
 * Timeouts are applied by the caller.
 */
public interface KeySetFetcher {

    /**
     * Fetch the current key set.
     *
     * @return the parsed JSON Web Key Set
     */
    Uni<JsonWebKeySet> fetch();

    /**
     * Description of the key source for logging, usually its URI.
     */
    String describe();

    /**
     * Exception thrown when the key set cannot be fetched.
     *
     * <p>This can occur due to network timeout, HTTP error, or malformed JWKS response.
     */
    class KeySetFetchException extends RuntimeException {
        public KeySetFetchException(String message) {
            super(message);
        }

        public KeySetFetchException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
