package tokengate.core.model.auth;

import java.security.Key;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * One public signing key published by the identity provider.
 *
 * @param keyId     the key identifier (kid), unique within a key set
 * @param algorithm the algorithm the key is pinned to, or {@code null} when the JWKS entry carries no alg
 * @param publicKey the verification key
 */
public record SigningKey(String keyId, String algorithm, Key publicKey) {

    public SigningKey {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Key ID cannot be null or blank");
        }
        if (publicKey == null) {
            throw new IllegalArgumentException("Public key cannot be null");
        }
        if (publicKey instanceof PrivateKey || !(publicKey instanceof PublicKey)) {
            throw new IllegalArgumentException("Signing key " + keyId + " must be a public key");
        }
        if (algorithm != null && algorithm.isBlank()) {
            algorithm = null;
        }
    }

    /**
     * Whether this key may verify a signature produced with the given algorithm.
     *
     * <p>Keys without a pinned algorithm accept any algorithm; key type compatibility is
     * enforced during signature verification.
     */
    public boolean permits(String jwsAlgorithm) {
        return algorithm == null || algorithm.equals(jwsAlgorithm);
    }
}
