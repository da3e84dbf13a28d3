package tokengate.core.model.auth;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import org.jose4j.jws.AlgorithmIdentifiers;

/**
 * Operator-supplied rules a bearer token must satisfy.
 *
 * <p>Issuers are matched exactly. A tenant that publishes tokens under more than one issuer
 * URL (for example a v1 and a v2 endpoint) must list every accepted variant.
 *
 * @param expectedIssuers    accepted iss values
 * @param expectedAudience   required aud value
 * @param allowedAlgorithms  accepted JWS algorithms; asymmetric only, never {@code none}
 * @param clockSkewTolerance tolerance applied to exp, nbf and iat
 */
public record TrustPolicy(
        Set<String> expectedIssuers,
        String expectedAudience,
        Set<String> allowedAlgorithms,
        Duration clockSkewTolerance) {

    /**
     * Algorithms that verify with a public key.
     */
    public static final Set<String> SUPPORTED_ALGORITHMS = Set.of(
            AlgorithmIdentifiers.RSA_USING_SHA256,
            AlgorithmIdentifiers.RSA_USING_SHA384,
            AlgorithmIdentifiers.RSA_USING_SHA512,
            AlgorithmIdentifiers.RSA_PSS_USING_SHA256,
            AlgorithmIdentifiers.RSA_PSS_USING_SHA384,
            AlgorithmIdentifiers.RSA_PSS_USING_SHA512,
            AlgorithmIdentifiers.ECDSA_USING_P256_CURVE_AND_SHA256,
            AlgorithmIdentifiers.ECDSA_USING_P384_CURVE_AND_SHA384,
            AlgorithmIdentifiers.ECDSA_USING_P521_CURVE_AND_SHA512);

    public TrustPolicy {
        if (expectedIssuers == null || expectedIssuers.isEmpty()) {
            throw new IllegalArgumentException("At least one expected issuer is required");
        }
        if (expectedIssuers.stream().anyMatch(issuer -> issuer == null || issuer.isBlank())) {
            throw new IllegalArgumentException("Expected issuers cannot contain blank values");
        }
        if (expectedAudience == null || expectedAudience.isBlank()) {
            throw new IllegalArgumentException("Expected audience cannot be null or blank");
        }
        if (allowedAlgorithms == null || allowedAlgorithms.isEmpty()) {
            throw new IllegalArgumentException("At least one allowed algorithm is required");
        }
        for (String algorithm : allowedAlgorithms) {
            if (isUnsigned(algorithm)) {
                throw new IllegalArgumentException("The unsigned algorithm 'none' can never be allowed");
            }
            if (!SUPPORTED_ALGORITHMS.contains(algorithm)) {
                throw new IllegalArgumentException("Unsupported signature algorithm: " + algorithm);
            }
        }
        if (clockSkewTolerance == null) {
            clockSkewTolerance = Duration.ZERO;
        }
        if (clockSkewTolerance.isNegative()) {
            throw new IllegalArgumentException("Clock skew tolerance cannot be negative");
        }
        expectedIssuers = Set.copyOf(expectedIssuers);
        allowedAlgorithms = Set.copyOf(allowedAlgorithms);
    }

    /**
     * Whether the algorithm is the unsigned JWS algorithm, in any letter case.
     */
    public static boolean isUnsigned(String algorithm) {
        return algorithm != null
                && AlgorithmIdentifiers.NONE.equals(algorithm.trim().toLowerCase(Locale.ROOT));
    }

    public boolean allowsAlgorithm(String algorithm) {
        return algorithm != null && !isUnsigned(algorithm) && allowedAlgorithms.contains(algorithm);
    }

    public boolean acceptsIssuer(String issuer) {
        return issuer != null && expectedIssuers.contains(issuer);
    }

    public static Builder builder(String expectedAudience) {
        return new Builder(expectedAudience);
    }

    public static class Builder {
        private final String expectedAudience;
        private final Set<String> expectedIssuers = new LinkedHashSet<>();
        private Set<String> allowedAlgorithms = Set.of(AlgorithmIdentifiers.RSA_USING_SHA256);
        private Duration clockSkewTolerance = Duration.ofSeconds(30);

        private Builder(String expectedAudience) {
            this.expectedAudience = expectedAudience;
        }

        public Builder issuer(String issuer) {
            this.expectedIssuers.add(issuer);
            return this;
        }

        public Builder issuers(Set<String> issuers) {
            this.expectedIssuers.addAll(issuers);
            return this;
        }

        public Builder allowedAlgorithms(Set<String> algorithms) {
            this.allowedAlgorithms = algorithms;
            return this;
        }

        public Builder clockSkewTolerance(Duration tolerance) {
            this.clockSkewTolerance = tolerance;
            return this;
        }

        public TrustPolicy build() {
            return new TrustPolicy(expectedIssuers, expectedAudience, allowedAlgorithms, clockSkewTolerance);
        }
    }
}
