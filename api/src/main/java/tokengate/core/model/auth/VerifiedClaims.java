package tokengate.core.model.auth;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Claims of a token that passed every signature and policy check.
 *
 * <p>Built fresh for each validation; never cached across requests.
 *
 * @param subject   the sub claim, or {@code null} when the token carries none
 * @param issuer    the accepted iss claim
 * @param audience  the aud value that matched the policy
 * @param expiresAt the exp claim
 * @param issuedAt  the iat claim, if present
 * @param claims    every claim of the payload, preserved verbatim
 */
public record VerifiedClaims(
        String subject,
        String issuer,
        String audience,
        Instant expiresAt,
        Optional<Instant> issuedAt,
        Map<String, Object> claims) {

    public VerifiedClaims {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("Issuer cannot be null or blank");
        }
        if (audience == null || audience.isBlank()) {
            throw new IllegalArgumentException("Audience cannot be null or blank");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiry cannot be null");
        }
        if (issuedAt == null) {
            issuedAt = Optional.empty();
        }
        // LinkedHashMap keeps claim order and tolerates null claim values, unlike Map.copyOf
        claims = claims == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }

    /**
     * Returns a claim value as a string, or the fallback when absent.
     */
    public String claimAsString(String name, String fallback) {
        final Object value = claims.get(name);
        return value != null ? value.toString() : fallback;
    }
}
