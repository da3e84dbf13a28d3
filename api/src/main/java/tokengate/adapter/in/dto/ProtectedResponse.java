package tokengate.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import tokengate.core.model.auth.VerifiedClaims;

/**
 * Response body of the protected resource.
 *
 * @param message   fixed success message
 * @param timestamp current time, ISO-8601 UTC
 * @param user      caller identity claims
 * @param tokenInfo summary of the validated token
 */
public record ProtectedResponse(
        String message, String timestamp, User user, @JsonProperty("token_info") TokenInfo tokenInfo) {

    static final String NOT_AVAILABLE = "N/A";

    public static ProtectedResponse from(VerifiedClaims claims, Instant now) {
        return new ProtectedResponse(
                "Successfully accessed protected resource",
                now.toString(),
                new User(
                        claims.claimAsString("upn", NOT_AVAILABLE),
                        claims.claimAsString("name", NOT_AVAILABLE),
                        claims.claimAsString("oid", NOT_AVAILABLE)),
                new TokenInfo(
                        claims.issuer(),
                        claims.audience(),
                        claims.issuedAt().map(Instant::toString).orElse(NOT_AVAILABLE),
                        claims.expiresAt().toString()));
    }

    /**
     * Caller identity.
     */
    public record User(String upn, String name, String oid) {}

    /**
     * Token summary.
     */
    public record TokenInfo(
            String issuer,
            String audience,
            @JsonProperty("issued_at") String issuedAt,
            @JsonProperty("expires_at") String expiresAt) {}
}
