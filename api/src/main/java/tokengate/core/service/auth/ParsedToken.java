package tokengate.core.service.auth;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.ReservedClaimNames;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwx.HeaderParameterNames;
import org.jose4j.lang.JoseException;

/**
 * Structural view of a compact JWS bearer token.
 *
 * <p>Nothing in here is trusted until the signature has been verified.
 */
record ParsedToken(
        JsonWebSignature jws,
        String algorithm,
        String keyId,
        Map<String, Object> claims,
        String issuer,
        String subject,
        List<String> audiences,
        Instant expiresAt,
        Instant notBefore,
        Instant issuedAt) {

    private static final int COMPACT_SEGMENTS = 3;

    /**
     * Parse a compact token.
     *
     * <p>A two-segment token is read as an unsecured JWS whose empty signature segment was
     * dropped; it is rejected later by the algorithm check.
     *
     * @throws MalformedTokenException if the token is not a compact JWS carrying a JSON claim set
     */
    static ParsedToken parse(String token) {
        if (token == null || token.isBlank()) {
            throw new MalformedTokenException("Token is empty");
        }

        var compact = token.trim();
        final int segments = countSegments(compact);
        if (segments == COMPACT_SEGMENTS - 1) {
            compact = compact + ".";
        } else if (segments != COMPACT_SEGMENTS) {
            throw new MalformedTokenException("Expected 3 token segments but found " + segments);
        }

        final var jws = new JsonWebSignature();
        final JwtClaims claims;
        try {
            jws.setCompactSerialization(compact);
            claims = JwtClaims.parse(jws.getUnverifiedPayload());
        } catch (JoseException | InvalidJwtException | IllegalArgumentException | ClassCastException e) {
            throw new MalformedTokenException("Token does not parse: " + e.getMessage(), e);
        }

        try {
            final var audiences = claims.hasAudience() ? claims.getAudience() : List.<String>of();
            return new ParsedToken(
                    jws,
                    stringHeader(jws, HeaderParameterNames.ALGORITHM),
                    stringHeader(jws, HeaderParameterNames.KEY_ID),
                    claims.getClaimsMap(),
                    claims.getIssuer(),
                    claims.getSubject(),
                    audiences == null ? List.of() : List.copyOf(audiences),
                    timeClaim(claims, ReservedClaimNames.EXPIRATION_TIME),
                    timeClaim(claims, ReservedClaimNames.NOT_BEFORE),
                    timeClaim(claims, ReservedClaimNames.ISSUED_AT));
        } catch (MalformedClaimException e) {
            throw new MalformedTokenException("Malformed claim: " + e.getMessage(), e);
        }
    }

    private static String stringHeader(JsonWebSignature jws, String name) {
        final Object value = jws.getHeaders().getObjectHeaderValue(name);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new MalformedTokenException("Header " + name + " is not a string");
    }

    private static int countSegments(String compact) {
        int segments = 1;
        for (int i = 0; i < compact.length(); i++) {
            if (compact.charAt(i) == '.') {
                segments++;
            }
        }
        return segments;
    }

    /**
     * Read a NumericDate claim, keeping any fractional seconds.
     */
    private static Instant timeClaim(JwtClaims claims, String name) {
        final Object value = claims.getClaimValue(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number)) {
            throw new MalformedTokenException("Claim " + name + " is not a NumericDate");
        }
        try {
            final var seconds = new BigDecimal(number.toString());
            final var whole = seconds.setScale(0, RoundingMode.FLOOR);
            final long nanos = seconds.subtract(whole)
                    .movePointRight(9)
                    .setScale(0, RoundingMode.FLOOR)
                    .longValueExact();
            return Instant.ofEpochSecond(whole.longValueExact(), nanos);
        } catch (ArithmeticException | NumberFormatException | DateTimeException e) {
            throw new MalformedTokenException("Claim " + name + " is out of range", e);
        }
    }

    /**
     * Thrown when a token fails structural parsing.
     */
    static class MalformedTokenException extends RuntimeException {
        MalformedTokenException(String message) {
            super(message);
        }

        MalformedTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
