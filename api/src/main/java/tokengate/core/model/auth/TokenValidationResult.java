package tokengate.core.model.auth;

/**
 * Result of validating an incoming bearer token.
 */
public sealed interface TokenValidationResult {

    /**
     * Token passed every check.
     *
     * @param claims the verified claims
     */
    record Valid(VerifiedClaims claims) implements TokenValidationResult {
        public Valid {
            if (claims == null) {
                throw new IllegalArgumentException("Verified claims cannot be null");
            }
        }
    }

    /**
     * Token was rejected.
     *
     * @param failure the failed check
     * @param reason  description for internal logging; not meant for callers
     */
    record Invalid(ValidationFailure failure, String reason) implements TokenValidationResult {
        public Invalid {
            if (failure == null) {
                throw new IllegalArgumentException("Failure kind cannot be null");
            }
            if (reason == null || reason.isBlank()) {
                reason = failure.name();
            }
        }
    }

    static TokenValidationResult invalid(ValidationFailure failure, String reason) {
        return new Invalid(failure, reason);
    }
}
