package tokengate.core.model.auth;

/**
 * Reasons a bearer token is rejected. Every kind is terminal for the validation call.
 */
public enum ValidationFailure {

    /** The token does not parse as a compact JWS with a JSON claim set. */
    MALFORMED,

    /** The declared algorithm is not allowed, or is the unsigned algorithm. */
    ALGORITHM_REJECTED,

    /** No usable key matches the token's key ID, or the key source could not be reached. */
    KEY_UNRESOLVABLE,

    /** The signature does not verify. */
    SIGNATURE_INVALID,

    ISSUER_REJECTED,

    AUDIENCE_REJECTED,

    EXPIRED,

    NOT_YET_VALID
}
