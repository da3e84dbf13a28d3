package tokengate.core.service.auth;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.lang.JoseException;

import tokengate.core.model.auth.KeyLookupResult;
import tokengate.core.model.auth.SigningKey;
import tokengate.core.model.auth.TokenValidationResult;
import tokengate.core.model.auth.TrustPolicy;
import tokengate.core.model.auth.ValidationFailure;
import tokengate.core.model.auth.VerifiedClaims;
import tokengate.core.port.out.KeySource;
import tokengate.core.port.out.ValidationMetrics;

/**
 * Validates bearer tokens against the {@link TrustPolicy}.
 *
 * <p>Checks run in a fixed order and the first failure is final:
 * <ol>
 *   <li>structure ({@link ValidationFailure#MALFORMED})</li>
 *   <li>algorithm allow-list, never {@code none} ({@link ValidationFailure#ALGORITHM_REJECTED})</li>
 *   <li>key lookup by kid ({@link ValidationFailure#KEY_UNRESOLVABLE})</li>
 *   <li>signature ({@link ValidationFailure#SIGNATURE_INVALID})</li>
 *   <li>issuer, audience, then iat/nbf/exp with clock skew</li>
 * </ol>
 *
 * <p>Claim content is only inspected after the signature has been verified.
 *
 * <p>Stateless apart from the shared {@link KeySource}; safe for concurrent use.
 */
@ApplicationScoped
public class TokenValidator {

    private static final Logger LOG = Logger.getLogger(TokenValidator.class);

    private final TrustPolicy policy;
    private final KeySource keySource;
    private final Clock clock;
    private final ValidationMetrics metrics;

    @Inject
    public TokenValidator(TrustPolicy policy, KeySource keySource, Clock clock, ValidationMetrics metrics) {
        this.policy = policy;
        this.keySource = keySource;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Validate a raw bearer token (without the "Bearer " prefix).
     *
     * @param token the compact JWS
     * @return the verified claims or the reason for rejection; never a failed {@link Uni}
     */
    public Uni<TokenValidationResult> validate(String token) {
        return Uni.createFrom()
                .deferred(() -> validateParsed(token))
                .invoke(metrics::recordValidation)
                .invoke(this::logOutcome);
    }

    private Uni<TokenValidationResult> validateParsed(String token) {
        final ParsedToken parsed;
        try {
            parsed = ParsedToken.parse(token);
        } catch (ParsedToken.MalformedTokenException e) {
            return reject(ValidationFailure.MALFORMED, e.getMessage());
        }

        final var algorithm = parsed.algorithm();
        if (algorithm == null || TrustPolicy.isUnsigned(algorithm)) {
            return reject(ValidationFailure.ALGORITHM_REJECTED, "Unsigned tokens are never accepted");
        }
        if (!policy.allowsAlgorithm(algorithm)) {
            return reject(ValidationFailure.ALGORITHM_REJECTED, "Algorithm " + algorithm + " is not allowed");
        }

        final var keyId = parsed.keyId();
        if (keyId == null || keyId.isBlank()) {
            return reject(ValidationFailure.KEY_UNRESOLVABLE, "Token header carries no kid");
        }

        return keySource
                .getKey(keyId)
                .onFailure()
                .recoverWithItem(error -> new KeyLookupResult.Unavailable(error.getMessage()))
                .map(lookup -> verifyWith(parsed, lookup));
    }

    private TokenValidationResult verifyWith(ParsedToken parsed, KeyLookupResult lookup) {
        if (lookup instanceof KeyLookupResult.NotFound notFound) {
            return invalid(ValidationFailure.KEY_UNRESOLVABLE, "No signing key with kid " + notFound.keyId());
        } else if (lookup instanceof KeyLookupResult.Unavailable unavailable) {
            return invalid(ValidationFailure.KEY_UNRESOLVABLE, "Key source unavailable: " + unavailable.reason());
        }

        final SigningKey key = ((KeyLookupResult.Found) lookup).key();
        if (!key.permits(parsed.algorithm())) {
            return invalid(
                    ValidationFailure.KEY_UNRESOLVABLE,
                    "Key " + key.keyId() + " is pinned to " + key.algorithm() + ", token uses " + parsed.algorithm());
        }

        if (!signatureVerifies(parsed, key)) {
            return invalid(ValidationFailure.SIGNATURE_INVALID, "Signature does not verify with key " + key.keyId());
        }

        return checkClaims(parsed);
    }

    private boolean signatureVerifies(ParsedToken parsed, SigningKey key) {
        final var jws = parsed.jws();
        jws.setAlgorithmConstraints(new AlgorithmConstraints(ConstraintType.PERMIT, parsed.algorithm()));
        jws.setKey(key.publicKey());
        try {
            return jws.verifySignature();
        } catch (JoseException e) {
            LOG.debugv("Signature verification error with key {0}: {1}", key.keyId(), e.getMessage());
            return false;
        }
    }

    private TokenValidationResult checkClaims(ParsedToken parsed) {
        if (!policy.acceptsIssuer(parsed.issuer())) {
            return invalid(ValidationFailure.ISSUER_REJECTED, "Issuer " + parsed.issuer() + " is not trusted");
        }

        final var audience = parsed.audiences().stream()
                .filter(policy.expectedAudience()::equals)
                .findFirst();
        if (audience.isEmpty()) {
            return invalid(ValidationFailure.AUDIENCE_REJECTED, "Audience " + parsed.audiences() + " does not match");
        }

        final var now = clock.instant();
        final var skew = policy.clockSkewTolerance();
        final var latestAcceptable = now.plus(skew);

        if (parsed.issuedAt() != null && latestAcceptable.isBefore(parsed.issuedAt())) {
            return invalid(ValidationFailure.NOT_YET_VALID, "Token issued in the future at " + parsed.issuedAt());
        }
        if (parsed.notBefore() != null && latestAcceptable.isBefore(parsed.notBefore())) {
            return invalid(ValidationFailure.NOT_YET_VALID, "Token not valid before " + parsed.notBefore());
        }
        if (parsed.expiresAt() == null) {
            return invalid(ValidationFailure.EXPIRED, "Token carries no exp claim");
        }
        if (now.minus(skew).isAfter(parsed.expiresAt())) {
            return invalid(ValidationFailure.EXPIRED, "Token expired at " + parsed.expiresAt());
        }

        return new TokenValidationResult.Valid(new VerifiedClaims(
                parsed.subject(),
                parsed.issuer(),
                audience.get(),
                parsed.expiresAt(),
                Optional.ofNullable(parsed.issuedAt()),
                parsed.claims()));
    }

    private void logOutcome(TokenValidationResult result) {
        if (result instanceof TokenValidationResult.Valid valid) {
            LOG.debugv(
                    "Token accepted: subject={0}, issuer={1}",
                    valid.claims().subject(), valid.claims().issuer());
        } else if (result instanceof TokenValidationResult.Invalid invalid) {
            LOG.debugv("Token rejected: failure={0}, reason={1}", invalid.failure(), invalid.reason());
        }
    }

    private static Uni<TokenValidationResult> reject(ValidationFailure failure, String reason) {
        return Uni.createFrom().item(invalid(failure, reason));
    }

    private static TokenValidationResult invalid(ValidationFailure failure, String reason) {
        return TokenValidationResult.invalid(failure, reason);
    }
}
