package tokengate.adapter.in.auth;

import java.security.Principal;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.identity.AuthenticationRequestContext;
import io.quarkus.security.identity.IdentityProvider;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tokengate.core.model.auth.TokenValidationResult;
import tokengate.core.model.auth.VerifiedClaims;
import tokengate.core.service.auth.TokenValidator;

/**
 * Quarkus identity provider that turns a validated bearer token into a {@link SecurityIdentity}.
 *
 * <p>The resulting identity contains:
 * <ul>
 *   <li>Principal: a {@link VerifiedClaimsPrincipal} named after the subject</li>
 *   <li>Attributes: {@code claims} holding the {@link VerifiedClaims}</li>
 * </ul>
 *
 * <p>Rejections are logged with their failure kind and fail with a plain
 * {@link AuthenticationFailedException}, so responses stay generic.
 */
@ApplicationScoped
public class BearerTokenIdentityProvider implements IdentityProvider<BearerTokenAuthenticationRequest> {

    private static final Logger LOG = Logger.getLogger(BearerTokenIdentityProvider.class);

    static final String CLAIMS_ATTRIBUTE = "claims";

    private final TokenValidator tokenValidator;

    @Inject
    public BearerTokenIdentityProvider(TokenValidator tokenValidator) {
        this.tokenValidator = tokenValidator;
    }

    @Override
    public Class<BearerTokenAuthenticationRequest> getRequestType() {
        return BearerTokenAuthenticationRequest.class;
    }

    @Override
    public Uni<SecurityIdentity> authenticate(
            BearerTokenAuthenticationRequest request, AuthenticationRequestContext context) {
        return tokenValidator.validate(request.getToken()).flatMap(result -> {
            if (result instanceof TokenValidationResult.Valid valid) {
                return Uni.createFrom().item(buildIdentity(valid.claims()));
            }
            final var invalid = (TokenValidationResult.Invalid) result;
            LOG.infov("Bearer token rejected ({0}): {1}", invalid.failure(), invalid.reason());
            return Uni.createFrom().failure(new AuthenticationFailedException(invalid.reason()));
        });
    }

    private SecurityIdentity buildIdentity(VerifiedClaims claims) {
        LOG.debugv("Authenticated subject={0}, issuer={1}", claims.subject(), claims.issuer());
        return QuarkusSecurityIdentity.builder()
                .setPrincipal(new VerifiedClaimsPrincipal(claims))
                .addAttribute(CLAIMS_ATTRIBUTE, claims)
                .build();
    }

    /**
     * Principal backed by the verified claims of the presented token.
     */
    public static class VerifiedClaimsPrincipal implements Principal {
        private final VerifiedClaims claims;

        public VerifiedClaimsPrincipal(VerifiedClaims claims) {
            this.claims = claims;
        }

        @Override
        public String getName() {
            // Use upn when present, else subject, else object id
            final Object upn = claims.claims().get("upn");
            if (upn != null) {
                return upn.toString();
            }
            return claims.subject() != null ? claims.subject() : claims.claimAsString("oid", "anonymous");
        }

        public VerifiedClaims getClaims() {
            return claims;
        }
    }
}
