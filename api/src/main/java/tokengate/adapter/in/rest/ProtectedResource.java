package tokengate.adapter.in.rest;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;
import org.jboss.logging.Logger;

import tokengate.adapter.in.auth.BearerTokenIdentityProvider.VerifiedClaimsPrincipal;
import tokengate.adapter.in.dto.ProtectedResponse;
import tokengate.adapter.in.dto.TokenInfoResponse;
import tokengate.core.model.auth.VerifiedClaims;

/**
 * Resources protected by bearer-token authentication.
 *
 * <p>Callers without a valid token receive 401 before these methods run.
 */
@Path("/api")
@ApplicationScoped
@Authenticated
@Produces(MediaType.APPLICATION_JSON)
public class ProtectedResource {

    private static final Logger LOG = Logger.getLogger(ProtectedResource.class);

    private final SecurityIdentity identity;
    private final Clock clock;

    @Inject
    public ProtectedResource(SecurityIdentity identity, Clock clock) {
        this.identity = identity;
        this.clock = clock;
    }

    @GET
    @Path("/protected")
    public ProtectedResponse getProtected() {
        return protectedResponse();
    }

    @POST
    @Path("/protected")
    public ProtectedResponse postProtected() {
        return protectedResponse();
    }

    /**
     * Return every claim of the caller's token.
     */
    @POST
    @Path("/token-info")
    public TokenInfoResponse tokenInfo() {
        final var claims = verifiedClaims();
        LOG.infov("Token info requested by {0}", identity.getPrincipal().getName());
        return TokenInfoResponse.of(claims.claims());
    }

    private ProtectedResponse protectedResponse() {
        final var claims = verifiedClaims();
        LOG.infov("Protected endpoint accessed by {0}", identity.getPrincipal().getName());
        return ProtectedResponse.from(claims, clock.instant());
    }

    private VerifiedClaims verifiedClaims() {
        return ((VerifiedClaimsPrincipal) identity.getPrincipal()).getClaims();
    }
}
