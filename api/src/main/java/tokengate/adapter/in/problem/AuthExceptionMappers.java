package tokengate.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.UnauthorizedException;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import tokengate.adapter.in.auth.BearerTokenAuthenticationMechanism;

/**
 * Exception mappers converting authentication failures to RFC 7807 Problem Details.
 *
 * <p>Every response carries the same generic detail and a {@code WWW-Authenticate: Bearer}
 * challenge, whatever check failed.
 */
@ApplicationScoped
public class AuthExceptionMappers {

    private static final Logger LOG = Logger.getLogger(AuthExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapAuthenticationFailed(AuthenticationFailedException e) {
        LOG.debugv("Authentication failed: {0}", e.getMessage());
        return toResponse(AuthProblem.unauthorized());
    }

    @ServerExceptionMapper
    public Response mapUnauthorized(UnauthorizedException e) {
        LOG.debug("Request to protected resource without credentials");
        return toResponse(AuthProblem.unauthorized());
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .header(HttpHeaders.WWW_AUTHENTICATE, BearerTokenAuthenticationMechanism.CHALLENGE)
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
