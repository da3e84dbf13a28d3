package tokengate.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for authentication errors.
 *
 * <p>Details never name the check that failed; the typed reason is only logged.
 */
public final class AuthProblem {

    static final String GENERIC_DETAIL = "Bearer token is missing or invalid";

    private AuthProblem() {
        // Utility class - prevent instantiation
    }

    /**
     * 401 problem used for every authentication failure, whatever check failed.
     */
    public static HttpProblem unauthorized() {
        final var status = Status.UNAUTHORIZED;
        return HttpProblem.builder()
                .withTitle(status.getReasonPhrase())
                .withStatus(status)
                .withDetail(GENERIC_DETAIL)
                .build();
    }
}
