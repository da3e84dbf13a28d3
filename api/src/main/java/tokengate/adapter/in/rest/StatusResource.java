package tokengate.adapter.in.rest;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import tokengate.adapter.in.dto.StatusResponse;
import tokengate.core.config.TokenGateConfig;

/**
 * Public status endpoint. Requires no credentials.
 */
@Path("/")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class StatusResource {

    static final String SERVICE_NAME = "jwt-backend";

    private final TokenGateConfig config;
    private final Clock clock;

    @Inject
    public StatusResource(TokenGateConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @GET
    public StatusResponse status() {
        return new StatusResponse(
                "healthy", SERVICE_NAME, clock.instant().toString(), config.tenantId(), config.clientId());
    }
}
