package tokengate.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body of the public status endpoint.
 *
 * @param status    always {@code healthy} while the service answers
 * @param service   service name
 * @param timestamp current time, ISO-8601 UTC
 * @param tenantId  configured tenant
 * @param clientId  configured client (application) id
 */
public record StatusResponse(
        String status,
        String service,
        String timestamp,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("client_id") String clientId) {}
