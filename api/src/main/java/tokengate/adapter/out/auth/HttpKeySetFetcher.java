package tokengate.adapter.out.auth;

import java.net.URI;
import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.lang.JoseException;

import tokengate.core.config.TokenGateConfig;
import tokengate.core.port.out.KeySetFetcher;

/**
 * Fetches the provider's JWKS over HTTP(S) with the Vert.x web client.
 *
 * <h2>Expected Response</h2>
 * <pre>{@code
 * GET /discovery/v2.0/keys
 *
 * {
 *   "keys": [
 *     { "kty": "RSA", "use": "sig", "kid": "...", "n": "...", "e": "AQAB" }
 *   ]
 * }
 * }</pre>
 *
 * <p>The body is untrusted; anything other than a 200 with a parsable key set fails with
 * {@link KeySetFetchException}.
 */
@ApplicationScoped
public class HttpKeySetFetcher implements KeySetFetcher {

    private static final Logger LOG = Logger.getLogger(HttpKeySetFetcher.class);

    private final WebClient webClient;
    private final URI jwksUri;
    private final Duration requestTimeout;

    @Inject
    public HttpKeySetFetcher(Vertx vertx, TokenGateConfig config) {
        this(vertx, URI.create(config.jwks().uri()), config.jwks().fetchTimeout());
    }

    public HttpKeySetFetcher(Vertx vertx, URI jwksUri, Duration requestTimeout) {
        if (jwksUri.getScheme() == null || jwksUri.getHost() == null) {
            throw new IllegalArgumentException("JWKS URI must be absolute: " + jwksUri);
        }
        this.webClient = WebClient.create(vertx);
        this.jwksUri = jwksUri;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Uni<JsonWebKeySet> fetch() {
        LOG.debugv("GET {0}", jwksUri);

        return webClient
                .getAbs(jwksUri.toString())
                .ssl("https".equalsIgnoreCase(jwksUri.getScheme()))
                .timeout(requestTimeout.toMillis())
                .putHeader("Accept", "application/json")
                .send()
                .map(this::parseResponse);
    }

    @Override
    public String describe() {
        return jwksUri.toString();
    }

    private JsonWebKeySet parseResponse(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            throw new KeySetFetchException("JWKS endpoint returned status " + response.statusCode());
        }

        final String body = response.bodyAsString();
        if (body == null || body.isBlank()) {
            throw new KeySetFetchException("JWKS endpoint returned an empty body");
        }
        try {
            return new JsonWebKeySet(body);
        } catch (JoseException | ClassCastException e) {
            throw new KeySetFetchException("Failed to parse JWKS response: " + e.getMessage(), e);
        }
    }
}
