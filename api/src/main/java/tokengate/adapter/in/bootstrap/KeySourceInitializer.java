package tokengate.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import tokengate.core.config.TokenGateConfig;
import tokengate.core.model.auth.TrustPolicy;
import tokengate.core.port.out.KeySource;

/**
 * Validates the trust policy and warms the key cache on application startup.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>Missing tenant or client id, or an invalid trust policy: startup FAILS</li>
 *   <li>JWKS endpoint unreachable: logged; keys are fetched on the first request instead</li>
 * </ul>
 */
@ApplicationScoped
public class KeySourceInitializer {

    private static final Logger LOG = Logger.getLogger(KeySourceInitializer.class);

    private final TokenGateConfig config;
    private final TrustPolicy trustPolicy;
    private final KeySource keySource;

    @Inject
    public KeySourceInitializer(TokenGateConfig config, TrustPolicy trustPolicy, KeySource keySource) {
        this.config = config;
        this.trustPolicy = trustPolicy;
        this.keySource = keySource;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.infov(
                "Starting JWT backend for tenant {0}, client {1}, audience {2}",
                config.tenantId(), config.clientId(), trustPolicy.expectedAudience());

        if (!config.jwks().warmOnStartup()) {
            LOG.debug("JWKS warm-up disabled");
            return;
        }

        keySource
                .refresh()
                .subscribe()
                .with(
                        snapshot -> LOG.infov("JWKS warm-up loaded {0} signing keys", snapshot.size()),
                        error -> LOG.warnv(
                                "JWKS warm-up failed, keys will be fetched on demand: {0}", error.getMessage()));
    }
}
