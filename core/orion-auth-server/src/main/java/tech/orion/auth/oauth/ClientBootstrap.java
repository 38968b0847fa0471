package tech.orion.auth.oauth;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.orion.auth.authentication.AuthConfig;

import java.util.List;

/**
 * Registers the clients listed under {@code orion.auth.bootstrap-clients} on startup.
 * Clients that already exist are left alone, so secrets rotated since are kept.
 */
@ApplicationScoped
public class ClientBootstrap {

    private static final Logger LOG = Logger.getLogger(ClientBootstrap.class);

    @Inject
    AuthConfig authConfig;

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    OAuthClientRepository clientRepository;

    @Transactional
    void onStart(@Observes StartupEvent event) {
        List<AuthConfig.BootstrapClient> clients = authConfig.bootstrapClients().orElse(List.of());
        for (AuthConfig.BootstrapClient bootstrap : clients) {
            if (clientRepository.existsByClientId(bootstrap.clientId())) {
                LOG.debugf("Bootstrap client %s already registered", bootstrap.clientId());
                continue;
            }
            clientRegistry.register(new ClientRegistry.Registration(
                    bootstrap.clientId(),
                    bootstrap.name(),
                    bootstrap.description().orElse(null),
                    bootstrap.redirectUris(),
                    bootstrap.grantTypes(),
                    bootstrap.secret().isPresent(),
                    bootstrap.secret().orElse(null),
                    bootstrap.pkceRequired().orElse(null)));
        }
    }
}
