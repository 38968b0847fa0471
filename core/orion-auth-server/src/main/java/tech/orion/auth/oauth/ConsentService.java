package tech.orion.auth.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.orion.auth.shared.EntityType;
import tech.orion.auth.shared.TsidGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Remembers which scopes a user approved for a client.
 */
@ApplicationScoped
public class ConsentService {

    private static final Logger LOG = Logger.getLogger(ConsentService.class);

    @Inject
    ConsentRepository consentRepository;

    @Inject
    Clock clock;

    /**
     * Whether an earlier approval already covers every requested scope.
     */
    public boolean covers(String userId, String clientId, Set<String> requestedScopes) {
        return consentRepository.findByUserAndClient(userId, clientId)
                .map(consent -> consent.covers(requestedScopes))
                .orElse(false);
    }

    /**
     * Record an approval. The stored grant becomes the union of what was approved
     * before and the newly approved scopes; approvals never shrink a grant.
     * Must be called within a transaction.
     */
    public Consent grant(String userId, String clientId, Set<String> approvedScopes) {
        Instant now = clock.instant();
        Optional<Consent> existing = consentRepository.findByUserAndClient(userId, clientId);
        if (existing.isPresent()) {
            Consent consent = existing.get();
            Set<String> union = new TreeSet<>(consent.grantedScopes);
            union.addAll(approvedScopes);
            consent.grantedScopes = union;
            consent.updatedAt = now;
            consentRepository.update(consent);
            LOG.debugf("Consent for user %s and client %s extended to [%s]", userId, clientId, Scopes.format(union));
            return consent;
        }

        Consent consent = new Consent();
        consent.id = TsidGenerator.generate(EntityType.CONSENT);
        consent.userId = userId;
        consent.clientId = clientId;
        consent.grantedScopes = new TreeSet<>(approvedScopes);
        consent.grantedAt = now;
        consent.updatedAt = now;
        consentRepository.persist(consent);
        LOG.debugf("Consent for user %s and client %s recorded: [%s]", userId, clientId, Scopes.format(approvedScopes));
        return consent;
    }
}
