package tech.orion.auth.oauth;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;

/**
 * Deletes expired authorization codes, parked consent requests and refresh tokens.
 * Housekeeping only: every lookup checks expiry on its own.
 */
@ApplicationScoped
public class ExpiredRecordSweeper {

    private static final Logger LOG = Logger.getLogger(ExpiredRecordSweeper.class);

    @Inject
    AuthorizationCodeRepository codeRepository;

    @Inject
    PendingAuthorizationRepository pendingRepository;

    @Inject
    RefreshTokenRepository refreshTokenRepository;

    @Inject
    Clock clock;

    @Scheduled(every = "${orion.auth.sweep-interval:15m}", identity = "oauth-expired-record-sweeper",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    @Transactional
    void sweep() {
        Instant now = clock.instant();
        long codes = codeRepository.deleteExpired(now);
        long pending = pendingRepository.deleteExpired(now);
        long refreshTokens = refreshTokenRepository.deleteExpired(now);
        if (codes + pending + refreshTokens > 0) {
            LOG.infof("Swept %d authorization codes, %d pending authorizations, %d refresh tokens",
                    codes, pending, refreshTokens);
        }
    }
}
