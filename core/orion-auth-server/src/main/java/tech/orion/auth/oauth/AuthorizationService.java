package tech.orion.auth.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.orion.auth.authentication.AuthConfig;
import tech.orion.auth.authentication.AuthenticatedUser;
import tech.orion.auth.shared.EntityType;
import tech.orion.auth.shared.TsidGenerator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The authorization endpoint's state machine:
 * validate the request, authenticate the user, obtain consent, issue a code, redirect.
 *
 * <p>Validation failures that happen before the redirect URI is trusted are thrown
 * as {@link OAuthException} and rendered directly. Everything after is delivered to
 * the client as an error redirect. The consent step is a continuation: the validated
 * request is persisted as a {@link PendingAuthorization} and resumed by
 * {@link #decideConsent(String, AuthenticatedUser, boolean)}.
 */
@ApplicationScoped
public class AuthorizationService {

    private static final Logger LOG = Logger.getLogger(AuthorizationService.class);
    private static final Duration MAX_CODE_LIFETIME = Duration.ofSeconds(60);

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    ConsentService consentService;

    @Inject
    PkceService pkceService;

    @Inject
    AuthorizationCodeRepository codeRepository;

    @Inject
    PendingAuthorizationRepository pendingRepository;

    @Inject
    AuthConfig config;

    @Inject
    Clock clock;

    /**
     * What the consent UI needs to render a prompt.
     */
    public record ConsentPrompt(PendingAuthorization request, OAuthClient client) {
    }

    /**
     * Run an authorization request as far as it can go without user interaction.
     *
     * @throws OAuthException for failures that must not be redirected
     */
    @Transactional
    public AuthorizationOutcome authorize(AuthorizationRequest request, Optional<AuthenticatedUser> user) {
        OAuthClient client = validate(request);

        if (!client.isGrantTypeAllowed(OAuthClient.GRANT_AUTHORIZATION_CODE)) {
            return errorRedirect(request.redirectUri(), OAuthError.UNAUTHORIZED_CLIENT,
                    "Client is not allowed to use the authorization code grant", request.state());
        }

        Set<String> scopes = Scopes.parse(request.scope());
        Optional<String> unsupported = scopes.stream()
                .filter(scope -> !config.supportedScopes().contains(scope))
                .findFirst();
        if (unsupported.isPresent()) {
            return errorRedirect(request.redirectUri(), OAuthError.INVALID_SCOPE,
                    "Unsupported scope: " + unsupported.get(), request.state());
        }

        if (user.isEmpty()) {
            return new AuthorizationOutcome.LoginRequired();
        }
        AuthenticatedUser authenticated = user.get();

        if (consentService.covers(authenticated.userId(), client.clientId, scopes)) {
            String code = issueCode(client.clientId, authenticated, request.redirectUri(), Scopes.format(scopes),
                    request.state(), request.codeChallenge(), request.codeChallengeMethod(), request.nonce());
            return codeRedirect(request.redirectUri(), code, request.state());
        }

        PendingAuthorization pending = park(client.clientId, authenticated.userId(), request, scopes);
        return new AuthorizationOutcome.ConsentRequired(pending.id);
    }

    /**
     * Deliver an unexpected failure of {@link #authorize} to the client as
     * {@code error=server_error}. Runs outside the failed transaction, so it also covers
     * failures at commit. A request whose redirect URI cannot be trusted gets a direct error.
     *
     * @throws OAuthException server_error when the request does not validate
     */
    public AuthorizationOutcome.Redirect serverErrorRedirect(AuthorizationRequest request, RuntimeException cause) {
        try {
            validate(request);
        } catch (RuntimeException e) {
            throw new OAuthException(OAuthError.SERVER_ERROR, "Authorization failed", cause);
        }
        LOG.errorf(cause, "Authorization request for client %s failed", request.clientId());
        return errorRedirect(request.redirectUri(), OAuthError.SERVER_ERROR, "Authorization failed", request.state());
    }

    /**
     * Checks that must pass before anything is sent to the redirect URI.
     */
    OAuthClient validate(AuthorizationRequest request) {
        if (request.clientId() == null || request.clientId().isBlank()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "client_id is required");
        }
        OAuthClient client = clientRegistry.lookup(request.clientId())
                .orElseThrow(() -> new OAuthException(OAuthError.INVALID_REQUEST, "Unknown client"));

        if (request.redirectUri() == null || request.redirectUri().isBlank()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "redirect_uri is required");
        }
        if (!clientRegistry.isRedirectUriRegistered(client, request.redirectUri())) {
            LOG.warnf("Authorization request for client %s with unregistered redirect_uri %s",
                    client.clientId, request.redirectUri());
            throw new OAuthException(OAuthError.INVALID_REQUEST, "redirect_uri is not registered for this client");
        }

        if (!"code".equals(request.responseType())) {
            throw new OAuthException(OAuthError.UNSUPPORTED_RESPONSE_TYPE, "Only response_type=code is supported");
        }

        boolean challengePresent = request.codeChallenge() != null && !request.codeChallenge().isBlank();
        if (client.requiresPkce() && !challengePresent) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "code_challenge is required for this client");
        }
        if (challengePresent) {
            if (!pkceService.isSupportedMethod(request.codeChallengeMethod())) {
                throw new OAuthException(OAuthError.INVALID_REQUEST, "code_challenge_method must be S256");
            }
            if (!pkceService.isValidCodeChallenge(request.codeChallenge())) {
                throw new OAuthException(OAuthError.INVALID_REQUEST, "code_challenge is malformed");
            }
        } else if (request.codeChallengeMethod() != null && !request.codeChallengeMethod().isBlank()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "code_challenge_method without code_challenge");
        }
        return client;
    }

    /**
     * Look up a parked request for the consent UI.
     *
     * @throws OAuthException invalid_request if unknown or expired, access_denied if it
     *                        belongs to another user
     */
    public ConsentPrompt describeConsent(String requestId, AuthenticatedUser user) {
        PendingAuthorization pending = loadPending(requestId, user);
        OAuthClient client = clientRegistry.lookup(pending.clientId)
                .orElseThrow(() -> new OAuthException(OAuthError.INVALID_REQUEST, "Client is no longer available"));
        return new ConsentPrompt(pending, client);
    }

    /**
     * Resume a parked request with the user's decision. Each request can be decided once.
     *
     * @return the URL the browser should follow: the client's redirect URI with a code,
     *         or with {@code error=access_denied}
     */
    @Transactional(dontRollbackOn = OAuthException.class)
    public String decideConsent(String requestId, AuthenticatedUser user, boolean approved) {
        PendingAuthorization pending = loadPending(requestId, user);
        if (!pendingRepository.consume(pending.id)) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "Authorization request was already decided");
        }

        OAuthClient client = clientRegistry.lookup(pending.clientId).orElse(null);
        if (client == null || !client.isRedirectUriAllowed(pending.redirectUri)) {
            // The client changed while the user was deciding; its redirect URI is no longer trusted
            throw new OAuthException(OAuthError.INVALID_REQUEST, "Client is no longer available");
        }

        if (!approved) {
            LOG.infof("User %s denied consent for client %s", user.userId(), pending.clientId);
            return errorRedirect(pending.redirectUri, OAuthError.ACCESS_DENIED,
                    "The user denied the request", pending.state).location();
        }

        consentService.grant(user.userId(), pending.clientId, pending.scopes());
        String code = issueCode(pending.clientId, user, pending.redirectUri, pending.scope, pending.state,
                pending.codeChallenge, pending.codeChallengeMethod, pending.nonce);
        LOG.infof("User %s granted [%s] to client %s", user.userId(), pending.scope, pending.clientId);
        return codeRedirect(pending.redirectUri, code, pending.state).location();
    }

    private PendingAuthorization loadPending(String requestId, AuthenticatedUser user) {
        if (requestId == null || requestId.isBlank()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "request_id is required");
        }
        PendingAuthorization pending = pendingRepository.findPending(requestId)
                .filter(found -> !found.isExpired(clock.instant()))
                .orElseThrow(() -> new OAuthException(OAuthError.INVALID_REQUEST,
                        "Unknown or expired authorization request"));
        if (!pending.userId.equals(user.userId())) {
            LOG.warnf("SECURITY: user %s tried to decide authorization request %s of user %s",
                    user.userId(), requestId, pending.userId);
            throw new OAuthException(OAuthError.ACCESS_DENIED, "Authorization request belongs to another user");
        }
        return pending;
    }

    private PendingAuthorization park(String clientId, String userId, AuthorizationRequest request, Set<String> scopes) {
        Instant now = clock.instant();
        PendingAuthorization pending = new PendingAuthorization();
        pending.id = TsidGenerator.generate(EntityType.PENDING_AUTHORIZATION);
        pending.userId = userId;
        pending.clientId = clientId;
        pending.redirectUri = request.redirectUri();
        pending.scope = Scopes.format(scopes);
        pending.state = request.state();
        pending.codeChallenge = blankToNull(request.codeChallenge());
        pending.codeChallengeMethod = pending.codeChallenge != null ? request.codeChallengeMethod() : null;
        pending.nonce = blankToNull(request.nonce());
        pending.createdAt = now;
        pending.expiresAt = now.plus(config.pendingRequestExpiry());
        pendingRepository.persist(pending);
        LOG.debugf("Authorization request %s for client %s awaits consent of user %s", pending.id, clientId, userId);
        return pending;
    }

    private String issueCode(String clientId, AuthenticatedUser user, String redirectUri, String scope, String state,
                             String codeChallenge, String codeChallengeMethod, String nonce) {
        String code = SecureTokens.generate();
        Instant now = clock.instant();

        AuthorizationCode authCode = new AuthorizationCode();
        authCode.id = TsidGenerator.generate(EntityType.AUTH_CODE);
        authCode.codeHash = SecureTokens.hash(code);
        authCode.clientId = clientId;
        authCode.userId = user.userId();
        authCode.redirectUri = redirectUri;
        authCode.scope = scope;
        authCode.codeChallenge = blankToNull(codeChallenge);
        authCode.codeChallengeMethod = authCode.codeChallenge != null ? codeChallengeMethod : null;
        authCode.nonce = blankToNull(nonce);
        authCode.state = state;
        authCode.authTime = user.authTime();
        authCode.createdAt = now;
        authCode.expiresAt = now.plus(codeLifetime());
        authCode.consumed = false;
        codeRepository.persist(authCode);

        LOG.debugf("Issued authorization code %s for client %s and user %s", authCode.id, clientId, user.userId());
        return code;
    }

    Duration codeLifetime() {
        Duration configured = config.jwt().authorizationCodeExpiry();
        return configured.compareTo(MAX_CODE_LIFETIME) > 0 ? MAX_CODE_LIFETIME : configured;
    }

    private static AuthorizationOutcome.Redirect codeRedirect(String redirectUri, String code, String state) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("code", code);
        params.put("state", state);
        return new AuthorizationOutcome.Redirect(RedirectUris.withParams(redirectUri, params));
    }

    private static AuthorizationOutcome.Redirect errorRedirect(String redirectUri, OAuthError error, String description, String state) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("error", error.code());
        params.put("error_description", description);
        params.put("state", state);
        return new AuthorizationOutcome.Redirect(RedirectUris.withParams(redirectUri, params));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
