package tech.orion.auth.oauth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Client Credentials Tests")
class ClientCredentialsTest {

    @Test
    @DisplayName("resolve should read credentials from the Basic header")
    void resolve_shouldReadBasicHeader() {
        ClientCredentials credentials = ClientCredentials.resolve(basic("backend-client", "s3cret"), null, null);

        assertThat(credentials.clientId()).isEqualTo("backend-client");
        assertThat(credentials.clientSecret()).isEqualTo("s3cret");
    }

    @Test
    @DisplayName("resolve should accept a lower-case scheme and url-encoded parts")
    void resolve_shouldDecodeUrlEncodedParts() {
        String header = "basic " + Base64.getEncoder().encodeToString(
            "my%20client:p%3Ass".getBytes(StandardCharsets.UTF_8));

        ClientCredentials credentials = ClientCredentials.resolve(header, null, null);

        assertThat(credentials.clientId()).isEqualTo("my client");
        assertThat(credentials.clientSecret()).isEqualTo("p:ss");
    }

    @Test
    @DisplayName("resolve should read credentials from the form body")
    void resolve_shouldReadFormBody() {
        ClientCredentials credentials = ClientCredentials.resolve(null, "backend-client", "s3cret");

        assertThat(credentials.clientId()).isEqualTo("backend-client");
        assertThat(credentials.clientSecret()).isEqualTo("s3cret");
    }

    @Test
    @DisplayName("resolve should allow a public client with no secret")
    void resolve_shouldAllowMissingSecret() {
        ClientCredentials credentials = ClientCredentials.resolve(null, "spa-client", "");

        assertThat(credentials.clientId()).isEqualTo("spa-client");
        assertThat(credentials.clientSecret()).isNull();
    }

    @Test
    @DisplayName("resolve should accept identical values in header and body")
    void resolve_shouldAcceptAgreeingValues() {
        ClientCredentials credentials = ClientCredentials.resolve(basic("backend-client", "s3cret"),
            "backend-client", "s3cret");

        assertThat(credentials.clientId()).isEqualTo("backend-client");
    }

    @Test
    @DisplayName("resolve should reject conflicting client ids")
    void resolve_shouldReject_whenClientIdsConflict() {
        assertThatThrownBy(() -> ClientCredentials.resolve(basic("backend-client", "s3cret"), "other-client", null))
            .isInstanceOf(OAuthException.class)
            .extracting(e -> ((OAuthException) e).error())
            .isEqualTo(OAuthError.INVALID_REQUEST);
    }

    @Test
    @DisplayName("resolve should reject conflicting secrets")
    void resolve_shouldReject_whenSecretsConflict() {
        assertThatThrownBy(() -> ClientCredentials.resolve(basic("backend-client", "s3cret"), null, "different"))
            .isInstanceOf(OAuthException.class)
            .extracting(e -> ((OAuthException) e).error())
            .isEqualTo(OAuthError.INVALID_REQUEST);
    }

    @Test
    @DisplayName("resolve should reject a Basic header that is not base64")
    void resolve_shouldReject_whenHeaderMalformed() {
        assertThatThrownBy(() -> ClientCredentials.resolve("Basic ***", null, null))
            .isInstanceOf(OAuthException.class)
            .extracting(e -> ((OAuthException) e).error())
            .isEqualTo(OAuthError.INVALID_REQUEST);
    }

    @Test
    @DisplayName("resolve should reject a Basic header without a colon")
    void resolve_shouldReject_whenHeaderHasNoColon() {
        String header = "Basic " + Base64.getEncoder().encodeToString("justid".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> ClientCredentials.resolve(header, null, null))
            .isInstanceOf(OAuthException.class);
    }

    @Test
    @DisplayName("resolve should require a client id")
    void resolve_shouldReject_whenClientIdMissing() {
        assertThatThrownBy(() -> ClientCredentials.resolve(null, null, "s3cret"))
            .isInstanceOf(OAuthException.class)
            .hasMessageContaining("client_id");
    }

    private static String basic(String id, String secret) {
        return "Basic " + Base64.getEncoder().encodeToString((id + ":" + secret).getBytes(StandardCharsets.UTF_8));
    }
}
