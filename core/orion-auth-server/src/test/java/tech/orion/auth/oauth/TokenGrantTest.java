package tech.orion.auth.oauth;

import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.MultivaluedMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Token Request Parsing Tests")
class TokenGrantTest {

    @Test
    @DisplayName("parse should build an authorization code grant")
    void parse_shouldBuildCodeGrant() {
        MultivaluedMap<String, String> form = form(
            "grant_type", "authorization_code",
            "code", "abc",
            "redirect_uri", "https://app.example.test/callback",
            "code_verifier", OAuthTestFixture.VERIFIER,
            "client_id", "spa-client");

        TokenGrant grant = TokenGrant.parse(form, null);

        assertThat(grant).isInstanceOf(TokenGrant.AuthorizationCodeGrant.class);
        TokenGrant.AuthorizationCodeGrant codeGrant = (TokenGrant.AuthorizationCodeGrant) grant;
        assertThat(codeGrant.code()).isEqualTo("abc");
        assertThat(codeGrant.redirectUri()).isEqualTo("https://app.example.test/callback");
        assertThat(codeGrant.codeVerifier()).isEqualTo(OAuthTestFixture.VERIFIER);
        assertThat(codeGrant.credentials().clientId()).isEqualTo("spa-client");
    }

    @Test
    @DisplayName("parse should build a refresh grant and treat a blank scope as absent")
    void parse_shouldBuildRefreshGrant() {
        MultivaluedMap<String, String> form = form(
            "grant_type", "refresh_token",
            "refresh_token", "rt",
            "scope", " ",
            "client_id", "spa-client");

        TokenGrant.RefreshTokenGrant grant = (TokenGrant.RefreshTokenGrant) TokenGrant.parse(form, null);

        assertThat(grant.refreshToken()).isEqualTo("rt");
        assertThat(grant.scope()).isNull();
    }

    @Test
    @DisplayName("parse should reject a missing grant_type")
    void parse_shouldReject_whenGrantTypeMissing() {
        assertThatThrownBy(() -> TokenGrant.parse(form("code", "abc"), null))
            .isInstanceOf(OAuthException.class)
            .extracting(e -> ((OAuthException) e).error())
            .isEqualTo(OAuthError.INVALID_REQUEST);
    }

    @Test
    @DisplayName("parse should reject grants other than code and refresh")
    void parse_shouldReject_whenGrantUnsupported() {
        assertThatThrownBy(() -> TokenGrant.parse(form("grant_type", "password", "client_id", "x"), null))
            .isInstanceOf(OAuthException.class)
            .extracting(e -> ((OAuthException) e).error())
            .isEqualTo(OAuthError.UNSUPPORTED_GRANT_TYPE);
    }

    @Test
    @DisplayName("parse should reject a missing code")
    void parse_shouldReject_whenCodeMissing() {
        assertThatThrownBy(() -> TokenGrant.parse(form("grant_type", "authorization_code", "client_id", "x"), null))
            .isInstanceOf(OAuthException.class)
            .hasMessageContaining("code");
    }

    @Test
    @DisplayName("parse should reject repeated parameters")
    void parse_shouldReject_whenParameterRepeated() {
        MultivaluedMap<String, String> form = form("grant_type", "authorization_code", "code", "a", "client_id", "x");
        form.add("code", "b");

        assertThatThrownBy(() -> TokenGrant.parse(form, null))
            .isInstanceOf(OAuthException.class)
            .extracting(e -> ((OAuthException) e).error())
            .isEqualTo(OAuthError.INVALID_REQUEST);
    }

    private static MultivaluedMap<String, String> form(String... pairs) {
        MultivaluedMap<String, String> form = new MultivaluedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            form.add(pairs[i], pairs[i + 1]);
        }
        return form;
    }
}
