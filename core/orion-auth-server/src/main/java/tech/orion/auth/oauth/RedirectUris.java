package tech.orion.auth.oauth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Builds redirect locations by appending query parameters to a base URI,
 * keeping any query the base already has. Null values are skipped.
 */
final class RedirectUris {

    static String withParams(String base, Map<String, String> params) {
        StringBuilder url = new StringBuilder(base);
        boolean hasQuery = base.indexOf('?') >= 0;
        for (Map.Entry<String, String> param : params.entrySet()) {
            if (param.getValue() == null) {
                continue;
            }
            if (!hasQuery) {
                url.append('?');
                hasQuery = true;
            } else if (url.charAt(url.length() - 1) != '?' && url.charAt(url.length() - 1) != '&') {
                url.append('&');
            }
            url.append(encode(param.getKey())).append('=').append(encode(param.getValue()));
        }
        return url.toString();
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private RedirectUris() {
    }
}
