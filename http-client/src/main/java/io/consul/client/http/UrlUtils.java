package io.consul.client.http;

import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLConnection;
import java.net.URLEncoder;
import java.net.URLStreamHandler;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * URL helpers shared by the transport implementations.
 */
public final class UrlUtils {

    private static final URLStreamHandler URL_HANDLER = new URLStreamHandler() {
        protected URLConnection openConnection(URL u) {
            return null;
        }
    };

    private UrlUtils() {
    }

    public static URL buildUrl(String uri) {
        try {
            return new URL(null, uri, URL_HANDLER);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("URI [" + uri + "] is not valid");
        }
    }

    /**
     * Normalize a base address to {@code scheme://authority[/prefix]}, dropping any trailing slash,
     * query or fragment. A path prefix is kept so that Consul can be reached behind a reverse proxy.
     *
     * @param baseUrl the configured address
     * @return the normalized base URL
     */
    public static String normalizeBaseUrl(String baseUrl) {
        URL url = buildUrl(baseUrl);
        String path = url.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return url.getProtocol() + "://" + url.getAuthority() + path;
    }

    /**
     * Encode query parameters in iteration order. A {@code null} value produces a valueless flag.
     *
     * @param params the parameters
     * @return the encoded query string without the leading {@code ?}, empty when there are no parameters
     */
    public static String encodeQuery(Map<String, @Nullable String> params) {
        StringBuilder query = new StringBuilder();
        for (Map.Entry<String, @Nullable String> entry : params.entrySet()) {
            if (query.length() > 0) {
                query.append('&');
            }
            query.append(encode(entry.getKey()));
            if (entry.getValue() != null) {
                query.append('=').append(encode(entry.getValue()));
            }
        }
        return query.toString();
    }

    public static boolean isSecureProtocol(String protocol) {
        return "https".equalsIgnoreCase(protocol);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
