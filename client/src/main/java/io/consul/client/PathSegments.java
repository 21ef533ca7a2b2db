package io.consul.client;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Escaping of caller-supplied values placed in request paths.
 */
final class PathSegments {

    private PathSegments() {
    }

    /**
     * Escape a single path segment such as a service name or session ID. Slashes are escaped too.
     */
    static String segment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * Escape a KV key, keeping the slashes that separate its levels.
     */
    static String key(String key) {
        StringBuilder escaped = new StringBuilder();
        String[] parts = key.split("/", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                escaped.append('/');
            }
            escaped.append(segment(parts[i]));
        }
        return escaped.toString();
    }
}
