package com.edgeauth.common.web;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response headers both services stamp on every response. Kept free of servlet and
 * reactive types so each stack applies them with its own filter.
 */
public final class SecurityHeaders {

    public static final String STRICT_TRANSPORT_SECURITY = "Strict-Transport-Security";

    private SecurityHeaders() {
    }

    /**
     * @param serviceName value of the {@code Server} header
     * @param secure      whether to add HSTS; only meaningful when served over TLS
     */
    public static Map<String, String> forService(String serviceName, boolean secure) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Content-Type-Options", "nosniff");
        headers.put("X-Frame-Options", "DENY");
        headers.put("X-XSS-Protection", "1; mode=block");
        headers.put("Server", serviceName);
        headers.put("Content-Security-Policy", "default-src 'self'");
        headers.put("Referrer-Policy", "strict-origin-when-cross-origin");
        if (secure) {
            headers.put(STRICT_TRANSPORT_SECURITY, "max-age=31536000; includeSubDomains");
        }
        return Collections.unmodifiableMap(headers);
    }
}
