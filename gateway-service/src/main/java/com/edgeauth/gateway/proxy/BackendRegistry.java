package com.edgeauth.gateway.proxy;

import com.edgeauth.common.exception.BusinessException;
import com.edgeauth.common.response.ErrorCode;
import com.edgeauth.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Backend name to base URL, fixed at startup from {@code gateway.backends}.
 */
@Slf4j
@Component
public class BackendRegistry {

    private final Map<String, URI> backends;

    public BackendRegistry(GatewayProperties properties) {
        Map<String, URI> resolved = new LinkedHashMap<>();
        properties.getBackends().forEach((name, backend) -> resolved.put(name, toBaseUri(name, backend.getUrl())));
        this.backends = Collections.unmodifiableMap(resolved);
        log.info("Registered backends: {}", backends);
    }

    public URI resolve(String name) {
        URI uri = backends.get(name);
        if (uri == null) {
            throw new BusinessException(ErrorCode.UNKNOWN_BACKEND, "Unknown service: " + name);
        }
        return uri;
    }

    public Set<String> names() {
        return backends.keySet();
    }

    private static URI toBaseUri(String name, String url) {
        String trimmed = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        URI uri = URI.create(trimmed);
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalStateException("gateway.backends." + name + ".url must be an absolute URL: " + url);
        }
        return uri;
    }
}
