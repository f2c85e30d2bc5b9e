package com.edgeauth.gateway.filter;

import com.edgeauth.common.web.SecurityHeaders;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Stamps security headers on every response, auth rejections included. Applied just
 * before commit so they replace whatever a proxied backend sent.
 */
@Component
public class SecurityHeadersFilter implements WebFilter, Ordered {

    private final Map<String, String> plainHeaders;
    private final Map<String, String> secureHeaders;
    private final boolean tlsTerminatedUpstream;

    public SecurityHeadersFilter(
            @Value("${spring.application.name}") String serviceName,
            @Value("${security.enable-tls:false}") boolean tlsTerminatedUpstream) {
        this.plainHeaders = SecurityHeaders.forService(serviceName, false);
        this.secureHeaders = SecurityHeaders.forService(serviceName, true);
        this.tlsTerminatedUpstream = tlsTerminatedUpstream;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        boolean secure = tlsTerminatedUpstream || exchange.getRequest().getSslInfo() != null;
        Map<String, String> headers = secure ? secureHeaders : plainHeaders;
        exchange.getResponse().beforeCommit(() -> {
            HttpHeaders responseHeaders = exchange.getResponse().getHeaders();
            headers.forEach(responseHeaders::set);
            return Mono.empty();
        });
        return chain.filter(exchange);
    }

    // registered ahead of JwtAuthFilter so rejections carry the headers too
    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }
}
