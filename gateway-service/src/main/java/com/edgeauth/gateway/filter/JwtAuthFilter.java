package com.edgeauth.gateway.filter;

import com.edgeauth.gateway.auth.AuthFailure;
import com.edgeauth.gateway.auth.AuthMode;
import com.edgeauth.gateway.auth.AuthenticatedIdentity;
import com.edgeauth.gateway.auth.AuthenticationException;
import com.edgeauth.gateway.auth.RequestAuthenticator;
import com.edgeauth.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@Component
public class JwtAuthFilter implements WebFilter, Ordered {

    static final String HEADER_USER_ID = "X-User-Id";
    static final String HEADER_USER_EMAIL = "X-User-Email";
    static final String HEADER_USER_ADMIN = "X-User-Admin";

    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    private final RequestAuthenticator authenticator;
    private final List<String> optionalPaths;
    private final HttpStatusCode keyUnavailableStatus;

    public JwtAuthFilter(RequestAuthenticator authenticator, GatewayProperties properties) {
        this.authenticator = authenticator;
        this.optionalPaths = properties.getAuth().getOptionalPaths();
        this.keyUnavailableStatus = HttpStatusCode.valueOf(properties.getAuth().getKeyUnavailableStatus());
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        String authHeader = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);

        if (resolveMode(path) == AuthMode.OPTIONAL) {
            return filterOptional(exchange, chain, authHeader);
        }

        return authenticator.authenticate(authHeader)
                .map(identity -> withIdentity(exchange, identity))
                .onErrorResume(AuthenticationException.class,
                        e -> reject(exchange, e).then(Mono.<ServerWebExchange>empty()))
                .flatMap(chain::filter);
    }

    private Mono<Void> filterOptional(ServerWebExchange exchange, WebFilterChain chain, String authHeader) {
        if (authHeader == null) {
            return chain.filter(anonymous(exchange));
        }
        return authenticator.authenticate(authHeader)
                .map(identity -> withIdentity(exchange, identity))
                .onErrorResume(AuthenticationException.class, e -> {
                    log.debug("Optional auth ignored token: failure={}, path={}",
                            e.getFailure(), exchange.getRequest().getPath().value());
                    return Mono.just(anonymous(exchange));
                })
                .flatMap(chain::filter);
    }

    @Override
    public int getOrder() {
        return -100;
    }

    AuthMode resolveMode(String path) {
        boolean optional = optionalPaths.stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
        return optional ? AuthMode.OPTIONAL : AuthMode.REQUIRED;
    }

    private ServerWebExchange withIdentity(ServerWebExchange exchange, AuthenticatedIdentity identity) {
        ServerHttpRequest mutatedRequest = exchange.getRequest().mutate()
                .headers(this::stripIdentityHeaders)
                .header(HEADER_USER_ID, identity.subjectId())
                .header(HEADER_USER_EMAIL, identity.email() == null ? "" : identity.email())
                .header(HEADER_USER_ADMIN, String.valueOf(identity.admin()))
                .build();
        ServerWebExchange mutated = exchange.mutate().request(mutatedRequest).build();
        mutated.getAttributes().put(AuthenticatedIdentity.EXCHANGE_ATTRIBUTE, identity);
        return mutated;
    }

    // clients must never be able to assert an identity themselves
    private ServerWebExchange anonymous(ServerWebExchange exchange) {
        ServerHttpRequest cleaned = exchange.getRequest().mutate()
                .headers(this::stripIdentityHeaders)
                .build();
        return exchange.mutate().request(cleaned).build();
    }

    private void stripIdentityHeaders(HttpHeaders headers) {
        headers.remove(HEADER_USER_ID);
        headers.remove(HEADER_USER_EMAIL);
        headers.remove(HEADER_USER_ADMIN);
    }

    private Mono<Void> reject(ServerWebExchange exchange, AuthenticationException e) {
        AuthFailure failure = e.getFailure();
        String path = exchange.getRequest().getPath().value();
        if (failure == AuthFailure.KEY_UNAVAILABLE) {
            log.error("Cannot authenticate request, issuer key unavailable: path={}, reason={}", path, e.getMessage());
        } else {
            log.warn("Authentication failed: failure={}, path={}, reason={}", failure, path, e.getMessage());
        }

        HttpStatusCode status = failure == AuthFailure.KEY_UNAVAILABLE
                ? keyUnavailableStatus
                : HttpStatusCode.valueOf(failure.getErrorCode().getStatus());
        return RequestUtils.writeErrorResponse(exchange, status, failure.getErrorCode());
    }
}
