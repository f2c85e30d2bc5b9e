package com.edgeauth.gateway.proxy;

import com.edgeauth.common.exception.BusinessException;
import com.edgeauth.common.response.ErrorCode;
import com.edgeauth.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Relays a request to a named backend and the backend's response back, byte for byte.
 *
 * <p>Only transport failures (connect errors, timeouts) are retried. Any HTTP
 * status the backend produces, 5xx included, is a response and goes back as is.
 */
@Slf4j
@Component
public class ProxyForwarder {

    // RFC 7230 hop-by-hop headers plus ones the client connection recomputes
    private static final Set<String> EXCLUDED_HEADERS = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
            "te", "trailer", "transfer-encoding", "upgrade", "host", "content-length");

    private final BackendRegistry backendRegistry;
    private final WebClient webClient;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration retryDelay;

    public ProxyForwarder(BackendRegistry backendRegistry, GatewayProperties properties,
                          WebClient.Builder webClientBuilder) {
        this.backendRegistry = backendRegistry;
        this.webClient = webClientBuilder.build();
        this.timeout = properties.getProxy().getTimeout();
        this.maxRetries = properties.getProxy().getMaxRetries();
        this.retryDelay = properties.getProxy().getRetryDelay();
    }

    public Mono<ResponseEntity<byte[]>> forward(String backendName, ServerHttpRequest request, byte[] body) {
        URI target;
        try {
            target = targetUri(backendRegistry.resolve(backendName), request);
        } catch (BusinessException e) {
            return Mono.error(e);
        } catch (IllegalArgumentException e) {
            log.error("Failed to create proxy request: backend={}, path={}", backendName, request.getPath(), e);
            return Mono.error(new BusinessException(ErrorCode.INTERNAL_PROXY_ERROR,
                    ErrorCode.INTERNAL_PROXY_ERROR.getMessage(), e));
        }

        log.debug("Proxying request: backend={}, method={}, target={}", backendName, request.getMethod(), target);

        WebClient.RequestBodySpec requestSpec = webClient.method(request.getMethod())
                .uri(target)
                .headers(headers -> copyHeaders(request.getHeaders(), headers));
        WebClient.RequestHeadersSpec<?> outbound = body.length > 0 ? requestSpec.bodyValue(body) : requestSpec;

        return outbound
                .exchangeToMono(response -> response.toEntity(byte[].class))
                .timeout(timeout)
                .retryWhen(Retry.fixedDelay(maxRetries, retryDelay)
                        .filter(ProxyForwarder::isTransient)
                        .doBeforeRetry(signal -> log.warn("Retry {}/{} for backend={}: {}",
                                signal.totalRetries() + 1, maxRetries, backendName, signal.failure().toString()))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .onErrorMap(ProxyForwarder::isTransient, e -> {
                    log.error("Proxy request failed: backend={}, target={}, error={}", backendName, target, e.toString());
                    return new BusinessException(ErrorCode.BACKEND_UNAVAILABLE,
                            "Service " + backendName + " is unavailable", e);
                })
                .map(ProxyForwarder::toClientResponse);
    }

    static boolean isTransient(Throwable e) {
        return e instanceof WebClientRequestException || e instanceof TimeoutException;
    }

    private static URI targetUri(URI base, ServerHttpRequest request) {
        return UriComponentsBuilder.fromUri(base)
                .path(request.getURI().getRawPath())
                .query(request.getURI().getRawQuery())
                .build(true)
                .toUri();
    }

    private static void copyHeaders(HttpHeaders source, HttpHeaders target) {
        source.forEach((name, values) -> {
            if (!EXCLUDED_HEADERS.contains(name.toLowerCase())) {
                target.addAll(name, values);
            }
        });
    }

    private static ResponseEntity<byte[]> toClientResponse(ResponseEntity<byte[]> backendResponse) {
        HttpHeaders headers = new HttpHeaders();
        copyHeaders(backendResponse.getHeaders(), headers);
        return ResponseEntity.status(backendResponse.getStatusCode())
                .headers(headers)
                .body(backendResponse.getBody());
    }
}
