package com.edgeauth.gateway.filter;

import com.edgeauth.common.response.ErrorCode;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Shared utilities for gateway filters.
 */
public final class RequestUtils {

    private RequestUtils() {}

    /**
     * Write an {@code {"code": ..., "error": ...}} body with proper escaping.
     * Filters run outside the controller advice, so they render errors themselves.
     */
    public static Mono<Void> writeErrorResponse(ServerWebExchange exchange, HttpStatusCode status, ErrorCode errorCode) {
        exchange.getResponse().setStatusCode(status);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        String body = String.format("{\"code\":\"%s\",\"error\":\"%s\"}",
                escapeJson(errorCode.getCode()), escapeJson(errorCode.getMessage()));
        DataBuffer buffer = exchange.getResponse().bufferFactory()
                .wrap(body.getBytes(StandardCharsets.UTF_8));
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }

    private static String escapeJson(String value) {
        if (value == null) return "";
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
