package com.edgeauth.gateway.controller;

import com.edgeauth.gateway.proxy.ProxyForwarder;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequiredArgsConstructor
public class ProxyController {

    private final ProxyForwarder proxyForwarder;

    @RequestMapping({"/api/v1/{backend}", "/api/v1/{backend}/**"})
    public Mono<ResponseEntity<byte[]>> proxy(@PathVariable String backend, ServerHttpRequest request) {
        return DataBufferUtils.join(request.getBody())
                .map(ProxyController::toBytes)
                .defaultIfEmpty(new byte[0])
                .flatMap(body -> proxyForwarder.forward(backend, request, body));
    }

    private static byte[] toBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}
