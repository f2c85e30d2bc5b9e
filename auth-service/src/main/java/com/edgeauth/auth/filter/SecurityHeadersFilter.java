package com.edgeauth.auth.filter;

import com.edgeauth.common.web.SecurityHeaders;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class SecurityHeadersFilter extends OncePerRequestFilter {

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
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        Map<String, String> headers = request.isSecure() || tlsTerminatedUpstream ? secureHeaders : plainHeaders;
        headers.forEach(response::setHeader);
        filterChain.doFilter(request, response);
    }
}
