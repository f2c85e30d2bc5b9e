package com.edgeauth.gateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    @Valid
    private Issuer issuer = new Issuer();
    @Valid
    private Auth auth = new Auth();
    @Valid
    private Proxy proxy = new Proxy();
    @Valid
    private Map<String, Backend> backends = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Issuer {
        @NotBlank
        private String baseUrl;
        private String publicKeyPath = "/api/v1/auth/public-key";
        @NotNull
        private Duration fetchTimeout = Duration.ofSeconds(5);
        @NotNull
        private Duration keyTtl = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class Auth {
        /** Ant patterns served with or without a token */
        private List<String> optionalPaths = List.of();
        /** 503 keeps an issuer outage distinguishable from a bad token; 401 hides it */
        @Min(400)
        @Max(599)
        private int keyUnavailableStatus = 503;
    }

    @Getter
    @Setter
    public static class Proxy {
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);
        @Min(0)
        private int maxRetries = 3;
        @NotNull
        private Duration retryDelay = Duration.ofSeconds(2);
    }

    @Getter
    @Setter
    public static class Backend {
        @NotBlank
        private String url;
    }
}
