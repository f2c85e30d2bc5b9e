package com.edgeauth.gateway.config;

import com.edgeauth.common.token.JwtTokenCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class GatewayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JwtTokenCodec jwtTokenCodec(Clock clock) {
        return new JwtTokenCodec(clock);
    }
}
