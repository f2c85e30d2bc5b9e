package com.edgeauth.auth.config;

import com.edgeauth.auth.service.StatelessTokenRevocationPolicy;
import com.edgeauth.auth.service.TokenRevocationPolicy;
import com.edgeauth.common.token.JwtTokenCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

@Configuration
public class SecurityConfig {

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JwtTokenCodec jwtTokenCodec(Clock clock) {
        return new JwtTokenCodec(clock);
    }

    @Bean
    @ConditionalOnMissingBean(TokenRevocationPolicy.class)
    public TokenRevocationPolicy tokenRevocationPolicy() {
        return new StatelessTokenRevocationPolicy();
    }
}
