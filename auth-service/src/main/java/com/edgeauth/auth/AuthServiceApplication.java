package com.edgeauth.auth;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@OpenAPIDefinition(info = @Info(
        title = "Auth Service API",
        description = "Token issuer - credential validation and RS256 token management",
        version = "1.0.0"
))
@SpringBootApplication(scanBasePackages = {"com.edgeauth.auth", "com.edgeauth.common"})
public class AuthServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
    }
}
