package com.competition.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Gateway Application
 *
 * <p>Edge gateway for the competition platform, built on Spring Cloud Gateway.
 * Validates inbound JWT tokens, exchanges them for service-scoped tokens
 * (RFC 8693) and forwards requests with tenant and correlation context.
 */
@SpringBootApplication
@EnableScheduling // JWKS refresh and exchange cache sweep
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }
}
