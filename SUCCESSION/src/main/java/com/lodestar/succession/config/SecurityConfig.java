package com.lodestar.succession.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;

/**
 * Security configuration for the SUCCESSION service.
 * <p>
 * Session authentication happens at the gateway, which forwards the member id and roles as
 * {@code X-Actor-Id} and {@code X-Actor-Roles}. Per-operation authorization is enforced by the
 * domain services.
 */
@Configuration
@EnableWebFluxSecurity
public class SecurityConfig {

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .authorizeExchange(exchanges -> exchanges
                        // Allow actuator endpoints without authentication
                        .pathMatchers("/actuator/**").permitAll()
                        // Allow API documentation
                        .pathMatchers("/swagger-ui/**", "/swagger-ui.html", "/v3/api-docs/**", "/api-docs/**").permitAll()
                        .pathMatchers("/api/v1/succession/**").permitAll()
                        .anyExchange().denyAll()
                )
                .build();
    }
}
