package com.knowledgeengine.config;

import com.knowledgeengine.security.ApiKeyAuthenticationFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.context.NoOpServerSecurityContextRepository;

/**
 * Security configuration for bearer API key authentication.
 *
 * Open by default; with {@code knowledge.security.enabled} every route except
 * health and actuator requires a configured key, so peers fetching exports authenticate.
 */
@Slf4j
@Configuration
@EnableWebFluxSecurity
@EnableConfigurationProperties(KnowledgeProperties.class)
@RequiredArgsConstructor
public class SecurityConfig {

    private final KnowledgeProperties properties;

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        http
            .csrf(ServerHttpSecurity.CsrfSpec::disable)
            .securityContextRepository(NoOpServerSecurityContextRepository.getInstance())
            .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
            .formLogin(ServerHttpSecurity.FormLoginSpec::disable);

        KnowledgeProperties.Security security = properties.getSecurity();
        if (!security.isEnabled()) {
            log.info("API key authentication disabled");
            return http
                .authorizeExchange(exchanges -> exchanges.anyExchange().permitAll())
                .build();
        }

        log.info("API key authentication enabled with {} accepted key(s)", security.getApiKeyHashes().size());
        return http
            .addFilterAt(new ApiKeyAuthenticationFilter(security.getApiKeyHashes()), SecurityWebFiltersOrder.AUTHENTICATION)
            .authorizeExchange(exchanges -> exchanges
                .pathMatchers("/", "/v1/health").permitAll()
                .pathMatchers("/actuator/**").permitAll()
                .anyExchange().authenticated()
            )
            .build();
    }
}
