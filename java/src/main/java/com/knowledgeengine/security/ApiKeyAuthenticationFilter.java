package com.knowledgeengine.security;

import com.knowledgeengine.util.ApiKeyUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.List;

/**
 * Filter for bearer API key authentication.
 * Keys are compared by SHA-256 digest; the key prefix becomes the principal.
 *
 * Registered inside the security filter chain, not as a standalone bean.
 */
@Slf4j
public class ApiKeyAuthenticationFilter implements WebFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final List<String> acceptedHashes;

    public ApiKeyAuthenticationFilter(List<String> acceptedHashes) {
        this.acceptedHashes = List.copyOf(acceptedHashes);
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();

        if (isPublicEndpoint(path)) {
            return chain.filter(exchange);
        }

        String authHeader = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);

        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            log.warn("Missing or invalid Authorization header on {}", path);
            return reject(exchange);
        }

        String apiKey = authHeader.substring(BEARER_PREFIX.length()).trim();
        if (!ApiKeyUtil.matches(apiKey, acceptedHashes)) {
            log.warn("Rejected API key {}... on {}", ApiKeyUtil.getKeyPrefix(apiKey), path);
            return reject(exchange);
        }

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                ApiKeyUtil.getKeyPrefix(apiKey), null, Collections.emptyList());

        return chain.filter(exchange)
                .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication));
    }

    private Mono<Void> reject(ServerWebExchange exchange) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        return exchange.getResponse().setComplete();
    }

    static boolean isPublicEndpoint(String path) {
        return path.equals("/") ||
               path.equals("/v1/health") ||
               path.startsWith("/actuator");
    }
}
