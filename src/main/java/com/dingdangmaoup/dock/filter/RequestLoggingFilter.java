package com.dingdangmaoup.dock.filter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Logs registry requests with their outcome and duration.
 * Enable by setting: dock.logging.request-logging=true
 */
@Slf4j
@Component
@Order(-1)
@ConditionalOnProperty(name = "dock.logging.request-logging", havingValue = "true", matchIfMissing = false)
public class RequestLoggingFilter implements WebFilter {

    @Value("${dock.logging.include-headers:false}")
    private boolean includeHeaders;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!log.isDebugEnabled()) {
            return chain.filter(exchange);
        }

        ServerHttpRequest request = exchange.getRequest();
        long startNanos = System.nanoTime();
        log.debug("--> {} {}", request.getMethod(), request.getURI());

        if (includeHeaders) {
            // Authorization values never reach the log
            request.getHeaders().forEach((name, values) -> log.debug("    {}: {}", name,
                    "Authorization".equalsIgnoreCase(name) ? "<redacted>" : String.join(", ", values)));
        }

        return chain.filter(exchange)
                .doOnSuccess(v -> log.debug("<-- {} {} {} ({} ms)", request.getMethod(), request.getPath().value(),
                        exchange.getResponse().getStatusCode(), (System.nanoTime() - startNanos) / 1_000_000))
                .doOnError(error -> log.error("Request {} {} failed: {}",
                        request.getMethod(), request.getPath().value(), error.getMessage()));
    }
}
