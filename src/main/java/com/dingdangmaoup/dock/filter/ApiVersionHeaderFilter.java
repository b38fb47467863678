package com.dingdangmaoup.dock.filter;

import com.dingdangmaoup.dock.registry.controller.RegistryHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Stamps every {@code /v2} response, errors included, with the API version header.
 */
@Component
public class ApiVersionHeaderFilter implements WebFilter {

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (exchange.getRequest().getPath().value().startsWith("/v2")) {
            exchange.getResponse().getHeaders().set(RegistryHeaders.API_VERSION, RegistryHeaders.API_VERSION_VALUE);
        }
        return chain.filter(exchange);
    }
}
