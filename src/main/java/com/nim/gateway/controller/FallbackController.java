package com.nim.gateway.controller;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * 未匹配路由统一返回 404 JSON
 */
@RestController
public class FallbackController {

    @RequestMapping("/**")
    public Mono<Void> notFound(ServerWebExchange exchange) {
        String path = exchange.getRequest().getPath().value();
        return Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "Endpoint " + path + " not supported"));
    }
}
