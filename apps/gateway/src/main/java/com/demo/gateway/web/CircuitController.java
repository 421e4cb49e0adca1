package com.demo.gateway.web;

import com.demo.gateway.breaker.CircuitBreaker;
import com.demo.gateway.breaker.CircuitBreakerRegistry;
import com.demo.gateway.breaker.CircuitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only breaker status plus the manual reset override.
 */
@RestController
@RequestMapping("/api/circuits")
public class CircuitController {
    private static final Logger logger = LoggerFactory.getLogger(CircuitController.class);

    private final CircuitBreakerRegistry registry;

    public CircuitController(CircuitBreakerRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<CircuitStatus> list() {
        return registry.getAll().stream()
                .map(CircuitBreaker::getStatus)
                .sorted(Comparator.comparing(CircuitStatus::name))
                .collect(Collectors.toList());
    }

    @GetMapping("/{name}")
    public CircuitStatus status(@PathVariable String name) {
        return breaker(name).getStatus();
    }

    @PostMapping("/{name}/reset")
    public CircuitStatus reset(@PathVariable String name) {
        CircuitBreaker breaker = breaker(name);
        logger.info("Manual reset requested for circuit {} (was {})", name, breaker.getState());
        breaker.reset();
        return breaker.getStatus();
    }

    private CircuitBreaker breaker(String name) {
        return registry.find(name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown circuit: " + name));
    }
}
