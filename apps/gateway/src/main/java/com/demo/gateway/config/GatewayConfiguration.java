package com.demo.gateway.config;

import com.demo.gateway.MetricsService;
import com.demo.gateway.adapter.ContextQueryAdapter;
import com.demo.gateway.adapter.ImageGenerationAdapter;
import com.demo.gateway.adapter.LinguisticAnalysisAdapter;
import com.demo.gateway.adapter.SuggestionAdapter;
import com.demo.gateway.breaker.CircuitBreakerRegistry;
import com.demo.gateway.client.ResilientClientFactory;
import com.demo.gateway.observability.ErrorClassifier;
import com.demo.gateway.retry.RetryDecisionPolicy;
import com.demo.gateway.transport.HttpTransport;
import com.demo.gateway.transport.WebClientHttpTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires breakers, the resilient client factory and one adapter per provider.
 */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(GatewayConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService resilienceScheduler(@Value("${gateway.scheduler.pool-size:2}") int poolSize) {
        return Executors.newScheduledThreadPool(poolSize);
    }

    @Bean
    public HttpTransport httpTransport(WebClient.Builder builder) {
        return new WebClientHttpTransport(builder.build());
    }

    @Bean
    public MetricsService metricsService(MeterRegistry registry) {
        return new MetricsService(registry);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(Clock clock, MetricsService metricsService) {
        return new CircuitBreakerRegistry(clock, metricsService);
    }

    @Bean
    public ResilientClientFactory resilientClientFactory(CircuitBreakerRegistry registry,
                                                         RetryDecisionPolicy retryDecisionPolicy,
                                                         ErrorClassifier classifier,
                                                         ScheduledExecutorService resilienceScheduler,
                                                         MetricsService metricsService) {
        return new ResilientClientFactory(registry, retryDecisionPolicy, classifier,
                resilienceScheduler, metricsService);
    }

    @Bean
    public ImageGenerationAdapter imageGenerationAdapter(GatewayProperties properties,
                                                         HttpTransport transport,
                                                         ResilientClientFactory factory,
                                                         ObjectMapper objectMapper,
                                                         MetricsService metricsService) {
        ServiceConfig config = register(properties, ImageGenerationAdapter.NAME, metricsService);
        GatewayProperties.ImageFallback fallback = properties.getImageFallback();
        return new ImageGenerationAdapter(config, transport, factory, objectMapper,
                model(properties, ImageGenerationAdapter.NAME, "black-forest-labs/flux-1.1-pro"),
                fallback.getImages(), fallback.getPlaceholderUrl());
    }

    @Bean
    public ContextQueryAdapter contextQueryAdapter(GatewayProperties properties,
                                                   HttpTransport transport,
                                                   ResilientClientFactory factory,
                                                   ObjectMapper objectMapper,
                                                   MetricsService metricsService) {
        ServiceConfig config = register(properties, ContextQueryAdapter.NAME, metricsService);
        return new ContextQueryAdapter(config, transport, factory, objectMapper,
                model(properties, ContextQueryAdapter.NAME, "sonar-small-online"));
    }

    @Bean
    public SuggestionAdapter suggestionAdapter(GatewayProperties properties,
                                               HttpTransport transport,
                                               ResilientClientFactory factory,
                                               ObjectMapper objectMapper,
                                               MetricsService metricsService) {
        ServiceConfig config = register(properties, SuggestionAdapter.NAME, metricsService);
        return new SuggestionAdapter(config, transport, factory, objectMapper,
                model(properties, SuggestionAdapter.NAME, "grok-1"));
    }

    @Bean
    public LinguisticAnalysisAdapter linguisticAnalysisAdapter(GatewayProperties properties,
                                                               HttpTransport transport,
                                                               ResilientClientFactory factory,
                                                               ObjectMapper objectMapper,
                                                               MetricsService metricsService) {
        ServiceConfig config = register(properties, LinguisticAnalysisAdapter.NAME, metricsService);
        return new LinguisticAnalysisAdapter(config, transport, factory, objectMapper,
                model(properties, LinguisticAnalysisAdapter.NAME, "claude-3-7-sonnet"));
    }

    private static ServiceConfig register(GatewayProperties properties, String name, MetricsService metricsService) {
        ServiceConfig config = properties.serviceConfig(name);
        metricsService.registerDependency(name);
        logger.info("Provider {} -> {} (credential: {}, fallback: {}, retries: {}, breaker: {})",
                name, config.baseUrl(), config.hasCredential() ? "set" : "missing",
                config.fallbackEnabled(), config.retryPolicy().maxRetries(), config.circuitBreakerConfig());
        return config;
    }

    private static String model(GatewayProperties properties, String name, String defaultModel) {
        String model = properties.getProviders().get(name).getModel();
        return model != null && !model.isBlank() ? model : defaultModel;
    }
}
