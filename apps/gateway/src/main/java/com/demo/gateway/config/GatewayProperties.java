package com.demo.gateway.config;

import com.demo.gateway.breaker.CircuitBreakerConfig;
import com.demo.gateway.retry.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds {@code gateway.defaults.*} and {@code gateway.providers.<name>.*}.
 * A provider value left unset inherits the default.
 */
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    private final Defaults defaults = new Defaults();
    private final Map<String, Provider> providers = new LinkedHashMap<>();
    private final ImageFallback imageFallback = new ImageFallback();

    public Defaults getDefaults() {
        return defaults;
    }

    public Map<String, Provider> getProviders() {
        return providers;
    }

    public ImageFallback getImageFallback() {
        return imageFallback;
    }

    /**
     * Resolve the effective config of one provider.
     *
     * @throws IllegalArgumentException when the provider is unknown or a value is out of range
     */
    public ServiceConfig serviceConfig(String name) {
        Provider provider = providers.get(name);
        if (provider == null) {
            throw new IllegalArgumentException("No provider configured under gateway.providers." + name);
        }
        RetryPolicy retryPolicy = new RetryPolicy(
            orDefault(provider.getRetryCount(), defaults.getRetryCount()),
            orDefault(provider.getBaseBackoffMs(), defaults.getBaseBackoffMs()));
        CircuitBreakerConfig breakerConfig = new CircuitBreakerConfig(
            orDefault(provider.getFailureThreshold(), defaults.getFailureThreshold()),
            orDefault(provider.getSuccessThreshold(), defaults.getSuccessThreshold()),
            orDefault(provider.getOpenDurationMs(), defaults.getOpenDurationMs()));
        return new ServiceConfig(
            provider.getBaseUrl(),
            provider.getCredential(),
            orDefault(provider.getTimeoutMs(), defaults.getTimeoutMs()),
            retryPolicy,
            breakerConfig,
            provider.isFallbackEnabled(),
            provider.getHeaders());
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }

    public static class Defaults {
        private int failureThreshold = CircuitBreakerConfig.DEFAULT_FAILURE_THRESHOLD;
        private int successThreshold = CircuitBreakerConfig.DEFAULT_SUCCESS_THRESHOLD;
        private long openDurationMs = CircuitBreakerConfig.DEFAULT_OPEN_DURATION_MS;
        private int retryCount = RetryPolicy.DEFAULT_MAX_RETRIES;
        private long baseBackoffMs = RetryPolicy.DEFAULT_BASE_BACKOFF_MS;
        private long timeoutMs = 15_000;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public int getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
        }

        public long getOpenDurationMs() {
            return openDurationMs;
        }

        public void setOpenDurationMs(long openDurationMs) {
            this.openDurationMs = openDurationMs;
        }

        public int getRetryCount() {
            return retryCount;
        }

        public void setRetryCount(int retryCount) {
            this.retryCount = retryCount;
        }

        public long getBaseBackoffMs() {
            return baseBackoffMs;
        }

        public void setBaseBackoffMs(long baseBackoffMs) {
            this.baseBackoffMs = baseBackoffMs;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public static class Provider {
        private String baseUrl;
        private String credential;
        private String model;
        private boolean fallbackEnabled;
        private Map<String, String> headers = new LinkedHashMap<>();
        private Integer failureThreshold;
        private Integer successThreshold;
        private Long openDurationMs;
        private Integer retryCount;
        private Long baseBackoffMs;
        private Long timeoutMs;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getCredential() {
            return credential;
        }

        public void setCredential(String credential) {
            this.credential = credential;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public boolean isFallbackEnabled() {
            return fallbackEnabled;
        }

        public void setFallbackEnabled(boolean fallbackEnabled) {
            this.fallbackEnabled = fallbackEnabled;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }

        public Integer getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(Integer failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Integer getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(Integer successThreshold) {
            this.successThreshold = successThreshold;
        }

        public Long getOpenDurationMs() {
            return openDurationMs;
        }

        public void setOpenDurationMs(Long openDurationMs) {
            this.openDurationMs = openDurationMs;
        }

        public Integer getRetryCount() {
            return retryCount;
        }

        public void setRetryCount(Integer retryCount) {
            this.retryCount = retryCount;
        }

        public Long getBaseBackoffMs() {
            return baseBackoffMs;
        }

        public void setBaseBackoffMs(Long baseBackoffMs) {
            this.baseBackoffMs = baseBackoffMs;
        }

        public Long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(Long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    /**
     * Placeholder images served while image generation is unavailable.
     */
    public static class ImageFallback {
        private List<String> images = new ArrayList<>();
        private String placeholderUrl = "/fallback/image-placeholder.svg";

        public List<String> getImages() {
            return images;
        }

        public void setImages(List<String> images) {
            this.images = images;
        }

        public String getPlaceholderUrl() {
            return placeholderUrl;
        }

        public void setPlaceholderUrl(String placeholderUrl) {
            this.placeholderUrl = placeholderUrl;
        }
    }
}
