package quest.gekko.insight.provider.youtube;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialRandomBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.ExceptionClassifierRetryPolicy;
import org.springframework.retry.policy.NeverRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import quest.gekko.insight.config.CacheConfig;
import quest.gekko.insight.config.InsightProperties;
import quest.gekko.insight.error.AppException;
import quest.gekko.insight.error.ErrorCode;
import quest.gekko.insight.util.TokenBucketRateLimiter;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Map;

/**
 * Authenticated JSON GETs against the Google APIs. Retryable failures (network, 429, 5xx, quota)
 * are retried with exponential backoff and random jitter; auth and validation failures are not.
 * Every attempt, retries included, takes a permit from the shared token bucket before it goes on
 * the wire. Successful responses are cached by URL and served without a permit.
 */
@Slf4j
@Component
public class ApiHttpClient {
    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP = new ParameterizedTypeReference<>() {};

    private final WebClient http;
    private final InsightProperties.YouTube youtube;
    private final RetryTemplate retryTemplate;
    private final Cache cache;
    private final TokenBucketRateLimiter limiter;

    @Autowired
    public ApiHttpClient(WebClient http, InsightProperties.YouTube youtube, InsightProperties.Http httpProps,
                         CacheManager cacheManager, TokenBucketRateLimiter limiter) {
        this(http, youtube, retryTemplate(httpProps, new ThreadWaitSleeper()),
                cacheManager.getCache(CacheConfig.PROVIDER_RESPONSES), limiter);
    }

    ApiHttpClient(WebClient http, InsightProperties.YouTube youtube, RetryTemplate retryTemplate, Cache cache,
                  TokenBucketRateLimiter limiter) {
        this.http = http;
        this.youtube = youtube;
        this.retryTemplate = retryTemplate;
        this.cache = cache;
        this.limiter = limiter;
    }

    public Map<String, Object> get(String url) {
        return get(url, true);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> get(String url, boolean useCache) {
        if (useCache && cache != null) {
            Map<String, Object> cached = cache.get(url, Map.class);
            if (cached != null) return cached;
        }

        URI uri = authorize(url);
        String token = youtube.accessToken();
        Map<String, Object> body = retryTemplate.execute(ctx -> fetch(uri, token));
        if (body == null) body = Map.of();

        if (useCache && cache != null) cache.put(url, body);
        return body;
    }

    private Map<String, Object> fetch(URI uri, String token) {
        throttle();
        try {
            return http.get()
                    .uri(uri)
                    .headers(h -> {
                        if (token != null && !token.isBlank()) h.set(HttpHeaders.AUTHORIZATION, "Bearer " + token);
                    })
                    .exchangeToMono(resp -> {
                        if (resp.statusCode().is2xxSuccessful()) return resp.bodyToMono(JSON_MAP);
                        return resp.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(b -> Mono.<Map<String, Object>>error(HttpErrorClassifier.classify(resp.statusCode().value(), b)));
                    })
                    .block();
        } catch (WebClientRequestException e) {
            throw new AppException(ErrorCode.NETWORK_ERROR, "Request to " + uri.getHost() + " failed", true, e.getMessage(), e);
        }
    }

    private void throttle() {
        try {
            limiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AppException(ErrorCode.UNKNOWN_ERROR, "Interrupted while waiting for rate limiter", false, null, e);
        }
    }

    private URI authorize(String url) {
        String token = youtube.accessToken();
        if (token != null && !token.isBlank()) return URI.create(url);

        String apiKey = youtube.apiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new AppException(ErrorCode.AUTH_ERROR, "No access token available", false);
        }
        return UriComponentsBuilder.fromUriString(url).queryParam("key", apiKey).build(true).toUri();
    }

    static RetryTemplate retryTemplate(InsightProperties.Http props, Sleeper sleeper) {
        SimpleRetryPolicy retry = new SimpleRetryPolicy(props.maxAttempts());
        NeverRetryPolicy never = new NeverRetryPolicy();
        ExceptionClassifierRetryPolicy policy = new ExceptionClassifierRetryPolicy();
        policy.setExceptionClassifier(t -> isRetryable(t) ? retry : never);

        ExponentialRandomBackOffPolicy backOff = new ExponentialRandomBackOffPolicy();
        backOff.setInitialInterval(props.initialBackoffMs());
        backOff.setMultiplier(2.0);
        backOff.setMaxInterval(props.maxBackoffMs());
        backOff.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(policy);
        template.setBackOffPolicy(backOff);
        template.registerListener(new RetryListener() {
            @Override
            public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
                log.warn("Remote call failed (attempt {}): {}", context.getRetryCount(), throwable.getMessage());
            }
        });
        return template;
    }

    static boolean isRetryable(Throwable t) {
        if (t instanceof AppException app) return app.isRetryable();
        return !(t instanceof IllegalArgumentException);
    }
}
