package quest.gekko.insight.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@EnableCaching
public class CacheConfig {
    /** Remote GET responses keyed by full request URL. */
    public static final String PROVIDER_RESPONSES = "providerResponses";
    static final Duration PROVIDER_RESPONSE_TTL = Duration.ofMinutes(15);

    @Bean
    public Caffeine<Object, Object> providerResponseCaffeine() {
        return Caffeine.newBuilder()
                .maximumSize(5_000)
                .expireAfterWrite(PROVIDER_RESPONSE_TTL)
                .recordStats();
    }

    @Bean
    public CacheManager cacheManager(final Caffeine<Object, Object> providerResponseCaffeine) {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager(PROVIDER_RESPONSES);
        cacheManager.setCaffeine(providerResponseCaffeine);
        cacheManager.setAllowNullValues(false);
        return cacheManager;
    }
}
