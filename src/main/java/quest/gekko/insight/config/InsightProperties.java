package quest.gekko.insight.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the sync pipeline and its remote data provider
 */
@Configuration
@EnableConfigurationProperties({
        InsightProperties.YouTube.class,
        InsightProperties.RateLimit.class,
        InsightProperties.Http.class,
        InsightProperties.Sync.class
})
public class InsightProperties {

    @ConfigurationProperties("insight.youtube")
    public record YouTube(
            String apiKey,
            String accessToken,
            @DefaultValue("MINE") String ownedChannelId,
            @DefaultValue("https://www.googleapis.com/youtube/v3") String baseUrl,
            @DefaultValue("https://youtubeanalytics.googleapis.com/v2") String analyticsBaseUrl) {}

    /** Token bucket in front of every remote call. */
    @ConfigurationProperties("insight.rate-limit")
    public record RateLimit(
            @DefaultValue("50") int capacity,
            @DefaultValue("5") double refillPerSecond) {}

    @ConfigurationProperties("insight.http")
    public record Http(
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("1000") long initialBackoffMs,
            @DefaultValue("8000") long maxBackoffMs) {}

    @ConfigurationProperties("insight.sync")
    public record Sync(
            @DefaultValue("21") int lookbackDays,
            @DefaultValue("50") int maxVideos,
            @DefaultValue("20") int competitorVideos,
            @DefaultValue("3") int videoMetricWorkers,
            @DefaultValue("0 10 2 * * *") String cron,
            @DefaultValue("true") boolean schedulingEnabled) {}
}
