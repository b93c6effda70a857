package quest.gekko.insight.provider.fake;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import quest.gekko.insight.error.AppException;
import quest.gekko.insight.provider.ChannelInfo;
import quest.gekko.insight.provider.DataProvider;
import quest.gekko.insight.provider.MetricRow;
import quest.gekko.insight.provider.VideoInfo;
import quest.gekko.insight.util.DateRange;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Offline provider producing deterministic data: the same ids and dates always yield the same
 * numbers. Public view counts grow with the clock so competitor snapshots never decrease.
 */
@Service
@ConditionalOnProperty(name = "insight.provider", havingValue = "fake")
public class FakeDataProvider implements DataProvider {
    public static final String OWNED_CHANNEL = "UC_fake_owned";
    static final int OWNED_VIDEOS = 60;
    static final int COMPETITOR_VIDEOS = 25;
    private static final LocalDate GROWTH_ANCHOR = LocalDate.of(2024, 1, 1);

    private static final String[] TOPICS = {
            "budget travel tips", "street food tour", "camera gear review", "editing workflow tutorial",
            "morning routine productivity", "home studio setup", "drone footage guide", "mountain hiking trip"
    };

    private final Clock clock;

    @Autowired
    public FakeDataProvider() {
        this(Clock.systemUTC());
    }

    public FakeDataProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ChannelInfo getChannel(String channelId) {
        String id = "MINE".equals(channelId) ? OWNED_CHANNEL : channelId;
        if (id == null || id.isBlank()) throw AppException.notFound("Channel not found: " + channelId);
        Random rnd = random(id);
        return new ChannelInfo(id, "Fake channel " + id, 10_000 + rnd.nextInt(500_000),
                Instant.parse("2019-01-01T00:00:00Z"), "UU" + id, "@" + id.toLowerCase());
    }

    @Override
    public List<VideoInfo> listVideos(String channelId, int maxResults) {
        String id = "MINE".equals(channelId) ? OWNED_CHANNEL : channelId;
        boolean owned = OWNED_CHANNEL.equals(id);
        int count = Math.min(maxResults, owned ? OWNED_VIDEOS : COMPETITOR_VIDEOS);

        LocalDate today = today();
        List<VideoInfo> videos = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String videoId = id + "_v" + i;
            Random rnd = random(videoId);
            LocalDate published = today.minusDays(2L + i * (owned ? 3L : 2L));
            String title = TOPICS[(i + (owned ? 0 : 3)) % TOPICS.length] + " part " + (i + 1);
            long age = ChronoUnit.DAYS.between(published, today);
            int peak = rnd.nextInt(5_000) + 200;
            long views = cumulativeViews(peak, age + 1, owned ? 1.0 : 2.5)
                    + Math.round(peak * 0.3) * ChronoUnit.DAYS.between(GROWTH_ANCHOR, today);
            videos.add(new VideoInfo(videoId, title, views, published.atStartOfDay().toInstant(ZoneOffset.UTC),
                    120 + rnd.nextInt(1_200)));
        }
        return videos;
    }

    @Override
    public List<MetricRow> getChannelDailyMetrics(String channelId, DateRange range) {
        List<MetricRow> rows = new ArrayList<>();
        for (LocalDate d = range.from(); !d.isAfter(range.to()); d = d.plusDays(1)) {
            Random rnd = random(channelId + d);
            double weekly = d.getDayOfWeek().getValue() >= 6 ? 1.25 : 1.0;
            double views = Math.round((4_000 + rnd.nextInt(800)) * weekly);
            double impressions = Math.round(views / (0.045 + rnd.nextDouble() * 0.01));
            rows.add(new MetricRow(d, "views", views));
            rows.add(new MetricRow(d, "estimatedMinutesWatched", Math.round(views * 3.2)));
            rows.add(new MetricRow(d, "averageViewDuration", 192 + rnd.nextInt(40)));
            rows.add(new MetricRow(d, "subscribersGained", 20 + rnd.nextInt(30)));
            rows.add(new MetricRow(d, "subscribersLost", rnd.nextInt(10)));
            rows.add(new MetricRow(d, "impressions", impressions));
        }
        return rows;
    }

    @Override
    public Map<String, List<MetricRow>> getVideoDailyMetrics(List<String> videoIds, DateRange range) {
        Map<String, List<MetricRow>> result = new LinkedHashMap<>();
        for (String videoId : videoIds) {
            Random rnd = random(videoId);
            double peak = 300 + rnd.nextInt(3_000);
            LocalDate published = publishDate(videoId);
            List<MetricRow> rows = new ArrayList<>();
            for (LocalDate d = range.from(); !d.isAfter(range.to()); d = d.plusDays(1)) {
                if (d.isBefore(published)) continue;
                long age = ChronoUnit.DAYS.between(published, d);
                double views = Math.round(peak * Math.exp(-age / 6.0) + peak * 0.02);
                rows.add(new MetricRow(d, "views", views));
                rows.add(new MetricRow(d, "estimatedMinutesWatched", Math.round(views * 2.8)));
                rows.add(new MetricRow(d, "likes", Math.round(views * 0.04)));
                rows.add(new MetricRow(d, "comments", Math.round(views * 0.005)));
            }
            result.put(videoId, rows);
        }
        return result;
    }

    private LocalDate publishDate(String videoId) {
        int idx = videoId.lastIndexOf("_v");
        int i = idx >= 0 ? Integer.parseInt(videoId.substring(idx + 2)) : 0;
        boolean owned = videoId.startsWith(OWNED_CHANNEL);
        return today().minusDays(2L + i * (owned ? 3L : 2L));
    }

    private static long cumulativeViews(double peak, long days, double boost) {
        double total = 0;
        for (int d = 0; d < days; d++) {
            total += peak * boost * Math.exp(-d / 6.0) + peak * 0.02;
        }
        return Math.round(total);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private static Random random(String key) {
        return new Random(key.hashCode());
    }
}
