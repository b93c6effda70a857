package quest.gekko.insight.service.plugin.standard;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import quest.gekko.insight.domain.Video;
import quest.gekko.insight.domain.VideoDayMetric;
import quest.gekko.insight.service.plugin.Insight;
import quest.gekko.insight.service.plugin.InsightContext;
import quest.gekko.insight.service.plugin.InsightPlugin;

import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Videos older than 90 days that picked up traffic again in the range. */
@Component
@Order(40)
public class SleepersPlugin implements InsightPlugin {
    static final int MIN_AGE_DAYS = 90;
    static final long WAKE_UP_VIEWS = 500;
    static final int TOP = 5;

    @Override
    public String name() { return "Sleepers"; }

    @Override
    public List<Insight> analyze(InsightContext ctx) {
        List<Sleeper> sleepers = new ArrayList<>();
        for (Video video : ctx.data().getAllVideos()) {
            if (video.getPublishedAt() == null) continue;
            long ageDays = ChronoUnit.DAYS.between(video.getPublishedAt().atZone(ZoneOffset.UTC).toLocalDate(), ctx.range().to());
            if (ageDays <= MIN_AGE_DAYS) continue;

            long recentViews = ctx.data().getVideoStats(video.getVideoId(), ctx.range()).stream()
                    .mapToLong(VideoDayMetric::getViews)
                    .sum();
            if (recentViews > WAKE_UP_VIEWS) sleepers.add(new Sleeper(video.getVideoId(), video.getTitle(), recentViews, ageDays));
        }
        if (sleepers.isEmpty()) return List.of();

        sleepers.sort(Comparator.comparingLong(Sleeper::recentViews).reversed());
        return List.of(new Insight("sleepers", "Sleeper Videos",
                sleepers.size() + " older videos are gaining traction.",
                sleepers.subList(0, Math.min(TOP, sleepers.size()))));
    }

    record Sleeper(String videoId, String title, long recentViews, long ageDays) {}
}
