package quest.gekko.insight.service.sync;

import quest.gekko.insight.domain.ChannelDayMetric;
import quest.gekko.insight.domain.VideoDayMetric;
import quest.gekko.insight.provider.MetricRow;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pivots provider {@code (date, metric, value)} triples into one fact row per day. Unknown metric
 * names are ignored; CTR is derived from views and impressions when the provider does not send it.
 */
final class MetricPivot {

    private MetricPivot() {
    }

    static List<ChannelDayMetric> channelDays(String channelId, List<MetricRow> rows) {
        Map<LocalDate, ChannelDayMetric> days = new TreeMap<>();
        for (MetricRow row : rows) {
            ChannelDayMetric day = days.computeIfAbsent(row.date(), d -> {
                ChannelDayMetric fact = new ChannelDayMetric();
                fact.setChannelId(channelId);
                fact.setMetricDate(d);
                return fact;
            });
            double v = row.value();
            switch (row.metric()) {
                case "views" -> day.setViews(Math.round(v));
                case "estimatedMinutesWatched" -> day.setWatchTimeMinutes(v);
                case "averageViewDuration" -> day.setAvgViewDurationSec(v);
                case "subscribersGained" -> day.setSubsGained(Math.round(v));
                case "subscribersLost" -> day.setSubsLost(Math.round(v));
                case "impressions" -> day.setImpressions(Math.round(v));
                case "impressionsCtr" -> day.setCtr(v);
                default -> { }
            }
        }
        days.values().forEach(d -> {
            if (d.getCtr() == 0 && d.getImpressions() > 0) d.setCtr(d.getViews() * 100.0 / d.getImpressions());
        });
        return List.copyOf(days.values());
    }

    static List<VideoDayMetric> videoDays(String videoId, List<MetricRow> rows) {
        Map<LocalDate, VideoDayMetric> days = new TreeMap<>();
        for (MetricRow row : rows) {
            VideoDayMetric day = days.computeIfAbsent(row.date(), d -> {
                VideoDayMetric fact = new VideoDayMetric();
                fact.setVideoId(videoId);
                fact.setMetricDate(d);
                return fact;
            });
            double v = row.value();
            switch (row.metric()) {
                case "views" -> day.setViews(Math.round(v));
                case "estimatedMinutesWatched" -> day.setWatchTimeMinutes(v);
                case "averageViewDuration" -> day.setAvgViewDurationSec(v);
                case "likes" -> day.setLikes(Math.round(v));
                case "comments" -> day.setComments(Math.round(v));
                case "impressions" -> day.setImpressions(Math.round(v));
                case "impressionsCtr" -> day.setCtr(v);
                default -> { }
            }
        }
        days.values().forEach(d -> {
            if (d.getCtr() == 0 && d.getImpressions() > 0) d.setCtr(d.getViews() * 100.0 / d.getImpressions());
        });
        return List.copyOf(days.values());
    }
}
