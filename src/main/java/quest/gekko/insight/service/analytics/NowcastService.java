package quest.gekko.insight.service.analytics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.insight.domain.GrowthCurveEntry;
import quest.gekko.insight.domain.Video;
import quest.gekko.insight.domain.VideoDayMetric;
import quest.gekko.insight.error.AppException;
import quest.gekko.insight.ml.nowcast.GrowthCurveEstimator;
import quest.gekko.insight.ml.nowcast.GrowthCurvePoint;
import quest.gekko.insight.ml.nowcast.NowcastPrediction;
import quest.gekko.insight.ml.nowcast.VideoViewHistory;
import quest.gekko.insight.service.store.AnalyticsStore;
import quest.gekko.insight.util.DateRange;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Keeps the channel-wide growth curve current and projects young videos to their day-7 views.
 * Histories are anchored at the publish date, so only videos with 28 stored days since publishing
 * contribute to the fit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NowcastService {
    private final AnalyticsStore store;
    private final GrowthCurveEstimator estimator;
    private final Clock clock;

    /** Refits the curve over every eligible video and replaces the stored one. Returns the stored point count. */
    public int refitGrowthCurves() {
        List<VideoViewHistory> population = new ArrayList<>();
        for (Video video : store.getAllVideos()) {
            if (video.getPublishedAt() == null) continue;
            LocalDate published = video.getPublishedAt().atZone(ZoneOffset.UTC).toLocalDate();
            DateRange firstDays = new DateRange(published, published.plusDays(GrowthCurveEstimator.CURVE_DAYS - 1));

            double[] daily = dailyViews(store.getVideoStats(video.getVideoId(), firstDays), published);
            if (daily.length == GrowthCurveEstimator.CURVE_DAYS) {
                population.add(new VideoViewHistory(video.getVideoId(),
                        video.getDurationSec() != null ? video.getDurationSec() : 0, daily));
            }
        }

        List<GrowthCurvePoint> curve = estimator.fit(population);
        if (curve.isEmpty()) {
            log.info("No video has {} days of history yet, keeping the stored growth curve", GrowthCurveEstimator.CURVE_DAYS);
            return 0;
        }
        log.info("Fitted growth curve over {} videos", population.size());
        return store.replaceGrowthCurve(GrowthCurveEntry.ALL_CLUSTERS, GrowthCurveEntry.ALL_DURATIONS, curve);
    }

    public NowcastPrediction predict(String videoId) {
        return predict(videoId, LocalDate.now(clock));
    }

    /** Projects from the views accumulated before {@code today}; the current day is incomplete. */
    public NowcastPrediction predict(String videoId, LocalDate today) {
        Video video = store.getVideo(videoId).orElseThrow(() -> AppException.notFound("Unknown video " + videoId));
        if (video.getPublishedAt() == null) return NowcastPrediction.flat(0);

        LocalDate published = video.getPublishedAt().atZone(ZoneOffset.UTC).toLocalDate();
        int days = (int) ChronoUnit.DAYS.between(published, today);
        if (days < 1) return NowcastPrediction.flat(0);

        double current = store.getVideoStats(videoId, new DateRange(published, today.minusDays(1))).stream()
                .mapToLong(VideoDayMetric::getViews)
                .sum();
        List<GrowthCurvePoint> curve = store.getGrowthCurve(GrowthCurveEntry.ALL_CLUSTERS, GrowthCurveEntry.ALL_DURATIONS);
        return estimator.predict(current, days, curve);
    }

    /** Day-indexed views since publishing; stops at the first missing day. */
    static double[] dailyViews(List<VideoDayMetric> stats, LocalDate published) {
        double[] out = new double[stats.size()];
        int n = 0;
        for (VideoDayMetric row : stats) {
            if (!row.getMetricDate().equals(published.plusDays(n))) break;
            out[n++] = row.getViews();
        }
        return n == out.length ? out : Arrays.copyOf(out, n);
    }
}
