package quest.gekko.insight.service.analytics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.insight.domain.GrowthCurveEntry;
import quest.gekko.insight.domain.Video;
import quest.gekko.insight.domain.VideoDayMetric;
import quest.gekko.insight.ml.nowcast.GrowthCurveEstimator;
import quest.gekko.insight.ml.nowcast.GrowthCurvePoint;
import quest.gekko.insight.ml.nowcast.NowcastPrediction;
import quest.gekko.insight.service.store.AnalyticsStore;
import quest.gekko.insight.util.DateRange;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NowcastServiceTest {
    private static final LocalDate PUBLISHED = LocalDate.of(2024, 3, 1);

    @Mock
    private AnalyticsStore store;

    private NowcastService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-04T12:00:00Z"), ZoneOffset.UTC);
        service = new NowcastService(store, new GrowthCurveEstimator(), clock);
    }

    private static Video video(String id, LocalDate published) {
        Video video = new Video();
        video.setVideoId(id);
        video.setChannelId("UC1");
        video.setTitle(id);
        video.setDurationSec(300);
        if (published != null) video.setPublishedAt(published.atTime(15, 30).toInstant(ZoneOffset.UTC));
        return video;
    }

    private static List<VideoDayMetric> days(String videoId, LocalDate first, int count, long views) {
        List<VideoDayMetric> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            VideoDayMetric m = new VideoDayMetric();
            m.setVideoId(videoId);
            m.setMetricDate(first.plusDays(i));
            m.setViews(views);
            out.add(m);
        }
        return out;
    }

    private static List<GrowthCurvePoint> uniformCurve() {
        List<GrowthCurvePoint> curve = new ArrayList<>();
        for (int d = 1; d <= GrowthCurveEstimator.CURVE_DAYS; d++) {
            double pct = d / 28.0;
            curve.add(new GrowthCurvePoint(d, pct, pct, pct));
        }
        return curve;
    }

    @Test
    @DisplayName("daily views are indexed from the publish date and stop at the first missing day")
    void dailyViewsStopAtGaps() {
        List<VideoDayMetric> stats = days("v1", PUBLISHED, 5, 10);
        stats.remove(3);

        assertThat(NowcastService.dailyViews(stats, PUBLISHED)).containsExactly(10.0, 10.0, 10.0);
        assertThat(NowcastService.dailyViews(days("v1", PUBLISHED.plusDays(1), 5, 10), PUBLISHED)).isEmpty();
    }

    @Test
    @DisplayName("only videos with 28 consecutive days since publishing join the fitted population")
    void refitUsesCompleteHistoriesOnly() {
        LocalDate gappy = PUBLISHED.minusDays(60);
        when(store.getAllVideos()).thenReturn(List.of(video("full", PUBLISHED.minusDays(40)), video("gappy", gappy),
                video("unpublished", null)));
        when(store.getVideoStats(eq("full"), any(DateRange.class))).thenReturn(days("full", PUBLISHED.minusDays(40), 28, 50));
        List<VideoDayMetric> withGap = days("gappy", gappy, 28, 500);
        withGap.remove(10);
        when(store.getVideoStats(eq("gappy"), any(DateRange.class))).thenReturn(withGap);
        when(store.replaceGrowthCurve(anyInt(), anyString(), anyList())).thenReturn(28);

        assertThat(service.refitGrowthCurves()).isEqualTo(28);

        verify(store).getVideoStats("full", new DateRange(PUBLISHED.minusDays(40), PUBLISHED.minusDays(13)));
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<GrowthCurvePoint>> curve = ArgumentCaptor.forClass(List.class);
        verify(store).replaceGrowthCurve(eq(GrowthCurveEntry.ALL_CLUSTERS), eq(GrowthCurveEntry.ALL_DURATIONS), curve.capture());
        assertThat(curve.getValue()).hasSize(28);
        assertThat(curve.getValue().get(6).medianPct()).isCloseTo(7 / 28.0, within(1e-9));
        assertThat(curve.getValue().get(27).medianPct()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("the stored curve is kept when no video is old enough")
    void refitWithoutPopulationKeepsCurve() {
        when(store.getAllVideos()).thenReturn(List.of(video("young", PUBLISHED)));
        when(store.getVideoStats(eq("young"), any(DateRange.class))).thenReturn(days("young", PUBLISHED, 3, 100));

        assertThat(service.refitGrowthCurves()).isZero();
        verify(store, never()).replaceGrowthCurve(anyInt(), anyString(), anyList());
    }

    @Test
    @DisplayName("prediction uses the injected clock and only completed days")
    void predictsFromCompletedDays() {
        when(store.getVideo("v1")).thenReturn(Optional.of(video("v1", PUBLISHED)));
        when(store.getVideoStats("v1", new DateRange(PUBLISHED, PUBLISHED.plusDays(2)))).thenReturn(days("v1", PUBLISHED, 3, 100));
        when(store.getGrowthCurve(GrowthCurveEntry.ALL_CLUSTERS, GrowthCurveEntry.ALL_DURATIONS)).thenReturn(uniformCurve());

        NowcastPrediction prediction = service.predict("v1");

        assertThat(prediction.predicted7d()).isEqualTo(700);
    }

    @Test
    @DisplayName("a video published today has nothing to project")
    void publishedTodayIsFlat() {
        when(store.getVideo("v1")).thenReturn(Optional.of(video("v1", LocalDate.of(2024, 3, 4))));

        assertThat(service.predict("v1")).isEqualTo(NowcastPrediction.flat(0));
    }
}
