package quest.gekko.insight.service.analytics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.insight.domain.QualityScore;
import quest.gekko.insight.domain.VideoDayMetric;
import quest.gekko.insight.service.store.AnalyticsStore;
import quest.gekko.insight.util.DateRange;
import quest.gekko.insight.util.JsonPayloads;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QualityScoreServiceTest {
    private static final LocalDate DAY = LocalDate.of(2024, 6, 1);

    @Mock
    private AnalyticsStore store;

    @Mock
    private JsonPayloads json;

    @InjectMocks
    private QualityScoreService service;

    private static List<VideoDayMetric> days(int count, long views, double watchMinutes, long likes, long comments) {
        List<VideoDayMetric> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            VideoDayMetric m = new VideoDayMetric();
            m.setVideoId("v1");
            m.setMetricDate(DAY.plusDays(i));
            m.setViews(views);
            m.setWatchTimeMinutes(watchMinutes);
            m.setLikes(likes);
            m.setComments(comments);
            out.add(m);
        }
        return out;
    }

    @Test
    @DisplayName("components are capped at 100 and weighted 0.4 / 0.4 / 0.2")
    void weightedAndCapped() {
        // 200 views/day, 3 min/view, 25 engagements per 1000 views
        QualityScoreService.Breakdown b = QualityScoreService.score(days(10, 200, 600, 4, 1));

        assertThat(b.velocity()).isEqualTo(200.0);
        assertThat(b.velocityScore()).isEqualTo(100.0);
        assertThat(b.efficiencyScore()).isCloseTo(100.0, within(1e-9));
        assertThat(b.conversion()).isCloseTo(25.0, within(1e-9));
        assertThat(b.conversionScore()).isCloseTo(50.0, within(1e-9));
        assertThat(b.score()).isCloseTo(90.0, within(1e-9));
    }

    @Test
    @DisplayName("videos without views score zero")
    void zeroViewsScoreZero() {
        QualityScoreService.Breakdown b = QualityScoreService.score(days(5, 0, 0, 0, 0));

        assertThat(b.score()).isZero();
        assertThat(QualityScoreService.verdict(b.score())).isEqualTo("Needs Improvement");
    }

    @Test
    @DisplayName("scores map to verdict bands")
    void verdictBands() {
        assertThat(QualityScoreService.verdict(70.5)).isEqualTo("High Quality");
        assertThat(QualityScoreService.verdict(70)).isEqualTo("Average");
        assertThat(QualityScoreService.verdict(40)).isEqualTo("Needs Improvement");
    }

    @Test
    @DisplayName("recompute stores the score with its explanation")
    void recomputeStores() {
        DateRange window = new DateRange(DAY, DAY.plusDays(27));
        when(store.getVideoStats("v1", window)).thenReturn(days(28, 50, 75, 1, 0));
        when(json.write(anyMap())).thenReturn("{\"verdict\":\"Average\"}");
        when(store.upsertQualityScore(any(QualityScore.class))).thenAnswer(inv -> inv.getArgument(0));

        QualityScore saved = service.recompute("v1", window).orElseThrow();

        assertThat(saved.getVideoId()).isEqualTo("v1");
        // 50 views/day -> 50, 1.5 min/view -> 50, 20 per 1000 -> 40
        assertThat(saved.getScore()).isCloseTo(48.0, within(1e-9));
        assertThat(saved.getExplainJson()).contains("verdict");
    }

    @Test
    @DisplayName("recompute skips videos without stats")
    void recomputeSkipsVideosWithoutStats() {
        DateRange window = new DateRange(DAY, DAY.plusDays(27));
        when(store.getVideoStats("v1", window)).thenReturn(List.of());

        assertThat(service.recompute("v1", window)).isEmpty();
        verify(store, never()).upsertQualityScore(any());
    }
}
