package quest.gekko.insight.service.plugin.standard;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import quest.gekko.insight.ml.anomaly.AnomalyDetector;
import quest.gekko.insight.service.plugin.InMemoryDataAccess;
import quest.gekko.insight.service.plugin.Insight;
import quest.gekko.insight.service.plugin.InsightContext;
import quest.gekko.insight.util.DateRange;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StandardPluginsTest {
    private static final LocalDate FROM = LocalDate.of(2024, 6, 1);
    private static final LocalDate TO = LocalDate.of(2024, 6, 20);

    private final InMemoryDataAccess data = new InMemoryDataAccess();

    private InsightContext context() {
        return new InsightContext(1L, "UC_owned", new DateRange(FROM, TO), data);
    }

    private static Instant daysBefore(LocalDate day, long days) {
        return day.minusDays(days).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    @Test
    @DisplayName("top movers lists at most three videos by total views")
    void topMovers() {
        String[] ids = {"a", "b", "c", "d"};
        long[] views = {50, 400, 300, 900};
        for (int i = 0; i < ids.length; i++) {
            data.video(ids[i], "Video " + ids[i], daysBefore(TO, 30));
            data.videoDay(ids[i], FROM, views[i], 0, 0);
            data.videoDay(ids[i], FROM.plusDays(1), views[i], 0, 0);
        }
        data.video("single", "Single day", daysBefore(TO, 30));
        data.videoDay("single", FROM, 10_000, 0, 0);

        List<Insight> insights = new TopMoversPlugin().analyze(context());

        assertThat(insights).singleElement().satisfies(insight -> {
            assertThat(insight.type()).isEqualTo("top_movers");
            assertThat(insight.description()).isEqualTo("Top 3 videos by views in this period: Video d, Video b, Video c");
        });
    }

    @Test
    @DisplayName("channel CTR below the benchmark is flagged as a bottleneck")
    void ctrBottleneck() {
        data.channelDay(FROM, 100, 10_000);
        data.channelDay(FROM.plusDays(1), 50, 10_000);

        assertThat(new CtrBottleneckPlugin().analyze(context())).singleElement()
                .satisfies(insight -> assertThat(insight.type()).isEqualTo("bottleneck"));

        data.channelStats.clear();
        data.channelDay(FROM, 500, 10_000);
        assertThat(new CtrBottleneckPlugin().analyze(context())).isEmpty();
    }

    @Test
    @DisplayName("sleepers are older than 90 days with more than 500 recent views")
    void sleepers() {
        data.video("old-hot", "Old but hot", daysBefore(TO, 200));
        data.videoDay("old-hot", FROM, 800, 0, 0);
        data.video("old-cold", "Old and cold", daysBefore(TO, 200));
        data.videoDay("old-cold", FROM, 100, 0, 0);
        data.video("young", "Young and hot", daysBefore(TO, 20));
        data.videoDay("young", FROM, 5_000, 0, 0);

        List<Insight> insights = new SleepersPlugin().analyze(context());

        assertThat(insights).singleElement().satisfies(insight -> {
            assertThat(insight.type()).isEqualTo("sleepers");
            assertThat(insight.description()).startsWith("1 older");
        });
    }

    @Test
    @DisplayName("quality ranking weights comments over likes over views")
    void qualityRanking() {
        data.video("views", "Many views", daysBefore(TO, 30));
        data.videoDay("views", FROM, 1_000, 0, 0);
        data.video("talk", "Lots of comments", daysBefore(TO, 30));
        data.videoDay("talk", FROM, 10, 0, 10);

        List<Insight> insights = new QualityRankingPlugin().analyze(context());

        assertThat(insights).singleElement().satisfies(insight -> {
            assertThat(insight.type()).isEqualTo("quality_rank");
            @SuppressWarnings("unchecked")
            List<QualityRankingPlugin.Ranked> ranked = (List<QualityRankingPlugin.Ranked>) insight.evidence();
            assertThat(ranked).extracting(QualityRankingPlugin.Ranked::videoId).containsExactly("talk", "views");
        });
    }

    @Test
    @DisplayName("anomaly days reports spikes and level shifts in channel views")
    void anomalyDays() {
        for (int i = 0; i < 20; i++) {
            long views = i < 10 ? (i % 2 == 0 ? 1_000 : 1_040) : (i % 2 == 0 ? 3_000 : 3_040);
            data.channelDay(FROM.plusDays(i), views, 50_000);
        }

        List<Insight> insights = new AnomalyDaysPlugin(new AnomalyDetector()).analyze(context());

        assertThat(insights).extracting(Insight::type).contains("trend_break");
    }

    @Test
    @DisplayName("plugins stay quiet without data")
    void pluginsStayQuietWithoutData() {
        InsightContext ctx = context();
        assertThat(new TopMoversPlugin().analyze(ctx)).isEmpty();
        assertThat(new CtrBottleneckPlugin().analyze(ctx)).isEmpty();
        assertThat(new SleepersPlugin().analyze(ctx)).isEmpty();
        assertThat(new QualityRankingPlugin().analyze(ctx)).isEmpty();
        assertThat(new AnomalyDaysPlugin(new AnomalyDetector()).analyze(ctx)).isEmpty();
        assertThat(new CtrDropPlugin().analyze(ctx)).isEmpty();
        assertThat(new CompetitorGapHitPlugin().analyze(ctx)).isEmpty();
    }
}
