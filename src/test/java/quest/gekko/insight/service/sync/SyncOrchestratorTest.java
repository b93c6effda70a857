package quest.gekko.insight.service.sync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.insight.config.InsightProperties;
import quest.gekko.insight.domain.CompetitorChannel;
import quest.gekko.insight.domain.SyncRun;
import quest.gekko.insight.domain.SyncStatus;
import quest.gekko.insight.error.AppException;
import quest.gekko.insight.error.ErrorCode;
import quest.gekko.insight.provider.ChannelInfo;
import quest.gekko.insight.provider.DataProvider;
import quest.gekko.insight.provider.MetricRow;
import quest.gekko.insight.provider.VideoInfo;
import quest.gekko.insight.repository.PerfEventRepository;
import quest.gekko.insight.service.analytics.MomentumService;
import quest.gekko.insight.service.analytics.NowcastService;
import quest.gekko.insight.service.analytics.QualityScoreService;
import quest.gekko.insight.service.analytics.TopicEngine;
import quest.gekko.insight.service.plugin.InsightContext;
import quest.gekko.insight.service.plugin.InsightDataAccess;
import quest.gekko.insight.service.plugin.InsightPluginRegistry;
import quest.gekko.insight.service.store.AnalyticsStore;
import quest.gekko.insight.service.store.CompetitorStore;
import quest.gekko.insight.service.store.SyncRunStore;
import quest.gekko.insight.util.DateRange;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncOrchestratorTest {
    private static final Instant NOW = Instant.parse("2024-06-30T02:10:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);
    private static final long RUN_ID = 5L;

    @Mock private DataProvider provider;
    @Mock private AnalyticsStore store;
    @Mock private CompetitorStore competitorStore;
    @Mock private SyncRunStore syncRuns;
    @Mock private NowcastService nowcast;
    @Mock private QualityScoreService qualityScores;
    @Mock private MomentumService momentum;
    @Mock private TopicEngine topicEngine;
    @Mock private InsightPluginRegistry plugins;
    @Mock private InsightDataAccess dataAccess;

    private SyncOrchestrator orchestrator;
    private final List<SyncProgress> progress = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        InsightProperties.YouTube youtube = new InsightProperties.YouTube(null, "token", "MINE",
                "https://example.test/youtube/v3", "https://example.test/analytics/v2");
        InsightProperties.Sync sync = new InsightProperties.Sync(21, 50, 20, 2, "0 10 2 * * *", false);
        orchestrator = new SyncOrchestrator(provider, store, competitorStore, syncRuns, nowcast, qualityScores,
                momentum, topicEngine, plugins, dataAccess, new PerfRecorder(mock(PerfEventRepository.class)),
                youtube, sync, Clock.fixed(NOW, ZoneOffset.UTC));

        SyncRun run = new SyncRun();
        run.setId(RUN_ID);
        lenient().when(syncRuns.start(SyncOrchestrator.MODE_DAILY)).thenReturn(run);
        lenient().when(provider.getChannel("MINE"))
                .thenReturn(new ChannelInfo("UC1", "Mine", 100, null, "UU1", null));
        lenient().when(provider.listVideos("MINE", 50)).thenReturn(List.of(
                new VideoInfo("v1", "One", 10, null, 60),
                new VideoInfo("v2", "Two", 20, null, 60)));
        lenient().when(provider.getChannelDailyMetrics(eq("UC1"), any()))
                .thenReturn(List.of(new MetricRow(TODAY, "views", 100)));
        lenient().when(provider.getVideoDailyMetrics(anyList(), any())).thenAnswer(inv -> {
            List<String> ids = inv.getArgument(0);
            return Map.of(ids.get(0), List.of(new MetricRow(TODAY, "views", 7)));
        });
        lenient().when(store.upsertChannelDays(anyCollection())).thenAnswer(inv -> ((Collection<?>) inv.getArgument(0)).size());
        lenient().when(store.upsertVideoDays(anyCollection())).thenAnswer(inv -> ((Collection<?>) inv.getArgument(0)).size());
        lenient().when(plugins.runAll(any())).thenReturn(new InsightPluginRegistry.RunSummary(4, 1, List.of()));
    }

    @Test
    @DisplayName("a successful run reports every stage in order and finishes as SUCCESS")
    void stagesInOrder() {
        SyncResult result = orchestrator.run(null, progress::add);

        assertThat(progress).extracting(SyncProgress::stage).containsExactly(
                SyncStage.CHANNEL_PROFILE, SyncStage.VIDEO_METADATA, SyncStage.CHANNEL_METRICS,
                SyncStage.VIDEO_METRICS, SyncStage.ADVANCED_ANALYTICS, SyncStage.COMPETITORS,
                SyncStage.INSIGHTS, SyncStage.COMPLETE);
        assertThat(progress).extracting(SyncProgress::progress).isSorted();

        assertThat(result.runId()).isEqualTo(RUN_ID);
        assertThat(result.channelId()).isEqualTo("UC1");
        assertThat(result.videos()).isEqualTo(2);
        assertThat(result.channelDays()).isEqualTo(1);
        assertThat(result.videoDays()).isEqualTo(2);
        assertThat(result.insights()).isEqualTo(4);
        assertThat(result.alerts()).isEqualTo(1);

        verify(syncRuns).checkpoint(RUN_ID, "channel_profile");
        verify(syncRuns).checkpoint(RUN_ID, "insights");
        verify(syncRuns).finish(eq(RUN_ID), eq(SyncStatus.SUCCESS), anyString());
        verify(nowcast).refitGrowthCurves();
        assertThat(orchestrator.isRunning()).isFalse();
    }

    @Test
    @DisplayName("without a requested range the configured lookback ending today is used")
    void defaultRange() {
        orchestrator.run(null, progress::add);

        verify(provider).getChannelDailyMetrics("UC1", new DateRange(TODAY.minusDays(21), TODAY));
        verify(plugins).runAll(new InsightContext(RUN_ID, "UC1", new DateRange(TODAY.minusDays(21), TODAY), dataAccess));
    }

    @Test
    @DisplayName("the requested range is widened, never shrunk")
    void requestedRangeIsWidenedNotShrunk() {
        orchestrator.run(new DateRange(TODAY.minusDays(60), TODAY.minusDays(30)), progress::add);

        verify(provider).getChannelDailyMetrics("UC1", new DateRange(TODAY.minusDays(60), TODAY));
    }

    @Test
    @DisplayName("a failing stage aborts the run, marks it FAILED and rethrows")
    void failureAbortsRun() {
        when(provider.getChannelDailyMetrics(eq("UC1"), any()))
                .thenThrow(new AppException(ErrorCode.NETWORK_ERROR, "HTTP error 503", true));

        assertThatThrownBy(() -> orchestrator.run(null, progress::add))
                .isInstanceOfSatisfying(AppException.class, e -> assertThat(e.getCode()).isEqualTo(ErrorCode.NETWORK_ERROR));

        verify(syncRuns).finish(RUN_ID, SyncStatus.FAILED, "HTTP error 503");
        verify(syncRuns, never()).checkpoint(RUN_ID, "channel_metrics");
        verify(plugins, never()).runAll(any());
        assertThat(progress).extracting(SyncProgress::stage).endsWith(SyncStage.CHANNEL_METRICS, SyncStage.FAILED);
        assertThat(orchestrator.isRunning()).isFalse();
    }

    @Test
    @DisplayName("unexpected exceptions are normalized before they leave the pipeline")
    void unexpectedErrorIsNormalized() {
        when(provider.getChannel("MINE")).thenThrow(new IllegalStateException("connection refused by peer"));

        assertThatThrownBy(() -> orchestrator.run(null, progress::add))
                .isInstanceOfSatisfying(AppException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(ErrorCode.NETWORK_ERROR);
                    assertThat(e.isRetryable()).isTrue();
                });
    }

    @Test
    @DisplayName("a second run while one is in flight fails with SYNC_FAILED")
    void concurrentRunIsRejected() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(provider.getChannel("MINE")).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new ChannelInfo("UC1", "Mine", 100, null, "UU1", null);
        });

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SyncResult> first = executor.submit(() -> orchestrator.run(null, progress::add));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(orchestrator.isRunning()).isTrue();

            assertThatThrownBy(() -> orchestrator.run(null, p -> { }))
                    .isInstanceOfSatisfying(AppException.class, e -> assertThat(e.getCode()).isEqualTo(ErrorCode.SYNC_FAILED));

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).channelId()).isEqualTo("UC1");
        } finally {
            executor.shutdownNow();
        }
        verify(syncRuns).start(SyncOrchestrator.MODE_DAILY);
    }

    @Test
    @DisplayName("one video failing leaves it empty; an auth failure stops the run")
    void videoMetricFailures() {
        when(provider.getVideoDailyMetrics(eq(List.of("v1")), any()))
                .thenThrow(new AppException(ErrorCode.NETWORK_ERROR, "HTTP error 500", true));
        DateRange range = new DateRange(TODAY.minusDays(3), TODAY);

        Map<String, List<MetricRow>> result = orchestrator.fetchVideoMetrics(List.of("v1", "v2"), range);

        assertThat(result).containsOnlyKeys("v1", "v2");
        assertThat(result.get("v1")).isEmpty();
        assertThat(result.get("v2")).hasSize(1);

        when(provider.getVideoDailyMetrics(eq(List.of("v2")), any()))
                .thenThrow(new AppException(ErrorCode.AUTH_ERROR, "Unauthorized: token expired or invalid", false));
        assertThatThrownBy(() -> orchestrator.run(null, progress::add))
                .isInstanceOfSatisfying(AppException.class, e -> assertThat(e.getCode()).isEqualTo(ErrorCode.AUTH_ERROR));
        verify(syncRuns).finish(RUN_ID, SyncStatus.FAILED, "Unauthorized: token expired or invalid");
    }

    @Test
    @DisplayName("competitor videos are snapshotted and their momentum recomputed")
    void competitorsAreRefreshed() {
        CompetitorChannel rival = new CompetitorChannel();
        rival.setChannelId("UC_rival");
        when(competitorStore.getCompetitors()).thenReturn(List.of(rival));
        when(provider.getPublicVideos("UC_rival", 20)).thenReturn(List.of(new VideoInfo("c1", "Rival", 5_000, null, 300)));

        SyncResult result = orchestrator.run(null, progress::add);

        assertThat(result.competitorVideos()).isEqualTo(1);
        verify(competitorStore).upsertVideo(eq("UC_rival"), any(VideoInfo.class));
        verify(competitorStore).upsertSnapshot("c1", TODAY, 5_000);
        verify(momentum).recompute("c1", TODAY);
    }

    @Test
    @DisplayName("a topic clustering failure does not abort the run")
    void topicClusteringFailureDoesNotAbortTheRun() {
        when(topicEngine.runClustering()).thenThrow(new IllegalStateException("not enough titles"));

        SyncResult result = orchestrator.run(null, progress::add);

        assertThat(result.insights()).isEqualTo(4);
        verify(syncRuns).finish(eq(RUN_ID), eq(SyncStatus.SUCCESS), anyString());
    }
}
