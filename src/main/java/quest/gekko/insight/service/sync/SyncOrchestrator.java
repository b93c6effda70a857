package quest.gekko.insight.service.sync;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.insight.config.InsightProperties;
import quest.gekko.insight.domain.ChannelDayMetric;
import quest.gekko.insight.domain.CompetitorChannel;
import quest.gekko.insight.domain.SyncRun;
import quest.gekko.insight.domain.SyncStatus;
import quest.gekko.insight.domain.Video;
import quest.gekko.insight.domain.VideoDayMetric;
import quest.gekko.insight.error.AppException;
import quest.gekko.insight.error.ErrorCode;
import quest.gekko.insight.provider.ChannelInfo;
import quest.gekko.insight.provider.DataProvider;
import quest.gekko.insight.provider.MetricRow;
import quest.gekko.insight.provider.VideoInfo;
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
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Seven-stage sync of the owned channel and tracked competitors. Stages run strictly in order and
 * the first failing stage aborts the run, which is then recorded as failed and rethrown as an
 * {@link AppException}. Only one run may be in flight; a concurrent call fails immediately.
 */
@Slf4j
@Service
public class SyncOrchestrator {
    public static final String MODE_DAILY = "daily_sync";

    private final DataProvider provider;
    private final AnalyticsStore store;
    private final CompetitorStore competitorStore;
    private final SyncRunStore syncRuns;
    private final NowcastService nowcast;
    private final QualityScoreService qualityScores;
    private final MomentumService momentum;
    private final TopicEngine topicEngine;
    private final InsightPluginRegistry plugins;
    private final InsightDataAccess dataAccess;
    private final PerfRecorder perf;
    private final InsightProperties.YouTube youtube;
    private final InsightProperties.Sync sync;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public SyncOrchestrator(DataProvider provider, AnalyticsStore store, CompetitorStore competitorStore,
                            SyncRunStore syncRuns, NowcastService nowcast, QualityScoreService qualityScores,
                            MomentumService momentum, TopicEngine topicEngine, InsightPluginRegistry plugins,
                            InsightDataAccess dataAccess, PerfRecorder perf, InsightProperties.YouTube youtube,
                            InsightProperties.Sync sync, Clock clock) {
        this.provider = provider;
        this.store = store;
        this.competitorStore = competitorStore;
        this.syncRuns = syncRuns;
        this.nowcast = nowcast;
        this.qualityScores = qualityScores;
        this.momentum = momentum;
        this.topicEngine = topicEngine;
        this.plugins = plugins;
        this.dataAccess = dataAccess;
        this.perf = perf;
        this.youtube = youtube;
        this.sync = sync;
        this.clock = clock;
    }

    public boolean isRunning() {
        return running.get();
    }

    public SyncResult run(DateRange requested) {
        return run(requested, p -> log.info("[{}%] {}", p.progress(), p.message()));
    }

    /**
     * Runs the pipeline over the wider of {@code requested} and the configured lookback, ending
     * today. {@code requested} may be null to use the lookback alone.
     */
    public SyncResult run(DateRange requested, SyncProgressListener listener) {
        if (!running.compareAndSet(false, true)) {
            throw AppException.syncFailed("Sync already running");
        }

        Long runId = null;
        try {
            SyncRun run = syncRuns.start(MODE_DAILY);
            runId = run.getId();
            long id = runId;
            log.info("Sync run {} started", id);
            SyncResult result = perf.measure("sync_full_run", () -> execute(id, requested, listener));
            listener.onProgress(new SyncProgress(SyncStage.COMPLETE, SyncStage.COMPLETE.progress(), SyncStage.COMPLETE.message()));
            syncRuns.checkpoint(id, SyncStage.COMPLETE.checkpoint());
            syncRuns.finish(id, SyncStatus.SUCCESS, "Completed successfully");
            log.info("Sync run {} finished: {} videos, {} insights, {} alerts", id, result.videos(), result.insights(), result.alerts());
            return result;
        } catch (RuntimeException e) {
            AppException error = AppException.from(e);
            log.error("Sync run {} failed with {}: {}", runId, error.getCode(), error.getMessage(), e);
            listener.onProgress(new SyncProgress(SyncStage.FAILED, SyncStage.FAILED.progress(), SyncStage.FAILED.message()));
            if (runId != null) syncRuns.finish(runId, SyncStatus.FAILED, error.getMessage());
            throw error;
        } finally {
            running.set(false);
        }
    }

    private SyncResult execute(long runId, DateRange requested, SyncProgressListener listener) {
        LocalDate today = LocalDate.now(clock);
        DateRange range = requested == null
                ? DateRange.lastDays(today, sync.lookbackDays())
                : requested.widenTo(today, sync.lookbackDays());
        String owned = youtube.ownedChannelId();

        ChannelInfo channel = stage(runId, SyncStage.CHANNEL_PROFILE, listener, () -> {
            ChannelInfo info = provider.getChannel(owned);
            store.upsertChannel(info);
            return info;
        });

        List<VideoInfo> videos = stage(runId, SyncStage.VIDEO_METADATA, listener, () -> {
            List<VideoInfo> listed = provider.listVideos(owned, sync.maxVideos());
            store.upsertVideos(channel.id(), listed);
            return listed;
        });

        int channelDays = stage(runId, SyncStage.CHANNEL_METRICS, listener, () -> {
            List<ChannelDayMetric> facts = MetricPivot.channelDays(channel.id(), provider.getChannelDailyMetrics(channel.id(), range));
            return store.upsertChannelDays(facts);
        });

        int videoDays = stage(runId, SyncStage.VIDEO_METRICS, listener, () -> {
            Map<String, List<MetricRow>> metrics = fetchVideoMetrics(videos.stream().map(VideoInfo::id).toList(), range);
            List<VideoDayMetric> facts = new ArrayList<>();
            metrics.forEach((videoId, rows) -> facts.addAll(MetricPivot.videoDays(videoId, rows)));
            return store.upsertVideoDays(facts);
        });

        stage(runId, SyncStage.ADVANCED_ANALYTICS, listener, () -> {
            nowcast.refitGrowthCurves();
            DateRange window = DateRange.lastDays(today, QualityScoreService.WINDOW_DAYS);
            for (Video video : store.getAllVideos()) {
                qualityScores.recompute(video.getVideoId(), window);
            }
            return null;
        });

        int competitorVideos = stage(runId, SyncStage.COMPETITORS, listener, () -> refreshCompetitors(today));

        InsightPluginRegistry.RunSummary summary = stage(runId, SyncStage.INSIGHTS, listener, () -> {
            refreshTopics();
            return plugins.runAll(new InsightContext(runId, channel.id(), range, dataAccess));
        });

        return new SyncResult(runId, channel.id(), videos.size(), channelDays, videoDays, competitorVideos,
                summary.insights(), summary.alerts(), summary.failedPlugins());
    }

    private <T> T stage(long runId, SyncStage stage, SyncProgressListener listener, Supplier<T> body) {
        listener.onProgress(new SyncProgress(stage, stage.progress(), stage.message()));
        log.info("Sync run {}: {}", runId, stage.checkpoint());
        T result = perf.measure(stage.perfName(), body);
        syncRuns.checkpoint(runId, stage.checkpoint());
        return result;
    }

    /**
     * Per-video metric fetch with a bounded pool pulling ids from a shared queue. A video whose
     * fetch fails gets no rows; an authorization failure stops the whole stage.
     */
    Map<String, List<MetricRow>> fetchVideoMetrics(List<String> videoIds, DateRange range) {
        Map<String, List<MetricRow>> results = new ConcurrentHashMap<>();
        if (videoIds.isEmpty()) return results;

        Queue<String> queue = new ConcurrentLinkedQueue<>(videoIds);
        int workers = Math.max(1, Math.min(sync.videoMetricWorkers(), videoIds.size()));
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            CompletableFuture<?>[] futures = new CompletableFuture<?>[workers];
            for (int i = 0; i < workers; i++) {
                futures[i] = CompletableFuture.runAsync(() -> drain(queue, results, range), pool);
            }
            CompletableFuture.allOf(futures).join();
        } finally {
            pool.shutdownNow();
        }
        return results;
    }

    private void drain(Queue<String> queue, Map<String, List<MetricRow>> results, DateRange range) {
        String videoId;
        while ((videoId = queue.poll()) != null) {
            try {
                results.put(videoId, provider.getVideoDailyMetrics(List.of(videoId), range).getOrDefault(videoId, List.of()));
            } catch (RuntimeException e) {
                AppException error = AppException.from(e);
                if (error.getCode() == ErrorCode.AUTH_ERROR) {
                    queue.clear();
                    throw error;
                }
                log.warn("Failed to fetch metrics for video {}: {}", videoId, error.getMessage());
                results.put(videoId, List.of());
            }
        }
    }

    private int refreshCompetitors(LocalDate today) {
        int count = 0;
        for (CompetitorChannel competitor : competitorStore.getCompetitors()) {
            List<VideoInfo> videos = provider.getPublicVideos(competitor.getChannelId(), sync.competitorVideos());
            for (VideoInfo video : videos) {
                competitorStore.upsertVideo(competitor.getChannelId(), video);
                competitorStore.upsertSnapshot(video.id(), today, video.views());
                momentum.recompute(video.id(), today);
                count++;
            }
            log.info("Competitor {}: {} videos refreshed", competitor.getChannelId(), videos.size());
        }
        return count;
    }

    /** Gap analysis feeds the gap-hit alert but is advisory; a failure here does not abort the run. */
    private void refreshTopics() {
        try {
            perf.measure("topic_clustering", topicEngine::runClustering);
        } catch (RuntimeException e) {
            log.warn("Topic clustering failed, plugins will see the previous clusters", e);
        }
    }
}
