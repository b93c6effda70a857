package quest.gekko.insight.service.analytics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.insight.domain.AccelerationTrend;
import quest.gekko.insight.domain.CompetitorSnapshot;
import quest.gekko.insight.domain.MomentumRecord;
import quest.gekko.insight.service.store.CompetitorStore;
import quest.gekko.insight.util.Stats;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Competitor momentum: daily view velocity, self-relative hit detection, acceleration and
 * sustained-momentum streaks. Snapshots are assumed non-decreasing; negative deltas clamp to zero.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MomentumService {
    public static final long HIT_FLOOR = 1_000;
    static final double HIT_PERCENTILE = 0.95;
    static final double EMA_ALPHA = 0.3;
    static final double TREND_THRESHOLD = 0.1;
    static final double SUSTAINED_RATIO = 1.5;
    static final int SUSTAINED_MIN_DAYS = 3;

    private final CompetitorStore competitorStore;

    /** Recomputes and stores momentum for {@code day}; no-op when the video has no snapshot history there. */
    public Optional<MomentumRecord> recompute(String videoId, LocalDate day) {
        Optional<MomentumRecord> computed = calculate(videoId, competitorStore.getSnapshots(videoId), day);
        computed.ifPresent(competitorStore::upsertMomentum);
        return computed;
    }

    /**
     * Momentum for the snapshot on {@code day}. Needs that snapshot and at least one earlier one.
     * Later snapshots are ignored.
     */
    public static Optional<MomentumRecord> calculate(String videoId, List<CompetitorSnapshot> snapshots, LocalDate day) {
        List<CompetitorSnapshot> sorted = snapshots.stream()
                .sorted(Comparator.comparing(CompetitorSnapshot::getSnapshotDate))
                .toList();

        int current = -1;
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i).getSnapshotDate().equals(day)) {
                current = i;
                break;
            }
        }
        if (current < 1) return Optional.empty();

        long[] views = sorted.subList(0, current + 1).stream().mapToLong(CompetitorSnapshot::getViewCount).toArray();
        double[] velocities = new double[current];
        for (int i = 1; i <= current; i++) {
            velocities[i - 1] = Math.max(0, views[i] - views[i - 1]);
        }

        long now = views[current];
        long velocity24h = (long) velocities[velocities.length - 1];
        long velocity7d = Math.max(0, now - (current >= 7 ? views[current - 7] : views[0]));

        double meanVelocity = Stats.mean(velocities);
        double threshold = percentile(Arrays.copyOf(velocities, velocities.length - 1));

        MomentumRecord record = new MomentumRecord();
        record.setVideoId(videoId);
        record.setMetricDate(day);
        record.setVelocity24h(velocity24h);
        record.setVelocity7d(velocity7d);
        record.setMomentumScore(meanVelocity > 0 ? velocity24h / meanVelocity : 0);
        record.setHit(velocity24h > threshold && velocity24h > HIT_FLOOR);

        if (velocities.length >= 3) {
            double[] smoothed = ema(velocities, EMA_ALPHA);
            int n = smoothed.length;
            double first = smoothed[n - 2] - smoothed[n - 3];
            double second = smoothed[n - 1] - smoothed[n - 2];
            record.setAcceleration(Math.round((second - first) * 100) / 100.0);

            double change = smoothed[n - 1] - smoothed[n - 3];
            double significance = meanVelocity * TREND_THRESHOLD;
            if (change > significance) {
                record.setAccelerationTrend(AccelerationTrend.ACCELERATING);
            } else if (change < -significance) {
                record.setAccelerationTrend(AccelerationTrend.DECELERATING);
            } else {
                record.setAccelerationTrend(AccelerationTrend.STABLE);
            }

            int streak = 0;
            for (int i = velocities.length - 1; i >= 0 && meanVelocity > 0 && velocities[i] / meanVelocity > SUSTAINED_RATIO; i--) {
                streak++;
            }
            record.setSustainedDays(streak);
            record.setSustained(streak >= SUSTAINED_MIN_DAYS);
        }
        return Optional.of(record);
    }

    /** Order statistic at floor(n * 0.95); 0 for no history. */
    static double percentile(double[] history) {
        if (history.length == 0) return 0;
        double[] sorted = history.clone();
        Arrays.sort(sorted);
        return sorted[Math.min(sorted.length - 1, (int) Math.floor(sorted.length * HIT_PERCENTILE))];
    }

    static double[] ema(double[] values, double alpha) {
        double[] out = new double[values.length];
        out[0] = values[0];
        for (int i = 1; i < values.length; i++) {
            out[i] = alpha * values[i] + (1 - alpha) * out[i - 1];
        }
        return out;
    }
}
