package quest.gekko.insight.service.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import quest.gekko.insight.domain.CompetitorSnapshot;
import quest.gekko.insight.domain.MomentumRecord;
import quest.gekko.insight.provider.ChannelInfo;
import quest.gekko.insight.provider.VideoInfo;
import quest.gekko.insight.repository.MomentumRecordRepository;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(CompetitorStore.class)
class CompetitorStoreTest {
    private static final LocalDate DAY = LocalDate.of(2024, 6, 10);

    @Autowired
    private CompetitorStore store;

    @Autowired
    private MomentumRecordRepository momentum;

    private static MomentumRecord record(String videoId, LocalDate day, long velocity, boolean hit) {
        MomentumRecord r = new MomentumRecord();
        r.setVideoId(videoId);
        r.setMetricDate(day);
        r.setVelocity24h(velocity);
        r.setHit(hit);
        return r;
    }

    @Test
    @DisplayName("adding a competitor twice keeps one row")
    void addingACompetitorTwiceKeepsOneRow() {
        store.addCompetitor(new ChannelInfo("UC_rival", "Rival", 100, null, "UU", "@rival"));
        store.addCompetitor(new ChannelInfo("UC_rival", "Rival renamed", 200, null, "UU", "@rival"));

        assertThat(store.getCompetitors()).singleElement()
                .satisfies(c -> assertThat(c.getTitle()).isEqualTo("Rival renamed"));
    }

    @Test
    @DisplayName("a snapshot per (video, day); later writes overwrite the count")
    void snapshotsAreKeyedByDay() {
        store.upsertSnapshot("c1", DAY, 100);
        store.upsertSnapshot("c1", DAY.plusDays(1), 250);
        store.upsertSnapshot("c1", DAY, 120);

        assertThat(store.getSnapshots("c1")).extracting(CompetitorSnapshot::getViewCount).containsExactly(120L, 250L);
    }

    @Test
    @DisplayName("recent hits are joined with their video and ordered by velocity")
    void recentHits() {
        store.upsertVideo("UC_rival", new VideoInfo("c1", "Slow burner", 10, null, 60));
        store.upsertVideo("UC_rival", new VideoInfo("c2", "Breakout", 10, null, 60));
        store.upsertMomentum(record("c1", DAY, 2_000, true));
        store.upsertMomentum(record("c2", DAY, 9_000, true));
        store.upsertMomentum(record("c2", DAY.minusDays(10), 5_000, true));
        store.upsertMomentum(record("c1", DAY.minusDays(1), 300, false));

        List<CompetitorHit> hits = store.getRecentHits(DAY.minusDays(3));

        assertThat(hits).extracting(CompetitorHit::videoId).containsExactly("c2", "c1");
        assertThat(hits.get(0).title()).isEqualTo("Breakout");
        assertThat(hits.get(0).channelId()).isEqualTo("UC_rival");
    }

    @Test
    @DisplayName("momentum for the same day is superseded")
    void momentumIsSupersededForTheSameDay() {
        store.upsertMomentum(record("c1", DAY, 100, false));
        store.upsertMomentum(record("c1", DAY, 4_000, true));

        assertThat(momentum.findAll()).singleElement().satisfies(r -> {
            assertThat(r.getVelocity24h()).isEqualTo(4_000);
            assertThat(r.isHit()).isTrue();
        });
    }
}
