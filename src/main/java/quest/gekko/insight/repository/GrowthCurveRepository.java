package quest.gekko.insight.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.insight.domain.GrowthCurveEntry;

import java.util.List;

public interface GrowthCurveRepository extends JpaRepository<GrowthCurveEntry, Long> {
    List<GrowthCurveEntry> findByClusterIdAndDurationBucketOrderByDayNumberAsc(final int clusterId, final String durationBucket);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from GrowthCurveEntry g where g.clusterId = :cluster and g.durationBucket = :bucket")
    void deleteCurve(@Param("cluster") final int clusterId, @Param("bucket") final String durationBucket);
}
