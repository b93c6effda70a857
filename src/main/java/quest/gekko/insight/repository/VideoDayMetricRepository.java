package quest.gekko.insight.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insight.domain.VideoDayMetric;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface VideoDayMetricRepository extends JpaRepository<VideoDayMetric, Long> {
    Optional<VideoDayMetric> findByVideoIdAndMetricDate(final String videoId, final LocalDate metricDate);
    List<VideoDayMetric> findByVideoIdAndMetricDateBetweenOrderByMetricDateAsc(final String videoId, final LocalDate from, final LocalDate to);
}
