package quest.gekko.insight.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insight.domain.ChannelDayMetric;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ChannelDayMetricRepository extends JpaRepository<ChannelDayMetric, Long> {
    Optional<ChannelDayMetric> findByChannelIdAndMetricDate(final String channelId, final LocalDate metricDate);
    List<ChannelDayMetric> findByChannelIdAndMetricDateBetweenOrderByMetricDateAsc(final String channelId, final LocalDate from, final LocalDate to);
}
