package quest.gekko.insight.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.insight.domain.ForecastModel;

import java.util.List;
import java.util.Optional;

public interface ForecastModelRepository extends JpaRepository<ForecastModel, Long> {
    Optional<ForecastModel> findByModelId(final String modelId);
    Optional<ForecastModel> findFirstByModelTypeAndActiveTrueOrderByTrainedAtDesc(final String modelType);
    List<ForecastModel> findByModelTypeOrderBySmapeAsc(final String modelType);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ForecastModel m set m.active = false where m.modelType = :type")
    int deactivateByType(@Param("type") final String modelType);
}
