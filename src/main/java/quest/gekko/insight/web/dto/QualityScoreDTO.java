package quest.gekko.insight.web.dto;

import quest.gekko.insight.domain.QualityScore;

public record QualityScoreDTO(String videoId, double score, double velocityScore, double efficiencyScore,
                              double conversionScore, String explainJson) {

    public static QualityScoreDTO from(QualityScore q) {
        return new QualityScoreDTO(q.getVideoId(), q.getScore(), q.getVelocityScore(), q.getEfficiencyScore(),
                q.getConversionScore(), q.getExplainJson());
    }
}
