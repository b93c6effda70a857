package quest.gekko.insight.web.dto;

import quest.gekko.insight.domain.TopicCluster;

public record TopicGapDTO(Long clusterId, String name, int members, double competitorShare,
                          Double gapScore, String reason) {

    public static TopicGapDTO from(TopicCluster c) {
        return new TopicGapDTO(c.getId(), c.getName(), c.getMemberCount(), c.getCompetitorShare(),
                c.getGapScore(), c.getGapReason());
    }
}
