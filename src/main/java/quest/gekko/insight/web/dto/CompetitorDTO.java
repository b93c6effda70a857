package quest.gekko.insight.web.dto;

import quest.gekko.insight.domain.CompetitorChannel;

public record CompetitorDTO(String channelId, String title, String customUrl, Long subscriberCount) {

    public static CompetitorDTO from(CompetitorChannel c) {
        return new CompetitorDTO(c.getChannelId(), c.getTitle(), c.getCustomUrl(), c.getSubscriberCount());
    }
}
