package quest.gekko.insight.service.store;

import java.time.LocalDate;

public record CompetitorHit(String videoId, String title, String channelId, LocalDate day, long velocity24h) {
}
