package quest.gekko.insight.provider;

import java.time.Instant;

public record ChannelInfo(String id, String title, long subscriberCount, Instant createdAt,
                          String uploadsPlaylistId, String customUrl) {
}
