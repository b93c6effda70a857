package quest.gekko.insight.provider;

import java.time.Instant;

/** {@code views} is the lifetime public view count at fetch time. */
public record VideoInfo(String id, String title, long views, Instant publishedAt, int durationSec) {
}
