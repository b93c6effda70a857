package quest.gekko.insight.provider.youtube;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import quest.gekko.insight.config.InsightProperties;
import quest.gekko.insight.error.AppException;
import quest.gekko.insight.provider.ChannelInfo;
import quest.gekko.insight.provider.DataProvider;
import quest.gekko.insight.provider.MetricRow;
import quest.gekko.insight.provider.VideoInfo;
import quest.gekko.insight.util.DateRange;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link DataProvider} backed by the YouTube Data API v3 and the YouTube Analytics API v2.
 * Rate limiting and retries live in {@link ApiHttpClient}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "insight.provider", havingValue = "youtube", matchIfMissing = true)
public class YouTubeDataProvider implements DataProvider {
    static final String CHANNEL_METRICS = "views,estimatedMinutesWatched,averageViewDuration,subscribersGained,subscribersLost";
    static final String VIDEO_METRICS = "views,estimatedMinutesWatched,averageViewDuration,likes,comments";
    private static final int PAGE_SIZE = 50;

    private final ApiHttpClient http;
    private final InsightProperties.YouTube youtube;

    @Override
    @SuppressWarnings("unchecked")
    public ChannelInfo getChannel(String channelId) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(youtube.baseUrl() + "/channels")
                .queryParam("part", "snippet,statistics,contentDetails");
        if ("MINE".equals(channelId)) uri.queryParam("mine", "true");
        else uri.queryParam("id", channelId);

        List<Map<String, Object>> items = safeItems(http.get(uri.toUriString()));
        if (items.isEmpty()) throw AppException.notFound("Channel not found: " + channelId);

        Map<String, Object> item = items.get(0);
        Map<String, Object> snippet = (Map<String, Object>) item.getOrDefault("snippet", Map.of());
        Map<String, Object> stats = (Map<String, Object>) item.getOrDefault("statistics", Map.of());
        Map<String, Object> details = (Map<String, Object>) item.getOrDefault("contentDetails", Map.of());
        Map<String, Object> playlists = (Map<String, Object>) details.getOrDefault("relatedPlaylists", Map.of());

        return new ChannelInfo(
                (String) item.get("id"),
                (String) snippet.getOrDefault("title", ""),
                parseLong(stats.get("subscriberCount")),
                parseInstant(snippet.get("publishedAt")),
                (String) playlists.get("uploads"),
                (String) snippet.get("customUrl"));
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<VideoInfo> listVideos(String channelId, int maxResults) {
        ChannelInfo channel = getChannel(channelId);
        if (channel.uploadsPlaylistId() == null) return List.of();

        List<VideoInfo> videos = new ArrayList<>();
        String pageToken = null;
        while (videos.size() < maxResults) {
            UriComponentsBuilder plUri = UriComponentsBuilder.fromHttpUrl(youtube.baseUrl() + "/playlistItems")
                    .queryParam("part", "contentDetails")
                    .queryParam("playlistId", channel.uploadsPlaylistId())
                    .queryParam("maxResults", PAGE_SIZE);
            if (pageToken != null) plUri.queryParam("pageToken", pageToken);

            Map<String, Object> page = http.get(plUri.toUriString());
            List<Map<String, Object>> items = safeItems(page);
            if (items.isEmpty()) break;

            String ids = String.join(",", items.stream()
                    .map(it -> (Map<String, Object>) it.get("contentDetails"))
                    .filter(Objects::nonNull)
                    .map(cd -> (String) cd.get("videoId"))
                    .filter(Objects::nonNull)
                    .toList());

            Map<String, Object> details = http.get(UriComponentsBuilder.fromHttpUrl(youtube.baseUrl() + "/videos")
                    .queryParam("part", "snippet,statistics,contentDetails")
                    .queryParam("id", ids)
                    .toUriString());
            for (Map<String, Object> item : safeItems(details)) {
                videos.add(mapVideo(item));
            }

            pageToken = (String) page.get("nextPageToken");
            if (pageToken == null) break;
        }
        return videos.size() > maxResults ? List.copyOf(videos.subList(0, maxResults)) : videos;
    }

    @Override
    public List<MetricRow> getChannelDailyMetrics(String channelId, DateRange range) {
        String url = reportUri(range, CHANNEL_METRICS).toUriString();
        return mapAnalyticsResponse(http.get(url));
    }

    @Override
    public Map<String, List<MetricRow>> getVideoDailyMetrics(List<String> videoIds, DateRange range) {
        Map<String, List<MetricRow>> result = new LinkedHashMap<>();
        for (String videoId : videoIds) {
            String url = reportUri(range, VIDEO_METRICS).queryParam("filters", "video==" + videoId).toUriString();
            result.put(videoId, mapAnalyticsResponse(http.get(url)));
        }
        return result;
    }

    private UriComponentsBuilder reportUri(DateRange range, String metrics) {
        return UriComponentsBuilder.fromHttpUrl(youtube.analyticsBaseUrl() + "/reports")
                .queryParam("ids", "channel==MINE")
                .queryParam("startDate", range.from().toString())
                .queryParam("endDate", range.to().toString())
                .queryParam("metrics", metrics)
                .queryParam("dimensions", "day")
                .queryParam("sort", "day");
    }

    // ---- Helpers ----

    @SuppressWarnings("unchecked")
    static List<MetricRow> mapAnalyticsResponse(Map<String, Object> data) {
        Object headersObj = data.get("columnHeaders");
        Object rowsObj = data.get("rows");
        if (!(headersObj instanceof List<?> headers) || !(rowsObj instanceof List<?> rows)) return List.of();

        List<String> names = headers.stream().map(h -> (String) ((Map<String, Object>) h).get("name")).toList();
        List<MetricRow> out = new ArrayList<>();
        for (Object rowObj : rows) {
            List<Object> row = (List<Object>) rowObj;
            LocalDate date = LocalDate.parse(row.get(0).toString());
            for (int i = 1; i < names.size() && i < row.size(); i++) {
                out.add(new MetricRow(date, names.get(i), parseDouble(row.get(i))));
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static VideoInfo mapVideo(Map<String, Object> item) {
        Map<String, Object> snippet = (Map<String, Object>) item.getOrDefault("snippet", Map.of());
        Map<String, Object> stats = (Map<String, Object>) item.getOrDefault("statistics", Map.of());
        Map<String, Object> details = (Map<String, Object>) item.getOrDefault("contentDetails", Map.of());
        return new VideoInfo(
                (String) item.get("id"),
                (String) snippet.getOrDefault("title", ""),
                parseLong(stats.get("viewCount")),
                parseInstant(snippet.get("publishedAt")),
                parseDuration((String) details.get("duration")));
    }

    static int parseDuration(String iso) {
        if (iso == null || iso.isBlank()) return 0;
        try {
            return (int) Duration.parse(iso).getSeconds();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable video duration {}", iso);
            return 0;
        }
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> safeItems(Map<?, ?> obj) {
        if (obj == null) return List.of();
        Object itemsObj = obj.get("items");
        if (!(itemsObj instanceof List<?> list)) return List.of();
        return (List<Map<String, Object>>) (List<?>) list;
    }

    private static Instant parseInstant(Object o) {
        if (o == null) return null;
        try {
            return Instant.parse(o.toString());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static long parseLong(Object o) {
        if (o == null) return 0L;
        if (o instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(o.toString());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private static double parseDouble(Object o) {
        if (o == null) return 0d;
        if (o instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(o.toString());
        } catch (NumberFormatException e) {
            return 0d;
        }
    }
}
