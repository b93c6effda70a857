package quest.gekko.insight.ml.nowcast;

/** Daily views of one video in publish order, day 1 first. */
public record VideoViewHistory(String videoId, int durationSec, double[] dailyViews) {
}
