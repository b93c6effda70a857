package quest.gekko.insight.ml.nowcast;

/** Share of the day-28 cumulative total reached by {@code day}, across a video population. */
public record GrowthCurvePoint(int day, double medianPct, double p25Pct, double p75Pct) {
}
