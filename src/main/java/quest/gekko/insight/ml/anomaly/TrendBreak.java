package quest.gekko.insight.ml.anomaly;

import java.time.LocalDate;

/** {@code breakDate} is the first day of the new regime. */
public record TrendBreak(LocalDate breakDate, double meanBefore, double meanAfter, double changePercent) {
}
