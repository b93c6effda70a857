package quest.gekko.insight.provider;

import java.time.LocalDate;

/** One {@code (date, metric, value)} triple as returned by an analytics report. */
public record MetricRow(LocalDate date, String metric, double value) {
}
