package quest.gekko.insight.ml.forecast;

import java.time.LocalDate;

public record TimeSeriesPoint(LocalDate date, double value) {
}
