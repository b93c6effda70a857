package quest.gekko.insight.ml.forecast;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Helpers shared by the forecaster implementations. */
final class Forecasts {

    private Forecasts() {
    }

    static void validate(List<TimeSeriesPoint> history, int horizon) {
        if (history == null || history.isEmpty()) {
            throw new IllegalArgumentException("History must contain at least one point");
        }
        if (horizon <= 0) {
            throw new IllegalArgumentException("Horizon must be positive, got " + horizon);
        }
    }

    static double[] values(List<TimeSeriesPoint> history) {
        return history.stream().mapToDouble(TimeSeriesPoint::value).toArray();
    }

    static LocalDate lastDate(List<TimeSeriesPoint> history) {
        return history.get(history.size() - 1).date();
    }

    static double lastValue(List<TimeSeriesPoint> history) {
        return history.get(history.size() - 1).value();
    }

    static List<TimeSeriesPoint> series(LocalDate lastDate, double[] values) {
        List<TimeSeriesPoint> out = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            out.add(new TimeSeriesPoint(lastDate.plusDays(i + 1L), Math.max(0, values[i])));
        }
        return out;
    }
}
