package quest.gekko.insight.util;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/** Inclusive calendar-day range. */
public record DateRange(LocalDate from, LocalDate to) {

    public DateRange {
        if (from == null || to == null) throw new IllegalArgumentException("Range bounds are required");
        if (from.isAfter(to)) throw new IllegalArgumentException("Range start " + from + " is after end " + to);
    }

    public static DateRange lastDays(LocalDate today, int days) {
        return new DateRange(today.minusDays(days), today);
    }

    public long days() {
        return ChronoUnit.DAYS.between(from, to) + 1;
    }

    /** The wider of this range and the trailing {@code days} ending today; always ends today. */
    public DateRange widenTo(LocalDate today, int days) {
        LocalDate lookbackStart = today.minusDays(days);
        return new DateRange(from.isBefore(lookbackStart) ? from : lookbackStart, today);
    }
}
