package io.dtindex.frequency;

import static com.google.common.base.Preconditions.checkArgument;

import io.dtindex.format.IndexFormat;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * A frequency of a fixed number of calendar days, like "days 1" or "days 7".
 *
 * @param step the number of calendar days per period
 */
public record DayFrequency(int step) implements Frequency {
  public static final String NAME = "days";

  /** Validates the step. */
  public DayFrequency {
    checkArgument(step > 0, "step must be positive: %s", step);
  }

  @Override
  public ZonedDateTime advance(ZonedDateTime dt, int n) {
    return dt.plusDays((long) step * n);
  }

  @Override
  public int difference(ZonedDateTime from, ZonedDateTime to) {
    return Math.toIntExact(ChronoUnit.DAYS.between(from, to) / step);
  }

  @Override
  public String toString() {
    return IndexFormat.renderFrequency(this);
  }
}
