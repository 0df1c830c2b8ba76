package io.dtindex.frequency;

import static com.google.common.base.Preconditions.checkArgument;

import io.dtindex.format.IndexFormat;
import java.time.ZonedDateTime;

/**
 * A frequency of a fixed number of business days (Monday to Friday), like "businessDays 1".
 *
 * <p>{@code advance} and {@code difference} are inverses only when the start date-time is itself
 * a business day.
 *
 * @param step the number of business days per period
 */
public record BusinessDayFrequency(int step) implements Frequency {
  public static final String NAME = "businessDays";

  /** Validates the step. */
  public BusinessDayFrequency {
    checkArgument(step > 0, "step must be positive: %s", step);
  }

  @Override
  public ZonedDateTime advance(ZonedDateTime dt, int n) {
    return BusinessDays.plus(dt, (long) step * n);
  }

  @Override
  public int difference(ZonedDateTime from, ZonedDateTime to) {
    return Math.toIntExact(BusinessDays.between(from, to) / step);
  }

  @Override
  public String toString() {
    return IndexFormat.renderFrequency(this);
  }
}
