package io.dtindex;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndexes;

import io.dtindex.format.IndexFormat;
import io.dtindex.frequency.Frequency;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * An index of date-times spaced at regular intervals of a {@link Frequency}. Uses constant space
 * and answers every lookup in constant time.
 */
public final class UniformDateTimeIndex implements DateTimeIndex {
  private final long start;
  private final int periods;
  private final Frequency frequency;

  /**
   * Creates a uniform index.
   *
   * @param start the first date-time, in epoch milliseconds
   * @param periods the number of date-times, zero or more
   * @param frequency the spacing between date-times
   */
  public UniformDateTimeIndex(long start, int periods, Frequency frequency) {
    checkArgument(periods >= 0, "periods must not be negative: %s", periods);
    this.start = start;
    this.periods = periods;
    this.frequency = checkNotNull(frequency, "frequency");
  }

  /**
   * Returns the date-time the index starts at. Unlike {@link #first()}, defined for an empty
   * index too.
   *
   * @return the start date-time
   */
  public ZonedDateTime start() {
    return Instants.ofMillis(start);
  }

  /**
   * Returns the number of periods.
   *
   * @return the number of periods
   */
  public int periods() {
    return periods;
  }

  /**
   * Returns the spacing between date-times.
   *
   * @return the frequency
   */
  public Frequency frequency() {
    return frequency;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Both bounds must lie on the frequency's grid from the start of this index; for business-day
   * frequencies both must be business days.
   */
  @Override
  public UniformDateTimeIndex slice(ZonedDateTime start, ZonedDateTime end) {
    return DateTimeIndex.uniform(start, end, frequency);
  }

  @Override
  public UniformDateTimeIndex slice(int start, int end) {
    checkPositionIndexes(start, end + 1, periods);
    return DateTimeIndex.uniform(frequency.advance(start(), start), end - start + 1, frequency);
  }

  @Override
  public ZonedDateTime first() {
    if (periods == 0) {
      throw new NoSuchElementException("empty index");
    }
    return start();
  }

  @Override
  public ZonedDateTime last() {
    if (periods == 0) {
      throw new NoSuchElementException("empty index");
    }
    return frequency.advance(start(), periods - 1);
  }

  @Override
  public int size() {
    return periods;
  }

  @Override
  public ZonedDateTime dateTimeAtLoc(int loc) {
    checkElementIndex(loc, periods);
    return frequency.advance(start(), loc);
  }

  @Override
  public int locAtDateTime(ZonedDateTime dt) {
    if (periods == 0) {
      return -1;
    }
    // Outside [first, last] the period count may not fit in an int
    Instant instant = dt.toInstant();
    if (instant.isBefore(start().toInstant()) || instant.isAfter(last().toInstant())) {
      return -1;
    }
    int loc = frequency.difference(start(), dt);
    if (loc < 0 || loc >= periods) {
      return -1;
    }
    return Instants.toMillis(dateTimeAtLoc(loc)) == Instants.toMillis(dt) ? loc : -1;
  }

  @Override
  public Stream<ZonedDateTime> dateTimes() {
    ZonedDateTime first = start();
    return IntStream.range(0, periods).mapToObj(i -> frequency.advance(first, i));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof UniformDateTimeIndex)) {
      return false;
    }
    UniformDateTimeIndex other = (UniformDateTimeIndex) o;
    return start == other.start && periods == other.periods && frequency.equals(other.frequency);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, periods, frequency);
  }

  /**
   * Returns the canonical text form, as read back by {@link DateTimeIndex#parse(String)}.
   *
   * @return the canonical form
   */
  @Override
  public String toString() {
    return IndexFormat.render(this);
  }
}
