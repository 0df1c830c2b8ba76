package io.dtindex;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.Range;
import io.dtindex.format.IndexFormat;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

/**
 * An index that allows date-times to be spaced at uneven intervals, backed by a sorted array of
 * epoch milliseconds. Lookups by location are O(1); lookups by date-time are O(log n).
 *
 * <p>Slicing is not supported.
 */
public final class IrregularDateTimeIndex implements DateTimeIndex {
  private final long[] instants;

  /**
   * Creates an irregular index.
   *
   * @param instants non-decreasing epoch milliseconds; copied
   * @throws IllegalArgumentException if the instants decrease anywhere
   */
  public IrregularDateTimeIndex(long[] instants) {
    this.instants = instants.clone();
    for (int i = 1; i < this.instants.length; i++) {
      checkArgument(
          this.instants[i - 1] <= this.instants[i],
          "date-times must not decrease: location %s is later than location %s",
          i - 1,
          i);
    }
  }

  @Override
  public IrregularDateTimeIndex slice(ZonedDateTime start, ZonedDateTime end) {
    throw new UnsupportedOperationException("irregular indexes cannot be sliced");
  }

  @Override
  public IrregularDateTimeIndex slice(Range<Integer> locs) {
    throw new UnsupportedOperationException("irregular indexes cannot be sliced");
  }

  @Override
  public IrregularDateTimeIndex slice(int start, int end) {
    throw new UnsupportedOperationException("irregular indexes cannot be sliced");
  }

  @Override
  public ZonedDateTime first() {
    if (instants.length == 0) {
      throw new NoSuchElementException("empty index");
    }
    return Instants.ofMillis(instants[0]);
  }

  @Override
  public ZonedDateTime last() {
    if (instants.length == 0) {
      throw new NoSuchElementException("empty index");
    }
    return Instants.ofMillis(instants[instants.length - 1]);
  }

  @Override
  public int size() {
    return instants.length;
  }

  @Override
  public ZonedDateTime dateTimeAtLoc(int loc) {
    checkElementIndex(loc, instants.length);
    return Instants.ofMillis(instants[loc]);
  }

  @Override
  public int locAtDateTime(ZonedDateTime dt) {
    if (instants.length == 0) {
      return -1;
    }
    // Outside the stored range the date-time may not fit in epoch milliseconds
    Instant instant = dt.toInstant();
    Instant lastEnd = Instant.ofEpochMilli(instants[instants.length - 1]).plusNanos(999_999);
    if (instant.isBefore(Instant.ofEpochMilli(instants[0])) || instant.isAfter(lastEnd)) {
      return -1;
    }
    long millis = Instants.toMillis(dt);
    int loc = Arrays.binarySearch(instants, millis);
    if (loc < 0) {
      return -1;
    }
    // binarySearch lands on any of the equal elements
    while (loc > 0 && instants[loc - 1] == millis) {
      loc--;
    }
    return loc;
  }

  @Override
  public Stream<ZonedDateTime> dateTimes() {
    return Arrays.stream(instants).mapToObj(Instants::ofMillis);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof IrregularDateTimeIndex)) {
      return false;
    }
    return Arrays.equals(instants, ((IrregularDateTimeIndex) o).instants);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(instants);
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
