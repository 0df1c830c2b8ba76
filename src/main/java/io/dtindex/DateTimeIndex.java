package io.dtindex;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.Range;
import io.dtindex.format.IndexFormat;
import io.dtindex.format.IndexParser;
import io.dtindex.frequency.Frequency;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.stream.Stream;

/**
 * A bi-directional mapping between the locations {@code [0, size())} and an ordered collection of
 * date-times. Multiple locations may hold the same date-time, implying multiple samples at that
 * date-time.
 *
 * <p>To avoid confusion between "index" as in "DateTimeIndex" and "index" as a position in an
 * array, the latter is called a "location", or "loc".
 *
 * <p>Indexes are immutable. Date-times are stored at millisecond precision and reported in UTC.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * DateTimeIndex index = DateTimeIndex.uniform(start, 5, new DayFrequency(1));
 * String text = index.toString();          // "uniform,2015-04-08T00:00:00.000Z,5,days 1"
 * DateTimeIndex copy = DateTimeIndex.parse(text);
 * int loc = copy.locAtDateTime(start.plusDays(2));  // 2
 * }</pre>
 */
public sealed interface DateTimeIndex permits UniformDateTimeIndex, IrregularDateTimeIndex {

  /**
   * Returns a sub-slice of the index, starting and ending at the given date-times (inclusive).
   *
   * @param start the first date-time of the slice
   * @param end the last date-time of the slice
   * @return the slice
   */
  DateTimeIndex slice(ZonedDateTime start, ZonedDateTime end);

  /**
   * Returns a sub-slice of the index covering the given range of locations.
   *
   * @param locs a bounded range of locations
   * @return the slice
   */
  default DateTimeIndex slice(Range<Integer> locs) {
    checkArgument(locs.hasLowerBound() && locs.hasUpperBound(), "unbounded range: %s", locs);
    Range<Integer> canonical = locs.canonical(DiscreteDomain.integers());
    return slice(canonical.lowerEndpoint(), canonical.upperEndpoint() - 1);
  }

  /**
   * Returns a sub-slice of the index, starting and ending at the given locations (inclusive).
   *
   * @param start the first location of the slice
   * @param end the last location of the slice
   * @return the slice
   */
  DateTimeIndex slice(int start, int end);

  /**
   * The first date-time in the index.
   *
   * @return the first date-time
   * @throws java.util.NoSuchElementException if the index is empty
   */
  ZonedDateTime first();

  /**
   * The last date-time in the index. Inclusive.
   *
   * @return the last date-time
   * @throws java.util.NoSuchElementException if the index is empty
   */
  ZonedDateTime last();

  /**
   * The number of date-times in the index.
   *
   * @return the size
   */
  int size();

  /**
   * The date-time at the given location.
   *
   * @param loc the location
   * @return the date-time
   * @throws IndexOutOfBoundsException if {@code loc} is outside {@code [0, size())}
   */
  ZonedDateTime dateTimeAtLoc(int loc);

  /**
   * The location of the given date-time. If the index contains the date-time more than once,
   * returns its first appearance.
   *
   * @param dt the date-time to look up, compared by instant
   * @return the location, or -1 if the date-time does not appear in the index
   */
  int locAtDateTime(ZonedDateTime dt);

  /**
   * Returns the date-times of the index in location order.
   *
   * @return a stream of date-times
   */
  Stream<ZonedDateTime> dateTimes();

  /**
   * Creates a uniform index with the given start, number of periods, and frequency.
   *
   * @param start the first date-time
   * @param periods the number of date-times
   * @param frequency the spacing between date-times
   * @return the uniform index
   */
  static UniformDateTimeIndex uniform(ZonedDateTime start, int periods, Frequency frequency) {
    return new UniformDateTimeIndex(Instants.toMillis(start), periods, frequency);
  }

  /**
   * Creates a uniform index with the given start, end (inclusive), and frequency.
   *
   * @param start the first date-time
   * @param end the last date-time, which must lie on the frequency's grid from {@code start}
   * @param frequency the spacing between date-times
   * @return the uniform index
   */
  static UniformDateTimeIndex uniform(
      ZonedDateTime start, ZonedDateTime end, Frequency frequency) {
    return uniform(start, frequency.difference(start, end) + 1, frequency);
  }

  /**
   * Creates an irregular index composed of the given date-times.
   *
   * @param dateTimes non-decreasing date-times
   * @return the irregular index
   */
  static IrregularDateTimeIndex irregular(List<ZonedDateTime> dateTimes) {
    return new IrregularDateTimeIndex(
        dateTimes.stream().mapToLong(Instants::toMillis).toArray());
  }

  /**
   * Parses an index from the output of {@link #format(DateTimeIndex)}.
   *
   * @param text the canonical text
   * @return the parsed index
   * @throws DateTimeIndexException if the text is not a valid index
   */
  static DateTimeIndex parse(String text) throws DateTimeIndexException {
    return IndexParser.parse(text);
  }

  /**
   * Renders an index as canonical text.
   *
   * @param index the index to render
   * @return the canonical text
   */
  static String format(DateTimeIndex index) {
    return IndexFormat.render(index);
  }
}
