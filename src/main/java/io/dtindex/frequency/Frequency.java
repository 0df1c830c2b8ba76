package io.dtindex.frequency;

import io.dtindex.DateTimeIndexException;
import java.time.Period;
import java.time.ZonedDateTime;

/**
 * Sealed interface for the calendar arithmetic behind a uniform index.
 *
 * <p>There are 2 types of frequency:
 *
 * <ul>
 *   <li>{@link DayFrequency} - "days 1", every calendar day
 *   <li>{@link BusinessDayFrequency} - "businessDays 1", every Monday to Friday
 * </ul>
 *
 * <p>The text returned by {@link #toString()} is the frequency field of the canonical index
 * format.
 */
public sealed interface Frequency permits DayFrequency, BusinessDayFrequency {

  /**
   * Moves a date-time by a number of periods.
   *
   * @param dt the date-time to move
   * @param n the number of periods, negative to move backwards
   * @return the moved date-time, in the zone of {@code dt}
   */
  ZonedDateTime advance(ZonedDateTime dt, int n);

  /**
   * Returns the number of periods between two date-times. Date-times that are not a whole number
   * of periods apart truncate toward zero.
   *
   * @param from the start date-time
   * @param to the end date-time
   * @return the signed period count from {@code from} to {@code to}
   */
  int difference(ZonedDateTime from, ZonedDateTime to);

  /**
   * Returns the number of base units advanced per period.
   *
   * @return the step, always positive
   */
  int step();

  /**
   * Converts a calendar period made of whole days into a day frequency.
   *
   * @param period the period to convert
   * @return a {@link DayFrequency} stepping by the period's days
   * @throws DateTimeIndexException if the period has months or years, or no positive day count
   */
  static Frequency fromPeriod(Period period) throws DateTimeIndexException {
    if (period.getYears() != 0 || period.getMonths() != 0) {
      throw DateTimeIndexException.frequency(
          "period " + period + " has months or years, only whole days are supported");
    }
    if (period.getDays() <= 0) {
      throw DateTimeIndexException.frequency(
          "period " + period + " must span a positive number of days");
    }
    return new DayFrequency(period.getDays());
  }
}
