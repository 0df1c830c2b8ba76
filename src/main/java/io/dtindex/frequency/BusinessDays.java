package io.dtindex.frequency;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/** Business-day arithmetic, where a business day is Monday through Friday. */
public final class BusinessDays {
  private static final int DAYS_PER_WEEK = 7;
  private static final int BUSINESS_DAYS_PER_WEEK = 5;

  private BusinessDays() {}

  /**
   * Checks whether a date-time falls on Monday through Friday.
   *
   * @param dt the date-time to check
   * @return true if the date-time is on a business day
   */
  public static boolean isBusinessDay(ZonedDateTime dt) {
    return isBusinessDay(dt.toLocalDate());
  }

  /**
   * Finds the next business day occurring at or after the given date-time.
   *
   * @param dt the date-time to start from
   * @return {@code dt} moved to Monday when it falls on a weekend, otherwise {@code dt}
   */
  public static ZonedDateTime nextBusinessDay(ZonedDateTime dt) {
    DayOfWeek dow = dt.getDayOfWeek();
    if (dow == DayOfWeek.SATURDAY) {
      return dt.plusDays(2);
    } else if (dow == DayOfWeek.SUNDAY) {
      return dt.plusDays(1);
    }
    return dt;
  }

  /**
   * Finds the last business day occurring at or before the given date-time.
   *
   * @param dt the date-time to start from
   * @return {@code dt} moved to Friday when it falls on a weekend, otherwise {@code dt}
   */
  public static ZonedDateTime previousBusinessDay(ZonedDateTime dt) {
    DayOfWeek dow = dt.getDayOfWeek();
    if (dow == DayOfWeek.SATURDAY) {
      return dt.minusDays(1);
    } else if (dow == DayOfWeek.SUNDAY) {
      return dt.minusDays(2);
    }
    return dt;
  }

  /**
   * Moves a date-time by a number of business days, keeping its time of day.
   *
   * <p>A weekend start first snaps to the adjacent business day in the direction of travel, and
   * that move counts as one business day.
   *
   * @param dt the date-time to move
   * @param n the number of business days, negative to move backwards
   * @return the moved date-time
   */
  public static ZonedDateTime plus(ZonedDateTime dt, long n) {
    if (n == 0) {
      return dt;
    }
    int sign = n > 0 ? 1 : -1;
    long remaining = Math.abs(n);
    ZonedDateTime cur = dt;

    if (!isBusinessDay(cur)) {
      cur = sign > 0 ? nextBusinessDay(cur) : previousBusinessDay(cur);
      remaining--;
    }

    // From a business day, every 5 business days is exactly one calendar week
    cur = cur.plusDays(sign * DAYS_PER_WEEK * (remaining / BUSINESS_DAYS_PER_WEEK));
    for (long i = remaining % BUSINESS_DAYS_PER_WEEK; i > 0; i--) {
      do {
        cur = cur.plusDays(sign);
      } while (!isBusinessDay(cur));
    }
    return cur;
  }

  /**
   * Counts the business days in {@code (from, to]}, negated when {@code to} precedes {@code
   * from}. Only calendar dates matter; {@code to} is first moved into the zone of {@code from}.
   *
   * @param from the start date-time (exclusive)
   * @param to the end date-time (inclusive)
   * @return the signed business-day count
   */
  public static long between(ZonedDateTime from, ZonedDateTime to) {
    LocalDate start = from.toLocalDate();
    LocalDate end = to.withZoneSameInstant(from.getZone()).toLocalDate();
    long weeks = Math.floorDiv(ChronoUnit.DAYS.between(start, end), DAYS_PER_WEEK);

    long count = weeks * BUSINESS_DAYS_PER_WEEK;
    LocalDate cur = start.plusWeeks(weeks);
    while (cur.isBefore(end)) {
      cur = cur.plusDays(1);
      if (isBusinessDay(cur)) {
        count++;
      }
    }
    return count;
  }

  private static boolean isBusinessDay(LocalDate date) {
    return date.getDayOfWeek().getValue() <= DayOfWeek.FRIDAY.getValue();
  }
}
