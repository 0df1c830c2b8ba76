package io.dtindex;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/** Conversions between stored epoch milliseconds and the date-times an index exposes. */
public final class Instants {
  /** The zone every index reports its date-times in. */
  public static final ZoneOffset ZONE = ZoneOffset.UTC;

  private Instants() {}

  /**
   * Returns the date-time at the given epoch millisecond.
   *
   * @param millis milliseconds since the epoch
   * @return the date-time in {@link #ZONE}
   */
  public static ZonedDateTime ofMillis(long millis) {
    return ZonedDateTime.ofInstant(Instant.ofEpochMilli(millis), ZONE);
  }

  /**
   * Returns the epoch millisecond of a date-time, dropping any sub-millisecond part.
   *
   * @param dt the date-time
   * @return milliseconds since the epoch
   */
  public static long toMillis(ZonedDateTime dt) {
    return dt.toInstant().toEpochMilli();
  }
}
