package io.dtindex.frequency;

import static org.junit.jupiter.api.Assertions.*;

import io.dtindex.DateTimeIndexException;
import io.dtindex.ErrorKind;
import java.time.Period;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

/** Unit tests for day frequencies and period conversion. */
public class FrequencyTest {
  private static final ZonedDateTime START =
      ZonedDateTime.of(2015, 4, 8, 0, 0, 0, 0, ZoneOffset.UTC);

  @Test
  void testDayAdvance() {
    DayFrequency days = new DayFrequency(1);
    assertEquals(START.plusDays(3), days.advance(START, 3));
    assertEquals(START.minusDays(2), days.advance(START, -2));
    assertEquals(START, days.advance(START, 0));
  }

  @Test
  void testDayAdvanceWithStep() {
    DayFrequency weekly = new DayFrequency(7);
    assertEquals(START.plusDays(21), weekly.advance(START, 3));
    assertEquals(START.minusDays(7), weekly.advance(START, -1));
  }

  @Test
  void testDayAdvanceComposes() {
    DayFrequency days = new DayFrequency(2);
    for (int a = -5; a <= 5; a++) {
      for (int b = -5; b <= 5; b++) {
        assertEquals(days.advance(START, a + b), days.advance(days.advance(START, a), b));
      }
    }
  }

  @Test
  void testDayDifference() {
    DayFrequency days = new DayFrequency(1);
    assertEquals(4, days.difference(START, START.plusDays(4)));
    assertEquals(-4, days.difference(START.plusDays(4), START));
    assertEquals(0, days.difference(START, START));
  }

  @Test
  void testDayDifferenceTruncatesOffGrid() {
    assertEquals(1, new DayFrequency(2).difference(START, START.plusDays(3)));
    assertEquals(-1, new DayFrequency(2).difference(START, START.minusDays(3)));
    assertEquals(0, new DayFrequency(1).difference(START, START.plusHours(23)));
  }

  @Test
  void testDayDifferenceAcrossZones() {
    ZonedDateTime tokyo = START.plusDays(2).withZoneSameInstant(ZoneId.of("Asia/Tokyo"));
    assertEquals(2, new DayFrequency(1).difference(START, tokyo));
  }

  @Test
  void testEquality() {
    assertEquals(new DayFrequency(2), new DayFrequency(2));
    assertNotEquals(new DayFrequency(1), new DayFrequency(2));
    assertNotEquals(new DayFrequency(1), new BusinessDayFrequency(1));
    assertEquals(new BusinessDayFrequency(3).hashCode(), new BusinessDayFrequency(3).hashCode());
  }

  @Test
  void testToString() {
    assertEquals("days 1", new DayFrequency(1).toString());
    assertEquals("businessDays 5", new BusinessDayFrequency(5).toString());
  }

  @Test
  void testNonPositiveStepRejected() {
    assertThrows(IllegalArgumentException.class, () -> new DayFrequency(0));
    assertThrows(IllegalArgumentException.class, () -> new BusinessDayFrequency(-1));
  }

  @Test
  void testFromPeriodDays() throws DateTimeIndexException {
    assertEquals(new DayFrequency(3), Frequency.fromPeriod(Period.ofDays(3)));
    assertEquals(new DayFrequency(7), Frequency.fromPeriod(Period.ofWeeks(1)));
  }

  @Test
  void testFromPeriodRejectsMonths() {
    DateTimeIndexException e =
        assertThrows(DateTimeIndexException.class, () -> Frequency.fromPeriod(Period.ofMonths(1)));
    assertEquals(ErrorKind.FREQUENCY, e.kind());
    assertTrue(e.getMessage().contains("P1M"));
  }

  @Test
  void testFromPeriodRejectsEmpty() {
    DateTimeIndexException e =
        assertThrows(DateTimeIndexException.class, () -> Frequency.fromPeriod(Period.ZERO));
    assertEquals(ErrorKind.FREQUENCY, e.kind());
    assertThrows(DateTimeIndexException.class, () -> Frequency.fromPeriod(Period.ofDays(-2)));
  }
}
