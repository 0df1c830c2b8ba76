package io.dtindex.frequency;

import static org.junit.jupiter.api.Assertions.*;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

/** Unit tests for business-day arithmetic. */
public class BusinessDaysTest {
  // April 2015: the 8th is a Wednesday, the 11th and 12th a weekend
  private static final ZonedDateTime WED = day(8);
  private static final ZonedDateTime THU = day(9);
  private static final ZonedDateTime FRI = day(10);
  private static final ZonedDateTime SAT = day(11);
  private static final ZonedDateTime SUN = day(12);
  private static final ZonedDateTime MON = day(13);

  private static ZonedDateTime day(int dayOfMonth) {
    return ZonedDateTime.of(2015, 4, dayOfMonth, 0, 0, 0, 0, ZoneOffset.UTC);
  }

  @Test
  void testNextBusinessDay() {
    assertEquals(MON, BusinessDays.nextBusinessDay(SAT));
    assertEquals(MON, BusinessDays.nextBusinessDay(SUN));
    assertEquals(WED, BusinessDays.nextBusinessDay(WED));
    assertEquals(FRI, BusinessDays.nextBusinessDay(FRI));
  }

  @Test
  void testNextBusinessDayKeepsTimeOfDay() {
    assertEquals(MON.plusHours(9), BusinessDays.nextBusinessDay(SAT.plusHours(9)));
  }

  @Test
  void testPreviousBusinessDay() {
    assertEquals(FRI, BusinessDays.previousBusinessDay(SAT));
    assertEquals(FRI, BusinessDays.previousBusinessDay(SUN));
    assertEquals(MON, BusinessDays.previousBusinessDay(MON));
  }

  @Test
  void testIsBusinessDay() {
    assertTrue(BusinessDays.isBusinessDay(MON));
    assertTrue(BusinessDays.isBusinessDay(FRI));
    assertFalse(BusinessDays.isBusinessDay(SAT));
    assertFalse(BusinessDays.isBusinessDay(SUN));
  }

  @Test
  void testPlusSkipsWeekend() {
    assertEquals(MON, BusinessDays.plus(FRI, 1));
    assertEquals(FRI, BusinessDays.plus(MON, -1));
    assertEquals(day(15), BusinessDays.plus(WED, 5));
    assertEquals(day(1), BusinessDays.plus(WED, -5));
    assertEquals(WED, BusinessDays.plus(WED, 0));
  }

  @Test
  void testPlusFromWeekend() {
    assertEquals(MON, BusinessDays.plus(SAT, 1));
    assertEquals(day(14), BusinessDays.plus(SUN, 2));
    assertEquals(FRI, BusinessDays.plus(SAT, -1));
    assertEquals(THU, BusinessDays.plus(SUN, -2));
  }

  @Test
  void testBetween() {
    assertEquals(1, BusinessDays.between(FRI, MON));
    assertEquals(-1, BusinessDays.between(MON, FRI));
    assertEquals(0, BusinessDays.between(FRI, SUN));
    assertEquals(1, BusinessDays.between(SAT, MON));
    assertEquals(5, BusinessDays.between(WED, day(15)));
    assertEquals(-5, BusinessDays.between(SAT, day(4)));
  }

  @Test
  void testBetweenInvertsPlusFromBusinessDay() {
    for (ZonedDateTime start : new ZonedDateTime[] {MON, WED, FRI}) {
      for (int n = -23; n <= 23; n++) {
        assertEquals(n, BusinessDays.between(start, BusinessDays.plus(start, n)), start + " " + n);
      }
    }
  }

  @Test
  void testFrequencyAdvance() {
    BusinessDayFrequency daily = new BusinessDayFrequency(1);
    assertEquals(MON, daily.advance(FRI, 1));
    assertEquals(FRI, daily.advance(MON, -1));

    BusinessDayFrequency everyOther = new BusinessDayFrequency(2);
    assertEquals(MON, everyOther.advance(THU, 1));
    assertEquals(day(16), everyOther.advance(WED, 3));
  }

  @Test
  void testFrequencyDifference() {
    assertEquals(5, new BusinessDayFrequency(1).difference(WED, day(15)));
    assertEquals(2, new BusinessDayFrequency(2).difference(WED, day(15)));
    assertEquals(-1, new BusinessDayFrequency(1).difference(MON, FRI));
  }

  @Test
  void testFrequencyAdvanceComposesFromBusinessDay() {
    BusinessDayFrequency freq = new BusinessDayFrequency(3);
    for (int a = -4; a <= 4; a++) {
      for (int b = -4; b <= 4; b++) {
        assertEquals(freq.advance(WED, a + b), freq.advance(freq.advance(WED, a), b));
      }
    }
  }
}
