/*
  Copyright © 2018 Kerry Shetline, kerry@shetline.com

  MIT license: https://opensource.org/licenses/MIT

  Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated
  documentation files (the "Software"), to deal in the Software without restriction, including without limitation the
  rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit
  persons to whom the Software is furnished to do so, subject to the following conditions:

  The above copyright notice and this permission notice shall be included in all copies or substantial portions of the
  Software.

  THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE
  WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR
  COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR
  OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
*/

package org.shetline.civiltime.zone;

import org.junit.jupiter.api.Test;
import org.shetline.civiltime.DayOfWeek;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.LocalTime;
import org.shetline.civiltime.Month;
import org.shetline.civiltime.ZoneOffset;
import org.shetline.civiltime.zone.ZoneOffsetTransitionRule.TimeDefinition;

import static org.junit.jupiter.api.Assertions.*;
import static org.shetline.civiltime.zone.SampleRules.*;


public class ZoneOffsetTransitionRuleTest
{
  private static final ZoneOffset EST = ZoneOffset.ofHours(-5);
  private static final ZoneOffset EDT = ZoneOffset.ofHours(-4);

  @Test
  public void secondSundayOnOrAfter()
  {
    ZoneOffsetTransitionRule  rule = ZoneOffsetTransitionRule.of(Month.MARCH, 8, DayOfWeek.SUNDAY, LocalTime.of(2, 0),
                                                                 false, TimeDefinition.WALL, EST, EST, EDT);
    ZoneOffsetTransition      trans = rule.createTransition(2008);

    assertEquals(LocalDateTime.of(2008, 3, 9, 2, 0), trans.getDateTimeBefore());
    assertEquals(LocalDateTime.of(2008, 3, 9, 3, 0), trans.getDateTimeAfter());
    assertEquals(LocalDateTime.of(2012, 3, 11, 2, 0), rule.createTransition(2012).getDateTimeBefore());
  }

  @Test
  public void utcTimeIsConvertedToWallTime()
  {
    ZoneOffsetTransitionRule  rule = ZoneOffsetTransitionRule.of(Month.MARCH, 25, DayOfWeek.SUNDAY, LocalTime.of(1, 0),
                                                                 false, TimeDefinition.UTC, OFFSET_PONE, OFFSET_PONE,
                                                                 OFFSET_PTWO);

    assertEquals(LocalDateTime.of(2008, 3, 30, 2, 0), rule.createTransition(2008).getDateTimeBefore());
  }

  @Test
  public void standardTimeIsConvertedToWallTime()
  {
    ZoneOffsetTransitionRule  rule = ZoneOffsetTransitionRule.of(Month.OCTOBER, 25, DayOfWeek.SUNDAY, LocalTime.of(2, 0),
                                                                 false, TimeDefinition.STANDARD, OFFSET_PONE, OFFSET_PTWO,
                                                                 OFFSET_PONE);

    assertEquals(LocalDateTime.of(2008, 10, 26, 3, 0), rule.createTransition(2008).getDateTimeBefore());
  }

  @Test
  public void endOfDayMovesToNextDay()
  {
    ZoneOffsetTransitionRule  rule = ZoneOffsetTransitionRule.of(Month.APRIL, 1, null, LocalTime.MIDNIGHT, true,
                                                                 TimeDefinition.WALL, OFFSET_ZERO, OFFSET_ZERO, OFFSET_PONE);

    assertEquals(LocalDateTime.of(2010, 4, 2, 0, 0), rule.createTransition(2010).getDateTimeBefore());
    assertTrue(rule.isMidnightEndOfDay());
  }

  @Test
  public void negativeDayCountsFromEndOfMonth()
  {
    ZoneOffsetTransitionRule  lastDay = ZoneOffsetTransitionRule.of(Month.FEBRUARY, -1, null, LocalTime.of(1, 0), false,
                                                                    TimeDefinition.WALL, OFFSET_ZERO, OFFSET_ZERO, OFFSET_PONE);
    ZoneOffsetTransitionRule  sunday = ZoneOffsetTransitionRule.of(Month.FEBRUARY, -2, DayOfWeek.SUNDAY, LocalTime.of(1, 0),
                                                                   false, TimeDefinition.WALL, OFFSET_ZERO, OFFSET_ZERO,
                                                                   OFFSET_PONE);

    assertEquals(29, lastDay.createTransition(2012).getDateTimeBefore().getDayOfMonth());
    assertEquals(28, lastDay.createTransition(2011).getDateTimeBefore().getDayOfMonth());
    // 2012-02-28 is a Tuesday; the Sunday on or before it is the 26th.
    assertEquals(LocalDateTime.of(2012, 2, 26, 1, 0), sunday.createTransition(2012).getDateTimeBefore());
  }

  @Test
  public void invalidRules()
  {
    assertThrows(IllegalArgumentException.class, () -> ZoneOffsetTransitionRule.of(Month.MARCH, 0, null, LocalTime.of(1, 0),
      false, TimeDefinition.WALL, OFFSET_ZERO, OFFSET_ZERO, OFFSET_PONE));
    assertThrows(IllegalArgumentException.class, () -> ZoneOffsetTransitionRule.of(Month.MARCH, 32, null, LocalTime.of(1, 0),
      false, TimeDefinition.WALL, OFFSET_ZERO, OFFSET_ZERO, OFFSET_PONE));
    assertThrows(IllegalArgumentException.class, () -> ZoneOffsetTransitionRule.of(Month.MARCH, -29, null, LocalTime.of(1, 0),
      false, TimeDefinition.WALL, OFFSET_ZERO, OFFSET_ZERO, OFFSET_PONE));
    assertThrows(IllegalArgumentException.class, () -> ZoneOffsetTransitionRule.of(Month.MARCH, 1, null, LocalTime.of(1, 0),
      true, TimeDefinition.WALL, OFFSET_ZERO, OFFSET_ZERO, OFFSET_PONE));
    assertThrows(NullPointerException.class, () -> ZoneOffsetTransitionRule.of(null, 1, null, LocalTime.of(1, 0),
      false, TimeDefinition.WALL, OFFSET_ZERO, OFFSET_ZERO, OFFSET_PONE));
  }

  @Test
  public void equality()
  {
    ZoneOffsetTransitionRule  a = ZoneOffsetTransitionRule.of(Month.MARCH, 25, DayOfWeek.SUNDAY, LocalTime.of(1, 0),
                                                              false, TimeDefinition.UTC, OFFSET_ZERO, OFFSET_ZERO, OFFSET_PONE);
    ZoneOffsetTransitionRule  b = ZoneOffsetTransitionRule.of(Month.MARCH, 25, DayOfWeek.SUNDAY, LocalTime.of(1, 0),
                                                              false, TimeDefinition.UTC, OFFSET_ZERO, OFFSET_ZERO, OFFSET_PONE);
    ZoneOffsetTransitionRule  c = ZoneOffsetTransitionRule.of(Month.MARCH, 25, DayOfWeek.SUNDAY, LocalTime.of(1, 0),
                                                              false, TimeDefinition.WALL, OFFSET_ZERO, OFFSET_ZERO, OFFSET_PONE);

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
  }

  @Test
  public void timeDefinitions()
  {
    LocalDateTime   ldt = LocalDateTime.of(2008, 3, 30, 1, 0);

    assertEquals(ldt, TimeDefinition.WALL.createDateTime(ldt, OFFSET_PONE, OFFSET_PTWO));
    assertEquals(ldt.plusHours(2), TimeDefinition.UTC.createDateTime(ldt, OFFSET_PONE, OFFSET_PTWO));
    assertEquals(ldt.plusHours(1), TimeDefinition.STANDARD.createDateTime(ldt, OFFSET_PONE, OFFSET_PTWO));
  }
}
