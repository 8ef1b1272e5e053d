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

package org.shetline.civiltime.temporal;

import org.junit.jupiter.api.Test;
import org.shetline.civiltime.DateTimeErrorKind;
import org.shetline.civiltime.DateTimeException;
import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.LocalTime;
import org.shetline.civiltime.OffsetDateTime;
import org.shetline.civiltime.ZoneOffset;
import org.shetline.civiltime.chrono.IsoChronology;

import static org.junit.jupiter.api.Assertions.*;
import static org.shetline.civiltime.temporal.ChronoField.*;


public class ValueRangeTest
{
  @Test
  public void fixedAndVariable()
  {
    ValueRange  months = ValueRange.of(1, 12);
    ValueRange  days = ValueRange.of(1, 28, 31);

    assertTrue(months.isFixed());
    assertFalse(days.isFixed());
    assertEquals(28, days.getSmallestMaximum());
    assertEquals(31, days.getMaximum());
    assertEquals(1, days.getLargestMinimum());
    assertEquals("1 - 12", months.toString());
    assertEquals("1 - 28/31", days.toString());
    assertEquals("0/1 - 10/20", ValueRange.of(0, 1, 10, 20).toString());
    assertEquals(ValueRange.of(1, 28, 31), days);
    assertEquals(days.hashCode(), ValueRange.of(1, 28, 31).hashCode());
    assertNotEquals(months, days);
  }

  @Test
  public void validation()
  {
    ValueRange  months = ValueRange.of(1, 12);

    assertTrue(months.isValidValue(12));
    assertFalse(months.isValidValue(13));
    assertTrue(months.isIntValue());
    assertFalse(ValueRange.of(0, Long.MAX_VALUE).isValidIntValue(1));
    assertEquals(6, months.checkValidIntValue(6, MONTH_OF_YEAR));

    DateTimeException   e = assertThrows(DateTimeException.class, () -> months.checkValidValue(13, MONTH_OF_YEAR));

    assertEquals(DateTimeErrorKind.RANGE, e.getKind());
    assertTrue(e.getMessage().endsWith("(valid values 1 - 12): 13"));
  }

  @Test
  public void invalidRanges()
  {
    assertThrows(IllegalArgumentException.class, () -> ValueRange.of(5, 1));
    assertThrows(IllegalArgumentException.class, () -> ValueRange.of(1, 31, 28));
    assertThrows(IllegalArgumentException.class, () -> ValueRange.of(2, 1, 5, 6));
    assertThrows(IllegalArgumentException.class, () -> ValueRange.of(1, 10, 5, 6));
  }

  @Test
  public void queries()
  {
    LocalDate       date = LocalDate.of(2012, 10, 29);
    LocalDateTime   dateTime = LocalDateTime.of(2012, 10, 29, 10, 15);
    OffsetDateTime  offsetDateTime = OffsetDateTime.of(dateTime, ZoneOffset.ofHours(1));

    assertEquals(ChronoUnit.DAYS, date.query(TemporalQueries.precision()));
    assertEquals(IsoChronology.INSTANCE, date.query(TemporalQueries.chronology()));
    assertNull(date.query(TemporalQueries.localTime()));
    assertEquals(ChronoUnit.NANOS, dateTime.query(TemporalQueries.precision()));
    assertEquals(LocalTime.of(10, 15), dateTime.query(TemporalQueries.localTime()));
    assertNull(dateTime.query(TemporalQueries.zone()));
    assertEquals(ZoneOffset.ofHours(1), offsetDateTime.query(TemporalQueries.offset()));
    assertEquals(ZoneOffset.ofHours(1), offsetDateTime.query(TemporalQueries.zone()));
    assertNull(offsetDateTime.query(TemporalQueries.zoneId()));
    assertEquals(date, offsetDateTime.query(TemporalQueries.localDate()));
  }

  @Test
  public void units()
  {
    assertTrue(ChronoUnit.HOURS.isTimeBased());
    assertFalse(ChronoUnit.HOURS.isDateBased());
    assertTrue(ChronoUnit.MONTHS.isDateBased());
    assertTrue(ChronoUnit.MONTHS.isDurationEstimated());
    assertFalse(ChronoUnit.FOREVER.isDateBased());
    assertEquals(86400, ChronoUnit.DAYS.getDuration().getSeconds());
    assertEquals("HalfDays", ChronoUnit.HALF_DAYS.toString());
  }
}
