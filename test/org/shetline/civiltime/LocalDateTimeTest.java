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

package org.shetline.civiltime;

import org.junit.jupiter.api.Test;
import org.shetline.civiltime.format.DateTimeParseException;
import org.shetline.civiltime.temporal.ChronoField;
import org.shetline.civiltime.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;


public class LocalDateTimeTest
{
  @Test
  public void timeArithmeticCarriesIntoTheDate()
  {
    LocalDateTime   ldt = LocalDateTime.of(2012, 12, 31, 23, 30);

    assertEquals(LocalDateTime.of(2013, 1, 1, 0, 30), ldt.plusHours(1));
    assertEquals(LocalDateTime.of(2013, 1, 2, 0, 30), ldt.plusHours(25));
    assertEquals(LocalDateTime.of(2012, 12, 30, 23, 30), ldt.minusHours(24));
    assertEquals(LocalDateTime.of(2013, 1, 1, 0, 0), ldt.plusMinutes(30));
    assertEquals(LocalDateTime.of(2012, 12, 31, 23, 29, 59, 999999999), ldt.minusNanos(1));
    assertEquals(LocalDateTime.of(2013, 1, 1, 0, 0, 1), ldt.plus(Duration.ofSeconds(1801)));
    assertEquals(LocalDateTime.of(2013, 1, 1, 11, 30), ldt.plus(1, ChronoUnit.HALF_DAYS));
  }

  @Test
  public void dateArithmeticKeepsTheTime()
  {
    LocalDateTime   ldt = LocalDateTime.of(2012, 1, 31, 10, 15);

    assertEquals(LocalDateTime.of(2012, 2, 29, 10, 15), ldt.plusMonths(1));
    assertEquals(LocalDateTime.of(2011, 1, 31, 10, 15), ldt.minusYears(1));
    assertEquals(LocalDateTime.of(2012, 2, 7, 10, 15), ldt.plusWeeks(1));
    assertEquals(LocalDateTime.of(2012, 4, 30, 10, 15), ldt.withMonth(4));
  }

  @Test
  public void epochSeconds()
  {
    LocalDateTime   ldt = LocalDateTime.of(2008, 6, 30, 11, 30, 59);

    assertEquals(1214825459L, ldt.toEpochSecond(ZoneOffset.UTC));
    assertEquals(1214825459L - 3600, ldt.toEpochSecond(ZoneOffset.ofHours(1)));
    assertEquals(ldt, LocalDateTime.ofEpochSecond(1214825459L, 0, ZoneOffset.UTC));
    assertEquals(LocalDateTime.of(1969, 12, 31, 23, 59, 59, 500000000),
                 LocalDateTime.ofEpochSecond(-1, 500000000, ZoneOffset.UTC));
    assertEquals(Instant.ofEpochSecond(1214825459L), ldt.toInstant(ZoneOffset.UTC));
  }

  @Test
  public void until()
  {
    LocalDateTime   start = LocalDateTime.of(2012, 1, 1, 22, 0);
    LocalDateTime   end = LocalDateTime.of(2012, 1, 3, 21, 0);

    assertEquals(47, start.until(end, ChronoUnit.HOURS));
    assertEquals(1, start.until(end, ChronoUnit.DAYS));
    assertEquals(-1, end.until(start, ChronoUnit.DAYS));
    assertEquals(47L * 3600 * 1000000000, start.until(end, ChronoUnit.NANOS));
    assertEquals(0, start.until(end, ChronoUnit.MONTHS));
  }

  @Test
  public void formatAndParse()
  {
    LocalDateTime   ldt = LocalDateTime.of(2012, 10, 29, 7, 5, 0, 120000000);

    assertEquals("2012-10-29T07:05:00.120", ldt.toString());
    assertEquals(ldt, LocalDateTime.parse("2012-10-29T07:05:00.12"));
    assertEquals("2012-10-29T07:05", LocalDateTime.of(2012, 10, 29, 7, 5).toString());
    assertThrows(DateTimeParseException.class, () -> LocalDateTime.parse("2012-10-29 07:05"));
  }

  @Test
  public void fieldsFromBothParts()
  {
    LocalDateTime   ldt = LocalDateTime.of(2012, 10, 29, 7, 5, 3);

    assertEquals(2012, ldt.get(ChronoField.YEAR));
    assertEquals(7, ldt.get(ChronoField.HOUR_OF_DAY));
    assertEquals(15642, ldt.getLong(ChronoField.EPOCH_DAY));
    assertEquals(DayOfWeek.MONDAY, ldt.getDayOfWeek());
    assertEquals(LocalDateTime.of(2012, 10, 29, 7, 0), ldt.truncatedTo(ChronoUnit.HOURS));
    assertEquals(LocalDateTime.of(2012, 10, 1, 7, 5, 3), ldt.with(ChronoField.DAY_OF_MONTH, 1));
    assertFalse(ldt.isSupported(ChronoField.OFFSET_SECONDS));
  }

  @Test
  public void ordering()
  {
    LocalDateTime   a = LocalDateTime.of(2012, 10, 29, 7, 5);
    LocalDateTime   b = LocalDateTime.of(2012, 10, 30, 1, 0);

    assertTrue(a.isBefore(b));
    assertTrue(b.isAfter(a));
    assertTrue(a.compareTo(b) < 0);
    assertTrue(a.isEqual(LocalDateTime.of(LocalDate.of(2012, 10, 29), LocalTime.of(7, 5))));
    assertTrue(LocalDateTime.MIN.isBefore(LocalDateTime.MAX));
  }
}
