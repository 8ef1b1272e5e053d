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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.shetline.civiltime.format.DateTimeParseException;
import org.shetline.civiltime.temporal.ChronoUnit;
import org.shetline.civiltime.temporal.UnsupportedTemporalTypeException;

import static org.junit.jupiter.api.Assertions.*;


public class PeriodTest
{
  @ParameterizedTest
  @CsvSource({
    "P1Y2M3D,   1,  2,  3",
    "P2W,       0,  0,  14",
    "P1W2D,     0,  0,  9",
    "-P1Y2M,    -1, -2, 0",
    "P-1Y+2M,   -1, 2,  0",
    "-P-3D,     0,  0,  3",
    "p1y,       1,  0,  0",
    "P0D,       0,  0,  0"
  })
  public void parsesIsoPeriods(String text, int years, int months, int days)
  {
    Period  period = Period.parse(text);

    assertEquals(years, period.getYears());
    assertEquals(months, period.getMonths());
    assertEquals(days, period.getDays());
  }

  @ParameterizedTest
  @ValueSource(strings = { "", "P", "PT1D", "P1Y2", "1Y", "P1D2M", "P2147483648D", "P1W2147483647D" })
  public void rejectsMalformedPeriods(String text)
  {
    DateTimeParseException  e = assertThrows(DateTimeParseException.class, () -> Period.parse(text));

    assertEquals(DateTimeErrorKind.PARSE, e.getKind());
    assertEquals(DateTimeErrorKind.PARSE, Period.tryParse(text).getKind());
  }

  @Test
  public void zeroIsShared()
  {
    assertSame(Period.ZERO, Period.parse("P0Y0M0D"));
    assertSame(Period.ZERO, Period.of(1, 2, 3).minus(Period.of(1, 2, 3)));
    assertTrue(Period.ofDays(0).isZero());
    assertEquals("P0D", Period.ZERO.toString());
  }

  @Test
  public void textForm()
  {
    assertEquals("P1Y2M3D", Period.of(1, 2, 3).toString());
    assertEquals("P14D", Period.ofWeeks(2).toString());
    assertEquals("P-1M", Period.ofMonths(-1).toString());
    assertEquals("P1Y-5D", Period.of(1, 0, -5).toString());
    assertEquals(Period.of(1, 0, -5), Period.parse(Period.of(1, 0, -5).toString()));
  }

  @Test
  public void arithmetic()
  {
    Period  period = Period.of(1, 2, 3);

    assertEquals(Period.of(2, 4, 6), period.plus(period));
    assertEquals(Period.of(0, 2, 3), period.minusYears(1));
    assertEquals(Period.of(1, 14, 3), period.plusMonths(12));
    assertEquals(Period.of(1, 2, -7), period.minusDays(10));
    assertEquals(Period.of(3, 6, 9), period.multipliedBy(3));
    assertEquals(Period.of(-1, -2, -3), period.negated());
    assertTrue(period.negated().isNegative());
    assertTrue(Period.of(1, -1, 0).isNegative());
    assertFalse(period.isNegative());
    assertEquals(Period.ofWeeks(2), Period.ofDays(14));
    assertEquals(Period.ofWeeks(2).hashCode(), Period.ofDays(14).hashCode());
    assertThrows(ArithmeticException.class, () -> Period.ofYears(Integer.MAX_VALUE).plusYears(1));
    assertThrows(ArithmeticException.class, () -> Period.ofDays(Integer.MIN_VALUE).negated());
  }

  @Test
  public void unitAccess()
  {
    Period  period = Period.of(1, 2, 3);

    assertEquals(1, period.get(ChronoUnit.YEARS));
    assertEquals(2, period.get(ChronoUnit.MONTHS));
    assertEquals(3, period.get(ChronoUnit.DAYS));
    assertThrows(UnsupportedTemporalTypeException.class, () -> period.get(ChronoUnit.WEEKS));
    assertEquals(Period.of(7, 2, 3), period.withYears(7));
    assertSame(period, period.withDays(3));
  }

  @Test
  public void normalization()
  {
    assertEquals(Period.of(2, 3, 3), Period.of(1, 15, 3).normalized());
    assertEquals(Period.of(0, -3, 0), Period.of(1, -15, 0).normalized());
    assertEquals(Period.of(0, 1, 40), Period.of(-1, 13, 40).normalized());
    assertEquals(27, Period.of(2, 3, 99).toTotalMonths());
  }

  @ParameterizedTest
  @CsvSource({
    "2012-01-31, 2012-03-01, P1M1D",
    "2012-03-01, 2012-01-31, P-1M-1D",
    "2010-06-15, 2012-05-14, P1Y10M29D",
    "2012-02-29, 2013-02-28, P11M30D",
    "2012-02-29, 2016-02-29, P4Y",
    "2012-10-29, 2012-10-29, P0D",
    "2012-10-29, 2012-10-28, P-1D"
  })
  public void between(String start, String end, String expected)
  {
    LocalDate   startDate = LocalDate.parse(start);
    LocalDate   endDate = LocalDate.parse(end);
    Period      period = Period.between(startDate, endDate);

    assertEquals(expected, period.toString());
    assertEquals(period, startDate.until(endDate));
    assertEquals(endDate, startDate.plus(period));
  }

  @Test
  public void addedToDates()
  {
    assertEquals(LocalDate.of(2012, 2, 29), LocalDate.of(2012, 1, 31).plus(Period.ofMonths(1)));
    assertEquals(LocalDate.of(2012, 2, 29), LocalDate.of(2011, 1, 31).plus(Period.of(1, 1, 0)));
    assertEquals(LocalDate.of(2012, 3, 1), LocalDate.of(2012, 1, 31).plus(Period.of(0, 1, 1)));
    assertEquals(LocalDate.of(2012, 2, 29), LocalDate.of(2012, 3, 31).minus(Period.ofMonths(1)));
    assertEquals(LocalDate.of(2011, 2, 28), LocalDate.of(2012, 2, 29).minus(Period.ofYears(1)));
    assertEquals(LocalDateTime.of(2013, 1, 5, 10, 15), LocalDateTime.of(2012, 1, 1, 10, 15).plus(Period.of(1, 0, 4)));
    assertEquals(LocalDateTime.of(2011, 12, 31, 10, 15), LocalDateTime.of(2012, 1, 1, 10, 15).minus(Period.ofDays(1)));
  }

  @Test
  public void addedToZonedDateTimes()
  {
    ZoneId          london = ZoneId.of("Europe/London");
    ZonedDateTime   zdt = ZonedDateTime.of(2008, 3, 29, 1, 30, 0, 0, london).plus(Period.ofDays(1));

    assertEquals(LocalDateTime.of(2008, 3, 30, 2, 30), zdt.toLocalDateTime());
    assertEquals(ZoneOffset.ofHours(1), zdt.getOffset());

    ZonedDateTime   summer = ZonedDateTime.of(2008, 6, 30, 12, 0, 0, 0, london);

    assertEquals(ZoneOffset.UTC, summer.minus(Period.ofMonths(6)).getOffset());
    assertEquals(LocalDateTime.of(2007, 12, 30, 12, 0), summer.minus(Period.ofMonths(6)).toLocalDateTime());
  }
}
