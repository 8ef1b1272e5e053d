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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.shetline.civiltime.DateTimeException;
import org.shetline.civiltime.DayOfWeek;
import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.LocalTime;

import static org.junit.jupiter.api.Assertions.*;


public class IsoFieldsTest
{
  @ParameterizedTest
  @CsvSource({
    "2008-12-29,  2009, 1",
    "2010-01-03,  2009, 53",
    "2010-01-04,  2010, 1",
    "2012-01-01,  2011, 52",
    "2012-06-30,  2012, 26",
    "2015-12-31,  2015, 53"
  })
  public void weekBasedYears(String text, int weekBasedYear, int week)
  {
    LocalDate   date = LocalDate.parse(text);

    assertEquals(weekBasedYear, date.query(IsoFields.weekBasedYear()));
    assertEquals(week, date.query(IsoFields.weekOfWeekBasedYear()));
    assertEquals(date, IsoFields.ofWeekBasedYear(weekBasedYear, week, date.getDayOfWeek()));
  }

  @ParameterizedTest
  @CsvSource({
    "2011-03-31,  1,  90",
    "2012-05-15,  2,  45",
    "2012-07-01,  3,  1",
    "2012-12-31,  4,  92"
  })
  public void quarters(String text, int quarter, int dayOfQuarter)
  {
    LocalDate   date = LocalDate.parse(text);

    assertEquals(quarter, date.query(IsoFields.quarterOfYear()));
    assertEquals(dayOfQuarter, date.query(IsoFields.dayOfQuarter()));
  }

  @Test
  public void weeksPerYear()
  {
    assertEquals(53, IsoFields.weeksInWeekBasedYear(2009));
    assertEquals(53, IsoFields.weeksInWeekBasedYear(2015));
    assertEquals(53, IsoFields.weeksInWeekBasedYear(2020));
    assertEquals(52, IsoFields.weeksInWeekBasedYear(2010));
    assertEquals(52, IsoFields.weeksInWeekBasedYear(2012));
  }

  @Test
  public void adjusters()
  {
    assertEquals(LocalDate.of(2012, 1, 7), LocalDate.of(2012, 6, 30).with(IsoFields.weekOfWeekBasedYear(1)));
    assertEquals(LocalDate.of(2010, 12, 30), LocalDate.of(2009, 12, 31).with(IsoFields.weekBasedYear(2010)));
    assertEquals(LocalDateTime.of(2012, 1, 7, 10, 15),
                 LocalDateTime.of(2012, 6, 30, 10, 15).with(IsoFields.weekOfWeekBasedYear(1)));
    assertThrows(DateTimeException.class, () -> LocalDate.of(2012, 6, 30).with(IsoFields.weekOfWeekBasedYear(53)));
  }

  @Test
  public void invalidWeeks()
  {
    assertThrows(DateTimeException.class, () -> IsoFields.ofWeekBasedYear(2012, 53, DayOfWeek.MONDAY));
    assertThrows(DateTimeException.class, () -> IsoFields.ofWeekBasedYear(2012, 0, DayOfWeek.MONDAY));
  }

  @Test
  public void needsADate()
  {
    assertEquals(2009, LocalDateTime.of(2008, 12, 29, 10, 0).query(IsoFields.weekBasedYear()));
    assertThrows(UnsupportedTemporalTypeException.class, () -> LocalTime.of(10, 0).query(IsoFields.quarterOfYear()));
  }
}
