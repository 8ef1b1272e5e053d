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
import org.junit.jupiter.params.provider.ValueSource;
import org.shetline.civiltime.format.DateTimeFormatter;
import org.shetline.civiltime.format.DateTimeParseException;
import org.shetline.civiltime.temporal.ChronoField;
import org.shetline.civiltime.temporal.UnsupportedTemporalTypeException;

import static org.junit.jupiter.api.Assertions.*;


public class MonthDayTest
{
  @Test
  public void parsesAndPrints()
  {
    assertEquals(MonthDay.of(12, 3), MonthDay.parse("--12-03"));
    assertEquals(MonthDay.of(2, 29), MonthDay.parse("--02-29"));
    assertEquals("--02-29", MonthDay.of(Month.FEBRUARY, 29).toString());
    assertEquals("--11-05", MonthDay.of(11, 5).toString());
    assertEquals("02/29", MonthDay.of(2, 29).format(DateTimeFormatter.ofPattern("MM/dd")));
  }

  @ParameterizedTest
  @ValueSource(strings = { "--02-30", "--13-01", "12-03" })
  public void rejectsBadText(String text)
  {
    assertThrows(DateTimeParseException.class, () -> MonthDay.parse(text));
    assertEquals(DateTimeErrorKind.PARSE, MonthDay.tryParse(text).getKind());
  }

  @Test
  public void rejectsImpossibleDays()
  {
    assertThrows(DateTimeException.class, () -> MonthDay.of(2, 30));
    assertThrows(DateTimeException.class, () -> MonthDay.of(4, 31));
    assertThrows(DateTimeException.class, () -> MonthDay.of(13, 1));
    assertThrows(DateTimeException.class, () -> MonthDay.of(1, 0));
  }

  @Test
  public void leapDay()
  {
    MonthDay  leapDay = MonthDay.of(2, 29);

    assertFalse(leapDay.isValidYear(2011));
    assertTrue(leapDay.isValidYear(2012));
    assertTrue(MonthDay.of(2, 28).isValidYear(2011));
    assertEquals(LocalDate.of(2011, 2, 28), leapDay.atYear(2011));
    assertEquals(LocalDate.of(2012, 2, 29), leapDay.atYear(2012));
    assertEquals(LocalDate.of(2011, 2, 28), LocalDate.of(2011, 1, 1).with(leapDay));
    assertEquals(LocalDate.of(2012, 2, 29), LocalDate.of(2012, 12, 31).with(leapDay));
  }

  @Test
  public void changingMonthKeepsDayValid()
  {
    assertEquals(MonthDay.of(4, 30), MonthDay.of(3, 31).with(Month.APRIL));
    assertEquals(MonthDay.of(2, 29), MonthDay.of(1, 31).withMonth(2));
    assertEquals(MonthDay.of(3, 5), MonthDay.of(3, 31).withDayOfMonth(5));
    assertThrows(DateTimeException.class, () -> MonthDay.of(4, 1).withDayOfMonth(31));
  }

  @Test
  public void fields()
  {
    MonthDay  feb = MonthDay.of(2, 10);

    assertEquals(2, feb.get(ChronoField.MONTH_OF_YEAR));
    assertEquals(10, feb.get(ChronoField.DAY_OF_MONTH));
    assertEquals("1 - 28/29", feb.range(ChronoField.DAY_OF_MONTH).toString());
    assertFalse(feb.isSupported(ChronoField.YEAR));
    assertThrows(UnsupportedTemporalTypeException.class, () -> feb.getLong(ChronoField.YEAR));
    assertEquals(MonthDay.of(6, 30), MonthDay.from(LocalDate.of(2012, 6, 30)));
  }

  @Test
  public void ordering()
  {
    assertTrue(MonthDay.of(1, 31).isBefore(MonthDay.of(2, 1)));
    assertTrue(MonthDay.of(12, 2).isAfter(MonthDay.of(12, 1)));
    assertEquals(0, MonthDay.of(7, 4).compareTo(MonthDay.parse("--07-04")));
  }
}
