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

package org.shetline.civiltime.chrono;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.shetline.civiltime.DateTimeException;
import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.temporal.ChronoField;
import org.shetline.civiltime.temporal.ChronoUnit;
import org.shetline.civiltime.temporal.TemporalAdjusters;

import static org.junit.jupiter.api.Assertions.*;


public class MinguoChronologyTest
{
  private static final MinguoChronology MINGUO = MinguoChronology.INSTANCE;

  @ParameterizedTest
  @CsvSource({
    "1,   1,  1, 1912-01-01",
    "101, 10, 29, 2012-10-29",
    "0,   12, 31, 1911-12-31",
    "-1,  6,  15, 1910-06-15",
  })
  public void isoEquivalence(int prolepticYear, int month, int day, String iso)
  {
    ChronoDate  date = MINGUO.date(prolepticYear, month, day);

    assertEquals(LocalDate.parse(iso).toEpochDay(), date.toEpochDay());
    assertEquals(date, MINGUO.date(LocalDate.parse(iso)));
  }

  @Test
  public void eras()
  {
    ChronoDate  roc = MINGUO.date(101, 10, 29);
    ChronoDate  before = MINGUO.date(0, 12, 31);

    assertEquals(MinguoEra.ROC, roc.getEra());
    assertEquals(101, roc.getYearOfEra());
    assertEquals(MinguoEra.BEFORE_ROC, before.getEra());
    assertEquals(1, before.getYearOfEra());
    assertEquals(0, before.getProlepticYear());
    assertEquals(before, MINGUO.date(MinguoEra.BEFORE_ROC, 1, 12, 31));
    assertEquals("Minguo ROC 101-10-29", roc.toString());
    assertEquals("Minguo BEFORE_ROC 1-12-31", before.toString());
  }

  @Test
  public void fields()
  {
    ChronoDate  date = MINGUO.date(101, 2, 1);

    assertTrue(date.isLeapYear());
    assertEquals(29, date.lengthOfMonth());
    assertEquals(101, date.get(ChronoField.YEAR));
    assertEquals(101 * 12 + 1, date.getLong(ChronoField.PROLEPTIC_MONTH));
    assertEquals(1, date.getLong(ChronoField.ERA));
    assertEquals(3, date.get(ChronoField.DAY_OF_WEEK));
  }

  @Test
  public void arithmetic()
  {
    ChronoDate  date = MINGUO.date(101, 1, 31);

    assertEquals(MINGUO.date(101, 2, 29), date.plusMonths(1));
    assertEquals(MINGUO.date(102, 1, 31), date.plusYears(1));
    assertEquals(MINGUO.date(101, 2, 7), date.plusWeeks(1));
    assertEquals(MINGUO.date(100, 12, 31), date.minus(1, ChronoUnit.MONTHS));
    assertEquals(MINGUO.date(101, 1, 1), date.with(TemporalAdjusters.firstDayOfMonth()));
    assertEquals(MINGUO.date(95, 1, 31), date.with(ChronoField.YEAR, 95));
    assertEquals(MINGUO.date(0, 1, 31), date.with(ChronoField.ERA, 0).with(ChronoField.YEAR_OF_ERA, 1));
    assertEquals(12, date.until(MINGUO.date(102, 1, 31), ChronoUnit.MONTHS));
    assertEquals(366, date.until(LocalDate.of(2013, 1, 31), ChronoUnit.DAYS));
  }

  @Test
  public void invalidDates()
  {
    assertThrows(DateTimeException.class, () -> MINGUO.date(101, 2, 30));
    assertThrows(DateTimeException.class, () -> MINGUO.eraOf(2));
    assertThrows(ClassCastException.class, () -> MINGUO.date(IsoEra.CE, 1, 1, 1));
  }
}
