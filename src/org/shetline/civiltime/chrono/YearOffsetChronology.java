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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.temporal.ChronoField;
import org.shetline.civiltime.temporal.TemporalAccessor;
import org.shetline.civiltime.temporal.ValueRange;

import static org.shetline.civiltime.temporal.ChronoField.*;


/**
 * A chronology identical to ISO except that its proleptic year is the ISO year plus a constant,
 * with one era for years from 1 on and another, counting backwards, for the years before.
 */
abstract class YearOffsetChronology extends Chronology
{
  private final int   yearsDifference;
  private final Era   eraBefore;
  private final Era   eraCurrent;

  YearOffsetChronology(int yearsDifference, Era eraBefore, Era eraCurrent)
  {
    this.yearsDifference = yearsDifference;
    this.eraBefore = eraBefore;
    this.eraCurrent = eraCurrent;
  }

  @Override
  public ChronoDate date(int prolepticYear, int month, int dayOfMonth)
  {
    return ofIso(LocalDate.of(isoYear(prolepticYear), month, dayOfMonth));
  }

  @Override
  public ChronoDate date(Era era, int yearOfEra, int month, int dayOfMonth)
  {
    return date(prolepticYear(era, yearOfEra), month, dayOfMonth);
  }

  @Override
  public ChronoDate dateYearDay(int prolepticYear, int dayOfYear)
  {
    return ofIso(LocalDate.ofYearDay(isoYear(prolepticYear), dayOfYear));
  }

  @Override
  public ChronoDate dateEpochDay(long epochDay)
  {
    return ofIso(LocalDate.ofEpochDay(epochDay));
  }

  @Override
  public ChronoDate date(TemporalAccessor temporal)
  {
    if (temporal instanceof ChronoDate && ((ChronoDate) temporal).getChronology().equals(this))
      return (ChronoDate) temporal;

    return ofIso(LocalDate.from(temporal));
  }

  private int isoYear(long prolepticYear)
  {
    YEAR.checkValidValue(prolepticYear - yearsDifference);

    return (int) (prolepticYear - yearsDifference);
  }

  @Override
  public boolean isLeapYear(long prolepticYear)
  {
    return IsoChronology.INSTANCE.isLeapYear(prolepticYear - yearsDifference);
  }

  @Override
  public int prolepticYear(Era era, int yearOfEra)
  {
    Objects.requireNonNull(era, "era");

    if (era.getClass() != eraCurrent.getClass())
      throw new ClassCastException("Era must be " + eraCurrent.getClass().getSimpleName());

    return (era == eraCurrent ? yearOfEra : 1 - yearOfEra);
  }

  @Override
  public List<Era> eras()
  {
    return Arrays.asList(eraBefore, eraCurrent);
  }

  @Override
  public ValueRange range(ChronoField field)
  {
    switch (field) {
      case PROLEPTIC_MONTH: {
        ValueRange  range = PROLEPTIC_MONTH.range();

        return ValueRange.of(range.getMinimum() + yearsDifference * 12L, range.getMaximum() + yearsDifference * 12L);
      }
      case YEAR_OF_ERA: {
        long  currentMax = YEAR.range().getMaximum() + yearsDifference;
        long  beforeMax = -(YEAR.range().getMinimum() + yearsDifference) + 1;

        return ValueRange.of(1, Math.min(currentMax, beforeMax), Math.max(currentMax, beforeMax));
      }
      case YEAR:
        return ValueRange.of(YEAR.range().getMinimum() + yearsDifference, YEAR.range().getMaximum() + yearsDifference);
      default:
        return field.range();
    }
  }

  @Override
  ChronoDate ofIso(LocalDate isoDate)
  {
    return new ChronoDate(this, isoDate);
  }

  @Override
  int prolepticYear(LocalDate isoDate)
  {
    return isoDate.getYear() + yearsDifference;
  }

  @Override
  Era era(LocalDate isoDate)
  {
    return prolepticYear(isoDate) >= 1 ? eraCurrent : eraBefore;
  }

  @Override
  int yearOfEra(LocalDate isoDate)
  {
    int   prolepticYear = prolepticYear(isoDate);

    return prolepticYear >= 1 ? prolepticYear : 1 - prolepticYear;
  }

  @Override
  ValueRange yearOfEraRange(LocalDate isoDate)
  {
    if (prolepticYear(isoDate) <= 0)
      return ValueRange.of(1, -(YEAR.range().getMinimum() + yearsDifference) + 1);

    return ValueRange.of(1, YEAR.range().getMaximum() + yearsDifference);
  }

  @Override
  LocalDate withProlepticYear(LocalDate isoDate, long prolepticYear)
  {
    return isoDate.withYear(isoYear(prolepticYear));
  }
}
