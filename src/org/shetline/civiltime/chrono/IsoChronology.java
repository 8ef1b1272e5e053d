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

import org.shetline.civiltime.DateTimeException;
import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.temporal.ChronoField;
import org.shetline.civiltime.temporal.TemporalAccessor;
import org.shetline.civiltime.temporal.ValueRange;


public final class IsoChronology extends Chronology
{
  public static final IsoChronology INSTANCE = new IsoChronology();

  private IsoChronology()
  {
  }

  @Override
  public String getId()
  {
    return "ISO";
  }

  @Override
  public String getCalendarType()
  {
    return "iso8601";
  }

  @Override
  public LocalDate date(Era era, int yearOfEra, int month, int dayOfMonth)
  {
    return date(prolepticYear(era, yearOfEra), month, dayOfMonth);
  }

  @Override
  public LocalDate date(int prolepticYear, int month, int dayOfMonth)
  {
    return LocalDate.of(prolepticYear, month, dayOfMonth);
  }

  @Override
  public LocalDate dateYearDay(int prolepticYear, int dayOfYear)
  {
    return LocalDate.ofYearDay(prolepticYear, dayOfYear);
  }

  @Override
  public LocalDate dateEpochDay(long epochDay)
  {
    return LocalDate.ofEpochDay(epochDay);
  }

  @Override
  public LocalDate date(TemporalAccessor temporal)
  {
    return LocalDate.from(temporal);
  }

  @Override
  public LocalDate dateNow()
  {
    return LocalDate.now();
  }

  @Override
  public boolean isLeapYear(long prolepticYear)
  {
    return (prolepticYear & 3) == 0 && (prolepticYear % 100 != 0 || prolepticYear % 400 == 0);
  }

  @Override
  public int prolepticYear(Era era, int yearOfEra)
  {
    Objects.requireNonNull(era, "era");

    if (!(era instanceof IsoEra))
      throw new ClassCastException("Era must be IsoEra");

    return (era == IsoEra.CE ? yearOfEra : 1 - yearOfEra);
  }

  @Override
  public IsoEra eraOf(int eraValue)
  {
    return IsoEra.of(eraValue);
  }

  @Override
  public List<Era> eras()
  {
    return Arrays.asList(IsoEra.values());
  }

  @Override
  public ValueRange range(ChronoField field)
  {
    return field.range();
  }

  @Override
  ChronoDate ofIso(LocalDate isoDate)
  {
    throw new DateTimeException("ISO dates are represented by LocalDate");
  }
}
