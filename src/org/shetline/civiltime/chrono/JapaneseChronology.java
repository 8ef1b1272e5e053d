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

import static org.shetline.civiltime.temporal.ChronoField.YEAR;


/**
 * The Japanese imperial calendar. Years are ISO years, numbered within eras that start on the
 * accession of each emperor. Dates before Meiji 6 (ISO 1873-01-01), when the Gregorian calendar
 * was adopted, are not supported.
 */
public final class JapaneseChronology extends Chronology
{
  public static final JapaneseChronology INSTANCE = new JapaneseChronology();

  static final LocalDate  MEIJI_6_ISODATE = LocalDate.of(1873, 1, 1);

  private JapaneseChronology()
  {
  }

  @Override
  public String getId()
  {
    return "Japanese";
  }

  @Override
  public String getCalendarType()
  {
    return "japanese";
  }

  @Override
  public ChronoDate date(Era era, int yearOfEra, int month, int dayOfMonth)
  {
    JapaneseEra   jera = toJapaneseEra(era);
    LocalDate     isoDate = LocalDate.of(prolepticYear(jera, yearOfEra), month, dayOfMonth);
    LocalDate     end = jera.endDate();

    if (isoDate.isBefore(jera.startDate()) || (end != null && !isoDate.isBefore(end)))
      throw new DateTimeException("Requested date is outside bounds of era " + jera);

    return ofIso(isoDate);
  }

  @Override
  public ChronoDate date(int prolepticYear, int month, int dayOfMonth)
  {
    return ofIso(LocalDate.of(prolepticYear, month, dayOfMonth));
  }

  @Override
  public ChronoDate dateYearDay(Era era, int yearOfEra, int dayOfYear)
  {
    JapaneseEra   jera = toJapaneseEra(era);
    LocalDate     isoDate;

    // Day-of-year counts from the start of the era in the era's first year.
    if (yearOfEra == 1)
      isoDate = jera.startDate().plusDays(dayOfYear - 1);
    else
      isoDate = LocalDate.ofYearDay(prolepticYear(jera, yearOfEra), dayOfYear);

    LocalDate     end = jera.endDate();

    if (end != null && !isoDate.isBefore(end))
      throw new DateTimeException("Requested date is outside bounds of era " + jera);

    return ofIso(isoDate);
  }

  @Override
  public ChronoDate dateYearDay(int prolepticYear, int dayOfYear)
  {
    return ofIso(LocalDate.ofYearDay(prolepticYear, dayOfYear));
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

  @Override
  public boolean isLeapYear(long prolepticYear)
  {
    return IsoChronology.INSTANCE.isLeapYear(prolepticYear);
  }

  @Override
  public int prolepticYear(Era era, int yearOfEra)
  {
    JapaneseEra   jera = toJapaneseEra(era);
    int           isoYear = jera.startDate().getYear() + yearOfEra - 1;
    LocalDate     end = jera.endDate();

    if (yearOfEra < 1 || (end != null && isoYear > end.getYear()))
      throw new DateTimeException("Invalid yearOfEra value");

    return isoYear;
  }

  private static JapaneseEra toJapaneseEra(Era era)
  {
    Objects.requireNonNull(era, "era");

    if (!(era instanceof JapaneseEra))
      throw new ClassCastException("Era must be JapaneseEra");

    return (JapaneseEra) era;
  }

  @Override
  public JapaneseEra eraOf(int eraValue)
  {
    return JapaneseEra.of(eraValue);
  }

  @Override
  public List<Era> eras()
  {
    return Arrays.asList((Era[]) JapaneseEra.values());
  }

  @Override
  public ValueRange range(ChronoField field)
  {
    JapaneseEra[]   eras = JapaneseEra.values();
    JapaneseEra     last = eras[eras.length - 1];

    switch (field) {
      case ERA:
        return ValueRange.of(JapaneseEra.MEIJI.getValue(), last.getValue());
      case YEAR:
        return ValueRange.of(MEIJI_6_ISODATE.getYear(), YEAR.range().getMaximum());
      case PROLEPTIC_MONTH:
        return ValueRange.of(MEIJI_6_ISODATE.getYear() * 12L, YEAR.range().getMaximum() * 12L + 11);
      case YEAR_OF_ERA: {
        long  shortest = Long.MAX_VALUE;

        for (int i = 0; i < eras.length - 1; ++i)
          shortest = Math.min(shortest, eras[i].endDate().getYear() - eras[i].startDate().getYear() + 1);

        return ValueRange.of(1, shortest, YEAR.range().getMaximum() - last.startDate().getYear() + 1);
      }
      default:
        return field.range();
    }
  }

  @Override
  ChronoDate ofIso(LocalDate isoDate)
  {
    if (isoDate.isBefore(MEIJI_6_ISODATE))
      throw new DateTimeException("JapaneseDate before Meiji 6 is not supported");

    return new ChronoDate(this, isoDate);
  }

  @Override
  Era era(LocalDate isoDate)
  {
    return JapaneseEra.from(isoDate);
  }

  @Override
  int yearOfEra(LocalDate isoDate)
  {
    return isoDate.getYear() - JapaneseEra.from(isoDate).startDate().getYear() + 1;
  }

  @Override
  ValueRange yearOfEraRange(LocalDate isoDate)
  {
    JapaneseEra   era = JapaneseEra.from(isoDate);
    LocalDate     end = era.endDate();

    if (end == null)
      return ValueRange.of(1, YEAR.range().getMaximum() - era.startDate().getYear() + 1);

    return ValueRange.of(1, end.getYear() - era.startDate().getYear() + 1);
  }

  @Override
  LocalDate withProlepticYear(LocalDate isoDate, long prolepticYear)
  {
    return isoDate.withYear(Math.toIntExact(prolepticYear));
  }
}
