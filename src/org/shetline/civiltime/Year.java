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

import java.util.Objects;

import org.shetline.civiltime.chrono.IsoChronology;
import org.shetline.civiltime.format.DateTimeFormatter;
import org.shetline.civiltime.format.DateTimeFormatterBuilder;
import org.shetline.civiltime.format.SignStyle;
import org.shetline.civiltime.temporal.*;

import static java.lang.Math.*;
import static org.shetline.civiltime.temporal.ChronoField.*;


public final class Year implements Temporal, TemporalAdjuster, Comparable<Year>
{
  public static final int   MIN_VALUE = LocalDate.MIN_YEAR;
  public static final int   MAX_VALUE = LocalDate.MAX_YEAR;

  private static final DateTimeFormatter  PARSER = new DateTimeFormatterBuilder()
    .appendValue(YEAR, 4, 10, SignStyle.EXCEEDS_PAD)
    .toFormatter();

  private final int year;

  private Year(int year)
  {
    this.year = year;
  }

  public static Year now()
  {
    return of(LocalDate.now().getYear());
  }

  public static Year of(int isoYear)
  {
    YEAR.checkValidValue(isoYear);

    return new Year(isoYear);
  }

  public static Year from(TemporalAccessor temporal)
  {
    Objects.requireNonNull(temporal, "temporal");

    if (temporal instanceof Year)
      return (Year) temporal;

    try {
      return of(temporal.get(YEAR));
    }
    catch (DateTimeException e) {
      throw new DateTimeException("Unable to obtain Year from TemporalAccessor: " + temporal +
                                  " of type " + temporal.getClass().getName(), e);
    }
  }

  public static Year parse(CharSequence text)
  {
    return parse(text, PARSER);
  }

  public static Year parse(CharSequence text, DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.parse(text, Year::from);
  }

  public static DateTimeResult<Year> tryParse(CharSequence text)
  {
    return DateTimeResult.of(() -> parse(text));
  }

  public static boolean isLeap(long year)
  {
    return IsoChronology.INSTANCE.isLeapYear(year);
  }

  public int getValue()
  {
    return year;
  }

  public boolean isLeap()
  {
    return isLeap(year);
  }

  public int length()
  {
    return isLeap() ? 366 : 365;
  }

  public boolean isValidMonthDay(MonthDay monthDay)
  {
    return monthDay != null && monthDay.isValidYear(year);
  }

  @Override
  public boolean isSupported(ChronoField field)
  {
    return field == YEAR || field == YEAR_OF_ERA || field == ERA;
  }

  @Override
  public boolean isSupported(ChronoUnit unit)
  {
    return unit == ChronoUnit.YEARS || unit == ChronoUnit.DECADES || unit == ChronoUnit.CENTURIES ||
           unit == ChronoUnit.MILLENNIA || unit == ChronoUnit.ERAS;
  }

  @Override
  public ValueRange range(ChronoField field)
  {
    if (field == YEAR_OF_ERA)
      return (year <= 0 ? ValueRange.of(1, MAX_VALUE + 1) : ValueRange.of(1, MAX_VALUE));

    return Temporal.super.range(field);
  }

  @Override
  public long getLong(ChronoField field)
  {
    switch (Objects.requireNonNull(field, "field")) {
      case YEAR_OF_ERA: return (year < 1 ? 1 - year : year);
      case YEAR:        return year;
      case ERA:         return (year < 1 ? 0 : 1);
      default:
        throw UnsupportedTemporalTypeException.forField(field);
    }
  }

  @Override
  public Year with(TemporalAdjuster adjuster)
  {
    return (Year) adjuster.adjustInto(this);
  }

  @Override
  public Year with(ChronoField field, long newValue)
  {
    Objects.requireNonNull(field, "field");

    if (!isSupported(field))
      throw UnsupportedTemporalTypeException.forField(field);

    field.checkValidValue(newValue);

    switch (field) {
      case YEAR_OF_ERA: return of((int) (year < 1 ? 1 - newValue : newValue));
      case YEAR:        return of((int) newValue);
      default:
        return (getLong(ERA) == newValue ? this : of(1 - year));
    }
  }

  @Override
  public Year plus(long amountToAdd, ChronoUnit unit)
  {
    switch (Objects.requireNonNull(unit, "unit")) {
      case YEARS:     return plusYears(amountToAdd);
      case DECADES:   return plusYears(multiplyExact(amountToAdd, 10));
      case CENTURIES: return plusYears(multiplyExact(amountToAdd, 100));
      case MILLENNIA: return plusYears(multiplyExact(amountToAdd, 1000));
      case ERAS:      return with(ERA, addExact(getLong(ERA), amountToAdd));
      default:
        throw UnsupportedTemporalTypeException.forUnit(unit);
    }
  }

  @Override
  public Year minus(long amountToSubtract, ChronoUnit unit)
  {
    return (amountToSubtract == Long.MIN_VALUE ? plus(Long.MAX_VALUE, unit).plus(1, unit) : plus(-amountToSubtract, unit));
  }

  public Year plusYears(long yearsToAdd)
  {
    if (yearsToAdd == 0)
      return this;

    return of(YEAR.checkValidIntValue(year + yearsToAdd));
  }

  public Year minusYears(long yearsToSubtract)
  {
    return (yearsToSubtract == Long.MIN_VALUE ? plusYears(Long.MAX_VALUE).plusYears(1) : plusYears(-yearsToSubtract));
  }

  @Override
  public long until(Temporal endExclusive, ChronoUnit unit)
  {
    Year  end = Year.from(endExclusive);
    long  yearsUntil = (long) end.year - year;

    switch (Objects.requireNonNull(unit, "unit")) {
      case YEARS:     return yearsUntil;
      case DECADES:   return yearsUntil / 10;
      case CENTURIES: return yearsUntil / 100;
      case MILLENNIA: return yearsUntil / 1000;
      case ERAS:      return end.getLong(ERA) - getLong(ERA);
      default:
        throw UnsupportedTemporalTypeException.forUnit(unit);
    }
  }

  @Override
  @SuppressWarnings("unchecked")
  public <R> R query(TemporalQuery<R> query)
  {
    if (query == TemporalQueries.chronology())
      return (R) IsoChronology.INSTANCE;
    else if (query == TemporalQueries.precision())
      return (R) ChronoUnit.YEARS;

    return Temporal.super.query(query);
  }

  @Override
  public Temporal adjustInto(Temporal temporal)
  {
    return temporal.with(YEAR, year);
  }

  public LocalDate atDay(int dayOfYear)
  {
    return LocalDate.ofYearDay(year, dayOfYear);
  }

  public YearMonth atMonth(Month month)
  {
    return YearMonth.of(year, month);
  }

  public YearMonth atMonth(int month)
  {
    return YearMonth.of(year, month);
  }

  public LocalDate atMonthDay(MonthDay monthDay)
  {
    return Objects.requireNonNull(monthDay, "monthDay").atYear(year);
  }

  public String format(DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.format(this);
  }

  @Override
  public int compareTo(Year other)
  {
    return Integer.compare(year, other.year);
  }

  public boolean isAfter(Year other)
  {
    return year > other.year;
  }

  public boolean isBefore(Year other)
  {
    return year < other.year;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (obj instanceof Year)
      return year == ((Year) obj).year;

    return false;
  }

  @Override
  public int hashCode()
  {
    return year;
  }

  @Override
  public String toString()
  {
    return Integer.toString(year);
  }
}
