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


public final class YearMonth implements Temporal, TemporalAdjuster, Comparable<YearMonth>
{
  private static final DateTimeFormatter  PARSER = new DateTimeFormatterBuilder()
    .appendValue(YEAR, 4, 10, SignStyle.EXCEEDS_PAD)
    .appendLiteral('-')
    .appendValue(MONTH_OF_YEAR, 2)
    .toFormatter();

  private final int year;
  private final int month;

  private YearMonth(int year, int month)
  {
    this.year = year;
    this.month = month;
  }

  public static YearMonth now()
  {
    LocalDate   today = LocalDate.now();

    return of(today.getYear(), today.getMonthValue());
  }

  public static YearMonth of(int year, Month month)
  {
    Objects.requireNonNull(month, "month");

    return of(year, month.getValue());
  }

  public static YearMonth of(int year, int month)
  {
    YEAR.checkValidValue(year);
    MONTH_OF_YEAR.checkValidValue(month);

    return new YearMonth(year, month);
  }

  public static YearMonth from(TemporalAccessor temporal)
  {
    Objects.requireNonNull(temporal, "temporal");

    if (temporal instanceof YearMonth)
      return (YearMonth) temporal;

    try {
      return of(temporal.get(YEAR), temporal.get(MONTH_OF_YEAR));
    }
    catch (DateTimeException e) {
      throw new DateTimeException("Unable to obtain YearMonth from TemporalAccessor: " + temporal +
                                  " of type " + temporal.getClass().getName(), e);
    }
  }

  public static YearMonth parse(CharSequence text)
  {
    return parse(text, PARSER);
  }

  public static YearMonth parse(CharSequence text, DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.parse(text, YearMonth::from);
  }

  public static DateTimeResult<YearMonth> tryParse(CharSequence text)
  {
    return DateTimeResult.of(() -> parse(text));
  }

  private YearMonth withYearMonth(int newYear, int newMonth)
  {
    if (year == newYear && month == newMonth)
      return this;

    return new YearMonth(newYear, newMonth);
  }

  private long getProlepticMonth()
  {
    return year * 12L + month - 1;
  }

  public int getYear()
  {
    return year;
  }

  public int getMonthValue()
  {
    return month;
  }

  public Month getMonth()
  {
    return Month.of(month);
  }

  public boolean isLeapYear()
  {
    return IsoChronology.INSTANCE.isLeapYear(year);
  }

  public boolean isValidDay(int dayOfMonth)
  {
    return dayOfMonth >= 1 && dayOfMonth <= lengthOfMonth();
  }

  public int lengthOfMonth()
  {
    return getMonth().length(isLeapYear());
  }

  public int lengthOfYear()
  {
    return isLeapYear() ? 366 : 365;
  }

  @Override
  public boolean isSupported(ChronoField field)
  {
    return field == YEAR || field == MONTH_OF_YEAR || field == PROLEPTIC_MONTH || field == YEAR_OF_ERA || field == ERA;
  }

  @Override
  public boolean isSupported(ChronoUnit unit)
  {
    return unit == ChronoUnit.MONTHS || unit == ChronoUnit.YEARS || unit == ChronoUnit.DECADES ||
           unit == ChronoUnit.CENTURIES || unit == ChronoUnit.MILLENNIA || unit == ChronoUnit.ERAS;
  }

  @Override
  public ValueRange range(ChronoField field)
  {
    if (field == YEAR_OF_ERA)
      return (year <= 0 ? ValueRange.of(1, Year.MAX_VALUE + 1) : ValueRange.of(1, Year.MAX_VALUE));

    return Temporal.super.range(field);
  }

  @Override
  public long getLong(ChronoField field)
  {
    switch (Objects.requireNonNull(field, "field")) {
      case MONTH_OF_YEAR:   return month;
      case PROLEPTIC_MONTH: return getProlepticMonth();
      case YEAR_OF_ERA:     return (year < 1 ? 1 - year : year);
      case YEAR:            return year;
      case ERA:             return (year < 1 ? 0 : 1);
      default:
        throw UnsupportedTemporalTypeException.forField(field);
    }
  }

  @Override
  public YearMonth with(TemporalAdjuster adjuster)
  {
    return (YearMonth) adjuster.adjustInto(this);
  }

  @Override
  public YearMonth with(ChronoField field, long newValue)
  {
    Objects.requireNonNull(field, "field");

    if (!isSupported(field))
      throw UnsupportedTemporalTypeException.forField(field);

    field.checkValidValue(newValue);

    switch (field) {
      case MONTH_OF_YEAR:   return withMonth((int) newValue);
      case PROLEPTIC_MONTH: return plusMonths(newValue - getProlepticMonth());
      case YEAR_OF_ERA:     return withYear((int) (year < 1 ? 1 - newValue : newValue));
      case YEAR:            return withYear((int) newValue);
      default:
        return (getLong(ERA) == newValue ? this : withYear(1 - year));
    }
  }

  public YearMonth withYear(int year)
  {
    YEAR.checkValidValue(year);

    return withYearMonth(year, month);
  }

  public YearMonth withMonth(int month)
  {
    MONTH_OF_YEAR.checkValidValue(month);

    return withYearMonth(year, month);
  }

  @Override
  public YearMonth plus(long amountToAdd, ChronoUnit unit)
  {
    switch (Objects.requireNonNull(unit, "unit")) {
      case MONTHS:    return plusMonths(amountToAdd);
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
  public YearMonth minus(long amountToSubtract, ChronoUnit unit)
  {
    return (amountToSubtract == Long.MIN_VALUE ? plus(Long.MAX_VALUE, unit).plus(1, unit) : plus(-amountToSubtract, unit));
  }

  public YearMonth plusYears(long yearsToAdd)
  {
    if (yearsToAdd == 0)
      return this;

    return withYearMonth(YEAR.checkValidIntValue(year + yearsToAdd), month);
  }

  public YearMonth plusMonths(long monthsToAdd)
  {
    if (monthsToAdd == 0)
      return this;

    long  calcMonths = getProlepticMonth() + monthsToAdd;
    int   newYear = YEAR.checkValidIntValue(floorDiv(calcMonths, 12));
    int   newMonth = (int) floorMod(calcMonths, 12) + 1;

    return withYearMonth(newYear, newMonth);
  }

  public YearMonth minusYears(long yearsToSubtract)
  {
    return (yearsToSubtract == Long.MIN_VALUE ? plusYears(Long.MAX_VALUE).plusYears(1) : plusYears(-yearsToSubtract));
  }

  public YearMonth minusMonths(long monthsToSubtract)
  {
    return (monthsToSubtract == Long.MIN_VALUE ? plusMonths(Long.MAX_VALUE).plusMonths(1) : plusMonths(-monthsToSubtract));
  }

  @Override
  public long until(Temporal endExclusive, ChronoUnit unit)
  {
    YearMonth   end = YearMonth.from(endExclusive);
    long        monthsUntil = end.getProlepticMonth() - getProlepticMonth();

    switch (Objects.requireNonNull(unit, "unit")) {
      case MONTHS:    return monthsUntil;
      case YEARS:     return monthsUntil / 12;
      case DECADES:   return monthsUntil / 120;
      case CENTURIES: return monthsUntil / 1200;
      case MILLENNIA: return monthsUntil / 12000;
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
      return (R) ChronoUnit.MONTHS;

    return Temporal.super.query(query);
  }

  @Override
  public Temporal adjustInto(Temporal temporal)
  {
    return temporal.with(PROLEPTIC_MONTH, getProlepticMonth());
  }

  public LocalDate atDay(int dayOfMonth)
  {
    return LocalDate.of(year, month, dayOfMonth);
  }

  public LocalDate atEndOfMonth()
  {
    return LocalDate.of(year, month, lengthOfMonth());
  }

  public String format(DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.format(this);
  }

  @Override
  public int compareTo(YearMonth other)
  {
    int   cmp = year - other.year;

    if (cmp == 0)
      cmp = month - other.month;

    return cmp;
  }

  public boolean isAfter(YearMonth other)
  {
    return compareTo(other) > 0;
  }

  public boolean isBefore(YearMonth other)
  {
    return compareTo(other) < 0;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (obj instanceof YearMonth) {
      YearMonth   other = (YearMonth) obj;

      return year == other.year && month == other.month;
    }

    return false;
  }

  @Override
  public int hashCode()
  {
    return year ^ (month << 27);
  }

  @Override
  public String toString()
  {
    int             absYear = abs(year);
    StringBuilder   buf = new StringBuilder(9);

    if (absYear < 1000) {
      if (year < 0)
        buf.append(year - 10000).deleteCharAt(1);
      else
        buf.append(year + 10000).deleteCharAt(0);
    }
    else {
      if (year > 9999)
        buf.append('+');

      buf.append(year);
    }

    return buf.append(month < 10 ? "-0" : "-").append(month).toString();
  }
}
