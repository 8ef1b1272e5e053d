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
import org.shetline.civiltime.temporal.*;

import static org.shetline.civiltime.temporal.ChronoField.*;


/**
 * A month and day-of-month in the ISO calendar, such as {@code --12-03}. February 29th is
 * allowed; it only becomes a real date in a leap year.
 */
public final class MonthDay implements TemporalAccessor, TemporalAdjuster, Comparable<MonthDay>
{
  private static final DateTimeFormatter  PARSER = new DateTimeFormatterBuilder()
    .appendLiteral("--")
    .appendValue(MONTH_OF_YEAR, 2)
    .appendLiteral('-')
    .appendValue(DAY_OF_MONTH, 2)
    .toFormatter();

  private final int month;
  private final int day;

  private MonthDay(int month, int dayOfMonth)
  {
    this.month = month;
    this.day = dayOfMonth;
  }

  public static MonthDay now()
  {
    LocalDate   today = LocalDate.now();

    return of(today.getMonthValue(), today.getDayOfMonth());
  }

  public static MonthDay of(Month month, int dayOfMonth)
  {
    Objects.requireNonNull(month, "month");
    DAY_OF_MONTH.checkValidValue(dayOfMonth);

    if (dayOfMonth > month.maxLength())
      throw new DateTimeException("Illegal value for DayOfMonth field, value " + dayOfMonth +
                                  " is not valid for month " + month.name());

    return new MonthDay(month.getValue(), dayOfMonth);
  }

  public static MonthDay of(int month, int dayOfMonth)
  {
    return of(Month.of(month), dayOfMonth);
  }

  public static MonthDay from(TemporalAccessor temporal)
  {
    Objects.requireNonNull(temporal, "temporal");

    if (temporal instanceof MonthDay)
      return (MonthDay) temporal;

    try {
      return of(temporal.get(MONTH_OF_YEAR), temporal.get(DAY_OF_MONTH));
    }
    catch (DateTimeException e) {
      throw new DateTimeException("Unable to obtain MonthDay from TemporalAccessor: " + temporal +
                                  " of type " + temporal.getClass().getName(), e);
    }
  }

  public static MonthDay parse(CharSequence text)
  {
    return parse(text, PARSER);
  }

  public static MonthDay parse(CharSequence text, DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.parse(text, MonthDay::from);
  }

  public static DateTimeResult<MonthDay> tryParse(CharSequence text)
  {
    return DateTimeResult.of(() -> parse(text));
  }

  public int getMonthValue()
  {
    return month;
  }

  public Month getMonth()
  {
    return Month.of(month);
  }

  public int getDayOfMonth()
  {
    return day;
  }

  public boolean isValidYear(int year)
  {
    return !(day == 29 && month == 2 && !Year.isLeap(year));
  }

  @Override
  public boolean isSupported(ChronoField field)
  {
    return field == MONTH_OF_YEAR || field == DAY_OF_MONTH;
  }

  @Override
  public ValueRange range(ChronoField field)
  {
    if (field == DAY_OF_MONTH)
      return ValueRange.of(1, getMonth().minLength(), getMonth().maxLength());

    return TemporalAccessor.super.range(field);
  }

  @Override
  public long getLong(ChronoField field)
  {
    switch (Objects.requireNonNull(field, "field")) {
      case DAY_OF_MONTH:  return day;
      case MONTH_OF_YEAR: return month;
      default:
        throw UnsupportedTemporalTypeException.forField(field);
    }
  }

  public MonthDay withMonth(int month)
  {
    return with(Month.of(month));
  }

  public MonthDay with(Month month)
  {
    Objects.requireNonNull(month, "month");

    if (month.getValue() == this.month)
      return this;

    return new MonthDay(month.getValue(), Math.min(day, month.maxLength()));
  }

  public MonthDay withDayOfMonth(int dayOfMonth)
  {
    return dayOfMonth == day ? this : of(month, dayOfMonth);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <R> R query(TemporalQuery<R> query)
  {
    if (query == TemporalQueries.chronology())
      return (R) IsoChronology.INSTANCE;

    return TemporalAccessor.super.query(query);
  }

  /**
   * Sets the month and then the day, reducing the day to the last valid day of the target
   * month where it does not exist.
   */
  @Override
  public Temporal adjustInto(Temporal temporal)
  {
    temporal = temporal.with(MONTH_OF_YEAR, month);

    return temporal.with(DAY_OF_MONTH, Math.min(temporal.range(DAY_OF_MONTH).getMaximum(), day));
  }

  public LocalDate atYear(int year)
  {
    return LocalDate.of(year, month, isValidYear(year) ? day : 28);
  }

  public String format(DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.format(this);
  }

  @Override
  public int compareTo(MonthDay other)
  {
    int   cmp = month - other.month;

    if (cmp == 0)
      cmp = day - other.day;

    return cmp;
  }

  public boolean isAfter(MonthDay other)
  {
    return compareTo(other) > 0;
  }

  public boolean isBefore(MonthDay other)
  {
    return compareTo(other) < 0;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (obj instanceof MonthDay) {
      MonthDay  other = (MonthDay) obj;

      return month == other.month && day == other.day;
    }

    return false;
  }

  @Override
  public int hashCode()
  {
    return (month << 6) + day;
  }

  @Override
  public String toString()
  {
    return new StringBuilder(7)
      .append(month < 10 ? "--0" : "--").append(month)
      .append(day < 10 ? "-0" : "-").append(day)
      .toString();
  }
}
