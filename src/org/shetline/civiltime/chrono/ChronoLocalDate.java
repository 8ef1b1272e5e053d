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

import java.util.Objects;

import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.format.DateTimeFormatter;
import org.shetline.civiltime.temporal.*;

import static org.shetline.civiltime.temporal.ChronoField.*;


/**
 * A date in some calendar system. Every implementation maps onto the same epoch-day axis, so dates
 * of different chronologies compare by their position on the time-line first.
 */
public interface ChronoLocalDate extends Temporal, TemporalAdjuster, Comparable<ChronoLocalDate>
{
  Chronology getChronology();

  default Era getEra()
  {
    return getChronology().eraOf(get(ERA));
  }

  default boolean isLeapYear()
  {
    return getChronology().isLeapYear(getLong(YEAR));
  }

  int lengthOfMonth();

  default int lengthOfYear()
  {
    return isLeapYear() ? 366 : 365;
  }

  default long toEpochDay()
  {
    return getLong(EPOCH_DAY);
  }

  @Override
  default boolean isSupported(ChronoField field)
  {
    return field != null && field.isDateBased();
  }

  @Override
  default boolean isSupported(ChronoUnit unit)
  {
    return unit != null && unit.isDateBased();
  }

  @Override
  default ChronoLocalDate with(TemporalAdjuster adjuster)
  {
    return (ChronoLocalDate) adjuster.adjustInto(this);
  }

  @Override
  ChronoLocalDate with(ChronoField field, long newValue);

  @Override
  ChronoLocalDate plus(long amountToAdd, ChronoUnit unit);

  @Override
  default ChronoLocalDate minus(long amountToSubtract, ChronoUnit unit)
  {
    return (ChronoLocalDate) Temporal.super.minus(amountToSubtract, unit);
  }

  @Override
  @SuppressWarnings("unchecked")
  default <R> R query(TemporalQuery<R> query)
  {
    if (query == TemporalQueries.chronology())
      return (R) getChronology();
    else if (query == TemporalQueries.precision())
      return (R) ChronoUnit.DAYS;
    else if (query == TemporalQueries.localDate())
      return (R) LocalDate.ofEpochDay(toEpochDay());
    else if (query == TemporalQueries.zoneId() || query == TemporalQueries.zone() ||
             query == TemporalQueries.offset() || query == TemporalQueries.localTime())
      return null;

    return query.queryFrom(this);
  }

  @Override
  default Temporal adjustInto(Temporal temporal)
  {
    return temporal.with(EPOCH_DAY, toEpochDay());
  }

  default String format(DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.format(this);
  }

  @Override
  default int compareTo(ChronoLocalDate other)
  {
    int   cmp = Long.compare(toEpochDay(), other.toEpochDay());

    if (cmp == 0)
      cmp = getChronology().compareTo(other.getChronology());

    return cmp;
  }

  default boolean isAfter(ChronoLocalDate other)
  {
    return toEpochDay() > other.toEpochDay();
  }

  default boolean isBefore(ChronoLocalDate other)
  {
    return toEpochDay() < other.toEpochDay();
  }

  default boolean isEqual(ChronoLocalDate other)
  {
    return toEpochDay() == other.toEpochDay();
  }
}
