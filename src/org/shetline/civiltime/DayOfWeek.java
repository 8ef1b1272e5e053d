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

import org.shetline.civiltime.temporal.*;

import static org.shetline.civiltime.temporal.ChronoField.DAY_OF_WEEK;


public enum DayOfWeek implements TemporalAccessor, TemporalAdjuster
{
  MONDAY, TUESDAY, WEDNESDAY, THURSDAY, FRIDAY, SATURDAY, SUNDAY;

  private static final DayOfWeek[] ENUMS = values();

  public static DayOfWeek of(int dayOfWeek)
  {
    if (dayOfWeek < 1 || dayOfWeek > 7)
      throw new DateTimeException("Invalid value for DayOfWeek: " + dayOfWeek);

    return ENUMS[dayOfWeek - 1];
  }

  public static DayOfWeek from(TemporalAccessor temporal)
  {
    if (temporal instanceof DayOfWeek)
      return (DayOfWeek) temporal;

    try {
      return of(temporal.get(DAY_OF_WEEK));
    }
    catch (DateTimeException e) {
      throw new DateTimeException("Unable to obtain DayOfWeek from TemporalAccessor: " + temporal, e);
    }
  }

  public int getValue()
  {
    return ordinal() + 1;
  }

  public DayOfWeek plus(long days)
  {
    int   amount = (int) (days % 7);

    return ENUMS[(ordinal() + (amount + 7)) % 7];
  }

  public DayOfWeek minus(long days)
  {
    return plus(-(days % 7));
  }

  public String getShortName()
  {
    return name().charAt(0) + name().substring(1, 3).toLowerCase();
  }

  @Override
  public boolean isSupported(ChronoField field)
  {
    return field == DAY_OF_WEEK;
  }

  @Override
  public long getLong(ChronoField field)
  {
    if (field == DAY_OF_WEEK)
      return getValue();

    throw UnsupportedTemporalTypeException.forField(field);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <R> R query(TemporalQuery<R> query)
  {
    if (query == TemporalQueries.precision())
      return (R) ChronoUnit.DAYS;

    return TemporalAccessor.super.query(query);
  }

  @Override
  public Temporal adjustInto(Temporal temporal)
  {
    return temporal.with(DAY_OF_WEEK, getValue());
  }
}
