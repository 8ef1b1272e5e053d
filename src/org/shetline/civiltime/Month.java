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

import org.shetline.civiltime.chrono.IsoChronology;
import org.shetline.civiltime.temporal.*;

import static org.shetline.civiltime.temporal.ChronoField.MONTH_OF_YEAR;


public enum Month implements TemporalAccessor, TemporalAdjuster
{
  JANUARY, FEBRUARY, MARCH, APRIL, MAY, JUNE, JULY, AUGUST, SEPTEMBER, OCTOBER, NOVEMBER, DECEMBER;

  private static final Month[] ENUMS = values();

  public static Month of(int month)
  {
    if (month < 1 || month > 12)
      throw new DateTimeException("Invalid value for MonthOfYear: " + month);

    return ENUMS[month - 1];
  }

  public static Month from(TemporalAccessor temporal)
  {
    if (temporal instanceof Month)
      return (Month) temporal;

    try {
      return of(temporal.get(MONTH_OF_YEAR));
    }
    catch (DateTimeException e) {
      throw new DateTimeException("Unable to obtain Month from TemporalAccessor: " + temporal, e);
    }
  }

  public int getValue()
  {
    return ordinal() + 1;
  }

  public Month plus(long months)
  {
    int   amount = (int) (months % 12);

    return ENUMS[(ordinal() + (amount + 12)) % 12];
  }

  public Month minus(long months)
  {
    return plus(-(months % 12));
  }

  public int length(boolean leapYear)
  {
    switch (this) {
      case FEBRUARY:
        return leapYear ? 29 : 28;
      case APRIL:
      case JUNE:
      case SEPTEMBER:
      case NOVEMBER:
        return 30;
      default:
        return 31;
    }
  }

  public int minLength()
  {
    return this == FEBRUARY ? 28 : length(false);
  }

  public int maxLength()
  {
    return this == FEBRUARY ? 29 : length(false);
  }

  public int firstDayOfYear(boolean leapYear)
  {
    int   leap = leapYear ? 1 : 0;

    switch (this) {
      case JANUARY:   return 1;
      case FEBRUARY:  return 32;
      case MARCH:     return 60 + leap;
      case APRIL:     return 91 + leap;
      case MAY:       return 121 + leap;
      case JUNE:      return 152 + leap;
      case JULY:      return 182 + leap;
      case AUGUST:    return 213 + leap;
      case SEPTEMBER: return 244 + leap;
      case OCTOBER:   return 274 + leap;
      case NOVEMBER:  return 305 + leap;
      default:        return 335 + leap;
    }
  }

  public String getShortName()
  {
    return name().charAt(0) + name().substring(1, 3).toLowerCase();
  }

  @Override
  public boolean isSupported(ChronoField field)
  {
    return field == MONTH_OF_YEAR;
  }

  @Override
  public ValueRange range(ChronoField field)
  {
    if (field == MONTH_OF_YEAR)
      return field.range();

    return TemporalAccessor.super.range(field);
  }

  @Override
  public long getLong(ChronoField field)
  {
    if (field == MONTH_OF_YEAR)
      return getValue();

    throw UnsupportedTemporalTypeException.forField(field);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <R> R query(TemporalQuery<R> query)
  {
    if (query == TemporalQueries.chronology())
      return (R) IsoChronology.INSTANCE;
    else if (query == TemporalQueries.precision())
      return (R) ChronoUnit.MONTHS;

    return TemporalAccessor.super.query(query);
  }

  @Override
  public Temporal adjustInto(Temporal temporal)
  {
    return temporal.with(MONTH_OF_YEAR, getValue());
  }
}
