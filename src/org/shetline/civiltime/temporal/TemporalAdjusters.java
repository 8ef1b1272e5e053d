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

package org.shetline.civiltime.temporal;

import java.util.Objects;

import org.shetline.civiltime.DayOfWeek;

import static org.shetline.civiltime.temporal.ChronoField.*;
import static org.shetline.civiltime.temporal.ChronoUnit.*;


/**
 * Common date adjusters. They work through fields and units only, so they apply equally to ISO
 * dates and to dates of the other chronologies.
 */
public final class TemporalAdjusters
{
  private TemporalAdjusters() {}

  public static TemporalAdjuster firstDayOfMonth()
  {
    return temporal -> temporal.with(DAY_OF_MONTH, 1);
  }

  public static TemporalAdjuster lastDayOfMonth()
  {
    return temporal -> temporal.with(DAY_OF_MONTH, temporal.range(DAY_OF_MONTH).getMaximum());
  }

  public static TemporalAdjuster firstDayOfNextMonth()
  {
    return temporal -> temporal.with(DAY_OF_MONTH, 1).plus(1, MONTHS);
  }

  public static TemporalAdjuster firstDayOfYear()
  {
    return temporal -> temporal.with(DAY_OF_YEAR, 1);
  }

  public static TemporalAdjuster lastDayOfYear()
  {
    return temporal -> temporal.with(DAY_OF_YEAR, temporal.range(DAY_OF_YEAR).getMaximum());
  }

  public static TemporalAdjuster firstDayOfNextYear()
  {
    return temporal -> temporal.with(DAY_OF_YEAR, 1).plus(1, YEARS);
  }

  public static TemporalAdjuster firstInMonth(DayOfWeek dayOfWeek)
  {
    return dayOfWeekInMonth(1, dayOfWeek);
  }

  public static TemporalAdjuster lastInMonth(DayOfWeek dayOfWeek)
  {
    return dayOfWeekInMonth(-1, dayOfWeek);
  }

  /**
   * The given occurrence of a day-of-week within the month. Positive ordinals count from the
   * start of the month, negative ones from the end, and zero means the last occurrence in the
   * previous month.
   */
  public static TemporalAdjuster dayOfWeekInMonth(int ordinal, DayOfWeek dayOfWeek)
  {
    Objects.requireNonNull(dayOfWeek, "dayOfWeek");

    int   dowValue = dayOfWeek.getValue();

    if (ordinal >= 0) {
      return temporal ->
      {
        Temporal  temp = temporal.with(DAY_OF_MONTH, 1);
        int       curDow = temp.get(DAY_OF_WEEK);
        int       dowDiff = (dowValue - curDow + 7) % 7;

        dowDiff += (ordinal - 1L) * 7L;

        return temp.plus(dowDiff, DAYS);
      };
    }
    else {
      return temporal ->
      {
        Temporal  temp = temporal.with(DAY_OF_MONTH, temporal.range(DAY_OF_MONTH).getMaximum());
        int       curDow = temp.get(DAY_OF_WEEK);
        int       daysDiff = dowValue - curDow;

        daysDiff = (daysDiff == 0 ? 0 : (daysDiff > 0 ? daysDiff - 7 : daysDiff));
        daysDiff -= (-ordinal - 1L) * 7L;

        return temp.plus(daysDiff, DAYS);
      };
    }
  }

  public static TemporalAdjuster next(DayOfWeek dayOfWeek)
  {
    return relative(dayOfWeek, false, true);
  }

  public static TemporalAdjuster nextOrSame(DayOfWeek dayOfWeek)
  {
    return relative(dayOfWeek, true, true);
  }

  public static TemporalAdjuster previous(DayOfWeek dayOfWeek)
  {
    return relative(dayOfWeek, false, false);
  }

  public static TemporalAdjuster previousOrSame(DayOfWeek dayOfWeek)
  {
    return relative(dayOfWeek, true, false);
  }

  private static TemporalAdjuster relative(DayOfWeek dayOfWeek, boolean orSame, boolean forward)
  {
    Objects.requireNonNull(dayOfWeek, "dayOfWeek");

    int   dowValue = dayOfWeek.getValue();

    return temporal ->
    {
      int   calDow = temporal.get(DAY_OF_WEEK);

      if (orSame && calDow == dowValue)
        return temporal;

      if (forward) {
        int   daysDiff = calDow - dowValue;

        return temporal.plus(daysDiff >= 0 ? 7 - daysDiff : -daysDiff, DAYS);
      }
      else {
        int   daysDiff = dowValue - calDow;

        return temporal.minus(daysDiff >= 0 ? 7 - daysDiff : -daysDiff, DAYS);
      }
    };
  }
}
