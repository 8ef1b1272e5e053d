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

import org.shetline.civiltime.DateTimeException;
import org.shetline.civiltime.DayOfWeek;
import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.Month;

import static org.shetline.civiltime.temporal.ChronoField.*;


/**
 * Quarters and ISO-8601 week-based years for anything that carries an epoch day. Week 1 of a
 * week-based year is the Monday-to-Sunday week containing January 4th, so the week-based year
 * can differ from the calendar year for a few days around New Year.
 */
public final class IsoFields
{
  private IsoFields() {}

  private static final TemporalQuery<Integer> QUARTER_OF_YEAR = temporal ->
    (toDate(temporal, "QuarterOfYear").getMonthValue() - 1) / 3 + 1;

  private static final TemporalQuery<Integer> DAY_OF_QUARTER = temporal ->
  {
    LocalDate   date = toDate(temporal, "DayOfQuarter");
    int         firstMonth = (date.getMonthValue() - 1) / 3 * 3 + 1;

    return date.getDayOfYear() - Month.of(firstMonth).firstDayOfYear(date.isLeapYear()) + 1;
  };

  private static final TemporalQuery<Integer> WEEK_OF_WEEK_BASED_YEAR = temporal ->
    (thursdayOfWeek(toDate(temporal, "WeekOfWeekBasedYear")).getDayOfYear() - 1) / 7 + 1;

  private static final TemporalQuery<Integer> WEEK_BASED_YEAR = temporal ->
    thursdayOfWeek(toDate(temporal, "WeekBasedYear")).getYear();

  public static TemporalQuery<Integer> quarterOfYear()
  {
    return QUARTER_OF_YEAR;
  }

  public static TemporalQuery<Integer> dayOfQuarter()
  {
    return DAY_OF_QUARTER;
  }

  public static TemporalQuery<Integer> weekOfWeekBasedYear()
  {
    return WEEK_OF_WEEK_BASED_YEAR;
  }

  public static TemporalQuery<Integer> weekBasedYear()
  {
    return WEEK_BASED_YEAR;
  }

  /**
   * 53 when the year starts on a Thursday, or on a Wednesday in a leap year; otherwise 52.
   */
  public static int weeksInWeekBasedYear(int weekBasedYear)
  {
    LocalDate   newYearsDay = LocalDate.of(weekBasedYear, 1, 1);
    DayOfWeek   dow = newYearsDay.getDayOfWeek();

    return (dow == DayOfWeek.THURSDAY || (dow == DayOfWeek.WEDNESDAY && newYearsDay.isLeapYear()) ? 53 : 52);
  }

  public static TemporalAdjuster weekOfWeekBasedYear(int week)
  {
    return temporal ->
    {
      LocalDate   date = toDate(temporal, "WeekOfWeekBasedYear");
      int         year = thursdayOfWeek(date).getYear();

      checkWeek(year, week);

      return temporal.with(EPOCH_DAY, date.plusWeeks(week - (long) WEEK_OF_WEEK_BASED_YEAR.queryFrom(date)).toEpochDay());
    };
  }

  /**
   * Moves to the same week and day-of-week in another week-based year. Week 53 becomes week 52
   * when the target year is short.
   */
  public static TemporalAdjuster weekBasedYear(int weekBasedYear)
  {
    return temporal ->
    {
      LocalDate   date = toDate(temporal, "WeekBasedYear");
      int         week = Math.min(WEEK_OF_WEEK_BASED_YEAR.queryFrom(date), weeksInWeekBasedYear(weekBasedYear));
      LocalDate   target = mondayOfWeekOne(weekBasedYear).plusWeeks(week - 1).plusDays(date.getDayOfWeek().getValue() - 1);

      return temporal.with(EPOCH_DAY, target.toEpochDay());
    };
  }

  public static LocalDate ofWeekBasedYear(int weekBasedYear, int week, DayOfWeek dayOfWeek)
  {
    checkWeek(weekBasedYear, week);

    return mondayOfWeekOne(weekBasedYear).plusWeeks(week - 1).plusDays(dayOfWeek.getValue() - 1);
  }

  private static void checkWeek(int weekBasedYear, int week)
  {
    int   weeks = weeksInWeekBasedYear(weekBasedYear);

    if (week < 1 || week > weeks)
      throw new DateTimeException("Invalid value for WeekOfWeekBasedYear (valid values 1 - " + weeks + "): " + week);
  }

  private static LocalDate mondayOfWeekOne(int weekBasedYear)
  {
    LocalDate   jan4 = LocalDate.of(weekBasedYear, 1, 4);

    return jan4.minusDays(jan4.getDayOfWeek().getValue() - 1);
  }

  private static LocalDate thursdayOfWeek(LocalDate date)
  {
    return date.plusDays(DayOfWeek.THURSDAY.getValue() - date.getDayOfWeek().getValue());
  }

  private static LocalDate toDate(TemporalAccessor temporal, String fieldName)
  {
    if (!temporal.isSupported(EPOCH_DAY))
      throw new UnsupportedTemporalTypeException("Unsupported field: " + fieldName);

    return LocalDate.ofEpochDay(temporal.getLong(EPOCH_DAY));
  }
}
