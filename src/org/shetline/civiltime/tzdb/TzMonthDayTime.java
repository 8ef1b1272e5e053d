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

package org.shetline.civiltime.tzdb;

import org.shetline.civiltime.DayOfWeek;
import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.LocalTime;
import org.shetline.civiltime.Month;
import org.shetline.civiltime.chrono.IsoChronology;
import org.shetline.civiltime.zone.ZoneOffsetTransitionRule.TimeDefinition;

import static org.shetline.civiltime.temporal.TemporalAdjusters.nextOrSame;
import static org.shetline.civiltime.temporal.TemporalAdjusters.previousOrSame;
import static org.shetline.civiltime.tzdb.TzUtil.*;


/**
 * The month, day and time columns shared by Rule lines (IN, ON, AT) and the UNTIL column of Zone
 * lines.
 */
public class TzMonthDayTime
{
  private static final int  SECONDS_PER_DAY = 86400;

  protected Month           month = Month.JANUARY;
  protected int             dayOfMonth = 1;
  protected DayOfWeek       dayOfWeek;
  protected boolean         adjustForwards = true;
  protected LocalTime       time = LocalTime.MIDNIGHT;
  protected boolean         endOfDay;
  protected TimeDefinition  timeDefinition = TimeDefinition.WALL;

  /**
   * Reads month, day rule and time from {@code parts}, starting at {@code start}. Trailing
   * columns may be omitted.
   */
  protected void parseMonthDayTime(String[] parts, int start, boolean roundToMinutes)
  {
    if (parts.length <= start)
      return;

    month = parseMonth(parts[start]);

    if (parts.length > start + 1) {
      String  dayRule = parts[start + 1];
      int     pos;

      if (dayRule.startsWith("last")) {
        dayOfMonth = -1;
        dayOfWeek = parseDayOfWeek(dayRule.substring(4));
        adjustForwards = false;
      }
      else if ((pos = dayRule.indexOf(">=")) > 0) {
        dayOfWeek = parseDayOfWeek(dayRule.substring(0, pos));
        dayOfMonth = Integer.parseInt(dayRule.substring(pos + 2));
      }
      else if ((pos = dayRule.indexOf("<=")) > 0) {
        dayOfWeek = parseDayOfWeek(dayRule.substring(0, pos));
        dayOfMonth = Integer.parseInt(dayRule.substring(pos + 2));
        adjustForwards = false;
      }
      else
        dayOfMonth = Integer.parseInt(dayRule);

      if (parts.length > start + 2)
        parseTime(parts[start + 2], roundToMinutes);
    }
  }

  private void parseTime(String s, boolean roundToMinutes)
  {
    char  last = s.charAt(s.length() - 1);

    if (Character.isLetter(last)) {
      timeDefinition = parseTimeDefinition(last);
      s = s.substring(0, s.length() - 1);
    }

    int   secs = parseSeconds(s, roundToMinutes);

    if (secs < 0)
      throw new IllegalArgumentException("Negative time of day: " + s);
    else if (secs == SECONDS_PER_DAY) {
      endOfDay = true;
      secs = 0;
    }
    else if (secs > SECONDS_PER_DAY) {
      // Times such as 25:00 move the transition into the following day.
      int   days = secs / SECONDS_PER_DAY;

      if (dayOfMonth == -1)
        throw new IllegalArgumentException("Time beyond 24:00 cannot follow a last-day-of-week rule: " + s);

      secs %= SECONDS_PER_DAY;
      dayOfMonth += days;

      if (dayOfWeek != null)
        dayOfWeek = dayOfWeek.plus(days);
    }

    time = LocalTime.ofSecondOfDay(secs);
  }

  /**
   * Rewrites an on-or-before day rule as the equivalent on-or-after rule, using the given year to
   * decide month lengths.
   */
  protected void adjustToForwards(int year)
  {
    if (!adjustForwards && dayOfMonth > 0) {
      LocalDate   adjustedDate = LocalDate.of(year, month, dayOfMonth).minusDays(6);

      dayOfMonth = adjustedDate.getDayOfMonth();
      month = adjustedDate.getMonth();
      adjustForwards = true;
    }
  }

  public LocalDateTime toDateTime(int year)
  {
    adjustToForwards(year);

    LocalDate   date;

    if (dayOfMonth == -1) {
      date = LocalDate.of(year, month, month.length(IsoChronology.INSTANCE.isLeapYear(year)));

      if (dayOfWeek != null)
        date = date.with(previousOrSame(dayOfWeek));
    }
    else {
      date = LocalDate.of(year, month, dayOfMonth);

      if (dayOfWeek != null)
        date = date.with(nextOrSame(dayOfWeek));
    }

    LocalDateTime   ldt = LocalDateTime.of(date, time);

    if (endOfDay)
      ldt = ldt.plusDays(1);

    return ldt;
  }

  public Month getMonth()
  {
    return month;
  }

  public int getDayOfMonth()
  {
    return dayOfMonth;
  }

  public DayOfWeek getDayOfWeek()
  {
    return dayOfWeek;
  }

  public LocalTime getTime()
  {
    return time;
  }

  public boolean isEndOfDay()
  {
    return endOfDay;
  }

  public TimeDefinition getTimeDefinition()
  {
    return timeDefinition;
  }

  protected String formatMonthDayTime()
  {
    String  day;

    if (dayOfWeek == null)
      day = Integer.toString(dayOfMonth);
    else if (dayOfMonth == -1)
      day = "last" + DAYS.substring(dayOfWeek.ordinal() * 3, dayOfWeek.ordinal() * 3 + 3);
    else
      day = DAYS.substring(dayOfWeek.ordinal() * 3, dayOfWeek.ordinal() * 3 + 3) + (adjustForwards ? ">=" : "<=") + dayOfMonth;

    return MONTHS.substring(month.ordinal() * 3, month.ordinal() * 3 + 3) + " " + day + " " +
           (endOfDay ? "24:00" : time.toString()) + Character.toLowerCase(timeDefinition.name().charAt(0));
  }
}
