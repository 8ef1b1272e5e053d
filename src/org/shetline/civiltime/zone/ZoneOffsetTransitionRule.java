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

package org.shetline.civiltime.zone;

import java.util.Objects;

import org.shetline.civiltime.DayOfWeek;
import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.LocalTime;
import org.shetline.civiltime.Month;
import org.shetline.civiltime.ZoneOffset;
import org.shetline.civiltime.chrono.IsoChronology;

import static org.shetline.civiltime.temporal.TemporalAdjusters.nextOrSame;
import static org.shetline.civiltime.temporal.TemporalAdjusters.previousOrSame;


/**
 * A recurring yearly transition, such as "the last Sunday in March at 01:00 UTC", from which the
 * actual transition for any year can be created.
 * <p>
 * The day is given by a month, a day-of-month indicator and an optional day-of-week:
 * <ul>
 *   <li>with no day-of-week, the indicator is the day itself, negative values counting back from
 *       the end of the month (-1 is the last day);</li>
 *   <li>with a positive indicator, the day is the first matching day-of-week on or after it;</li>
 *   <li>with a negative indicator, the day is the last matching day-of-week on or before it.</li>
 * </ul>
 */
public final class ZoneOffsetTransitionRule
{
  public enum TimeDefinition
  {
    UTC,
    WALL,
    STANDARD;

    /**
     * Converts a date-time in this definition to a wall-clock date-time, given the standard offset
     * and the wall offset in force before the transition.
     */
    public LocalDateTime createDateTime(LocalDateTime dateTime, ZoneOffset standardOffset, ZoneOffset wallOffset)
    {
      switch (this) {
        case UTC:
          return dateTime.plusSeconds(wallOffset.getTotalSeconds() - ZoneOffset.UTC.getTotalSeconds());
        case STANDARD:
          return dateTime.plusSeconds(wallOffset.getTotalSeconds() - standardOffset.getTotalSeconds());
        default:
          return dateTime;
      }
    }
  }

  private final Month           month;
  private final byte            dom;
  private final DayOfWeek       dow;
  private final LocalTime       time;
  private final boolean         timeEndOfDay;
  private final TimeDefinition  timeDefinition;
  private final ZoneOffset      standardOffset;
  private final ZoneOffset      offsetBefore;
  private final ZoneOffset      offsetAfter;

  ZoneOffsetTransitionRule(Month month, int dayOfMonthIndicator, DayOfWeek dayOfWeek, LocalTime time,
                           boolean timeEndOfDay, TimeDefinition timeDefinition, ZoneOffset standardOffset,
                           ZoneOffset offsetBefore, ZoneOffset offsetAfter)
  {
    this.month = month;
    dom = (byte) dayOfMonthIndicator;
    dow = dayOfWeek;
    this.time = time;
    this.timeEndOfDay = timeEndOfDay;
    this.timeDefinition = timeDefinition;
    this.standardOffset = standardOffset;
    this.offsetBefore = offsetBefore;
    this.offsetAfter = offsetAfter;
  }

  /**
   * @param dayOfMonthIndicator from -28 to 31, excluding 0
   * @param dayOfWeek           null for a fixed day-of-month
   * @param timeEndOfDay        true for a transition at 24:00, in which case the time must be
   *                            midnight
   */
  public static ZoneOffsetTransitionRule of(Month month, int dayOfMonthIndicator, DayOfWeek dayOfWeek, LocalTime time,
                                            boolean timeEndOfDay, TimeDefinition timeDefinition,
                                            ZoneOffset standardOffset, ZoneOffset offsetBefore, ZoneOffset offsetAfter)
  {
    Objects.requireNonNull(month, "month");
    Objects.requireNonNull(time, "time");
    Objects.requireNonNull(timeDefinition, "timeDefinition");
    Objects.requireNonNull(standardOffset, "standardOffset");
    Objects.requireNonNull(offsetBefore, "offsetBefore");
    Objects.requireNonNull(offsetAfter, "offsetAfter");

    if (dayOfMonthIndicator < -28 || dayOfMonthIndicator > 31 || dayOfMonthIndicator == 0)
      throw new IllegalArgumentException("Day of month indicator must be between -28 and 31 inclusive excluding zero");
    else if (timeEndOfDay && !time.equals(LocalTime.MIDNIGHT))
      throw new IllegalArgumentException("Time must be midnight when end of day flag is true");
    else if (time.getNano() != 0)
      throw new IllegalArgumentException("Time's nano-of-second must be zero");

    return new ZoneOffsetTransitionRule(month, dayOfMonthIndicator, dayOfWeek, time, timeEndOfDay, timeDefinition,
                                        standardOffset, offsetBefore, offsetAfter);
  }

  public Month getMonth()
  {
    return month;
  }

  public int getDayOfMonthIndicator()
  {
    return dom;
  }

  public DayOfWeek getDayOfWeek()
  {
    return dow;
  }

  public LocalTime getLocalTime()
  {
    return time;
  }

  public boolean isMidnightEndOfDay()
  {
    return timeEndOfDay;
  }

  public TimeDefinition getTimeDefinition()
  {
    return timeDefinition;
  }

  public ZoneOffset getStandardOffset()
  {
    return standardOffset;
  }

  public ZoneOffset getOffsetBefore()
  {
    return offsetBefore;
  }

  public ZoneOffset getOffsetAfter()
  {
    return offsetAfter;
  }

  public ZoneOffsetTransition createTransition(int year)
  {
    LocalDate   date;

    if (dom < 0) {
      date = LocalDate.of(year, month, month.length(IsoChronology.INSTANCE.isLeapYear(year)) + 1 + dom);

      if (dow != null)
        date = date.with(previousOrSame(dow));
    }
    else {
      date = LocalDate.of(year, month, dom);

      if (dow != null)
        date = date.with(nextOrSame(dow));
    }

    if (timeEndOfDay)
      date = date.plusDays(1);

    LocalDateTime   localDT = LocalDateTime.of(date, time);
    LocalDateTime   transition = timeDefinition.createDateTime(localDT, standardOffset, offsetBefore);

    return new ZoneOffsetTransition(transition, offsetBefore, offsetAfter);
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (!(obj instanceof ZoneOffsetTransitionRule))
      return false;

    ZoneOffsetTransitionRule  other = (ZoneOffsetTransitionRule) obj;

    return month == other.month && dom == other.dom && dow == other.dow &&
           timeDefinition == other.timeDefinition && timeEndOfDay == other.timeEndOfDay &&
           time.equals(other.time) && standardOffset.equals(other.standardOffset) &&
           offsetBefore.equals(other.offsetBefore) && offsetAfter.equals(other.offsetAfter);
  }

  @Override
  public int hashCode()
  {
    int   hash = ((time.toSecondOfDay() + (timeEndOfDay ? 1 : 0)) << 15) + (month.ordinal() << 11) + ((dom + 32) << 5) +
                 ((dow == null ? 7 : dow.ordinal()) << 2) + timeDefinition.ordinal();

    return hash ^ standardOffset.hashCode() ^ offsetBefore.hashCode() ^ offsetAfter.hashCode();
  }

  @Override
  public String toString()
  {
    StringBuilder   buf = new StringBuilder();

    buf.append("TransitionRule[")
       .append(offsetAfter.getTotalSeconds() > offsetBefore.getTotalSeconds() ? "Gap " : "Overlap ")
       .append(offsetBefore).append(" to ").append(offsetAfter).append(", ");

    if (dow != null) {
      if (dom == -1)
        buf.append(dow.name()).append(" on or before last day of ").append(month.name());
      else if (dom < 0)
        buf.append(dow.name()).append(" on or before last day minus ").append(-dom - 1).append(" of ").append(month.name());
      else
        buf.append(dow.name()).append(" on or after ").append(month.name()).append(' ').append(dom);
    }
    else
      buf.append(month.name()).append(' ').append(dom);

    buf.append(" at ").append(timeEndOfDay ? "24:00" : time.toString())
       .append(' ').append(timeDefinition)
       .append(", standard offset ").append(standardOffset)
       .append(']');

    return buf.toString();
  }
}
