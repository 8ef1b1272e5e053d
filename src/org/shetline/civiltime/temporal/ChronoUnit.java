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

import org.shetline.civiltime.Duration;


/**
 * Units of time, from nanoseconds up to eras. Units of a day or more are date-based and their
 * durations are estimates.
 */
public enum ChronoUnit
{
  NANOS("Nanos", 0, 1),
  MICROS("Micros", 0, 1000),
  MILLIS("Millis", 0, 1000000),
  SECONDS("Seconds", 1, 0),
  MINUTES("Minutes", 60, 0),
  HOURS("Hours", 3600, 0),
  HALF_DAYS("HalfDays", 43200, 0),
  DAYS("Days", 86400, 0),
  WEEKS("Weeks", 7 * 86400L, 0),
  MONTHS("Months", 31556952L / 12, 0),
  YEARS("Years", 31556952L, 0),
  DECADES("Decades", 31556952L * 10L, 0),
  CENTURIES("Centuries", 31556952L * 100L, 0),
  MILLENNIA("Millennia", 31556952L * 1000L, 0),
  ERAS("Eras", 31556952L * 1000000000L, 0),
  FOREVER("Forever", Long.MAX_VALUE, 999999999);

  private final String  name;
  private final long    seconds;
  private final int     nanos;

  ChronoUnit(String name, long seconds, int nanos)
  {
    this.name = name;
    this.seconds = seconds;
    this.nanos = nanos;
  }

  public Duration getDuration()
  {
    return Duration.ofSeconds(seconds, nanos);
  }

  public boolean isDurationEstimated()
  {
    return compareTo(DAYS) >= 0;
  }

  public boolean isDateBased()
  {
    return compareTo(DAYS) >= 0 && this != FOREVER;
  }

  public boolean isTimeBased()
  {
    return compareTo(DAYS) < 0;
  }

  @Override
  public String toString()
  {
    return name;
  }
}
