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

import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.ZoneOffset;

import static org.shetline.civiltime.tzdb.TzUtil.*;


/**
 * One row of a transition table: from {@link #getTime()} on, the UTC offset and daylight savings
 * that apply.
 */
public class TzTransition
{
  public static final long  BEGINNING_OF_TIME = Long.MIN_VALUE;

  protected long  time; // in seconds from epoch
  protected int   utcOffset; // seconds, positive eastward from UTC
  protected int   dstOffset; // seconds

  public TzTransition(long time, int utcOffset, int dstOffset)
  {
    this.time = time;
    this.utcOffset = utcOffset;
    this.dstOffset = dstOffset;
  }

  public long getTime()
  {
    return time;
  }

  public int getUtcOffset()
  {
    return utcOffset;
  }

  public int getDstOffset()
  {
    return dstOffset;
  }

  public String formatTime()
  {
    LocalDateTime   ldt = LocalDateTime.ofEpochSecond(time, 0, ZoneOffset.ofTotalSeconds(utcOffset));

    return dateTimeFormat.format(ldt);
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o)
      return true;
    else if (!(o instanceof TzTransition))
      return false;

    TzTransition  other = (TzTransition) o;

    return time == other.time && utcOffset == other.utcOffset && dstOffset == other.dstOffset;
  }

  @Override
  public int hashCode()
  {
    return Long.hashCode(time) * 31 * 31 + utcOffset * 31 + dstOffset;
  }

  @Override
  public String toString()
  {
    String  s;

    if (time == BEGINNING_OF_TIME)
      s = "---";
    else
      s = formatTime();

    return s + ", " + formatOffsetNotation(utcOffset) + ", " + formatOffsetNotation(dstOffset);
  }
}
