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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.shetline.civiltime.temporal.*;
import org.shetline.civiltime.zone.ZoneRules;

import static java.lang.Math.abs;
import static org.shetline.civiltime.temporal.ChronoField.OFFSET_SECONDS;


/**
 * A fixed offset from UTC, from -18:00 to +18:00, to the second. An offset is also the simplest
 * kind of {@link ZoneId}, one whose rules never change.
 * <p>
 * Offsets order from the largest (furthest east) to the smallest, so that sorting offsets agrees
 * with sorting the same local time by instant.
 */
public final class ZoneOffset extends ZoneId implements TemporalAccessor, TemporalAdjuster, Comparable<ZoneOffset>
{
  private static final ConcurrentMap<Integer, ZoneOffset> SECONDS_CACHE = new ConcurrentHashMap<>(16, 0.75f, 4);
  private static final ConcurrentMap<String, ZoneOffset>  ID_CACHE = new ConcurrentHashMap<>(16, 0.75f, 4);

  private static final int  MAX_SECONDS = 18 * 3600;

  public static final ZoneOffset UTC = ZoneOffset.ofTotalSeconds(0);
  public static final ZoneOffset MIN = ZoneOffset.ofTotalSeconds(-MAX_SECONDS);
  public static final ZoneOffset MAX = ZoneOffset.ofTotalSeconds(MAX_SECONDS);

  private final int     totalSeconds;
  private final String  id;

  private ZoneOffset(int totalSeconds)
  {
    this.totalSeconds = totalSeconds;
    id = buildId(totalSeconds);
  }

  /**
   * Parses {@code Z}, {@code ±H}, {@code ±HH}, {@code ±HH:MM}, {@code ±HHMM},
   * {@code ±HH:MM:SS} or {@code ±HHMMSS}. Malformed text fails with
   * {@link DateTimeErrorKind#PARSE}, an out-of-range value with {@link DateTimeErrorKind#RANGE}.
   */
  public static ZoneOffset of(String offsetId)
  {
    Objects.requireNonNull(offsetId, "offsetId");

    ZoneOffset  offset = ID_CACHE.get(offsetId);

    if (offset != null)
      return offset;

    int   hours, minutes, seconds;

    switch (offsetId.length()) {
      case 2:
        offsetId = offsetId.charAt(0) + "0" + offsetId.charAt(1);
        // fall through
      case 3:
        hours = parseNumber(offsetId, 1, false);
        minutes = 0;
        seconds = 0;
        break;
      case 5:
        hours = parseNumber(offsetId, 1, false);
        minutes = parseNumber(offsetId, 3, false);
        seconds = 0;
        break;
      case 6:
        hours = parseNumber(offsetId, 1, false);
        minutes = parseNumber(offsetId, 4, true);
        seconds = 0;
        break;
      case 7:
        hours = parseNumber(offsetId, 1, false);
        minutes = parseNumber(offsetId, 3, false);
        seconds = parseNumber(offsetId, 5, false);
        break;
      case 9:
        hours = parseNumber(offsetId, 1, false);
        minutes = parseNumber(offsetId, 4, true);
        seconds = parseNumber(offsetId, 7, true);
        break;
      default:
        throw new DateTimeException(DateTimeErrorKind.PARSE, "Invalid ID for ZoneOffset, invalid format: " + offsetId);
    }

    char  first = offsetId.charAt(0);

    if (first != '+' && first != '-')
      throw new DateTimeException(DateTimeErrorKind.PARSE, "Invalid ID for ZoneOffset, plus/minus not found when expected: " + offsetId);

    if (first == '-')
      return ofHoursMinutesSeconds(-hours, -minutes, -seconds);
    else
      return ofHoursMinutesSeconds(hours, minutes, seconds);
  }

  public static DateTimeResult<ZoneOffset> tryOfOffsetId(String offsetId)
  {
    return DateTimeResult.of(() -> of(offsetId));
  }

  private static int parseNumber(CharSequence offsetId, int pos, boolean precededByColon)
  {
    if (precededByColon && offsetId.charAt(pos - 1) != ':')
      throw new DateTimeException(DateTimeErrorKind.PARSE, "Invalid ID for ZoneOffset, colon not found when expected: " + offsetId);

    char  ch1 = offsetId.charAt(pos);
    char  ch2 = offsetId.charAt(pos + 1);

    if (ch1 < '0' || ch1 > '9' || ch2 < '0' || ch2 > '9')
      throw new DateTimeException(DateTimeErrorKind.PARSE, "Invalid ID for ZoneOffset, non numeric characters found: " + offsetId);

    return (ch1 - 48) * 10 + (ch2 - 48);
  }

  public static ZoneOffset ofHours(int hours)
  {
    return ofHoursMinutesSeconds(hours, 0, 0);
  }

  public static ZoneOffset ofHoursMinutes(int hours, int minutes)
  {
    return ofHoursMinutesSeconds(hours, minutes, 0);
  }

  public static ZoneOffset ofHoursMinutesSeconds(int hours, int minutes, int seconds)
  {
    validate(hours, minutes, seconds);

    int   totalSeconds = totalSeconds(hours, minutes, seconds);

    return ofTotalSeconds(totalSeconds);
  }

  public static ZoneOffset from(TemporalAccessor temporal)
  {
    Objects.requireNonNull(temporal, "temporal");

    ZoneOffset  offset = temporal.query(TemporalQueries.offset());

    if (offset == null)
      throw new DateTimeException("Unable to obtain ZoneOffset from TemporalAccessor: " +
                                  temporal + " of type " + temporal.getClass().getName());

    return offset;
  }

  private static void validate(int hours, int minutes, int seconds)
  {
    if (hours < -18 || hours > 18)
      throw new DateTimeException("Zone offset hours not in valid range: value " + hours + " is not in the range -18 to 18");

    if (hours > 0) {
      if (minutes < 0 || seconds < 0)
        throw new DateTimeException("Zone offset minutes and seconds must be positive because hours is positive");
    }
    else if (hours < 0) {
      if (minutes > 0 || seconds > 0)
        throw new DateTimeException("Zone offset minutes and seconds must be negative because hours is negative");
    }
    else if ((minutes > 0 && seconds < 0) || (minutes < 0 && seconds > 0))
      throw new DateTimeException("Zone offset minutes and seconds must have the same sign");

    if (minutes < -59 || minutes > 59)
      throw new DateTimeException("Zone offset minutes not in valid range: value " + minutes + " is not in the range -59 to 59");

    if (seconds < -59 || seconds > 59)
      throw new DateTimeException("Zone offset seconds not in valid range: value " + seconds + " is not in the range -59 to 59");

    if (abs(hours) == 18 && (minutes | seconds) != 0)
      throw new DateTimeException("Zone offset not in valid range: -18:00 to +18:00");
  }

  private static int totalSeconds(int hours, int minutes, int seconds)
  {
    return hours * 3600 + minutes * 60 + seconds;
  }

  public static ZoneOffset ofTotalSeconds(int totalSeconds)
  {
    if (totalSeconds < -MAX_SECONDS || totalSeconds > MAX_SECONDS)
      throw new DateTimeException("Zone offset not in valid range: -18:00 to +18:00");

    if (totalSeconds % (15 * 60) == 0) {
      Integer     totalSecs = totalSeconds;
      ZoneOffset  result = SECONDS_CACHE.get(totalSecs);

      if (result == null) {
        result = new ZoneOffset(totalSeconds);
        SECONDS_CACHE.putIfAbsent(totalSecs, result);
        result = SECONDS_CACHE.get(totalSecs);
        ID_CACHE.putIfAbsent(result.getId(), result);
      }

      return result;
    }
    else
      return new ZoneOffset(totalSeconds);
  }

  private static String buildId(int totalSeconds)
  {
    if (totalSeconds == 0)
      return "Z";

    int             absTotalSeconds = abs(totalSeconds);
    StringBuilder   buf = new StringBuilder();
    int             absHours = absTotalSeconds / 3600;
    int             absMinutes = (absTotalSeconds / 60) % 60;

    buf.append(totalSeconds < 0 ? "-" : "+")
       .append(absHours < 10 ? "0" : "").append(absHours)
       .append(absMinutes < 10 ? ":0" : ":").append(absMinutes);

    int   absSeconds = absTotalSeconds % 60;

    if (absSeconds != 0)
      buf.append(absSeconds < 10 ? ":0" : ":").append(absSeconds);

    return buf.toString();
  }

  public int getTotalSeconds()
  {
    return totalSeconds;
  }

  /**
   * {@code Z} for UTC, otherwise {@code ±HH:MM}, with {@code :SS} only when the seconds are
   * non-zero.
   */
  @Override
  public String getId()
  {
    return id;
  }

  @Override
  public ZoneRules getRules()
  {
    return ZoneRules.of(this);
  }

  @Override
  public ZoneId normalized()
  {
    return this;
  }

  @Override
  public boolean isSupported(ChronoField field)
  {
    return field == OFFSET_SECONDS;
  }

  @Override
  public int get(ChronoField field)
  {
    if (field == OFFSET_SECONDS)
      return totalSeconds;

    return TemporalAccessor.super.get(field);
  }

  @Override
  public long getLong(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    if (field == OFFSET_SECONDS)
      return totalSeconds;

    throw UnsupportedTemporalTypeException.forField(field);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <R> R query(TemporalQuery<R> query)
  {
    if (query == TemporalQueries.offset() || query == TemporalQueries.zone())
      return (R) this;

    return TemporalAccessor.super.query(query);
  }

  @Override
  public Temporal adjustInto(Temporal temporal)
  {
    return temporal.with(OFFSET_SECONDS, totalSeconds);
  }

  /**
   * Descending by total seconds: {@code +02:00} sorts before {@code +01:00}.
   */
  @Override
  public int compareTo(ZoneOffset other)
  {
    return other.totalSeconds - totalSeconds;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (obj instanceof ZoneOffset)
      return totalSeconds == ((ZoneOffset) obj).totalSeconds;

    return false;
  }

  @Override
  public int hashCode()
  {
    return totalSeconds;
  }

  @Override
  public String toString()
  {
    return id;
  }
}
