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

import org.shetline.civiltime.format.DateTimeFormatter;
import org.shetline.civiltime.temporal.*;

import static java.lang.Math.*;
import static org.shetline.civiltime.LocalTime.NANOS_PER_DAY;
import static org.shetline.civiltime.LocalTime.NANOS_PER_SECOND;
import static org.shetline.civiltime.LocalTime.SECONDS_PER_DAY;
import static org.shetline.civiltime.LocalTime.SECONDS_PER_HOUR;
import static org.shetline.civiltime.LocalTime.SECONDS_PER_MINUTE;
import static org.shetline.civiltime.temporal.ChronoField.*;


/**
 * An instantaneous point on the time-line, counted in seconds and nanoseconds from
 * 1970-01-01T00:00Z. The nanosecond part is always in the range 0 to 999,999,999, even when the
 * seconds are negative, so one nanosecond before the epoch is (-1 s, 999,999,999 ns).
 */
public final class Instant implements Temporal, TemporalAdjuster, Comparable<Instant>
{
  public static final long    MIN_SECOND = -31557014167219200L;
  public static final long    MAX_SECOND = 31556889864403199L;

  public static final Instant EPOCH = new Instant(0, 0);
  public static final Instant MIN = Instant.ofEpochSecond(MIN_SECOND, 0);
  public static final Instant MAX = Instant.ofEpochSecond(MAX_SECOND, 999999999);

  private final long  seconds;
  private final int   nanos;

  private Instant(long epochSecond, int nanos)
  {
    this.seconds = epochSecond;
    this.nanos = nanos;
  }

  public static Instant now()
  {
    return ofEpochMilli(System.currentTimeMillis());
  }

  public static Instant ofEpochSecond(long epochSecond)
  {
    return create(epochSecond, 0);
  }

  public static Instant ofEpochSecond(long epochSecond, long nanoAdjustment)
  {
    long  secs = addExact(epochSecond, floorDiv(nanoAdjustment, NANOS_PER_SECOND));
    int   nos = (int) floorMod(nanoAdjustment, NANOS_PER_SECOND);

    return create(secs, nos);
  }

  public static Instant ofEpochMilli(long epochMilli)
  {
    long  secs = floorDiv(epochMilli, 1000);
    int   mos = (int) floorMod(epochMilli, 1000);

    return create(secs, mos * 1000000);
  }

  public static Instant from(TemporalAccessor temporal)
  {
    Objects.requireNonNull(temporal, "temporal");

    if (temporal instanceof Instant)
      return (Instant) temporal;

    try {
      long  instantSecs = temporal.getLong(INSTANT_SECONDS);
      int   nanoOfSecond = temporal.get(NANO_OF_SECOND);

      return Instant.ofEpochSecond(instantSecs, nanoOfSecond);
    }
    catch (DateTimeException e) {
      throw new DateTimeException("Unable to obtain Instant from TemporalAccessor: " +
                                  temporal + " of type " + temporal.getClass().getName(), e);
    }
  }

  public static Instant parse(CharSequence text)
  {
    return DateTimeFormatter.ISO_INSTANT.parse(text, Instant::from);
  }

  public static DateTimeResult<Instant> tryParse(CharSequence text)
  {
    return DateTimeResult.of(() -> parse(text));
  }

  private static Instant create(long seconds, int nanoOfSecond)
  {
    if ((seconds | nanoOfSecond) == 0)
      return EPOCH;

    if (seconds < MIN_SECOND || seconds > MAX_SECOND)
      throw new DateTimeException("Instant exceeds minimum or maximum instant");

    return new Instant(seconds, nanoOfSecond);
  }

  public long getEpochSecond()
  {
    return seconds;
  }

  public int getNano()
  {
    return nanos;
  }

  @Override
  public boolean isSupported(ChronoField field)
  {
    return field == INSTANT_SECONDS || field == NANO_OF_SECOND || field == MICRO_OF_SECOND || field == MILLI_OF_SECOND;
  }

  @Override
  public boolean isSupported(ChronoUnit unit)
  {
    return unit != null && (unit.isTimeBased() || unit == ChronoUnit.DAYS);
  }

  @Override
  public int get(ChronoField field)
  {
    switch (Objects.requireNonNull(field, "field")) {
      case NANO_OF_SECOND:  return nanos;
      case MICRO_OF_SECOND: return nanos / 1000;
      case MILLI_OF_SECOND: return nanos / 1000000;
      default: break;
    }

    if (field == INSTANT_SECONDS)
      throw new UnsupportedTemporalTypeException("Invalid field " + field + " for get() method, use getLong() instead");

    throw UnsupportedTemporalTypeException.forField(field);
  }

  @Override
  public long getLong(ChronoField field)
  {
    switch (Objects.requireNonNull(field, "field")) {
      case NANO_OF_SECOND:  return nanos;
      case MICRO_OF_SECOND: return nanos / 1000;
      case MILLI_OF_SECOND: return nanos / 1000000;
      case INSTANT_SECONDS: return seconds;
      default:
        throw UnsupportedTemporalTypeException.forField(field);
    }
  }

  @Override
  public Instant with(TemporalAdjuster adjuster)
  {
    return (Instant) adjuster.adjustInto(this);
  }

  @Override
  public Instant with(ChronoField field, long newValue)
  {
    Objects.requireNonNull(field, "field");

    if (!isSupported(field))
      throw UnsupportedTemporalTypeException.forField(field);

    field.checkValidValue(newValue);

    switch (field) {
      case MILLI_OF_SECOND: {
        int   nval = (int) newValue * 1000000;

        return (nval != nanos ? create(seconds, nval) : this);
      }
      case MICRO_OF_SECOND: {
        int   nval = (int) newValue * 1000;

        return (nval != nanos ? create(seconds, nval) : this);
      }
      case NANO_OF_SECOND:
        return (newValue != nanos ? create(seconds, (int) newValue) : this);
      default:
        return (newValue != seconds ? create(newValue, nanos) : this);
    }
  }

  public Instant truncatedTo(ChronoUnit unit)
  {
    if (unit == ChronoUnit.NANOS)
      return this;

    Duration  unitDur = unit.getDuration();

    if (unitDur.getSeconds() > SECONDS_PER_DAY)
      throw new UnsupportedTemporalTypeException("Unit is too large to be used for truncation");

    long  dur = unitDur.toNanos();

    if ((NANOS_PER_DAY % dur) != 0)
      throw new UnsupportedTemporalTypeException("Unit must divide into a standard day without remainder");

    long  nod = (seconds % SECONDS_PER_DAY) * NANOS_PER_SECOND + nanos;
    long  result = floorDiv(nod, dur) * dur;

    return plusNanos(result - nod);
  }

  @Override
  public Instant plus(long amountToAdd, ChronoUnit unit)
  {
    switch (Objects.requireNonNull(unit, "unit")) {
      case NANOS:     return plusNanos(amountToAdd);
      case MICROS:    return plus(amountToAdd / 1000000, (amountToAdd % 1000000) * 1000);
      case MILLIS:    return plusMillis(amountToAdd);
      case SECONDS:   return plusSeconds(amountToAdd);
      case MINUTES:   return plusSeconds(multiplyExact(amountToAdd, SECONDS_PER_MINUTE));
      case HOURS:     return plusSeconds(multiplyExact(amountToAdd, SECONDS_PER_HOUR));
      case HALF_DAYS: return plusSeconds(multiplyExact(amountToAdd, SECONDS_PER_DAY / 2));
      case DAYS:      return plusSeconds(multiplyExact(amountToAdd, SECONDS_PER_DAY));
      default:
        throw UnsupportedTemporalTypeException.forUnit(unit);
    }
  }

  public Instant plus(Duration duration)
  {
    return plus(duration.getSeconds(), duration.getNano());
  }

  public Instant plusSeconds(long secondsToAdd)
  {
    return plus(secondsToAdd, 0);
  }

  public Instant plusMillis(long millisToAdd)
  {
    return plus(millisToAdd / 1000, (millisToAdd % 1000) * 1000000);
  }

  public Instant plusNanos(long nanosToAdd)
  {
    return plus(0, nanosToAdd);
  }

  private Instant plus(long secondsToAdd, long nanosToAdd)
  {
    if ((secondsToAdd | nanosToAdd) == 0)
      return this;

    long  epochSec = addExact(seconds, secondsToAdd);

    epochSec = addExact(epochSec, nanosToAdd / NANOS_PER_SECOND);
    nanosToAdd = nanosToAdd % NANOS_PER_SECOND;

    long  nanoAdjustment = nanos + nanosToAdd;

    return ofEpochSecond(epochSec, nanoAdjustment);
  }

  @Override
  public Instant minus(long amountToSubtract, ChronoUnit unit)
  {
    return (amountToSubtract == Long.MIN_VALUE ? plus(Long.MAX_VALUE, unit).plus(1, unit) : plus(-amountToSubtract, unit));
  }

  public Instant minus(Duration duration)
  {
    Instant   result = plus(-duration.getSeconds(), 0);

    return result.plus(0, -duration.getNano());
  }

  public Instant minusSeconds(long secondsToSubtract)
  {
    if (secondsToSubtract == Long.MIN_VALUE)
      return plusSeconds(Long.MAX_VALUE).plusSeconds(1);

    return plusSeconds(-secondsToSubtract);
  }

  public Instant minusMillis(long millisToSubtract)
  {
    if (millisToSubtract == Long.MIN_VALUE)
      return plusMillis(Long.MAX_VALUE).plusMillis(1);

    return plusMillis(-millisToSubtract);
  }

  public Instant minusNanos(long nanosToSubtract)
  {
    if (nanosToSubtract == Long.MIN_VALUE)
      return plusNanos(Long.MAX_VALUE).plusNanos(1);

    return plusNanos(-nanosToSubtract);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <R> R query(TemporalQuery<R> query)
  {
    if (query == TemporalQueries.precision())
      return (R) ChronoUnit.NANOS;
    else if (query == TemporalQueries.localDate() || query == TemporalQueries.localTime() ||
             query == TemporalQueries.offset() || query == TemporalQueries.zone())
      return null;

    return Temporal.super.query(query);
  }

  @Override
  public Temporal adjustInto(Temporal temporal)
  {
    return temporal.with(INSTANT_SECONDS, seconds).with(NANO_OF_SECOND, nanos);
  }

  @Override
  public long until(Temporal endExclusive, ChronoUnit unit)
  {
    Instant   end = Instant.from(endExclusive);

    switch (Objects.requireNonNull(unit, "unit")) {
      case NANOS:     return nanosUntil(end);
      case MICROS:    return nanosUntil(end) / 1000;
      case MILLIS:    return subtractExact(end.toEpochMilli(), toEpochMilli());
      case SECONDS:   return secondsUntil(end);
      case MINUTES:   return secondsUntil(end) / SECONDS_PER_MINUTE;
      case HOURS:     return secondsUntil(end) / SECONDS_PER_HOUR;
      case HALF_DAYS: return secondsUntil(end) / (12 * SECONDS_PER_HOUR);
      case DAYS:      return secondsUntil(end) / SECONDS_PER_DAY;
      default:
        throw UnsupportedTemporalTypeException.forUnit(unit);
    }
  }

  private long nanosUntil(Instant end)
  {
    long  secsDiff = subtractExact(end.seconds, seconds);
    long  totalNanos = multiplyExact(secsDiff, NANOS_PER_SECOND);

    return addExact(totalNanos, end.nanos - nanos);
  }

  private long secondsUntil(Instant end)
  {
    long  secsDiff = subtractExact(end.seconds, seconds);
    long  nanosDiff = end.nanos - nanos;

    if (secsDiff > 0 && nanosDiff < 0)
      secsDiff--;
    else if (secsDiff < 0 && nanosDiff > 0)
      secsDiff++;

    return secsDiff;
  }

  public OffsetDateTime atOffset(ZoneOffset offset)
  {
    return OffsetDateTime.ofInstant(this, offset);
  }

  public ZonedDateTime atZone(ZoneId zone)
  {
    return ZonedDateTime.ofInstant(this, zone);
  }

  public long toEpochMilli()
  {
    if (seconds < 0 && nanos > 0) {
      long  millis = multiplyExact(seconds + 1, 1000);
      long  adjustment = nanos / 1000000 - 1000;

      return addExact(millis, adjustment);
    }
    else {
      long  millis = multiplyExact(seconds, 1000);

      return addExact(millis, nanos / 1000000);
    }
  }

  @Override
  public int compareTo(Instant other)
  {
    int   cmp = Long.compare(seconds, other.seconds);

    if (cmp != 0)
      return cmp;

    return nanos - other.nanos;
  }

  public boolean isAfter(Instant other)
  {
    return compareTo(other) > 0;
  }

  public boolean isBefore(Instant other)
  {
    return compareTo(other) < 0;
  }

  @Override
  public boolean equals(Object other)
  {
    if (this == other)
      return true;
    else if (!(other instanceof Instant))
      return false;

    Instant   that = (Instant) other;

    return seconds == that.seconds && nanos == that.nanos;
  }

  @Override
  public int hashCode()
  {
    return ((int) (seconds ^ (seconds >>> 32))) + 51 * nanos;
  }

  @Override
  public String toString()
  {
    return DateTimeFormatter.ISO_INSTANT.format(this);
  }
}
