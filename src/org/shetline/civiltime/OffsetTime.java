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

import static java.lang.Math.floorMod;
import static org.shetline.civiltime.LocalTime.NANOS_PER_HOUR;
import static org.shetline.civiltime.LocalTime.NANOS_PER_MINUTE;
import static org.shetline.civiltime.LocalTime.NANOS_PER_SECOND;
import static org.shetline.civiltime.LocalTime.SECONDS_PER_DAY;
import static org.shetline.civiltime.temporal.ChronoField.*;


public final class OffsetTime implements Temporal, TemporalAdjuster, Comparable<OffsetTime>
{
  public static final OffsetTime MIN = LocalTime.MIN.atOffset(ZoneOffset.MAX);
  public static final OffsetTime MAX = LocalTime.MAX.atOffset(ZoneOffset.MIN);

  private final LocalTime   time;
  private final ZoneOffset  offset;

  private OffsetTime(LocalTime time, ZoneOffset offset)
  {
    this.time = Objects.requireNonNull(time, "time");
    this.offset = Objects.requireNonNull(offset, "offset");
  }

  public static OffsetTime now()
  {
    return OffsetDateTime.now().toOffsetTime();
  }

  public static OffsetTime of(LocalTime time, ZoneOffset offset)
  {
    return new OffsetTime(time, offset);
  }

  public static OffsetTime of(int hour, int minute, int second, int nanoOfSecond, ZoneOffset offset)
  {
    return new OffsetTime(LocalTime.of(hour, minute, second, nanoOfSecond), offset);
  }

  public static OffsetTime ofInstant(Instant instant, ZoneId zone)
  {
    Objects.requireNonNull(instant, "instant");
    Objects.requireNonNull(zone, "zone");

    ZoneOffset  offset = zone.getRules().getOffset(instant);
    long        localSecond = instant.getEpochSecond() + offset.getTotalSeconds();
    int         secsOfDay = (int) floorMod(localSecond, SECONDS_PER_DAY);
    LocalTime   time = LocalTime.ofNanoOfDay(secsOfDay * NANOS_PER_SECOND + instant.getNano());

    return new OffsetTime(time, offset);
  }

  public static OffsetTime from(TemporalAccessor temporal)
  {
    if (temporal instanceof OffsetTime)
      return (OffsetTime) temporal;

    try {
      LocalTime   time = LocalTime.from(temporal);
      ZoneOffset  offset = ZoneOffset.from(temporal);

      return new OffsetTime(time, offset);
    }
    catch (DateTimeException e) {
      throw new DateTimeException("Unable to obtain OffsetTime from TemporalAccessor: " +
                                  temporal + " of type " + temporal.getClass().getName(), e);
    }
  }

  public static OffsetTime parse(CharSequence text)
  {
    return parse(text, DateTimeFormatter.ISO_OFFSET_TIME);
  }

  public static OffsetTime parse(CharSequence text, DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.parse(text, OffsetTime::from);
  }

  public static DateTimeResult<OffsetTime> tryParse(CharSequence text)
  {
    return DateTimeResult.of(() -> parse(text));
  }

  private OffsetTime with(LocalTime time, ZoneOffset offset)
  {
    if (this.time == time && this.offset.equals(offset))
      return this;

    return new OffsetTime(time, offset);
  }

  @Override
  public boolean isSupported(ChronoField field)
  {
    return field != null && (field.isTimeBased() || field == OFFSET_SECONDS);
  }

  @Override
  public boolean isSupported(ChronoUnit unit)
  {
    return unit != null && unit.isTimeBased();
  }

  @Override
  public ValueRange range(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    if (field == OFFSET_SECONDS)
      return field.range();

    return time.range(field);
  }

  @Override
  public int get(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    if (field == OFFSET_SECONDS)
      return offset.getTotalSeconds();

    return time.get(field);
  }

  @Override
  public long getLong(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    if (field == OFFSET_SECONDS)
      return offset.getTotalSeconds();

    return time.getLong(field);
  }

  public ZoneOffset getOffset()
  {
    return offset;
  }

  public OffsetTime withOffsetSameLocal(ZoneOffset offset)
  {
    return offset != null && offset.equals(this.offset) ? this : new OffsetTime(time, offset);
  }

  public OffsetTime withOffsetSameInstant(ZoneOffset offset)
  {
    if (offset.equals(this.offset))
      return this;

    int         difference = offset.getTotalSeconds() - this.offset.getTotalSeconds();
    LocalTime   adjusted = time.plusSeconds(difference);

    return new OffsetTime(adjusted, offset);
  }

  public LocalTime toLocalTime()
  {
    return time;
  }

  public int getHour()
  {
    return time.getHour();
  }

  public int getMinute()
  {
    return time.getMinute();
  }

  public int getSecond()
  {
    return time.getSecond();
  }

  public int getNano()
  {
    return time.getNano();
  }

  @Override
  public OffsetTime with(TemporalAdjuster adjuster)
  {
    if (adjuster instanceof LocalTime)
      return with((LocalTime) adjuster, offset);
    else if (adjuster instanceof ZoneOffset)
      return with(time, (ZoneOffset) adjuster);
    else if (adjuster instanceof OffsetTime)
      return (OffsetTime) adjuster;

    return (OffsetTime) adjuster.adjustInto(this);
  }

  @Override
  public OffsetTime with(ChronoField field, long newValue)
  {
    Objects.requireNonNull(field, "field");

    if (field == OFFSET_SECONDS)
      return with(time, ZoneOffset.ofTotalSeconds(field.checkValidIntValue(newValue)));

    return with(time.with(field, newValue), offset);
  }

  public OffsetTime withHour(int hour)
  {
    return with(time.withHour(hour), offset);
  }

  public OffsetTime withMinute(int minute)
  {
    return with(time.withMinute(minute), offset);
  }

  public OffsetTime withSecond(int second)
  {
    return with(time.withSecond(second), offset);
  }

  public OffsetTime withNano(int nanoOfSecond)
  {
    return with(time.withNano(nanoOfSecond), offset);
  }

  public OffsetTime truncatedTo(ChronoUnit unit)
  {
    return with(time.truncatedTo(unit), offset);
  }

  @Override
  public OffsetTime plus(long amountToAdd, ChronoUnit unit)
  {
    return with(time.plus(amountToAdd, unit), offset);
  }

  public OffsetTime plus(Duration duration)
  {
    return with(time.plus(duration), offset);
  }

  public OffsetTime plusHours(long hours)
  {
    return with(time.plusHours(hours), offset);
  }

  public OffsetTime plusMinutes(long minutes)
  {
    return with(time.plusMinutes(minutes), offset);
  }

  public OffsetTime plusSeconds(long seconds)
  {
    return with(time.plusSeconds(seconds), offset);
  }

  public OffsetTime plusNanos(long nanos)
  {
    return with(time.plusNanos(nanos), offset);
  }

  @Override
  public OffsetTime minus(long amountToSubtract, ChronoUnit unit)
  {
    return (amountToSubtract == Long.MIN_VALUE ? plus(Long.MAX_VALUE, unit).plus(1, unit) : plus(-amountToSubtract, unit));
  }

  public OffsetTime minus(Duration duration)
  {
    return with(time.minus(duration), offset);
  }

  public OffsetTime minusHours(long hours)
  {
    return with(time.minusHours(hours), offset);
  }

  public OffsetTime minusMinutes(long minutes)
  {
    return with(time.minusMinutes(minutes), offset);
  }

  public OffsetTime minusSeconds(long seconds)
  {
    return with(time.minusSeconds(seconds), offset);
  }

  public OffsetTime minusNanos(long nanos)
  {
    return with(time.minusNanos(nanos), offset);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <R> R query(TemporalQuery<R> query)
  {
    if (query == TemporalQueries.offset() || query == TemporalQueries.zone())
      return (R) offset;
    else if (query == TemporalQueries.localTime())
      return (R) time;
    else if (query == TemporalQueries.precision())
      return (R) ChronoUnit.NANOS;
    else if (query == TemporalQueries.localDate())
      return null;

    return Temporal.super.query(query);
  }

  @Override
  public Temporal adjustInto(Temporal temporal)
  {
    return temporal.with(NANO_OF_DAY, time.toNanoOfDay()).with(OFFSET_SECONDS, offset.getTotalSeconds());
  }

  @Override
  public long until(Temporal endExclusive, ChronoUnit unit)
  {
    OffsetTime  end = OffsetTime.from(endExclusive);
    long        nanosUntil = end.toEpochNano() - toEpochNano();

    switch (Objects.requireNonNull(unit, "unit")) {
      case NANOS:     return nanosUntil;
      case MICROS:    return nanosUntil / 1000;
      case MILLIS:    return nanosUntil / 1000000;
      case SECONDS:   return nanosUntil / NANOS_PER_SECOND;
      case MINUTES:   return nanosUntil / NANOS_PER_MINUTE;
      case HOURS:     return nanosUntil / NANOS_PER_HOUR;
      case HALF_DAYS: return nanosUntil / (12 * NANOS_PER_HOUR);
      default:
        throw UnsupportedTemporalTypeException.forUnit(unit);
    }
  }

  public String format(DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.format(this);
  }

  public OffsetDateTime atDate(LocalDate date)
  {
    return OffsetDateTime.of(date, time, offset);
  }

  public long toEpochSecond(LocalDate date)
  {
    Objects.requireNonNull(date, "date");

    long  epochDay = date.toEpochDay();
    long  secs = epochDay * 86400 + time.toSecondOfDay();

    secs -= offset.getTotalSeconds();

    return secs;
  }

  private long toEpochNano()
  {
    long  nod = time.toNanoOfDay();
    long  offsetNanos = offset.getTotalSeconds() * NANOS_PER_SECOND;

    return nod - offsetNanos;
  }

  @Override
  public int compareTo(OffsetTime other)
  {
    if (offset.equals(other.offset))
      return time.compareTo(other.time);

    int   compare = Long.compare(toEpochNano(), other.toEpochNano());

    if (compare == 0)
      compare = time.compareTo(other.time);

    return compare;
  }

  public boolean isAfter(OffsetTime other)
  {
    return toEpochNano() > other.toEpochNano();
  }

  public boolean isBefore(OffsetTime other)
  {
    return toEpochNano() < other.toEpochNano();
  }

  public boolean isEqual(OffsetTime other)
  {
    return toEpochNano() == other.toEpochNano();
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (!(obj instanceof OffsetTime))
      return false;

    OffsetTime  other = (OffsetTime) obj;

    return time.equals(other.time) && offset.equals(other.offset);
  }

  @Override
  public int hashCode()
  {
    return time.hashCode() ^ offset.hashCode();
  }

  @Override
  public String toString()
  {
    return time.toString() + offset.toString();
  }
}
