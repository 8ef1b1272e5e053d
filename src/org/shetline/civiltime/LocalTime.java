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

import static org.shetline.civiltime.temporal.ChronoField.*;


/**
 * A time of day without a date or offset, to nanosecond precision. Arithmetic wraps around
 * midnight.
 */
public final class LocalTime implements Temporal, TemporalAdjuster, Comparable<LocalTime>
{
  static final int  HOURS_PER_DAY = 24;
  static final int  MINUTES_PER_HOUR = 60;
  static final int  MINUTES_PER_DAY = MINUTES_PER_HOUR * HOURS_PER_DAY;
  static final int  SECONDS_PER_MINUTE = 60;
  static final int  SECONDS_PER_HOUR = SECONDS_PER_MINUTE * MINUTES_PER_HOUR;
  static final int  SECONDS_PER_DAY = SECONDS_PER_HOUR * HOURS_PER_DAY;
  static final long MILLIS_PER_DAY = SECONDS_PER_DAY * 1000L;
  static final long MICROS_PER_DAY = SECONDS_PER_DAY * 1000000L;
  static final long NANOS_PER_MILLI = 1000000L;
  static final long NANOS_PER_SECOND = 1000000000L;
  static final long NANOS_PER_MINUTE = NANOS_PER_SECOND * SECONDS_PER_MINUTE;
  static final long NANOS_PER_HOUR = NANOS_PER_MINUTE * MINUTES_PER_HOUR;
  static final long NANOS_PER_DAY = NANOS_PER_HOUR * HOURS_PER_DAY;

  private static final LocalTime[] HOURS = new LocalTime[24];

  static {
    for (int i = 0; i < HOURS.length; ++i)
      HOURS[i] = new LocalTime(i, 0, 0, 0);
  }

  public static final LocalTime MIDNIGHT = HOURS[0];
  public static final LocalTime NOON = HOURS[12];
  public static final LocalTime MIN = HOURS[0];
  public static final LocalTime MAX = new LocalTime(23, 59, 59, 999999999);

  private final byte  hour;
  private final byte  minute;
  private final byte  second;
  private final int   nano;

  private LocalTime(int hour, int minute, int second, int nanoOfSecond)
  {
    this.hour = (byte) hour;
    this.minute = (byte) minute;
    this.second = (byte) second;
    this.nano = nanoOfSecond;
  }

  public static LocalTime now()
  {
    return LocalDateTime.now().toLocalTime();
  }

  public static LocalTime of(int hour, int minute)
  {
    HOUR_OF_DAY.checkValidValue(hour);

    if (minute == 0)
      return HOURS[hour];

    MINUTE_OF_HOUR.checkValidValue(minute);

    return new LocalTime(hour, minute, 0, 0);
  }

  public static LocalTime of(int hour, int minute, int second)
  {
    HOUR_OF_DAY.checkValidValue(hour);

    if ((minute | second) == 0)
      return HOURS[hour];

    MINUTE_OF_HOUR.checkValidValue(minute);
    SECOND_OF_MINUTE.checkValidValue(second);

    return new LocalTime(hour, minute, second, 0);
  }

  public static LocalTime of(int hour, int minute, int second, int nanoOfSecond)
  {
    HOUR_OF_DAY.checkValidValue(hour);
    MINUTE_OF_HOUR.checkValidValue(minute);
    SECOND_OF_MINUTE.checkValidValue(second);
    NANO_OF_SECOND.checkValidValue(nanoOfSecond);

    return create(hour, minute, second, nanoOfSecond);
  }

  public static LocalTime ofSecondOfDay(long secondOfDay)
  {
    SECOND_OF_DAY.checkValidValue(secondOfDay);

    int   hours = (int) (secondOfDay / SECONDS_PER_HOUR);

    secondOfDay -= hours * (long) SECONDS_PER_HOUR;

    int   minutes = (int) (secondOfDay / SECONDS_PER_MINUTE);

    secondOfDay -= minutes * (long) SECONDS_PER_MINUTE;

    return create(hours, minutes, (int) secondOfDay, 0);
  }

  public static LocalTime ofNanoOfDay(long nanoOfDay)
  {
    NANO_OF_DAY.checkValidValue(nanoOfDay);

    int   hours = (int) (nanoOfDay / NANOS_PER_HOUR);

    nanoOfDay -= hours * NANOS_PER_HOUR;

    int   minutes = (int) (nanoOfDay / NANOS_PER_MINUTE);

    nanoOfDay -= minutes * NANOS_PER_MINUTE;

    int   seconds = (int) (nanoOfDay / NANOS_PER_SECOND);

    nanoOfDay -= seconds * NANOS_PER_SECOND;

    return create(hours, minutes, seconds, (int) nanoOfDay);
  }

  public static LocalTime from(TemporalAccessor temporal)
  {
    Objects.requireNonNull(temporal, "temporal");

    LocalTime   time = temporal.query(TemporalQueries.localTime());

    if (time == null)
      throw new DateTimeException("Unable to obtain LocalTime from TemporalAccessor: " +
                                  temporal + " of type " + temporal.getClass().getName());

    return time;
  }

  public static LocalTime parse(CharSequence text)
  {
    return parse(text, DateTimeFormatter.ISO_LOCAL_TIME);
  }

  public static LocalTime parse(CharSequence text, DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.parse(text, LocalTime::from);
  }

  public static DateTimeResult<LocalTime> tryParse(CharSequence text)
  {
    return DateTimeResult.of(() -> parse(text));
  }

  private static LocalTime create(int hour, int minute, int second, int nanoOfSecond)
  {
    if ((minute | second | nanoOfSecond) == 0)
      return HOURS[hour];

    return new LocalTime(hour, minute, second, nanoOfSecond);
  }

  @Override
  public boolean isSupported(ChronoField field)
  {
    return field != null && field.isTimeBased();
  }

  @Override
  public boolean isSupported(ChronoUnit unit)
  {
    return unit != null && unit.isTimeBased();
  }

  @Override
  public int get(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    return (int) get0(field);
  }

  @Override
  public long getLong(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    if (field == NANO_OF_DAY)
      return toNanoOfDay();
    else if (field == MICRO_OF_DAY)
      return toNanoOfDay() / 1000;

    return get0(field);
  }

  private long get0(ChronoField field)
  {
    switch (field) {
      case NANO_OF_SECOND:   return nano;
      case NANO_OF_DAY:      throw new UnsupportedTemporalTypeException("Invalid field 'NanoOfDay' for get() method, use getLong() instead");
      case MICRO_OF_SECOND:  return nano / 1000;
      case MICRO_OF_DAY:     throw new UnsupportedTemporalTypeException("Invalid field 'MicroOfDay' for get() method, use getLong() instead");
      case MILLI_OF_SECOND:  return nano / 1000000;
      case MILLI_OF_DAY:     return toNanoOfDay() / 1000000;
      case SECOND_OF_MINUTE: return second;
      case SECOND_OF_DAY:    return toSecondOfDay();
      case MINUTE_OF_HOUR:   return minute;
      case MINUTE_OF_DAY:    return hour * 60 + minute;
      case HOUR_OF_DAY:      return hour;
      default:
        throw UnsupportedTemporalTypeException.forField(field);
    }
  }

  public int getHour()
  {
    return hour;
  }

  public int getMinute()
  {
    return minute;
  }

  public int getSecond()
  {
    return second;
  }

  public int getNano()
  {
    return nano;
  }

  @Override
  public LocalTime with(TemporalAdjuster adjuster)
  {
    if (adjuster instanceof LocalTime)
      return (LocalTime) adjuster;

    return (LocalTime) adjuster.adjustInto(this);
  }

  @Override
  public LocalTime with(ChronoField field, long newValue)
  {
    Objects.requireNonNull(field, "field");

    if (!isSupported(field))
      throw UnsupportedTemporalTypeException.forField(field);

    field.checkValidValue(newValue);

    switch (field) {
      case NANO_OF_SECOND:   return withNano((int) newValue);
      case NANO_OF_DAY:      return LocalTime.ofNanoOfDay(newValue);
      case MICRO_OF_SECOND:  return withNano((int) newValue * 1000);
      case MICRO_OF_DAY:     return LocalTime.ofNanoOfDay(newValue * 1000);
      case MILLI_OF_SECOND:  return withNano((int) newValue * 1000000);
      case MILLI_OF_DAY:     return LocalTime.ofNanoOfDay(newValue * 1000000);
      case SECOND_OF_MINUTE: return withSecond((int) newValue);
      case SECOND_OF_DAY:    return plusSeconds(newValue - toSecondOfDay());
      case MINUTE_OF_HOUR:   return withMinute((int) newValue);
      case MINUTE_OF_DAY:    return plusMinutes(newValue - (hour * 60 + minute));
      case HOUR_OF_DAY:      return withHour((int) newValue);
      default:
        throw UnsupportedTemporalTypeException.forField(field);
    }
  }

  public LocalTime withHour(int hour)
  {
    if (this.hour == hour)
      return this;

    HOUR_OF_DAY.checkValidValue(hour);

    return create(hour, minute, second, nano);
  }

  public LocalTime withMinute(int minute)
  {
    if (this.minute == minute)
      return this;

    MINUTE_OF_HOUR.checkValidValue(minute);

    return create(hour, minute, second, nano);
  }

  public LocalTime withSecond(int second)
  {
    if (this.second == second)
      return this;

    SECOND_OF_MINUTE.checkValidValue(second);

    return create(hour, minute, second, nano);
  }

  public LocalTime withNano(int nanoOfSecond)
  {
    if (this.nano == nanoOfSecond)
      return this;

    NANO_OF_SECOND.checkValidValue(nanoOfSecond);

    return create(hour, minute, second, nanoOfSecond);
  }

  public LocalTime truncatedTo(ChronoUnit unit)
  {
    if (unit == ChronoUnit.NANOS)
      return this;

    Duration  unitDur = unit.getDuration();

    if (unitDur.getSeconds() > SECONDS_PER_DAY)
      throw new UnsupportedTemporalTypeException("Unit is too large to be used for truncation");

    long  dur = unitDur.toNanos();

    if ((NANOS_PER_DAY % dur) != 0)
      throw new UnsupportedTemporalTypeException("Unit must divide into a standard day without remainder");

    long  nod = toNanoOfDay();

    return ofNanoOfDay((nod / dur) * dur);
  }

  @Override
  public LocalTime plus(long amountToAdd, ChronoUnit unit)
  {
    switch (Objects.requireNonNull(unit, "unit")) {
      case NANOS:     return plusNanos(amountToAdd);
      case MICROS:    return plusNanos((amountToAdd % MICROS_PER_DAY) * 1000);
      case MILLIS:    return plusNanos((amountToAdd % MILLIS_PER_DAY) * 1000000);
      case SECONDS:   return plusSeconds(amountToAdd);
      case MINUTES:   return plusMinutes(amountToAdd);
      case HOURS:     return plusHours(amountToAdd);
      case HALF_DAYS: return plusHours((amountToAdd % 2) * 12);
      default:
        throw UnsupportedTemporalTypeException.forUnit(unit);
    }
  }

  public LocalTime plus(Duration duration)
  {
    return plusSeconds(duration.getSeconds()).plusNanos(duration.getNano());
  }

  public LocalTime plusHours(long hoursToAdd)
  {
    if (hoursToAdd == 0)
      return this;

    int   newHour = ((int) (hoursToAdd % HOURS_PER_DAY) + hour + HOURS_PER_DAY) % HOURS_PER_DAY;

    return create(newHour, minute, second, nano);
  }

  public LocalTime plusMinutes(long minutesToAdd)
  {
    if (minutesToAdd == 0)
      return this;

    int   mofd = hour * MINUTES_PER_HOUR + minute;
    int   newMofd = ((int) (minutesToAdd % MINUTES_PER_DAY) + mofd + MINUTES_PER_DAY) % MINUTES_PER_DAY;

    if (mofd == newMofd)
      return this;

    int   newHour = newMofd / MINUTES_PER_HOUR;
    int   newMinute = newMofd % MINUTES_PER_HOUR;

    return create(newHour, newMinute, second, nano);
  }

  public LocalTime plusSeconds(long secondstoAdd)
  {
    if (secondstoAdd == 0)
      return this;

    int   sofd = hour * SECONDS_PER_HOUR + minute * SECONDS_PER_MINUTE + second;
    int   newSofd = ((int) (secondstoAdd % SECONDS_PER_DAY) + sofd + SECONDS_PER_DAY) % SECONDS_PER_DAY;

    if (sofd == newSofd)
      return this;

    int   newHour = newSofd / SECONDS_PER_HOUR;
    int   newMinute = (newSofd / SECONDS_PER_MINUTE) % MINUTES_PER_HOUR;
    int   newSecond = newSofd % SECONDS_PER_MINUTE;

    return create(newHour, newMinute, newSecond, nano);
  }

  public LocalTime plusNanos(long nanosToAdd)
  {
    if (nanosToAdd == 0)
      return this;

    long  nofd = toNanoOfDay();
    long  newNofd = ((nanosToAdd % NANOS_PER_DAY) + nofd + NANOS_PER_DAY) % NANOS_PER_DAY;

    if (nofd == newNofd)
      return this;

    int   newHour = (int) (newNofd / NANOS_PER_HOUR);
    int   newMinute = (int) ((newNofd / NANOS_PER_MINUTE) % MINUTES_PER_HOUR);
    int   newSecond = (int) ((newNofd / NANOS_PER_SECOND) % SECONDS_PER_MINUTE);
    int   newNano = (int) (newNofd % NANOS_PER_SECOND);

    return create(newHour, newMinute, newSecond, newNano);
  }

  @Override
  public LocalTime minus(long amountToSubtract, ChronoUnit unit)
  {
    return (amountToSubtract == Long.MIN_VALUE ? plus(Long.MAX_VALUE, unit).plus(1, unit) : plus(-amountToSubtract, unit));
  }

  public LocalTime minus(Duration duration)
  {
    return minusSeconds(duration.getSeconds()).minusNanos(duration.getNano());
  }

  public LocalTime minusHours(long hoursToSubtract)
  {
    return plusHours(-(hoursToSubtract % HOURS_PER_DAY));
  }

  public LocalTime minusMinutes(long minutesToSubtract)
  {
    return plusMinutes(-(minutesToSubtract % MINUTES_PER_DAY));
  }

  public LocalTime minusSeconds(long secondsToSubtract)
  {
    return plusSeconds(-(secondsToSubtract % SECONDS_PER_DAY));
  }

  public LocalTime minusNanos(long nanosToSubtract)
  {
    return plusNanos(-(nanosToSubtract % NANOS_PER_DAY));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <R> R query(TemporalQuery<R> query)
  {
    if (query == TemporalQueries.precision())
      return (R) ChronoUnit.NANOS;
    else if (query == TemporalQueries.localTime())
      return (R) this;

    return Temporal.super.query(query);
  }

  @Override
  public Temporal adjustInto(Temporal temporal)
  {
    return temporal.with(NANO_OF_DAY, toNanoOfDay());
  }

  @Override
  public long until(Temporal endExclusive, ChronoUnit unit)
  {
    LocalTime   end = LocalTime.from(endExclusive);
    long        nanosUntil = end.toNanoOfDay() - toNanoOfDay();

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

  public LocalDateTime atDate(LocalDate date)
  {
    return LocalDateTime.of(date, this);
  }

  public OffsetTime atOffset(ZoneOffset offset)
  {
    return OffsetTime.of(this, offset);
  }

  public int toSecondOfDay()
  {
    int   total = hour * SECONDS_PER_HOUR;

    total += minute * SECONDS_PER_MINUTE;
    total += second;

    return total;
  }

  public long toNanoOfDay()
  {
    long  total = hour * NANOS_PER_HOUR;

    total += minute * NANOS_PER_MINUTE;
    total += second * NANOS_PER_SECOND;
    total += nano;

    return total;
  }

  @Override
  public int compareTo(LocalTime other)
  {
    int   cmp = Integer.compare(hour, other.hour);

    if (cmp == 0) {
      cmp = Integer.compare(minute, other.minute);

      if (cmp == 0) {
        cmp = Integer.compare(second, other.second);

        if (cmp == 0)
          cmp = Integer.compare(nano, other.nano);
      }
    }

    return cmp;
  }

  public boolean isAfter(LocalTime other)
  {
    return compareTo(other) > 0;
  }

  public boolean isBefore(LocalTime other)
  {
    return compareTo(other) < 0;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (!(obj instanceof LocalTime))
      return false;

    LocalTime   other = (LocalTime) obj;

    return hour == other.hour && minute == other.minute && second == other.second && nano == other.nano;
  }

  @Override
  public int hashCode()
  {
    long  nod = toNanoOfDay();

    return (int) (nod ^ (nod >>> 32));
  }

  /**
   * {@code HH:mm}, with seconds added when either the seconds or nanoseconds are non-zero, and
   * the fraction written in groups of three digits: 3, 6 or 9 as needed.
   */
  @Override
  public String toString()
  {
    StringBuilder   buf = new StringBuilder(18);
    int             hourValue = hour;
    int             minuteValue = minute;
    int             secondValue = second;
    int             nanoValue = nano;

    buf.append(hourValue < 10 ? "0" : "").append(hourValue).append(minuteValue < 10 ? ":0" : ":").append(minuteValue);

    if (secondValue > 0 || nanoValue > 0) {
      buf.append(secondValue < 10 ? ":0" : ":").append(secondValue);

      if (nanoValue > 0) {
        buf.append('.');

        if (nanoValue % 1000000 == 0)
          buf.append(Integer.toString((nanoValue / 1000000) + 1000).substring(1));
        else if (nanoValue % 1000 == 0)
          buf.append(Integer.toString((nanoValue / 1000) + 1000000).substring(1));
        else
          buf.append(Integer.toString((nanoValue) + 1000000000).substring(1));
      }
    }

    return buf.toString();
  }
}
