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
import static org.shetline.civiltime.LocalTime.*;
import static org.shetline.civiltime.temporal.ChronoField.*;


/**
 * A date and time of day without an offset or zone. Time arithmetic carries into, and borrows
 * from, the date.
 */
public final class LocalDateTime implements Temporal, TemporalAdjuster, Comparable<LocalDateTime>
{
  public static final LocalDateTime MIN = LocalDateTime.of(LocalDate.MIN, LocalTime.MIN);
  public static final LocalDateTime MAX = LocalDateTime.of(LocalDate.MAX, LocalTime.MAX);

  private final LocalDate date;
  private final LocalTime time;

  private LocalDateTime(LocalDate date, LocalTime time)
  {
    this.date = date;
    this.time = time;
  }

  public static LocalDateTime now()
  {
    return now(ZoneId.systemDefault());
  }

  public static LocalDateTime now(ZoneId zone)
  {
    return ofInstant(Instant.now(), zone);
  }

  public static LocalDateTime of(int year, Month month, int dayOfMonth, int hour, int minute)
  {
    return new LocalDateTime(LocalDate.of(year, month, dayOfMonth), LocalTime.of(hour, minute));
  }

  public static LocalDateTime of(int year, Month month, int dayOfMonth, int hour, int minute, int second)
  {
    return new LocalDateTime(LocalDate.of(year, month, dayOfMonth), LocalTime.of(hour, minute, second));
  }

  public static LocalDateTime of(int year, Month month, int dayOfMonth, int hour, int minute, int second, int nanoOfSecond)
  {
    return new LocalDateTime(LocalDate.of(year, month, dayOfMonth), LocalTime.of(hour, minute, second, nanoOfSecond));
  }

  public static LocalDateTime of(int year, int month, int dayOfMonth, int hour, int minute)
  {
    return new LocalDateTime(LocalDate.of(year, month, dayOfMonth), LocalTime.of(hour, minute));
  }

  public static LocalDateTime of(int year, int month, int dayOfMonth, int hour, int minute, int second)
  {
    return new LocalDateTime(LocalDate.of(year, month, dayOfMonth), LocalTime.of(hour, minute, second));
  }

  public static LocalDateTime of(int year, int month, int dayOfMonth, int hour, int minute, int second, int nanoOfSecond)
  {
    return new LocalDateTime(LocalDate.of(year, month, dayOfMonth), LocalTime.of(hour, minute, second, nanoOfSecond));
  }

  public static LocalDateTime of(LocalDate date, LocalTime time)
  {
    Objects.requireNonNull(date, "date");
    Objects.requireNonNull(time, "time");

    return new LocalDateTime(date, time);
  }

  public static LocalDateTime ofInstant(Instant instant, ZoneId zone)
  {
    Objects.requireNonNull(instant, "instant");
    Objects.requireNonNull(zone, "zone");

    ZoneOffset  offset = zone.getRules().getOffset(instant);

    return ofEpochSecond(instant.getEpochSecond(), instant.getNano(), offset);
  }

  public static LocalDateTime ofEpochSecond(long epochSecond, int nanoOfSecond, ZoneOffset offset)
  {
    Objects.requireNonNull(offset, "offset");
    NANO_OF_SECOND.checkValidValue(nanoOfSecond);

    long        localSecond = epochSecond + offset.getTotalSeconds();
    long        localEpochDay = floorDiv(localSecond, SECONDS_PER_DAY);
    int         secsOfDay = (int) floorMod(localSecond, SECONDS_PER_DAY);
    LocalDate   date = LocalDate.ofEpochDay(localEpochDay);
    LocalTime   time = LocalTime.ofNanoOfDay(secsOfDay * NANOS_PER_SECOND + nanoOfSecond);

    return new LocalDateTime(date, time);
  }

  public static LocalDateTime from(TemporalAccessor temporal)
  {
    Objects.requireNonNull(temporal, "temporal");

    if (temporal instanceof LocalDateTime)
      return (LocalDateTime) temporal;
    else if (temporal instanceof ZonedDateTime)
      return ((ZonedDateTime) temporal).toLocalDateTime();
    else if (temporal instanceof OffsetDateTime)
      return ((OffsetDateTime) temporal).toLocalDateTime();

    try {
      LocalDate   date = LocalDate.from(temporal);
      LocalTime   time = LocalTime.from(temporal);

      return new LocalDateTime(date, time);
    }
    catch (DateTimeException e) {
      throw new DateTimeException("Unable to obtain LocalDateTime from TemporalAccessor: " +
                                  temporal + " of type " + temporal.getClass().getName(), e);
    }
  }

  public static LocalDateTime parse(CharSequence text)
  {
    return parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
  }

  public static LocalDateTime parse(CharSequence text, DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.parse(text, LocalDateTime::from);
  }

  public static DateTimeResult<LocalDateTime> tryParse(CharSequence text)
  {
    return DateTimeResult.of(() -> parse(text));
  }

  private LocalDateTime with(LocalDate newDate, LocalTime newTime)
  {
    if (date == newDate && time == newTime)
      return this;

    return new LocalDateTime(newDate, newTime);
  }

  @Override
  public boolean isSupported(ChronoField field)
  {
    return field != null && (field.isDateBased() || field.isTimeBased());
  }

  @Override
  public boolean isSupported(ChronoUnit unit)
  {
    return unit != null && unit != ChronoUnit.FOREVER;
  }

  @Override
  public ValueRange range(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    if (field.isTimeBased())
      return time.range(field);
    else if (field.isDateBased())
      return date.range(field);

    throw UnsupportedTemporalTypeException.forField(field);
  }

  @Override
  public int get(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    if (field.isTimeBased())
      return time.get(field);
    else if (field.isDateBased())
      return date.get(field);

    return Temporal.super.get(field);
  }

  @Override
  public long getLong(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    if (field.isTimeBased())
      return time.getLong(field);
    else if (field.isDateBased())
      return date.getLong(field);

    throw UnsupportedTemporalTypeException.forField(field);
  }

  public LocalDate toLocalDate()
  {
    return date;
  }

  public int getYear()
  {
    return date.getYear();
  }

  public int getMonthValue()
  {
    return date.getMonthValue();
  }

  public Month getMonth()
  {
    return date.getMonth();
  }

  public int getDayOfMonth()
  {
    return date.getDayOfMonth();
  }

  public int getDayOfYear()
  {
    return date.getDayOfYear();
  }

  public DayOfWeek getDayOfWeek()
  {
    return date.getDayOfWeek();
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
  public LocalDateTime with(TemporalAdjuster adjuster)
  {
    if (adjuster instanceof LocalDate)
      return with((LocalDate) adjuster, time);
    else if (adjuster instanceof LocalTime)
      return with(date, (LocalTime) adjuster);
    else if (adjuster instanceof LocalDateTime)
      return (LocalDateTime) adjuster;

    return (LocalDateTime) adjuster.adjustInto(this);
  }

  @Override
  public LocalDateTime with(ChronoField field, long newValue)
  {
    Objects.requireNonNull(field, "field");

    if (field.isTimeBased())
      return with(date, time.with(field, newValue));
    else if (field.isDateBased())
      return with(date.with(field, newValue), time);

    throw UnsupportedTemporalTypeException.forField(field);
  }

  public LocalDateTime withYear(int year)
  {
    return with(date.withYear(year), time);
  }

  public LocalDateTime withMonth(int month)
  {
    return with(date.withMonth(month), time);
  }

  public LocalDateTime withDayOfMonth(int dayOfMonth)
  {
    return with(date.withDayOfMonth(dayOfMonth), time);
  }

  public LocalDateTime withDayOfYear(int dayOfYear)
  {
    return with(date.withDayOfYear(dayOfYear), time);
  }

  public LocalDateTime withHour(int hour)
  {
    return with(date, time.withHour(hour));
  }

  public LocalDateTime withMinute(int minute)
  {
    return with(date, time.withMinute(minute));
  }

  public LocalDateTime withSecond(int second)
  {
    return with(date, time.withSecond(second));
  }

  public LocalDateTime withNano(int nanoOfSecond)
  {
    return with(date, time.withNano(nanoOfSecond));
  }

  public LocalDateTime truncatedTo(ChronoUnit unit)
  {
    return with(date, time.truncatedTo(unit));
  }

  @Override
  public LocalDateTime plus(long amountToAdd, ChronoUnit unit)
  {
    Objects.requireNonNull(unit, "unit");

    if (unit.isTimeBased()) {
      switch (unit) {
        case NANOS:     return plusNanos(amountToAdd);
        case MICROS:    return plusDays(amountToAdd / MICROS_PER_DAY).plusNanos((amountToAdd % MICROS_PER_DAY) * 1000);
        case MILLIS:    return plusDays(amountToAdd / MILLIS_PER_DAY).plusNanos((amountToAdd % MILLIS_PER_DAY) * 1000000);
        case SECONDS:   return plusSeconds(amountToAdd);
        case MINUTES:   return plusMinutes(amountToAdd);
        case HOURS:     return plusHours(amountToAdd);
        default:
          return plusDays(amountToAdd / 256).plusHours((amountToAdd % 256) * 12);
      }
    }

    return with(date.plus(amountToAdd, unit), time);
  }

  public LocalDateTime plus(Duration duration)
  {
    return plusSeconds(duration.getSeconds()).plusNanos(duration.getNano());
  }

  public LocalDateTime plus(Period period)
  {
    return with(date.plus(period), time);
  }

  public LocalDateTime plusYears(long years)
  {
    return with(date.plusYears(years), time);
  }

  public LocalDateTime plusMonths(long months)
  {
    return with(date.plusMonths(months), time);
  }

  public LocalDateTime plusWeeks(long weeks)
  {
    return with(date.plusWeeks(weeks), time);
  }

  public LocalDateTime plusDays(long days)
  {
    return with(date.plusDays(days), time);
  }

  public LocalDateTime plusHours(long hours)
  {
    return plusWithOverflow(date, hours, 0, 0, 0, 1);
  }

  public LocalDateTime plusMinutes(long minutes)
  {
    return plusWithOverflow(date, 0, minutes, 0, 0, 1);
  }

  public LocalDateTime plusSeconds(long seconds)
  {
    return plusWithOverflow(date, 0, 0, seconds, 0, 1);
  }

  public LocalDateTime plusNanos(long nanos)
  {
    return plusWithOverflow(date, 0, 0, 0, nanos, 1);
  }

  @Override
  public LocalDateTime minus(long amountToSubtract, ChronoUnit unit)
  {
    return (amountToSubtract == Long.MIN_VALUE ? plus(Long.MAX_VALUE, unit).plus(1, unit) : plus(-amountToSubtract, unit));
  }

  public LocalDateTime minus(Period period)
  {
    return with(date.minus(period), time);
  }

  public LocalDateTime minus(Duration duration)
  {
    return minusSeconds(duration.getSeconds()).minusNanos(duration.getNano());
  }

  public LocalDateTime minusYears(long years)
  {
    return (years == Long.MIN_VALUE ? plusYears(Long.MAX_VALUE).plusYears(1) : plusYears(-years));
  }

  public LocalDateTime minusMonths(long months)
  {
    return (months == Long.MIN_VALUE ? plusMonths(Long.MAX_VALUE).plusMonths(1) : plusMonths(-months));
  }

  public LocalDateTime minusWeeks(long weeks)
  {
    return (weeks == Long.MIN_VALUE ? plusWeeks(Long.MAX_VALUE).plusWeeks(1) : plusWeeks(-weeks));
  }

  public LocalDateTime minusDays(long days)
  {
    return (days == Long.MIN_VALUE ? plusDays(Long.MAX_VALUE).plusDays(1) : plusDays(-days));
  }

  public LocalDateTime minusHours(long hours)
  {
    return plusWithOverflow(date, hours, 0, 0, 0, -1);
  }

  public LocalDateTime minusMinutes(long minutes)
  {
    return plusWithOverflow(date, 0, minutes, 0, 0, -1);
  }

  public LocalDateTime minusSeconds(long seconds)
  {
    return plusWithOverflow(date, 0, 0, seconds, 0, -1);
  }

  public LocalDateTime minusNanos(long nanos)
  {
    return plusWithOverflow(date, 0, 0, 0, nanos, -1);
  }

  /**
   * Adds a time amount, splitting it into whole days and a nanosecond remainder first so that no
   * intermediate value overflows.
   */
  private LocalDateTime plusWithOverflow(LocalDate newDate, long hours, long minutes, long seconds, long nanos, int sign)
  {
    if ((hours | minutes | seconds | nanos) == 0)
      return with(newDate, time);

    long  totDays = nanos / NANOS_PER_DAY +
                    seconds / SECONDS_PER_DAY +
                    minutes / MINUTES_PER_DAY +
                    hours / HOURS_PER_DAY;

    totDays *= sign;

    long  totNanos = nanos % NANOS_PER_DAY +
                     (seconds % SECONDS_PER_DAY) * NANOS_PER_SECOND +
                     (minutes % MINUTES_PER_DAY) * NANOS_PER_MINUTE +
                     (hours % HOURS_PER_DAY) * NANOS_PER_HOUR;
    long  curNoD = time.toNanoOfDay();

    totNanos = totNanos * sign + curNoD;
    totDays += floorDiv(totNanos, NANOS_PER_DAY);

    long        newNoD = floorMod(totNanos, NANOS_PER_DAY);
    LocalTime   newTime = (newNoD == curNoD ? time : LocalTime.ofNanoOfDay(newNoD));

    return with(newDate.plusDays(totDays), newTime);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <R> R query(TemporalQuery<R> query)
  {
    if (query == TemporalQueries.localDate())
      return (R) date;
    else if (query == TemporalQueries.localTime())
      return (R) time;
    else if (query == TemporalQueries.chronology())
      return (R) date.getChronology();
    else if (query == TemporalQueries.precision())
      return (R) ChronoUnit.NANOS;
    else if (query == TemporalQueries.offset() || query == TemporalQueries.zone())
      return null;

    return Temporal.super.query(query);
  }

  @Override
  public Temporal adjustInto(Temporal temporal)
  {
    return temporal.with(EPOCH_DAY, date.toEpochDay()).with(NANO_OF_DAY, time.toNanoOfDay());
  }

  @Override
  public long until(Temporal endExclusive, ChronoUnit unit)
  {
    LocalDateTime   end = LocalDateTime.from(endExclusive);

    Objects.requireNonNull(unit, "unit");

    if (unit.isTimeBased()) {
      long  amount = date.daysUntil(end.date);

      if (amount == 0)
        return time.until(end.time, unit);

      long  timePart = end.time.toNanoOfDay() - time.toNanoOfDay();

      if (amount > 0) {
        amount--;
        timePart += NANOS_PER_DAY;
      }
      else {
        amount++;
        timePart -= NANOS_PER_DAY;
      }

      switch (unit) {
        case NANOS:
          amount = multiplyExact(amount, NANOS_PER_DAY);
          break;
        case MICROS:
          amount = multiplyExact(amount, MICROS_PER_DAY);
          timePart = timePart / 1000;
          break;
        case MILLIS:
          amount = multiplyExact(amount, MILLIS_PER_DAY);
          timePart = timePart / 1000000;
          break;
        case SECONDS:
          amount = multiplyExact(amount, SECONDS_PER_DAY);
          timePart = timePart / NANOS_PER_SECOND;
          break;
        case MINUTES:
          amount = multiplyExact(amount, MINUTES_PER_DAY);
          timePart = timePart / NANOS_PER_MINUTE;
          break;
        case HOURS:
          amount = multiplyExact(amount, HOURS_PER_DAY);
          timePart = timePart / NANOS_PER_HOUR;
          break;
        default:
          amount = multiplyExact(amount, 2);
          timePart = timePart / (NANOS_PER_HOUR * 12);
          break;
      }

      return addExact(amount, timePart);
    }

    LocalDate   endDate = end.date;

    if (endDate.isAfter(date) && end.time.isBefore(time))
      endDate = endDate.minusDays(1);
    else if (endDate.isBefore(date) && end.time.isAfter(time))
      endDate = endDate.plusDays(1);

    return date.until(endDate, unit);
  }

  public String format(DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.format(this);
  }

  public OffsetDateTime atOffset(ZoneOffset offset)
  {
    return OffsetDateTime.of(this, offset);
  }

  public ZonedDateTime atZone(ZoneId zone)
  {
    return ZonedDateTime.of(this, zone);
  }

  public long toEpochSecond(ZoneOffset offset)
  {
    Objects.requireNonNull(offset, "offset");

    long  epochDay = date.toEpochDay();
    long  secs = epochDay * 86400 + time.toSecondOfDay();

    secs -= offset.getTotalSeconds();

    return secs;
  }

  public Instant toInstant(ZoneOffset offset)
  {
    return Instant.ofEpochSecond(toEpochSecond(offset), time.getNano());
  }

  @Override
  public int compareTo(LocalDateTime other)
  {
    int   cmp = date.compareTo0(other.toLocalDate());

    if (cmp == 0)
      cmp = time.compareTo(other.toLocalTime());

    return cmp;
  }

  public boolean isAfter(LocalDateTime other)
  {
    return compareTo(other) > 0;
  }

  public boolean isBefore(LocalDateTime other)
  {
    return compareTo(other) < 0;
  }

  public boolean isEqual(LocalDateTime other)
  {
    return compareTo(other) == 0;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (!(obj instanceof LocalDateTime))
      return false;

    LocalDateTime   other = (LocalDateTime) obj;

    return date.equals(other.date) && time.equals(other.time);
  }

  @Override
  public int hashCode()
  {
    return date.hashCode() ^ time.hashCode();
  }

  @Override
  public String toString()
  {
    return date.toString() + 'T' + time.toString();
  }
}
