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

import java.util.Comparator;
import java.util.Objects;

import org.shetline.civiltime.format.DateTimeFormatter;
import org.shetline.civiltime.temporal.*;

import static org.shetline.civiltime.temporal.ChronoField.*;


/**
 * A date-time with a fixed offset from UTC. No zone rules are involved.
 * <p>
 * {@link #equals} compares the local date-time and the offset, so the same instant written with
 * two different offsets gives two unequal values; {@link #isEqual} compares instants only.
 */
public final class OffsetDateTime implements Temporal, TemporalAdjuster, Comparable<OffsetDateTime>
{
  public static final OffsetDateTime MIN = LocalDateTime.MIN.atOffset(ZoneOffset.MAX);
  public static final OffsetDateTime MAX = LocalDateTime.MAX.atOffset(ZoneOffset.MIN);

  private final LocalDateTime dateTime;
  private final ZoneOffset    offset;

  private OffsetDateTime(LocalDateTime dateTime, ZoneOffset offset)
  {
    this.dateTime = Objects.requireNonNull(dateTime, "dateTime");
    this.offset = Objects.requireNonNull(offset, "offset");
  }

  public static Comparator<OffsetDateTime> timeLineOrder()
  {
    return OffsetDateTime::compareInstant;
  }

  public static OffsetDateTime now()
  {
    return ZonedDateTime.now().toOffsetDateTime();
  }

  public static OffsetDateTime of(LocalDate date, LocalTime time, ZoneOffset offset)
  {
    LocalDateTime   dt = LocalDateTime.of(date, time);

    return new OffsetDateTime(dt, offset);
  }

  public static OffsetDateTime of(LocalDateTime dateTime, ZoneOffset offset)
  {
    return new OffsetDateTime(dateTime, offset);
  }

  public static OffsetDateTime of(int year, int month, int dayOfMonth, int hour, int minute, int second, int nanoOfSecond,
                                  ZoneOffset offset)
  {
    LocalDateTime   dt = LocalDateTime.of(year, month, dayOfMonth, hour, minute, second, nanoOfSecond);

    return new OffsetDateTime(dt, offset);
  }

  public static OffsetDateTime ofInstant(Instant instant, ZoneId zone)
  {
    Objects.requireNonNull(instant, "instant");
    Objects.requireNonNull(zone, "zone");

    ZoneOffset      offset = zone.getRules().getOffset(instant);
    LocalDateTime   ldt = LocalDateTime.ofEpochSecond(instant.getEpochSecond(), instant.getNano(), offset);

    return new OffsetDateTime(ldt, offset);
  }

  public static OffsetDateTime from(TemporalAccessor temporal)
  {
    if (temporal instanceof OffsetDateTime)
      return (OffsetDateTime) temporal;

    Objects.requireNonNull(temporal, "temporal");

    try {
      ZoneOffset  offset = ZoneOffset.from(temporal);
      LocalDate   date = temporal.query(TemporalQueries.localDate());
      LocalTime   time = temporal.query(TemporalQueries.localTime());

      if (date != null && time != null)
        return OffsetDateTime.of(date, time, offset);

      Instant   instant = Instant.from(temporal);

      return OffsetDateTime.ofInstant(instant, offset);
    }
    catch (DateTimeException e) {
      throw new DateTimeException("Unable to obtain OffsetDateTime from TemporalAccessor: " +
                                  temporal + " of type " + temporal.getClass().getName(), e);
    }
  }

  public static OffsetDateTime parse(CharSequence text)
  {
    return parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
  }

  public static OffsetDateTime parse(CharSequence text, DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.parse(text, OffsetDateTime::from);
  }

  public static DateTimeResult<OffsetDateTime> tryParse(CharSequence text)
  {
    return DateTimeResult.of(() -> parse(text));
  }

  private OffsetDateTime with(LocalDateTime dateTime, ZoneOffset offset)
  {
    if (this.dateTime == dateTime && this.offset.equals(offset))
      return this;

    return new OffsetDateTime(dateTime, offset);
  }

  @Override
  public boolean isSupported(ChronoField field)
  {
    return field != null;
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

    if (field == INSTANT_SECONDS || field == OFFSET_SECONDS)
      return field.range();

    return dateTime.range(field);
  }

  @Override
  public int get(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    switch (field) {
      case INSTANT_SECONDS:
        throw new UnsupportedTemporalTypeException("Invalid field 'InstantSeconds' for get() method, use getLong() instead");
      case OFFSET_SECONDS:
        return getOffset().getTotalSeconds();
      default:
        return dateTime.get(field);
    }
  }

  @Override
  public long getLong(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    switch (field) {
      case INSTANT_SECONDS: return toEpochSecond();
      case OFFSET_SECONDS:  return getOffset().getTotalSeconds();
      default:
        return dateTime.getLong(field);
    }
  }

  public ZoneOffset getOffset()
  {
    return offset;
  }

  public OffsetDateTime withOffsetSameLocal(ZoneOffset offset)
  {
    return with(dateTime, offset);
  }

  public OffsetDateTime withOffsetSameInstant(ZoneOffset offset)
  {
    if (offset.equals(this.offset))
      return this;

    int             difference = offset.getTotalSeconds() - this.offset.getTotalSeconds();
    LocalDateTime   adjusted = dateTime.plusSeconds(difference);

    return new OffsetDateTime(adjusted, offset);
  }

  public LocalDateTime toLocalDateTime()
  {
    return dateTime;
  }

  public LocalDate toLocalDate()
  {
    return dateTime.toLocalDate();
  }

  public LocalTime toLocalTime()
  {
    return dateTime.toLocalTime();
  }

  public int getYear()
  {
    return dateTime.getYear();
  }

  public int getMonthValue()
  {
    return dateTime.getMonthValue();
  }

  public Month getMonth()
  {
    return dateTime.getMonth();
  }

  public int getDayOfMonth()
  {
    return dateTime.getDayOfMonth();
  }

  public int getDayOfYear()
  {
    return dateTime.getDayOfYear();
  }

  public DayOfWeek getDayOfWeek()
  {
    return dateTime.getDayOfWeek();
  }

  public int getHour()
  {
    return dateTime.getHour();
  }

  public int getMinute()
  {
    return dateTime.getMinute();
  }

  public int getSecond()
  {
    return dateTime.getSecond();
  }

  public int getNano()
  {
    return dateTime.getNano();
  }

  @Override
  public OffsetDateTime with(TemporalAdjuster adjuster)
  {
    if (adjuster instanceof LocalDate || adjuster instanceof LocalTime || adjuster instanceof LocalDateTime)
      return with(dateTime.with(adjuster), offset);
    else if (adjuster instanceof Instant)
      return ofInstant((Instant) adjuster, offset);
    else if (adjuster instanceof ZoneOffset)
      return with(dateTime, (ZoneOffset) adjuster);
    else if (adjuster instanceof OffsetDateTime)
      return (OffsetDateTime) adjuster;

    return (OffsetDateTime) adjuster.adjustInto(this);
  }

  @Override
  public OffsetDateTime with(ChronoField field, long newValue)
  {
    Objects.requireNonNull(field, "field");

    switch (field) {
      case INSTANT_SECONDS:
        return ofInstant(Instant.ofEpochSecond(newValue, getNano()), offset);
      case OFFSET_SECONDS:
        return with(dateTime, ZoneOffset.ofTotalSeconds(field.checkValidIntValue(newValue)));
      default:
        return with(dateTime.with(field, newValue), offset);
    }
  }

  public OffsetDateTime withYear(int year)
  {
    return with(dateTime.withYear(year), offset);
  }

  public OffsetDateTime withMonth(int month)
  {
    return with(dateTime.withMonth(month), offset);
  }

  public OffsetDateTime withDayOfMonth(int dayOfMonth)
  {
    return with(dateTime.withDayOfMonth(dayOfMonth), offset);
  }

  public OffsetDateTime withDayOfYear(int dayOfYear)
  {
    return with(dateTime.withDayOfYear(dayOfYear), offset);
  }

  public OffsetDateTime withHour(int hour)
  {
    return with(dateTime.withHour(hour), offset);
  }

  public OffsetDateTime withMinute(int minute)
  {
    return with(dateTime.withMinute(minute), offset);
  }

  public OffsetDateTime withSecond(int second)
  {
    return with(dateTime.withSecond(second), offset);
  }

  public OffsetDateTime withNano(int nanoOfSecond)
  {
    return with(dateTime.withNano(nanoOfSecond), offset);
  }

  public OffsetDateTime truncatedTo(ChronoUnit unit)
  {
    return with(dateTime.truncatedTo(unit), offset);
  }

  @Override
  public OffsetDateTime plus(long amountToAdd, ChronoUnit unit)
  {
    return with(dateTime.plus(amountToAdd, unit), offset);
  }

  public OffsetDateTime plus(Period period)
  {
    return with(dateTime.plus(period), offset);
  }

  public OffsetDateTime minus(Period period)
  {
    return with(dateTime.minus(period), offset);
  }

  public OffsetDateTime plus(Duration duration)
  {
    return with(dateTime.plus(duration), offset);
  }

  public OffsetDateTime plusYears(long years)
  {
    return with(dateTime.plusYears(years), offset);
  }

  public OffsetDateTime plusMonths(long months)
  {
    return with(dateTime.plusMonths(months), offset);
  }

  public OffsetDateTime plusWeeks(long weeks)
  {
    return with(dateTime.plusWeeks(weeks), offset);
  }

  public OffsetDateTime plusDays(long days)
  {
    return with(dateTime.plusDays(days), offset);
  }

  public OffsetDateTime plusHours(long hours)
  {
    return with(dateTime.plusHours(hours), offset);
  }

  public OffsetDateTime plusMinutes(long minutes)
  {
    return with(dateTime.plusMinutes(minutes), offset);
  }

  public OffsetDateTime plusSeconds(long seconds)
  {
    return with(dateTime.plusSeconds(seconds), offset);
  }

  public OffsetDateTime plusNanos(long nanos)
  {
    return with(dateTime.plusNanos(nanos), offset);
  }

  @Override
  public OffsetDateTime minus(long amountToSubtract, ChronoUnit unit)
  {
    return (amountToSubtract == Long.MIN_VALUE ? plus(Long.MAX_VALUE, unit).plus(1, unit) : plus(-amountToSubtract, unit));
  }

  public OffsetDateTime minus(Duration duration)
  {
    return with(dateTime.minus(duration), offset);
  }

  public OffsetDateTime minusYears(long years)
  {
    return with(dateTime.minusYears(years), offset);
  }

  public OffsetDateTime minusMonths(long months)
  {
    return with(dateTime.minusMonths(months), offset);
  }

  public OffsetDateTime minusWeeks(long weeks)
  {
    return with(dateTime.minusWeeks(weeks), offset);
  }

  public OffsetDateTime minusDays(long days)
  {
    return with(dateTime.minusDays(days), offset);
  }

  public OffsetDateTime minusHours(long hours)
  {
    return with(dateTime.minusHours(hours), offset);
  }

  public OffsetDateTime minusMinutes(long minutes)
  {
    return with(dateTime.minusMinutes(minutes), offset);
  }

  public OffsetDateTime minusSeconds(long seconds)
  {
    return with(dateTime.minusSeconds(seconds), offset);
  }

  public OffsetDateTime minusNanos(long nanos)
  {
    return with(dateTime.minusNanos(nanos), offset);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <R> R query(TemporalQuery<R> query)
  {
    if (query == TemporalQueries.offset() || query == TemporalQueries.zone())
      return (R) getOffset();
    else if (query == TemporalQueries.zoneId())
      return null;
    else if (query == TemporalQueries.localDate())
      return (R) toLocalDate();
    else if (query == TemporalQueries.localTime())
      return (R) toLocalTime();
    else if (query == TemporalQueries.chronology())
      return (R) toLocalDate().getChronology();
    else if (query == TemporalQueries.precision())
      return (R) ChronoUnit.NANOS;

    return query.queryFrom(this);
  }

  @Override
  public Temporal adjustInto(Temporal temporal)
  {
    return temporal.with(EPOCH_DAY, toLocalDate().toEpochDay())
                   .with(NANO_OF_DAY, toLocalTime().toNanoOfDay())
                   .with(OFFSET_SECONDS, getOffset().getTotalSeconds());
  }

  /**
   * The end is first moved to this value's offset, so the result counts elapsed time.
   */
  @Override
  public long until(Temporal endExclusive, ChronoUnit unit)
  {
    OffsetDateTime  end = OffsetDateTime.from(endExclusive);

    end = end.withOffsetSameInstant(offset);

    return dateTime.until(end.dateTime, unit);
  }

  public String format(DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.format(this);
  }

  public ZonedDateTime atZoneSameInstant(ZoneId zone)
  {
    return ZonedDateTime.ofInstant(dateTime, offset, zone);
  }

  public ZonedDateTime atZoneSimilarLocal(ZoneId zone)
  {
    return ZonedDateTime.ofLocal(dateTime, zone, offset);
  }

  public OffsetTime toOffsetTime()
  {
    return OffsetTime.of(dateTime.toLocalTime(), offset);
  }

  public ZonedDateTime toZonedDateTime()
  {
    return ZonedDateTime.of(dateTime, offset);
  }

  public Instant toInstant()
  {
    return dateTime.toInstant(offset);
  }

  public long toEpochSecond()
  {
    return dateTime.toEpochSecond(offset);
  }

  private static int compareInstant(OffsetDateTime datetime1, OffsetDateTime datetime2)
  {
    if (datetime1.getOffset().equals(datetime2.getOffset()))
      return datetime1.toLocalDateTime().compareTo(datetime2.toLocalDateTime());

    int   cmp = Long.compare(datetime1.toEpochSecond(), datetime2.toEpochSecond());

    if (cmp == 0)
      cmp = datetime1.toLocalTime().getNano() - datetime2.toLocalTime().getNano();

    return cmp;
  }

  @Override
  public int compareTo(OffsetDateTime other)
  {
    int   cmp = compareInstant(this, other);

    if (cmp == 0)
      cmp = toLocalDateTime().compareTo(other.toLocalDateTime());

    return cmp;
  }

  public boolean isAfter(OffsetDateTime other)
  {
    long  thisEpochSec = toEpochSecond();
    long  otherEpochSec = other.toEpochSecond();

    return thisEpochSec > otherEpochSec || (thisEpochSec == otherEpochSec && toLocalTime().getNano() > other.toLocalTime().getNano());
  }

  public boolean isBefore(OffsetDateTime other)
  {
    long  thisEpochSec = toEpochSecond();
    long  otherEpochSec = other.toEpochSecond();

    return thisEpochSec < otherEpochSec || (thisEpochSec == otherEpochSec && toLocalTime().getNano() < other.toLocalTime().getNano());
  }

  public boolean isEqual(OffsetDateTime other)
  {
    return toEpochSecond() == other.toEpochSecond() && toLocalTime().getNano() == other.toLocalTime().getNano();
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (!(obj instanceof OffsetDateTime))
      return false;

    OffsetDateTime  other = (OffsetDateTime) obj;

    return dateTime.equals(other.dateTime) && offset.equals(other.offset);
  }

  @Override
  public int hashCode()
  {
    return dateTime.hashCode() ^ offset.hashCode();
  }

  @Override
  public String toString()
  {
    return dateTime.toString() + offset.toString();
  }
}
