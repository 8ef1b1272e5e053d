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

import java.util.List;
import java.util.Objects;

import org.shetline.civiltime.format.DateTimeFormatter;
import org.shetline.civiltime.temporal.*;
import org.shetline.civiltime.zone.ZoneOffsetTransition;
import org.shetline.civiltime.zone.ZoneRules;

import static org.shetline.civiltime.temporal.ChronoField.*;


/**
 * A date-time in a time zone, such as {@code 2008-10-26T01:30+01:00[Europe/London]}.
 * <p>
 * The offset is always one of the offsets the zone's rules allow for the local date-time. Each
 * factory and adjustment reconciles the two:
 * <ul>
 *   <li>a local time inside a gap moves forward by the length of the gap and takes the offset
 *       after it;</li>
 *   <li>a local time inside an overlap keeps a preferred offset when it is still valid, and
 *       otherwise takes the earlier offset, the one in force before the transition.</li>
 * </ul>
 * Date units and field changes work on the local time-line and are reconciled this way afterwards.
 * Time units (hours down to nanoseconds) and durations work on the instant time-line.
 */
public final class ZonedDateTime implements Temporal, Comparable<ZonedDateTime>
{
  private final LocalDateTime dateTime;
  private final ZoneOffset    offset;
  private final ZoneId        zone;

  private ZonedDateTime(LocalDateTime dateTime, ZoneOffset offset, ZoneId zone)
  {
    this.dateTime = dateTime;
    this.offset = offset;
    this.zone = zone;
  }

  public static ZonedDateTime now()
  {
    return now(ZoneId.systemDefault());
  }

  public static ZonedDateTime now(ZoneId zone)
  {
    return ofInstant(Instant.now(), zone);
  }

  public static ZonedDateTime of(LocalDate date, LocalTime time, ZoneId zone)
  {
    return of(LocalDateTime.of(date, time), zone);
  }

  public static ZonedDateTime of(LocalDateTime localDateTime, ZoneId zone)
  {
    return ofLocal(localDateTime, zone, null);
  }

  public static ZonedDateTime of(int year, int month, int dayOfMonth, int hour, int minute, int second, int nanoOfSecond,
                                 ZoneId zone)
  {
    LocalDateTime   dt = LocalDateTime.of(year, month, dayOfMonth, hour, minute, second, nanoOfSecond);

    return ofLocal(dt, zone, null);
  }

  /**
   * Lenient creation from a local date-time. The preferred offset, which may be null, only
   * matters when the local date-time falls in an overlap.
   */
  public static ZonedDateTime ofLocal(LocalDateTime localDateTime, ZoneId zone, ZoneOffset preferredOffset)
  {
    Objects.requireNonNull(localDateTime, "localDateTime");
    Objects.requireNonNull(zone, "zone");

    if (zone instanceof ZoneOffset)
      return new ZonedDateTime(localDateTime, (ZoneOffset) zone, zone);

    ZoneRules         rules = zone.getRules();
    List<ZoneOffset>  validOffsets = rules.getValidOffsets(localDateTime);
    ZoneOffset        offset;

    if (validOffsets.size() == 1)
      offset = validOffsets.get(0);
    else if (validOffsets.size() == 0) {
      ZoneOffsetTransition  trans = rules.getTransition(localDateTime);

      localDateTime = localDateTime.plusSeconds(trans.getDuration().getSeconds());
      offset = trans.getOffsetAfter();
    }
    else {
      if (preferredOffset != null && validOffsets.contains(preferredOffset))
        offset = preferredOffset;
      else
        offset = Objects.requireNonNull(validOffsets.get(0), "offset");
    }

    return new ZonedDateTime(localDateTime, offset, zone);
  }

  public static ZonedDateTime ofInstant(Instant instant, ZoneId zone)
  {
    Objects.requireNonNull(instant, "instant");
    Objects.requireNonNull(zone, "zone");

    return create(instant.getEpochSecond(), instant.getNano(), zone);
  }

  public static ZonedDateTime ofInstant(LocalDateTime localDateTime, ZoneOffset offset, ZoneId zone)
  {
    Objects.requireNonNull(localDateTime, "localDateTime");
    Objects.requireNonNull(offset, "offset");
    Objects.requireNonNull(zone, "zone");

    if (zone.getRules().isValidOffset(localDateTime, offset))
      return new ZonedDateTime(localDateTime, offset, zone);

    return create(localDateTime.toEpochSecond(offset), localDateTime.getNano(), zone);
  }

  private static ZonedDateTime create(long epochSecond, int nanoOfSecond, ZoneId zone)
  {
    ZoneRules       rules = zone.getRules();
    Instant         instant = Instant.ofEpochSecond(epochSecond, nanoOfSecond);
    ZoneOffset      offset = rules.getOffset(instant);
    LocalDateTime   ldt = LocalDateTime.ofEpochSecond(epochSecond, nanoOfSecond, offset);

    return new ZonedDateTime(ldt, offset, zone);
  }

  /**
   * Strict creation: the offset must be valid for the local date-time in the zone, otherwise a
   * {@link DateTimeErrorKind#ZONE_RECONCILIATION} error is thrown whose message tells a gap apart
   * from an offset that is merely wrong.
   */
  public static ZonedDateTime ofStrict(LocalDateTime localDateTime, ZoneOffset offset, ZoneId zone)
  {
    Objects.requireNonNull(localDateTime, "localDateTime");
    Objects.requireNonNull(offset, "offset");
    Objects.requireNonNull(zone, "zone");

    ZoneRules   rules = zone.getRules();

    if (!rules.isValidOffset(localDateTime, offset)) {
      ZoneOffsetTransition  trans = rules.getTransition(localDateTime);

      if (trans != null && trans.isGap())
        throw new DateTimeException(DateTimeErrorKind.ZONE_RECONCILIATION,
          "LocalDateTime '" + localDateTime + "' does not exist in zone '" + zone +
          "' due to a gap in the local time-line, typically caused by daylight savings");

      throw new DateTimeException(DateTimeErrorKind.ZONE_RECONCILIATION,
        "ZoneOffset '" + offset + "' is not valid for LocalDateTime '" + localDateTime + "' in zone '" + zone + "'");
    }

    return new ZonedDateTime(localDateTime, offset, zone);
  }

  public static DateTimeResult<ZonedDateTime> tryOfStrict(LocalDateTime localDateTime, ZoneOffset offset, ZoneId zone)
  {
    return DateTimeResult.of(() -> ofStrict(localDateTime, offset, zone));
  }

  public static ZonedDateTime from(TemporalAccessor temporal)
  {
    if (temporal instanceof ZonedDateTime)
      return (ZonedDateTime) temporal;

    Objects.requireNonNull(temporal, "temporal");

    try {
      ZoneId  zone = ZoneId.from(temporal);

      if (temporal.isSupported(INSTANT_SECONDS)) {
        long  epochSecond = temporal.getLong(INSTANT_SECONDS);
        int   nanoOfSecond = temporal.get(NANO_OF_SECOND);

        return create(epochSecond, nanoOfSecond, zone);
      }
      else {
        LocalDate   date = LocalDate.from(temporal);
        LocalTime   time = LocalTime.from(temporal);

        return of(date, time, zone);
      }
    }
    catch (DateTimeException e) {
      throw new DateTimeException("Unable to obtain ZonedDateTime from TemporalAccessor: " +
                                  temporal + " of type " + temporal.getClass().getName(), e);
    }
  }

  public static ZonedDateTime parse(CharSequence text)
  {
    return parse(text, DateTimeFormatter.ISO_ZONED_DATE_TIME);
  }

  public static ZonedDateTime parse(CharSequence text, DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.parse(text, ZonedDateTime::from);
  }

  public static DateTimeResult<ZonedDateTime> tryParse(CharSequence text)
  {
    return DateTimeResult.of(() -> parse(text));
  }

  private ZonedDateTime resolveLocal(LocalDateTime newDateTime)
  {
    return ofLocal(newDateTime, zone, offset);
  }

  private ZonedDateTime resolveInstant(LocalDateTime newDateTime)
  {
    return ofInstant(newDateTime, offset, zone);
  }

  private ZonedDateTime resolveOffset(ZoneOffset offset)
  {
    if (!offset.equals(this.offset) && zone.getRules().isValidOffset(dateTime, offset))
      return new ZonedDateTime(dateTime, offset, zone);

    return this;
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

  public ZoneId getZone()
  {
    return zone;
  }

  public ZonedDateTime withEarlierOffsetAtOverlap()
  {
    ZoneOffsetTransition  trans = getZone().getRules().getTransition(dateTime);

    if (trans != null && trans.isOverlap()) {
      ZoneOffset  earlierOffset = trans.getOffsetBefore();

      if (!earlierOffset.equals(offset))
        return new ZonedDateTime(dateTime, earlierOffset, zone);
    }

    return this;
  }

  public ZonedDateTime withLaterOffsetAtOverlap()
  {
    ZoneOffsetTransition  trans = getZone().getRules().getTransition(dateTime);

    if (trans != null && trans.isOverlap()) {
      ZoneOffset  laterOffset = trans.getOffsetAfter();

      if (!laterOffset.equals(offset))
        return new ZonedDateTime(dateTime, laterOffset, zone);
    }

    return this;
  }

  /**
   * Same local date-time in another zone, keeping the current offset where the new zone allows
   * it.
   */
  public ZonedDateTime withZoneSameLocal(ZoneId zone)
  {
    Objects.requireNonNull(zone, "zone");

    return this.zone.equals(zone) ? this : ofLocal(dateTime, zone, offset);
  }

  public ZonedDateTime withZoneSameInstant(ZoneId zone)
  {
    Objects.requireNonNull(zone, "zone");

    return this.zone.equals(zone) ? this : create(dateTime.toEpochSecond(offset), dateTime.getNano(), zone);
  }

  public ZonedDateTime withFixedOffsetZone()
  {
    return zone.equals(offset) ? this : new ZonedDateTime(dateTime, offset, offset);
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
  public ZonedDateTime with(TemporalAdjuster adjuster)
  {
    if (adjuster instanceof LocalDate)
      return resolveLocal(LocalDateTime.of((LocalDate) adjuster, dateTime.toLocalTime()));
    else if (adjuster instanceof LocalTime)
      return resolveLocal(LocalDateTime.of(dateTime.toLocalDate(), (LocalTime) adjuster));
    else if (adjuster instanceof LocalDateTime)
      return resolveLocal((LocalDateTime) adjuster);
    else if (adjuster instanceof OffsetDateTime) {
      OffsetDateTime  odt = (OffsetDateTime) adjuster;

      return ofLocal(odt.toLocalDateTime(), zone, odt.getOffset());
    }
    else if (adjuster instanceof Instant) {
      Instant   instant = (Instant) adjuster;

      return create(instant.getEpochSecond(), instant.getNano(), zone);
    }
    else if (adjuster instanceof ZoneOffset)
      return resolveOffset((ZoneOffset) adjuster);

    return (ZonedDateTime) adjuster.adjustInto(this);
  }

  @Override
  public ZonedDateTime with(ChronoField field, long newValue)
  {
    Objects.requireNonNull(field, "field");

    switch (field) {
      case INSTANT_SECONDS:
        return create(newValue, getNano(), zone);
      case OFFSET_SECONDS:
        return resolveOffset(ZoneOffset.ofTotalSeconds(field.checkValidIntValue(newValue)));
      default:
        return resolveLocal(dateTime.with(field, newValue));
    }
  }

  public ZonedDateTime withYear(int year)
  {
    return resolveLocal(dateTime.withYear(year));
  }

  public ZonedDateTime withMonth(int month)
  {
    return resolveLocal(dateTime.withMonth(month));
  }

  public ZonedDateTime withDayOfMonth(int dayOfMonth)
  {
    return resolveLocal(dateTime.withDayOfMonth(dayOfMonth));
  }

  public ZonedDateTime withDayOfYear(int dayOfYear)
  {
    return resolveLocal(dateTime.withDayOfYear(dayOfYear));
  }

  public ZonedDateTime withHour(int hour)
  {
    return resolveLocal(dateTime.withHour(hour));
  }

  public ZonedDateTime withMinute(int minute)
  {
    return resolveLocal(dateTime.withMinute(minute));
  }

  public ZonedDateTime withSecond(int second)
  {
    return resolveLocal(dateTime.withSecond(second));
  }

  public ZonedDateTime withNano(int nanoOfSecond)
  {
    return resolveLocal(dateTime.withNano(nanoOfSecond));
  }

  public ZonedDateTime truncatedTo(ChronoUnit unit)
  {
    return resolveLocal(dateTime.truncatedTo(unit));
  }

  @Override
  public ZonedDateTime plus(long amountToAdd, ChronoUnit unit)
  {
    Objects.requireNonNull(unit, "unit");

    if (unit.isDateBased())
      return resolveLocal(dateTime.plus(amountToAdd, unit));
    else
      return resolveInstant(dateTime.plus(amountToAdd, unit));
  }

  public ZonedDateTime plus(Period period)
  {
    return resolveLocal(dateTime.plus(period));
  }

  public ZonedDateTime plus(Duration duration)
  {
    return resolveInstant(dateTime.plus(duration));
  }

  public ZonedDateTime plusYears(long years)
  {
    return resolveLocal(dateTime.plusYears(years));
  }

  public ZonedDateTime plusMonths(long months)
  {
    return resolveLocal(dateTime.plusMonths(months));
  }

  public ZonedDateTime plusWeeks(long weeks)
  {
    return resolveLocal(dateTime.plusWeeks(weeks));
  }

  public ZonedDateTime plusDays(long days)
  {
    return resolveLocal(dateTime.plusDays(days));
  }

  public ZonedDateTime plusHours(long hours)
  {
    return resolveInstant(dateTime.plusHours(hours));
  }

  public ZonedDateTime plusMinutes(long minutes)
  {
    return resolveInstant(dateTime.plusMinutes(minutes));
  }

  public ZonedDateTime plusSeconds(long seconds)
  {
    return resolveInstant(dateTime.plusSeconds(seconds));
  }

  public ZonedDateTime plusNanos(long nanos)
  {
    return resolveInstant(dateTime.plusNanos(nanos));
  }

  @Override
  public ZonedDateTime minus(long amountToSubtract, ChronoUnit unit)
  {
    return (amountToSubtract == Long.MIN_VALUE ? plus(Long.MAX_VALUE, unit).plus(1, unit) : plus(-amountToSubtract, unit));
  }

  public ZonedDateTime minus(Period period)
  {
    return resolveLocal(dateTime.minus(period));
  }

  public ZonedDateTime minus(Duration duration)
  {
    return resolveInstant(dateTime.minus(duration));
  }

  public ZonedDateTime minusYears(long years)
  {
    return (years == Long.MIN_VALUE ? plusYears(Long.MAX_VALUE).plusYears(1) : plusYears(-years));
  }

  public ZonedDateTime minusMonths(long months)
  {
    return (months == Long.MIN_VALUE ? plusMonths(Long.MAX_VALUE).plusMonths(1) : plusMonths(-months));
  }

  public ZonedDateTime minusWeeks(long weeks)
  {
    return (weeks == Long.MIN_VALUE ? plusWeeks(Long.MAX_VALUE).plusWeeks(1) : plusWeeks(-weeks));
  }

  public ZonedDateTime minusDays(long days)
  {
    return (days == Long.MIN_VALUE ? plusDays(Long.MAX_VALUE).plusDays(1) : plusDays(-days));
  }

  public ZonedDateTime minusHours(long hours)
  {
    return (hours == Long.MIN_VALUE ? plusHours(Long.MAX_VALUE).plusHours(1) : plusHours(-hours));
  }

  public ZonedDateTime minusMinutes(long minutes)
  {
    return (minutes == Long.MIN_VALUE ? plusMinutes(Long.MAX_VALUE).plusMinutes(1) : plusMinutes(-minutes));
  }

  public ZonedDateTime minusSeconds(long seconds)
  {
    return (seconds == Long.MIN_VALUE ? plusSeconds(Long.MAX_VALUE).plusSeconds(1) : plusSeconds(-seconds));
  }

  public ZonedDateTime minusNanos(long nanos)
  {
    return (nanos == Long.MIN_VALUE ? plusNanos(Long.MAX_VALUE).plusNanos(1) : plusNanos(-nanos));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <R> R query(TemporalQuery<R> query)
  {
    if (query == TemporalQueries.zoneId() || query == TemporalQueries.zone())
      return (R) getZone();
    else if (query == TemporalQueries.offset())
      return (R) getOffset();
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

  /**
   * Date units are counted on the local time-line, after moving the end into this zone; time
   * units count elapsed time.
   */
  @Override
  public long until(Temporal endExclusive, ChronoUnit unit)
  {
    ZonedDateTime   end = ZonedDateTime.from(endExclusive);

    Objects.requireNonNull(unit, "unit");

    if (unit.isDateBased()) {
      end = end.withZoneSameInstant(zone);

      return dateTime.until(end.dateTime, unit);
    }
    else
      return toOffsetDateTime().until(end.toOffsetDateTime(), unit);
  }

  public String format(DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.format(this);
  }

  public OffsetDateTime toOffsetDateTime()
  {
    return OffsetDateTime.of(dateTime, offset);
  }

  public Instant toInstant()
  {
    return Instant.ofEpochSecond(toEpochSecond(), getNano());
  }

  public long toEpochSecond()
  {
    return dateTime.toEpochSecond(offset);
  }

  @Override
  public int compareTo(ZonedDateTime other)
  {
    int   cmp = Long.compare(toEpochSecond(), other.toEpochSecond());

    if (cmp == 0) {
      cmp = getNano() - other.getNano();

      if (cmp == 0) {
        cmp = dateTime.compareTo(other.dateTime);

        if (cmp == 0)
          cmp = zone.getId().compareTo(other.zone.getId());
      }
    }

    return cmp;
  }

  public boolean isAfter(ZonedDateTime other)
  {
    long  thisEpochSec = toEpochSecond();
    long  otherEpochSec = other.toEpochSecond();

    return thisEpochSec > otherEpochSec || (thisEpochSec == otherEpochSec && getNano() > other.getNano());
  }

  public boolean isBefore(ZonedDateTime other)
  {
    long  thisEpochSec = toEpochSecond();
    long  otherEpochSec = other.toEpochSecond();

    return thisEpochSec < otherEpochSec || (thisEpochSec == otherEpochSec && getNano() < other.getNano());
  }

  public boolean isEqual(ZonedDateTime other)
  {
    return toEpochSecond() == other.toEpochSecond() && getNano() == other.getNano();
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (!(obj instanceof ZonedDateTime))
      return false;

    ZonedDateTime   other = (ZonedDateTime) obj;

    return dateTime.equals(other.dateTime) && offset.equals(other.offset) && zone.equals(other.zone);
  }

  @Override
  public int hashCode()
  {
    return dateTime.hashCode() ^ offset.hashCode() ^ Integer.rotateLeft(zone.hashCode(), 3);
  }

  @Override
  public String toString()
  {
    String  str = dateTime.toString() + offset.toString();

    if (offset != zone)
      str += '[' + zone.toString() + ']';

    return str;
  }
}
