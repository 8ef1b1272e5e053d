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

package org.shetline.civiltime.format;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import org.shetline.civiltime.DateTimeErrorKind;
import org.shetline.civiltime.DateTimeException;
import org.shetline.civiltime.Instant;
import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.LocalTime;
import org.shetline.civiltime.ZoneId;
import org.shetline.civiltime.ZoneOffset;
import org.shetline.civiltime.chrono.IsoChronology;
import org.shetline.civiltime.temporal.ChronoField;
import org.shetline.civiltime.temporal.TemporalAccessor;
import org.shetline.civiltime.temporal.TemporalQueries;
import org.shetline.civiltime.temporal.TemporalQuery;
import org.shetline.civiltime.temporal.UnsupportedTemporalTypeException;

import static org.shetline.civiltime.temporal.ChronoField.*;


/**
 * The fields, zone, date, and time gathered by a parse. Resolution combines the raw fields into
 * a date, a time, and, when an offset is also known, an instant.
 */
final class Parsed implements TemporalAccessor
{
  final Map<ChronoField, Long>  fieldValues = new EnumMap<>(ChronoField.class);
  ZoneId                        zone;
  private LocalDate             date;
  private LocalTime             time;

  Parsed copy()
  {
    Parsed  cloned = new Parsed();

    cloned.fieldValues.putAll(fieldValues);
    cloned.zone = zone;

    return cloned;
  }

  void resolve()
  {
    resolveFractions();
    resolveDate();
    resolveTime();
    resolveInstant();
  }

  private void resolveFractions()
  {
    Long  micros = fieldValues.remove(MICRO_OF_SECOND);
    Long  millis = fieldValues.remove(MILLI_OF_SECOND);

    if (micros != null)
      addFieldValue(NANO_OF_SECOND, MICRO_OF_SECOND.checkValidValue(micros) * 1000L);

    if (millis != null)
      addFieldValue(NANO_OF_SECOND, MILLI_OF_SECOND.checkValidValue(millis) * 1000000L);
  }

  private void resolveDate()
  {
    Long  yearOfEra = fieldValues.remove(YEAR_OF_ERA);
    Long  era = fieldValues.remove(ERA);

    if (yearOfEra != null) {
      long  yoe = YEAR_OF_ERA.checkValidValue(yearOfEra);

      if (era == null || era == 1)
        addFieldValue(YEAR, yoe);
      else if (era == 0)
        addFieldValue(YEAR, Math.subtractExact(1, yoe));
      else
        throw new DateTimeException("Invalid value for era: " + era);
    }
    else if (era != null)
      ERA.checkValidValue(era);

    Long  epochDay = fieldValues.remove(EPOCH_DAY);

    if (epochDay != null)
      date = LocalDate.ofEpochDay(epochDay);
    else if (fieldValues.containsKey(YEAR)) {
      int   year = YEAR.checkValidIntValue(fieldValues.get(YEAR));

      if (fieldValues.containsKey(MONTH_OF_YEAR) && fieldValues.containsKey(DAY_OF_MONTH)) {
        int   month = MONTH_OF_YEAR.checkValidIntValue(fieldValues.remove(MONTH_OF_YEAR));
        int   day = DAY_OF_MONTH.checkValidIntValue(fieldValues.remove(DAY_OF_MONTH));

        date = LocalDate.of(year, month, day);
      }
      else if (fieldValues.containsKey(DAY_OF_YEAR))
        date = LocalDate.ofYearDay(year, DAY_OF_YEAR.checkValidIntValue(fieldValues.remove(DAY_OF_YEAR)));

      if (date != null)
        fieldValues.remove(YEAR);
    }

    Long  dayOfWeek = fieldValues.get(DAY_OF_WEEK);

    if (date != null && dayOfWeek != null) {
      if (date.getDayOfWeek().getValue() != dayOfWeek)
        throw new DateTimeException("Conflict found: Field DayOfWeek " + date.getDayOfWeek().getValue() +
                                    " differs from DayOfWeek " + dayOfWeek + " derived from " + date);

      fieldValues.remove(DAY_OF_WEEK);
    }
  }

  private void resolveTime()
  {
    Long  hour = fieldValues.get(HOUR_OF_DAY);
    Long  minute = fieldValues.get(MINUTE_OF_HOUR);
    Long  second = fieldValues.get(SECOND_OF_MINUTE);
    Long  nano = fieldValues.get(NANO_OF_SECOND);

    // Lower fields without the ones above them stay unresolved.
    if (hour == null || (minute == null && (second != null || nano != null)) || (second == null && nano != null))
      return;

    time = LocalTime.of(HOUR_OF_DAY.checkValidIntValue(hour),
                        minute == null ? 0 : MINUTE_OF_HOUR.checkValidIntValue(minute),
                        second == null ? 0 : SECOND_OF_MINUTE.checkValidIntValue(second),
                        nano == null ? 0 : NANO_OF_SECOND.checkValidIntValue(nano));
    fieldValues.remove(HOUR_OF_DAY);
    fieldValues.remove(MINUTE_OF_HOUR);
    fieldValues.remove(SECOND_OF_MINUTE);
    fieldValues.remove(NANO_OF_SECOND);
  }

  private void resolveInstant()
  {
    Long  offsetSecs = fieldValues.get(OFFSET_SECONDS);

    if (offsetSecs != null)
      OFFSET_SECONDS.checkValidValue(offsetSecs);

    if (date == null || time == null || fieldValues.containsKey(INSTANT_SECONDS))
      return;

    ZoneOffset  offset = null;

    if (offsetSecs != null)
      offset = ZoneOffset.ofTotalSeconds(offsetSecs.intValue());
    else if (zone instanceof ZoneOffset)
      offset = (ZoneOffset) zone;

    if (offset == null)
      return;

    long  epochSecond = date.toEpochSecond(time, offset);

    if (zone != null && !(zone instanceof ZoneOffset)) {
      ZoneOffset  zoneOffset = zone.getRules().getOffset(Instant.ofEpochSecond(epochSecond));

      if (!zoneOffset.equals(offset))
        throw new DateTimeException(DateTimeErrorKind.ZONE_RECONCILIATION, "Offset " + offset +
                                    " does not match the offset " + zoneOffset + " of zone " + zone + " at " + date + "T" + time);
    }

    fieldValues.put(INSTANT_SECONDS, epochSecond);
  }

  private void addFieldValue(ChronoField field, long value)
  {
    Long  old = fieldValues.get(field);

    if (old != null && old != value)
      throw new DateTimeException("Conflict found: " + field + " " + old + " differs from " + field + " " + value);

    fieldValues.put(field, value);
  }

  @Override
  public boolean isSupported(ChronoField field)
  {
    if (field == null)
      return false;

    return fieldValues.containsKey(field) || (date != null && date.isSupported(field)) ||
           (time != null && time.isSupported(field));
  }

  @Override
  public long getLong(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    Long  value = fieldValues.get(field);

    if (value != null)
      return value;
    else if (date != null && date.isSupported(field))
      return date.getLong(field);
    else if (time != null && time.isSupported(field))
      return time.getLong(field);

    throw UnsupportedTemporalTypeException.forField(field);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <R> R query(TemporalQuery<R> query)
  {
    if (query == TemporalQueries.zoneId())
      return (R) zone;
    else if (query == TemporalQueries.chronology())
      return (R) IsoChronology.INSTANCE;
    else if (query == TemporalQueries.localDate())
      return (R) date;
    else if (query == TemporalQueries.localTime())
      return (R) time;
    else if (query == TemporalQueries.offset()) {
      Long  offsetSecs = fieldValues.get(OFFSET_SECONDS);

      if (offsetSecs != null)
        return (R) ZoneOffset.ofTotalSeconds(offsetSecs.intValue());

      return zone instanceof ZoneOffset ? (R) zone : null;
    }
    else if (query == TemporalQueries.zone())
      return zone != null ? (R) zone : query.queryFrom(this);
    else if (query == TemporalQueries.precision())
      return null;

    return query.queryFrom(this);
  }

  @Override
  public String toString()
  {
    StringBuilder   buf = new StringBuilder(64);

    buf.append(fieldValues).append(',').append(IsoChronology.INSTANCE);

    if (zone != null)
      buf.append(',').append(zone);

    if (date != null || time != null) {
      buf.append(" resolved to ");

      if (date != null) {
        buf.append(date);

        if (time != null)
          buf.append('T').append(time);
      }
      else
        buf.append(time);
    }

    return buf.toString();
  }
}
