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

package org.shetline.civiltime.chrono;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.shetline.civiltime.DateTimeException;
import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.ZoneId;
import org.shetline.civiltime.temporal.ChronoField;
import org.shetline.civiltime.temporal.TemporalAccessor;
import org.shetline.civiltime.temporal.TemporalQueries;
import org.shetline.civiltime.temporal.ValueRange;

import static org.shetline.civiltime.temporal.ChronoField.YEAR_OF_ERA;


/**
 * A calendar system. The set of chronologies is closed: ISO, Minguo, Thai Buddhist and Japanese.
 * Every chronology counts days on the same epoch-day axis as {@link LocalDate}; the non-ISO ones
 * differ only in how years and eras are numbered.
 */
public abstract class Chronology implements Comparable<Chronology>
{
  private static class Registry
  {
    private static final Set<Chronology>          ALL;
    private static final Map<String, Chronology>  BY_ID_OR_TYPE = new HashMap<>();

    static {
      List<Chronology>  list = Arrays.asList(IsoChronology.INSTANCE, MinguoChronology.INSTANCE,
                                             ThaiBuddhistChronology.INSTANCE, JapaneseChronology.INSTANCE);

      for (Chronology chrono : list) {
        BY_ID_OR_TYPE.put(chrono.getId(), chrono);
        BY_ID_OR_TYPE.put(chrono.getCalendarType(), chrono);
      }

      ALL = Collections.unmodifiableSet(new LinkedHashSet<>(list));
    }
  }

  Chronology()
  {
  }

  public static Chronology of(String id)
  {
    Objects.requireNonNull(id, "id");

    Chronology  chrono = Registry.BY_ID_OR_TYPE.get(id);

    if (chrono == null)
      throw new DateTimeException("Unknown chronology: " + id);

    return chrono;
  }

  public static Set<Chronology> getAvailableChronologies()
  {
    return Registry.ALL;
  }

  public static Chronology from(TemporalAccessor temporal)
  {
    Objects.requireNonNull(temporal, "temporal");

    Chronology  chrono = temporal.query(TemporalQueries.chronology());

    return chrono != null ? chrono : IsoChronology.INSTANCE;
  }

  public abstract String getId();

  public abstract String getCalendarType();

  public ChronoLocalDate date(Era era, int yearOfEra, int month, int dayOfMonth)
  {
    return date(prolepticYear(era, yearOfEra), month, dayOfMonth);
  }

  public abstract ChronoLocalDate date(int prolepticYear, int month, int dayOfMonth);

  public ChronoLocalDate dateYearDay(Era era, int yearOfEra, int dayOfYear)
  {
    return dateYearDay(prolepticYear(era, yearOfEra), dayOfYear);
  }

  public abstract ChronoLocalDate dateYearDay(int prolepticYear, int dayOfYear);

  public abstract ChronoLocalDate dateEpochDay(long epochDay);

  public ChronoLocalDate date(TemporalAccessor temporal)
  {
    return dateEpochDay(LocalDate.from(temporal).toEpochDay());
  }

  public ChronoLocalDate dateNow()
  {
    return date(LocalDate.now());
  }

  public ChronoLocalDate dateNow(ZoneId zone)
  {
    return date(LocalDate.now(zone));
  }

  public abstract boolean isLeapYear(long prolepticYear);

  public abstract int prolepticYear(Era era, int yearOfEra);

  public abstract Era eraOf(int eraValue);

  public abstract List<Era> eras();

  public abstract ValueRange range(ChronoField field);

  // Hooks used by ChronoDate for the non-ISO chronologies.

  ChronoDate ofIso(LocalDate isoDate)
  {
    throw new UnsupportedOperationException(getId() + " dates are not wrapped");
  }

  int prolepticYear(LocalDate isoDate)
  {
    return isoDate.getYear();
  }

  Era era(LocalDate isoDate)
  {
    return isoDate.getEra();
  }

  int yearOfEra(LocalDate isoDate)
  {
    return isoDate.get(YEAR_OF_ERA);
  }

  ValueRange yearOfEraRange(LocalDate isoDate)
  {
    return range(YEAR_OF_ERA);
  }

  /**
   * The ISO date with the given proleptic year and the month and day of the given ISO date, the
   * day clamped to the month's length.
   */
  LocalDate withProlepticYear(LocalDate isoDate, long prolepticYear)
  {
    return isoDate.withYear(Math.toIntExact(prolepticYear));
  }

  @Override
  public int compareTo(Chronology other)
  {
    return getId().compareTo(other.getId());
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (obj instanceof Chronology)
      return getId().equals(((Chronology) obj).getId());

    return false;
  }

  @Override
  public int hashCode()
  {
    return getClass().hashCode() ^ getId().hashCode();
  }

  @Override
  public String toString()
  {
    return getId();
  }
}
