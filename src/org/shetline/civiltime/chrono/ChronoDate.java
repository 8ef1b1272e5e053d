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

import java.util.Objects;

import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.temporal.*;

import static java.lang.Math.addExact;
import static org.shetline.civiltime.temporal.ChronoField.*;


/**
 * A date in one of the non-ISO chronologies. It holds the equivalent ISO date and asks its
 * chronology how years and eras are numbered; day and month arithmetic is done on the ISO date.
 */
public final class ChronoDate implements ChronoLocalDate
{
  private final Chronology  chronology;
  private final LocalDate   isoDate;

  ChronoDate(Chronology chronology, LocalDate isoDate)
  {
    this.chronology = chronology;
    this.isoDate = isoDate;
  }

  @Override
  public Chronology getChronology()
  {
    return chronology;
  }

  LocalDate toIsoDate()
  {
    return isoDate;
  }

  @Override
  public Era getEra()
  {
    return chronology.era(isoDate);
  }

  public int getProlepticYear()
  {
    return chronology.prolepticYear(isoDate);
  }

  public int getYearOfEra()
  {
    return chronology.yearOfEra(isoDate);
  }

  public int getMonthValue()
  {
    return isoDate.getMonthValue();
  }

  public int getDayOfMonth()
  {
    return isoDate.getDayOfMonth();
  }

  @Override
  public boolean isLeapYear()
  {
    return isoDate.isLeapYear();
  }

  @Override
  public int lengthOfMonth()
  {
    return isoDate.lengthOfMonth();
  }

  @Override
  public int lengthOfYear()
  {
    return isoDate.lengthOfYear();
  }

  @Override
  public ValueRange range(ChronoField field)
  {
    if (!isSupported(field))
      throw UnsupportedTemporalTypeException.forField(field);

    switch (field) {
      case DAY_OF_MONTH:
      case DAY_OF_YEAR:
        return isoDate.range(field);
      case YEAR_OF_ERA:
        return chronology.yearOfEraRange(isoDate);
      default:
        return chronology.range(field);
    }
  }

  @Override
  public long getLong(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    switch (field) {
      case PROLEPTIC_MONTH: return getProlepticYear() * 12L + isoDate.getMonthValue() - 1;
      case YEAR:            return getProlepticYear();
      case YEAR_OF_ERA:     return getYearOfEra();
      case ERA:             return getEra().getValue();
      default:
        if (!isSupported(field))
          throw UnsupportedTemporalTypeException.forField(field);

        return isoDate.getLong(field);
    }
  }

  @Override
  public long toEpochDay()
  {
    return isoDate.toEpochDay();
  }

  @Override
  public ChronoDate with(TemporalAdjuster adjuster)
  {
    return (ChronoDate) ChronoLocalDate.super.with(adjuster);
  }

  @Override
  public ChronoDate with(ChronoField field, long newValue)
  {
    Objects.requireNonNull(field, "field");

    if (!isSupported(field))
      throw UnsupportedTemporalTypeException.forField(field);

    range(field).checkValidValue(newValue, field);

    if (getLong(field) == newValue)
      return this;

    switch (field) {
      case PROLEPTIC_MONTH:
        return plusMonths(newValue - getLong(PROLEPTIC_MONTH));
      case YEAR:
        return withIso(chronology.withProlepticYear(isoDate, newValue));
      case YEAR_OF_ERA:
        return withIso(chronology.withProlepticYear(isoDate, chronology.prolepticYear(getEra(), (int) newValue)));
      case ERA:
        return withIso(chronology.withProlepticYear(isoDate, chronology.prolepticYear(chronology.eraOf((int) newValue),
                                                                                      getYearOfEra())));
      default:
        return withIso(isoDate.with(field, newValue));
    }
  }

  @Override
  public ChronoDate plus(long amountToAdd, ChronoUnit unit)
  {
    Objects.requireNonNull(unit, "unit");

    if (unit == ChronoUnit.ERAS)
      return with(ERA, addExact(getLong(ERA), amountToAdd));
    else if (!isSupported(unit))
      throw UnsupportedTemporalTypeException.forUnit(unit);

    return withIso(isoDate.plus(amountToAdd, unit));
  }

  @Override
  public ChronoDate minus(long amountToSubtract, ChronoUnit unit)
  {
    return (ChronoDate) ChronoLocalDate.super.minus(amountToSubtract, unit);
  }

  public ChronoDate plusYears(long years)
  {
    return withIso(isoDate.plusYears(years));
  }

  public ChronoDate plusMonths(long months)
  {
    return withIso(isoDate.plusMonths(months));
  }

  public ChronoDate plusWeeks(long weeks)
  {
    return withIso(isoDate.plusWeeks(weeks));
  }

  public ChronoDate plusDays(long days)
  {
    return withIso(isoDate.plusDays(days));
  }

  @Override
  public long until(Temporal endExclusive, ChronoUnit unit)
  {
    Objects.requireNonNull(unit, "unit");

    ChronoLocalDate   end = chronology.date(endExclusive);

    if (unit == ChronoUnit.ERAS)
      return end.getLong(ERA) - getLong(ERA);

    return isoDate.until(LocalDate.ofEpochDay(end.toEpochDay()), unit);
  }

  private ChronoDate withIso(LocalDate newIsoDate)
  {
    return newIsoDate.equals(isoDate) ? this : chronology.ofIso(newIsoDate);
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (!(obj instanceof ChronoDate))
      return false;

    ChronoDate  other = (ChronoDate) obj;

    return chronology.equals(other.chronology) && isoDate.equals(other.isoDate);
  }

  @Override
  public int hashCode()
  {
    return chronology.getId().hashCode() ^ isoDate.hashCode();
  }

  @Override
  public String toString()
  {
    int   yoe = getYearOfEra();
    int   moy = getMonthValue();
    int   dom = getDayOfMonth();

    return chronology + " " + getEra() + " " + yoe + (moy < 10 ? "-0" : "-") + moy + (dom < 10 ? "-0" : "-") + dom;
  }
}
