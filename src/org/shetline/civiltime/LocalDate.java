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

import org.shetline.civiltime.chrono.ChronoLocalDate;
import org.shetline.civiltime.chrono.IsoChronology;
import org.shetline.civiltime.chrono.IsoEra;
import org.shetline.civiltime.format.DateTimeFormatter;
import org.shetline.civiltime.temporal.*;
import org.shetline.civiltime.zone.ZoneOffsetTransition;
import org.shetline.civiltime.zone.ZoneRules;

import static java.lang.Math.*;
import static org.shetline.civiltime.LocalTime.SECONDS_PER_DAY;
import static org.shetline.civiltime.temporal.ChronoField.*;


/**
 * A date in the proleptic ISO calendar, without time or offset. Years range over
 * &plusmn;999,999,999. Month and year arithmetic clamps the day-of-month to the last valid day
 * rather than carrying the overflow into the next month.
 */
public final class LocalDate implements ChronoLocalDate
{
  public static final int   MIN_YEAR = -999999999;
  public static final int   MAX_YEAR = 999999999;

  public static final LocalDate MIN = LocalDate.of(MIN_YEAR, 1, 1);
  public static final LocalDate MAX = LocalDate.of(MAX_YEAR, 12, 31);
  public static final LocalDate EPOCH = LocalDate.of(1970, 1, 1);

  private static final int  DAYS_PER_CYCLE = 146097;
  static final long         DAYS_0000_TO_1970 = (DAYS_PER_CYCLE * 5L) - (30L * 365L + 7L);

  private final int   year;
  private final short month;
  private final short day;

  private LocalDate(int year, int month, int dayOfMonth)
  {
    this.year = year;
    this.month = (short) month;
    this.day = (short) dayOfMonth;
  }

  public static LocalDate now()
  {
    return LocalDateTime.now().toLocalDate();
  }

  public static LocalDate now(ZoneId zone)
  {
    return LocalDateTime.now(zone).toLocalDate();
  }

  public static LocalDate of(int year, Month month, int dayOfMonth)
  {
    YEAR.checkValidValue(year);
    Objects.requireNonNull(month, "month");
    DAY_OF_MONTH.checkValidValue(dayOfMonth);

    return create(year, month.getValue(), dayOfMonth);
  }

  public static LocalDate of(int year, int month, int dayOfMonth)
  {
    YEAR.checkValidValue(year);
    MONTH_OF_YEAR.checkValidValue(month);
    DAY_OF_MONTH.checkValidValue(dayOfMonth);

    return create(year, month, dayOfMonth);
  }

  public static LocalDate ofYearDay(int year, int dayOfYear)
  {
    YEAR.checkValidValue(year);
    DAY_OF_YEAR.checkValidValue(dayOfYear);

    boolean   leap = IsoChronology.INSTANCE.isLeapYear(year);

    if (dayOfYear == 366 && !leap)
      throw new DateTimeException("Invalid date 'DayOfYear 366' as '" + year + "' is not a leap year");

    Month   moy = Month.of((dayOfYear - 1) / 31 + 1);
    int     monthEnd = moy.firstDayOfYear(leap) + moy.length(leap) - 1;

    if (dayOfYear > monthEnd)
      moy = moy.plus(1);

    int   dom = dayOfYear - moy.firstDayOfYear(leap) + 1;

    return new LocalDate(year, moy.getValue(), dom);
  }

  public static LocalDate ofInstant(Instant instant, ZoneId zone)
  {
    Objects.requireNonNull(instant, "instant");
    Objects.requireNonNull(zone, "zone");

    ZoneOffset  offset = zone.getRules().getOffset(instant);
    long        localSecond = instant.getEpochSecond() + offset.getTotalSeconds();
    long        localEpochDay = floorDiv(localSecond, SECONDS_PER_DAY);

    return ofEpochDay(localEpochDay);
  }

  /**
   * Converts a count of days from 1970-01-01, working in 400-year cycles counted from March 1st
   * of year 0 so that the leap day falls at the end of each cycle year.
   */
  public static LocalDate ofEpochDay(long epochDay)
  {
    EPOCH_DAY.checkValidValue(epochDay);

    long  zeroDay = epochDay + DAYS_0000_TO_1970;

    zeroDay -= 60;

    long  adjust = 0;

    if (zeroDay < 0) {
      long  adjustCycles = (zeroDay + 1) / DAYS_PER_CYCLE - 1;

      adjust = adjustCycles * 400;
      zeroDay += -adjustCycles * DAYS_PER_CYCLE;
    }

    long  yearEst = (400 * zeroDay + 591) / DAYS_PER_CYCLE;
    long  doyEst = zeroDay - (365 * yearEst + yearEst / 4 - yearEst / 100 + yearEst / 400);

    if (doyEst < 0) {
      yearEst--;
      doyEst = zeroDay - (365 * yearEst + yearEst / 4 - yearEst / 100 + yearEst / 400);
    }

    yearEst += adjust;

    int   marchDoy0 = (int) doyEst;
    int   marchMonth0 = (marchDoy0 * 5 + 2) / 153;
    int   month = (marchMonth0 + 2) % 12 + 1;
    int   dom = marchDoy0 - (marchMonth0 * 306 + 5) / 10 + 1;

    yearEst += marchMonth0 / 10;

    return new LocalDate(YEAR.checkValidIntValue(yearEst), month, dom);
  }

  public static LocalDate from(TemporalAccessor temporal)
  {
    Objects.requireNonNull(temporal, "temporal");

    LocalDate   date = temporal.query(TemporalQueries.localDate());

    if (date == null)
      throw new DateTimeException("Unable to obtain LocalDate from TemporalAccessor: " +
                                  temporal + " of type " + temporal.getClass().getName());

    return date;
  }

  public static LocalDate parse(CharSequence text)
  {
    return parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
  }

  public static LocalDate parse(CharSequence text, DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.parse(text, LocalDate::from);
  }

  public static DateTimeResult<LocalDate> tryParse(CharSequence text)
  {
    return DateTimeResult.of(() -> parse(text));
  }

  private static LocalDate create(int year, int month, int dayOfMonth)
  {
    if (dayOfMonth > 28) {
      int   dom = 31;

      switch (month) {
        case 2:
          dom = (IsoChronology.INSTANCE.isLeapYear(year) ? 29 : 28);
          break;
        case 4:
        case 6:
        case 9:
        case 11:
          dom = 30;
          break;
        default:
          break;
      }

      if (dayOfMonth > dom) {
        if (dayOfMonth == 29)
          throw new DateTimeException("Invalid date 'February 29' as '" + year + "' is not a leap year");
        else
          throw new DateTimeException("Invalid date '" + Month.of(month).name() + " " + dayOfMonth + "'");
      }
    }

    return new LocalDate(year, month, dayOfMonth);
  }

  private static LocalDate resolvePreviousValid(int year, int month, int day)
  {
    switch (month) {
      case 2:
        day = min(day, IsoChronology.INSTANCE.isLeapYear(year) ? 29 : 28);
        break;
      case 4:
      case 6:
      case 9:
      case 11:
        day = min(day, 30);
        break;
      default:
        break;
    }

    return new LocalDate(year, month, day);
  }

  @Override
  public ValueRange range(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    if (!isSupported(field))
      throw UnsupportedTemporalTypeException.forField(field);

    switch (field) {
      case DAY_OF_MONTH: return ValueRange.of(1, lengthOfMonth());
      case DAY_OF_YEAR:  return ValueRange.of(1, lengthOfYear());
      case YEAR_OF_ERA:  return (getYear() <= 0 ? ValueRange.of(1, MAX_YEAR + 1) : ValueRange.of(1, MAX_YEAR));
      default:
        return field.range();
    }
  }

  @Override
  public int get(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    if (field == EPOCH_DAY || field == PROLEPTIC_MONTH)
      throw new UnsupportedTemporalTypeException("Invalid field '" + field + "' for get() method, use getLong() instead");

    return (int) getLong(field);
  }

  @Override
  public long getLong(ChronoField field)
  {
    switch (Objects.requireNonNull(field, "field")) {
      case DAY_OF_WEEK:     return getDayOfWeek().getValue();
      case DAY_OF_MONTH:    return day;
      case DAY_OF_YEAR:     return getDayOfYear();
      case EPOCH_DAY:       return toEpochDay();
      case MONTH_OF_YEAR:   return month;
      case PROLEPTIC_MONTH: return getProlepticMonth();
      case YEAR_OF_ERA:     return (year >= 1 ? year : 1 - year);
      case YEAR:            return year;
      case ERA:             return (year >= 1 ? 1 : 0);
      default:
        throw UnsupportedTemporalTypeException.forField(field);
    }
  }

  private long getProlepticMonth()
  {
    return (year * 12L + month - 1);
  }

  @Override
  public IsoChronology getChronology()
  {
    return IsoChronology.INSTANCE;
  }

  @Override
  public IsoEra getEra()
  {
    return (getYear() >= 1 ? IsoEra.CE : IsoEra.BCE);
  }

  public int getYear()
  {
    return year;
  }

  public int getMonthValue()
  {
    return month;
  }

  public Month getMonth()
  {
    return Month.of(month);
  }

  public int getDayOfMonth()
  {
    return day;
  }

  public int getDayOfYear()
  {
    return getMonth().firstDayOfYear(isLeapYear()) + day - 1;
  }

  public DayOfWeek getDayOfWeek()
  {
    int   dow0 = (int) floorMod(toEpochDay() + 3, 7);

    return DayOfWeek.of(dow0 + 1);
  }

  @Override
  public boolean isLeapYear()
  {
    return IsoChronology.INSTANCE.isLeapYear(year);
  }

  @Override
  public int lengthOfMonth()
  {
    switch (month) {
      case 2:
        return (isLeapYear() ? 29 : 28);
      case 4:
      case 6:
      case 9:
      case 11:
        return 30;
      default:
        return 31;
    }
  }

  @Override
  public int lengthOfYear()
  {
    return (isLeapYear() ? 366 : 365);
  }

  @Override
  public LocalDate with(TemporalAdjuster adjuster)
  {
    if (adjuster instanceof LocalDate)
      return (LocalDate) adjuster;

    return (LocalDate) adjuster.adjustInto(this);
  }

  @Override
  public LocalDate with(ChronoField field, long newValue)
  {
    Objects.requireNonNull(field, "field");

    if (!isSupported(field))
      throw UnsupportedTemporalTypeException.forField(field);

    field.checkValidValue(newValue);

    switch (field) {
      case DAY_OF_WEEK:     return plusDays(newValue - getDayOfWeek().getValue());
      case DAY_OF_MONTH:    return withDayOfMonth((int) newValue);
      case DAY_OF_YEAR:     return withDayOfYear((int) newValue);
      case EPOCH_DAY:       return LocalDate.ofEpochDay(newValue);
      case MONTH_OF_YEAR:   return withMonth((int) newValue);
      case PROLEPTIC_MONTH: return plusMonths(newValue - getProlepticMonth());
      case YEAR_OF_ERA:     return withYear((int) (year >= 1 ? newValue : 1 - newValue));
      case YEAR:            return withYear((int) newValue);
      case ERA:             return (getLong(ERA) == newValue ? this : withYear(1 - year));
      default:
        throw UnsupportedTemporalTypeException.forField(field);
    }
  }

  public LocalDate withYear(int year)
  {
    if (this.year == year)
      return this;

    YEAR.checkValidValue(year);

    return resolvePreviousValid(year, month, day);
  }

  public LocalDate withMonth(int month)
  {
    if (this.month == month)
      return this;

    MONTH_OF_YEAR.checkValidValue(month);

    return resolvePreviousValid(year, month, day);
  }

  public LocalDate withDayOfMonth(int dayOfMonth)
  {
    if (this.day == dayOfMonth)
      return this;

    return of(year, month, dayOfMonth);
  }

  public LocalDate withDayOfYear(int dayOfYear)
  {
    if (this.getDayOfYear() == dayOfYear)
      return this;

    return ofYearDay(year, dayOfYear);
  }

  @Override
  public LocalDate plus(long amountToAdd, ChronoUnit unit)
  {
    switch (Objects.requireNonNull(unit, "unit")) {
      case DAYS:      return plusDays(amountToAdd);
      case WEEKS:     return plusWeeks(amountToAdd);
      case MONTHS:    return plusMonths(amountToAdd);
      case YEARS:     return plusYears(amountToAdd);
      case DECADES:   return plusYears(multiplyExact(amountToAdd, 10));
      case CENTURIES: return plusYears(multiplyExact(amountToAdd, 100));
      case MILLENNIA: return plusYears(multiplyExact(amountToAdd, 1000));
      case ERAS:      return with(ERA, addExact(getLong(ERA), amountToAdd));
      default:
        throw UnsupportedTemporalTypeException.forUnit(unit);
    }
  }

  public LocalDate plus(Period period)
  {
    return (LocalDate) Objects.requireNonNull(period, "period").addTo(this);
  }

  public LocalDate plusYears(long yearsToAdd)
  {
    if (yearsToAdd == 0)
      return this;

    int   newYear = YEAR.checkValidIntValue(year + yearsToAdd);

    return resolvePreviousValid(newYear, month, day);
  }

  public LocalDate plusMonths(long monthsToAdd)
  {
    if (monthsToAdd == 0)
      return this;

    long  monthCount = year * 12L + (month - 1);
    long  calcMonths = monthCount + monthsToAdd;
    int   newYear = YEAR.checkValidIntValue(floorDiv(calcMonths, 12));
    int   newMonth = (int) floorMod(calcMonths, 12) + 1;

    return resolvePreviousValid(newYear, newMonth, day);
  }

  public LocalDate plusWeeks(long weeksToAdd)
  {
    return plusDays(multiplyExact(weeksToAdd, 7));
  }

  public LocalDate plusDays(long daysToAdd)
  {
    if (daysToAdd == 0)
      return this;

    long  dom = day + daysToAdd;

    if (dom > 0) {
      if (dom <= 28)
        return new LocalDate(year, month, (int) dom);
      else if (dom <= 59) {
        long  monthLen = lengthOfMonth();

        if (dom <= monthLen)
          return new LocalDate(year, month, (int) dom);
        else if (month < 12)
          return new LocalDate(year, month + 1, (int) (dom - monthLen));
        else {
          YEAR.checkValidValue(year + 1);

          return new LocalDate(year + 1, 1, (int) (dom - monthLen));
        }
      }
    }

    long  mjDay = addExact(toEpochDay(), daysToAdd);

    return LocalDate.ofEpochDay(mjDay);
  }

  @Override
  public LocalDate minus(long amountToSubtract, ChronoUnit unit)
  {
    return (amountToSubtract == Long.MIN_VALUE ? plus(Long.MAX_VALUE, unit).plus(1, unit) : plus(-amountToSubtract, unit));
  }

  public LocalDate minus(Period period)
  {
    return (LocalDate) Objects.requireNonNull(period, "period").subtractFrom(this);
  }

  public LocalDate minusYears(long yearsToSubtract)
  {
    return (yearsToSubtract == Long.MIN_VALUE ? plusYears(Long.MAX_VALUE).plusYears(1) : plusYears(-yearsToSubtract));
  }

  public LocalDate minusMonths(long monthsToSubtract)
  {
    return (monthsToSubtract == Long.MIN_VALUE ? plusMonths(Long.MAX_VALUE).plusMonths(1) : plusMonths(-monthsToSubtract));
  }

  public LocalDate minusWeeks(long weeksToSubtract)
  {
    return (weeksToSubtract == Long.MIN_VALUE ? plusWeeks(Long.MAX_VALUE).plusWeeks(1) : plusWeeks(-weeksToSubtract));
  }

  public LocalDate minusDays(long daysToSubtract)
  {
    return (daysToSubtract == Long.MIN_VALUE ? plusDays(Long.MAX_VALUE).plusDays(1) : plusDays(-daysToSubtract));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <R> R query(TemporalQuery<R> query)
  {
    if (query == TemporalQueries.localDate())
      return (R) this;

    return ChronoLocalDate.super.query(query);
  }

  @Override
  public long until(Temporal endExclusive, ChronoUnit unit)
  {
    LocalDate   end = LocalDate.from(endExclusive);

    switch (Objects.requireNonNull(unit, "unit")) {
      case DAYS:      return daysUntil(end);
      case WEEKS:     return daysUntil(end) / 7;
      case MONTHS:    return monthsUntil(end);
      case YEARS:     return monthsUntil(end) / 12;
      case DECADES:   return monthsUntil(end) / 120;
      case CENTURIES: return monthsUntil(end) / 1200;
      case MILLENNIA: return monthsUntil(end) / 12000;
      case ERAS:      return end.getLong(ERA) - getLong(ERA);
      default:
        throw UnsupportedTemporalTypeException.forUnit(unit);
    }
  }

  /**
   * The period up to an end date, exclusive. The parts share one sign: for a later end the
   * days part is counted from the last whole month, for an earlier end the month is given back
   * before the days are counted.
   */
  public Period until(ChronoLocalDate endDateExclusive)
  {
    LocalDate   end = LocalDate.from(endDateExclusive);
    long        totalMonths = end.getProlepticMonth() - getProlepticMonth();
    int         days = end.day - day;

    if (totalMonths > 0 && days < 0) {
      totalMonths--;
      days = (int) (end.toEpochDay() - plusMonths(totalMonths).toEpochDay());
    }
    else if (totalMonths < 0 && days > 0) {
      totalMonths++;
      days -= end.lengthOfMonth();
    }

    return Period.of(toIntExact(totalMonths / 12), (int) (totalMonths % 12), days);
  }

  long daysUntil(LocalDate end)
  {
    return end.toEpochDay() - toEpochDay();
  }

  private long monthsUntil(LocalDate end)
  {
    long  packed1 = getProlepticMonth() * 32L + getDayOfMonth();
    long  packed2 = end.getProlepticMonth() * 32L + end.getDayOfMonth();

    return (packed2 - packed1) / 32;
  }

  @Override
  public String format(DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");

    return formatter.format(this);
  }

  public LocalDateTime atTime(LocalTime time)
  {
    return LocalDateTime.of(this, time);
  }

  public LocalDateTime atTime(int hour, int minute)
  {
    return atTime(LocalTime.of(hour, minute));
  }

  public LocalDateTime atTime(int hour, int minute, int second)
  {
    return atTime(LocalTime.of(hour, minute, second));
  }

  public LocalDateTime atTime(int hour, int minute, int second, int nanoOfSecond)
  {
    return atTime(LocalTime.of(hour, minute, second, nanoOfSecond));
  }

  public OffsetDateTime atTime(OffsetTime time)
  {
    return OffsetDateTime.of(LocalDateTime.of(this, time.toLocalTime()), time.getOffset());
  }

  public LocalDateTime atStartOfDay()
  {
    return LocalDateTime.of(this, LocalTime.MIDNIGHT);
  }

  /**
   * The earliest valid time on this date in the zone. That is midnight unless midnight falls in
   * a gap, in which case it is the wall time just after the gap.
   */
  public ZonedDateTime atStartOfDay(ZoneId zone)
  {
    Objects.requireNonNull(zone, "zone");

    LocalDateTime   ldt = atTime(LocalTime.MIDNIGHT);

    if (!(zone instanceof ZoneOffset)) {
      ZoneRules             rules = zone.getRules();
      ZoneOffsetTransition  trans = rules.getTransition(ldt);

      if (trans != null && trans.isGap())
        ldt = trans.getDateTimeAfter();
    }

    return ZonedDateTime.of(ldt, zone);
  }

  @Override
  public long toEpochDay()
  {
    long  y = year;
    long  m = month;
    long  total = 0;

    total += 365 * y;

    if (y >= 0)
      total += (y + 3) / 4 - (y + 99) / 100 + (y + 399) / 400;
    else
      total -= y / -4 - y / -100 + y / -400;

    total += ((367 * m - 362) / 12);
    total += day - 1;

    if (m > 2) {
      total--;

      if (!isLeapYear())
        total--;
    }

    return total - DAYS_0000_TO_1970;
  }

  public long toEpochSecond(LocalTime time, ZoneOffset offset)
  {
    Objects.requireNonNull(time, "time");
    Objects.requireNonNull(offset, "offset");

    long  secs = toEpochDay() * SECONDS_PER_DAY + time.toSecondOfDay();

    secs -= offset.getTotalSeconds();

    return secs;
  }

  @Override
  public int compareTo(ChronoLocalDate other)
  {
    if (other instanceof LocalDate)
      return compareTo0((LocalDate) other);

    return ChronoLocalDate.super.compareTo(other);
  }

  int compareTo0(LocalDate otherDate)
  {
    int   cmp = (year - otherDate.year);

    if (cmp == 0) {
      cmp = (month - otherDate.month);

      if (cmp == 0)
        cmp = (day - otherDate.day);
    }

    return cmp;
  }

  @Override
  public boolean isAfter(ChronoLocalDate other)
  {
    if (other instanceof LocalDate)
      return compareTo0((LocalDate) other) > 0;

    return ChronoLocalDate.super.isAfter(other);
  }

  @Override
  public boolean isBefore(ChronoLocalDate other)
  {
    if (other instanceof LocalDate)
      return compareTo0((LocalDate) other) < 0;

    return ChronoLocalDate.super.isBefore(other);
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (obj instanceof LocalDate)
      return compareTo0((LocalDate) obj) == 0;

    return false;
  }

  @Override
  public int hashCode()
  {
    int   yearValue = year;
    int   monthValue = month;
    int   dayValue = day;

    return (yearValue & 0xFFFFF800) ^ ((yearValue << 11) + (monthValue << 6) + (dayValue));
  }

  @Override
  public String toString()
  {
    int             yearValue = year;
    int             monthValue = month;
    int             dayValue = day;
    int             absYear = abs(yearValue);
    StringBuilder   buf = new StringBuilder(10);

    if (absYear < 1000) {
      if (yearValue < 0)
        buf.append(yearValue - 10000).deleteCharAt(1);
      else
        buf.append(yearValue + 10000).deleteCharAt(0);
    }
    else {
      if (yearValue > 9999)
        buf.append('+');

      buf.append(yearValue);
    }

    return buf.append(monthValue < 10 ? "-0" : "-")
              .append(monthValue)
              .append(dayValue < 10 ? "-0" : "-")
              .append(dayValue)
              .toString();
  }
}
