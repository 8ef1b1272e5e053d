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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.shetline.civiltime.format.DateTimeParseException;
import org.shetline.civiltime.temporal.ChronoUnit;
import org.shetline.civiltime.temporal.Temporal;
import org.shetline.civiltime.temporal.UnsupportedTemporalTypeException;

import static java.lang.Math.*;


/**
 * A date-based amount of years, months, and days. The three parts are kept separately and may
 * have different signs; nothing is normalized unless {@link #normalized()} is called, and days
 * are never folded into months.
 */
public final class Period
{
  public static final Period ZERO = new Period(0, 0, 0);

  private static final Pattern  PATTERN =
    Pattern.compile("([-+]?)P(?:([-+]?[0-9]+)Y)?(?:([-+]?[0-9]+)M)?(?:([-+]?[0-9]+)W)?(?:([-+]?[0-9]+)D)?",
                    Pattern.CASE_INSENSITIVE);

  private final int years;
  private final int months;
  private final int days;

  private Period(int years, int months, int days)
  {
    this.years = years;
    this.months = months;
    this.days = days;
  }

  public static Period ofYears(int years)
  {
    return create(years, 0, 0);
  }

  public static Period ofMonths(int months)
  {
    return create(0, months, 0);
  }

  public static Period ofWeeks(int weeks)
  {
    return create(0, 0, multiplyExact(weeks, 7));
  }

  public static Period ofDays(int days)
  {
    return create(0, 0, days);
  }

  public static Period of(int years, int months, int days)
  {
    return create(years, months, days);
  }

  /**
   * The period from the start date, inclusive, to the end date, exclusive. Whole months are
   * counted first and the remainder goes into days, so the sign of all three parts agrees.
   */
  public static Period between(LocalDate startDateInclusive, LocalDate endDateExclusive)
  {
    Objects.requireNonNull(startDateInclusive, "startDateInclusive");

    return startDateInclusive.until(endDateExclusive);
  }

  /**
   * Parses {@code PnYnMnWnD}. Weeks are converted to days. A leading minus negates every part.
   */
  public static Period parse(CharSequence text)
  {
    Objects.requireNonNull(text, "text");

    Matcher   matcher = PATTERN.matcher(text);

    if (matcher.matches()) {
      int       negate = ("-".equals(matcher.group(1)) ? -1 : 1);
      String    yearMatch = matcher.group(2);
      String    monthMatch = matcher.group(3);
      String    weekMatch = matcher.group(4);
      String    dayMatch = matcher.group(5);

      if (yearMatch != null || monthMatch != null || weekMatch != null || dayMatch != null) {
        try {
          int   years = parseNumber(yearMatch, negate);
          int   months = parseNumber(monthMatch, negate);
          int   weeks = parseNumber(weekMatch, negate);
          int   days = parseNumber(dayMatch, negate);

          return create(years, months, addExact(days, multiplyExact(weeks, 7)));
        }
        catch (NumberFormatException | ArithmeticException e) {
          throw new DateTimeParseException("Text cannot be parsed to a Period", text, 0, e);
        }
      }
    }

    throw new DateTimeParseException("Text cannot be parsed to a Period", text, 0);
  }

  public static DateTimeResult<Period> tryParse(CharSequence text)
  {
    return DateTimeResult.of(() -> parse(text));
  }

  private static int parseNumber(String parsed, int negate)
  {
    if (parsed == null)
      return 0;

    return multiplyExact(Integer.parseInt(parsed), negate);
  }

  private static Period create(int years, int months, int days)
  {
    if ((years | months | days) == 0)
      return ZERO;

    return new Period(years, months, days);
  }

  public long get(ChronoUnit unit)
  {
    switch (Objects.requireNonNull(unit, "unit")) {
      case YEARS:   return years;
      case MONTHS:  return months;
      case DAYS:    return days;
      default:
        throw UnsupportedTemporalTypeException.forUnit(unit);
    }
  }

  public int getYears()
  {
    return years;
  }

  public int getMonths()
  {
    return months;
  }

  public int getDays()
  {
    return days;
  }

  public boolean isZero()
  {
    return this == ZERO;
  }

  public boolean isNegative()
  {
    return years < 0 || months < 0 || days < 0;
  }

  public Period withYears(int years)
  {
    return years == this.years ? this : create(years, months, days);
  }

  public Period withMonths(int months)
  {
    return months == this.months ? this : create(years, months, days);
  }

  public Period withDays(int days)
  {
    return days == this.days ? this : create(years, months, days);
  }

  public Period plus(Period amount)
  {
    Objects.requireNonNull(amount, "amount");

    return create(addExact(years, amount.years), addExact(months, amount.months), addExact(days, amount.days));
  }

  public Period plusYears(long yearsToAdd)
  {
    return yearsToAdd == 0 ? this : create(toIntExact(addExact(years, yearsToAdd)), months, days);
  }

  public Period plusMonths(long monthsToAdd)
  {
    return monthsToAdd == 0 ? this : create(years, toIntExact(addExact(months, monthsToAdd)), days);
  }

  public Period plusDays(long daysToAdd)
  {
    return daysToAdd == 0 ? this : create(years, months, toIntExact(addExact(days, daysToAdd)));
  }

  public Period minus(Period amount)
  {
    Objects.requireNonNull(amount, "amount");

    return create(subtractExact(years, amount.years), subtractExact(months, amount.months),
                  subtractExact(days, amount.days));
  }

  public Period minusYears(long yearsToSubtract)
  {
    return (yearsToSubtract == Long.MIN_VALUE ? plusYears(Long.MAX_VALUE).plusYears(1) : plusYears(-yearsToSubtract));
  }

  public Period minusMonths(long monthsToSubtract)
  {
    return (monthsToSubtract == Long.MIN_VALUE ? plusMonths(Long.MAX_VALUE).plusMonths(1) : plusMonths(-monthsToSubtract));
  }

  public Period minusDays(long daysToSubtract)
  {
    return (daysToSubtract == Long.MIN_VALUE ? plusDays(Long.MAX_VALUE).plusDays(1) : plusDays(-daysToSubtract));
  }

  public Period multipliedBy(int scalar)
  {
    if (this == ZERO || scalar == 1)
      return this;

    return create(multiplyExact(years, scalar), multiplyExact(months, scalar), multiplyExact(days, scalar));
  }

  public Period negated()
  {
    return multipliedBy(-1);
  }

  /**
   * Moves whole years out of the months part, leaving months in the range -11 to 11 with the
   * sign of the total. Days are untouched.
   */
  public Period normalized()
  {
    long  totalMonths = toTotalMonths();
    long  splitYears = totalMonths / 12;
    int   splitMonths = (int) (totalMonths % 12);

    if (splitYears == years && splitMonths == months)
      return this;

    return create(toIntExact(splitYears), splitMonths, days);
  }

  public long toTotalMonths()
  {
    return years * 12L + months;
  }

  public Temporal addTo(Temporal temporal)
  {
    Objects.requireNonNull(temporal, "temporal");

    if (years != 0 && months != 0)
      temporal = temporal.plus(toTotalMonths(), ChronoUnit.MONTHS);
    else if (years != 0)
      temporal = temporal.plus(years, ChronoUnit.YEARS);
    else if (months != 0)
      temporal = temporal.plus(months, ChronoUnit.MONTHS);

    if (days != 0)
      temporal = temporal.plus(days, ChronoUnit.DAYS);

    return temporal;
  }

  public Temporal subtractFrom(Temporal temporal)
  {
    Objects.requireNonNull(temporal, "temporal");

    if (years != 0 && months != 0)
      temporal = temporal.minus(toTotalMonths(), ChronoUnit.MONTHS);
    else if (years != 0)
      temporal = temporal.minus(years, ChronoUnit.YEARS);
    else if (months != 0)
      temporal = temporal.minus(months, ChronoUnit.MONTHS);

    if (days != 0)
      temporal = temporal.minus(days, ChronoUnit.DAYS);

    return temporal;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (obj instanceof Period) {
      Period  other = (Period) obj;

      return years == other.years && months == other.months && days == other.days;
    }

    return false;
  }

  @Override
  public int hashCode()
  {
    return years + Integer.rotateLeft(months, 8) + Integer.rotateLeft(days, 16);
  }

  @Override
  public String toString()
  {
    if (this == ZERO)
      return "P0D";

    StringBuilder   buf = new StringBuilder(16);

    buf.append('P');

    if (years != 0)
      buf.append(years).append('Y');

    if (months != 0)
      buf.append(months).append('M');

    if (days != 0)
      buf.append(days).append('D');

    return buf.toString();
  }
}
