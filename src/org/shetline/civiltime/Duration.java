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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.shetline.civiltime.format.DateTimeParseException;
import org.shetline.civiltime.temporal.*;

import static java.lang.Math.*;
import static org.shetline.civiltime.LocalTime.NANOS_PER_SECOND;
import static org.shetline.civiltime.LocalTime.SECONDS_PER_DAY;
import static org.shetline.civiltime.LocalTime.SECONDS_PER_HOUR;
import static org.shetline.civiltime.LocalTime.SECONDS_PER_MINUTE;
import static org.shetline.civiltime.temporal.ChronoField.*;


/**
 * A signed amount of elapsed time in seconds and nanoseconds. As with {@link Instant}, the
 * nanosecond part is kept in the range 0 to 999,999,999 and the sign lives in the seconds.
 * Arithmetic that would overflow a {@code long} count of seconds throws {@link ArithmeticException}.
 */
public final class Duration implements Comparable<Duration>
{
  public static final Duration ZERO = new Duration(0, 0);

  private static final BigInteger BI_NANOS_PER_SECOND = BigInteger.valueOf(NANOS_PER_SECOND);

  private static final Pattern  PATTERN =
    Pattern.compile("([-+]?)P(?:([-+]?[0-9]+)D)?" +
                    "(T(?:([-+]?[0-9]+)H)?(?:([-+]?[0-9]+)M)?(?:([-+]?[0-9]+)(?:[.,]([0-9]{0,9}))?S)?)?",
                    Pattern.CASE_INSENSITIVE);

  private final long  seconds;
  private final int   nanos;

  private Duration(long seconds, int nanos)
  {
    this.seconds = seconds;
    this.nanos = nanos;
  }

  public static Duration ofDays(long days)
  {
    return create(multiplyExact(days, SECONDS_PER_DAY), 0);
  }

  public static Duration ofHours(long hours)
  {
    return create(multiplyExact(hours, SECONDS_PER_HOUR), 0);
  }

  public static Duration ofMinutes(long minutes)
  {
    return create(multiplyExact(minutes, SECONDS_PER_MINUTE), 0);
  }

  public static Duration ofSeconds(long seconds)
  {
    return create(seconds, 0);
  }

  public static Duration ofSeconds(long seconds, long nanoAdjustment)
  {
    long  secs = addExact(seconds, floorDiv(nanoAdjustment, NANOS_PER_SECOND));
    int   nos = (int) floorMod(nanoAdjustment, NANOS_PER_SECOND);

    return create(secs, nos);
  }

  public static Duration ofMillis(long millis)
  {
    long  secs = millis / 1000;
    int   mos = (int) (millis % 1000);

    if (mos < 0) {
      mos += 1000;
      secs--;
    }

    return create(secs, mos * 1000000);
  }

  public static Duration ofNanos(long nanos)
  {
    long  secs = nanos / NANOS_PER_SECOND;
    int   nos = (int) (nanos % NANOS_PER_SECOND);

    if (nos < 0) {
      nos += NANOS_PER_SECOND;
      secs--;
    }

    return create(secs, nos);
  }

  public static Duration of(long amount, ChronoUnit unit)
  {
    return ZERO.plus(amount, unit);
  }

  /**
   * The duration from {@code startInclusive} to {@code endExclusive}, negative when the end is
   * earlier. The end is converted to the type of the start where they differ.
   */
  public static Duration between(Temporal startInclusive, Temporal endExclusive)
  {
    try {
      return ofNanos(startInclusive.until(endExclusive, ChronoUnit.NANOS));
    }
    catch (DateTimeException | ArithmeticException e) {
      long  secs = startInclusive.until(endExclusive, ChronoUnit.SECONDS);
      long  nanos;

      try {
        nanos = endExclusive.getLong(NANO_OF_SECOND) - startInclusive.getLong(NANO_OF_SECOND);

        if (secs > 0 && nanos < 0)
          secs++;
        else if (secs < 0 && nanos > 0)
          secs--;
      }
      catch (DateTimeException e2) {
        nanos = 0;
      }

      return ofSeconds(secs, nanos);
    }
  }

  /**
   * Parses the ISO-8601 form {@code PnDTnHnMn.nS}. Each component may carry its own sign, the
   * whole text may be negated with a leading minus, letters are case-insensitive, and up to nine
   * fraction digits follow a dot or comma.
   */
  public static Duration parse(CharSequence text)
  {
    Objects.requireNonNull(text, "text");

    Matcher   matcher = PATTERN.matcher(text);

    if (matcher.matches()) {
      // a lone "T" is not a duration
      if (!"T".equalsIgnoreCase(matcher.group(3))) {
        boolean   negate = "-".equals(matcher.group(1));
        String    dayMatch = matcher.group(2);
        String    hourMatch = matcher.group(4);
        String    minuteMatch = matcher.group(5);
        String    secondMatch = matcher.group(6);
        String    fractionMatch = matcher.group(7);

        if (dayMatch != null || hourMatch != null || minuteMatch != null || secondMatch != null) {
          long  daysAsSecs = parseNumber(text, dayMatch, SECONDS_PER_DAY, "days");
          long  hoursAsSecs = parseNumber(text, hourMatch, SECONDS_PER_HOUR, "hours");
          long  minsAsSecs = parseNumber(text, minuteMatch, SECONDS_PER_MINUTE, "minutes");
          long  seconds = parseNumber(text, secondMatch, 1, "seconds");
          int   nanos = parseFraction(text, fractionMatch, secondMatch != null && secondMatch.startsWith("-") ? -1 : 1);

          try {
            return create(negate, daysAsSecs, hoursAsSecs, minsAsSecs, seconds, nanos);
          }
          catch (ArithmeticException e) {
            throw new DateTimeParseException("Text cannot be parsed to a Duration: overflow", text, 0, e);
          }
        }
      }
    }

    throw new DateTimeParseException("Text cannot be parsed to a Duration", text, 0);
  }

  public static DateTimeResult<Duration> tryParse(CharSequence text)
  {
    return DateTimeResult.of(() -> parse(text));
  }

  private static long parseNumber(CharSequence text, String parsed, int multiplier, String errorText)
  {
    if (parsed == null)
      return 0;

    try {
      long  val = Long.parseLong(parsed);

      return multiplyExact(val, multiplier);
    }
    catch (NumberFormatException | ArithmeticException e) {
      throw new DateTimeParseException("Text cannot be parsed to a Duration: " + errorText, text, 0, e);
    }
  }

  private static int parseFraction(CharSequence text, String parsed, int negate)
  {
    if (parsed == null || parsed.length() == 0)
      return 0;

    try {
      parsed = (parsed + "000000000").substring(0, 9);

      return Integer.parseInt(parsed) * negate;
    }
    catch (NumberFormatException e) {
      throw new DateTimeParseException("Text cannot be parsed to a Duration: fraction", text, 0, e);
    }
  }

  private static Duration create(boolean negate, long daysAsSecs, long hoursAsSecs, long minsAsSecs, long secs, int nanos)
  {
    long  seconds = addExact(daysAsSecs, addExact(hoursAsSecs, addExact(minsAsSecs, secs)));

    if (negate)
      return ofSeconds(seconds, nanos).negated();

    return ofSeconds(seconds, nanos);
  }

  private static Duration create(long seconds, int nanoAdjustment)
  {
    if ((seconds | nanoAdjustment) == 0)
      return ZERO;

    return new Duration(seconds, nanoAdjustment);
  }

  private static Duration create(BigDecimal seconds)
  {
    BigInteger  nanos = seconds.movePointRight(9).toBigIntegerExact();
    BigInteger[] divRem = nanos.divideAndRemainder(BI_NANOS_PER_SECOND);

    if (divRem[0].bitLength() > 63)
      throw new ArithmeticException("Exceeds capacity of Duration: " + nanos);

    return ofSeconds(divRem[0].longValue(), divRem[1].intValue());
  }

  public long getSeconds()
  {
    return seconds;
  }

  public int getNano()
  {
    return nanos;
  }

  public boolean isZero()
  {
    return (seconds | nanos) == 0;
  }

  public boolean isNegative()
  {
    return seconds < 0;
  }

  public Duration withSeconds(long seconds)
  {
    return create(seconds, nanos);
  }

  public Duration withNanos(int nanoOfSecond)
  {
    NANO_OF_SECOND.checkValidIntValue(nanoOfSecond);

    return create(seconds, nanoOfSecond);
  }

  public Duration plus(Duration duration)
  {
    return plus(duration.getSeconds(), duration.getNano());
  }

  /**
   * Adds an amount of an exact unit. Days count as exactly 24 hours; months and longer units
   * are estimates and are rejected.
   */
  public Duration plus(long amountToAdd, ChronoUnit unit)
  {
    Objects.requireNonNull(unit, "unit");

    if (unit == ChronoUnit.DAYS)
      return plus(multiplyExact(amountToAdd, SECONDS_PER_DAY), 0);
    else if (unit.isDurationEstimated())
      throw new UnsupportedTemporalTypeException("Unit must not have an estimated duration");
    else if (amountToAdd == 0)
      return this;

    switch (unit) {
      case NANOS:   return plusNanos(amountToAdd);
      case MICROS:  return plusSeconds((amountToAdd / (1000000L * 1000)) * 1000).plusNanos((amountToAdd % (1000000L * 1000)) * 1000);
      case MILLIS:  return plusMillis(amountToAdd);
      case SECONDS: return plusSeconds(amountToAdd);
      default: break;
    }

    Duration  duration = unit.getDuration().multipliedBy(amountToAdd);

    return plusSeconds(duration.getSeconds()).plusNanos(duration.getNano());
  }

  public Duration plusDays(long daysToAdd)
  {
    return plus(multiplyExact(daysToAdd, SECONDS_PER_DAY), 0);
  }

  public Duration plusHours(long hoursToAdd)
  {
    return plus(multiplyExact(hoursToAdd, SECONDS_PER_HOUR), 0);
  }

  public Duration plusMinutes(long minutesToAdd)
  {
    return plus(multiplyExact(minutesToAdd, SECONDS_PER_MINUTE), 0);
  }

  public Duration plusSeconds(long secondsToAdd)
  {
    return plus(secondsToAdd, 0);
  }

  public Duration plusMillis(long millisToAdd)
  {
    return plus(millisToAdd / 1000, (millisToAdd % 1000) * 1000000);
  }

  public Duration plusNanos(long nanosToAdd)
  {
    return plus(0, nanosToAdd);
  }

  private Duration plus(long secondsToAdd, long nanosToAdd)
  {
    if ((secondsToAdd | nanosToAdd) == 0)
      return this;

    long  epochSec = addExact(seconds, secondsToAdd);

    epochSec = addExact(epochSec, nanosToAdd / NANOS_PER_SECOND);
    nanosToAdd = nanosToAdd % NANOS_PER_SECOND;

    long  nanoAdjustment = nanos + nanosToAdd;

    return ofSeconds(epochSec, nanoAdjustment);
  }

  public Duration minus(Duration duration)
  {
    long  secsToSubtract = duration.getSeconds();
    int   nanosToSubtract = duration.getNano();

    if (secsToSubtract == Long.MIN_VALUE)
      return plus(Long.MAX_VALUE, -nanosToSubtract).plus(1, 0);

    return plus(-secsToSubtract, -nanosToSubtract);
  }

  public Duration minus(long amountToSubtract, ChronoUnit unit)
  {
    return (amountToSubtract == Long.MIN_VALUE ? plus(Long.MAX_VALUE, unit).plus(1, unit) : plus(-amountToSubtract, unit));
  }

  public Duration minusDays(long daysToSubtract)
  {
    return (daysToSubtract == Long.MIN_VALUE ? plusDays(Long.MAX_VALUE).plusDays(1) : plusDays(-daysToSubtract));
  }

  public Duration minusHours(long hoursToSubtract)
  {
    return (hoursToSubtract == Long.MIN_VALUE ? plusHours(Long.MAX_VALUE).plusHours(1) : plusHours(-hoursToSubtract));
  }

  public Duration minusMinutes(long minutesToSubtract)
  {
    return (minutesToSubtract == Long.MIN_VALUE ? plusMinutes(Long.MAX_VALUE).plusMinutes(1) : plusMinutes(-minutesToSubtract));
  }

  public Duration minusSeconds(long secondsToSubtract)
  {
    return (secondsToSubtract == Long.MIN_VALUE ? plusSeconds(Long.MAX_VALUE).plusSeconds(1) : plusSeconds(-secondsToSubtract));
  }

  public Duration minusMillis(long millisToSubtract)
  {
    return (millisToSubtract == Long.MIN_VALUE ? plusMillis(Long.MAX_VALUE).plusMillis(1) : plusMillis(-millisToSubtract));
  }

  public Duration minusNanos(long nanosToSubtract)
  {
    return (nanosToSubtract == Long.MIN_VALUE ? plusNanos(Long.MAX_VALUE).plusNanos(1) : plusNanos(-nanosToSubtract));
  }

  public Duration multipliedBy(long multiplicand)
  {
    if (multiplicand == 0)
      return ZERO;
    else if (multiplicand == 1)
      return this;

    return create(toBigDecimalSeconds().multiply(BigDecimal.valueOf(multiplicand)));
  }

  public Duration dividedBy(long divisor)
  {
    if (divisor == 0)
      throw new ArithmeticException("Cannot divide by zero");
    else if (divisor == 1)
      return this;

    return create(toBigDecimalSeconds().divide(BigDecimal.valueOf(divisor), RoundingMode.DOWN));
  }

  public long dividedBy(Duration divisor)
  {
    Objects.requireNonNull(divisor, "divisor");

    BigDecimal  dividendBigD = toBigDecimalSeconds();
    BigDecimal  divisorBigD = divisor.toBigDecimalSeconds();

    if (divisorBigD.signum() == 0)
      throw new ArithmeticException("Cannot divide by zero");

    return dividendBigD.divideToIntegralValue(divisorBigD).longValueExact();
  }

  private BigDecimal toBigDecimalSeconds()
  {
    return BigDecimal.valueOf(seconds).add(BigDecimal.valueOf(nanos, 9));
  }

  public Duration negated()
  {
    return multipliedBy(-1);
  }

  public Duration abs()
  {
    return isNegative() ? negated() : this;
  }

  public Temporal addTo(Temporal temporal)
  {
    if (seconds != 0)
      temporal = temporal.plus(seconds, ChronoUnit.SECONDS);

    if (nanos != 0)
      temporal = temporal.plus(nanos, ChronoUnit.NANOS);

    return temporal;
  }

  public Temporal subtractFrom(Temporal temporal)
  {
    if (seconds != 0)
      temporal = temporal.minus(seconds, ChronoUnit.SECONDS);

    if (nanos != 0)
      temporal = temporal.minus(nanos, ChronoUnit.NANOS);

    return temporal;
  }

  public long toDays()
  {
    return seconds / SECONDS_PER_DAY;
  }

  public long toHours()
  {
    return seconds / SECONDS_PER_HOUR;
  }

  public long toMinutes()
  {
    return seconds / SECONDS_PER_MINUTE;
  }

  public long toSeconds()
  {
    return seconds;
  }

  public long toMillis()
  {
    long  tempSeconds = seconds;
    long  tempNanos = nanos;

    if (tempSeconds < 0) {
      tempSeconds = tempSeconds + 1;
      tempNanos = tempNanos - NANOS_PER_SECOND;
    }

    long  millis = multiplyExact(tempSeconds, 1000);

    return addExact(millis, tempNanos / 1000000);
  }

  public long toNanos()
  {
    long  tempSeconds = seconds;
    long  tempNanos = nanos;

    if (tempSeconds < 0) {
      tempSeconds = tempSeconds + 1;
      tempNanos = tempNanos - NANOS_PER_SECOND;
    }

    long  totalNanos = multiplyExact(tempSeconds, NANOS_PER_SECOND);

    return addExact(totalNanos, tempNanos);
  }

  public long toDaysPart()
  {
    return seconds / SECONDS_PER_DAY;
  }

  public int toHoursPart()
  {
    return (int) (toHours() % 24);
  }

  public int toMinutesPart()
  {
    return (int) (toMinutes() % 60);
  }

  public int toSecondsPart()
  {
    return (int) (seconds % SECONDS_PER_MINUTE);
  }

  public int toMillisPart()
  {
    return nanos / 1000000;
  }

  public int toNanosPart()
  {
    return nanos;
  }

  public Duration truncatedTo(ChronoUnit unit)
  {
    Objects.requireNonNull(unit, "unit");

    if (unit == ChronoUnit.SECONDS && (seconds >= 0 || nanos == 0))
      return create(seconds, 0);
    else if (unit == ChronoUnit.NANOS)
      return this;

    Duration  unitDur = unit.getDuration();

    if (unitDur.getSeconds() > SECONDS_PER_DAY)
      throw new UnsupportedTemporalTypeException("Unit is too large to be used for truncation");

    long  dur = unitDur.toNanos();

    if ((SECONDS_PER_DAY * NANOS_PER_SECOND) % dur != 0)
      throw new UnsupportedTemporalTypeException("Unit must divide into a standard day without remainder");

    long  nod = (seconds % SECONDS_PER_DAY) * NANOS_PER_SECOND + nanos;
    long  result = (nod / dur) * dur;

    return plusNanos(result - nod);
  }

  @Override
  public int compareTo(Duration other)
  {
    int   cmp = Long.compare(seconds, other.seconds);

    if (cmp != 0)
      return cmp;

    return nanos - other.nanos;
  }

  @Override
  public boolean equals(Object other)
  {
    if (this == other)
      return true;
    else if (!(other instanceof Duration))
      return false;

    Duration  that = (Duration) other;

    return seconds == that.seconds && nanos == that.nanos;
  }

  @Override
  public int hashCode()
  {
    return ((int) (seconds ^ (seconds >>> 32))) + (51 * nanos);
  }

  /**
   * ISO-8601 text using hours, minutes and seconds only, such as {@code PT8H6M12.345S}.
   */
  @Override
  public String toString()
  {
    if (this == ZERO)
      return "PT0S";

    long  effectiveTotalSecs = seconds;

    if (seconds < 0 && nanos > 0)
      effectiveTotalSecs++;

    long            hours = effectiveTotalSecs / SECONDS_PER_HOUR;
    int             minutes = (int) ((effectiveTotalSecs % SECONDS_PER_HOUR) / SECONDS_PER_MINUTE);
    int             secs = (int) (effectiveTotalSecs % SECONDS_PER_MINUTE);
    StringBuilder   buf = new StringBuilder(24);

    buf.append("PT");

    if (hours != 0)
      buf.append(hours).append('H');

    if (minutes != 0)
      buf.append(minutes).append('M');

    if (secs == 0 && nanos == 0 && buf.length() > 2)
      return buf.toString();

    if (seconds < 0 && nanos > 0) {
      if (secs == 0)
        buf.append("-0");
      else
        buf.append(secs);
    }
    else
      buf.append(secs);

    if (nanos > 0) {
      int   pos = buf.length();

      if (seconds < 0)
        buf.append(2 * NANOS_PER_SECOND - nanos);
      else
        buf.append(nanos + NANOS_PER_SECOND);

      while (buf.charAt(buf.length() - 1) == '0')
        buf.setLength(buf.length() - 1);

      buf.setCharAt(pos, '.');
    }

    buf.append('S');

    return buf.toString();
  }
}
