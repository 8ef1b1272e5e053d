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

package org.shetline.civiltime.tzdb;

import java.util.regex.Pattern;

import org.shetline.civiltime.DayOfWeek;
import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.Month;
import org.shetline.civiltime.format.DateTimeFormatter;
import org.shetline.civiltime.zone.ZoneOffsetTransitionRule.TimeDefinition;

import static java.lang.Math.abs;


public class TzUtil
{
  private TzUtil() {}

  public static final String    DAYS = "MonTueWedThuFriSatSun";
  public static final String    MONTHS = "JanFebMarAprMayJunJulAugSepOctNovDec";

  public static final DateTimeFormatter   dateTimeFormat = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");

  // tz allows any unambiguous abbreviation of these keywords.
  private static final Pattern  minYear = Pattern.compile("min(i(m(um?)?)?)?", Pattern.CASE_INSENSITIVE);
  private static final Pattern  maxYear = Pattern.compile("max(i(m(um?)?)?)?", Pattern.CASE_INSENSITIVE);
  private static final Pattern  onlyYear = Pattern.compile("o(n(ly?)?)?", Pattern.CASE_INSENSITIVE);

  public static Month parseMonth(String s)
  {
    return Month.of(indexOfFailNotFound(MONTHS, capitalize(s, 3)) / 3 + 1);
  }

  public static DayOfWeek parseDayOfWeek(String s)
  {
    return DayOfWeek.of(indexOfFailNotFound(DAYS, capitalize(s, 3)) / 3 + 1);
  }

  /**
   * Parses a year column, where "min" and "max" stand for the earliest and latest supported
   * years, and "only" repeats {@code defaultYear}.
   *
   * @throws NumberFormatException if the text is neither a year nor a keyword
   */
  public static int parseYear(String s, int defaultYear)
  {
    if (minYear.matcher(s).matches())
      return LocalDate.MIN_YEAR;
    else if (maxYear.matcher(s).matches())
      return LocalDate.MAX_YEAR;
    else if (onlyYear.matcher(s).matches())
      return defaultYear;

    return Integer.parseInt(s);
  }

  /**
   * Maps the suffix of an AT or UNTIL time to the clock it is measured by: s for local standard
   * time, u, g or z for UTC, and anything else for wall-clock time.
   */
  public static TimeDefinition parseTimeDefinition(char c)
  {
    switch (c) {
      case 's':
      case 'S':
        return TimeDefinition.STANDARD;

      case 'u':
      case 'U':
      case 'g':
      case 'G':
      case 'z':
      case 'Z':
        return TimeDefinition.UTC;

      default:
        return TimeDefinition.WALL;
    }
  }

  /**
   * Parse a time or offset in the form [+/-]hours[:minutes[:seconds[.fraction]]], where a lone
   * "-" means zero.
   * @param s Time as string, without any clock type suffix
   * @param roundToMinutes If true, round to whole minutes.
   * @return Time in seconds
   */
  public static int parseSeconds(String s, boolean roundToMinutes)
  {
    int   sign = 1;

    if ("-".equals(s))
      return 0;
    else if (s.startsWith("-")) {
      sign = -1;
      s = s.substring(1);
    }
    else if (s.startsWith("+"))
      s = s.substring(1);

    String[]  parts = s.split(":");

    if (parts.length > 3 || parts[0].isEmpty())
      throw new IllegalArgumentException("Invalid time: " + s);

    int       hour = Integer.parseInt(parts[0]);
    int       min = (parts.length > 1 ? Integer.parseInt(parts[1]) : 0);
    int       sec = (parts.length > 2 ? (int) Math.round(Double.parseDouble(parts[2])) : 0);

    if (min > 59 || sec > 60)
      throw new IllegalArgumentException("Invalid time: " + s);

    if (roundToMinutes) {
      if (sec >= 30)
        ++min;

      sec = 0;
    }

    return sign * ((hour * 60 + min) * 60 + sec);
  }

  public static String formatOffsetNotation(int offset)
  {
    int   sign = (int) Math.signum(offset);

    offset = abs(offset);

    int     hrs = offset / 3600;
    int     min = (offset - hrs * 3600) / 60;
    int     sec = offset % 60;
    String  s = (sign < 0 ? "-" : "+") + padLeft(hrs, '0', 2) + padLeft(min, '0', 2);

    if (sec != 0)
      s += padLeft(sec, '0', 2);

    return s;
  }

  public static int indexOfFailNotFound(String s, String sub)
  {
    int   pos = s.indexOf(sub);

    if (pos < 0 || sub.isEmpty())
      throw new IllegalArgumentException("'" + sub + "' not found in '" + s + "'");

    return pos;
  }

  public static boolean isNullOrEmpty(String s)
  {
    return (s == null || s.isEmpty());
  }

  public static String padLeft(int value, char padChar, int finalLength)
  {
    return padLeft("" + value, padChar, finalLength);
  }

  public static String padLeft(String s, char padChar, int finalLength)
  {
    if (s == null)
      return null;
    else if (s.length() >= finalLength)
      return s;

    StringBuilder   sb = new StringBuilder(finalLength);

    for (int i = s.length(); i < finalLength; ++i)
      sb.append(padChar);

    return sb.append(s).toString();
  }

  public static String rtrim(String s)
  {
    if (isNullOrEmpty(s))
      return s;

    int   i = s.length() - 1;

    while (i >= 0 && s.charAt(i) <= 32)
      --i;

    return s.substring(0, i + 1);
  }

  private static String capitalize(String s, int length)
  {
    if (s.length() < length)
      return s;

    return Character.toUpperCase(s.charAt(0)) + s.substring(1, length).toLowerCase();
  }
}
