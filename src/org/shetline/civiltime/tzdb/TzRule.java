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

import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.zone.ZoneRulesBuilder;

import static org.shetline.civiltime.tzdb.TzUtil.*;


public class TzRule extends TzMonthDayTime
{
  /**
   * Rules starting at "min" are expanded from this year onwards, well before any zone's first
   * rule-based window.
   */
  public static final int   EARLIEST_RULE_YEAR = 1800;

  // Leap year, so that Feb 29 rules can be moved to an on-or-after form.
  private static final int  ADJUSTMENT_YEAR = 2004;

  protected String  name;
  protected int     startYear;
  protected int     endYear;
  protected int     save;
  protected String  letters;

  public static TzRule parseRule(String line, boolean roundToMinutes)
  {
    TzRule    rule = new TzRule();
    String[]  parts = line.trim().split("\\s+");

    if (parts.length < 9)
      throw new IllegalArgumentException("Incomplete Rule line: " + line);

    rule.name = parts[1];
    rule.startYear = parseYear(parts[2], 0);
    rule.endYear = parseYear(parts[3], rule.startYear);

    if (rule.startYear > rule.endYear)
      throw new IllegalArgumentException("Rule " + rule.name + " ends before it starts: " + line);

    // parts[4], the obsolete TYPE column, is always "-".
    rule.parseMonthDayTime(parts, 5, roundToMinutes);

    String  save = parts[8];

    // Newer tz sources may mark the amount with s (standard) or d (daylight).
    if (Character.isLetter(save.charAt(save.length() - 1)))
      save = save.substring(0, save.length() - 1);

    rule.save = parseSeconds(save, roundToMinutes);

    if (parts.length < 10 || parts[9].equals("-"))
      rule.letters = "";
    else
      rule.letters = parts[9];

    return rule;
  }

  /**
   * Adds this rule to the builder's current window. Years before {@code windowStartYear - 1} are
   * left out, except that the year before the window is kept so the savings in force when the
   * window opens can be found.
   */
  public void addToBuilder(ZoneRulesBuilder builder, int windowStartYear)
  {
    int   start = startYear;

    if (windowStartYear > LocalDate.MIN_YEAR)
      start = Math.max(start, windowStartYear - 1);

    if (start == LocalDate.MIN_YEAR)
      start = Math.min(EARLIEST_RULE_YEAR, endYear);

    if (start > endYear)
      return;

    adjustToForwards(ADJUSTMENT_YEAR);
    builder.addRuleToWindow(start, endYear, month, dayOfMonth, dayOfWeek, time, endOfDay, timeDefinition, save);
  }

  public String getName()
  {
    return name;
  }

  public int getStartYear()
  {
    return startYear;
  }

  public int getEndYear()
  {
    return endYear;
  }

  public int getSave()
  {
    return save;
  }

  public String getLetters()
  {
    return letters;
  }

  @Override
  public String toString()
  {
    return name + ": " + (startYear == LocalDate.MIN_YEAR ? "min" : Integer.toString(startYear)) + ", " +
           (endYear == LocalDate.MAX_YEAR ? "max" : Integer.toString(endYear)) + ", " + formatMonthDayTime() + ", " +
           formatOffsetNotation(save) + ", " + letters;
  }
}
