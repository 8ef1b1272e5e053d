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

import java.util.Map;

import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.ZoneOffset;
import org.shetline.civiltime.zone.ZoneRulesBuilder;

import static org.shetline.civiltime.tzdb.TzUtil.*;


/**
 * One line of a Zone definition: the standard offset, the rules or fixed savings that apply, and
 * the date-time until which the line is in force.
 */
public class IanaZoneRecord
{
  protected int             gmtOffset;
  protected String          rules;
  protected Integer         fixedSavings;
  protected String          format;
  protected Integer         untilYear;
  protected TzMonthDayTime  until;

  public static IanaZoneRecord parseZoneRecord(String line, StringBuilder zoneId, boolean roundToMinutes)
  {
    // The use of tabs vs. spaces to delimit these files is wildly inconsistent, so split on any
    // run of whitespace.
    String[]  parts = line.trim().split("\\s+");
    int       first = 0;

    if (parts[0].equals("Zone")) {
      if (parts.length < 2)
        throw new IllegalArgumentException("Zone line without a name: " + line);

      if (zoneId != null)
        zoneId.append(parts[1]);

      first = 2;
    }

    if (parts.length < first + 3)
      throw new IllegalArgumentException("Incomplete Zone line: " + line);

    IanaZoneRecord  zoneRec = new IanaZoneRecord();
    String          savingsRule = parts[first + 1];

    zoneRec.gmtOffset = parseSeconds(parts[first], roundToMinutes);

    if (savingsRule.equals("-"))
      zoneRec.fixedSavings = 0;
    else if (Character.isDigit(savingsRule.charAt(0)) || savingsRule.charAt(0) == '-' || savingsRule.charAt(0) == '+')
      zoneRec.fixedSavings = parseSeconds(savingsRule, roundToMinutes);
    else
      zoneRec.rules = savingsRule;

    zoneRec.format = parts[first + 2];

    if (parts.length > first + 3) {
      zoneRec.untilYear = Integer.parseInt(parts[first + 3]);
      zoneRec.until = new TzMonthDayTime();
      zoneRec.until.parseMonthDayTime(parts, first + 4, roundToMinutes);
    }

    return zoneRec;
  }

  /**
   * Opens a builder window for this line and adds its savings. {@code windowStartYear} is the
   * year the previous line ended, or {@link LocalDate#MIN_YEAR} for the first line.
   *
   * @throws IllegalArgumentException if the line names rules that were never defined
   */
  public void addToBuilder(ZoneRulesBuilder builder, Map<String, TzRuleSet> ruleSets, int windowStartYear)
  {
    ZoneOffset  standardOffset = ZoneOffset.ofTotalSeconds(gmtOffset);

    if (untilYear != null)
      builder.addWindow(standardOffset, until.toDateTime(untilYear), until.getTimeDefinition());
    else
      builder.addWindowForever(standardOffset);

    if (fixedSavings != null)
      builder.setFixedSavingsToWindow(fixedSavings);
    else {
      TzRuleSet   ruleSet = ruleSets.get(rules);

      if (ruleSet == null)
        throw new IllegalArgumentException("Rule not found: " + rules);

      ruleSet.addToBuilder(builder, windowStartYear);
    }
  }

  public boolean isForever()
  {
    return untilYear == null;
  }

  public int getGmtOffset()
  {
    return gmtOffset;
  }

  public String getRules()
  {
    return rules;
  }

  public Integer getFixedSavings()
  {
    return fixedSavings;
  }

  public String getFormat()
  {
    return format;
  }

  public Integer getUntilYear()
  {
    return untilYear;
  }

  public TzMonthDayTime getUntil()
  {
    return until;
  }

  @Override
  public String toString()
  {
    String  s = formatOffsetNotation(gmtOffset) + ", " + (rules != null ? rules : formatOffsetNotation(fixedSavings)) +
                ", " + format;

    if (untilYear != null)
      s += ", " + untilYear + " " + until.formatMonthDayTime();

    return s;
  }
}
