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

import java.io.BufferedWriter;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;

import org.shetline.civiltime.Instant;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.ZoneOffset;
import org.shetline.civiltime.zone.ZoneOffsetTransition;
import org.shetline.civiltime.zone.ZoneRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.Math.abs;
import static org.shetline.civiltime.tzdb.TzUtil.*;


/**
 * A zone's transitions over a range of years, as a list of rows. The first row holds the offsets
 * in force at the start of the range.
 */
public class TzTransitionTable extends ArrayList<TzTransition>
{
  private static final Logger LOGGER = LoggerFactory.getLogger(TzTransitionTable.class);

  private final String  zoneId;

  public TzTransitionTable(String zoneId)
  {
    this.zoneId = zoneId;
  }

  public String getZoneId()
  {
    return zoneId;
  }

  public static TzTransitionTable fromRules(String zoneId, ZoneRules rules, int minYear, int maxYear)
  {
    TzTransitionTable     transitions = new TzTransitionTable(zoneId);
    Instant               start = Instant.ofEpochSecond(startOfYear(minYear));
    long                  end = startOfYear(maxYear + 1);
    ZoneOffsetTransition  transition = rules.nextTransition(start);

    transitions.add(new TzTransition(TzTransition.BEGINNING_OF_TIME, rules.getOffset(start).getTotalSeconds(),
                                     (int) rules.getDaylightSavings(start).getSeconds()));

    while (transition != null && transition.toEpochSecond() < end) {
      transitions.add(new TzTransition(transition.toEpochSecond(), transition.getOffsetAfter().getTotalSeconds(),
                                       (int) rules.getDaylightSavings(transition.getInstant()).getSeconds()));
      transition = rules.nextTransition(transition.getInstant());
    }

    return transitions;
  }

  public static TzTransitionTable fromJavaTime(String zoneId, int minYear, int maxYear)
  {
    java.time.zone.ZoneRules  rules;

    try {
      rules = java.time.ZoneId.of(zoneId).getRules();
    }
    catch (java.time.DateTimeException e) {
      LOGGER.debug("java.time has no rules for {}: {}", zoneId, e.getMessage());
      return null;
    }

    TzTransitionTable                   transitions = new TzTransitionTable(zoneId);
    java.time.Instant                   start = java.time.Instant.ofEpochSecond(startOfYear(minYear));
    long                                end = startOfYear(maxYear + 1);
    java.time.zone.ZoneOffsetTransition transition = rules.nextTransition(start);

    transitions.add(new TzTransition(TzTransition.BEGINNING_OF_TIME, rules.getOffset(start).getTotalSeconds(),
                                     (int) rules.getDaylightSavings(start).getSeconds()));

    while (transition != null && transition.toEpochSecond() < end) {
      transitions.add(new TzTransition(transition.toEpochSecond(), transition.getOffsetAfter().getTotalSeconds(),
                                       (int) rules.getDaylightSavings(transition.getInstant()).getSeconds()));
      transition = rules.nextTransition(transition.getInstant());
    }

    return transitions;
  }

  private static long startOfYear(int year)
  {
    return LocalDateTime.of(year, 1, 1, 0, 0).toEpochSecond(ZoneOffset.UTC);
  }

  /**
   * Compares the UTC offsets and daylight savings of two tables, ignoring rows where nothing
   * changes. With {@code roundToMinutes}, times and offsets may differ by up to a minute.
   */
  public boolean closelyMatches(TzTransitionTable other, boolean roundToMinutes)
  {
    int                 tolerance = (roundToMinutes ? 60 : 0);
    TzTransitionTable   mine = withoutEmptyTransitions();
    TzTransitionTable   theirs = other.withoutEmptyTransitions();

    for (int i = 0; i < mine.size() && i < theirs.size(); ++i) {
      TzTransition  t = mine.get(i);
      TzTransition  to = theirs.get(i);

      if (abs(t.time - to.time) > tolerance ||
          abs(t.utcOffset - to.utcOffset) > tolerance ||
              t.dstOffset != to.dstOffset)
      {
        LOGGER.warn("{} differs at row {}: {} vs. {}", zoneId, i, t, to);

        return false;
      }
    }

    if (mine.size() != theirs.size()) {
      LOGGER.warn("{} has {} transitions, compared with {}", zoneId, mine.size() - 1, theirs.size() - 1);

      return false;
    }

    return true;
  }

  private TzTransitionTable withoutEmptyTransitions()
  {
    TzTransitionTable   transitions = new TzTransitionTable(zoneId);

    for (TzTransition curr : this) {
      TzTransition  prev = (transitions.isEmpty() ? null : transitions.get(transitions.size() - 1));

      if (prev == null || curr.utcOffset != prev.utcOffset || curr.dstOffset != prev.dstOffset)
        transitions.add(curr);
    }

    return transitions;
  }

  public void dump(OutputStream out)
  {
    PrintWriter   writer = new PrintWriter(new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8)));

    dump(writer);
    writer.flush();
  }

  public void dump(PrintWriter out)
  {
    out.println("-------- " + zoneId + " --------");

    if (size() == 0)
      out.println("(empty)");
    else if (size() == 1)
      out.println("Fixed UTC offset at " + formatOffsetNotation(get(0).utcOffset));
    else {
      TzTransition  tzt = get(0);

      out.println("____-__-__ __:__:__ ±____ ±____ --> ____-__-__ __:__:__ " +
                  formatOffsetNotation(tzt.utcOffset) + " " + formatOffsetNotation(tzt.dstOffset));

      for (int i = 1; i < size(); ++i) {
        TzTransition    prev = get(i - 1);
        TzTransition    curr = get(i);
        LocalDateTime   prevDateTime = LocalDateTime.ofEpochSecond(curr.time - 1, 0, ZoneOffset.ofTotalSeconds(prev.utcOffset));
        LocalDateTime   currDateTime = LocalDateTime.ofEpochSecond(curr.time, 0, ZoneOffset.ofTotalSeconds(curr.utcOffset));

        out.println(dateTimeFormat.format(prevDateTime) + " " + formatOffsetNotation(prev.utcOffset) + " " +
                    formatOffsetNotation(prev.dstOffset) + " --> " +
                    dateTimeFormat.format(currDateTime) + " " + formatOffsetNotation(curr.utcOffset) + " " +
                    formatOffsetNotation(curr.dstOffset) + (curr.dstOffset != 0 ? "*" : ""));
      }
    }
  }
}
