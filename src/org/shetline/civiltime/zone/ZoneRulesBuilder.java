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

package org.shetline.civiltime.zone;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.shetline.civiltime.DayOfWeek;
import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.LocalTime;
import org.shetline.civiltime.Month;
import org.shetline.civiltime.ZoneOffset;
import org.shetline.civiltime.chrono.IsoChronology;
import org.shetline.civiltime.zone.ZoneOffsetTransitionRule.TimeDefinition;

import static org.shetline.civiltime.temporal.ChronoField.YEAR;
import static org.shetline.civiltime.temporal.TemporalAdjusters.nextOrSame;
import static org.shetline.civiltime.temporal.TemporalAdjusters.previousOrSame;


/**
 * Builds {@link ZoneRules} from a sequence of windows, the way the IANA tz sources describe a
 * zone. Each window has a standard offset and an end date-time, and either a fixed amount of
 * savings or a set of savings rules. Rules that run to the maximum year become the recurring
 * {@link ZoneOffsetTransitionRule}s of the result.
 * <p>
 * A builder is not thread-safe and is meant to be used once.
 */
public class ZoneRulesBuilder
{
  private static final int  MAX_RULES_PER_WINDOW = 2000;

  private final List<TZWindow>  windowList = new ArrayList<>();
  private Map<Object, Object>   deduplicateMap;

  public ZoneRulesBuilder addWindow(ZoneOffset standardOffset, LocalDateTime until, TimeDefinition untilDefinition)
  {
    Objects.requireNonNull(standardOffset, "standardOffset");
    Objects.requireNonNull(until, "until");
    Objects.requireNonNull(untilDefinition, "untilDefinition");

    TZWindow  window = new TZWindow(standardOffset, until, untilDefinition);

    if (windowList.size() > 0)
      window.validateWindowOrder(windowList.get(windowList.size() - 1));

    windowList.add(window);

    return this;
  }

  public ZoneRulesBuilder addWindowForever(ZoneOffset standardOffset)
  {
    return addWindow(standardOffset, LocalDateTime.MAX, TimeDefinition.WALL);
  }

  public ZoneRulesBuilder setFixedSavingsToWindow(int fixedSavingAmountSecs)
  {
    if (windowList.isEmpty())
      throw new IllegalStateException("Must add a window before setting the fixed savings");

    windowList.get(windowList.size() - 1).setFixedSavings(fixedSavingAmountSecs);

    return this;
  }

  public ZoneRulesBuilder addRuleToWindow(LocalDateTime transitionDateTime, TimeDefinition timeDefinition,
                                          int savingAmountSecs)
  {
    Objects.requireNonNull(transitionDateTime, "transitionDateTime");

    return addRuleToWindow(transitionDateTime.getYear(), transitionDateTime.getYear(), transitionDateTime.getMonth(),
                           transitionDateTime.getDayOfMonth(), null, transitionDateTime.toLocalTime(), false,
                           timeDefinition, savingAmountSecs);
  }

  public ZoneRulesBuilder addRuleToWindow(int year, Month month, int dayOfMonthIndicator, LocalTime time,
                                          boolean timeEndOfDay, TimeDefinition timeDefinition, int savingAmountSecs)
  {
    return addRuleToWindow(year, year, month, dayOfMonthIndicator, null, time, timeEndOfDay, timeDefinition,
                           savingAmountSecs);
  }

  /**
   * Adds a savings rule for a range of years to the current window. An end year of
   * {@link LocalDate#MAX_YEAR} makes the rule recur forever.
   */
  public ZoneRulesBuilder addRuleToWindow(int startYear, int endYear, Month month, int dayOfMonthIndicator,
                                          DayOfWeek dayOfWeek, LocalTime time, boolean timeEndOfDay,
                                          TimeDefinition timeDefinition, int savingAmountSecs)
  {
    Objects.requireNonNull(month, "month");
    Objects.requireNonNull(time, "time");
    Objects.requireNonNull(timeDefinition, "timeDefinition");
    YEAR.checkValidValue(startYear);
    YEAR.checkValidValue(endYear);

    if (dayOfMonthIndicator < -28 || dayOfMonthIndicator > 31 || dayOfMonthIndicator == 0)
      throw new IllegalArgumentException("Day of month indicator must be between -28 and 31 inclusive excluding zero");
    else if (timeEndOfDay && !time.equals(LocalTime.MIDNIGHT))
      throw new IllegalArgumentException("Time must be midnight when end of day flag is true");
    else if (windowList.isEmpty())
      throw new IllegalStateException("Must add a window before adding a rule");

    windowList.get(windowList.size() - 1).addRule(startYear, endYear, month, dayOfMonthIndicator, dayOfWeek, time,
                                                  timeEndOfDay, timeDefinition, savingAmountSecs);

    return this;
  }

  public ZoneRules toRules(String zoneId)
  {
    return toRules(zoneId, new HashMap<>());
  }

  /**
   * Builds the rules, sharing equal offsets, date-times and transitions through the given map so
   * that compiling many zones does not hold many copies of the same values.
   */
  public ZoneRules toRules(String zoneId, Map<Object, Object> deduplicateMap)
  {
    Objects.requireNonNull(zoneId, "zoneId");
    this.deduplicateMap = Objects.requireNonNull(deduplicateMap, "deduplicateMap");

    if (windowList.isEmpty())
      throw new IllegalStateException("No windows have been added to the builder");

    List<ZoneOffsetTransition>      standardTransitionList = new ArrayList<>(4);
    List<ZoneOffsetTransition>      transitionList = new ArrayList<>(256);
    List<ZoneOffsetTransitionRule>  lastTransitionRuleList = new ArrayList<>(2);

    TZWindow      firstWindow = windowList.get(0);
    ZoneOffset    loopStandardOffset = firstWindow.standardOffset;
    int           loopSavings = 0;

    if (firstWindow.fixedSavingAmountSecs != null)
      loopSavings = firstWindow.fixedSavingAmountSecs;

    ZoneOffset    firstWallOffset = deduplicate(ZoneOffset.ofTotalSeconds(loopStandardOffset.getTotalSeconds() + loopSavings), ZoneOffset.class);
    LocalDateTime loopWindowStart = deduplicate(LocalDateTime.of(LocalDate.MIN_YEAR, 1, 1, 0, 0), LocalDateTime.class);
    ZoneOffset    loopWindowOffset = firstWallOffset;

    for (TZWindow window : windowList) {
      window.tidy(loopWindowStart.getYear());

      Integer   effectiveSavings = window.fixedSavingAmountSecs;

      if (effectiveSavings == null) {
        effectiveSavings = 0;

        for (TZRule rule : window.ruleList) {
          ZoneOffsetTransition  trans = rule.toTransition(loopStandardOffset, loopSavings);

          if (trans.toEpochSecond() > loopWindowStart.toEpochSecond(loopWindowOffset))
            break;

          effectiveSavings = rule.savingAmountSecs;
        }
      }

      if (!loopStandardOffset.equals(window.standardOffset)) {
        LocalDateTime   start = LocalDateTime.ofEpochSecond(loopWindowStart.toEpochSecond(loopWindowOffset), 0, loopStandardOffset);

        standardTransitionList.add(deduplicate(new ZoneOffsetTransition(start, loopStandardOffset, window.standardOffset), ZoneOffsetTransition.class));
        loopStandardOffset = deduplicate(window.standardOffset, ZoneOffset.class);
      }

      ZoneOffset  effectiveWallOffset = deduplicate(ZoneOffset.ofTotalSeconds(loopStandardOffset.getTotalSeconds() + effectiveSavings), ZoneOffset.class);

      if (!loopWindowOffset.equals(effectiveWallOffset))
        transitionList.add(deduplicate(new ZoneOffsetTransition(loopWindowStart, loopWindowOffset, effectiveWallOffset), ZoneOffsetTransition.class));

      loopSavings = effectiveSavings;

      for (TZRule rule : window.ruleList) {
        ZoneOffsetTransition  trans = deduplicate(rule.toTransition(loopStandardOffset, loopSavings), ZoneOffsetTransition.class);

        if (trans.toEpochSecond() >= loopWindowStart.toEpochSecond(loopWindowOffset) &&
            trans.toEpochSecond() < window.createDateTimeEpochSecond(loopSavings) &&
            !trans.getOffsetBefore().equals(trans.getOffsetAfter())) {
          transitionList.add(trans);
          loopSavings = rule.savingAmountSecs;
        }
      }

      for (TZRule lastRule : window.lastRuleList) {
        lastTransitionRuleList.add(deduplicate(lastRule.toTransitionRule(loopStandardOffset, loopSavings), ZoneOffsetTransitionRule.class));
        loopSavings = lastRule.savingAmountSecs;
      }

      loopWindowOffset = deduplicate(window.createWallOffset(loopSavings), ZoneOffset.class);
      loopWindowStart = deduplicate(LocalDateTime.ofEpochSecond(window.createDateTimeEpochSecond(loopSavings), 0, loopWindowOffset), LocalDateTime.class);
    }

    if (transitionList.isEmpty() && lastTransitionRuleList.isEmpty() && standardTransitionList.isEmpty() &&
        firstWallOffset.equals(firstWindow.standardOffset))
      return ZoneRules.of(firstWallOffset);

    return new StandardZoneRules(firstWindow.standardOffset, firstWallOffset, standardTransitionList, transitionList,
                                 lastTransitionRuleList);
  }

  private <T> T deduplicate(T object, Class<T> type)
  {
    Object  existing = deduplicateMap.putIfAbsent(object, object);

    return existing != null ? type.cast(existing) : object;
  }

  private class TZWindow
  {
    private final ZoneOffset      standardOffset;
    private final LocalDateTime   windowEnd;
    private final TimeDefinition  timeDefinition;

    private Integer       fixedSavingAmountSecs;
    private List<TZRule>  ruleList = new ArrayList<>();
    private int           maxLastRuleStartYear = LocalDate.MIN_YEAR;
    private List<TZRule>  lastRuleList = new ArrayList<>();

    private TZWindow(ZoneOffset standardOffset, LocalDateTime windowEnd, TimeDefinition timeDefinition)
    {
      this.standardOffset = standardOffset;
      this.windowEnd = windowEnd;
      this.timeDefinition = timeDefinition;
    }

    private void setFixedSavings(int fixedSavingAmount)
    {
      if (ruleList.size() > 0 || lastRuleList.size() > 0)
        throw new IllegalStateException("Window has DST rules, so cannot have fixed savings");

      fixedSavingAmountSecs = fixedSavingAmount;
    }

    private void addRule(int startYear, int endYear, Month month, int dayOfMonthIndicator, DayOfWeek dayOfWeek,
                         LocalTime time, boolean timeEndOfDay, TimeDefinition timeDefinition, int savingAmountSecs)
    {
      if (fixedSavingAmountSecs != null)
        throw new IllegalStateException("Window has a fixed DST saving, so cannot have DST rules");
      else if (ruleList.size() >= MAX_RULES_PER_WINDOW)
        throw new IllegalStateException("Window has reached the maximum number of allowed rules");

      boolean   lastRule = false;

      if (endYear == LocalDate.MAX_YEAR) {
        lastRule = true;
        endYear = startYear;
      }

      for (int year = startYear; year <= endYear; ++year) {
        TZRule  rule = new TZRule(year, month, dayOfMonthIndicator, dayOfWeek, time, timeEndOfDay, timeDefinition,
                                  savingAmountSecs);

        if (lastRule) {
          lastRuleList.add(rule);
          maxLastRuleStartYear = Math.max(startYear, maxLastRuleStartYear);
        }
        else
          ruleList.add(rule);
      }
    }

    private void validateWindowOrder(TZWindow previous)
    {
      if (windowEnd.isBefore(previous.windowEnd))
        throw new IllegalStateException("Windows must be added in date-time order: " + windowEnd + " < " + previous.windowEnd);
    }

    /**
     * Expands the forever rules into concrete years up to the point where they can safely stand
     * alone as recurring rules.
     */
    private void tidy(int windowStartYear)
    {
      if (lastRuleList.size() == 1)
        throw new IllegalStateException("Cannot have only one rule defined as being forever");

      if (windowEnd.equals(LocalDateTime.MAX)) {
        maxLastRuleStartYear = Math.max(maxLastRuleStartYear, windowStartYear) + 1;

        for (TZRule lastRule : lastRuleList) {
          addRule(lastRule.year, maxLastRuleStartYear, lastRule.month, lastRule.dayOfMonthIndicator, lastRule.dayOfWeek,
                  lastRule.time, lastRule.timeEndOfDay, lastRule.timeDefinition, lastRule.savingAmountSecs);
          lastRule.year = maxLastRuleStartYear + 1;
        }

        if (maxLastRuleStartYear == LocalDate.MAX_YEAR)
          lastRuleList.clear();
        else
          ++maxLastRuleStartYear;
      }
      else {
        int   endYear = windowEnd.getYear();

        for (TZRule lastRule : lastRuleList)
          addRule(lastRule.year, endYear + 1, lastRule.month, lastRule.dayOfMonthIndicator, lastRule.dayOfWeek,
                  lastRule.time, lastRule.timeEndOfDay, lastRule.timeDefinition, lastRule.savingAmountSecs);

        lastRuleList.clear();
        maxLastRuleStartYear = LocalDate.MAX_YEAR;
      }

      Collections.sort(ruleList);
      Collections.sort(lastRuleList);

      if (ruleList.size() == 0 && fixedSavingAmountSecs == null)
        fixedSavingAmountSecs = 0;
    }

    private ZoneOffset createWallOffset(int savingsSecs)
    {
      return ZoneOffset.ofTotalSeconds(standardOffset.getTotalSeconds() + savingsSecs);
    }

    private long createDateTimeEpochSecond(int savingsSecs)
    {
      ZoneOffset      wallOffset = createWallOffset(savingsSecs);
      LocalDateTime   ldt = timeDefinition.createDateTime(windowEnd, standardOffset, wallOffset);

      return ldt.toEpochSecond(wallOffset);
    }
  }

  private class TZRule implements Comparable<TZRule>
  {
    private int             year;
    private Month           month;
    private int             dayOfMonthIndicator;
    private DayOfWeek       dayOfWeek;
    private LocalTime       time;
    private boolean         timeEndOfDay;
    private TimeDefinition  timeDefinition;
    private int             savingAmountSecs;

    private TZRule(int year, Month month, int dayOfMonthIndicator, DayOfWeek dayOfWeek, LocalTime time,
                   boolean timeEndOfDay, TimeDefinition timeDefinition, int savingAmountSecs)
    {
      this.year = year;
      this.month = month;
      this.dayOfMonthIndicator = dayOfMonthIndicator;
      this.dayOfWeek = dayOfWeek;
      this.time = time;
      this.timeEndOfDay = timeEndOfDay;
      this.timeDefinition = timeDefinition;
      this.savingAmountSecs = savingAmountSecs;
    }

    private ZoneOffsetTransition toTransition(ZoneOffset standardOffset, int savingsBeforeSecs)
    {
      LocalDate       date = deduplicate(toLocalDate(), LocalDate.class);
      LocalDateTime   ldt = deduplicate(LocalDateTime.of(date, time), LocalDateTime.class);
      ZoneOffset      wallOffset = deduplicate(ZoneOffset.ofTotalSeconds(standardOffset.getTotalSeconds() + savingsBeforeSecs), ZoneOffset.class);
      LocalDateTime   dt = deduplicate(timeDefinition.createDateTime(ldt, standardOffset, wallOffset), LocalDateTime.class);
      ZoneOffset      offsetAfter = deduplicate(ZoneOffset.ofTotalSeconds(standardOffset.getTotalSeconds() + savingAmountSecs), ZoneOffset.class);

      return new ZoneOffsetTransition(dt, wallOffset, offsetAfter);
    }

    private ZoneOffsetTransitionRule toTransitionRule(ZoneOffset standardOffset, int savingsBeforeSecs)
    {
      // "Last" rules are stored as "on or after" the earliest day the last week can start.
      if (dayOfMonthIndicator < 0 && month != Month.FEBRUARY)
        dayOfMonthIndicator = month.maxLength() - 6;

      if (timeEndOfDay && dayOfMonthIndicator > 0 && !(dayOfMonthIndicator == 28 && month == Month.FEBRUARY)) {
        LocalDate   date = LocalDate.of(2004, month, dayOfMonthIndicator).plusDays(1);

        month = date.getMonth();
        dayOfMonthIndicator = date.getDayOfMonth();

        if (dayOfWeek != null)
          dayOfWeek = dayOfWeek.plus(1);

        timeEndOfDay = false;
      }

      ZoneOffsetTransition  trans = toTransition(standardOffset, savingsBeforeSecs);

      return new ZoneOffsetTransitionRule(month, dayOfMonthIndicator, dayOfWeek, time, timeEndOfDay, timeDefinition,
                                          standardOffset, trans.getOffsetBefore(), trans.getOffsetAfter());
    }

    @Override
    public int compareTo(TZRule other)
    {
      int   cmp = year - other.year;

      if (cmp == 0)
        cmp = month.compareTo(other.month);

      if (cmp == 0)
        cmp = toLocalDate().compareTo(other.toLocalDate());

      if (cmp == 0)
        cmp = time.compareTo(other.time);

      return cmp;
    }

    private LocalDate toLocalDate()
    {
      LocalDate   date;

      if (dayOfMonthIndicator < 0) {
        int   monthLen = month.length(IsoChronology.INSTANCE.isLeapYear(year));

        date = LocalDate.of(year, month, monthLen + 1 + dayOfMonthIndicator);

        if (dayOfWeek != null)
          date = date.with(previousOrSame(dayOfWeek));
      }
      else {
        date = LocalDate.of(year, month, dayOfMonthIndicator);

        if (dayOfWeek != null)
          date = date.with(nextOrSame(dayOfWeek));
      }

      if (timeEndOfDay)
        date = date.plusDays(1);

      return date;
    }
  }
}
