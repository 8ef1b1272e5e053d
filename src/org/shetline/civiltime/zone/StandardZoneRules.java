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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.shetline.civiltime.Instant;
import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.ZoneOffset;

import static java.lang.Math.floorDiv;


/**
 * Zone rules backed by a table of historical transitions plus a set of recurring rules used after
 * the last of them.
 */
final class StandardZoneRules extends ZoneRules
{
  static final int  MAX_LAST_RULES = 15;

  // Years beyond this are computed on every request rather than cached.
  private static final int  LAST_CACHED_YEAR = 2100;

  private final long[]                      standardTransitions;
  private final ZoneOffset[]                standardOffsets;
  private final long[]                      savingsInstantTransitions;
  private final ZoneOffset[]                wallOffsets;
  private final ZoneOffsetTransitionRule[]  lastRules;
  // Pairs of local date-times bracketing each gap or overlap, in ascending order.
  private final LocalDateTime[]             savingsLocalTransitions;

  private final ConcurrentMap<Integer, ZoneOffsetTransition[]> lastRulesCache = new ConcurrentHashMap<>();

  StandardZoneRules(ZoneOffset baseStandardOffset, ZoneOffset baseWallOffset,
                    List<ZoneOffsetTransition> standardOffsetTransitionList,
                    List<ZoneOffsetTransition> transitionList,
                    List<ZoneOffsetTransitionRule> lastRules)
  {
    standardTransitions = new long[standardOffsetTransitionList.size()];
    standardOffsets = new ZoneOffset[standardOffsetTransitionList.size() + 1];
    standardOffsets[0] = baseStandardOffset;

    for (int i = 0; i < standardOffsetTransitionList.size(); ++i) {
      standardTransitions[i] = standardOffsetTransitionList.get(i).toEpochSecond();
      standardOffsets[i + 1] = standardOffsetTransitionList.get(i).getOffsetAfter();
    }

    wallOffsets = new ZoneOffset[transitionList.size() + 1];
    wallOffsets[0] = baseWallOffset;
    savingsInstantTransitions = new long[transitionList.size()];

    for (int i = 0; i < transitionList.size(); ++i) {
      ZoneOffsetTransition  trans = transitionList.get(i);

      savingsInstantTransitions[i] = trans.toEpochSecond();
      wallOffsets[i + 1] = trans.getOffsetAfter();
    }

    if (lastRules.size() > MAX_LAST_RULES)
      throw new IllegalArgumentException("Too many transition rules");

    this.lastRules = lastRules.toArray(new ZoneOffsetTransitionRule[0]);
    savingsLocalTransitions = buildLocalTransitions(savingsInstantTransitions, wallOffsets);
  }

  StandardZoneRules(long[] standardTransitions, ZoneOffset[] standardOffsets, long[] savingsInstantTransitions,
                    ZoneOffset[] wallOffsets, ZoneOffsetTransitionRule[] lastRules)
  {
    this.standardTransitions = standardTransitions;
    this.standardOffsets = standardOffsets;
    this.savingsInstantTransitions = savingsInstantTransitions;
    this.wallOffsets = wallOffsets;
    this.lastRules = lastRules;
    savingsLocalTransitions = buildLocalTransitions(savingsInstantTransitions, wallOffsets);
  }

  private static LocalDateTime[] buildLocalTransitions(long[] instantTransitions, ZoneOffset[] wallOffsets)
  {
    List<LocalDateTime>   localTransitions = new ArrayList<>(instantTransitions.length * 2);

    for (int i = 0; i < instantTransitions.length; ++i) {
      ZoneOffsetTransition  trans = new ZoneOffsetTransition(instantTransitions[i], wallOffsets[i], wallOffsets[i + 1]);

      if (trans.isGap()) {
        localTransitions.add(trans.getDateTimeBefore());
        localTransitions.add(trans.getDateTimeAfter());
      }
      else {
        localTransitions.add(trans.getDateTimeAfter());
        localTransitions.add(trans.getDateTimeBefore());
      }
    }

    return localTransitions.toArray(new LocalDateTime[0]);
  }

  long[] getStandardTransitionArray()
  {
    return standardTransitions;
  }

  ZoneOffset[] getStandardOffsetArray()
  {
    return standardOffsets;
  }

  long[] getSavingsInstantTransitionArray()
  {
    return savingsInstantTransitions;
  }

  ZoneOffset[] getWallOffsetArray()
  {
    return wallOffsets;
  }

  ZoneOffsetTransitionRule[] getLastRuleArray()
  {
    return lastRules;
  }

  @Override
  public boolean isFixedOffset()
  {
    return savingsInstantTransitions.length == 0 && lastRules.length == 0 && standardTransitions.length == 0;
  }

  private boolean beyondHistory(long epochSecond)
  {
    return lastRules.length > 0 &&
      (savingsInstantTransitions.length == 0 || epochSecond > savingsInstantTransitions[savingsInstantTransitions.length - 1]);
  }

  @Override
  public ZoneOffset getOffset(Instant instant)
  {
    long  epochSec = instant.getEpochSecond();

    if (beyondHistory(epochSec)) {
      int                     year = findYear(epochSec, wallOffsets[wallOffsets.length - 1]);
      ZoneOffsetTransition[]  transArray = findTransitionArray(year);
      ZoneOffsetTransition    trans = null;

      for (ZoneOffsetTransition t : transArray) {
        trans = t;

        if (epochSec < trans.toEpochSecond())
          return trans.getOffsetBefore();
      }

      return trans.getOffsetAfter();
    }

    int   index = Arrays.binarySearch(savingsInstantTransitions, epochSec);

    if (index < 0)
      index = -index - 2;

    return wallOffsets[index + 1];
  }

  @Override
  public ZoneOffset getOffset(LocalDateTime localDateTime)
  {
    Object  info = getOffsetInfo(localDateTime);

    if (info instanceof ZoneOffsetTransition)
      return ((ZoneOffsetTransition) info).getOffsetBefore();

    return (ZoneOffset) info;
  }

  @Override
  public List<ZoneOffset> getValidOffsets(LocalDateTime localDateTime)
  {
    Object  info = getOffsetInfo(localDateTime);

    if (info instanceof ZoneOffsetTransition)
      return ((ZoneOffsetTransition) info).getValidOffsets();

    return Collections.singletonList((ZoneOffset) info);
  }

  @Override
  public ZoneOffsetTransition getTransition(LocalDateTime localDateTime)
  {
    Object  info = getOffsetInfo(localDateTime);

    return (info instanceof ZoneOffsetTransition ? (ZoneOffsetTransition) info : null);
  }

  /**
   * Either the single {@link ZoneOffset} valid at the local date-time, or the
   * {@link ZoneOffsetTransition} whose gap or overlap contains it.
   */
  private Object getOffsetInfo(LocalDateTime dt)
  {
    if (lastRules.length > 0 &&
        (savingsLocalTransitions.length == 0 || dt.isAfter(savingsLocalTransitions[savingsLocalTransitions.length - 1]))) {
      ZoneOffsetTransition[]  transArray = findTransitionArray(dt.getYear());
      Object                  info = null;

      for (ZoneOffsetTransition trans : transArray) {
        info = findOffsetInfo(dt, trans);

        if (info instanceof ZoneOffsetTransition || info.equals(trans.getOffsetBefore()))
          return info;
      }

      return info;
    }

    int   index = Arrays.binarySearch(savingsLocalTransitions, dt);

    if (index == -1)
      return wallOffsets[0];

    if (index < 0)
      index = -index - 2;
    else if (index < savingsLocalTransitions.length - 1 && savingsLocalTransitions[index].equals(savingsLocalTransitions[index + 1]))
      ++index;

    if ((index & 1) == 0) {
      LocalDateTime   dtBefore = savingsLocalTransitions[index];
      LocalDateTime   dtAfter = savingsLocalTransitions[index + 1];
      ZoneOffset      offsetBefore = wallOffsets[index / 2];
      ZoneOffset      offsetAfter = wallOffsets[index / 2 + 1];

      if (offsetAfter.getTotalSeconds() > offsetBefore.getTotalSeconds())
        return new ZoneOffsetTransition(dtBefore, offsetBefore, offsetAfter);
      else
        return new ZoneOffsetTransition(dtAfter, offsetBefore, offsetAfter);
    }

    return wallOffsets[index / 2 + 1];
  }

  private static Object findOffsetInfo(LocalDateTime dt, ZoneOffsetTransition trans)
  {
    LocalDateTime   localTransition = trans.getDateTimeBefore();

    if (trans.isGap()) {
      if (dt.isBefore(localTransition))
        return trans.getOffsetBefore();
      else if (dt.isBefore(trans.getDateTimeAfter()))
        return trans;
      else
        return trans.getOffsetAfter();
    }
    else {
      if (!dt.isBefore(localTransition))
        return trans.getOffsetAfter();
      else if (dt.isBefore(trans.getDateTimeAfter()))
        return trans.getOffsetBefore();
      else
        return trans;
    }
  }

  private ZoneOffsetTransition[] findTransitionArray(int year)
  {
    ZoneOffsetTransition[]  transArray = lastRulesCache.get(year);

    if (transArray != null)
      return transArray;

    transArray = new ZoneOffsetTransition[lastRules.length];

    for (int i = 0; i < lastRules.length; ++i)
      transArray[i] = lastRules[i].createTransition(year);

    if (year < LAST_CACHED_YEAR)
      lastRulesCache.putIfAbsent(year, transArray);

    return transArray;
  }

  @Override
  public ZoneOffset getStandardOffset(Instant instant)
  {
    int   index = Arrays.binarySearch(standardTransitions, instant.getEpochSecond());

    if (index < 0)
      index = -index - 2;

    return standardOffsets[index + 1];
  }

  @Override
  public ZoneOffsetTransition nextTransition(Instant instant)
  {
    if (savingsInstantTransitions.length == 0 && lastRules.length == 0)
      return null;

    long  epochSec = instant.getEpochSecond();

    if (savingsInstantTransitions.length == 0 || epochSec >= savingsInstantTransitions[savingsInstantTransitions.length - 1]) {
      if (lastRules.length == 0)
        return null;

      int                     year = findYear(epochSec, wallOffsets[wallOffsets.length - 1]);
      ZoneOffsetTransition[]  transArray = findTransitionArray(year);

      for (ZoneOffsetTransition trans : transArray) {
        if (epochSec < trans.toEpochSecond())
          return trans;
      }

      if (year < LocalDate.MAX_YEAR)
        return findTransitionArray(year + 1)[0];

      return null;
    }

    int   index = Arrays.binarySearch(savingsInstantTransitions, epochSec);

    if (index < 0)
      index = -index - 1;
    else
      ++index;

    return new ZoneOffsetTransition(savingsInstantTransitions[index], wallOffsets[index], wallOffsets[index + 1]);
  }

  @Override
  public ZoneOffsetTransition previousTransition(Instant instant)
  {
    if (savingsInstantTransitions.length == 0 && lastRules.length == 0)
      return null;

    long  epochSec = instant.getEpochSecond();

    if (instant.getNano() > 0 && epochSec < Long.MAX_VALUE)
      ++epochSec;

    if (beyondHistory(epochSec)) {
      ZoneOffset              lastHistoricOffset = wallOffsets[wallOffsets.length - 1];
      int                     year = findYear(epochSec, lastHistoricOffset);
      ZoneOffsetTransition[]  transArray = findTransitionArray(year);

      for (int i = transArray.length - 1; i >= 0; --i) {
        if (epochSec > transArray[i].toEpochSecond())
          return transArray[i];
      }

      int   firstRuleYear;

      if (savingsInstantTransitions.length > 0)
        firstRuleYear = findYear(savingsInstantTransitions[savingsInstantTransitions.length - 1], lastHistoricOffset) + 1;
      else
        firstRuleYear = LocalDate.MIN_YEAR;

      if (--year >= firstRuleYear) {
        transArray = findTransitionArray(year);

        return transArray[transArray.length - 1];
      }
    }

    int   index = Arrays.binarySearch(savingsInstantTransitions, epochSec);

    if (index < 0)
      index = -index - 1;

    if (index <= 0)
      return null;

    return new ZoneOffsetTransition(savingsInstantTransitions[index - 1], wallOffsets[index - 1], wallOffsets[index]);
  }

  private static int findYear(long epochSecond, ZoneOffset offset)
  {
    long  localSecond = epochSecond + offset.getTotalSeconds();
    long  localEpochDay = floorDiv(localSecond, 86400L);

    // Instants reach a little past the local date range.
    if (localEpochDay > LocalDate.MAX.toEpochDay())
      return LocalDate.MAX_YEAR;
    else if (localEpochDay < LocalDate.MIN.toEpochDay())
      return LocalDate.MIN_YEAR;

    return LocalDate.ofEpochDay(localEpochDay).getYear();
  }

  @Override
  public List<ZoneOffsetTransition> getTransitions()
  {
    List<ZoneOffsetTransition>  list = new ArrayList<>(savingsInstantTransitions.length);

    for (int i = 0; i < savingsInstantTransitions.length; ++i)
      list.add(new ZoneOffsetTransition(savingsInstantTransitions[i], wallOffsets[i], wallOffsets[i + 1]));

    return Collections.unmodifiableList(list);
  }

  @Override
  public List<ZoneOffsetTransitionRule> getTransitionRules()
  {
    return Collections.unmodifiableList(Arrays.asList(lastRules));
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (!(obj instanceof StandardZoneRules))
      return false;

    StandardZoneRules   other = (StandardZoneRules) obj;

    return Arrays.equals(standardTransitions, other.standardTransitions) &&
           Arrays.equals(standardOffsets, other.standardOffsets) &&
           Arrays.equals(savingsInstantTransitions, other.savingsInstantTransitions) &&
           Arrays.equals(wallOffsets, other.wallOffsets) &&
           Arrays.equals(lastRules, other.lastRules);
  }

  @Override
  public int hashCode()
  {
    return Arrays.hashCode(standardTransitions) ^ Arrays.hashCode(standardOffsets) ^
           Arrays.hashCode(savingsInstantTransitions) ^ Arrays.hashCode(wallOffsets) ^ Arrays.hashCode(lastRules);
  }

  @Override
  public String toString()
  {
    return "StandardZoneRules[currentStandardOffset=" + standardOffsets[standardOffsets.length - 1] + "]";
  }
}
