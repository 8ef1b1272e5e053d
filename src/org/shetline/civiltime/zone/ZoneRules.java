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

import java.util.List;
import java.util.Objects;

import org.shetline.civiltime.Duration;
import org.shetline.civiltime.Instant;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.ZoneOffset;


/**
 * The rules defining how the offset of a zone varies, both historically and, through recurring
 * transition rules, into the future.
 * <p>
 * Two implementations exist: {@link #of(ZoneOffset) fixed} rules, and the transition-table rules
 * produced by {@link #of(ZoneOffset, ZoneOffset, List, List, List)} or a {@link ZoneRulesBuilder}.
 * Both are immutable and thread-safe.
 */
public abstract class ZoneRules
{
  ZoneRules()
  {
  }

  public static ZoneRules of(ZoneOffset offset)
  {
    return new FixedZoneRules(Objects.requireNonNull(offset, "offset"));
  }

  /**
   * @param baseStandardOffset  standard offset before the first standard transition
   * @param baseWallOffset      wall offset before the first wall transition
   * @param standardTransitions changes to the standard offset, in order
   * @param transitions         changes to the wall offset, in order
   * @param lastRules           rules for the years after the last wall transition
   */
  public static ZoneRules of(ZoneOffset baseStandardOffset, ZoneOffset baseWallOffset,
                             List<ZoneOffsetTransition> standardTransitions,
                             List<ZoneOffsetTransition> transitions,
                             List<ZoneOffsetTransitionRule> lastRules)
  {
    Objects.requireNonNull(baseStandardOffset, "baseStandardOffset");
    Objects.requireNonNull(baseWallOffset, "baseWallOffset");
    Objects.requireNonNull(standardTransitions, "standardTransitions");
    Objects.requireNonNull(transitions, "transitions");
    Objects.requireNonNull(lastRules, "lastRules");

    return new StandardZoneRules(baseStandardOffset, baseWallOffset, standardTransitions, transitions, lastRules);
  }

  public abstract boolean isFixedOffset();

  public abstract ZoneOffset getOffset(Instant instant);

  /**
   * The best offset for a local date-time. In a gap this is the offset before the gap, which is
   * not actually valid; in an overlap it is the earlier of the two valid offsets.
   */
  public abstract ZoneOffset getOffset(LocalDateTime localDateTime);

  /**
   * Empty in a gap, two offsets (before then after) in an overlap, otherwise exactly one.
   */
  public abstract List<ZoneOffset> getValidOffsets(LocalDateTime localDateTime);

  public abstract ZoneOffsetTransition getTransition(LocalDateTime localDateTime);

  public boolean isValidOffset(LocalDateTime localDateTime, ZoneOffset offset)
  {
    return getValidOffsets(localDateTime).contains(offset);
  }

  public abstract ZoneOffset getStandardOffset(Instant instant);

  public Duration getDaylightSavings(Instant instant)
  {
    ZoneOffset  standardOffset = getStandardOffset(instant);
    ZoneOffset  actualOffset = getOffset(instant);

    return Duration.ofSeconds(actualOffset.getTotalSeconds() - standardOffset.getTotalSeconds());
  }

  public boolean isDaylightSavings(Instant instant)
  {
    return !getStandardOffset(instant).equals(getOffset(instant));
  }

  public abstract ZoneOffsetTransition nextTransition(Instant instant);

  public abstract ZoneOffsetTransition previousTransition(Instant instant);

  public abstract List<ZoneOffsetTransition> getTransitions();

  public abstract List<ZoneOffsetTransitionRule> getTransitionRules();
}
