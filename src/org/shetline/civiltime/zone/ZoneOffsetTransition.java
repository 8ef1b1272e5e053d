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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.shetline.civiltime.Duration;
import org.shetline.civiltime.Instant;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.ZoneOffset;


/**
 * A change from one offset to another at a specific point on the time-line, such as the start of
 * daylight saving time. A forward jump is a gap (local times are skipped), a backward jump an
 * overlap (local times repeat).
 */
public final class ZoneOffsetTransition implements Comparable<ZoneOffsetTransition>
{
  private final LocalDateTime transition;
  private final ZoneOffset    offsetBefore;
  private final ZoneOffset    offsetAfter;

  ZoneOffsetTransition(LocalDateTime transition, ZoneOffset offsetBefore, ZoneOffset offsetAfter)
  {
    this.transition = transition;
    this.offsetBefore = offsetBefore;
    this.offsetAfter = offsetAfter;
  }

  ZoneOffsetTransition(long epochSecond, ZoneOffset offsetBefore, ZoneOffset offsetAfter)
  {
    transition = LocalDateTime.ofEpochSecond(epochSecond, 0, offsetBefore);
    this.offsetBefore = offsetBefore;
    this.offsetAfter = offsetAfter;
  }

  public static ZoneOffsetTransition of(LocalDateTime transition, ZoneOffset offsetBefore, ZoneOffset offsetAfter)
  {
    Objects.requireNonNull(transition, "transition");
    Objects.requireNonNull(offsetBefore, "offsetBefore");
    Objects.requireNonNull(offsetAfter, "offsetAfter");

    if (offsetBefore.equals(offsetAfter))
      throw new IllegalArgumentException("Offsets must not be equal");
    else if (transition.getNano() != 0)
      throw new IllegalArgumentException("Nano-of-second must be zero");

    return new ZoneOffsetTransition(transition, offsetBefore, offsetAfter);
  }

  public Instant getInstant()
  {
    return transition.toInstant(offsetBefore);
  }

  public long toEpochSecond()
  {
    return transition.toEpochSecond(offsetBefore);
  }

  public LocalDateTime getDateTimeBefore()
  {
    return transition;
  }

  public LocalDateTime getDateTimeAfter()
  {
    return transition.plusSeconds(getDurationSeconds());
  }

  public ZoneOffset getOffsetBefore()
  {
    return offsetBefore;
  }

  public ZoneOffset getOffsetAfter()
  {
    return offsetAfter;
  }

  public Duration getDuration()
  {
    return Duration.ofSeconds(getDurationSeconds());
  }

  private int getDurationSeconds()
  {
    return offsetAfter.getTotalSeconds() - offsetBefore.getTotalSeconds();
  }

  public boolean isGap()
  {
    return offsetAfter.getTotalSeconds() > offsetBefore.getTotalSeconds();
  }

  public boolean isOverlap()
  {
    return offsetAfter.getTotalSeconds() < offsetBefore.getTotalSeconds();
  }

  /**
   * Whether the offset is valid at some local time inside this transition: never for a gap, for
   * either offset of an overlap.
   */
  public boolean isValidOffset(ZoneOffset offset)
  {
    return !isGap() && (offsetBefore.equals(offset) || offsetAfter.equals(offset));
  }

  List<ZoneOffset> getValidOffsets()
  {
    if (isGap())
      return Collections.emptyList();

    return Arrays.asList(offsetBefore, offsetAfter);
  }

  @Override
  public int compareTo(ZoneOffsetTransition other)
  {
    return getInstant().compareTo(other.getInstant());
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (!(obj instanceof ZoneOffsetTransition))
      return false;

    ZoneOffsetTransition  other = (ZoneOffsetTransition) obj;

    return transition.equals(other.transition) && offsetBefore.equals(other.offsetBefore) &&
           offsetAfter.equals(other.offsetAfter);
  }

  @Override
  public int hashCode()
  {
    return transition.hashCode() ^ offsetBefore.hashCode() ^ Integer.rotateLeft(offsetAfter.hashCode(), 16);
  }

  @Override
  public String toString()
  {
    return "Transition[" + (isGap() ? "Gap" : "Overlap") + " at " + transition + offsetBefore + " to " + offsetAfter + ']';
  }
}
