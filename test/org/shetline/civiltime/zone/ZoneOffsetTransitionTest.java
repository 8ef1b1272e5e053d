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

import org.junit.jupiter.api.Test;
import org.shetline.civiltime.Duration;
import org.shetline.civiltime.Instant;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.shetline.civiltime.zone.SampleRules.*;


public class ZoneOffsetTransitionTest
{
  @Test
  public void gap()
  {
    ZoneOffsetTransition  trans = ZoneOffsetTransition.of(LocalDateTime.of(2010, 3, 31, 1, 0), OFFSET_ZERO, OFFSET_PONE);

    assertTrue(trans.isGap());
    assertFalse(trans.isOverlap());
    assertEquals(Duration.ofHours(1), trans.getDuration());
    assertEquals(LocalDateTime.of(2010, 3, 31, 1, 0), trans.getDateTimeBefore());
    assertEquals(LocalDateTime.of(2010, 3, 31, 2, 0), trans.getDateTimeAfter());
    assertEquals(Instant.ofEpochSecond(LocalDateTime.of(2010, 3, 31, 1, 0).toEpochSecond(OFFSET_ZERO)), trans.getInstant());
    assertFalse(trans.isValidOffset(OFFSET_ZERO));
    assertFalse(trans.isValidOffset(OFFSET_PONE));
    assertEquals("Transition[Gap at 2010-03-31T01:00Z to +01:00]", trans.toString());
  }

  @Test
  public void overlap()
  {
    ZoneOffsetTransition  trans = ZoneOffsetTransition.of(LocalDateTime.of(2010, 10, 31, 1, 0), OFFSET_PONE, OFFSET_ZERO);

    assertTrue(trans.isOverlap());
    assertFalse(trans.isGap());
    assertEquals(Duration.ofHours(-1), trans.getDuration());
    assertEquals(LocalDateTime.of(2010, 10, 31, 0, 0), trans.getDateTimeAfter());
    assertTrue(trans.isValidOffset(OFFSET_ZERO));
    assertTrue(trans.isValidOffset(OFFSET_PONE));
    assertFalse(trans.isValidOffset(OFFSET_PTWO));
    assertEquals(Arrays.asList(OFFSET_PONE, OFFSET_ZERO), trans.getValidOffsets());
    assertEquals("Transition[Overlap at 2010-10-31T01:00+01:00 to Z]", trans.toString());
  }

  @Test
  public void invalidTransitions()
  {
    LocalDateTime   ldt = LocalDateTime.of(2010, 3, 31, 1, 0);

    assertThrows(IllegalArgumentException.class, () -> ZoneOffsetTransition.of(ldt, OFFSET_PONE, OFFSET_PONE));
    assertThrows(IllegalArgumentException.class, () -> ZoneOffsetTransition.of(ldt.withNano(5), OFFSET_ZERO, OFFSET_PONE));
    assertThrows(NullPointerException.class, () -> ZoneOffsetTransition.of(null, OFFSET_ZERO, OFFSET_PONE));
  }

  @Test
  public void equalityAndOrdering()
  {
    ZoneOffsetTransition  a = ZoneOffsetTransition.of(LocalDateTime.of(2010, 3, 31, 1, 0), OFFSET_ZERO, OFFSET_PONE);
    ZoneOffsetTransition  b = ZoneOffsetTransition.of(LocalDateTime.of(2010, 3, 31, 1, 0), OFFSET_ZERO, OFFSET_PONE);
    ZoneOffsetTransition  later = ZoneOffsetTransition.of(LocalDateTime.of(2010, 10, 31, 1, 0), OFFSET_PONE, OFFSET_ZERO);

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, later);
    assertTrue(a.compareTo(later) < 0);
    assertTrue(later.compareTo(a) > 0);
  }

  @Test
  public void sameLocalTimeDifferentOffsetsIsDifferentInstant()
  {
    ZoneOffsetTransition  a = ZoneOffsetTransition.of(LocalDateTime.of(2010, 3, 31, 1, 0), OFFSET_ZERO, OFFSET_PONE);
    ZoneOffsetTransition  b = ZoneOffsetTransition.of(LocalDateTime.of(2010, 3, 31, 1, 0), ZoneOffset.ofHours(-1), OFFSET_PONE);

    assertEquals(3600, b.toEpochSecond() - a.toEpochSecond());
  }
}
