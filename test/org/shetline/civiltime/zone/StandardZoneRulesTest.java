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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.shetline.civiltime.Duration;
import org.shetline.civiltime.Instant;
import org.shetline.civiltime.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.shetline.civiltime.zone.SampleRules.*;


public class StandardZoneRulesTest
{
  private static final long SPRING_2008 = 1206838800L;
  private static final long AUTUMN_2008 = 1224982800L;

  private ZoneRules rules;

  @BeforeEach
  public void setUp()
  {
    rules = london();
  }

  @Test
  public void offsetsByInstant()
  {
    assertFalse(rules.isFixedOffset());
    assertEquals(OFFSET_ZERO, rules.getOffset(Instant.ofEpochSecond(SPRING_2008 - 1)));
    assertEquals(OFFSET_PONE, rules.getOffset(Instant.ofEpochSecond(SPRING_2008)));
    assertEquals(OFFSET_PONE, rules.getOffset(Instant.ofEpochSecond(AUTUMN_2008 - 1)));
    assertEquals(OFFSET_ZERO, rules.getOffset(Instant.ofEpochSecond(AUTUMN_2008)));
    assertEquals(OFFSET_ZERO, rules.getOffset(Instant.EPOCH));
  }

  @Test
  public void savings()
  {
    Instant   summer = Instant.ofEpochSecond(1214870400L);

    assertEquals(OFFSET_ZERO, rules.getStandardOffset(summer));
    assertEquals(Duration.ofHours(1), rules.getDaylightSavings(summer));
    assertTrue(rules.isDaylightSavings(summer));
    assertFalse(rules.isDaylightSavings(Instant.ofEpochSecond(AUTUMN_2008 + 86400)));
  }

  @Test
  public void gap()
  {
    LocalDateTime   inGap = LocalDateTime.of(2008, 3, 30, 1, 30);

    assertEquals(Collections.emptyList(), rules.getValidOffsets(inGap));
    assertEquals(OFFSET_ZERO, rules.getOffset(inGap));
    assertFalse(rules.isValidOffset(inGap, OFFSET_ZERO));

    ZoneOffsetTransition  trans = rules.getTransition(inGap);

    assertNotNull(trans);
    assertTrue(trans.isGap());
    assertEquals(SPRING_2008, trans.toEpochSecond());
    assertEquals(LocalDateTime.of(2008, 3, 30, 2, 0), trans.getDateTimeAfter());
  }

  @Test
  public void overlap()
  {
    LocalDateTime   inOverlap = LocalDateTime.of(2008, 10, 26, 1, 30);

    assertEquals(Arrays.asList(OFFSET_PONE, OFFSET_ZERO), rules.getValidOffsets(inOverlap));
    assertEquals(OFFSET_PONE, rules.getOffset(inOverlap));
    assertTrue(rules.isValidOffset(inOverlap, OFFSET_ZERO));
    assertTrue(rules.isValidOffset(inOverlap, OFFSET_PONE));

    ZoneOffsetTransition  trans = rules.getTransition(inOverlap);

    assertTrue(trans.isOverlap());
    assertEquals(AUTUMN_2008, trans.toEpochSecond());
  }

  @Test
  public void ordinaryLocalTimes()
  {
    assertEquals(Collections.singletonList(OFFSET_PONE), rules.getValidOffsets(LocalDateTime.of(2008, 7, 1, 12, 0)));
    assertEquals(Collections.singletonList(OFFSET_ZERO), rules.getValidOffsets(LocalDateTime.of(2008, 10, 26, 2, 0)));
    assertNull(rules.getTransition(LocalDateTime.of(2008, 7, 1, 12, 0)));
    // Within the historical transitions as well as those generated from the recurring rules.
    assertEquals(Collections.emptyList(), rules.getValidOffsets(LocalDateTime.of(1981, 3, 29, 1, 0)));
    assertEquals(2, rules.getValidOffsets(LocalDateTime.of(1981, 10, 25, 1, 59)).size());
  }

  @Test
  public void nextTransition()
  {
    ZoneOffsetTransition  trans = rules.nextTransition(Instant.ofEpochSecond(SPRING_2008 - 1));

    assertEquals(SPRING_2008, trans.toEpochSecond());
    assertEquals(OFFSET_ZERO, trans.getOffsetBefore());
    assertEquals(OFFSET_PONE, trans.getOffsetAfter());
    assertEquals(AUTUMN_2008, rules.nextTransition(Instant.ofEpochSecond(SPRING_2008)).toEpochSecond());
    assertEquals(354672000L + 3600, rules.nextTransition(Instant.EPOCH).toEpochSecond());
  }

  @Test
  public void previousTransition()
  {
    assertEquals(AUTUMN_2008, rules.previousTransition(Instant.ofEpochSecond(AUTUMN_2008 + 60)).toEpochSecond());
    assertEquals(SPRING_2008, rules.previousTransition(Instant.ofEpochSecond(SPRING_2008 + 60)).toEpochSecond());
    // 2007-10-28T01:00Z
    assertEquals(1193533200L, rules.previousTransition(Instant.ofEpochSecond(1199145600L)).toEpochSecond());
    assertNull(rules.previousTransition(Instant.EPOCH));
  }

  @Test
  public void instantsBeyondLastLocalYear()
  {
    assertEquals(OFFSET_ZERO, rules.getOffset(Instant.MAX));
    assertNull(rules.nextTransition(Instant.MAX));

    ZoneOffsetTransition  last = rules.previousTransition(Instant.MAX);

    assertEquals(999999999, last.getDateTimeBefore().getYear());
    assertEquals(10, last.getDateTimeBefore().getMonthValue());
    assertTrue(last.isOverlap());
  }

  @Test
  public void equality()
  {
    assertEquals(london(), rules);
    assertEquals(london().hashCode(), rules.hashCode());
    assertNotEquals(withStandardChange(), rules);
  }

  @Test
  public void binaryForm() throws IOException
  {
    for (ZoneRules original : Arrays.asList(rules, withStandardChange(), ZoneRules.of(OFFSET_PTWO))) {
      ByteArrayOutputStream   bytes = new ByteArrayOutputStream();

      try (DataOutputStream out = new DataOutputStream(bytes)) {
        ZoneRulesCodec.write(original, out);
      }

      ZoneRules   copy = ZoneRulesCodec.read(new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())));

      assertEquals(original, copy);
      assertEquals(original.getOffset(Instant.ofEpochSecond(SPRING_2008)), copy.getOffset(Instant.ofEpochSecond(SPRING_2008)));
    }
  }
}
