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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.shetline.civiltime.DayOfWeek;
import org.shetline.civiltime.Duration;
import org.shetline.civiltime.Instant;
import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.LocalTime;
import org.shetline.civiltime.Month;
import org.shetline.civiltime.ZoneOffset;
import org.shetline.civiltime.zone.ZoneOffsetTransitionRule.TimeDefinition;

import static org.junit.jupiter.api.Assertions.*;
import static org.shetline.civiltime.zone.SampleRules.*;


public class ZoneRulesBuilderTest
{
  @Test
  public void singleWindowIsFixed()
  {
    ZoneRules   rules = new ZoneRulesBuilder().addWindowForever(ZoneOffset.ofHours(3)).toRules("Test/Fixed");

    assertTrue(rules.isFixedOffset());
    assertEquals(ZoneOffset.ofHours(3), rules.getOffset(Instant.EPOCH));
    assertEquals(ZoneOffset.ofHours(3), rules.getStandardOffset(Instant.EPOCH));
    assertTrue(rules.getTransitions().isEmpty());
    assertNull(rules.nextTransition(Instant.EPOCH));
  }

  @Test
  public void fixedSavingsKeepStandardOffset()
  {
    ZoneRules   rules = new ZoneRulesBuilder()
      .addWindowForever(ZoneOffset.ofHours(5))
      .setFixedSavingsToWindow(1800)
      .toRules("Test/Savings");

    assertTrue(rules.isFixedOffset());
    assertEquals(ZoneOffset.ofHoursMinutes(5, 30), rules.getOffset(Instant.EPOCH));
    assertEquals(ZoneOffset.ofHours(5), rules.getStandardOffset(Instant.EPOCH));
    assertEquals(Duration.ofMinutes(30), rules.getDaylightSavings(Instant.EPOCH));
    assertTrue(rules.isDaylightSavings(Instant.EPOCH));
  }

  @Test
  public void standardOffsetChange()
  {
    ZoneRules             rules = withStandardChange();
    List<ZoneOffsetTransition> transitions = rules.getTransitions();
    ZoneOffsetTransition  first = transitions.get(0);

    assertEquals(LocalDateTime.of(1950, 1, 1, 0, 0), first.getDateTimeBefore());
    assertEquals(OFFSET_PONE, first.getOffsetBefore());
    assertEquals(OFFSET_ZERO, first.getOffsetAfter());
    assertTrue(first.isOverlap());

    assertEquals(OFFSET_PONE, rules.getStandardOffset(LocalDateTime.of(1940, 1, 1, 0, 0).toInstant(OFFSET_PONE)));
    assertEquals(OFFSET_ZERO, rules.getStandardOffset(LocalDateTime.of(1960, 1, 1, 0, 0).toInstant(OFFSET_ZERO)));

    LocalDateTime   inOverlap = LocalDateTime.of(1949, 12, 31, 23, 30);

    assertEquals(2, rules.getValidOffsets(inOverlap).size());
    assertEquals(OFFSET_PONE, rules.getOffset(inOverlap));
  }

  @Test
  public void foreverRulesBecomeTransitionRules()
  {
    ZoneRules   rules = london();

    assertEquals(4, rules.getTransitions().size());
    assertEquals(LocalDateTime.of(1981, 3, 29, 1, 0), rules.getTransitions().get(0).getDateTimeBefore());
    assertEquals(LocalDateTime.of(1982, 10, 31, 2, 0), rules.getTransitions().get(3).getDateTimeBefore());
    assertEquals(2, rules.getTransitionRules().size());
    assertEquals(Month.MARCH, rules.getTransitionRules().get(0).getMonth());
    assertEquals(Month.OCTOBER, rules.getTransitionRules().get(1).getMonth());
  }

  @Test
  public void oneOffSavingsChange()
  {
    ZoneRules   rules = new ZoneRulesBuilder()
      .addWindowForever(OFFSET_ZERO)
      .addRuleToWindow(LocalDateTime.of(1990, 5, 1, 0, 0), TimeDefinition.WALL, 3600)
      .addRuleToWindow(LocalDateTime.of(1990, 9, 1, 0, 0), TimeDefinition.WALL, 0)
      .toRules("Test/OneOff");

    assertFalse(rules.isFixedOffset());
    assertEquals(2, rules.getTransitions().size());
    assertTrue(rules.getTransitionRules().isEmpty());
    assertEquals(OFFSET_PONE, rules.getOffset(LocalDateTime.of(1990, 7, 1, 0, 0)));
    assertEquals(OFFSET_ZERO, rules.getOffset(LocalDateTime.of(1991, 7, 1, 0, 0)));
  }

  @Test
  public void invalidUsage()
  {
    assertThrows(IllegalStateException.class, () -> new ZoneRulesBuilder().toRules("Test/Empty"));
    assertThrows(IllegalStateException.class, () -> new ZoneRulesBuilder().setFixedSavingsToWindow(3600));
    assertThrows(IllegalStateException.class, () -> new ZoneRulesBuilder()
      .addRuleToWindow(2000, Month.MARCH, 1, LocalTime.of(1, 0), false, TimeDefinition.WALL, 3600));
    assertThrows(IllegalArgumentException.class, () -> new ZoneRulesBuilder().addWindowForever(OFFSET_ZERO)
      .addRuleToWindow(2000, Month.MARCH, 0, LocalTime.of(1, 0), false, TimeDefinition.WALL, 3600));
    assertThrows(IllegalStateException.class, () -> new ZoneRulesBuilder().addWindowForever(OFFSET_ZERO)
      .setFixedSavingsToWindow(3600)
      .addRuleToWindow(2000, Month.MARCH, 1, LocalTime.of(1, 0), false, TimeDefinition.WALL, 3600));
    assertThrows(IllegalStateException.class, () -> new ZoneRulesBuilder()
      .addWindow(OFFSET_ZERO, LocalDateTime.of(2000, 1, 1, 0, 0), TimeDefinition.WALL)
      .addWindow(OFFSET_PONE, LocalDateTime.of(1990, 1, 1, 0, 0), TimeDefinition.WALL));
    assertThrows(IllegalStateException.class, () -> new ZoneRulesBuilder().addWindowForever(OFFSET_ZERO)
      .addRuleToWindow(2000, LocalDate.MAX_YEAR, Month.MARCH, -1, DayOfWeek.SUNDAY, LocalTime.of(1, 0), false,
                       TimeDefinition.UTC, 3600)
      .toRules("Test/OneForever"));
  }

  @Test
  public void sharedMapReusesEqualParts()
  {
    Map<Object, Object>   shared = new HashMap<>();
    ZoneRules             first = euRules().toRules("Test/First", shared);
    ZoneRules             second = euRules().toRules("Test/Second", shared);

    assertEquals(first, second);
    assertFalse(shared.isEmpty());
    assertEquals(2, first.getTransitionRules().size());
    assertSame(first.getTransitionRules().get(0), second.getTransitionRules().get(0));
    assertSame(first.getTransitionRules().get(1), second.getTransitionRules().get(1));
  }

  private static ZoneRulesBuilder euRules()
  {
    return new ZoneRulesBuilder()
      .addWindowForever(OFFSET_ZERO)
      .addRuleToWindow(1981, LocalDate.MAX_YEAR, Month.MARCH, -1, DayOfWeek.SUNDAY, LocalTime.of(1, 0), false,
                       TimeDefinition.UTC, 3600)
      .addRuleToWindow(1981, LocalDate.MAX_YEAR, Month.OCTOBER, -1, DayOfWeek.SUNDAY, LocalTime.of(1, 0), false,
                       TimeDefinition.UTC, 0);
  }
}
