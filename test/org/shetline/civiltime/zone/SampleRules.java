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

import org.shetline.civiltime.DayOfWeek;
import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.LocalTime;
import org.shetline.civiltime.Month;
import org.shetline.civiltime.ZoneOffset;
import org.shetline.civiltime.zone.ZoneOffsetTransitionRule.TimeDefinition;


/**
 * Rules built by hand for tests that should not depend on the bundled tz data.
 */
final class SampleRules
{
  static final ZoneOffset OFFSET_ZERO = ZoneOffset.UTC;
  static final ZoneOffset OFFSET_PONE = ZoneOffset.ofHours(1);
  static final ZoneOffset OFFSET_PTWO = ZoneOffset.ofHours(2);

  private SampleRules()
  {
  }

  /**
   * UTC standard time with EU summer time from 1981: last Sunday in March and October, 01:00 UTC.
   */
  static ZoneRules london()
  {
    return addEuRules(new ZoneRulesBuilder().addWindowForever(OFFSET_ZERO)).toRules("Test/London");
  }

  /**
   * Fixed +01:00 until 1950, then the same rules as {@link #london()}.
   */
  static ZoneRules withStandardChange()
  {
    ZoneRulesBuilder  builder = new ZoneRulesBuilder()
      .addWindow(OFFSET_PONE, LocalDateTime.of(1950, 1, 1, 0, 0), TimeDefinition.WALL)
      .addWindowForever(OFFSET_ZERO);

    return addEuRules(builder).toRules("Test/Changed");
  }

  private static ZoneRulesBuilder addEuRules(ZoneRulesBuilder builder)
  {
    return builder
      .addRuleToWindow(1981, LocalDate.MAX_YEAR, Month.MARCH, -1, DayOfWeek.SUNDAY, LocalTime.of(1, 0), false,
                       TimeDefinition.UTC, 3600)
      .addRuleToWindow(1981, LocalDate.MAX_YEAR, Month.OCTOBER, -1, DayOfWeek.SUNDAY, LocalTime.of(1, 0), false,
                       TimeDefinition.UTC, 0);
  }
}
