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

import java.util.ArrayList;
import java.util.Map;

import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.zone.ZoneRulesBuilder;


public class IanaZone extends ArrayList<IanaZoneRecord>
{
  private final String  zoneId;

  public IanaZone(String zoneId)
  {
    this.zoneId = zoneId;
  }

  public String getZoneId()
  {
    return zoneId;
  }

  public ZoneRulesBuilder toBuilder(Map<String, TzRuleSet> ruleSets)
  {
    ZoneRulesBuilder  builder = new ZoneRulesBuilder();
    int               windowStartYear = LocalDate.MIN_YEAR;

    for (IanaZoneRecord zoneRec : this) {
      zoneRec.addToBuilder(builder, ruleSets, windowStartYear);

      if (zoneRec.getUntilYear() != null)
        windowStartYear = zoneRec.getUntilYear();
    }

    return builder;
  }
}
