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

package org.shetline.civiltime;

import java.util.Objects;
import java.util.regex.Pattern;

import org.shetline.civiltime.zone.ZoneRules;
import org.shetline.civiltime.zone.ZoneRulesException;
import org.shetline.civiltime.zone.ZoneRulesRegistry;


/**
 * A region-based zone ID. Rules looked up at creation are held on to; a region created without
 * checking availability looks its rules up again on each request.
 */
final class ZoneRegion extends ZoneId
{
  private static final Pattern  REGION_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9~/._+-]+");

  private final String            id;
  private final ZoneRules         rules;
  private final ZoneRulesRegistry registry;

  ZoneRegion(String id, ZoneRules rules, ZoneRulesRegistry registry)
  {
    this.id = id;
    this.rules = rules;
    this.registry = registry;
  }

  static ZoneRegion ofId(String zoneId, boolean checkAvailable, ZoneRulesRegistry registry)
  {
    Objects.requireNonNull(zoneId, "zoneId");
    checkName(zoneId);

    ZoneRules   rules = null;

    try {
      rules = registry.getRules(zoneId, true);
    }
    catch (ZoneRulesException e) {
      if (zoneId.equals("GMT0"))
        rules = ZoneOffset.UTC.getRules();
      else if (checkAvailable)
        throw e;
    }

    return new ZoneRegion(zoneId, rules, registry);
  }

  private static void checkName(String zoneId)
  {
    if (!REGION_PATTERN.matcher(zoneId).matches())
      throw new DateTimeException(DateTimeErrorKind.PARSE, "Invalid ID for region-based ZoneId, invalid format: " + zoneId);
  }

  @Override
  public String getId()
  {
    return id;
  }

  @Override
  public ZoneRules getRules()
  {
    return (rules != null ? rules : registry.getRules(id, false));
  }
}
