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

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

import org.shetline.civiltime.DateTimeException;
import org.shetline.civiltime.zone.ZoneRules;
import org.shetline.civiltime.zone.ZoneRulesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Turns parsed tz database zones into {@link ZoneRules}. Rules are compiled on demand and cached,
 * links sharing the rules of their target zone. Equal offsets, date-times and transitions are
 * shared across every zone compiled by one compiler.
 */
public class TzCompiler
{
  private static final Logger LOGGER = LoggerFactory.getLogger(TzCompiler.class);

  private final IanaZonesAndRulesParser   parser;
  private final Map<Object, Object>       deduplicateMap = new HashMap<>();
  private final Map<String, ZoneRules>    compiled = new HashMap<>();

  public TzCompiler(IanaZonesAndRulesParser parser)
  {
    this.parser = parser;
  }

  public synchronized ZoneRules compile(String zoneId)
  {
    IanaZone  zone = parser.getZone(zoneId);

    if (zone == null)
      throw new ZoneRulesException("Unknown time-zone ID: " + zoneId);

    ZoneRules   rules = compiled.get(zone.getZoneId());

    if (rules == null) {
      try {
        rules = zone.toBuilder(parser.getRuleSets()).toRules(zone.getZoneId(), deduplicateMap);
      }
      catch (DateTimeException | IllegalArgumentException | IllegalStateException e) {
        throw new ZoneRulesException("Unable to compile time zone " + zone.getZoneId() + ": " + e.getMessage(), e);
      }

      compiled.put(zone.getZoneId(), rules);
      LOGGER.debug("Compiled {}", zone.getZoneId());
    }

    return rules;
  }

  public Map<String, ZoneRules> compileAll()
  {
    Map<String, ZoneRules>  allRules = new TreeMap<>();

    for (String zoneId : parser.getZoneIds())
      allRules.put(zoneId, compile(zoneId));

    LOGGER.info("Compiled {} time zones, {} of them links", allRules.size(), allRules.size() - compiled.size());

    return allRules;
  }

  public IanaZonesAndRulesParser getParser()
  {
    return parser;
  }
}
