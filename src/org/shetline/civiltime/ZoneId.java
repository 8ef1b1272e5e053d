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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;

import org.shetline.civiltime.temporal.TemporalAccessor;
import org.shetline.civiltime.temporal.TemporalQueries;
import org.shetline.civiltime.zone.ZoneRules;
import org.shetline.civiltime.zone.ZoneRulesException;
import org.shetline.civiltime.zone.ZoneRulesRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.unmodifiableMap;


/**
 * A time-zone identifier. There are two kinds: a fixed {@link ZoneOffset}, and a region such as
 * {@code Europe/Paris} whose rules come from a {@link ZoneRulesRegistry}.
 * <p>
 * Two IDs are equal when their ID strings are equal; {@code Z}, {@code UTC} and {@code GMT}
 * share the same rules but are distinct IDs.
 */
public abstract class ZoneId
{
  private static final Logger LOGGER = LoggerFactory.getLogger(ZoneId.class);

  public static final Map<String, String> SHORT_IDS;

  static {
    Map<String, String>   map = new HashMap<>(64);

    map.put("ACT", "Australia/Darwin");
    map.put("AET", "Australia/Sydney");
    map.put("AGT", "America/Argentina/Buenos_Aires");
    map.put("ART", "Africa/Cairo");
    map.put("AST", "America/Anchorage");
    map.put("BET", "America/Sao_Paulo");
    map.put("BST", "Asia/Dhaka");
    map.put("CAT", "Africa/Harare");
    map.put("CNT", "America/St_Johns");
    map.put("CST", "America/Chicago");
    map.put("CTT", "Asia/Shanghai");
    map.put("EAT", "Africa/Addis_Ababa");
    map.put("ECT", "Europe/Paris");
    map.put("IET", "America/Indiana/Indianapolis");
    map.put("IST", "Asia/Kolkata");
    map.put("JST", "Asia/Tokyo");
    map.put("MIT", "Pacific/Apia");
    map.put("NET", "Asia/Yerevan");
    map.put("NST", "Pacific/Auckland");
    map.put("PLT", "Asia/Karachi");
    map.put("PNT", "America/Phoenix");
    map.put("PRT", "America/Puerto_Rico");
    map.put("PST", "America/Los_Angeles");
    map.put("SST", "Pacific/Guadalcanal");
    map.put("VST", "Asia/Ho_Chi_Minh");
    map.put("EST", "-05:00");
    map.put("MST", "-07:00");
    map.put("HST", "-10:00");
    SHORT_IDS = unmodifiableMap(map);
  }

  ZoneId()
  {
  }

  /**
   * The JVM's default zone. When the registry has no rules for it, the zone's current offset is
   * used instead.
   */
  public static ZoneId systemDefault()
  {
    TimeZone  tz = TimeZone.getDefault();

    try {
      return of(tz.getID(), SHORT_IDS);
    }
    catch (ZoneRulesException e) {
      LOGGER.warn("No rules for system zone {}, using its current fixed offset", tz.getID());

      return ZoneOffset.ofTotalSeconds(tz.getOffset(System.currentTimeMillis()) / 1000);
    }
  }

  public static Set<String> getAvailableZoneIds()
  {
    return ZoneRulesRegistry.getDefault().getAvailableZoneIds();
  }

  public static ZoneId of(String zoneId, Map<String, String> aliasMap)
  {
    Objects.requireNonNull(zoneId, "zoneId");
    Objects.requireNonNull(aliasMap, "aliasMap");

    String  id = aliasMap.get(zoneId);

    return of(id != null ? id : zoneId);
  }

  public static ZoneId of(String zoneId)
  {
    return of(zoneId, ZoneRulesRegistry.getDefault());
  }

  /**
   * Resolves an ID against a specific registry. Accepted forms are an offset ({@code Z},
   * {@code +01:00}...), {@code UTC}, {@code GMT} or {@code UT} alone or followed by an offset,
   * or a region ID known to the registry.
   */
  public static ZoneId of(String zoneId, ZoneRulesRegistry registry)
  {
    Objects.requireNonNull(zoneId, "zoneId");
    Objects.requireNonNull(registry, "registry");

    if (zoneId.length() <= 1 || zoneId.startsWith("+") || zoneId.startsWith("-"))
      return ZoneOffset.of(zoneId);
    else if (zoneId.startsWith("UTC") || zoneId.startsWith("GMT"))
      return ofWithPrefix(zoneId, 3, registry);
    else if (zoneId.startsWith("UT"))
      return ofWithPrefix(zoneId, 2, registry);

    return ZoneRegion.ofId(zoneId, true, registry);
  }

  public static DateTimeResult<ZoneId> tryOf(String zoneId)
  {
    return DateTimeResult.of(() -> of(zoneId));
  }

  private static ZoneId ofWithPrefix(String zoneId, int prefixLength, ZoneRulesRegistry registry)
  {
    String  prefix = zoneId.substring(0, prefixLength);

    if (zoneId.length() == prefixLength)
      return ofOffset(prefix, ZoneOffset.UTC);

    if (zoneId.charAt(prefixLength) != '+' && zoneId.charAt(prefixLength) != '-')
      return ZoneRegion.ofId(zoneId, true, registry);

    try {
      ZoneOffset  offset = ZoneOffset.of(zoneId.substring(prefixLength));

      return ofOffset(prefix, offset);
    }
    catch (DateTimeException e) {
      throw new DateTimeException(e.getKind(), "Invalid ID for offset-based ZoneId: " + zoneId, e);
    }
  }

  /**
   * A region ID wrapping an offset, such as {@code UTC+01:00}. An empty prefix returns the offset
   * itself.
   */
  public static ZoneId ofOffset(String prefix, ZoneOffset offset)
  {
    Objects.requireNonNull(prefix, "prefix");
    Objects.requireNonNull(offset, "offset");

    if (prefix.isEmpty())
      return offset;

    if (!prefix.equals("GMT") && !prefix.equals("UTC") && !prefix.equals("UT"))
      throw new IllegalArgumentException("prefix should be GMT, UTC or UT, is: " + prefix);

    if (offset.getTotalSeconds() != 0)
      prefix = prefix.concat(offset.getId());

    return new ZoneRegion(prefix, offset.getRules(), null);
  }

  public static ZoneId from(TemporalAccessor temporal)
  {
    ZoneId  obj = temporal.query(TemporalQueries.zone());

    if (obj == null)
      throw new DateTimeException("Unable to obtain ZoneId from TemporalAccessor: " +
                                  temporal + " of type " + temporal.getClass().getName());

    return obj;
  }

  public abstract String getId();

  public abstract ZoneRules getRules();

  public ZoneId normalized()
  {
    try {
      ZoneRules   rules = getRules();

      if (rules.isFixedOffset())
        return rules.getOffset(Instant.EPOCH);
    }
    catch (ZoneRulesException e) {
      LOGGER.debug("Rules unavailable while normalizing {}", getId(), e);
    }

    return this;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (obj instanceof ZoneId)
      return getId().equals(((ZoneId) obj).getId());

    return false;
  }

  @Override
  public int hashCode()
  {
    return getId().hashCode();
  }

  @Override
  public String toString()
  {
    return getId();
  }
}
