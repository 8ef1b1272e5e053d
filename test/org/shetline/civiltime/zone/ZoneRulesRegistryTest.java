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

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;
import org.shetline.civiltime.ZoneId;
import org.shetline.civiltime.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.shetline.civiltime.zone.SampleRules.*;


public class ZoneRulesRegistryTest
{
  private static class MapProvider extends ZoneRulesProvider
  {
    private final Map<String, ZoneRules>  rules = new HashMap<>();
    private final Map<String, ZoneRules>  pending = new HashMap<>();

    private MapProvider(String id, ZoneRules zoneRules)
    {
      rules.put(id, zoneRules);
    }

    @Override
    protected Set<String> provideZoneIds()
    {
      return new HashSet<>(rules.keySet());
    }

    @Override
    protected ZoneRules provideRules(String regionId, boolean forCaching)
    {
      ZoneRules   zoneRules = rules.get(regionId);

      if (zoneRules == null)
        throw new ZoneRulesException("Unknown time-zone ID: " + regionId);

      return zoneRules;
    }

    @Override
    protected NavigableMap<String, ZoneRules> provideVersions(String regionId)
    {
      return new TreeMap<>(Collections.singletonMap("test", rules.get(regionId)));
    }

    @Override
    protected boolean provideRefresh()
    {
      if (pending.isEmpty())
        return false;

      rules.putAll(pending);
      pending.clear();

      return true;
    }
  }

  @Test
  public void emptyRegistry()
  {
    ZoneRulesRegistry   registry = new ZoneRulesRegistry();

    assertTrue(registry.isEmpty());
    assertTrue(registry.getAvailableZoneIds().isEmpty());

    ZoneRulesException  e = assertThrows(ZoneRulesException.class, () -> registry.getRules("Europe/London", false));

    assertEquals("No time-zone data files registered", e.getMessage());
    assertFalse(registry.refresh());
  }

  @Test
  public void registeredRules()
  {
    ZoneRulesRegistry   registry = new ZoneRulesRegistry();

    registry.registerProvider(new MapProvider("Test/London", london()));

    assertFalse(registry.isEmpty());
    assertEquals(Collections.singleton("Test/London"), registry.getAvailableZoneIds());
    assertEquals(london(), registry.getRules("Test/London", true));
    assertEquals(Collections.singleton("test"), registry.getVersions("Test/London").keySet());

    ZoneRulesException  e = assertThrows(ZoneRulesException.class, () -> registry.getRules("Test/Nowhere", false));

    assertEquals("Unknown time-zone ID: Test/Nowhere", e.getMessage());
  }

  @Test
  public void duplicateIdsAreRejected()
  {
    ZoneRulesRegistry   registry = new ZoneRulesRegistry();

    registry.registerProvider(new MapProvider("Test/London", london()));
    assertThrows(ZoneRulesException.class, () -> registry.registerProvider(new MapProvider("Test/London", withStandardChange())));
    assertEquals(london(), registry.getRules("Test/London", false));
  }

  @Test
  public void refreshAddsNewIds()
  {
    ZoneRulesRegistry   registry = new ZoneRulesRegistry();
    MapProvider         provider = new MapProvider("Test/London", london());

    registry.registerProvider(provider);
    provider.pending.put("Test/Changed", withStandardChange());

    assertTrue(registry.refresh());
    assertTrue(registry.getAvailableZoneIds().contains("Test/Changed"));
    assertEquals(withStandardChange(), registry.getRules("Test/Changed", false));
    assertFalse(registry.refresh());
  }

  @Test
  public void zoneIdsResolveThroughRegistry()
  {
    ZoneRulesRegistry   registry = new ZoneRulesRegistry();

    registry.registerProvider(new MapProvider("Test/London", london()));

    ZoneId  zone = ZoneId.of("Test/London", registry);

    assertEquals("Test/London", zone.getId());
    assertEquals(london(), zone.getRules());
    assertThrows(ZoneRulesException.class, () -> ZoneId.of("Test/Nowhere", registry));
    assertEquals(ZoneOffset.ofHours(2), ZoneId.of("+02:00", registry));
  }
}
