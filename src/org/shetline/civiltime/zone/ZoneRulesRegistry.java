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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Maps region IDs to the providers that supply their rules.
 * <p>
 * A registry is an ordinary object: create one, register providers with it, and pass it to
 * {@link org.shetline.civiltime.ZoneId#of(String, ZoneRulesRegistry)}. The process-wide
 * {@link #getDefault() default registry} is built on first use from the providers
 * {@link ServiceLoader} finds.
 * <p>
 * Lookups may run concurrently with registration and refresh; the map is guarded by a read-write
 * lock.
 */
public class ZoneRulesRegistry
{
  private static final Logger LOGGER = LoggerFactory.getLogger(ZoneRulesRegistry.class);

  private final ReadWriteLock             lock = new ReentrantReadWriteLock();
  private final List<ZoneRulesProvider>   providers = new ArrayList<>();
  private final Map<String, ZoneRulesProvider> zones = new HashMap<>(512);

  private static class DefaultHolder
  {
    private static final ZoneRulesRegistry  INSTANCE = loadDefault();
  }

  public ZoneRulesRegistry()
  {
  }

  public static ZoneRulesRegistry getDefault()
  {
    return DefaultHolder.INSTANCE;
  }

  private static ZoneRulesRegistry loadDefault()
  {
    ZoneRulesRegistry   registry = new ZoneRulesRegistry();
    ServiceLoader<ZoneRulesProvider> loader = ServiceLoader.load(ZoneRulesProvider.class, ZoneRulesProvider.class.getClassLoader());

    try {
      for (ZoneRulesProvider provider : loader) {
        registry.registerProvider(provider);
        LOGGER.info("Registered zone rules provider {}", provider);
      }
    }
    catch (ServiceConfigurationError e) {
      if (!(e.getCause() instanceof SecurityException))
        throw e;

      LOGGER.warn("Zone rules provider not loaded: {}", e.getMessage());
    }

    if (registry.providers.isEmpty())
      LOGGER.warn("No zone rules providers found, only fixed-offset zones are available");

    return registry;
  }

  /**
   * @throws ZoneRulesException if the provider supplies an ID that is already registered, in
   *                            which case nothing is registered
   */
  public void registerProvider(ZoneRulesProvider provider)
  {
    Objects.requireNonNull(provider, "provider");

    lock.writeLock().lock();

    try {
      Set<String>   ids = provider.provideZoneIds();

      for (String zoneId : ids) {
        Objects.requireNonNull(zoneId, "zoneId");

        if (zones.containsKey(zoneId))
          throw new ZoneRulesException("Unable to register zone as one already registered with that ID: " + zoneId +
                                       ", currently loading from provider: " + provider);
      }

      for (String zoneId : ids)
        zones.put(zoneId, provider);

      providers.add(provider);
      LOGGER.debug("Provider {} supplies {} zone IDs", provider, ids.size());
    }
    finally {
      lock.writeLock().unlock();
    }
  }

  public Set<String> getAvailableZoneIds()
  {
    lock.readLock().lock();

    try {
      return new HashSet<>(zones.keySet());
    }
    finally {
      lock.readLock().unlock();
    }
  }

  public boolean isEmpty()
  {
    lock.readLock().lock();

    try {
      return zones.isEmpty();
    }
    finally {
      lock.readLock().unlock();
    }
  }

  public ZoneRules getRules(String zoneId, boolean forCaching)
  {
    Objects.requireNonNull(zoneId, "zoneId");

    return getProvider(zoneId).provideRules(zoneId, forCaching);
  }

  public NavigableMap<String, ZoneRules> getVersions(String zoneId)
  {
    Objects.requireNonNull(zoneId, "zoneId");

    return getProvider(zoneId).provideVersions(zoneId);
  }

  private ZoneRulesProvider getProvider(String zoneId)
  {
    lock.readLock().lock();

    try {
      ZoneRulesProvider   provider = zones.get(zoneId);

      if (provider == null) {
        if (zones.isEmpty())
          throw new ZoneRulesException("No time-zone data files registered");

        throw new ZoneRulesException("Unknown time-zone ID: " + zoneId);
      }

      return provider;
    }
    finally {
      lock.readLock().unlock();
    }
  }

  public boolean refresh()
  {
    boolean   changed = false;

    lock.writeLock().lock();

    try {
      for (ZoneRulesProvider provider : providers) {
        if (provider.provideRefresh()) {
          changed = true;

          for (String zoneId : provider.provideZoneIds())
            zones.putIfAbsent(zoneId, provider);
        }
      }
    }
    finally {
      lock.writeLock().unlock();
    }

    if (changed)
      LOGGER.info("Zone rules refreshed, {} zone IDs available", getAvailableZoneIds().size());

    return changed;
  }
}
