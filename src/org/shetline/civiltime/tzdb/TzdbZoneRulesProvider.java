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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Function;

import org.shetline.civiltime.zone.ZoneRules;
import org.shetline.civiltime.zone.ZoneRulesException;
import org.shetline.civiltime.zone.ZoneRulesProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Supplies zone rules from the IANA tz database. The data comes from the first of these that is
 * configured:
 * <ul>
 *   <li>{@code tzdb.compiled}, a TZDB.dat file written by {@link TzdbCompiler}</li>
 *   <li>{@code tzdb.archive}, a tzdata*.tar.gz archive</li>
 *   <li>{@code tzdb.directory}, a directory of tz source files</li>
 * </ul>
 * With none of them set, the abridged sources bundled on the classpath are used. Settings are read
 * from {@code /civiltime.properties}, and system properties named {@code civiltime.}<i>key</i>
 * override them. {@code tzdb.roundToMinutes} rounds offsets from sources to whole minutes.
 * <p>
 * Several versions can be held at once. Rules come from the newest version that has the region,
 * and {@link #provideRefresh()} adds a version when the configured file has changed to a newer one.
 */
public class TzdbZoneRulesProvider extends ZoneRulesProvider
{
  private static final Logger LOGGER = LoggerFactory.getLogger(TzdbZoneRulesProvider.class);

  public static final String  CONFIG_RESOURCE = "/civiltime.properties";
  public static final String  SYSTEM_PROPERTY_PREFIX = "civiltime.";
  public static final String  BUNDLED_SOURCES = "/org/shetline/civiltime/tzdb";

  public static final String  KEY_COMPILED = "tzdb.compiled";
  public static final String  KEY_ARCHIVE = "tzdb.archive";
  public static final String  KEY_DIRECTORY = "tzdb.directory";
  public static final String  KEY_ROUND_TO_MINUTES = "tzdb.roundToMinutes";

  private static final String UNKNOWN_VERSION = "unknown";

  private final ConcurrentNavigableMap<String, Version>   versions = new ConcurrentSkipListMap<>();
  private final Properties                                config;
  private volatile Set<String>                            regionIds = Collections.emptySet();

  private static class Version
  {
    private final String                      versionId;
    private final Set<String>                 regionIds;
    private final Function<String, ZoneRules> loader;
    private final Map<String, ZoneRules>      cache = new ConcurrentHashMap<>();

    private Version(String versionId, Set<String> regionIds, Function<String, ZoneRules> loader)
    {
      this.versionId = versionId;
      this.regionIds = regionIds;
      this.loader = loader;
    }

    private ZoneRules getRules(String regionId)
    {
      if (!regionIds.contains(regionId))
        return null;

      return cache.computeIfAbsent(regionId, loader);
    }

    @Override
    public String toString()
    {
      return versionId;
    }
  }

  public TzdbZoneRulesProvider()
  {
    this(loadConfiguration());
  }

  public TzdbZoneRulesProvider(Properties config)
  {
    this.config = config;

    try {
      loadConfigured();
    }
    catch (IOException | IanaParserException e) {
      throw new ZoneRulesException("Unable to load TZDB time-zone rules: " + e.getMessage(), e);
    }
  }

  public TzdbZoneRulesProvider(IanaZonesAndRulesParser parser)
  {
    this.config = null;
    addVersion(parser);
  }

  public TzdbZoneRulesProvider(TzdbDatFile datFile)
  {
    this.config = null;
    addVersions(datFile);
  }

  public static Properties loadConfiguration()
  {
    Properties  props = new Properties();

    try (InputStream in = TzdbZoneRulesProvider.class.getResourceAsStream(CONFIG_RESOURCE)) {
      if (in != null)
        props.load(in);
    }
    catch (IOException e) {
      throw new UncheckedIOException("Unable to read " + CONFIG_RESOURCE, e);
    }

    for (String key : new String[] { KEY_COMPILED, KEY_ARCHIVE, KEY_DIRECTORY, KEY_ROUND_TO_MINUTES }) {
      String  value = System.getProperty(SYSTEM_PROPERTY_PREFIX + key);

      if (value != null)
        props.setProperty(key, value);
    }

    return props;
  }

  // Returns true if a new version was added.
  private boolean loadConfigured() throws IOException, IanaParserException
  {
    String    compiled = setting(KEY_COMPILED);
    String    archive = setting(KEY_ARCHIVE);
    String    directory = setting(KEY_DIRECTORY);
    boolean   roundToMinutes = Boolean.parseBoolean(setting(KEY_ROUND_TO_MINUTES));
    int       before = versions.size();

    if (compiled != null) {
      LOGGER.info("Loading compiled time-zone rules from {}", compiled);

      try (InputStream in = Files.newInputStream(Paths.get(compiled))) {
        addVersions(TzdbDatFile.read(in));
      }
    }
    else {
      IanaZonesAndRulesParser   parser = new IanaZonesAndRulesParser(roundToMinutes);

      if (archive != null) {
        LOGGER.info("Loading time-zone rules from archive {}", archive);

        try (InputStream in = Files.newInputStream(Paths.get(archive))) {
          parser.parseArchive(in);
        }
      }
      else if (directory != null) {
        LOGGER.info("Loading time-zone rules from directory {}", directory);
        parser.parseDirectory(Paths.get(directory));
      }
      else {
        LOGGER.debug("Loading bundled time-zone rules");
        parser.parseResources(BUNDLED_SOURCES);
      }

      addVersion(parser);
    }

    return versions.size() > before;
  }

  private String setting(String key)
  {
    String  value = config.getProperty(key);

    return value == null || value.trim().isEmpty() ? null : value.trim();
  }

  private void addVersion(IanaZonesAndRulesParser parser)
  {
    String      versionId = (parser.getVersion() != null ? parser.getVersion() : UNKNOWN_VERSION);
    TzCompiler  compiler = new TzCompiler(parser);

    if (versions.containsKey(versionId))
      LOGGER.debug("Version {} already loaded", versionId);
    else
      addVersion(new Version(versionId, new HashSet<>(parser.getZoneIds()), compiler::compile));
  }

  private void addVersions(TzdbDatFile datFile)
  {
    for (String versionId : datFile.getVersionIds()) {
      if (versions.containsKey(versionId))
        LOGGER.debug("Version {} already loaded", versionId);
      else
        addVersion(new Version(versionId, datFile.getRegionIds(versionId), id -> datFile.getRules(versionId, id)));
    }
  }

  private void addVersion(Version version)
  {
    Set<String>   ids = new HashSet<>(regionIds);

    ids.addAll(version.regionIds);
    versions.put(version.versionId, version);
    regionIds = Collections.unmodifiableSet(ids);
    LOGGER.info("Loaded TZDB version {} with {} regions", version.versionId, version.regionIds.size());
  }

  @Override
  protected Set<String> provideZoneIds()
  {
    return new HashSet<>(regionIds);
  }

  @Override
  protected ZoneRules provideRules(String regionId, boolean forCaching)
  {
    for (Version version : versions.descendingMap().values()) {
      ZoneRules   rules = version.getRules(regionId);

      if (rules != null)
        return rules;
    }

    throw new ZoneRulesException("Unknown time-zone ID: " + regionId);
  }

  @Override
  protected NavigableMap<String, ZoneRules> provideVersions(String regionId)
  {
    NavigableMap<String, ZoneRules>   map = new TreeMap<>();

    for (Version version : versions.values()) {
      ZoneRules   rules = version.getRules(regionId);

      if (rules != null)
        map.put(version.versionId, rules);
    }

    return map;
  }

  @Override
  protected boolean provideRefresh()
  {
    if (config == null || (setting(KEY_COMPILED) == null && setting(KEY_ARCHIVE) == null && setting(KEY_DIRECTORY) == null))
      return false;

    try {
      return loadConfigured();
    }
    catch (IOException | IanaParserException e) {
      throw new ZoneRulesException("Unable to refresh TZDB time-zone rules: " + e.getMessage(), e);
    }
  }

  public Set<String> getVersionIds()
  {
    return Collections.unmodifiableSet(versions.keySet());
  }

  @Override
  public String toString()
  {
    return "TZDB[" + (versions.isEmpty() ? UNKNOWN_VERSION : versions.lastKey()) + "]";
  }
}
