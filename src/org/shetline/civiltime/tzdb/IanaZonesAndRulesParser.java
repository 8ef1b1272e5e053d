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

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.shetline.civiltime.tzdb.TzUtil.*;


/**
 * Reads the Rule, Zone and Link lines of IANA tz database source files, from a tzdata archive, a
 * directory, or the classpath. One parser collects one version of the database.
 */
public class IanaZonesAndRulesParser
{
  private static final Logger LOGGER = LoggerFactory.getLogger(IanaZonesAndRulesParser.class);

  public static final List<String>  TZ_SOURCE_FILES = Collections.unmodifiableList(Arrays.asList(
    "africa", "antarctica", "asia", "australasia", "europe", "northamerica", "southamerica", "etcetera", "backward"));

  /**
   * IDs that collide with the UTC, GMT and UT prefixes of offset-style zone IDs. Fixed-offset
   * zones take care of these.
   */
  public static final List<String>  EXCLUDED_ZONE_IDS = Collections.unmodifiableList(Arrays.asList(
    "UTC", "GMT", "GMT0", "GMT+0", "GMT-0"));

  private static final String   VERSION_FILE = "version";

  private final Map<String, IanaZone>   zoneMap = new HashMap<>();
  private final Map<String, String>     zoneAliases = new HashMap<>();
  private final Map<String, TzRuleSet>  ruleSetMap = new HashMap<>();
  private final boolean                 roundToMinutes;

  private String  version;
  private int     lineNo;

  public IanaZonesAndRulesParser()
  {
    this(false);
  }

  public IanaZonesAndRulesParser(boolean roundToMinutes)
  {
    this.roundToMinutes = roundToMinutes;
  }

  /**
   * Parses a gzipped tar archive such as tzdata2024a.tar.gz.
   *
   * @return the version named by the archive's version file, or null if it has none
   */
  public String parseArchive(InputStream archiveIn) throws IOException, IanaParserException
  {
    Map<String, InputStream>  sources = new HashMap<>();

    try (TarArchiveInputStream tarIn = new TarArchiveInputStream(new BufferedInputStream(new GZIPInputStream(archiveIn)))) {
      TarArchiveEntry   entry;

      while ((entry = tarIn.getNextEntry()) != null) {
        if (!entry.isFile())
          continue;

        String  sourceName = entry.getName();

        // Some archives place the files under a tzdb-VERSION directory.
        sourceName = sourceName.substring(sourceName.lastIndexOf('/') + 1);

        if (TZ_SOURCE_FILES.contains(sourceName) || VERSION_FILE.equals(sourceName)) {
          byte[]  fileContent = tarIn.readAllBytes();

          LOGGER.debug("Extracting {} ({} bytes)", sourceName, fileContent.length);
          sources.put(sourceName, new ByteArrayInputStream(fileContent));
        }
      }
    }

    return parseSources(sources);
  }

  public String parseDirectory(Path directory) throws IOException, IanaParserException
  {
    if (!Files.isDirectory(directory))
      throw new IOException("Not a directory: " + directory);

    Map<String, InputStream>  sources = new HashMap<>();

    try {
      for (String sourceName : allFileNames()) {
        Path  file = directory.resolve(sourceName);

        if (Files.isRegularFile(file))
          sources.put(sourceName, Files.newInputStream(file));
      }

      return parseSources(sources);
    }
    finally {
      closeAll(sources);
    }
  }

  public String parseResources(String basePath) throws IOException, IanaParserException
  {
    Map<String, InputStream>  sources = new HashMap<>();

    try {
      for (String sourceName : allFileNames()) {
        InputStream   in = IanaZonesAndRulesParser.class.getResourceAsStream(basePath + "/" + sourceName);

        if (in != null)
          sources.put(sourceName, in);
      }

      if (sources.isEmpty())
        throw new IOException("No tz source files found at " + basePath);

      return parseSources(sources);
    }
    finally {
      closeAll(sources);
    }
  }

  /**
   * Parses the given sources, keyed by file name, in the standard file order. A "version" entry
   * supplies the version string. Missing files are skipped.
   *
   * @return the version, or null if none was supplied
   */
  public String parseSources(Map<String, InputStream> inputStreams) throws IanaParserException
  {
    InputStream   versionIn = inputStreams.get(VERSION_FILE);

    if (versionIn != null) {
      try {
        version = new String(versionIn.readAllBytes(), StandardCharsets.UTF_8).trim();
        LOGGER.info("tz database version: {}", version);
      }
      catch (IOException e) {
        throw new IanaParserException(0, VERSION_FILE, "Failed reading \"" + VERSION_FILE + "\": " + e.getMessage(), e);
      }
    }

    for (String sourceName : TZ_SOURCE_FILES) {
      InputStream   in = inputStreams.get(sourceName);

      if (in == null) {
        LOGGER.debug("No {} source file", sourceName);
        continue;
      }

      try {
        parseSource(sourceName, in);
      }
      catch (IOException e) {
        throw new IanaParserException(0, sourceName, "Failed reading \"" + sourceName + "\": " + e.getMessage(), e);
      }
      catch (RuntimeException e) {
        throw new IanaParserException(lineNo, sourceName, e.getMessage(), e);
      }
    }

    // Remove aliases for anything that actually has its own defined zone.
    zoneAliases.keySet().removeAll(zoneMap.keySet());

    for (String zoneId : EXCLUDED_ZONE_IDS) {
      zoneMap.remove(zoneId);
      zoneAliases.remove(zoneId);
    }

    // Make sure remaining aliases point to a defined zone, following links to links.
    for (Map.Entry<String, String> alias : zoneAliases.entrySet()) {
      String  target = alias.getValue();

      for (int i = 0; i < 4 && !zoneMap.containsKey(target) && zoneAliases.containsKey(target); ++i)
        target = zoneAliases.get(target);

      if (!zoneMap.containsKey(target))
        throw new IanaParserException(0, null, alias.getKey() + " is mapped to unknown time zone " + alias.getValue());

      alias.setValue(target);
    }

    for (IanaZone zone : zoneMap.values()) {
      for (IanaZoneRecord zoneRec : zone) {
        if (zoneRec.getRules() != null && !ruleSetMap.containsKey(zoneRec.getRules()))
          throw new IanaParserException(0, null, "Zone " + zone.getZoneId() + " uses unknown rules " + zoneRec.getRules());
      }
    }

    LOGGER.info("Parsed {} zones, {} links and {} rule sets", zoneMap.size(), zoneAliases.size(), ruleSetMap.size());

    return version;
  }

  private void parseSource(String sourceName, InputStream source) throws IOException, IanaParserException
  {
    BufferedReader    in = new BufferedReader(new InputStreamReader(source, StandardCharsets.UTF_8));
    String            line;
    IanaZone          zone = null;
    IanaZoneRecord    zoneRec;
    String            zoneId = null;

    LOGGER.debug("Parsing {}", sourceName);
    lineNo = 0;

    while ((line = readLine(in)) != null) {
      zoneRec = null;

      if (line.startsWith("Rule")) {
        if (zone != null)
          throw new IanaParserException(lineNo, sourceName, "Zone " + zoneId + " was not properly terminated");

        TzRule      rule = TzRule.parseRule(line, roundToMinutes);
        TzRuleSet   ruleSet = ruleSetMap.computeIfAbsent(rule.getName(), TzRuleSet::new);

        ruleSet.add(rule);
      }
      else if (line.startsWith("Link")) {
        if (zone != null)
          throw new IanaParserException(lineNo, sourceName, "Zone " + zoneId + " was not properly terminated");

        String[]  parts = line.split("\\s+");

        if (parts.length < 3)
          throw new IanaParserException(lineNo, sourceName, "Incomplete Link line: " + line);

        zoneAliases.put(parts[2], parts[1]);
      }
      else if (line.startsWith("Zone")) {
        if (zone != null)
          throw new IanaParserException(lineNo, sourceName, "Zone " + zoneId + " was not properly terminated");

        StringBuilder   sb = new StringBuilder();

        zoneRec = IanaZoneRecord.parseZoneRecord(line, sb, roundToMinutes);
        zoneId = sb.toString();
        zone = new IanaZone(zoneId);
      }
      else if (zone != null && Character.isWhitespace(line.charAt(0)))
        zoneRec = IanaZoneRecord.parseZoneRecord(line, null, roundToMinutes);
      else
        LOGGER.warn("Ignoring unrecognized line {} of {}: {}", lineNo, sourceName, line);

      if (zoneRec != null) {
        zone.add(zoneRec);

        if (zoneRec.isForever()) {
          if (zoneMap.put(zoneId, zone) != null)
            LOGGER.warn("Zone {} redefined in {}", zoneId, sourceName);

          zone = null;
        }
      }
    }

    if (zone != null)
      throw new IanaParserException(lineNo, sourceName, "Zone " + zoneId + " was not properly terminated");
  }

  public List<String> getZoneIds()
  {
    List<String>  zoneIds = new ArrayList<>();

    zoneIds.addAll(zoneMap.keySet());
    zoneIds.addAll(zoneAliases.keySet());

    Collections.sort(zoneIds);

    return zoneIds;
  }

  public IanaZone getZone(String zoneId)
  {
    if (zoneAliases.containsKey(zoneId))
      zoneId = zoneAliases.get(zoneId);

    return zoneMap.get(zoneId);
  }

  public boolean isLink(String zoneId)
  {
    return zoneAliases.containsKey(zoneId);
  }

  public TzRuleSet getRuleSet(String rulesName)
  {
    return ruleSetMap.get(rulesName);
  }

  public Map<String, TzRuleSet> getRuleSets()
  {
    return Collections.unmodifiableMap(ruleSetMap);
  }

  public String getVersion()
  {
    return version;
  }

  public boolean isRoundToMinutes()
  {
    return roundToMinutes;
  }

  private String readLine(BufferedReader in) throws IOException
  {
    String  line;

    do {
      line = in.readLine();
      ++lineNo;

      if (line != null) {
        int pos = line.indexOf('#');

        if (pos >= 0)
          line = line.substring(0, pos);

        line = rtrim(line);
      }
    } while (line != null && line.length() == 0);

    return line;
  }

  private static List<String> allFileNames()
  {
    List<String>  names = new ArrayList<>(TZ_SOURCE_FILES);

    names.add(VERSION_FILE);

    return names;
  }

  private static void closeAll(Map<String, InputStream> sources) throws IOException
  {
    IOException   failure = null;

    for (InputStream in : sources.values()) {
      try {
        in.close();
      }
      catch (IOException e) {
        if (failure == null)
          failure = e;
        else
          failure.addSuppressed(e);
      }
    }

    if (failure != null)
      throw failure;
  }
}
