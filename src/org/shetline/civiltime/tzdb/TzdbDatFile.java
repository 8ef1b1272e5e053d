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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.StreamCorruptedException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.shetline.civiltime.zone.ZoneRules;
import org.shetline.civiltime.zone.ZoneRulesCodec;
import org.shetline.civiltime.zone.ZoneRulesException;


/**
 * Compiled zone rules for one or more tz database versions, in the TZDB.dat layout:
 * <pre>
 *   byte     format (1)
 *   UTF      "TZDB"
 *   short    version count, then each version ID as UTF
 *   short    region count, then each region ID as UTF
 *   short    rules count, then each rules blob as a short length and its bytes
 *   for each version:
 *     short  region count, then pairs of (short region index, short rules index)
 * </pre>
 * Rules shared by several regions or versions are stored once. A blob is decoded the first time
 * its rules are asked for.
 */
public class TzdbDatFile
{
  public static final int     FORMAT = 1;
  public static final String  GROUP_ID = "TZDB";

  private final List<String>                        versionIds;
  private final Map<String, Map<String, Integer>>   regionsByVersion;
  private final byte[][]                            rulesData;
  private final Map<Integer, ZoneRules>             decoded = new ConcurrentHashMap<>();

  private TzdbDatFile(List<String> versionIds, Map<String, Map<String, Integer>> regionsByVersion, byte[][] rulesData)
  {
    this.versionIds = versionIds;
    this.regionsByVersion = regionsByVersion;
    this.rulesData = rulesData;
  }

  public static TzdbDatFile read(InputStream input) throws IOException
  {
    DataInputStream   in = new DataInputStream(input);

    if (in.readByte() != FORMAT)
      throw new StreamCorruptedException("File format not recognised");

    String  groupId = in.readUTF();

    if (!GROUP_ID.equals(groupId))
      throw new StreamCorruptedException("File format not recognised");

    int           versionCount = in.readShort();
    List<String>  versionIds = new ArrayList<>(versionCount);

    for (int i = 0; i < versionCount; ++i)
      versionIds.add(in.readUTF());

    int       regionCount = in.readShort();
    String[]  regionIds = new String[regionCount];

    for (int i = 0; i < regionCount; ++i)
      regionIds[i] = in.readUTF();

    int       ruleCount = in.readShort();
    byte[][]  rulesData = new byte[ruleCount][];

    for (int i = 0; i < ruleCount; ++i) {
      byte[]  bytes = new byte[in.readUnsignedShort()];

      in.readFully(bytes);
      rulesData[i] = bytes;
    }

    Map<String, Map<String, Integer>>   regionsByVersion = new HashMap<>();

    for (String versionId : versionIds) {
      int                   count = in.readShort();
      Map<String, Integer>  regions = new TreeMap<>();

      for (int i = 0; i < count; ++i) {
        int   regionIndex = in.readShort();
        int   rulesIndex = in.readShort();

        if (regionIndex < 0 || regionIndex >= regionCount || rulesIndex < 0 || rulesIndex >= ruleCount)
          throw new StreamCorruptedException("Invalid index in version " + versionId);

        regions.put(regionIds[regionIndex], rulesIndex);
      }

      regionsByVersion.put(versionId, regions);
    }

    Collections.sort(versionIds);

    return new TzdbDatFile(Collections.unmodifiableList(versionIds), regionsByVersion, rulesData);
  }

  public static void write(Map<String, Map<String, ZoneRules>> versions, OutputStream output) throws IOException
  {
    Objects.requireNonNull(versions, "versions");

    Set<String>               allRegionIds = new TreeSet<>();
    List<byte[]>              rulesData = new ArrayList<>();
    Map<ZoneRules, Integer>   rulesIndices = new HashMap<>();

    for (Map<String, ZoneRules> regions : versions.values()) {
      for (Map.Entry<String, ZoneRules> entry : regions.entrySet()) {
        allRegionIds.add(entry.getKey());

        if (!rulesIndices.containsKey(entry.getValue())) {
          rulesIndices.put(entry.getValue(), rulesData.size());
          rulesData.add(encode(entry.getValue()));
        }
      }
    }

    List<String>  regionIds = new ArrayList<>(allRegionIds);

    if (versions.size() > Short.MAX_VALUE || regionIds.size() > Short.MAX_VALUE || rulesData.size() > Short.MAX_VALUE)
      throw new IllegalArgumentException("Too many versions, regions or rules for the TZDB format");

    DataOutputStream  out = new DataOutputStream(output);

    out.writeByte(FORMAT);
    out.writeUTF(GROUP_ID);
    out.writeShort(versions.size());

    for (String versionId : versions.keySet())
      out.writeUTF(versionId);

    out.writeShort(regionIds.size());

    for (String regionId : regionIds)
      out.writeUTF(regionId);

    out.writeShort(rulesData.size());

    for (byte[] bytes : rulesData) {
      if (bytes.length > 0xFFFF)
        throw new IllegalArgumentException("Rules too large for the TZDB format");

      out.writeShort(bytes.length);
      out.write(bytes);
    }

    for (Map<String, ZoneRules> regions : versions.values()) {
      out.writeShort(regions.size());

      for (Map.Entry<String, ZoneRules> entry : regions.entrySet()) {
        out.writeShort(Collections.binarySearch(regionIds, entry.getKey()));
        out.writeShort(rulesIndices.get(entry.getValue()));
      }
    }

    out.flush();
  }

  private static byte[] encode(ZoneRules rules) throws IOException
  {
    ByteArrayOutputStream   bytes = new ByteArrayOutputStream(1024);
    DataOutputStream        out = new DataOutputStream(bytes);

    ZoneRulesCodec.write(rules, out);
    out.flush();

    return bytes.toByteArray();
  }

  public List<String> getVersionIds()
  {
    return versionIds;
  }

  public Set<String> getRegionIds(String versionId)
  {
    Map<String, Integer>  regions = regionsByVersion.get(versionId);

    return regions == null ? Collections.emptySet() : Collections.unmodifiableSet(regions.keySet());
  }

  public ZoneRules getRules(String versionId, String regionId)
  {
    Map<String, Integer>  regions = regionsByVersion.get(versionId);
    Integer               index = (regions == null ? null : regions.get(regionId));

    if (index == null)
      return null;

    return decoded.computeIfAbsent(index, i -> decode(i, versionId, regionId));
  }

  private ZoneRules decode(int index, String versionId, String regionId)
  {
    try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(rulesData[index]))) {
      return ZoneRulesCodec.read(in);
    }
    catch (IOException e) {
      throw new ZoneRulesException("Invalid binary time-zone data: TZDB:" + regionId + ", version: " + versionId, e);
    }
  }
}
