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
import java.io.IOException;
import java.io.StreamCorruptedException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.shetline.civiltime.ZoneOffset;
import org.shetline.civiltime.zone.ZoneRules;

import static org.junit.jupiter.api.Assertions.*;


public class TzdbDatFileTest
{
  private static TzCompiler compiler;

  @BeforeAll
  public static void parseBundled() throws Exception
  {
    IanaZonesAndRulesParser   parser = new IanaZonesAndRulesParser();

    parser.parseResources(TzdbZoneRulesProvider.BUNDLED_SOURCES);
    compiler = new TzCompiler(parser);
  }

  private static byte[] write(Map<String, Map<String, ZoneRules>> versions) throws IOException
  {
    ByteArrayOutputStream   out = new ByteArrayOutputStream();

    TzdbDatFile.write(versions, out);

    return out.toByteArray();
  }

  @Test
  public void versionsAndRegions() throws Exception
  {
    Map<String, ZoneRules>  latest = new TreeMap<>();
    Map<String, ZoneRules>  older = new TreeMap<>();

    latest.put("Europe/London", compiler.compile("Europe/London"));
    latest.put("GB", compiler.compile("GB"));
    latest.put("Asia/Tokyo", compiler.compile("Asia/Tokyo"));
    older.put("Europe/London", ZoneRules.of(ZoneOffset.UTC));

    Map<String, Map<String, ZoneRules>>   versions = new LinkedHashMap<>();

    versions.put("2024a", latest);
    versions.put("2023c", older);

    TzdbDatFile   datFile = TzdbDatFile.read(new ByteArrayInputStream(write(versions)));

    assertEquals(Arrays.asList("2023c", "2024a"), datFile.getVersionIds());
    assertEquals(latest.keySet(), datFile.getRegionIds("2024a"));
    assertEquals(older.keySet(), datFile.getRegionIds("2023c"));
    assertTrue(datFile.getRegionIds("1999z").isEmpty());

    assertEquals(compiler.compile("Europe/London"), datFile.getRules("2024a", "Europe/London"));
    assertSame(datFile.getRules("2024a", "Europe/London"), datFile.getRules("2024a", "GB"));
    assertEquals(ZoneRules.of(ZoneOffset.UTC), datFile.getRules("2023c", "Europe/London"));
    assertNull(datFile.getRules("2023c", "Asia/Tokyo"));
    assertNull(datFile.getRules("1999z", "Europe/London"));
  }

  @Test
  public void sharedRulesStoredOnce() throws Exception
  {
    Map<String, ZoneRules>  one = new TreeMap<>();
    Map<String, ZoneRules>  two = new TreeMap<>();

    one.put("Europe/London", compiler.compile("Europe/London"));
    two.put("Europe/London", compiler.compile("Europe/London"));
    two.put("GB", compiler.compile("GB"));

    Map<String, Map<String, ZoneRules>>   single = new TreeMap<>();
    Map<String, Map<String, ZoneRules>>   both = new TreeMap<>();

    single.put("2024a", one);
    both.put("2024a", one);
    both.put("2024b", two);

    int   extra = write(both).length - write(single).length;

    // The rules themselves are stored once.
    assertEquals((2 + 5) + (2 + 2) + (2 + 2 * 4), extra);
  }

  @Test
  public void corruptData() throws Exception
  {
    assertThrows(StreamCorruptedException.class, () -> TzdbDatFile.read(new ByteArrayInputStream(new byte[] { 2, 0, 4, 'T', 'Z', 'D', 'B' })));
    assertThrows(StreamCorruptedException.class, () -> TzdbDatFile.read(new ByteArrayInputStream(new byte[] { 1, 0, 4, 'T', 'Z', 'D', 'X' })));

    Map<String, Map<String, ZoneRules>>   versions = new TreeMap<>();

    versions.put("2024a", new TreeMap<>(Map.of("Europe/London", compiler.compile("Europe/London"))));

    byte[]  data = write(versions);

    assertThrows(IOException.class, () -> TzdbDatFile.read(new ByteArrayInputStream(Arrays.copyOf(data, data.length - 3))));
  }
}
