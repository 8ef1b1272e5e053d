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
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;


public class IanaZonesAndRulesParserTest
{
  private static final String EUROPE =
    "# Sample\n" +
    "Rule\tEU\t1981\tmax\t-\tMar\tlastSun\t 1:00u\t1:00\tS\n" +
    "Rule\tEU\t1996\tmax\t-\tOct\tlastSun\t 1:00u\t0\t-\n" +
    "\n" +
    "Zone\tEurope/Berlin\t0:53:28 -\tLMT\t1893 Apr\n" +
    "\t\t\t1:00\t-\tCET\t1980\n" +
    "\t\t\t1:00\tEU\tCE%sT   # trailing comment\n";

  private static final String BACKWARD =
    "Link\tEurope/Berlin\tEurope/Busingen\n" +
    "Link\tEurope/Busingen\tEurope/Somewhere\n" +
    "Link\tEtc/UTC\tUTC\n";

  private static Map<String, InputStream> sources(String... namesAndContents)
  {
    Map<String, InputStream>  sources = new HashMap<>();

    for (int i = 0; i < namesAndContents.length; i += 2)
      sources.put(namesAndContents[i], new ByteArrayInputStream(namesAndContents[i + 1].getBytes(StandardCharsets.UTF_8)));

    return sources;
  }

  @Test
  public void parseSources() throws Exception
  {
    IanaZonesAndRulesParser   parser = new IanaZonesAndRulesParser();
    String                    version = parser.parseSources(sources("europe", EUROPE, "backward", BACKWARD,
                                                                    "etcetera", "Zone Etc/UTC 0 - UTC\n"));

    assertNull(version);
    assertEquals(List.of("Etc/UTC", "Europe/Berlin", "Europe/Busingen", "Europe/Somewhere"), parser.getZoneIds());
    assertEquals(3, parser.getZone("Europe/Berlin").size());
    assertEquals(2, parser.getRuleSet("EU").size());
    assertTrue(parser.getRuleSets().containsKey("EU"));
    assertNull(parser.getRuleSet("US"));
    assertFalse(parser.isRoundToMinutes());
  }

  @Test
  public void linksFollowedToTheirZone() throws Exception
  {
    IanaZonesAndRulesParser   parser = new IanaZonesAndRulesParser();

    parser.parseSources(sources("europe", EUROPE, "backward", BACKWARD));

    assertTrue(parser.isLink("Europe/Somewhere"));
    assertFalse(parser.isLink("Europe/Berlin"));
    assertSame(parser.getZone("Europe/Berlin"), parser.getZone("Europe/Somewhere"));
    assertEquals("Europe/Berlin", parser.getZone("Europe/Busingen").getZoneId());
    assertNull(parser.getZone("Europe/Nowhere"));
  }

  @Test
  public void bundledResources() throws Exception
  {
    IanaZonesAndRulesParser   parser = new IanaZonesAndRulesParser();

    assertEquals("2024a", parser.parseResources(TzdbZoneRulesProvider.BUNDLED_SOURCES));
    assertEquals("2024a", parser.getVersion());

    List<String>  zoneIds = parser.getZoneIds();

    assertTrue(zoneIds.contains("Europe/London"));
    assertTrue(zoneIds.contains("America/New_York"));
    assertTrue(zoneIds.contains("Asia/Kathmandu"));
    assertTrue(zoneIds.contains("GB"));
    assertTrue(zoneIds.contains("Etc/GMT-14"));

    for (String excluded : IanaZonesAndRulesParser.EXCLUDED_ZONE_IDS)
      assertFalse(zoneIds.contains(excluded), excluded);

    assertEquals("Europe/London", parser.getZone("GB").getZoneId());
    assertEquals("Etc/UTC", parser.getZone("Etc/Zulu").getZoneId());
    assertEquals(6, parser.getRuleSet("EU").size());
  }

  @Test
  public void missingResources()
  {
    IanaZonesAndRulesParser   parser = new IanaZonesAndRulesParser();

    assertThrows(IOException.class, () -> parser.parseResources("/no/such/place"));
  }

  @Test
  public void directory(@TempDir Path dir) throws Exception
  {
    Files.write(dir.resolve("europe"), EUROPE.getBytes(StandardCharsets.UTF_8));
    Files.write(dir.resolve("version"), "2099z\n".getBytes(StandardCharsets.UTF_8));
    Files.write(dir.resolve("README"), "Not a source file".getBytes(StandardCharsets.UTF_8));

    IanaZonesAndRulesParser   parser = new IanaZonesAndRulesParser();

    assertEquals("2099z", parser.parseDirectory(dir));
    assertEquals(List.of("Europe/Berlin"), parser.getZoneIds());
    assertThrows(IOException.class, () -> new IanaZonesAndRulesParser().parseDirectory(dir.resolve("version")));
  }

  @Test
  public void archive() throws Exception
  {
    ByteArrayOutputStream   bytes = new ByteArrayOutputStream();

    try (TarArchiveOutputStream tarOut = new TarArchiveOutputStream(new GZIPOutputStream(bytes))) {
      addEntry(tarOut, "tzdb-2099z/europe", EUROPE);
      addEntry(tarOut, "tzdb-2099z/backward", BACKWARD.replace("Link\tEtc/UTC\tUTC\n", ""));
      addEntry(tarOut, "tzdb-2099z/version", "2099z\n");
      addEntry(tarOut, "tzdb-2099z/Makefile", "all:\n");
    }

    IanaZonesAndRulesParser   parser = new IanaZonesAndRulesParser(true);

    assertEquals("2099z", parser.parseArchive(new ByteArrayInputStream(bytes.toByteArray())));
    assertTrue(parser.isRoundToMinutes());
    assertEquals(List.of("Europe/Berlin", "Europe/Busingen", "Europe/Somewhere"), parser.getZoneIds());
    assertEquals(3180, parser.getZone("Europe/Berlin").get(0).getGmtOffset());
  }

  private static void addEntry(TarArchiveOutputStream tarOut, String name, String content) throws IOException
  {
    byte[]            data = content.getBytes(StandardCharsets.UTF_8);
    TarArchiveEntry   entry = new TarArchiveEntry(name);

    entry.setSize(data.length);
    tarOut.putArchiveEntry(entry);
    tarOut.write(data);
    tarOut.closeArchiveEntry();
  }

  @Test
  public void unterminatedZone()
  {
    IanaParserException   e = assertThrows(IanaParserException.class, () -> new IanaZonesAndRulesParser().parseSources(
      sources("europe", "Zone Test/Zone 1:00 - X 2000\nRule R 2000 only - Mar 1 0:00 1:00 S\n")));

    assertEquals("europe", e.getSource());
    assertEquals(2, e.getLineNo());
    assertTrue(e.getMessage().contains("Test/Zone"));
    assertEquals("IanaParserException: " + e.getMessage() + " (europe) (line 2)", e.toString());
  }

  @Test
  public void invalidLine()
  {
    IanaParserException   e = assertThrows(IanaParserException.class, () -> new IanaZonesAndRulesParser().parseSources(
      sources("asia", "# Comment\nRule R 2000 only - Foo 1 0:00 1:00 S\n")));

    assertEquals("asia", e.getSource());
    assertEquals(2, e.getLineNo());
    assertTrue(e.getCause() instanceof IllegalArgumentException);
  }

  @Test
  public void unknownRules()
  {
    IanaParserException   e = assertThrows(IanaParserException.class, () -> new IanaZonesAndRulesParser().parseSources(
      sources("europe", "Zone Test/Zone 1:00 Nope X\n")));

    assertTrue(e.getMessage().contains("unknown rules Nope"));
    assertEquals(0, e.getLineNo());
  }

  @Test
  public void linkToUnknownZone()
  {
    IanaParserException   e = assertThrows(IanaParserException.class, () -> new IanaZonesAndRulesParser().parseSources(
      sources("backward", "Link Test/Missing Test/Alias\n")));

    assertTrue(e.getMessage().contains("Test/Alias"));
  }
}
