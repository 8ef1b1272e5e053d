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
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.shetline.civiltime.Duration;
import org.shetline.civiltime.Instant;
import org.shetline.civiltime.ZoneOffset;
import org.shetline.civiltime.zone.ZoneRules;
import org.shetline.civiltime.zone.ZoneRulesException;

import static org.junit.jupiter.api.Assertions.*;


public class TzCompilerTest
{
  private static TzCompiler compiler;

  @BeforeAll
  public static void parseBundled() throws Exception
  {
    IanaZonesAndRulesParser   parser = new IanaZonesAndRulesParser();

    parser.parseResources(TzdbZoneRulesProvider.BUNDLED_SOURCES);
    compiler = new TzCompiler(parser);
  }

  @ParameterizedTest
  @CsvSource({
    "Europe/London,    2024-07-01T00:00:00Z, +01:00",
    "Europe/London,    2024-01-01T00:00:00Z, Z",
    "Europe/London,    1970-06-01T00:00:00Z, +01:00",
    "Europe/Paris,     2024-07-01T00:00:00Z, +02:00",
    "Europe/Berlin,    1979-07-01T00:00:00Z, +01:00",
    "America/New_York, 2024-07-01T00:00:00Z, -04:00",
    "America/New_York, 2024-01-01T00:00:00Z, -05:00",
    "America/Phoenix,  2024-07-01T00:00:00Z, -07:00",
    "Asia/Tokyo,       1949-06-01T00:00:00Z, +10:00",
    "Asia/Tokyo,       2024-06-01T00:00:00Z, +09:00",
    "Asia/Kathmandu,   1980-01-01T00:00:00Z, +05:30",
    "Asia/Kathmandu,   2020-01-01T00:00:00Z, +05:45",
    "Australia/Sydney, 2024-01-01T00:00:00Z, +11:00",
    "Australia/Sydney, 2024-07-01T00:00:00Z, +10:00",
    "Etc/GMT-14,       2024-01-01T00:00:00Z, +14:00",
    "Etc/GMT+12,       2024-01-01T00:00:00Z, -12:00"
  })
  public void offsets(String zoneId, String instant, String offset)
  {
    assertEquals(ZoneOffset.of(offset), compiler.compile(zoneId).getOffset(Instant.parse(instant)));
  }

  @Test
  public void doubleSummerTimeStandardOffset()
  {
    ZoneRules   london = compiler.compile("Europe/London");
    Instant     instant = Instant.parse("1970-06-01T00:00:00Z");

    assertEquals(ZoneOffset.ofHours(1), london.getStandardOffset(instant));
    assertEquals(Duration.ZERO, london.getDaylightSavings(instant));
    assertEquals(2, london.getTransitionRules().size());
  }

  @Test
  public void fixedZones()
  {
    assertTrue(compiler.compile("Etc/GMT-14").isFixedOffset());
    assertTrue(compiler.compile("Etc/UTC").isFixedOffset());
    assertFalse(compiler.compile("Asia/Kathmandu").isFixedOffset());
    assertTrue(compiler.compile("Asia/Kathmandu").getTransitionRules().isEmpty());
  }

  @Test
  public void linksShareRules()
  {
    assertSame(compiler.compile("Europe/London"), compiler.compile("GB"));
    assertSame(compiler.compile("America/New_York"), compiler.compile("US/Eastern"));
  }

  @Test
  public void compileAll()
  {
    Map<String, ZoneRules>  all = compiler.compileAll();

    assertEquals(compiler.getParser().getZoneIds().size(), all.size());
    assertSame(all.get("Asia/Kolkata"), all.get("Asia/Calcutta"));
    assertFalse(all.containsKey("UTC"));
  }

  @Test
  public void unknownZone()
  {
    ZoneRulesException  e = assertThrows(ZoneRulesException.class, () -> compiler.compile("Mars/Olympus_Mons"));

    assertEquals("Unknown time-zone ID: Mars/Olympus_Mons", e.getMessage());
  }

  @Test
  public void uncompilableZone() throws Exception
  {
    IanaZonesAndRulesParser   parser = new IanaZonesAndRulesParser();
    String                    source = "Rule Lonely 2000 max - Mar 1 0:00 1:00 S\nZone Test/Lonely 1:00 Lonely X\n";

    parser.parseSources(Collections.singletonMap("europe", new ByteArrayInputStream(source.getBytes(StandardCharsets.UTF_8))));

    ZoneRulesException  e = assertThrows(ZoneRulesException.class, () -> new TzCompiler(parser).compile("Test/Lonely"));

    assertTrue(e.getMessage().startsWith("Unable to compile time zone Test/Lonely"));
    assertTrue(e.getCause() instanceof IllegalStateException);
  }
}
