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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;


public class TzTransitionTableTest
{
  private static TzCompiler compiler;

  @BeforeAll
  public static void parseBundled() throws Exception
  {
    IanaZonesAndRulesParser   parser = new IanaZonesAndRulesParser();

    parser.parseResources(TzdbZoneRulesProvider.BUNDLED_SOURCES);
    compiler = new TzCompiler(parser);
  }

  private static TzTransitionTable table(String zoneId, int minYear, int maxYear)
  {
    return TzTransitionTable.fromRules(zoneId, compiler.compile(zoneId), minYear, maxYear);
  }

  @Test
  public void oneYear()
  {
    TzTransitionTable   london = table("Europe/London", 2024, 2024);
    long                spring = LocalDateTime.of(2024, 3, 31, 1, 0).toEpochSecond(ZoneOffset.UTC);
    long                autumn = LocalDateTime.of(2024, 10, 27, 1, 0).toEpochSecond(ZoneOffset.UTC);

    assertEquals("Europe/London", london.getZoneId());
    assertEquals(3, london.size());
    assertEquals(new TzTransition(TzTransition.BEGINNING_OF_TIME, 0, 0), london.get(0));
    assertEquals(new TzTransition(spring, 3600, 3600), london.get(1));
    assertEquals(new TzTransition(autumn, 0, 0), london.get(2));
    assertEquals("---, +0000, +0000", london.get(0).toString());
    assertEquals("2024-03-31 02:00:00, +0100, +0100", london.get(1).toString());
  }

  @ParameterizedTest
  @ValueSource(strings = { "Europe/London", "Europe/Paris", "America/New_York" })
  public void matchesJavaTime(String zoneId)
  {
    TzTransitionTable   fromJava = TzTransitionTable.fromJavaTime(zoneId, 1997, 2030);

    assertNotNull(fromJava);
    assertTrue(table(zoneId, 1997, 2030).closelyMatches(fromJava, false));
  }

  @Test
  public void mismatches()
  {
    assertFalse(table("Europe/London", 2020, 2024).closelyMatches(table("Europe/Paris", 2020, 2024), false));
    assertFalse(table("Europe/London", 2020, 2024).closelyMatches(table("Europe/London", 2020, 2023), false));
    assertTrue(table("Europe/Paris", 2020, 2024).closelyMatches(table("Europe/Berlin", 2020, 2024), false));
  }

  @Test
  public void unknownToJavaTime()
  {
    assertNull(TzTransitionTable.fromJavaTime("Mars/Olympus_Mons", 2000, 2001));
  }

  @Test
  public void dump()
  {
    ByteArrayOutputStream   out = new ByteArrayOutputStream();

    table("Europe/London", 2024, 2024).dump(out);

    String  text = new String(out.toByteArray(), StandardCharsets.UTF_8);

    assertTrue(text.startsWith("-------- Europe/London --------"));
    assertTrue(text.contains("____-__-__ __:__:__ ±____ ±____ --> ____-__-__ __:__:__ +0000 +0000"));
    assertTrue(text.contains("2024-03-31 00:59:59 +0000 +0000 --> 2024-03-31 02:00:00 +0100 +0100*"));
    assertTrue(text.contains("2024-10-27 01:59:59 +0100 +0100 --> 2024-10-27 01:00:00 +0000 +0000"));

    out.reset();
    table("Asia/Kolkata", 2000, 2001).dump(out);
    assertTrue(new String(out.toByteArray(), StandardCharsets.UTF_8).contains("Fixed UTC offset at +0530"));
  }
}
