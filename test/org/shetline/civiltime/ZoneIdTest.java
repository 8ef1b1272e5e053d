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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.shetline.civiltime.zone.ZoneRulesException;

import static org.junit.jupiter.api.Assertions.*;


public class ZoneIdTest
{
  @Test
  public void regions()
  {
    ZoneId  london = ZoneId.of("Europe/London");

    assertEquals("Europe/London", london.getId());
    assertEquals("Europe/London", london.toString());
    assertEquals(london, ZoneId.of("Europe/London"));
    assertFalse(london.getRules().isFixedOffset());
    assertSame(london, london.normalized());
  }

  @Test
  public void offsets()
  {
    assertSame(ZoneOffset.UTC, ZoneId.of("Z"));
    assertEquals(ZoneOffset.ofHours(1), ZoneId.of("+01:00"));
    assertEquals(ZoneOffset.ofHoursMinutes(-5, -30), ZoneId.of("-05:30"));
  }

  @ParameterizedTest
  @CsvSource({
    "UTC,       UTC,       Z",
    "GMT,       GMT,       Z",
    "UT,        UT,        Z",
    "UTC+01:00, UTC+01:00, +01:00",
    "GMT-05:00, GMT-05:00, -05:00",
    "UT+02,     UT+02:00,  +02:00",
  })
  public void prefixedOffsets(String text, String id, String offset)
  {
    ZoneId  zone = ZoneId.of(text);

    assertEquals(id, zone.getId());
    assertTrue(zone.getRules().isFixedOffset());
    assertEquals(ZoneOffset.of(offset), zone.normalized());
  }

  @Test
  public void distinctIdsForSameRules()
  {
    assertNotEquals(ZoneId.of("UTC"), ZoneId.of("Z"));
    assertNotEquals(ZoneId.of("UTC"), ZoneId.of("GMT"));
    assertEquals(ZoneId.of("UTC").normalized(), ZoneId.of("GMT").normalized());
  }

  @Test
  public void shortIds()
  {
    assertEquals("America/Chicago", ZoneId.SHORT_IDS.get("CST"));
    assertEquals(ZoneOffset.ofHours(-5), ZoneId.of("EST", ZoneId.SHORT_IDS));
    assertEquals("Asia/Tokyo", ZoneId.of("JST", ZoneId.SHORT_IDS).getId());
    assertEquals("Europe/London", ZoneId.of("Europe/London", ZoneId.SHORT_IDS).getId());
    assertThrows(UnsupportedOperationException.class, () -> ZoneId.SHORT_IDS.put("XYZ", "UTC"));
  }

  @Test
  public void linksAndFixedRegions()
  {
    Instant   summer = Instant.parse("2008-06-30T12:00:00Z");

    assertEquals(ZoneId.of("Europe/London").getRules().getOffset(summer), ZoneId.of("GB").getRules().getOffset(summer));
    assertEquals(ZoneOffset.ofHours(-4), ZoneId.of("US/Eastern").getRules().getOffset(summer));
    assertEquals(ZoneOffset.ofHours(1), ZoneId.of("Etc/GMT-1").normalized());
    assertEquals(ZoneOffset.ofHoursMinutes(5, 45), ZoneId.of("Asia/Kathmandu").getRules().getOffset(summer));
    assertEquals(ZoneOffset.UTC, ZoneId.of("GMT0").getRules().getOffset(summer));
  }

  @Test
  public void availableIds()
  {
    assertTrue(ZoneId.getAvailableZoneIds().contains("Europe/London"));
    assertTrue(ZoneId.getAvailableZoneIds().contains("America/New_York"));
    assertTrue(ZoneId.getAvailableZoneIds().contains("US/Eastern"));
    assertFalse(ZoneId.getAvailableZoneIds().contains("UTC"));
  }

  @Test
  public void unknownRegion()
  {
    assertThrows(ZoneRulesException.class, () -> ZoneId.of("Nowhere/Special"));

    DateTimeResult<ZoneId>  result = ZoneId.tryOf("Nowhere/Special");

    assertFalse(result.isSuccess());
    assertEquals(DateTimeErrorKind.UNKNOWN_ZONE, result.getKind());
  }

  @ParameterizedTest
  @ValueSource(strings = { "Europe/Lon don", "Europe/London!", "/Europe", "UTC+5:", "+25:00" })
  public void malformedIds(String text)
  {
    assertThrows(DateTimeException.class, () -> ZoneId.of(text));
  }

  @Test
  public void nullId()
  {
    assertThrows(NullPointerException.class, () -> ZoneId.of(null));
  }
}
