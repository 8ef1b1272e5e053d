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
import org.shetline.civiltime.format.DateTimeParseException;
import org.shetline.civiltime.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;


public class InstantTest
{
  private static final long JUNE_30_2008 = 1214825459L; // 2008-06-30T11:30:59Z

  @Test
  public void nanosAreNormalizedWithFloorSemantics()
  {
    Instant   instant = Instant.ofEpochSecond(0, -1);

    assertEquals(-1, instant.getEpochSecond());
    assertEquals(999999999, instant.getNano());

    instant = Instant.ofEpochSecond(3, 2500000000L);
    assertEquals(5, instant.getEpochSecond());
    assertEquals(500000000, instant.getNano());

    instant = Instant.ofEpochSecond(3, -2500000000L);
    assertEquals(0, instant.getEpochSecond());
    assertEquals(500000000, instant.getNano());
  }

  @Test
  public void epochMillis()
  {
    Instant   instant = Instant.ofEpochMilli(-1);

    assertEquals(-1, instant.getEpochSecond());
    assertEquals(999000000, instant.getNano());
    assertEquals(-1, instant.toEpochMilli());
    assertEquals(1214825459123L, Instant.ofEpochSecond(JUNE_30_2008, 123456789).toEpochMilli());
  }

  @Test
  public void boundsAreEnforced()
  {
    assertThrows(DateTimeException.class, () -> Instant.ofEpochSecond(Instant.MAX_SECOND + 1));
    assertThrows(DateTimeException.class, () -> Instant.ofEpochSecond(Instant.MIN_SECOND - 1));
    assertThrows(DateTimeException.class, () -> Instant.MAX.plusNanos(1));
    assertThrows(DateTimeException.class, () -> Instant.EPOCH.plusSeconds(Long.MAX_VALUE));
  }

  @Test
  public void arithmeticOverflowIsNotWrapped()
  {
    assertThrows(ArithmeticException.class, () -> Instant.MAX.plusSeconds(Long.MAX_VALUE));
    assertThrows(ArithmeticException.class, () -> Instant.MIN.minusSeconds(Long.MAX_VALUE));
  }

  @Test
  public void arithmetic()
  {
    Instant   instant = Instant.ofEpochSecond(10, 900000000);

    assertEquals(Instant.ofEpochSecond(11, 100000000), instant.plusMillis(200));
    assertEquals(Instant.ofEpochSecond(10, 800000000), instant.minusNanos(100000000));
    assertEquals(Instant.ofEpochSecond(3610, 900000000), instant.plus(1, ChronoUnit.HOURS));
    assertEquals(Instant.ofEpochSecond(9, 400000000), instant.minus(Duration.ofMillis(1500)));
    assertEquals(Instant.ofEpochSecond(0), instant.truncatedTo(ChronoUnit.MINUTES));
    assertEquals(10, instant.truncatedTo(ChronoUnit.SECONDS).getEpochSecond());
  }

  @Test
  public void until()
  {
    Instant   start = Instant.ofEpochSecond(0, 500000000);
    Instant   end = Instant.ofEpochSecond(120);

    assertEquals(119, start.until(end, ChronoUnit.SECONDS));
    assertEquals(1, start.until(end, ChronoUnit.MINUTES));
    assertEquals(119500, start.until(end, ChronoUnit.MILLIS));
    assertEquals(-119500, end.until(start, ChronoUnit.MILLIS));
  }

  @Test
  public void formatsAsIsoInstant()
  {
    assertEquals("1970-01-01T00:00:00Z", Instant.EPOCH.toString());
    assertEquals("2008-06-30T11:30:59Z", Instant.ofEpochSecond(JUNE_30_2008).toString());
    assertEquals("2008-06-30T11:30:59.500Z", Instant.ofEpochSecond(JUNE_30_2008, 500000000).toString());
    assertEquals("2008-06-30T11:30:59.000001Z", Instant.ofEpochSecond(JUNE_30_2008, 1000).toString());
    assertEquals("1969-12-31T23:59:59.999999999Z", Instant.ofEpochSecond(0, -1).toString());
  }

  @Test
  public void parsesIsoInstant()
  {
    assertEquals(Instant.ofEpochSecond(JUNE_30_2008, 500000000), Instant.parse("2008-06-30T11:30:59.5Z"));
    assertEquals(Instant.ofEpochSecond(JUNE_30_2008), Instant.parse("2008-06-30T11:30:59Z"));
    assertThrows(DateTimeParseException.class, () -> Instant.parse("2008-06-30T11:30:59"));
    assertEquals(DateTimeErrorKind.PARSE, Instant.tryParse("2008-06-30 11:30:59Z").getKind());
  }

  @Test
  public void ordering()
  {
    Instant   a = Instant.ofEpochSecond(-1, 999999999);
    Instant   b = Instant.EPOCH;

    assertTrue(a.isBefore(b));
    assertTrue(b.isAfter(a));
    assertTrue(a.compareTo(b) < 0);
    assertEquals(Duration.ofNanos(1), Duration.between(a, b));
  }

  @Test
  public void atOffset()
  {
    OffsetDateTime  odt = Instant.ofEpochSecond(JUNE_30_2008).atOffset(ZoneOffset.ofHours(2));

    assertEquals(LocalDateTime.of(2008, 6, 30, 13, 30, 59), odt.toLocalDateTime());
    assertEquals(ZoneOffset.ofHours(2), odt.getOffset());
  }
}
