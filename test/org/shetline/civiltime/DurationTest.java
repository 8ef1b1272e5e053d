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
import org.shetline.civiltime.format.DateTimeParseException;
import org.shetline.civiltime.temporal.ChronoUnit;
import org.shetline.civiltime.temporal.UnsupportedTemporalTypeException;

import static org.junit.jupiter.api.Assertions.*;


public class DurationTest
{
  @Test
  public void nanoAdjustmentIsNormalized()
  {
    Duration  duration = Duration.ofSeconds(2, -1);

    assertEquals(1, duration.getSeconds());
    assertEquals(999999999, duration.getNano());

    duration = Duration.ofSeconds(-1, 2500000000L);
    assertEquals(1, duration.getSeconds());
    assertEquals(500000000, duration.getNano());

    duration = Duration.ofMillis(-1);
    assertEquals(-1, duration.getSeconds());
    assertEquals(999000000, duration.getNano());
    assertTrue(duration.isNegative());
  }

  @ParameterizedTest
  @CsvSource({
    "PT1.123456789S,  1,    123456789",
    "PT-1.1S,         -2,   900000000",
    "'PT0,5S',        0,    500000000",
    "P2D,             172800, 0",
    "pt1h30m,         5400, 0",
    "-PT1H,           -3600, 0",
    "PT1H-30M,        1800, 0",
    "P-1DT25H,        3600, 0",
    "-PT-6H+3M,       21420, 0",
    "PT0S,            0,    0"
  })
  public void parsesIsoDurations(String text, long seconds, int nanos)
  {
    Duration  duration = Duration.parse(text);

    assertEquals(seconds, duration.getSeconds());
    assertEquals(nanos, duration.getNano());
  }

  @ParameterizedTest
  @ValueSource(strings = { "", "P", "PT", "P1", "PT1", "1S", "PT1.S2", "PT0.1234567891S", "P1H", "PT1D",
                           "PT9223372036854775808S", "P106751991167301D" })
  public void rejectsMalformedDurations(String text)
  {
    DateTimeParseException  e = assertThrows(DateTimeParseException.class, () -> Duration.parse(text));

    assertEquals(DateTimeErrorKind.PARSE, e.getKind());
  }

  @Test
  public void formatsIsoDurations()
  {
    assertEquals("PT0S", Duration.ZERO.toString());
    assertEquals("PT25H1M", Duration.ofHours(25).plusMinutes(1).toString());
    assertEquals("PT1.5S", Duration.ofMillis(1500).toString());
    assertEquals("PT-0.9S", Duration.ofSeconds(-1, 100000000).toString());
    assertEquals("PT-1.1S", Duration.parse("PT-1.1S").toString());
    assertEquals("PT-2H", Duration.ofHours(-2).toString());
  }

  @Test
  public void overflowIsAnArithmeticError()
  {
    Duration  max = Duration.ofSeconds(Long.MAX_VALUE, 999999999);

    assertThrows(ArithmeticException.class, () -> max.plusNanos(1));
    assertThrows(ArithmeticException.class, () -> max.plusSeconds(1));
    assertThrows(ArithmeticException.class, () -> max.multipliedBy(2));
    assertThrows(ArithmeticException.class, () -> Duration.ofSeconds(Long.MIN_VALUE).negated());
    assertThrows(ArithmeticException.class, () -> Duration.ofDays(Long.MAX_VALUE));
    assertThrows(ArithmeticException.class, () -> Duration.ofSeconds(1).dividedBy(0));
    assertThrows(ArithmeticException.class, () -> Duration.ofSeconds(1).dividedBy(Duration.ZERO));
  }

  @Test
  public void multiplyAndDivide()
  {
    assertEquals(Duration.ofSeconds(3, 333333333), Duration.ofSeconds(10).dividedBy(3));
    assertEquals(Duration.ofSeconds(-4, 666666667), Duration.ofSeconds(-10).dividedBy(3));
    assertEquals(Duration.ofSeconds(-3, 0), Duration.ofMillis(1500).multipliedBy(-2));
    assertEquals(4, Duration.ofMinutes(9).dividedBy(Duration.ofMinutes(2)));
    assertEquals(Duration.ofMillis(1500), Duration.ofMillis(-1500).abs());
    assertSame(Duration.ZERO, Duration.ofHours(3).multipliedBy(0));
  }

  @Test
  public void between()
  {
    Instant   start = Instant.ofEpochSecond(10, 700000000);
    Instant   end = Instant.ofEpochSecond(12, 200000000);

    assertEquals(Duration.ofMillis(1500), Duration.between(start, end));
    assertEquals(Duration.ofMillis(-1500), Duration.between(end, start));
    assertEquals(Duration.ofHours(26), Duration.between(LocalDateTime.of(2012, 1, 1, 0, 0), LocalDateTime.of(2012, 1, 2, 2, 0)));
  }

  @Test
  public void parts()
  {
    Duration  duration = Duration.ofSeconds(93784, 5000000);

    assertEquals(1, duration.toDays());
    assertEquals(26, duration.toHours());
    assertEquals(1563, duration.toMinutes());
    assertEquals(93784005, duration.toMillis());
    assertEquals(1, duration.toDaysPart());
    assertEquals(2, duration.toHoursPart());
    assertEquals(3, duration.toMinutesPart());
    assertEquals(4, duration.toSecondsPart());
    assertEquals(5, duration.toMillisPart());
    assertEquals(-1500, Duration.ofMillis(-1500).toMillis());
  }

  @Test
  public void unitAmounts()
  {
    assertEquals(Duration.ofHours(12), Duration.of(1, ChronoUnit.HALF_DAYS));
    assertEquals(Duration.ofDays(2), Duration.of(2, ChronoUnit.DAYS));
    assertThrows(UnsupportedTemporalTypeException.class, () -> Duration.of(1, ChronoUnit.MONTHS));
    assertEquals(Duration.ofMinutes(61), Duration.ofSeconds(3690).truncatedTo(ChronoUnit.MINUTES));
  }
}
