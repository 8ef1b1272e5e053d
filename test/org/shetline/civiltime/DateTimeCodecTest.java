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

import java.io.IOException;
import java.io.StreamCorruptedException;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.shetline.civiltime.zone.ZoneRules;

import static org.junit.jupiter.api.Assertions.*;


public class DateTimeCodecTest
{
  @Test
  public void valuesSurviveEncoding() throws IOException
  {
    List<Object>  values = Arrays.asList(
      Duration.ofSeconds(-5, 123),
      Instant.ofEpochSecond(1214825459L, 500),
      LocalDate.of(-44, 3, 15),
      LocalTime.of(11, 0),
      LocalTime.of(11, 30),
      LocalTime.of(11, 30, 59),
      LocalTime.of(11, 30, 59, 1),
      LocalDateTime.of(2008, 6, 30, 11, 30, 59, 500),
      ZoneOffset.ofHoursMinutes(5, 45),
      OffsetTime.of(LocalTime.of(11, 30), ZoneOffset.ofHours(-5)),
      OffsetDateTime.of(LocalDateTime.of(2008, 6, 30, 11, 30), ZoneOffset.ofHours(2)),
      ZonedDateTime.of(2008, 10, 26, 1, 30, 0, 0, ZoneId.of("Europe/London")).withLaterOffsetAtOverlap(),
      ZonedDateTime.of(2008, 6, 30, 11, 30, 0, 0, ZoneOffset.ofHours(3)),
      ZoneId.of("America/New_York"),
      ZoneId.of("UTC+01:00"),
      Year.of(-1),
      YearMonth.of(2012, 10),
      MonthDay.of(2, 29),
      Period.of(1, -2, 3));

    for (Object value : values)
      assertEquals(value, DateTimeCodec.decode(DateTimeCodec.encode(value)), value.toString());
  }

  @Test
  public void trailingZeroTimeFieldsAreDropped()
  {
    int   dateTimeBase = DateTimeCodec.encode(LocalDateTime.of(2008, 6, 30, 11, 0)).length;

    assertEquals(dateTimeBase + 1, DateTimeCodec.encode(LocalDateTime.of(2008, 6, 30, 11, 30)).length);
    assertEquals(dateTimeBase + 2, DateTimeCodec.encode(LocalDateTime.of(2008, 6, 30, 11, 30, 59)).length);
    assertEquals(dateTimeBase + 6, DateTimeCodec.encode(LocalDateTime.of(2008, 6, 30, 11, 30, 59, 1)).length);
  }

  @Test
  public void zoneRules() throws IOException
  {
    ZoneRules   rules = ZoneId.of("Europe/Paris").getRules();
    ZoneRules   copy = DateTimeCodec.decode(DateTimeCodec.encode(rules), ZoneRules.class);

    assertEquals(rules, copy);
  }

  @Test
  public void typedDecodeChecksType()
  {
    byte[]  encoded = DateTimeCodec.encode(LocalDate.of(2012, 10, 29));

    assertThrows(StreamCorruptedException.class, () -> DateTimeCodec.decode(encoded, LocalTime.class));
  }

  @Test
  public void corruptInput()
  {
    byte[]  encoded = DateTimeCodec.encode(LocalDate.of(2012, 10, 29));

    assertThrows(IOException.class, () -> DateTimeCodec.decode(Arrays.copyOf(encoded, encoded.length - 1)));
    assertThrows(StreamCorruptedException.class, () -> DateTimeCodec.decode(Arrays.copyOf(encoded, encoded.length + 1)));
    assertThrows(StreamCorruptedException.class, () -> DateTimeCodec.decode(new byte[] { 9, 3 }));
    assertThrows(StreamCorruptedException.class, () -> DateTimeCodec.decode(new byte[] { DateTimeCodec.VERSION, 99 }));

    encoded[encoded.length - 1] = 32;

    assertThrows(StreamCorruptedException.class, () -> DateTimeCodec.decode(encoded));
  }

  @Test
  public void unsupportedValue()
  {
    assertThrows(IllegalArgumentException.class, () -> DateTimeCodec.encode("2012-10-29"));
    assertThrows(IllegalArgumentException.class, () -> DateTimeCodec.encode(null));
  }
}
