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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.shetline.civiltime.temporal.ChronoField;
import org.shetline.civiltime.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;


public class OffsetDateTimeTest
{
  private static final ZoneOffset OFFSET_PONE = ZoneOffset.ofHours(1);
  private static final ZoneOffset OFFSET_PTWO = ZoneOffset.ofHours(2);

  @Test
  public void formatsLocalDateTimeThenOffset()
  {
    OffsetDateTime  odt = OffsetDateTime.of(LocalDate.of(2008, 6, 30), LocalTime.of(11, 30, 59, 500), OFFSET_PONE);

    assertEquals("2008-06-30T11:30:59.000000500+01:00", odt.toString());
    assertEquals("2008-06-30T11:30Z", OffsetDateTime.of(2008, 6, 30, 11, 30, 0, 0, ZoneOffset.UTC).toString());
    assertEquals(odt, OffsetDateTime.parse(odt.toString()));
  }

  @Test
  public void parsing()
  {
    OffsetDateTime  odt = OffsetDateTime.parse("2008-06-30T11:30:59+01:00");

    assertEquals(LocalDateTime.of(2008, 6, 30, 11, 30, 59), odt.toLocalDateTime());
    assertEquals(OFFSET_PONE, odt.getOffset());
    assertEquals(DateTimeErrorKind.PARSE, OffsetDateTime.tryParse("2008-06-30T11:30:59").getKind());
  }

  @Test
  public void equalsDistinguishesOffsetsButIsEqualComparesInstants()
  {
    OffsetDateTime  a = OffsetDateTime.of(2008, 6, 30, 11, 30, 0, 0, OFFSET_PONE);
    OffsetDateTime  b = OffsetDateTime.of(2008, 6, 30, 12, 30, 0, 0, OFFSET_PTWO);

    assertNotEquals(a, b);
    assertTrue(a.isEqual(b));
    assertFalse(a.isBefore(b));
    assertFalse(a.isAfter(b));
    assertTrue(a.compareTo(b) < 0);
    assertEquals(0, OffsetDateTime.timeLineOrder().compare(a, b));
    assertEquals(a.toInstant(), b.toInstant());
  }

  @Test
  public void ordersByInstantFirst()
  {
    OffsetDateTime  early = OffsetDateTime.of(2008, 6, 30, 11, 0, 0, 0, OFFSET_PTWO);
    OffsetDateTime  late = OffsetDateTime.of(2008, 6, 30, 10, 30, 0, 0, OFFSET_PONE);
    List<OffsetDateTime>  list = new ArrayList<>(Arrays.asList(late, early));

    list.sort(null);
    assertEquals(Arrays.asList(early, late), list);
    assertTrue(early.isBefore(late));
    assertTrue(OffsetDateTime.MIN.isBefore(OffsetDateTime.MAX));
  }

  @Test
  public void offsetChanges()
  {
    OffsetDateTime  odt = OffsetDateTime.of(2008, 6, 30, 23, 30, 0, 0, OFFSET_PONE);
    OffsetDateTime  sameInstant = odt.withOffsetSameInstant(OFFSET_PTWO);

    assertEquals(LocalDateTime.of(2008, 7, 1, 0, 30), sameInstant.toLocalDateTime());
    assertTrue(sameInstant.isEqual(odt));
    assertEquals(LocalDateTime.of(2008, 6, 30, 23, 30), odt.withOffsetSameLocal(OFFSET_PTWO).toLocalDateTime());
    assertEquals(3600, odt.toEpochSecond() - odt.withOffsetSameLocal(OFFSET_PTWO).toEpochSecond());
  }

  @Test
  public void fieldsAndArithmetic()
  {
    OffsetDateTime  odt = OffsetDateTime.of(2008, 6, 30, 23, 30, 0, 0, OFFSET_PONE);

    assertEquals(3600, odt.get(ChronoField.OFFSET_SECONDS));
    assertEquals(odt.toEpochSecond(), odt.getLong(ChronoField.INSTANT_SECONDS));
    assertEquals(OffsetDateTime.of(2008, 7, 1, 0, 30, 0, 0, OFFSET_PONE), odt.plusHours(1));
    assertEquals(OffsetDateTime.of(2008, 7, 30, 23, 30, 0, 0, OFFSET_PONE), odt.plusMonths(1));
    assertEquals(1, odt.until(OffsetDateTime.of(2008, 7, 1, 1, 30, 0, 0, OFFSET_PTWO), ChronoUnit.HOURS));
  }

  @Test
  public void instantConversion()
  {
    Instant         instant = Instant.ofEpochSecond(1214825459L);
    OffsetDateTime  odt = OffsetDateTime.ofInstant(instant, OFFSET_PTWO);

    assertEquals(LocalDateTime.of(2008, 6, 30, 13, 30, 59), odt.toLocalDateTime());
    assertEquals(instant, odt.toInstant());
    assertEquals(OffsetTime.of(13, 30, 59, 0, OFFSET_PTWO), odt.toOffsetTime());
  }
}
