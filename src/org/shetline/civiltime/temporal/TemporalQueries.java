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

package org.shetline.civiltime.temporal;

import org.shetline.civiltime.LocalDate;
import org.shetline.civiltime.LocalTime;
import org.shetline.civiltime.ZoneId;
import org.shetline.civiltime.ZoneOffset;
import org.shetline.civiltime.chrono.Chronology;

import static org.shetline.civiltime.temporal.ChronoField.*;


public final class TemporalQueries
{
  private TemporalQueries() {}

  private static final TemporalQuery<ZoneId>      ZONE_ID = temporal -> temporal.query(TemporalQueries.zoneId());
  private static final TemporalQuery<Chronology>  CHRONO = temporal -> temporal.query(TemporalQueries.chronology());
  private static final TemporalQuery<ChronoUnit>  PRECISION = temporal -> temporal.query(TemporalQueries.precision());

  private static final TemporalQuery<ZoneOffset>  OFFSET = temporal ->
  {
    if (temporal.isSupported(OFFSET_SECONDS))
      return ZoneOffset.ofTotalSeconds(temporal.get(OFFSET_SECONDS));

    return null;
  };

  private static final TemporalQuery<ZoneId>  ZONE = temporal ->
  {
    ZoneId  zone = temporal.query(ZONE_ID);

    return zone != null ? zone : temporal.query(OFFSET);
  };

  private static final TemporalQuery<LocalDate>   LOCAL_DATE = temporal ->
  {
    if (temporal.isSupported(EPOCH_DAY))
      return LocalDate.ofEpochDay(temporal.getLong(EPOCH_DAY));

    return null;
  };

  private static final TemporalQuery<LocalTime>   LOCAL_TIME = temporal ->
  {
    if (temporal.isSupported(NANO_OF_DAY))
      return LocalTime.ofNanoOfDay(temporal.getLong(NANO_OF_DAY));

    return null;
  };

  public static TemporalQuery<ZoneId> zoneId()
  {
    return ZONE_ID;
  }

  public static TemporalQuery<Chronology> chronology()
  {
    return CHRONO;
  }

  public static TemporalQuery<ChronoUnit> precision()
  {
    return PRECISION;
  }

  public static TemporalQuery<ZoneId> zone()
  {
    return ZONE;
  }

  public static TemporalQuery<ZoneOffset> offset()
  {
    return OFFSET;
  }

  public static TemporalQuery<LocalDate> localDate()
  {
    return LOCAL_DATE;
  }

  public static TemporalQuery<LocalTime> localTime()
  {
    return LOCAL_TIME;
  }
}
