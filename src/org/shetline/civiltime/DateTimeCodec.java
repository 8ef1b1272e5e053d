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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.StreamCorruptedException;
import java.io.UncheckedIOException;

import org.shetline.civiltime.zone.ZoneRules;
import org.shetline.civiltime.zone.ZoneRulesCodec;
import org.shetline.civiltime.zone.ZoneRulesRegistry;


/**
 * Binary form of the date-time value types and of zone rules. Each encoded value is a format
 * version byte, a type byte, and the value's fields.
 * <p>
 * Decoding a region ID does not require its rules to be available; they are looked up when first
 * used.
 */
public final class DateTimeCodec
{
  public static final int   VERSION = 1;

  private static final byte DURATION = 1;
  private static final byte INSTANT = 2;
  private static final byte LOCAL_DATE = 3;
  private static final byte LOCAL_TIME = 4;
  private static final byte LOCAL_DATE_TIME = 5;
  private static final byte ZONED_DATE_TIME = 6;
  private static final byte ZONE_REGION = 7;
  private static final byte ZONE_OFFSET = 8;
  private static final byte OFFSET_TIME = 9;
  private static final byte OFFSET_DATE_TIME = 10;
  private static final byte ZONE_RULES = 11;
  private static final byte YEAR = 12;
  private static final byte YEAR_MONTH = 13;
  private static final byte MONTH_DAY = 14;
  private static final byte PERIOD = 15;

  private DateTimeCodec() {}

  public static byte[] encode(Object value)
  {
    ByteArrayOutputStream   bytes = new ByteArrayOutputStream();

    try (DataOutputStream out = new DataOutputStream(bytes)) {
      write(value, out);
    }
    catch (IOException e) {
      throw new UncheckedIOException(e);
    }

    return bytes.toByteArray();
  }

  public static Object decode(byte[] data) throws IOException
  {
    try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
      Object  value = read(in);

      if (in.available() > 0)
        throw new StreamCorruptedException("Unexpected data after encoded value");

      return value;
    }
  }

  public static <T> T decode(byte[] data, Class<T> type) throws IOException
  {
    Object  value = decode(data);

    if (!type.isInstance(value))
      throw new StreamCorruptedException("Expected " + type.getSimpleName() + " but found " + value.getClass().getSimpleName());

    return type.cast(value);
  }

  public static void write(Object value, DataOutput out) throws IOException
  {
    out.writeByte(VERSION);

    if (value instanceof Duration) {
      out.writeByte(DURATION);
      out.writeLong(((Duration) value).getSeconds());
      out.writeInt(((Duration) value).getNano());
    }
    else if (value instanceof Instant) {
      out.writeByte(INSTANT);
      out.writeLong(((Instant) value).getEpochSecond());
      out.writeInt(((Instant) value).getNano());
    }
    else if (value instanceof LocalDate) {
      out.writeByte(LOCAL_DATE);
      writeDate((LocalDate) value, out);
    }
    else if (value instanceof LocalTime) {
      out.writeByte(LOCAL_TIME);
      writeTime((LocalTime) value, out);
    }
    else if (value instanceof LocalDateTime) {
      out.writeByte(LOCAL_DATE_TIME);
      writeDateTime((LocalDateTime) value, out);
    }
    else if (value instanceof ZonedDateTime) {
      ZonedDateTime   zdt = (ZonedDateTime) value;

      out.writeByte(ZONED_DATE_TIME);
      writeDateTime(zdt.toLocalDateTime(), out);
      ZoneRulesCodec.writeOffset(zdt.getOffset(), out);
      writeZone(zdt.getZone(), out);
    }
    else if (value instanceof ZoneOffset) {
      out.writeByte(ZONE_OFFSET);
      ZoneRulesCodec.writeOffset((ZoneOffset) value, out);
    }
    else if (value instanceof ZoneRegion) {
      out.writeByte(ZONE_REGION);
      out.writeUTF(((ZoneRegion) value).getId());
    }
    else if (value instanceof OffsetTime) {
      out.writeByte(OFFSET_TIME);
      writeTime(((OffsetTime) value).toLocalTime(), out);
      ZoneRulesCodec.writeOffset(((OffsetTime) value).getOffset(), out);
    }
    else if (value instanceof OffsetDateTime) {
      out.writeByte(OFFSET_DATE_TIME);
      writeDateTime(((OffsetDateTime) value).toLocalDateTime(), out);
      ZoneRulesCodec.writeOffset(((OffsetDateTime) value).getOffset(), out);
    }
    else if (value instanceof ZoneRules) {
      out.writeByte(ZONE_RULES);
      ZoneRulesCodec.write((ZoneRules) value, out);
    }
    else if (value instanceof Year) {
      out.writeByte(YEAR);
      out.writeInt(((Year) value).getValue());
    }
    else if (value instanceof YearMonth) {
      out.writeByte(YEAR_MONTH);
      out.writeInt(((YearMonth) value).getYear());
      out.writeByte(((YearMonth) value).getMonthValue());
    }
    else if (value instanceof MonthDay) {
      out.writeByte(MONTH_DAY);
      out.writeByte(((MonthDay) value).getMonthValue());
      out.writeByte(((MonthDay) value).getDayOfMonth());
    }
    else if (value instanceof Period) {
      out.writeByte(PERIOD);
      out.writeInt(((Period) value).getYears());
      out.writeInt(((Period) value).getMonths());
      out.writeInt(((Period) value).getDays());
    }
    else
      throw new IllegalArgumentException("Cannot encode " + (value == null ? "null" : value.getClass().getName()));
  }

  public static Object read(DataInput in) throws IOException
  {
    int   version = in.readByte();

    if (version != VERSION)
      throw new StreamCorruptedException("Unsupported encoding version: " + version);

    byte  type = in.readByte();

    try {
      switch (type) {
        case DURATION:
          return Duration.ofSeconds(in.readLong(), in.readInt());
        case INSTANT:
          return Instant.ofEpochSecond(in.readLong(), in.readInt());
        case LOCAL_DATE:
          return readDate(in);
        case LOCAL_TIME:
          return readTime(in);
        case LOCAL_DATE_TIME:
          return readDateTime(in);
        case ZONED_DATE_TIME: {
          LocalDateTime   ldt = readDateTime(in);
          ZoneOffset      offset = ZoneRulesCodec.readOffset(in);
          ZoneId          zone = readZone(in);

          return ZonedDateTime.ofInstant(ldt, offset, zone);
        }
        case ZONE_OFFSET:
          return ZoneRulesCodec.readOffset(in);
        case ZONE_REGION:
          return readRegion(in.readUTF());
        case OFFSET_TIME:
          return OffsetTime.of(readTime(in), ZoneRulesCodec.readOffset(in));
        case OFFSET_DATE_TIME:
          return OffsetDateTime.of(readDateTime(in), ZoneRulesCodec.readOffset(in));
        case ZONE_RULES:
          return ZoneRulesCodec.read(in);
        case YEAR:
          return Year.of(in.readInt());
        case YEAR_MONTH:
          return YearMonth.of(in.readInt(), in.readByte());
        case MONTH_DAY:
          return MonthDay.of(in.readByte(), in.readByte());
        case PERIOD:
          return Period.of(in.readInt(), in.readInt(), in.readInt());
        default:
          throw new StreamCorruptedException("Unknown encoded type: " + type);
      }
    }
    catch (DateTimeException e) {
      StreamCorruptedException  sce = new StreamCorruptedException("Invalid encoded value: " + e.getMessage());

      sce.initCause(e);

      throw sce;
    }
  }

  private static void writeDate(LocalDate date, DataOutput out) throws IOException
  {
    out.writeInt(date.getYear());
    out.writeByte(date.getMonthValue());
    out.writeByte(date.getDayOfMonth());
  }

  private static LocalDate readDate(DataInput in) throws IOException
  {
    int   year = in.readInt();
    int   month = in.readByte();
    int   dayOfMonth = in.readByte();

    return LocalDate.of(year, month, dayOfMonth);
  }

  // Trailing zero fields are dropped, the last field written being stored complemented.
  private static void writeTime(LocalTime time, DataOutput out) throws IOException
  {
    int   hour = time.getHour();
    int   minute = time.getMinute();
    int   second = time.getSecond();
    int   nano = time.getNano();

    if (nano == 0) {
      if (second == 0) {
        if (minute == 0)
          out.writeByte(~hour);
        else {
          out.writeByte(hour);
          out.writeByte(~minute);
        }
      }
      else {
        out.writeByte(hour);
        out.writeByte(minute);
        out.writeByte(~second);
      }
    }
    else {
      out.writeByte(hour);
      out.writeByte(minute);
      out.writeByte(second);
      out.writeInt(nano);
    }
  }

  private static LocalTime readTime(DataInput in) throws IOException
  {
    int   hour = in.readByte();
    int   minute = 0;
    int   second = 0;
    int   nano = 0;

    if (hour < 0)
      hour = ~hour;
    else {
      minute = in.readByte();

      if (minute < 0)
        minute = ~minute;
      else {
        second = in.readByte();

        if (second < 0)
          second = ~second;
        else
          nano = in.readInt();
      }
    }

    return LocalTime.of(hour, minute, second, nano);
  }

  private static void writeDateTime(LocalDateTime dateTime, DataOutput out) throws IOException
  {
    writeDate(dateTime.toLocalDate(), out);
    writeTime(dateTime.toLocalTime(), out);
  }

  private static LocalDateTime readDateTime(DataInput in) throws IOException
  {
    LocalDate   date = readDate(in);
    LocalTime   time = readTime(in);

    return LocalDateTime.of(date, time);
  }

  private static void writeZone(ZoneId zone, DataOutput out) throws IOException
  {
    if (zone instanceof ZoneOffset) {
      out.writeByte(ZONE_OFFSET);
      ZoneRulesCodec.writeOffset((ZoneOffset) zone, out);
    }
    else {
      out.writeByte(ZONE_REGION);
      out.writeUTF(zone.getId());
    }
  }

  private static ZoneId readZone(DataInput in) throws IOException
  {
    byte  type = in.readByte();

    if (type == ZONE_OFFSET)
      return ZoneRulesCodec.readOffset(in);
    else if (type == ZONE_REGION)
      return readRegion(in.readUTF());

    throw new StreamCorruptedException("Unknown encoded zone type: " + type);
  }

  private static ZoneId readRegion(String id)
  {
    // Prefixed offsets such as UTC+01:00 are rebuilt from the ID itself.
    if (id.startsWith("UTC") || id.startsWith("GMT") || id.startsWith("UT"))
      return ZoneId.of(id);

    return ZoneRegion.ofId(id, false, ZoneRulesRegistry.getDefault());
  }
}
