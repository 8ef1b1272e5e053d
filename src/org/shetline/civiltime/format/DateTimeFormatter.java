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

package org.shetline.civiltime.format;

import java.text.ParsePosition;
import java.util.Objects;

import org.shetline.civiltime.DateTimeException;
import org.shetline.civiltime.DateTimeResult;
import org.shetline.civiltime.temporal.TemporalAccessor;
import org.shetline.civiltime.temporal.TemporalQuery;

import static org.shetline.civiltime.temporal.ChronoField.*;


/**
 * Formats date-time values as text and parses text back into them. Formatters are immutable and
 * thread-safe.
 *
 * <pre>
 *   LocalDate date = LocalDate.parse("2012-10-29", DateTimeFormatter.ISO_LOCAL_DATE);
 *   String text = date.format(DateTimeFormatter.ofPattern("dd/MM/uuuu"));
 * </pre>
 */
public final class DateTimeFormatter
{
  public static final DateTimeFormatter ISO_LOCAL_DATE = new DateTimeFormatterBuilder()
    .appendValue(YEAR, 4, 10, SignStyle.EXCEEDS_PAD)
    .appendLiteral('-')
    .appendValue(MONTH_OF_YEAR, 2)
    .appendLiteral('-')
    .appendValue(DAY_OF_MONTH, 2)
    .toFormatter();

  public static final DateTimeFormatter ISO_OFFSET_DATE = new DateTimeFormatterBuilder()
    .parseCaseInsensitive()
    .append(ISO_LOCAL_DATE)
    .appendOffsetId()
    .toFormatter();

  public static final DateTimeFormatter ISO_DATE = new DateTimeFormatterBuilder()
    .parseCaseInsensitive()
    .append(ISO_LOCAL_DATE)
    .optionalStart()
    .appendOffsetId()
    .toFormatter();

  public static final DateTimeFormatter ISO_LOCAL_TIME = new DateTimeFormatterBuilder()
    .appendValue(HOUR_OF_DAY, 2)
    .appendLiteral(':')
    .appendValue(MINUTE_OF_HOUR, 2)
    .optionalStart()
    .appendLiteral(':')
    .appendValue(SECOND_OF_MINUTE, 2)
    .optionalStart()
    .appendFraction(NANO_OF_SECOND, 0, 9, true)
    .toFormatter();

  public static final DateTimeFormatter ISO_OFFSET_TIME = new DateTimeFormatterBuilder()
    .parseCaseInsensitive()
    .append(ISO_LOCAL_TIME)
    .appendOffsetId()
    .toFormatter();

  public static final DateTimeFormatter ISO_TIME = new DateTimeFormatterBuilder()
    .parseCaseInsensitive()
    .append(ISO_LOCAL_TIME)
    .optionalStart()
    .appendOffsetId()
    .toFormatter();

  public static final DateTimeFormatter ISO_LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
    .parseCaseInsensitive()
    .append(ISO_LOCAL_DATE)
    .appendLiteral('T')
    .append(ISO_LOCAL_TIME)
    .toFormatter();

  public static final DateTimeFormatter ISO_OFFSET_DATE_TIME = new DateTimeFormatterBuilder()
    .parseCaseInsensitive()
    .append(ISO_LOCAL_DATE_TIME)
    .appendOffsetId()
    .toFormatter();

  /**
   * "2011-12-03T10:15:30+01:00[Europe/Paris]". When parsing, a bracketed region must agree with
   * the offset at the instant described.
   */
  public static final DateTimeFormatter ISO_ZONED_DATE_TIME = new DateTimeFormatterBuilder()
    .append(ISO_OFFSET_DATE_TIME)
    .optionalStart()
    .appendLiteral('[')
    .parseCaseSensitive()
    .appendZoneRegionId()
    .appendLiteral(']')
    .toFormatter();

  public static final DateTimeFormatter ISO_DATE_TIME = new DateTimeFormatterBuilder()
    .append(ISO_LOCAL_DATE_TIME)
    .optionalStart()
    .appendOffsetId()
    .optionalStart()
    .appendLiteral('[')
    .parseCaseSensitive()
    .appendZoneRegionId()
    .appendLiteral(']')
    .toFormatter();

  public static final DateTimeFormatter ISO_ORDINAL_DATE = new DateTimeFormatterBuilder()
    .parseCaseInsensitive()
    .appendValue(YEAR, 4, 10, SignStyle.EXCEEDS_PAD)
    .appendLiteral('-')
    .appendValue(DAY_OF_YEAR, 3)
    .optionalStart()
    .appendOffsetId()
    .toFormatter();

  public static final DateTimeFormatter BASIC_ISO_DATE = new DateTimeFormatterBuilder()
    .parseCaseInsensitive()
    .appendValue(YEAR, 4)
    .appendValue(MONTH_OF_YEAR, 2)
    .appendValue(DAY_OF_MONTH, 2)
    .optionalStart()
    .appendOffset("+HHMMss", "Z")
    .toFormatter();

  public static final DateTimeFormatter ISO_INSTANT = new DateTimeFormatterBuilder()
    .parseCaseInsensitive()
    .appendInstant()
    .toFormatter();

  private final DateTimeFormatterBuilder.CompositePrinterParser printerParser;

  DateTimeFormatter(DateTimeFormatterBuilder.CompositePrinterParser printerParser)
  {
    this.printerParser = printerParser;
  }

  public static DateTimeFormatter ofPattern(String pattern)
  {
    return new DateTimeFormatterBuilder().appendPattern(pattern).toFormatter();
  }

  public String format(TemporalAccessor temporal)
  {
    StringBuilder   buf = new StringBuilder(32);

    formatTo(temporal, buf);

    return buf.toString();
  }

  public void formatTo(TemporalAccessor temporal, StringBuilder buf)
  {
    Objects.requireNonNull(temporal, "temporal");
    Objects.requireNonNull(buf, "buf");

    printerParser.format(new DateTimePrintContext(temporal), buf);
  }

  public TemporalAccessor parse(CharSequence text)
  {
    Objects.requireNonNull(text, "text");

    try {
      return parseResolved(text);
    }
    catch (DateTimeParseException e) {
      throw e;
    }
    catch (DateTimeException | ArithmeticException e) {
      throw createError(text, e);
    }
  }

  /**
   * Parses the text and converts the result with a query, typically a {@code from} method such
   * as {@code LocalDate::from}.
   *
   * @throws DateTimeParseException if the text cannot be parsed or converted
   */
  public <T> T parse(CharSequence text, TemporalQuery<T> query)
  {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(query, "query");

    try {
      return parseResolved(text).query(query);
    }
    catch (DateTimeParseException e) {
      throw e;
    }
    catch (DateTimeException | ArithmeticException e) {
      throw createError(text, e);
    }
  }

  public <T> DateTimeResult<T> tryParse(CharSequence text, TemporalQuery<T> query)
  {
    return DateTimeResult.of(() -> parse(text, query));
  }

  /**
   * Parses the text from a position without resolving the fields, returning null and setting
   * the error index of {@code position} on failure.
   */
  public TemporalAccessor parseUnresolved(CharSequence text, ParsePosition position)
  {
    DateTimeParseContext  context = parseUnresolved0(text, position);

    return context == null ? null : context.toUnresolved();
  }

  private TemporalAccessor parseResolved(CharSequence text)
  {
    ParsePosition         pos = new ParsePosition(0);
    DateTimeParseContext  context = parseUnresolved0(text, pos);

    if (context == null || pos.getErrorIndex() >= 0 || pos.getIndex() < text.length()) {
      String  abbr = abbreviate(text);

      if (pos.getErrorIndex() >= 0)
        throw new DateTimeParseException("Text '" + abbr + "' could not be parsed at index " + pos.getErrorIndex(),
                                         text, pos.getErrorIndex());
      else
        throw new DateTimeParseException("Text '" + abbr + "' could not be parsed, unparsed text found at index " +
                                         pos.getIndex(), text, pos.getIndex());
    }

    return context.toResolved();
  }

  private DateTimeParseContext parseUnresolved0(CharSequence text, ParsePosition position)
  {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(position, "position");

    DateTimeParseContext  context = new DateTimeParseContext();
    int                   pos = printerParser.parse(context, text, position.getIndex());

    if (pos < 0) {
      position.setErrorIndex(~pos);
      return null;
    }

    position.setIndex(pos);

    return context;
  }

  private static DateTimeParseException createError(CharSequence text, RuntimeException e)
  {
    return new DateTimeParseException("Text '" + abbreviate(text) + "' could not be parsed: " + e.getMessage(), text, 0, e);
  }

  private static String abbreviate(CharSequence text)
  {
    if (text.length() > 64)
      return text.subSequence(0, 64).toString() + "...";

    return text.toString();
  }

  DateTimeFormatterBuilder.CompositePrinterParser toPrinterParser(boolean optional)
  {
    return printerParser.withOptional(optional);
  }

  @Override
  public String toString()
  {
    String  pattern = printerParser.toString();

    return pattern.startsWith("[") ? pattern : pattern.substring(1, pattern.length() - 1);
  }
}
