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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.shetline.civiltime.DateTimeException;
import org.shetline.civiltime.Instant;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.ZoneId;
import org.shetline.civiltime.ZoneOffset;
import org.shetline.civiltime.temporal.ChronoField;
import org.shetline.civiltime.temporal.TemporalQueries;
import org.shetline.civiltime.temporal.TemporalQuery;

import static org.shetline.civiltime.temporal.ChronoField.*;


/**
 * Assembles a {@link DateTimeFormatter} from numeric fields, fractions, literals, offsets, and
 * zone IDs. A builder is for use from a single thread; the formatters it produces are immutable.
 */
public final class DateTimeFormatterBuilder
{
  private static final TemporalQuery<ZoneId> QUERY_REGION_ONLY = temporal ->
  {
    ZoneId  zone = temporal.query(TemporalQueries.zoneId());

    return zone != null && !(zone instanceof ZoneOffset) ? zone : null;
  };

  private DateTimeFormatterBuilder                active = this;
  private final DateTimeFormatterBuilder          parent;
  private final List<DateTimePrinterParser>       printerParsers = new ArrayList<>();
  private final boolean                           optional;
  private int                                     valueParserIndex = -1;

  public DateTimeFormatterBuilder()
  {
    parent = null;
    optional = false;
  }

  private DateTimeFormatterBuilder(DateTimeFormatterBuilder parent, boolean optional)
  {
    this.parent = parent;
    this.optional = optional;
  }

  public DateTimeFormatterBuilder parseCaseSensitive()
  {
    appendInternal(SettingsParser.SENSITIVE);
    return this;
  }

  public DateTimeFormatterBuilder parseCaseInsensitive()
  {
    appendInternal(SettingsParser.INSENSITIVE);
    return this;
  }

  public DateTimeFormatterBuilder parseStrict()
  {
    appendInternal(SettingsParser.STRICT);
    return this;
  }

  public DateTimeFormatterBuilder parseLenient()
  {
    appendInternal(SettingsParser.LENIENT);
    return this;
  }

  public DateTimeFormatterBuilder appendValue(ChronoField field)
  {
    Objects.requireNonNull(field, "field");
    appendValue(new NumberPrinterParser(field, 1, 19, SignStyle.NORMAL));
    return this;
  }

  public DateTimeFormatterBuilder appendValue(ChronoField field, int width)
  {
    Objects.requireNonNull(field, "field");

    if (width < 1 || width > 19)
      throw new IllegalArgumentException("The width must be from 1 to 19 inclusive but was " + width);

    appendValue(new NumberPrinterParser(field, width, width, SignStyle.NOT_NEGATIVE));
    return this;
  }

  public DateTimeFormatterBuilder appendValue(ChronoField field, int minWidth, int maxWidth, SignStyle signStyle)
  {
    if (minWidth == maxWidth && signStyle == SignStyle.NOT_NEGATIVE)
      return appendValue(field, maxWidth);

    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(signStyle, "signStyle");

    if (minWidth < 1 || minWidth > 19)
      throw new IllegalArgumentException("The minimum width must be from 1 to 19 inclusive but was " + minWidth);
    else if (maxWidth < 1 || maxWidth > 19)
      throw new IllegalArgumentException("The maximum width must be from 1 to 19 inclusive but was " + maxWidth);
    else if (maxWidth < minWidth)
      throw new IllegalArgumentException("The maximum width must exceed or equal the minimum width but " +
                                         maxWidth + " < " + minWidth);

    appendValue(new NumberPrinterParser(field, minWidth, maxWidth, signStyle));
    return this;
  }

  /**
   * Appends a field printed as its last {@code width} digits. Parsing places the value in the
   * range of {@code 10^width} values starting at {@code baseValue}.
   */
  public DateTimeFormatterBuilder appendValueReduced(ChronoField field, int width, int baseValue)
  {
    Objects.requireNonNull(field, "field");

    if (width < 1 || width > 10)
      throw new IllegalArgumentException("The width must be from 1 to 10 inclusive but was " + width);

    appendValue(new ReducedPrinterParser(field, width, baseValue, 0));
    return this;
  }

  // A fixed-width value directly following another value lets the earlier one parse
  // without a separator, as in "20080630".
  private void appendValue(NumberPrinterParser pp)
  {
    if (active.valueParserIndex >= 0) {
      int                   activeValueParser = active.valueParserIndex;
      NumberPrinterParser   basePP = (NumberPrinterParser) active.printerParsers.get(activeValueParser);

      if (pp.minWidth == pp.maxWidth && pp.signStyle == SignStyle.NOT_NEGATIVE) {
        basePP = basePP.withSubsequentWidth(pp.maxWidth);
        appendInternal(pp.withFixedWidth());
        active.valueParserIndex = activeValueParser;
      }
      else {
        basePP = basePP.withFixedWidth();
        active.valueParserIndex = appendInternal(pp);
      }

      active.printerParsers.set(activeValueParser, basePP);
    }
    else
      active.valueParserIndex = appendInternal(pp);
  }

  public DateTimeFormatterBuilder appendFraction(ChronoField field, int minWidth, int maxWidth, boolean decimalPoint)
  {
    Objects.requireNonNull(field, "field");

    if (field.range().getMinimum() != 0 || !field.range().isFixed())
      throw new IllegalArgumentException("Field must have a fixed set of values: " + field);
    else if (minWidth < 0 || minWidth > 9)
      throw new IllegalArgumentException("Minimum width must be from 0 to 9 inclusive but was " + minWidth);
    else if (maxWidth < 1 || maxWidth > 9)
      throw new IllegalArgumentException("Maximum width must be from 1 to 9 inclusive but was " + maxWidth);
    else if (maxWidth < minWidth)
      throw new IllegalArgumentException("Maximum width must exceed or equal the minimum width but " +
                                         maxWidth + " < " + minWidth);

    appendInternal(new FractionPrinterParser(field, minWidth, maxWidth, decimalPoint));
    return this;
  }

  public DateTimeFormatterBuilder appendInstant()
  {
    appendInternal(new InstantPrinterParser(-2));
    return this;
  }

  public DateTimeFormatterBuilder appendInstant(int fractionalDigits)
  {
    if (fractionalDigits < -1 || fractionalDigits > 9)
      throw new IllegalArgumentException("The fractional digits must be from -1 to 9 inclusive but was " + fractionalDigits);

    appendInternal(new InstantPrinterParser(fractionalDigits));
    return this;
  }

  public DateTimeFormatterBuilder appendOffsetId()
  {
    appendInternal(OffsetIdPrinterParser.INSTANCE_ID_Z);
    return this;
  }

  /**
   * Appends an offset in one of the patterns "+HH", "+HHmm", "+HH:mm", "+HHMM", "+HH:MM",
   * "+HHMMss", "+HH:MM:ss", "+HHMMSS" or "+HH:MM:SS". Lower-case parts are printed only when
   * non-zero.
   */
  public DateTimeFormatterBuilder appendOffset(String pattern, String noOffsetText)
  {
    appendInternal(new OffsetIdPrinterParser(noOffsetText, pattern));
    return this;
  }

  public DateTimeFormatterBuilder appendZoneId()
  {
    appendInternal(new ZoneIdPrinterParser(TemporalQueries.zoneId(), "ZoneId()"));
    return this;
  }

  public DateTimeFormatterBuilder appendZoneRegionId()
  {
    appendInternal(new ZoneIdPrinterParser(QUERY_REGION_ONLY, "ZoneRegionId()"));
    return this;
  }

  public DateTimeFormatterBuilder appendLiteral(char literal)
  {
    appendInternal(new CharLiteralPrinterParser(literal));
    return this;
  }

  public DateTimeFormatterBuilder appendLiteral(String literal)
  {
    Objects.requireNonNull(literal, "literal");

    if (literal.length() == 1)
      appendInternal(new CharLiteralPrinterParser(literal.charAt(0)));
    else if (literal.length() > 0)
      appendInternal(new StringLiteralPrinterParser(literal));

    return this;
  }

  public DateTimeFormatterBuilder append(DateTimeFormatter formatter)
  {
    Objects.requireNonNull(formatter, "formatter");
    appendInternal(formatter.toPrinterParser(false));
    return this;
  }

  /**
   * Appends the elements of a pattern. The letters understood are:
   *
   * <pre>
   *   u  year                   y  year-of-era
   *   M  month-of-year          d  day-of-month
   *   D  day-of-year            H  hour-of-day
   *   m  minute-of-hour         s  second-of-minute
   *   S  fraction-of-second     n  nano-of-second
   *   X  offset, Z for zero     x  offset
   *   VV zone ID
   * </pre>
   *
   * Text in single quotes is literal, two single quotes are a quote, and square brackets enclose
   * an optional section.
   *
   * @throws IllegalArgumentException if the pattern is invalid
   */
  public DateTimeFormatterBuilder appendPattern(String pattern)
  {
    Objects.requireNonNull(pattern, "pattern");
    parsePattern(pattern);
    return this;
  }

  private void parsePattern(String pattern)
  {
    for (int pos = 0; pos < pattern.length(); ++pos) {
      char  cur = pattern.charAt(pos);

      if ((cur >= 'A' && cur <= 'Z') || (cur >= 'a' && cur <= 'z')) {
        int   start = pos++;

        while (pos < pattern.length() && pattern.charAt(pos) == cur)
          ++pos;

        parseField(cur, pos - start);
        --pos;
      }
      else if (cur == '\'') {
        int   start = pos++;

        for (; pos < pattern.length(); ++pos) {
          if (pattern.charAt(pos) == '\'') {
            if (pos + 1 < pattern.length() && pattern.charAt(pos + 1) == '\'')
              ++pos;
            else
              break;
          }
        }

        if (pos >= pattern.length())
          throw new IllegalArgumentException("Pattern ends with an incomplete string literal: " + pattern);

        String  str = pattern.substring(start + 1, pos);

        if (str.isEmpty())
          appendLiteral('\'');
        else
          appendLiteral(str.replace("''", "'"));
      }
      else if (cur == '[')
        optionalStart();
      else if (cur == ']') {
        if (active.parent == null)
          throw new IllegalArgumentException("Pattern invalid as it contains ] without previous [");

        optionalEnd();
      }
      else if (cur == '{' || cur == '}' || cur == '#')
        throw new IllegalArgumentException("Pattern includes reserved character: '" + cur + "'");
      else
        appendLiteral(cur);
    }
  }

  private static final String[] X_NO_OFFSET = { "Z", "Z", "Z", "Z", "Z" };
  private static final String[] x_NO_OFFSET = { "+00", "+0000", "+00:00", "+0000", "+00:00" };
  private static final String[] OFFSET_PATTERNS = { "+HHmm", "+HHMM", "+HH:MM", "+HHMMss", "+HH:MM:ss" };

  private void parseField(char cur, int count)
  {
    switch (cur) {
      case 'u':
      case 'y': {
        ChronoField   field = (cur == 'u' ? YEAR : YEAR_OF_ERA);

        if (count == 2)
          appendValueReduced(field, 2, 2000);
        else if (count < 4)
          appendValue(field, count, 19, SignStyle.NORMAL);
        else
          appendValue(field, count, 19, SignStyle.EXCEEDS_PAD);
      }
      break;

      case 'M': case 'd': case 'H': case 'm': case 's': {
        ChronoField   field = fieldForLetter(cur);

        if (count == 1)
          appendValue(field);
        else if (count == 2)
          appendValue(field, 2);
        else
          throw new IllegalArgumentException("Too many pattern letters: " + cur);
      }
      break;

      case 'D':
        if (count == 1)
          appendValue(DAY_OF_YEAR);
        else if (count == 2)
          appendValue(DAY_OF_YEAR, 2, 3, SignStyle.NOT_NEGATIVE);
        else if (count == 3)
          appendValue(DAY_OF_YEAR, 3);
        else
          throw new IllegalArgumentException("Too many pattern letters: " + cur);
        break;

      case 'S':
        appendFraction(NANO_OF_SECOND, count, count, false);
        break;

      case 'n':
        if (count == 1)
          appendValue(NANO_OF_SECOND);
        else
          appendValue(NANO_OF_SECOND, count, 19, SignStyle.NOT_NEGATIVE);
        break;

      case 'X':
      case 'x':
        if (count > 5)
          throw new IllegalArgumentException("Too many pattern letters: " + cur);

        appendOffset(OFFSET_PATTERNS[count - 1], cur == 'X' ? X_NO_OFFSET[count - 1] : x_NO_OFFSET[count - 1]);
        break;

      case 'V':
        if (count != 2)
          throw new IllegalArgumentException("Pattern letter count must be 2: " + cur);

        appendZoneId();
        break;

      default:
        throw new IllegalArgumentException("Unknown pattern letter: " + cur);
    }
  }

  private static ChronoField fieldForLetter(char letter)
  {
    switch (letter) {
      case 'M': return MONTH_OF_YEAR;
      case 'd': return DAY_OF_MONTH;
      case 'H': return HOUR_OF_DAY;
      case 'm': return MINUTE_OF_HOUR;
      default:  return SECOND_OF_MINUTE;
    }
  }

  /**
   * Starts an optional section. When formatting, the section is skipped if any value in it is
   * unavailable; when parsing, it is skipped if it fails to match.
   */
  public DateTimeFormatterBuilder optionalStart()
  {
    active.valueParserIndex = -1;
    active = new DateTimeFormatterBuilder(active, true);
    return this;
  }

  public DateTimeFormatterBuilder optionalEnd()
  {
    if (active.parent == null)
      throw new IllegalStateException("Cannot call optionalEnd() as there was no previous call to optionalStart()");

    if (active.printerParsers.size() > 0) {
      CompositePrinterParser  cpp = new CompositePrinterParser(active.printerParsers, active.optional);

      active = active.parent;
      appendInternal(cpp);
    }
    else
      active = active.parent;

    return this;
  }

  private int appendInternal(DateTimePrinterParser pp)
  {
    Objects.requireNonNull(pp, "pp");

    active.printerParsers.add(pp);
    active.valueParserIndex = -1;

    return active.printerParsers.size() - 1;
  }

  public DateTimeFormatter toFormatter()
  {
    while (active.parent != null)
      optionalEnd();

    return new DateTimeFormatter(new CompositePrinterParser(printerParsers, false));
  }

  static final class CompositePrinterParser implements DateTimePrinterParser
  {
    private final DateTimePrinterParser[] printerParsers;
    private final boolean                 optional;

    CompositePrinterParser(List<DateTimePrinterParser> printerParsers, boolean optional)
    {
      this(printerParsers.toArray(new DateTimePrinterParser[0]), optional);
    }

    CompositePrinterParser(DateTimePrinterParser[] printerParsers, boolean optional)
    {
      this.printerParsers = printerParsers;
      this.optional = optional;
    }

    CompositePrinterParser withOptional(boolean optional)
    {
      return optional == this.optional ? this : new CompositePrinterParser(printerParsers, optional);
    }

    @Override
    public boolean format(DateTimePrintContext context, StringBuilder buf)
    {
      int   length = buf.length();

      if (optional)
        context.startOptional();

      try {
        for (DateTimePrinterParser pp : printerParsers) {
          if (!pp.format(context, buf)) {
            buf.setLength(length);
            return true;
          }
        }
      }
      finally {
        if (optional)
          context.endOptional();
      }

      return true;
    }

    @Override
    public int parse(DateTimeParseContext context, CharSequence text, int position)
    {
      if (optional) {
        int   pos = position;

        context.startOptional();

        for (DateTimePrinterParser pp : printerParsers) {
          pos = pp.parse(context, text, pos);

          if (pos < 0) {
            context.endOptional(false);
            return position;
          }
        }

        context.endOptional(true);

        return pos;
      }
      else {
        for (DateTimePrinterParser pp : printerParsers) {
          position = pp.parse(context, text, position);

          if (position < 0)
            break;
        }

        return position;
      }
    }

    @Override
    public String toString()
    {
      StringBuilder   buf = new StringBuilder();

      buf.append(optional ? "[" : "(");

      for (DateTimePrinterParser pp : printerParsers)
        buf.append(pp);

      buf.append(optional ? "]" : ")");

      return buf.toString();
    }
  }

  enum SettingsParser implements DateTimePrinterParser
  {
    SENSITIVE, INSENSITIVE, STRICT, LENIENT;

    @Override
    public boolean format(DateTimePrintContext context, StringBuilder buf)
    {
      return true;
    }

    @Override
    public int parse(DateTimeParseContext context, CharSequence text, int position)
    {
      switch (this) {
        case SENSITIVE:   context.setCaseSensitive(true); break;
        case INSENSITIVE: context.setCaseSensitive(false); break;
        case STRICT:      context.setStrict(true); break;
        case LENIENT:     context.setStrict(false); break;
      }

      return position;
    }

    @Override
    public String toString()
    {
      switch (this) {
        case SENSITIVE:   return "ParseCaseSensitive(true)";
        case INSENSITIVE: return "ParseCaseSensitive(false)";
        case STRICT:      return "ParseStrict(true)";
        default:          return "ParseStrict(false)";
      }
    }
  }

  static final class CharLiteralPrinterParser implements DateTimePrinterParser
  {
    private final char  literal;

    CharLiteralPrinterParser(char literal)
    {
      this.literal = literal;
    }

    @Override
    public boolean format(DateTimePrintContext context, StringBuilder buf)
    {
      buf.append(literal);
      return true;
    }

    @Override
    public int parse(DateTimeParseContext context, CharSequence text, int position)
    {
      if (position == text.length() || !context.charEquals(literal, text.charAt(position)))
        return ~position;

      return position + 1;
    }

    @Override
    public String toString()
    {
      return literal == '\'' ? "''" : "'" + literal + "'";
    }
  }

  static final class StringLiteralPrinterParser implements DateTimePrinterParser
  {
    private final String  literal;

    StringLiteralPrinterParser(String literal)
    {
      this.literal = literal;
    }

    @Override
    public boolean format(DateTimePrintContext context, StringBuilder buf)
    {
      buf.append(literal);
      return true;
    }

    @Override
    public int parse(DateTimeParseContext context, CharSequence text, int position)
    {
      if (position > text.length() || position < 0)
        throw new IndexOutOfBoundsException("Position " + position + " outside text of length " + text.length());

      if (!context.subSequenceEquals(text, position, literal, 0, literal.length()))
        return ~position;

      return position + literal.length();
    }

    @Override
    public String toString()
    {
      return "'" + literal.replace("'", "''") + "'";
    }
  }

  static class NumberPrinterParser implements DateTimePrinterParser
  {
    // Values at or above these need more digits than the corresponding minimum width.
    static final long[] EXCEED_POINTS = {
      0L, 10L, 100L, 1000L, 10000L, 100000L, 1000000L, 10000000L, 100000000L, 1000000000L, 10000000000L,
      100000000000L, 1000000000000L, 10000000000000L, 100000000000000L, 1000000000000000L,
      10000000000000000L, 100000000000000000L, 1000000000000000000L
    };

    final ChronoField   field;
    final int           minWidth;
    final int           maxWidth;
    final SignStyle     signStyle;
    // Width of fixed-width values that follow this one with no separator, or -1 once fixed itself.
    final int           subsequentWidth;

    NumberPrinterParser(ChronoField field, int minWidth, int maxWidth, SignStyle signStyle)
    {
      this(field, minWidth, maxWidth, signStyle, 0);
    }

    NumberPrinterParser(ChronoField field, int minWidth, int maxWidth, SignStyle signStyle, int subsequentWidth)
    {
      this.field = field;
      this.minWidth = minWidth;
      this.maxWidth = maxWidth;
      this.signStyle = signStyle;
      this.subsequentWidth = subsequentWidth;
    }

    NumberPrinterParser withFixedWidth()
    {
      if (subsequentWidth == -1)
        return this;

      return new NumberPrinterParser(field, minWidth, maxWidth, signStyle, -1);
    }

    NumberPrinterParser withSubsequentWidth(int subsequentWidth)
    {
      return new NumberPrinterParser(field, minWidth, maxWidth, signStyle, this.subsequentWidth + subsequentWidth);
    }

    @Override
    public boolean format(DateTimePrintContext context, StringBuilder buf)
    {
      Long  valueLong = context.getValue(field);

      if (valueLong == null)
        return false;

      long    value = getValue(valueLong);
      String  str = (value == Long.MIN_VALUE ? "9223372036854775808" : Long.toString(Math.abs(value)));

      if (str.length() > maxWidth)
        throw new DateTimeException("Field " + field + " cannot be printed as the value " + value +
                                    " exceeds the maximum print width of " + maxWidth);

      if (value >= 0) {
        if (signStyle == SignStyle.EXCEEDS_PAD) {
          if (minWidth < 19 && value >= EXCEED_POINTS[minWidth])
            buf.append('+');
        }
        else if (signStyle == SignStyle.ALWAYS)
          buf.append('+');
      }
      else {
        switch (signStyle) {
          case NORMAL:
          case EXCEEDS_PAD:
          case ALWAYS:
            buf.append('-');
            break;
          case NOT_NEGATIVE:
            throw new DateTimeException("Field " + field + " cannot be printed as the value " + value +
                                        " cannot be negative according to the SignStyle");
          default:
            break;
        }
      }

      for (int i = 0; i < minWidth - str.length(); ++i)
        buf.append('0');

      buf.append(str);

      return true;
    }

    long getValue(long value)
    {
      return value;
    }

    boolean isFixedWidth()
    {
      return subsequentWidth == -1 || (subsequentWidth > 0 && minWidth == maxWidth && signStyle == SignStyle.NOT_NEGATIVE);
    }

    @Override
    public int parse(DateTimeParseContext context, CharSequence text, int position)
    {
      int       length = text.length();
      boolean   strict = context.isStrict();

      if (position == length)
        return ~position;

      char      sign = text.charAt(position);
      boolean   negative = false;
      boolean   positive = false;

      if (sign == '+') {
        if (!signStyle.parse(true, strict, minWidth == maxWidth))
          return ~position;

        positive = true;
        ++position;
      }
      else if (sign == '-') {
        if (!signStyle.parse(false, strict, minWidth == maxWidth))
          return ~position;

        negative = true;
        ++position;
      }
      else if (signStyle == SignStyle.ALWAYS && strict)
        return ~position;

      int   effMinWidth = (strict || isFixedWidth() ? minWidth : 1);
      int   minEndPos = position + effMinWidth;

      if (minEndPos > length)
        return ~position;

      int   effMaxWidth = (strict || isFixedWidth() ? maxWidth : 9) + Math.max(subsequentWidth, 0);
      long  total = 0;
      int   pos = position;

      for (int pass = 0; pass < 2; ++pass) {
        int   maxEndPos = Math.min(pos + effMaxWidth, length);

        while (pos < maxEndPos) {
          char  ch = text.charAt(pos++);

          if (ch < '0' || ch > '9') {
            --pos;

            if (pos < minEndPos)
              return ~position;

            break;
          }

          if (pos - position > 18)
            return ~position;

          total = total * 10 + (ch - '0');
        }

        // Give back the digits the following fixed-width values need.
        if (subsequentWidth > 0 && pass == 0) {
          int   parseLen = pos - position;

          effMaxWidth = Math.max(effMinWidth, parseLen - subsequentWidth);
          pos = position;
          total = 0;
        }
        else
          break;
      }

      if (negative) {
        if (total == 0 && strict)
          return ~(position - 1);

        total = -total;
      }
      else if (signStyle == SignStyle.EXCEEDS_PAD && strict) {
        int   parseLen = pos - position;

        if (positive) {
          if (parseLen <= minWidth)
            return ~(position - 1);
        }
        else if (parseLen > minWidth)
          return ~position;
      }

      return setValue(context, total, position, pos);
    }

    int setValue(DateTimeParseContext context, long value, int errorPos, int successPos)
    {
      return context.setParsedField(field, value, errorPos, successPos);
    }

    @Override
    public String toString()
    {
      if (minWidth == 1 && maxWidth == 19 && signStyle == SignStyle.NORMAL)
        return "Value(" + field + ")";
      else if (minWidth == maxWidth && signStyle == SignStyle.NOT_NEGATIVE)
        return "Value(" + field + "," + minWidth + ")";

      return "Value(" + field + "," + minWidth + "," + maxWidth + "," + signStyle + ")";
    }
  }

  static final class ReducedPrinterParser extends NumberPrinterParser
  {
    private final int   baseValue;

    ReducedPrinterParser(ChronoField field, int width, int baseValue, int subsequentWidth)
    {
      super(field, width, width, SignStyle.NOT_NEGATIVE, subsequentWidth);
      this.baseValue = baseValue;
    }

    @Override
    long getValue(long value)
    {
      long  absValue = Math.abs(value);

      return absValue % EXCEED_POINTS[minWidth];
    }

    @Override
    int setValue(DateTimeParseContext context, long value, int errorPos, int successPos)
    {
      int   parseLen = successPos - errorPos;

      if (parseLen == minWidth && value >= 0) {
        long  range = EXCEED_POINTS[minWidth];
        long  lastPart = baseValue % range;
        long  basePart = baseValue - lastPart;

        if (baseValue > 0)
          value = basePart + value;
        else
          value = basePart - value;

        if (value < baseValue)
          value += range;
      }

      return context.setParsedField(field, value, errorPos, successPos);
    }

    @Override
    ReducedPrinterParser withFixedWidth()
    {
      if (subsequentWidth == -1)
        return this;

      return new ReducedPrinterParser(field, minWidth, baseValue, -1);
    }

    @Override
    ReducedPrinterParser withSubsequentWidth(int subsequentWidth)
    {
      return new ReducedPrinterParser(field, minWidth, baseValue, this.subsequentWidth + subsequentWidth);
    }

    @Override
    public String toString()
    {
      return "ReducedValue(" + field + "," + minWidth + "," + baseValue + ")";
    }
  }

  static final class FractionPrinterParser implements DateTimePrinterParser
  {
    private final ChronoField   field;
    private final int           minWidth;
    private final int           maxWidth;
    private final boolean       decimalPoint;

    FractionPrinterParser(ChronoField field, int minWidth, int maxWidth, boolean decimalPoint)
    {
      this.field = field;
      this.minWidth = minWidth;
      this.maxWidth = maxWidth;
      this.decimalPoint = decimalPoint;
    }

    // Number of decimal digits needed for the largest value of the field.
    private int scale()
    {
      return Long.toString(field.range().getMaximum()).length();
    }

    @Override
    public boolean format(DateTimePrintContext context, StringBuilder buf)
    {
      Long  value = context.getValue(field);

      if (value == null)
        return false;

      int     scale = scale();
      String  digits = Long.toString(field.range().checkValidValue(value, field));

      while (digits.length() < scale)
        digits = "0" + digits;

      int   significant = digits.length();

      while (significant > 0 && digits.charAt(significant - 1) == '0')
        --significant;

      int   outputWidth = Math.min(Math.max(significant, minWidth), maxWidth);

      if (outputWidth > 0) {
        if (decimalPoint)
          buf.append('.');

        buf.append(digits, 0, outputWidth);
      }

      return true;
    }

    @Override
    public int parse(DateTimeParseContext context, CharSequence text, int position)
    {
      int   effectiveMin = (context.isStrict() ? minWidth : 0);
      int   effectiveMax = (context.isStrict() ? maxWidth : 9);
      int   length = text.length();

      if (position == length)
        return (effectiveMin > 0 ? ~position : position);

      if (decimalPoint) {
        if (text.charAt(position) != '.')
          return (effectiveMin > 0 ? ~position : position);

        ++position;
      }

      int   minEndPos = position + effectiveMin;

      if (minEndPos > length)
        return ~position;

      int   maxEndPos = Math.min(position + effectiveMax, length);
      long  total = 0;
      int   pos = position;

      while (pos < maxEndPos) {
        char  ch = text.charAt(pos++);

        if (ch < '0' || ch > '9') {
          if (pos < minEndPos)
            return ~position;

          --pos;
          break;
        }

        total = total * 10 + (ch - '0');
      }

      // A decimal point must be followed by at least one digit.
      if (decimalPoint && pos == position)
        return ~position;

      int   scale = scale();

      for (int i = pos - position; i < scale; ++i)
        total *= 10;

      return context.setParsedField(field, total, position, pos);
    }

    @Override
    public String toString()
    {
      return "Fraction(" + field + "," + minWidth + "," + maxWidth + (decimalPoint ? ",DecimalPoint" : "") + ")";
    }
  }

  static final class InstantPrinterParser implements DateTimePrinterParser
  {
    private static final long SECONDS_PER_10000_YEARS = 146097L * 25L * 86400L;
    private static final long SECONDS_0000_TO_1970 = ((146097L * 5L) - (30L * 365L + 7L)) * 86400L;

    private final int   fractionalDigits;

    InstantPrinterParser(int fractionalDigits)
    {
      this.fractionalDigits = fractionalDigits;
    }

    @Override
    public boolean format(DateTimePrintContext context, StringBuilder buf)
    {
      Long  inSecs = context.getValue(INSTANT_SECONDS);
      Long  inNanos = null;

      if (context.getTemporal().isSupported(NANO_OF_SECOND))
        inNanos = context.getTemporal().getLong(NANO_OF_SECOND);

      if (inSecs == null)
        return false;

      long  inSec = inSecs;
      int   inNano = NANO_OF_SECOND.checkValidIntValue(inNanos != null ? inNanos : 0);

      // Years outside 0000 to 9999 are printed as a number of 10000 year cycles plus a year
      // inside one, so that the full instant range can be printed.
      if (inSec >= -SECONDS_0000_TO_1970) {
        long            zeroSecs = inSec - SECONDS_PER_10000_YEARS + SECONDS_0000_TO_1970;
        long            hi = Math.floorDiv(zeroSecs, SECONDS_PER_10000_YEARS) + 1;
        long            lo = Math.floorMod(zeroSecs, SECONDS_PER_10000_YEARS);
        LocalDateTime   ldt = LocalDateTime.ofEpochSecond(lo - SECONDS_0000_TO_1970, 0, ZoneOffset.UTC);

        if (hi > 0)
          buf.append('+').append(hi);

        buf.append(ldt);

        if (ldt.getSecond() == 0)
          buf.append(":00");
      }
      else {
        long            zeroSecs = inSec + SECONDS_0000_TO_1970;
        long            hi = zeroSecs / SECONDS_PER_10000_YEARS;
        long            lo = zeroSecs % SECONDS_PER_10000_YEARS;
        LocalDateTime   ldt = LocalDateTime.ofEpochSecond(lo - SECONDS_0000_TO_1970, 0, ZoneOffset.UTC);
        int             pos = buf.length();

        buf.append(ldt);

        if (ldt.getSecond() == 0)
          buf.append(":00");

        if (hi < 0) {
          if (ldt.getYear() == -10000)
            buf.replace(pos, pos + 2, Long.toString(hi - 1));
          else if (lo == 0)
            buf.insert(pos, hi);
          else
            buf.insert(pos + 1, Math.abs(hi));
        }
      }

      if ((fractionalDigits < 0 && inNano > 0) || fractionalDigits > 0) {
        buf.append('.');

        if (fractionalDigits == -2) {
          if (inNano % 1000000 == 0)
            buf.append(Integer.toString((inNano / 1000000) + 1000).substring(1));
          else if (inNano % 1000 == 0)
            buf.append(Integer.toString((inNano / 1000) + 1000000).substring(1));
          else
            buf.append(Integer.toString(inNano + 1000000000).substring(1));
        }
        else if (fractionalDigits > 0 || (fractionalDigits == -1 && inNano > 0)) {
          int   div = 100000000;

          for (int i = 0; ((fractionalDigits == -1 && inNano > 0) || i < fractionalDigits); ++i) {
            int   digit = inNano / div;

            buf.append((char) (digit + '0'));
            inNano = inNano - (digit * div);
            div = div / 10;
          }
        }
      }

      buf.append('Z');

      return true;
    }

    @Override
    public int parse(DateTimeParseContext context, CharSequence text, int position)
    {
      DateTimeParseContext    newContext = context.copy();
      int                     minDigits = (fractionalDigits < 0 ? 0 : fractionalDigits);
      int                     maxDigits = (fractionalDigits < 0 ? 9 : fractionalDigits);
      CompositePrinterParser  parser = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE).appendLiteral('T')
        .appendValue(HOUR_OF_DAY, 2).appendLiteral(':').appendValue(MINUTE_OF_HOUR, 2)
        .optionalStart().appendLiteral(':').appendValue(SECOND_OF_MINUTE, 2)
        .appendFraction(NANO_OF_SECOND, minDigits, maxDigits, true).optionalEnd()
        .appendOffsetId()
        .toFormatter().toPrinterParser(false);
      int                     pos = parser.parse(newContext, text, position);

      if (pos < 0)
        return pos;

      long  yearParsed = newContext.getParsed(YEAR);
      int   month = newContext.getParsed(MONTH_OF_YEAR).intValue();
      int   day = newContext.getParsed(DAY_OF_MONTH).intValue();
      int   hour = newContext.getParsed(HOUR_OF_DAY).intValue();
      int   min = newContext.getParsed(MINUTE_OF_HOUR).intValue();
      Long  secVal = newContext.getParsed(SECOND_OF_MINUTE);
      Long  nanoVal = newContext.getParsed(NANO_OF_SECOND);
      int   sec = (secVal != null ? secVal.intValue() : 0);
      int   nano = (nanoVal != null ? nanoVal.intValue() : 0);
      int   offset = newContext.getParsed(OFFSET_SECONDS).intValue();
      int   days = 0;

      if (hour == 24 && min == 0 && sec == 0 && nano == 0) {
        hour = 0;
        days = 1;
      }

      int   year = (int) yearParsed % 10000;
      long  instantSecs;

      try {
        LocalDateTime   ldt = LocalDateTime.of(year, month, day, hour, min, sec, 0).plusDays(days);

        instantSecs = ldt.toEpochSecond(ZoneOffset.ofTotalSeconds(offset));
        instantSecs = Math.addExact(instantSecs, Math.multiplyExact(yearParsed / 10000L, SECONDS_PER_10000_YEARS));
      }
      catch (DateTimeException | ArithmeticException e) {
        return ~position;
      }

      if (instantSecs < Instant.MIN.getEpochSecond() || instantSecs > Instant.MAX.getEpochSecond())
        return ~position;

      int   successPos = context.setParsedField(INSTANT_SECONDS, instantSecs, position, pos);

      return context.setParsedField(NANO_OF_SECOND, nano, position, successPos);
    }

    @Override
    public String toString()
    {
      return "Instant()";
    }
  }

  static final class OffsetIdPrinterParser implements DateTimePrinterParser
  {
    static final String[] PATTERNS = {
      "+HH", "+HHmm", "+HH:mm", "+HHMM", "+HH:MM", "+HHMMss", "+HH:MM:ss", "+HHMMSS", "+HH:MM:SS"
    };
    static final OffsetIdPrinterParser  INSTANCE_ID_Z = new OffsetIdPrinterParser("Z", "+HH:MM:ss");

    private final String  noOffsetText;
    private final int     type;

    OffsetIdPrinterParser(String noOffsetText, String pattern)
    {
      Objects.requireNonNull(noOffsetText, "noOffsetText");
      Objects.requireNonNull(pattern, "pattern");

      this.noOffsetText = noOffsetText;
      this.type = checkPattern(pattern);
    }

    private static int checkPattern(String pattern)
    {
      for (int i = 0; i < PATTERNS.length; ++i) {
        if (PATTERNS[i].equals(pattern))
          return i;
      }

      throw new IllegalArgumentException("Invalid zone offset pattern: " + pattern);
    }

    @Override
    public boolean format(DateTimePrintContext context, StringBuilder buf)
    {
      Long  offsetSecs = context.getValue(OFFSET_SECONDS);

      if (offsetSecs == null)
        return false;

      int   totalSecs = Math.toIntExact(offsetSecs);

      if (totalSecs == 0)
        buf.append(noOffsetText);
      else {
        int   absHours = Math.abs((totalSecs / 3600) % 100);
        int   absMinutes = Math.abs((totalSecs / 60) % 60);
        int   absSeconds = Math.abs(totalSecs % 60);
        int   bufPos = buf.length();
        int   output = absHours;

        buf.append(totalSecs < 0 ? "-" : "+").append((char) (absHours / 10 + '0')).append((char) (absHours % 10 + '0'));

        if (type >= 3 || (type >= 1 && absMinutes > 0)) {
          buf.append((type % 2) == 0 ? ":" : "").append((char) (absMinutes / 10 + '0')).append((char) (absMinutes % 10 + '0'));
          output += absMinutes;

          if (type >= 7 || (type >= 5 && absSeconds > 0)) {
            buf.append((type % 2) == 0 ? ":" : "").append((char) (absSeconds / 10 + '0')).append((char) (absSeconds % 10 + '0'));
            output += absSeconds;
          }
        }

        if (output == 0) {
          buf.setLength(bufPos);
          buf.append(noOffsetText);
        }
      }

      return true;
    }

    @Override
    public int parse(DateTimeParseContext context, CharSequence text, int position)
    {
      int   length = text.length();
      int   noOffsetLen = noOffsetText.length();

      if (noOffsetLen == 0) {
        if (position == length)
          return context.setParsedField(OFFSET_SECONDS, 0, position, position);
      }
      else {
        if (position == length)
          return ~position;

        if (context.subSequenceEquals(text, position, noOffsetText, 0, noOffsetLen))
          return context.setParsedField(OFFSET_SECONDS, 0, position, position + noOffsetLen);
      }

      char  sign = text.charAt(position);

      if (sign == '+' || sign == '-') {
        int   negative = (sign == '-' ? -1 : 1);
        int[] array = new int[4];

        array[0] = position + 1;

        if (!(parseNumber(array, 1, text, true) || parseNumber(array, 2, text, type >= 3) ||
              parseNumber(array, 3, text, false))) {
          long  offsetSecs = negative * (array[1] * 3600L + array[2] * 60L + array[3]);

          return context.setParsedField(OFFSET_SECONDS, offsetSecs, position, array[0]);
        }
      }

      if (noOffsetLen == 0)
        return context.setParsedField(OFFSET_SECONDS, 0, position, position);

      return ~position;
    }

    /**
     * Parses one two-digit part of the offset into {@code array[arrayIndex]}, advancing the
     * position held in {@code array[0]}.
     *
     * @return true if the part was required and could not be parsed
     */
    private boolean parseNumber(int[] array, int arrayIndex, CharSequence parseText, boolean required)
    {
      if ((type + 3) / 2 < arrayIndex)
        return false;

      int   pos = array[0];

      if ((type % 2) == 0 && arrayIndex > 1) {
        if (pos + 1 > parseText.length() || parseText.charAt(pos) != ':')
          return required;

        ++pos;
      }

      if (pos + 2 > parseText.length())
        return required;

      char  ch1 = parseText.charAt(pos++);
      char  ch2 = parseText.charAt(pos++);

      if (ch1 < '0' || ch1 > '9' || ch2 < '0' || ch2 > '9')
        return required;

      int   value = (ch1 - 48) * 10 + (ch2 - 48);

      if (value < 0 || value > 59)
        return required;

      array[arrayIndex] = value;
      array[0] = pos;

      return false;
    }

    @Override
    public String toString()
    {
      String  converted = noOffsetText.replace("'", "''");

      return "Offset(" + PATTERNS[type] + ",'" + converted + "')";
    }
  }

  static final class ZoneIdPrinterParser implements DateTimePrinterParser
  {
    private final TemporalQuery<ZoneId> query;
    private final String                description;

    ZoneIdPrinterParser(TemporalQuery<ZoneId> query, String description)
    {
      this.query = query;
      this.description = description;
    }

    @Override
    public boolean format(DateTimePrintContext context, StringBuilder buf)
    {
      ZoneId  zone = context.getValue(query);

      if (zone == null)
        return false;

      buf.append(zone.getId());

      return true;
    }

    @Override
    public int parse(DateTimeParseContext context, CharSequence text, int position)
    {
      int   length = text.length();

      if (position >= length)
        return ~position;

      char  next = text.charAt(position);

      if (next == '+' || next == '-') {
        DateTimeParseContext  newContext = context.copy();
        int                   endPos = OffsetIdPrinterParser.INSTANCE_ID_Z.parse(newContext, text, position);

        if (endPos < 0)
          return endPos;

        context.setParsedZone(ZoneOffset.ofTotalSeconds(newContext.getParsed(OFFSET_SECONDS).intValue()));

        return endPos;
      }

      int   end = position;

      while (end < length && isZoneIdChar(text.charAt(end)))
        ++end;

      if (end == position)
        return ~position;

      ZoneId  zone;

      try {
        zone = ZoneId.of(text.subSequence(position, end).toString());
      }
      catch (DateTimeException e) {
        return ~position;
      }

      context.setParsedZone(zone);

      return end;
    }

    private static boolean isZoneIdChar(char ch)
    {
      return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9') ||
             ch == '/' || ch == '_' || ch == '+' || ch == '-' || ch == '.' || ch == ':' || ch == '~';
    }

    @Override
    public String toString()
    {
      return description;
    }
  }
}
