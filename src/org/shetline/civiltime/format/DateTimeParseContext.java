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

import org.shetline.civiltime.ZoneId;
import org.shetline.civiltime.temporal.ChronoField;


/**
 * Mutable state of a single parse: the settings in force and a stack of parsed values, one level
 * for each open optional section.
 */
final class DateTimeParseContext
{
  private boolean             caseSensitive = true;
  private boolean             strict = true;
  private final List<Parsed>  parsed = new ArrayList<>();

  DateTimeParseContext()
  {
    parsed.add(new Parsed());
  }

  DateTimeParseContext copy()
  {
    DateTimeParseContext  newContext = new DateTimeParseContext();

    newContext.caseSensitive = caseSensitive;
    newContext.strict = strict;

    return newContext;
  }

  boolean isCaseSensitive()
  {
    return caseSensitive;
  }

  void setCaseSensitive(boolean caseSensitive)
  {
    this.caseSensitive = caseSensitive;
  }

  boolean isStrict()
  {
    return strict;
  }

  void setStrict(boolean strict)
  {
    this.strict = strict;
  }

  boolean subSequenceEquals(CharSequence cs1, int offset1, CharSequence cs2, int offset2, int length)
  {
    if (offset1 + length > cs1.length() || offset2 + length > cs2.length())
      return false;

    for (int i = 0; i < length; ++i) {
      if (!charEquals(cs1.charAt(offset1 + i), cs2.charAt(offset2 + i)))
        return false;
    }

    return true;
  }

  boolean charEquals(char ch1, char ch2)
  {
    if (caseSensitive)
      return ch1 == ch2;

    return ch1 == ch2 || Character.toUpperCase(ch1) == Character.toUpperCase(ch2) ||
           Character.toLowerCase(ch1) == Character.toLowerCase(ch2);
  }

  void startOptional()
  {
    parsed.add(currentParsed().copy());
  }

  void endOptional(boolean successful)
  {
    if (successful)
      parsed.remove(parsed.size() - 2);
    else
      parsed.remove(parsed.size() - 1);
  }

  private Parsed currentParsed()
  {
    return parsed.get(parsed.size() - 1);
  }

  Long getParsed(ChronoField field)
  {
    return currentParsed().fieldValues.get(field);
  }

  int setParsedField(ChronoField field, long value, int errorPos, int successPos)
  {
    Long  old = currentParsed().fieldValues.put(field, value);

    return (old != null && old != value) ? ~errorPos : successPos;
  }

  void setParsedZone(ZoneId zone)
  {
    currentParsed().zone = zone;
  }

  Parsed toUnresolved()
  {
    return currentParsed();
  }

  Parsed toResolved()
  {
    Parsed  result = currentParsed();

    result.resolve();

    return result;
  }

  @Override
  public String toString()
  {
    return currentParsed().toString();
  }
}
