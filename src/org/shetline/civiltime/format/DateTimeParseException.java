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

import org.shetline.civiltime.DateTimeErrorKind;
import org.shetline.civiltime.DateTimeException;


/**
 * Text that could not be parsed as a date, time, offset, zone, or duration. The error index is
 * the position in the text where parsing stopped.
 */
public class DateTimeParseException extends DateTimeException
{
  private static final long serialVersionUID = 1L;

  private final String  parsedString;
  private final int     errorIndex;

  public DateTimeParseException(String message, CharSequence parsedData, int errorIndex)
  {
    this(message, parsedData, errorIndex, null);
  }

  public DateTimeParseException(String message, CharSequence parsedData, int errorIndex, Throwable cause)
  {
    super(DateTimeErrorKind.PARSE, message, cause);
    this.parsedString = parsedData.toString();
    this.errorIndex = errorIndex;
  }

  public String getParsedString()
  {
    return parsedString;
  }

  public int getErrorIndex()
  {
    return errorIndex;
  }
}
