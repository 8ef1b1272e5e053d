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


/**
 * Base exception for date-time problems. Each instance carries the {@link DateTimeErrorKind} that
 * describes the failure; the kind defaults to {@link DateTimeErrorKind#RANGE}.
 */
public class DateTimeException extends RuntimeException
{
  private static final long serialVersionUID = 1L;

  private final DateTimeErrorKind kind;

  public DateTimeException(String message)
  {
    this(DateTimeErrorKind.RANGE, message, null);
  }

  public DateTimeException(String message, Throwable cause)
  {
    this(DateTimeErrorKind.RANGE, message, cause);
  }

  public DateTimeException(DateTimeErrorKind kind, String message)
  {
    this(kind, message, null);
  }

  public DateTimeException(DateTimeErrorKind kind, String message, Throwable cause)
  {
    super(message, cause);
    this.kind = kind;
  }

  public DateTimeErrorKind getKind()
  {
    return kind;
  }
}
