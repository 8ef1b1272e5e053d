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

package org.shetline.civiltime.tzdb;

public class IanaParserException extends Exception
{
  private final int     lineNo;
  private final String  source;

  public IanaParserException(int lineNo, String source, String message)
  {
    super(message);
    this.lineNo = lineNo;
    this.source = source;
  }

  public IanaParserException(int lineNo, String source, String message, Throwable cause)
  {
    super(message, cause);
    this.lineNo = lineNo;
    this.source = source;
  }

  public int getLineNo()
  {
    return lineNo;
  }

  public String getSource()
  {
    return source;
  }

  @Override
  public String toString()
  {
    String  s = getClass().getSimpleName() + ": " + getMessage();

    if (source != null)
      s += " (" + source + ")";

    if (lineNo != 0)
      s += " (line " + lineNo + ")";

    return s;
  }
}
