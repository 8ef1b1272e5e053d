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


/**
 * How the sign of a numeric field is printed and which signs are accepted when parsing.
 */
public enum SignStyle
{
  NORMAL,
  ALWAYS,
  NEVER,
  NOT_NEGATIVE,
  /** A plus sign when the value has more digits than the minimum width, as for years past 9999. */
  EXCEEDS_PAD;

  boolean parse(boolean positive, boolean strict, boolean fixedWidth)
  {
    switch (this) {
      case NORMAL:
        return !positive || !strict;
      case ALWAYS:
      case EXCEEDS_PAD:
        return true;
      default:
        return !strict && !fixedWidth;
    }
  }
}
