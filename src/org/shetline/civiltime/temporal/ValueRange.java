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

import org.shetline.civiltime.DateTimeErrorKind;
import org.shetline.civiltime.DateTimeException;


/**
 * The range of valid values for a field. The maximum may vary, as day-of-month does between 28
 * and 31, in which case the smallest and largest maximum are both tracked.
 */
public final class ValueRange
{
  private final long  minSmallest;
  private final long  minLargest;
  private final long  maxSmallest;
  private final long  maxLargest;

  private ValueRange(long minSmallest, long minLargest, long maxSmallest, long maxLargest)
  {
    this.minSmallest = minSmallest;
    this.minLargest = minLargest;
    this.maxSmallest = maxSmallest;
    this.maxLargest = maxLargest;
  }

  public static ValueRange of(long min, long max)
  {
    if (min > max)
      throw new IllegalArgumentException("Minimum value must be less than maximum value");

    return new ValueRange(min, min, max, max);
  }

  public static ValueRange of(long min, long maxSmallest, long maxLargest)
  {
    return of(min, min, maxSmallest, maxLargest);
  }

  public static ValueRange of(long minSmallest, long minLargest, long maxSmallest, long maxLargest)
  {
    if (minSmallest > minLargest)
      throw new IllegalArgumentException("Smallest minimum value must be less than largest minimum value");
    else if (maxSmallest > maxLargest)
      throw new IllegalArgumentException("Smallest maximum value must be less than largest maximum value");
    else if (minLargest > maxLargest)
      throw new IllegalArgumentException("Minimum value must be less than maximum value");

    return new ValueRange(minSmallest, minLargest, maxSmallest, maxLargest);
  }

  public boolean isFixed()
  {
    return minSmallest == minLargest && maxSmallest == maxLargest;
  }

  public long getMinimum()
  {
    return minSmallest;
  }

  public long getLargestMinimum()
  {
    return minLargest;
  }

  public long getSmallestMaximum()
  {
    return maxSmallest;
  }

  public long getMaximum()
  {
    return maxLargest;
  }

  public boolean isIntValue()
  {
    return getMinimum() >= Integer.MIN_VALUE && getMaximum() <= Integer.MAX_VALUE;
  }

  public boolean isValidValue(long value)
  {
    return value >= getMinimum() && value <= getMaximum();
  }

  public boolean isValidIntValue(long value)
  {
    return isIntValue() && isValidValue(value);
  }

  public long checkValidValue(long value, ChronoField field)
  {
    if (!isValidValue(value))
      throw new DateTimeException(DateTimeErrorKind.RANGE, genInvalidFieldMessage(field, value));

    return value;
  }

  public int checkValidIntValue(long value, ChronoField field)
  {
    if (!isValidIntValue(value))
      throw new DateTimeException(DateTimeErrorKind.RANGE, genInvalidFieldMessage(field, value));

    return (int) value;
  }

  private String genInvalidFieldMessage(ChronoField field, long value)
  {
    if (field != null)
      return "Invalid value for " + field + " (valid values " + this + "): " + value;
    else
      return "Invalid value (valid values " + this + "): " + value;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (obj == this)
      return true;
    else if (!(obj instanceof ValueRange))
      return false;

    ValueRange  other = (ValueRange) obj;

    return minSmallest == other.minSmallest && minLargest == other.minLargest &&
           maxSmallest == other.maxSmallest && maxLargest == other.maxLargest;
  }

  @Override
  public int hashCode()
  {
    long  hash = minSmallest + (minLargest << 16) + (minLargest >> 48) +
                 (maxSmallest << 32) + (maxSmallest >> 32) + (maxLargest << 48) + (maxLargest >> 16);

    return (int) (hash ^ (hash >>> 32));
  }

  @Override
  public String toString()
  {
    StringBuilder   sb = new StringBuilder();

    sb.append(minSmallest);

    if (minSmallest != minLargest)
      sb.append('/').append(minLargest);

    sb.append(" - ").append(maxSmallest);

    if (maxSmallest != maxLargest)
      sb.append('/').append(maxLargest);

    return sb.toString();
  }
}
