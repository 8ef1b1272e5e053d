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


/**
 * A date, time, or offset value that can be adjusted. Implementations are immutable, so every
 * adjustment returns a new value.
 */
public interface Temporal extends TemporalAccessor
{
  boolean isSupported(ChronoUnit unit);

  default Temporal with(TemporalAdjuster adjuster)
  {
    return adjuster.adjustInto(this);
  }

  Temporal with(ChronoField field, long newValue);

  Temporal plus(long amountToAdd, ChronoUnit unit);

  default Temporal minus(long amountToSubtract, ChronoUnit unit)
  {
    if (amountToSubtract == Long.MIN_VALUE)
      return plus(Long.MAX_VALUE, unit).plus(1, unit);

    return plus(-amountToSubtract, unit);
  }

  /**
   * Complete units between this value and {@code endExclusive}, which is first converted to the
   * type of this value.
   */
  long until(Temporal endExclusive, ChronoUnit unit);
}
