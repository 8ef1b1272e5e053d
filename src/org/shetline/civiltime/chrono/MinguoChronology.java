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

package org.shetline.civiltime.chrono;


/**
 * The calendar of the Republic of China. Year 1 of the ROC era is ISO 1912; earlier years are
 * counted backwards in the BEFORE_ROC era.
 */
public final class MinguoChronology extends YearOffsetChronology
{
  public static final MinguoChronology INSTANCE = new MinguoChronology();

  static final int  YEARS_DIFFERENCE = 1911;

  private MinguoChronology()
  {
    super(-YEARS_DIFFERENCE, MinguoEra.BEFORE_ROC, MinguoEra.ROC);
  }

  @Override
  public String getId()
  {
    return "Minguo";
  }

  @Override
  public String getCalendarType()
  {
    return "roc";
  }

  @Override
  public MinguoEra eraOf(int eraValue)
  {
    return MinguoEra.of(eraValue);
  }
}
