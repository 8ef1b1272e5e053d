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

import java.util.Objects;


public interface TemporalAccessor
{
  boolean isSupported(ChronoField field);

  default ValueRange range(ChronoField field)
  {
    Objects.requireNonNull(field, "field");

    if (isSupported(field))
      return field.range();

    throw UnsupportedTemporalTypeException.forField(field);
  }

  default int get(ChronoField field)
  {
    ValueRange  range = range(field);
    long        value = getLong(field);

    if (!range.isIntValue())
      throw new UnsupportedTemporalTypeException("Invalid field " + field + " for get() method, use getLong() instead");

    return range.checkValidIntValue(value, field);
  }

  long getLong(ChronoField field);

  default <R> R query(TemporalQuery<R> query)
  {
    Objects.requireNonNull(query, "query");

    if (query == TemporalQueries.zoneId() || query == TemporalQueries.chronology() || query == TemporalQueries.precision())
      return null;

    return query.queryFrom(this);
  }
}
