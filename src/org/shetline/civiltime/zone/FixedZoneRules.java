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

package org.shetline.civiltime.zone;

import java.util.Collections;
import java.util.List;

import org.shetline.civiltime.Instant;
import org.shetline.civiltime.LocalDateTime;
import org.shetline.civiltime.ZoneOffset;


final class FixedZoneRules extends ZoneRules
{
  private final ZoneOffset  offset;

  FixedZoneRules(ZoneOffset offset)
  {
    this.offset = offset;
  }

  @Override
  public boolean isFixedOffset()
  {
    return true;
  }

  @Override
  public ZoneOffset getOffset(Instant instant)
  {
    return offset;
  }

  @Override
  public ZoneOffset getOffset(LocalDateTime localDateTime)
  {
    return offset;
  }

  @Override
  public List<ZoneOffset> getValidOffsets(LocalDateTime localDateTime)
  {
    return Collections.singletonList(offset);
  }

  @Override
  public ZoneOffsetTransition getTransition(LocalDateTime localDateTime)
  {
    return null;
  }

  @Override
  public boolean isValidOffset(LocalDateTime localDateTime, ZoneOffset offset)
  {
    return this.offset.equals(offset);
  }

  @Override
  public ZoneOffset getStandardOffset(Instant instant)
  {
    return offset;
  }

  @Override
  public boolean isDaylightSavings(Instant instant)
  {
    return false;
  }

  @Override
  public ZoneOffsetTransition nextTransition(Instant instant)
  {
    return null;
  }

  @Override
  public ZoneOffsetTransition previousTransition(Instant instant)
  {
    return null;
  }

  @Override
  public List<ZoneOffsetTransition> getTransitions()
  {
    return Collections.emptyList();
  }

  @Override
  public List<ZoneOffsetTransitionRule> getTransitionRules()
  {
    return Collections.emptyList();
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    else if (obj instanceof FixedZoneRules)
      return offset.equals(((FixedZoneRules) obj).offset);

    return false;
  }

  @Override
  public int hashCode()
  {
    return offset.hashCode();
  }

  @Override
  public String toString()
  {
    return "FixedRules:" + offset;
  }
}
