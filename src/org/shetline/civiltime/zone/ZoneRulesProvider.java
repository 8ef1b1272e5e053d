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

import java.util.NavigableMap;
import java.util.Set;


/**
 * A source of zone rules, registered with a {@link ZoneRulesRegistry}. Implementations found
 * through {@link java.util.ServiceLoader} are registered with the default registry.
 * <p>
 * Implementations must be thread-safe and must keep returning rules for every region ID they
 * have provided, even after a refresh.
 */
public abstract class ZoneRulesProvider
{
  protected ZoneRulesProvider()
  {
  }

  /**
   * The region IDs this provider can supply rules for. Called when the provider is registered and
   * after a refresh that reports a change.
   */
  protected abstract Set<String> provideZoneIds();

  /**
   * @param forCaching true if the rules are about to be held on to by a {@code ZoneId}, in which
   *                   case a provider whose rules change over time may refuse to supply them
   * @throws ZoneRulesException if the region is unknown or its rules cannot be loaded
   */
  protected abstract ZoneRules provideRules(String regionId, boolean forCaching);

  protected abstract NavigableMap<String, ZoneRules> provideVersions(String regionId);

  protected boolean provideRefresh()
  {
    return false;
  }
}
