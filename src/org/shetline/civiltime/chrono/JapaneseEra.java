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

import java.util.Objects;

import org.shetline.civiltime.DateTimeException;
import org.shetline.civiltime.LocalDate;


/**
 * An era of the Japanese imperial calendar. Era values run from -1 for Meiji upwards, so that
 * Showa is 1 as in the JIS calendar.
 */
public final class JapaneseEra implements Era
{
  public static final JapaneseEra MEIJI = new JapaneseEra(-1, LocalDate.of(1868, 9, 8), "MEIJI");
  public static final JapaneseEra TAISHO = new JapaneseEra(0, LocalDate.of(1912, 7, 30), "TAISHO");
  public static final JapaneseEra SHOWA = new JapaneseEra(1, LocalDate.of(1926, 12, 25), "SHOWA");
  public static final JapaneseEra HEISEI = new JapaneseEra(2, LocalDate.of(1989, 1, 8), "HEISEI");
  public static final JapaneseEra REIWA = new JapaneseEra(3, LocalDate.of(2019, 5, 1), "REIWA");

  private static final JapaneseEra[]  KNOWN_ERAS = { MEIJI, TAISHO, SHOWA, HEISEI, REIWA };

  private final int       eraValue;
  private final LocalDate since;
  private final String    name;

  private JapaneseEra(int eraValue, LocalDate since, String name)
  {
    this.eraValue = eraValue;
    this.since = since;
    this.name = name;
  }

  public static JapaneseEra of(int japaneseEra)
  {
    int   index = japaneseEra + 1;

    if (index < 0 || index >= KNOWN_ERAS.length)
      throw new DateTimeException("japaneseEra is invalid");

    return KNOWN_ERAS[index];
  }

  public static JapaneseEra valueOf(String japaneseEra)
  {
    Objects.requireNonNull(japaneseEra, "japaneseEra");

    for (JapaneseEra era : KNOWN_ERAS) {
      if (era.name.equals(japaneseEra))
        return era;
    }

    throw new IllegalArgumentException("Era not found: " + japaneseEra);
  }

  public static JapaneseEra[] values()
  {
    return KNOWN_ERAS.clone();
  }

  static JapaneseEra from(LocalDate date)
  {
    if (date.isBefore(MEIJI.since))
      throw new DateTimeException("Date too early: " + date);

    for (int i = KNOWN_ERAS.length - 1; i >= 0; --i) {
      if (!date.isBefore(KNOWN_ERAS[i].since))
        return KNOWN_ERAS[i];
    }

    return MEIJI;
  }

  LocalDate startDate()
  {
    return since;
  }

  LocalDate endDate()
  {
    int   index = eraValue + 2;

    return index < KNOWN_ERAS.length ? KNOWN_ERAS[index].since : null;
  }

  @Override
  public int getValue()
  {
    return eraValue;
  }

  @Override
  public String name()
  {
    return name;
  }

  @Override
  public String toString()
  {
    return name;
  }
}
