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

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.io.StreamCorruptedException;

import org.shetline.civiltime.DayOfWeek;
import org.shetline.civiltime.Instant;
import org.shetline.civiltime.LocalTime;
import org.shetline.civiltime.Month;
import org.shetline.civiltime.ZoneOffset;


/**
 * Compact binary form of {@link ZoneRules}, used by compiled rule files and the value codec.
 * <p>
 * Offsets that are whole quarter hours take one byte. Epoch seconds on a quarter hour between
 * 1825 and 2300 take three bytes.
 */
public final class ZoneRulesCodec
{
  private static final byte FIXED_RULES = 1;
  private static final byte STANDARD_RULES = 2;

  private static final long EPOCH_BASE = 4575744000L;
  private static final long EPOCH_LIMIT = 10413792000L;

  private ZoneRulesCodec() {}

  public static void write(ZoneRules rules, DataOutput out) throws IOException
  {
    if (rules instanceof FixedZoneRules) {
      out.writeByte(FIXED_RULES);
      writeOffset(rules.getOffset(Instant.EPOCH), out);
    }
    else if (rules instanceof StandardZoneRules) {
      StandardZoneRules   szr = (StandardZoneRules) rules;

      out.writeByte(STANDARD_RULES);
      out.writeInt(szr.getStandardTransitionArray().length);

      for (long trans : szr.getStandardTransitionArray())
        writeEpochSec(trans, out);

      for (ZoneOffset offset : szr.getStandardOffsetArray())
        writeOffset(offset, out);

      out.writeInt(szr.getSavingsInstantTransitionArray().length);

      for (long trans : szr.getSavingsInstantTransitionArray())
        writeEpochSec(trans, out);

      for (ZoneOffset offset : szr.getWallOffsetArray())
        writeOffset(offset, out);

      out.writeByte(szr.getLastRuleArray().length);

      for (ZoneOffsetTransitionRule rule : szr.getLastRuleArray())
        writeRule(rule, out);
    }
    else
      throw new IllegalArgumentException("Unknown zone rules type: " + rules.getClass().getName());
  }

  public static ZoneRules read(DataInput in) throws IOException
  {
    byte  type = in.readByte();

    if (type == FIXED_RULES)
      return ZoneRules.of(readOffset(in));
    else if (type != STANDARD_RULES)
      throw new StreamCorruptedException("Unknown zone rules type: " + type);

    int     stdSize = in.readInt();
    long[]  stdTrans = new long[stdSize];

    for (int i = 0; i < stdSize; ++i)
      stdTrans[i] = readEpochSec(in);

    ZoneOffset[]  stdOffsets = new ZoneOffset[stdSize + 1];

    for (int i = 0; i < stdOffsets.length; ++i)
      stdOffsets[i] = readOffset(in);

    int     savSize = in.readInt();
    long[]  savTrans = new long[savSize];

    for (int i = 0; i < savSize; ++i)
      savTrans[i] = readEpochSec(in);

    ZoneOffset[]  savOffsets = new ZoneOffset[savSize + 1];

    for (int i = 0; i < savOffsets.length; ++i)
      savOffsets[i] = readOffset(in);

    int   ruleSize = in.readByte();

    if (ruleSize < 0 || ruleSize > StandardZoneRules.MAX_LAST_RULES)
      throw new StreamCorruptedException("Invalid transition rule count: " + ruleSize);

    ZoneOffsetTransitionRule[]  rules = new ZoneOffsetTransitionRule[ruleSize];

    for (int i = 0; i < ruleSize; ++i)
      rules[i] = readRule(in);

    return new StandardZoneRules(stdTrans, stdOffsets, savTrans, savOffsets, rules);
  }

  public static void writeRule(ZoneOffsetTransitionRule rule, DataOutput out) throws IOException
  {
    out.writeByte(rule.getMonth().getValue());
    out.writeByte(rule.getDayOfMonthIndicator());
    out.writeByte(rule.getDayOfWeek() == null ? 0 : rule.getDayOfWeek().getValue());
    out.writeInt(rule.isMidnightEndOfDay() ? 86400 : rule.getLocalTime().toSecondOfDay());
    out.writeByte(rule.getTimeDefinition().ordinal());
    writeOffset(rule.getStandardOffset(), out);
    writeOffset(rule.getOffsetBefore(), out);
    writeOffset(rule.getOffsetAfter(), out);
  }

  public static ZoneOffsetTransitionRule readRule(DataInput in) throws IOException
  {
    Month       month = Month.of(in.readByte());
    int         dom = in.readByte();
    int         dowByte = in.readByte();
    DayOfWeek   dow = (dowByte == 0 ? null : DayOfWeek.of(dowByte));
    int         secsOfDay = in.readInt();
    boolean     endOfDay = (secsOfDay == 86400);
    LocalTime   time = (endOfDay ? LocalTime.MIDNIGHT : LocalTime.ofSecondOfDay(secsOfDay));
    int         defOrdinal = in.readByte();

    if (defOrdinal < 0 || defOrdinal >= ZoneOffsetTransitionRule.TimeDefinition.values().length)
      throw new StreamCorruptedException("Invalid time definition: " + defOrdinal);

    ZoneOffsetTransitionRule.TimeDefinition   timeDef = ZoneOffsetTransitionRule.TimeDefinition.values()[defOrdinal];
    ZoneOffset  std = readOffset(in);
    ZoneOffset  before = readOffset(in);
    ZoneOffset  after = readOffset(in);

    return ZoneOffsetTransitionRule.of(month, dom, dow, time, endOfDay, timeDef, std, before, after);
  }

  public static void writeOffset(ZoneOffset offset, DataOutput out) throws IOException
  {
    int   offsetSecs = offset.getTotalSeconds();
    int   offsetByte = (offsetSecs % 900 == 0 ? offsetSecs / 900 : 127);

    out.writeByte(offsetByte);

    if (offsetByte == 127)
      out.writeInt(offsetSecs);
  }

  public static ZoneOffset readOffset(DataInput in) throws IOException
  {
    int   offsetByte = in.readByte();

    return (offsetByte == 127 ? ZoneOffset.ofTotalSeconds(in.readInt()) : ZoneOffset.ofTotalSeconds(offsetByte * 900));
  }

  static void writeEpochSec(long epochSec, DataOutput out) throws IOException
  {
    if (epochSec >= -EPOCH_BASE && epochSec < EPOCH_LIMIT && epochSec % 900 == 0) {
      int   store = (int) ((epochSec + EPOCH_BASE) / 900);

      out.writeByte((store >>> 16) & 255);
      out.writeByte((store >>> 8) & 255);
      out.writeByte(store & 255);
    }
    else {
      out.writeByte(255);
      out.writeLong(epochSec);
    }
  }

  static long readEpochSec(DataInput in) throws IOException
  {
    int   hiByte = in.readByte() & 255;

    if (hiByte == 255)
      return in.readLong();

    int   midByte = in.readByte() & 255;
    int   loByte = in.readByte() & 255;
    long  tot = (hiByte << 16) + (midByte << 8) + loByte;

    return tot * 900 - EPOCH_BASE;
  }
}
