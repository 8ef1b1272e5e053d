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

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;


public class TzdbCompilerTest
{
  private ByteArrayOutputStream outBytes;
  private ByteArrayOutputStream errBytes;

  @BeforeEach
  public void setUp()
  {
    outBytes = new ByteArrayOutputStream();
    errBytes = new ByteArrayOutputStream();
  }

  private int run(String... args)
  {
    PrintStream   out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
    PrintStream   err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);

    return TzdbCompiler.run(args, out, err);
  }

  private String out()
  {
    return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
  }

  private String err()
  {
    return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test
  public void versionAndHelp()
  {
    assertEquals(0, run("-v"));
    assertTrue(out().contains("Version 1.0.0"));
    assertEquals(0, run("--help"));
    assertTrue(out().contains("Usage:"));
  }

  @Test
  public void badOptions()
  {
    assertEquals(1, run("-x"));
    assertTrue(err().contains("Unrecognized option: -x"));
    assertEquals(1, run("-y", "1990,soon"));
    assertTrue(err().contains("Invalid year range"));
  }

  @Test
  public void compileBundled(@TempDir Path dir) throws Exception
  {
    Path  datPath = dir.resolve("zones.dat");

    assertEquals(0, run("-q", "-o", datPath.toString()));
    assertTrue(out().contains("tz database version 2024a"));

    TzdbDatFile   datFile;

    try (InputStream in = Files.newInputStream(datPath)) {
      datFile = TzdbDatFile.read(in);
    }

    assertEquals(1, datFile.getVersionIds().size());
    assertTrue(datFile.getRegionIds("2024a").contains("Europe/London"));
    assertTrue(datFile.getRegionIds("2024a").contains("GB"));
    assertNotNull(datFile.getRules("2024a", "Australia/Sydney"));
  }

  @Test
  public void transitionTable()
  {
    assertEquals(0, run("-ts", "Europe/London", "-y", "2024"));

    String  text = out();

    assertTrue(text.contains("tz database version 2024a: 1 time zone IDs"));
    assertTrue(text.contains("-------- Europe/London --------"));
    assertTrue(text.contains("2024-03-31 00:59:59 +0000 +0000 --> 2024-03-31 02:00:00 +0100 +0100*"));
    assertFalse(text.contains("Writing"));
  }

  @Test
  public void checkAgainstJavaTime(@TempDir Path dir)
  {
    assertEquals(0, run("-j", "-s", "America/New_York", "-y", "1997,2030", "-o", dir.resolve("ny.dat").toString()));
    assertTrue(out().contains("1 time zones checked, 0 mismatched"));
  }

  @Test
  public void sourceDirectory(@TempDir Path dir) throws Exception
  {
    Files.write(dir.resolve("europe"), "Zone Europe/Test 1:00 Nope X\n".getBytes(StandardCharsets.UTF_8));

    assertEquals(1, run("-d", dir.toString(), "-o", dir.resolve("out.dat").toString()));
    assertTrue(err().contains("unknown rules Nope"));
    assertFalse(Files.exists(dir.resolve("out.dat")));
  }

  @Test
  public void unknownSingleZone(@TempDir Path dir)
  {
    assertEquals(1, run("-s", "Mars/Olympus_Mons", "-o", dir.resolve("out.dat").toString()));
    assertTrue(err().contains("Unknown time-zone ID: Mars/Olympus_Mons"));
  }
}
