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

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.shetline.civiltime.zone.ZoneRules;
import org.shetline.civiltime.zone.ZoneRulesException;


/**
 * Command-line tool that compiles tz database sources into a TZDB.dat file, prints transition
 * tables, and checks compiled zones against the JVM's own time-zone data.
 */
public class TzdbCompiler
{
  private static final int DEFAULT_MIN_YEAR = 1900;
  private static final int DEFAULT_MAX_YEAR = 2050;

  private static final String DEFAULT_OUTPUT_FILE = "TZDB.dat";

  public static void main(String[] args)
  {
    int   status = run(args, System.out, System.err);

    if (status != 0)
      System.exit(status);
  }

  public static int run(String[] args, PrintStream out, PrintStream err)
  {
    List<String>  archives = new ArrayList<>();
    List<String>  directories = new ArrayList<>();
    String        singleZone = null;
    String        outFileName = null;
    int           minYear = DEFAULT_MIN_YEAR;
    int           maxYear = DEFAULT_MAX_YEAR;
    boolean       validateWithJava = false;
    boolean       roundToMinutes = false;
    boolean       showWarnings = true;
    boolean       showTable = false;
    final String  simpleFlags = "hjmqtv";

    args = args.clone();

    for (int i = 0; i < args.length; ++i) {
      String    arg = args[i];
      boolean   hasMore = (i < args.length - 1);

      if (arg.startsWith("-") && !arg.startsWith("--") && arg.length() > 2) {
        String  flag = arg.substring(1, 2);

        if (simpleFlags.contains(flag)) {
          args[i--] = "-" + arg.substring(2);
          arg = "-" + flag;
        }
      }

      if ("-a".equals(arg) && hasMore)
        archives.add(args[++i]);
      else if ("-d".equals(arg) && hasMore)
        directories.add(args[++i]);
      else if ("-o".equals(arg) && hasMore)
        outFileName = args[++i];
      else if ("-s".equals(arg) && hasMore)
        singleZone = args[++i];
      else if ("-y".equals(arg) && hasMore) {
        String[]  parts = args[++i].split(",", -1);

        try {
          if (parts.length == 1)
            minYear = maxYear = Integer.parseInt(parts[0].trim());
          else if (parts.length == 2) {
            minYear = (parts[0].trim().isEmpty() ? DEFAULT_MIN_YEAR : Integer.parseInt(parts[0].trim()));
            maxYear = (parts[1].trim().isEmpty() ? DEFAULT_MAX_YEAR : Integer.parseInt(parts[1].trim()));
          }
        }
        catch (NumberFormatException e) {
          err.println("*** Invalid year range: " + args[i]);
          return 1;
        }
      }
      else if ("-h".equals(arg) || "--help".equals(arg)) {
        out.println("Usage: java -jar civil-time.jar [options]");
        out.println("options:");
        out.println("        -a             <path to tzdata*.tar.gz> Archive of tz database sources. May be repeated");
        out.println("                       to compile more than one version.");
        out.println("        -d             <directory> Directory of tz database sources. May be repeated.");
        out.println("                       With neither -a nor -d, the bundled abridged sources are compiled.");
        out.println("        -h, --help     Display this help.");
        out.println("        -j             Check compiled zones against the JVM's own java.time zone rules.");
        out.println("        -m             Round all zone offsets to whole minutes.");
        out.println("        -o             <file> Output file. Default: " + DEFAULT_OUTPUT_FILE + ", or stdout with -t.");
        out.println("        -q             Display fewer warning messages.");
        out.println("        -s             <zone_id> Zone ID for a single time zone to be compiled.");
        out.println("        -t             Write human-readable transition tables instead of a TZDB.dat file.");
        out.println("        -v, --version  Display the version of this tool.");
        out.println("        -y             <min_year,max_year> Year range for transition tables and checks.");
        out.println("                       Default: " + DEFAULT_MIN_YEAR + "," + DEFAULT_MAX_YEAR);
        return 0;
      }
      else if ("-j".equals(arg))
        validateWithJava = true;
      else if ("-m".equals(arg))
        roundToMinutes = true;
      else if ("-q".equals(arg))
        showWarnings = false;
      else if ("-t".equals(arg))
        showTable = true;
      else if ("-v".equals(arg) || "--version".equals(arg)) {
        out.println("Version 1.0.0");
        return 0;
      }
      else {
        err.println("*** Unrecognized option: " + arg);
        return 1;
      }
    }

    List<IanaZonesAndRulesParser>   parsers = new ArrayList<>();

    try {
      for (String archive : archives) {
        IanaZonesAndRulesParser   parser = new IanaZonesAndRulesParser(roundToMinutes);

        out.println("Parsing " + archive);

        try (InputStream in = Files.newInputStream(Paths.get(archive))) {
          parser.parseArchive(in);
        }

        parsers.add(parser);
      }

      for (String directory : directories) {
        IanaZonesAndRulesParser   parser = new IanaZonesAndRulesParser(roundToMinutes);

        out.println("Parsing " + directory);
        parser.parseDirectory(Paths.get(directory));
        parsers.add(parser);
      }

      if (parsers.isEmpty()) {
        IanaZonesAndRulesParser   parser = new IanaZonesAndRulesParser(roundToMinutes);

        out.println("Parsing bundled tz database sources");
        parser.parseResources(TzdbZoneRulesProvider.BUNDLED_SOURCES);
        parsers.add(parser);
      }
    }
    catch (IOException e) {
      err.println("*** " + e.getMessage());
      return 1;
    }
    catch (IanaParserException e) {
      err.print("*** " + e.getMessage());

      if (e.getSource() != null)
        err.print(" (" + e.getSource() + ")");

      if (e.getLineNo() != 0)
        err.print(" (line " + e.getLineNo() + ")");

      err.println();
      return 1;
    }

    TreeMap<String, Map<String, ZoneRules>>   versions = new TreeMap<>();

    out.println("Compiling time zones");

    try {
      for (IanaZonesAndRulesParser parser : parsers) {
        String                  version = (parser.getVersion() != null ? parser.getVersion() : "unknown");
        TzCompiler              compiler = new TzCompiler(parser);
        Map<String, ZoneRules>  compiled;

        if (singleZone != null) {
          compiled = new LinkedHashMap<>();
          compiled.put(singleZone, compiler.compile(singleZone));
        }
        else
          compiled = compiler.compileAll();

        if (versions.put(version, compiled) != null && showWarnings)
          err.println("* Warning: version " + version + " given more than once, keeping the last");

        out.println("tz database version " + version + ": " + compiled.size() + " time zone IDs");
      }
    }
    catch (ZoneRulesException e) {
      err.println("*** " + e.getMessage());
      return 1;
    }

    String                  latest = versions.lastKey();
    Map<String, ZoneRules>  latestRules = versions.get(latest);
    int                     status = 0;

    if (validateWithJava) {
      int   mismatches = 0;
      int   unknown = 0;

      out.println("Checking version " + latest + " against java.time, years " + minYear + "-" + maxYear);

      for (Map.Entry<String, ZoneRules> entry : latestRules.entrySet()) {
        TzTransitionTable   fromJava = TzTransitionTable.fromJavaTime(entry.getKey(), minYear, maxYear);

        if (fromJava == null) {
          ++unknown;

          if (showWarnings)
            out.println("* Warning: " + entry.getKey() + " is not known to java.time");

          continue;
        }

        TzTransitionTable   compiled = TzTransitionTable.fromRules(entry.getKey(), entry.getValue(), minYear, maxYear);

        if (!compiled.closelyMatches(fromJava, roundToMinutes)) {
          ++mismatches;
          err.println("*** Compiled " + entry.getKey() + " does not match java.time version");
        }
      }

      out.println(latestRules.size() + " time zones checked, " + mismatches + " mismatched" +
                  (unknown > 0 ? ", " + unknown + " unknown to java.time" : ""));

      if (mismatches > 0)
        status = 2;
    }

    try {
      if (showTable) {
        OutputStream  tableOut = (outFileName == null ? out : Files.newOutputStream(Paths.get(outFileName)));
        PrintWriter   writer = new PrintWriter(new OutputStreamWriter(tableOut, StandardCharsets.UTF_8));

        for (Map.Entry<String, ZoneRules> entry : latestRules.entrySet()) {
          TzTransitionTable.fromRules(entry.getKey(), entry.getValue(), minYear, maxYear).dump(writer);
          writer.println();
        }

        writer.flush();

        if (tableOut != out)
          tableOut.close();
      }
      else {
        String  fileName = (outFileName != null ? outFileName : DEFAULT_OUTPUT_FILE);

        out.println("Writing " + fileName);

        try (OutputStream datOut = new BufferedOutputStream(Files.newOutputStream(Paths.get(fileName)))) {
          TzdbDatFile.write(versions, datOut);
        }
      }
    }
    catch (IOException e) {
      err.println("*** " + e.getMessage());
      return 1;
    }

    return status;
  }
}
