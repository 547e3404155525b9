/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.cqptree;

import com.google.common.collect.ImmutableList;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cqptree.ast.IdentifierGenerator;
import net.hydromatic.cqptree.compile.CompiledPlan;
import net.hydromatic.cqptree.compile.Compiler;
import net.hydromatic.cqptree.compile.Prop;
import net.hydromatic.cqptree.compile.Tracers;
import net.hydromatic.cqptree.query.Recipe;
import net.hydromatic.cqptree.translate.AmbiguousTranslatorException;
import net.hydromatic.cqptree.translate.Translators;
import net.hydromatic.cqptree.util.CqpTreeException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Command-line tool that translates tree-style corpus queries to CQP. */
public class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  private final List<String> args;
  private final InputStream in;
  private final PrintStream out;
  private final PrintWriter err;
  private final Map<Prop, Object> propMap;
  private final Translators translators;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final List<String> argList = ImmutableList.copyOf(args);
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    final Main main =
        new Main(argList, System.in, System.out, System.err, propMap);
    final int status;
    try {
      status = main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
      return;
    }
    System.exit(status);
  }

  /** Creates a Main. */
  public Main(List<String> args, InputStream in, PrintStream out,
      PrintStream err, Map<Prop, Object> propMap) {
    this.args = ImmutableList.copyOf(args);
    this.in = in;
    this.out = out;
    this.err = new PrintWriter(new OutputStreamWriter(err,
        StandardCharsets.UTF_8), true);
    this.propMap = new LinkedHashMap<>(propMap);
    this.translators = Translators.builtIn(new IdentifierGenerator());
  }

  /** Runs the command. Returns 0 if at least one query was translated, 1
   * otherwise. */
  public int run() {
    final Options options;
    try {
      options = parseArgs();
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println(usage());
      return 1;
    }
    if (options.help) {
      out.println(usage());
      out.flush();
      return 0;
    }

    final Compiler compiler = new Compiler(propMap, Tracers.empty());
    final Writer writer;
    try {
      writer = options.output == null
          ? new BufferedWriter(new OutputStreamWriter(out, options.encoding))
          : Files.newBufferedWriter(Paths.get(options.output),
              options.encoding);
    } catch (IOException e) {
      warn("Could not write to output file " + options.output + ": " + e);
      return 1;
    }

    int translated = 0;
    try {
      for (String input : inputs(options)) {
        final @Nullable CompiledPlan plan =
            translate(compiler, input, options.translator);
        if (plan != null) {
          ++translated;
          writer.write(plan.script());
          writer.write("\n");
        }
      }
      writer.flush();
      if (options.output != null) {
        writer.close();
      }
    } catch (IOException e) {
      warn("Could not write output: " + e);
      return 1;
    }
    LOGGER.debug("Translated {} queries", translated);
    return translated > 0 ? 0 : 1;
  }

  /** Translates and compiles one query; reports errors and returns null if
   * it cannot be translated. */
  private @Nullable CompiledPlan translate(Compiler compiler, String input,
      @Nullable String translator) {
    try {
      final Recipe recipe = translators.translate(input, translator);
      return compiler.compile(recipe);
    } catch (AmbiguousTranslatorException e) {
      if (e.noTranslatorMatches()) {
        warn("Unable to determine translator: "
            + "No translator accepts the query.");
      } else {
        warn("Unable to determine translator: Query is accepted by "
            + humanReadable(e.matching));
      }
    } catch (RuntimeException e) {
      if (!(e instanceof CqpTreeException)) {
        throw e;
      }
      warn(((CqpTreeException) e).describeTo(new StringBuilder()).toString());
    }
    return null;
  }

  /** Formats a list as "a", "a and b", "a, b and c". */
  static String humanReadable(List<String> list) {
    final StringBuilder buf = new StringBuilder();
    for (int i = 0; i < list.size(); i++) {
      if (i > 0) {
        buf.append(i == list.size() - 1 ? " and " : ", ");
      }
      buf.append(list.get(i));
    }
    return buf.toString();
  }

  private List<String> inputs(Options options) throws IOException {
    final List<String> inputs = new ArrayList<>();
    if (!options.files.isEmpty()) {
      for (String file : options.files) {
        try {
          inputs.add(
              new String(Files.readAllBytes(Paths.get(file)),
                  options.encoding));
        } catch (IOException e) {
          warn("Could not read input file " + file + ": " + e);
        }
      }
    } else if (!options.queries.isEmpty()) {
      inputs.addAll(options.queries);
    } else {
      warn("No input file specified. Reading from stdin instead.");
      inputs.add(new String(in.readAllBytes(), options.encoding));
    }
    return inputs;
  }

  private void warn(String message) {
    err.println(message);
  }

  private Options parseArgs() {
    final Options options = new Options();
    for (String arg : args) {
      if (arg.equals("--help") || arg.equals("-h")) {
        options.help = true;
      } else if (arg.startsWith("--file=")) {
        options.files.add(value(arg));
      } else if (arg.startsWith("--query=")) {
        options.queries.add(value(arg));
      } else if (arg.startsWith("--output=")) {
        options.output = value(arg);
      } else if (arg.startsWith("--encoding=")) {
        options.encoding = charset(value(arg));
      } else if (arg.startsWith("--span=")) {
        Prop.SPAN.set(propMap, value(arg));
      } else if (arg.startsWith("-")) {
        throw new IllegalArgumentException("Unknown option: " + arg);
      } else if (options.translator != null) {
        throw new IllegalArgumentException("Unexpected argument: " + arg);
      } else if (!translators.names().contains(arg)) {
        throw new IllegalArgumentException("Unknown translator: " + arg);
      } else {
        options.translator = arg;
      }
    }
    if (!options.files.isEmpty() && !options.queries.isEmpty()) {
      throw new IllegalArgumentException(
          "Options --file and --query are mutually exclusive");
    }
    return options;
  }

  private static String value(String arg) {
    return arg.substring(arg.indexOf('=') + 1);
  }

  private static Charset charset(String name) {
    try {
      return Charset.forName(name);
    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
      throw new IllegalArgumentException("Unknown encoding: " + name, e);
    }
  }

  private String usage() {
    return "Usage: cqp-tree [TRANSLATOR] [--file=FILE]... [--query=STR]...\n"
        + "    [--output=FILE] [--encoding=ENC] [--span=NAME] [--help]\n"
        + "\n"
        + "Translate tree-style corpus queries to CQP queries.\n"
        + "\n"
        + "TRANSLATOR       one of " + String.join(", ", translators.names())
        + "; if omitted, a translator\n"
        + "                 is determined automatically for each query\n"
        + "--file=FILE      input file containing a query to translate\n"
        + "--query=STR      query to translate\n"
        + "--output=FILE    file to which results are written "
        + "(default stdout)\n"
        + "--encoding=ENC   encoding for reading and writing files "
        + "(default UTF-8)\n"
        + "--span=NAME      structural attribute that anchors refer to "
        + "(default s)\n"
        + "--help           show this message and exit";
  }

  /** Parsed command-line options. */
  private static class Options {
    boolean help;
    final List<String> files = new ArrayList<>();
    final List<String> queries = new ArrayList<>();
    @Nullable String output;
    Charset encoding = StandardCharsets.UTF_8;
    @Nullable String translator;
  }
}

// End Main.java
