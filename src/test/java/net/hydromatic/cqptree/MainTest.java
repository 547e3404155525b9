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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link Main}. */
public class MainTest {
  @TempDir Path tempDir;

  /** Result of running the command. */
  private static class Run {
    final int status;
    final String out;
    final String err;

    Run(int status, String out, String err) {
      this.status = status;
      this.out = out;
      this.err = err;
    }
  }

  private static Run runWithInput(String stdin, String... args) {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    final ByteArrayOutputStream err = new ByteArrayOutputStream();
    final Main main =
        new Main(ImmutableList.copyOf(args),
            new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(out), new PrintStream(err), ImmutableMap.of());
    final int status = main.run();
    return new Run(status, out.toString(StandardCharsets.UTF_8),
        err.toString(StandardCharsets.UTF_8));
  }

  private static Run run(String... args) {
    return runWithInput("", args);
  }

  @Test void testQuery() {
    final Run run = run("grew", "--query=pattern { N [upos=NOUN] }");
    assertThat(run.status, is(0));
    assertThat(run.out, is("[upos = \"NOUN\"]\n"));
    assertThat(run.err, is(""));
  }

  @Test void testSeveralQueries() {
    final Run run =
        run("--query=(pos NOUN)", "--query=pattern { X < Y }",
            "--query=%%%");
    assertThat(run.status, is(0));
    assertThat(run.out, is("[pos = \"NOUN\"]\n[] []\n"));
    assertThat(run.err,
        is("Unable to determine translator: "
            + "No translator accepts the query.\n"));
  }

  @Test void testPlan() {
    final Run run =
        run("grew",
            "--query=pattern { N [upos=NOUN] } without { N [Number=Plur] }");
    assertThat(run.status, is(0));
    assertThat(run.out,
        is("A = [upos = \"NOUN\"];\n"
            + "B = [upos = \"NOUN\" & Number = \"Plur\"];\n"
            + "C = diff A B;\n"));
  }

  @Test void testSpan() {
    final Run run =
        run("--span=p", "conllu",
            "--query=1\tthe\t_\t_\t_\t_\t2\t_\t_\t_\n"
                + "2\tdog\t_\t_\t_\t_\t0\t_\t_\tanchored=Yes|subsequent=Yes");
    assertThat(run.status, is(0));
    assertThat(run.out,
        is("a:[word = \"the\"] [word = \"dog\" & a.dephead = ref] </p>\n"));
  }

  @Test void testErrors() {
    final Run parse = run("grew", "--query=match { }");
    assertThat(parse.status, is(1));
    assertThat(parse.out, is(""));
    assertThat(parse.err,
        is("Query could not be parsed:\n"
            + "1:1: Expected 'pattern', found 'match'\n"));

    final Run notSupported = run("grew", "--query=pattern { N [lemma=/x/] }");
    assertThat(notSupported.status, is(1));
    assertThat(notSupported.err,
        is("Query cannot be translated: "
            + "PCRE expressions are not yet supported.\n"));

    final Run selfEdge =
        run("grew", "--query=pattern { N -> N }",
            "--query=pattern { N [upos=NOUN] }");
    assertThat(selfEdge.status, is(0));
    assertThat(selfEdge.out, is("[upos = \"NOUN\"]\n"));
    assertThat(selfEdge.err,
        is("Query cannot be translated: "
            + "Node N cannot be a dependent of itself.\n"));
  }

  @Test void testFiles() throws IOException {
    final Path query = tempDir.resolve("query.grew");
    Files.write(query,
        "pattern { N [lemma=\"café\"] }".getBytes(StandardCharsets.UTF_8));
    final Path output = tempDir.resolve("out.cqp");
    final Run run = run("--file=" + query, "--output=" + output);
    assertThat(run.status, is(0));
    assertThat(run.out, is(""));
    assertThat(new String(Files.readAllBytes(output), StandardCharsets.UTF_8),
        is("[lemma = \"café\"]\n"));

    final Path latin1 = tempDir.resolve("latin1.grew");
    final String text = "pattern { N [lemma=\"café\"] }";
    Files.write(latin1, text.getBytes(StandardCharsets.ISO_8859_1));
    final Run run2 =
        run("--encoding=ISO-8859-1", "--file=" + latin1, "--output=" + output);
    assertThat(run2.status, is(0));
    assertThat(
        new String(Files.readAllBytes(output), StandardCharsets.ISO_8859_1),
        is("[lemma = \"café\"]\n"));
  }

  @Test void testMissingFile() {
    final Path missing = tempDir.resolve("missing.grew");
    final Run run = run("--file=" + missing);
    assertThat(run.status, is(1));
    assertThat(run.err,
        startsWith("Could not read input file " + missing + ": "));

    final Run run2 =
        run("--query=(pos NOUN)",
            "--output=" + tempDir.resolve("no/such/dir/out.cqp"));
    assertThat(run2.status, is(1));
    assertThat(run2.err, startsWith("Could not write to output file "));
  }

  @Test void testStdin() {
    final Run run = runWithInput("(pos NOUN)");
    assertThat(run.status, is(0));
    assertThat(run.out, is("[pos = \"NOUN\"]\n"));
    assertThat(run.err,
        is("No input file specified. Reading from stdin instead.\n"));
  }

  @Test void testUsage() {
    final Run help = run("--help");
    assertThat(help.status, is(0));
    assertThat(help.out, startsWith("Usage: cqp-tree [TRANSLATOR]"));
    assertThat(help.out,
        containsString("one of conllu, depsearch, deptreepy, grew"));

    assertThat(run("cql").err, startsWith("Unknown translator: cql\nUsage:"));
    assertThat(run("--bogus").err, startsWith("Unknown option: --bogus\n"));
    assertThat(run("grew", "conllu").err,
        startsWith("Unexpected argument: conllu\n"));
    assertThat(run("--encoding=klingon").err,
        startsWith("Unknown encoding: klingon\n"));
    final Run both = run("--file=a", "--query=b");
    assertThat(both.status, is(1));
    assertThat(both.err,
        startsWith("Options --file and --query are mutually exclusive\n"));
  }

  @Test void testHumanReadable() {
    assertThat(Main.humanReadable(ImmutableList.of()), is(""));
    assertThat(Main.humanReadable(ImmutableList.of("a")), is("a"));
    assertThat(Main.humanReadable(ImmutableList.of("a", "b")),
        is("a and b"));
    assertThat(Main.humanReadable(ImmutableList.of("a", "b", "c")),
        is("a, b and c"));
  }
}

// End MainTest.java
