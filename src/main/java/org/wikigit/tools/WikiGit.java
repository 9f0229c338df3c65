/*
 * Copyright 2025 The Wikigit Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.wikigit.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;
import org.wikigit.WikiGitException;
import org.wikigit.dump.DumpReader;
import org.wikigit.dump.Page;
import org.wikigit.extract.Citation;
import org.wikigit.extract.CitationExtractor;
import org.wikigit.markup.MarkupConfig;
import org.wikigit.markup.MarkupNode;
import org.wikigit.markup.MarkupParser;
import org.wikigit.store.GitObjectStore;

/**
 * A command-line tool for inspecting a Wikiquote dump and converting it to a git repository.
 *
 * <p>The branch name, commit message and commit author can be changed with the system properties
 * {@code branch}, {@code message}, {@code author} and {@code email}.
 */
public class WikiGit {
  private WikiGit() {}

  private static final String USAGE =
      "Use: wikigit -c <list|parse|json|debug|cats> -d <dump> [-o <output>] [search]";

  /** What to do with the dump. */
  enum Command {
    /** Print a summary line for every page. */
    LIST,
    /** Print the citations of the page named by the search argument. */
    PARSE,
    /** Like PARSE, but as JSON. */
    JSON,
    /** Print the parsed markup of the page named by the search argument. */
    DEBUG,
    /** Convert the dump to a git repository. */
    CATS;

    /** Unrecognized names mean LIST. */
    static Command of(String name) {
      for (Command c : values()) {
        if (Ascii.equalsIgnoreCase(c.name(), name)) {
          return c;
        }
      }
      return LIST;
    }
  }

  /** The parsed command line. */
  record Options(Command command, Path dump, @Nullable Path output, String search) {

    /** Returns null if {@code args} are not valid. */
    static @Nullable Options parse(String[] args) {
      Command command = Command.PARSE;
      Path dump = null;
      Path output = null;
      String search = "";
      for (int i = 0; i < args.length; i++) {
        switch (args[i]) {
          case "-c", "-d", "-o" -> {
            if (i + 1 == args.length) {
              return null;
            }
            String flag = args[i];
            String value = args[++i];
            switch (flag) {
              case "-c" -> command = Command.of(value);
              case "-d" -> dump = Path.of(value);
              default -> output = Path.of(value);
            }
          }
          default -> {
            if (args[i].startsWith("-") || !search.isEmpty()) {
              return null;
            }
            search = args[i];
          }
        }
      }
      if (dump == null || (command == Command.CATS && output == null)) {
        return null;
      }
      return new Options(command, dump, output, search);
    }
  }

  /** The settings taken from system properties. */
  record Settings(String branch, String message, String author, String email) {
    static final Settings DEFAULT =
        new Settings("master", "init repo", "WikiQuotes", "anonymous@pl.wikiquote.org");

    static Settings fromSystemProperties() {
      return new Settings(
          System.getProperty("branch", DEFAULT.branch),
          System.getProperty("message", DEFAULT.message),
          System.getProperty("author", DEFAULT.author),
          System.getProperty("email", DEFAULT.email));
    }
  }

  public static void main(String[] args) {
    int status = run(args, Settings.fromSystemProperties(), System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  /** Runs the tool and returns its exit status. */
  @VisibleForTesting
  static int run(String[] args, Settings settings, PrintStream out, PrintStream err) {
    Options options = Options.parse(args);
    if (options == null) {
      err.println(USAGE);
      return 1;
    }
    MarkupConfig config = MarkupConfig.plWikiquote();
    try {
      if (options.command == Command.CATS) {
        try (GitObjectStore store =
            GitObjectStore.init(options.output, settings.author, settings.email)) {
          new Pipeline(config, out)
              .run(options.dump, store, options.search, settings.message, settings.branch);
        }
      } else {
        showPages(options, new MarkupParser(config), out);
      }
    } catch (WikiGitException | IOException e) {
      err.println("ERROR: " + e.getMessage());
      return 1;
    }
    return 0;
  }

  private static void showPages(Options options, MarkupParser parser, PrintStream out)
      throws IOException {
    try (DumpReader pages = DumpReader.open(options.dump)) {
      while (pages.hasNext()) {
        Page page = pages.next();
        if (options.command == Command.LIST) {
          out.println(page.summary());
        } else if (page.title().equals(options.search)) {
          out.println(page.summary());
          showPage(options.command, parser.parse(page.text()), page.title(), out);
        }
      }
    }
  }

  private static void showPage(
      Command command, ImmutableList<MarkupNode> nodes, String title, PrintStream out)
      throws JsonProcessingException {
    switch (command) {
      case PARSE -> {
        for (Citation cite : CitationExtractor.extract(nodes, title)) {
          out.println(cite.render());
        }
      }
      case JSON -> {
        ImmutableList<Citation> cites = CitationExtractor.extract(nodes, title);
        out.println(
            new ObjectMapper()
                .writerWithDefaultPrettyPrinter()
                .writeValueAsString(ImmutableMap.of("cites", cites)));
      }
      default -> out.println(nodes + "\n");
    }
  }
}
