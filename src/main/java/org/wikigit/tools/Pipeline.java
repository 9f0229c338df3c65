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

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.OptionalInt;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikigit.compiler.ObjectCompiler;
import org.wikigit.compiler.RootSelector;
import org.wikigit.dump.DumpReader;
import org.wikigit.dump.Page;
import org.wikigit.dump.UpstreamParseFailure;
import org.wikigit.extract.CategoryExtractor;
import org.wikigit.extract.Citation;
import org.wikigit.extract.CitationExtractor;
import org.wikigit.graph.CycleSafeWalker;
import org.wikigit.graph.LabelGraph;
import org.wikigit.graph.NodeId;
import org.wikigit.markup.MarkupConfig;
import org.wikigit.markup.MarkupParser;
import org.wikigit.markup.Normalizer;
import org.wikigit.store.ObjectHash;
import org.wikigit.store.ObjectStore;

/**
 * Turns a dump into a git branch. The dump is read twice: once to build the category graph and
 * once to collect the citations of the articles in it. The graph is then compiled from its root
 * and committed.
 */
public final class Pipeline {

  private static final Logger logger = LoggerFactory.getLogger(Pipeline.class);

  private final MarkupParser parser;
  private final Normalizer normalizer;
  private final PrintStream out;

  public Pipeline(MarkupConfig config, PrintStream out) {
    this.parser = new MarkupParser(config);
    this.normalizer = new Normalizer(config);
    this.out = out;
  }

  /**
   * Runs all passes over {@code dump}, writing to {@code store}, and returns the new commit.
   *
   * @param search the name of the category to compile from; if empty or not found, the first
   *     root of the graph is used
   */
  public ObjectHash run(
      Path dump, ObjectStore store, @Nullable String search, String message, String branch)
      throws IOException {
    LabelGraph graph;
    try (DumpReader pages = DumpReader.open(dump)) {
      graph = extractCategories(pages);
    }
    int root = RootSelector.select(graph, search);
    checkReachability(graph, root);
    ObjectCompiler compiler = new ObjectCompiler(graph, store);
    try (DumpReader pages = DumpReader.open(dump)) {
      collectCitations(pages, graph, compiler);
    }
    ObjectHash commit = compiler.publish(root, message, branch);
    out.println("commit is " + commit);
    return commit;
  }

  /**
   * Builds the category graph of {@code pages}. An {@link UpstreamParseFailure} propagates, since
   * an incomplete graph would be compiled wrongly.
   */
  public LabelGraph extractCategories(Iterator<Page> pages) {
    CategoryExtractor extractor = new CategoryExtractor(new LabelGraph(), normalizer);
    int count = 0;
    while (pages.hasNext()) {
      Page page = pages.next();
      extractor.setDocument(normalizer.normalize(page.title()));
      extractor.extract(parser.parse(page.text()));
      count++;
    }
    logger.info("Read {} pages, found {}", count, extractor.graph());
    return extractor.graph();
  }

  /** Walks {@code graph} from {@code root}, reporting how many nodes are reachable. */
  public CycleSafeWalker.WalkResult checkReachability(LabelGraph graph, int root) {
    CycleSafeWalker.WalkResult result = new CycleSafeWalker(graph).walk(root);
    out.printf("Visited %s out of %s nodes.%n", result.visitedCount(), graph.size());
    if (result.visitedCount() < graph.size()) {
      logger.warn(
          "{} nodes are not reachable from '{}'",
          graph.size() - result.visitedCount(),
          graph.nodeId(root).name());
    }
    return result;
  }

  /**
   * Stores the citations of each wikitext article of {@code pages} that is in {@code graph}, and
   * attaches them to the article's node. Returns the number of articles read.
   *
   * <p>If the dump turns out to be malformed the error is reported and the citations collected so
   * far are kept; the reader can't be resumed past the error.
   */
  public int collectCitations(Iterator<Page> pages, LabelGraph graph, ObjectCompiler compiler) {
    int articles = 0;
    try {
      while (pages.hasNext()) {
        Page page = pages.next();
        OptionalInt node = findArticle(page, graph);
        if (node.isEmpty()) {
          logger.info("Skip {}", page.summary());
          continue;
        }
        logger.debug("Citations from {}", page.title());
        for (Citation cite : CitationExtractor.extract(parser.parse(page.text()), page.title())) {
          compiler.addCitation(node.getAsInt(), cite.render());
        }
        articles++;
      }
    } catch (UpstreamParseFailure e) {
      logger.error("Stopped reading citations after {} articles", articles, e);
    }
    logger.info("Stored {} citations from {} articles", compiler.citationCount(), articles);
    return articles;
  }

  private OptionalInt findArticle(Page page, LabelGraph graph) {
    if (!page.isWikitextArticle()) {
      return OptionalInt.empty();
    }
    NodeId id = normalizer.normalize(page.title());
    return id.isCategory() ? OptionalInt.empty() : graph.findVertex(id);
  }
}
