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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wikigit.compiler.ObjectCompiler;
import org.wikigit.dump.DumpReader;
import org.wikigit.dump.UpstreamParseFailure;
import org.wikigit.graph.LabelGraph;
import org.wikigit.graph.NodeId;
import org.wikigit.markup.MarkupConfig;
import org.wikigit.store.GitObjectStore;
import org.wikigit.store.InMemoryObjectStore;
import org.wikigit.store.ObjectHash;

@RunWith(JUnit4.class)
public class PipelineTest {

  static final String CITE_1 =
      "[Adam Mickiewicz / Pan Tadeusz]\n"
          + "Litwo! Ojczyzno moja!\n"
          + " * Źródło: Pan Tadeusz, Księga I\n";
  static final String CITE_2 = "[Adam Mickiewicz / Pan Tadeusz]\nDrugi cytat\n";

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream output = new ByteArrayOutputStream();
  private final Pipeline pipeline =
      new Pipeline(MarkupConfig.plWikiquote(), new PrintStream(output, true, UTF_8));
  private Path dump;

  /** Copies the sample dump to a file and returns its path. */
  static Path sampleDump(TemporaryFolder tmp) throws IOException {
    Path file = tmp.getRoot().toPath().resolve("plwikiquote-sample.xml");
    Files.write(
        file, Resources.toByteArray(Resources.getResource(PipelineTest.class, "sample-dump.xml")));
    return file;
  }

  /** Returns the contents of each file in {@code commit}'s tree, keyed by path. */
  static Map<String, String> files(Repository repository, String commit) throws IOException {
    Map<String, String> result = new LinkedHashMap<>();
    try (RevWalk walk = new RevWalk(repository);
        TreeWalk treeWalk = new TreeWalk(repository)) {
      RevCommit revCommit = walk.parseCommit(repository.resolve(commit));
      treeWalk.addTree(revCommit.getTree());
      treeWalk.setRecursive(true);
      while (treeWalk.next()) {
        byte[] content = repository.open(treeWalk.getObjectId(0)).getBytes();
        result.put(treeWalk.getPathString(), new String(content, UTF_8));
      }
    }
    return result;
  }

  @Before
  public void setUp() throws IOException {
    dump = sampleDump(tmp);
  }

  @Test
  public void categoryGraph() throws IOException {
    LabelGraph graph;
    try (DumpReader pages = DumpReader.open(dump)) {
      graph = pipeline.extractCategories(pages);
    }
    assertThat(graph.size()).isEqualTo(5);
    int poeci = graph.findVertex(NodeId.category("Poeci")).getAsInt();
    int polscy = graph.findVertex(NodeId.category("Polscy poeci")).getAsInt();
    int adam = graph.findVertex(NodeId.article("Adam Mickiewicz")).getAsInt();
    int inna = graph.findVertex(NodeId.category("Inna")).getAsInt();
    int osobna = graph.findVertex(NodeId.category("Osobna")).getAsInt();
    assertThat(graph.roots()).containsExactly(poeci, inna).inOrder();
    assertThat(graph.edgeLabel(poeci, polscy)).isEqualTo("Polscy");
    assertThat(graph.edgeLabel(polscy, adam)).isEqualTo("Mickiewicz, Adam");
    assertThat(graph.edgeLabel(inna, osobna)).isEqualTo("Osobna");

    assertThat(pipeline.checkReachability(graph, poeci).visitedCount()).isEqualTo(3);
    assertThat(output.toString(UTF_8)).isEqualTo("Visited 3 out of 5 nodes.\n");
  }

  @Test
  public void citationsOnlyFromArticlesInGraph() throws IOException {
    LabelGraph graph;
    try (DumpReader pages = DumpReader.open(dump)) {
      graph = pipeline.extractCategories(pages);
    }
    InMemoryObjectStore store = new InMemoryObjectStore();
    ObjectCompiler compiler = new ObjectCompiler(graph, store);
    try (DumpReader pages = DumpReader.open(dump)) {
      assertThat(pipeline.collectCitations(pages, graph, compiler)).isEqualTo(1);
    }
    int adam = graph.findVertex(NodeId.article("Adam Mickiewicz")).getAsInt();
    assertThat(compiler.citationCount()).isEqualTo(2);
    assertThat(store.blob(compiler.citations(adam).get(0)).content()).isEqualTo(CITE_1);
    assertThat(store.blob(compiler.citations(adam).get(1)).content()).isEqualTo(CITE_2);
  }

  @Test
  public void malformedDumpStopsCitationPass() throws IOException {
    String xml = Files.readString(dump);
    // Cut the dump off in the middle of its second page.
    String truncated = xml.substring(0, xml.indexOf("<page>", xml.indexOf("</page>")) + 20);
    LabelGraph graph = new LabelGraph();
    graph.findOrAddVertex(NodeId.article("Adam Mickiewicz"));
    ObjectCompiler compiler = new ObjectCompiler(graph, new InMemoryObjectStore());
    try (DumpReader pages = new DumpReader(new ByteArrayInputStream(truncated.getBytes(UTF_8)))) {
      assertThat(pipeline.collectCitations(pages, graph, compiler)).isEqualTo(1);
    }
    assertThat(compiler.citationCount()).isEqualTo(2);

    try (DumpReader pages = new DumpReader(new ByteArrayInputStream(truncated.getBytes(UTF_8)))) {
      assertThrows(UpstreamParseFailure.class, () -> pipeline.extractCategories(pages));
    }
  }

  @Test
  public void endToEndIntoGit() throws IOException {
    Path repo = tmp.newFolder("repo").toPath();
    ObjectHash commit;
    try (GitObjectStore store =
        GitObjectStore.init(repo, "WikiQuotes", "anonymous@pl.wikiquote.org")) {
      commit = pipeline.run(dump, store, "", "init repo", "master");
      assertThat(files(store.repository(), "master"))
          .containsExactlyEntriesIn(
              ImmutableMap.of(
                  "cat.txt", "Poeci",
                  "Polscy/cat.txt", "Polscy poeci",
                  "Polscy/Mickiewicz, Adam/art.txt", "Adam Mickiewicz",
                  "Polscy/Mickiewicz, Adam/1.txt", CITE_1,
                  "Polscy/Mickiewicz, Adam/2.txt", CITE_2));
    }
    assertThat(output.toString(UTF_8))
        .isEqualTo("Visited 3 out of 5 nodes.\ncommit is " + commit + "\n");
  }

  @Test
  public void searchSelectsRoot() throws IOException {
    InMemoryObjectStore store = new InMemoryObjectStore();
    ObjectHash commit = pipeline.run(dump, store, "Inna", "init repo", "master");
    InMemoryObjectStore.Tree root = store.tree(store.commit(commit).tree());
    assertThat(root.names()).containsExactly("cat.txt", "Osobna");
    assertThat(output.toString(UTF_8)).startsWith("Visited 2 out of 5 nodes.\n");
  }
}
