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

package org.wikigit.compiler;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wikigit.graph.LabelGraph;
import org.wikigit.graph.NodeId;
import org.wikigit.store.InMemoryObjectStore;
import org.wikigit.store.InMemoryObjectStore.Tree;
import org.wikigit.store.ObjectHash;
import org.wikigit.store.ObjectStoreFailure;
import org.wikigit.store.TreeEntry;

@RunWith(JUnit4.class)
public class ObjectCompilerTest {

  private static final NodeId ART1 = NodeId.article("Art1");
  private static final NodeId CAT_A = NodeId.category("CatA");
  private static final NodeId CAT_ROOT = NodeId.category("CatRoot");

  private InMemoryObjectStore store;
  private LabelGraph graph;

  @Before
  public void setUp() {
    store = new InMemoryObjectStore();
    graph = new LabelGraph();
  }

  private int node(NodeId id) {
    return graph.findVertex(id).getAsInt();
  }

  private Tree subtree(Tree tree, String name) {
    TreeEntry entry = tree.entry(name);
    assertThat(entry).isNotNull();
    assertThat(entry.mode()).isEqualTo(TreeEntry.Mode.TREE);
    return store.tree(entry.id());
  }

  private String file(Tree tree, String name) {
    TreeEntry entry = tree.entry(name);
    assertThat(entry).isNotNull();
    assertThat(entry.mode()).isEqualTo(TreeEntry.Mode.FILE);
    return store.blob(entry.id()).content();
  }

  @Test
  public void endToEnd() {
    graph.add(CAT_A, "quote", ART1);
    graph.add(CAT_ROOT, "sub", CAT_A);
    ObjectCompiler compiler = new ObjectCompiler(graph, store);
    compiler.addCitation(node(ART1), "cite text 1");
    compiler.addCitation(node(ART1), "cite text 2");

    ObjectHash commit = compiler.publish(node(CAT_ROOT), "init repo", "master");

    assertThat(store.refs()).containsExactly("master", commit);
    InMemoryObjectStore.Commit stored = store.commit(commit);
    assertThat(stored.message()).isEqualTo("init repo");
    assertThat(stored.parents()).isEmpty();
    Tree root = store.tree(stored.tree());
    assertThat(root.names()).containsExactly("cat.txt", "sub");
    assertThat(file(root, "cat.txt")).isEqualTo("CatRoot");
    Tree catA = subtree(root, "sub");
    assertThat(catA.names()).containsExactly("cat.txt", "quote");
    assertThat(file(catA, "cat.txt")).isEqualTo("CatA");
    Tree art1 = subtree(catA, "quote");
    assertThat(art1.names()).containsExactly("art.txt", "1.txt", "2.txt");
    assertThat(file(art1, "art.txt")).isEqualTo("Art1");
    assertThat(file(art1, "1.txt")).isEqualTo("cite text 1");
    assertThat(file(art1, "2.txt")).isEqualTo("cite text 2");
    assertThat(compiler.tree(node(ART1))).isEqualTo(catA.entry("quote").id());
  }

  @Test
  public void deterministic() {
    graph.add(CAT_A, "quote", ART1);
    graph.add(CAT_ROOT, "sub", CAT_A);
    ObjectCompiler compiler = new ObjectCompiler(graph, store);
    compiler.addCitation(node(ART1), "cite");
    ObjectHash first = compiler.compile(node(CAT_ROOT));
    ObjectHash second = compiler.compile(node(CAT_ROOT));
    assertThat(second).isEqualTo(first);

    InMemoryObjectStore otherStore = new InMemoryObjectStore();
    ObjectCompiler other = new ObjectCompiler(graph, otherStore);
    other.addCitation(node(ART1), "cite");
    assertThat(other.compile(node(CAT_ROOT))).isEqualTo(first);
  }

  @Test
  public void emptyLabelUsesChildName() {
    graph.add(CAT_ROOT, "", NodeId.category("AC/DC"));
    Tree root = store.tree(new ObjectCompiler(graph, store).compile(node(CAT_ROOT)));
    assertThat(root.names()).containsExactly("cat.txt", "AC-DC");
  }

  @Test
  public void cycleEdgesAreLeftOut() {
    NodeId b = NodeId.category("B");
    graph.add(CAT_ROOT, "a", CAT_A);
    graph.add(CAT_A, "b", b);
    graph.add(b, "back", CAT_A);
    Tree root = store.tree(new ObjectCompiler(graph, store).compile(node(CAT_ROOT)));
    Tree treeB = subtree(subtree(root, "a"), "b");
    assertThat(treeB.names()).containsExactly("cat.txt");
  }

  @Test
  public void unreachableNodesAreNotCompiled() {
    graph.add(CAT_ROOT, "a", CAT_A);
    graph.add(NodeId.category("Other"), "x", ART1);
    ObjectCompiler compiler = new ObjectCompiler(graph, store);
    compiler.compile(node(CAT_ROOT));
    assertThat(compiler.tree(node(CAT_A))).isNotNull();
    assertThat(compiler.tree(node(ART1))).isNull();
  }

  @Test
  public void duplicateNamesKeepLastEntry() {
    NodeId x = NodeId.category("X");
    NodeId y = NodeId.category("Y");
    graph.add(CAT_ROOT, "same", x);
    graph.add(CAT_ROOT, "same", y);
    ObjectCompiler compiler = new ObjectCompiler(graph, store);
    Tree root = store.tree(compiler.compile(node(CAT_ROOT)));
    assertThat(root.names()).containsExactly("cat.txt", "same");
    assertThat(root.entry("same").id()).isEqualTo(compiler.tree(node(y)));
  }

  @Test
  public void manyCitationsUseBase36() {
    graph.addVertex(ART1);
    ObjectCompiler compiler = new ObjectCompiler(graph, store);
    for (int i = 1; i <= 37; i++) {
      compiler.addCitation(0, "cite " + i);
    }
    Tree tree = store.tree(compiler.compile(0));
    assertThat(tree.names()).contains("9.txt");
    assertThat(tree.names()).contains("a.txt");
    assertThat(tree.names()).contains("z.txt");
    assertThat(file(tree, "10.txt")).isEqualTo("cite 36");
    assertThat(file(tree, "11.txt")).isEqualTo("cite 37");
    assertThat(tree.names()).hasSize(38);
  }

  @Test
  public void entryNames() {
    assertThat(ObjectCompiler.entryName("a/b/c")).isEqualTo("a-b-c");
    assertThat(ObjectCompiler.entryName("")).isEqualTo("_");
    assertThat(ObjectCompiler.entryName(".")).isEqualTo("_.");
    assertThat(ObjectCompiler.entryName("..")).isEqualTo("_..");
    assertThat(ObjectCompiler.entryName(".Git")).isEqualTo("_.Git");
    assertThat(ObjectCompiler.entryName("...")).isEqualTo("...");
    assertThat(ObjectCompiler.citationName(1)).isEqualTo("1.txt");
    assertThat(ObjectCompiler.citationName(35)).isEqualTo("z.txt");
  }

  @Test
  public void labelsGitRejectsAreRenamed() {
    graph.add(CAT_ROOT, "..", CAT_A);
    graph.add(CAT_ROOT, ".git", ART1);
    ObjectCompiler compiler = new ObjectCompiler(graph, store);
    Tree root = store.tree(compiler.compile(node(CAT_ROOT)));
    assertThat(file(subtree(root, "_.."), ObjectCompiler.CATEGORY_MARKER)).isEqualTo("CatA");
    assertThat(file(subtree(root, "_.git"), ObjectCompiler.ARTICLE_MARKER)).isEqualTo("Art1");
    assertThat(root.entry("..")).isNull();
  }

  @Test
  public void storeFailureLeavesNoBranch() {
    graph.add(CAT_A, "quote", ART1);
    graph.add(CAT_ROOT, "sub", CAT_A);
    ObjectCompiler compiler = new ObjectCompiler(graph, store);
    store.failAfter(3);
    assertThrows(ObjectStoreFailure.class, () -> compiler.publish(node(CAT_ROOT), "m", "master"));
    assertThat(store.refs()).isEmpty();
  }

  @Test
  public void existingBranchIsNotMoved() {
    graph.addVertex(CAT_ROOT);
    ObjectCompiler compiler = new ObjectCompiler(graph, store);
    ObjectHash first = compiler.publish(0, "one", "master");
    assertThrows(ObjectStoreFailure.class, () -> compiler.publish(0, "two", "master"));
    assertThat(store.refs()).containsExactly("master", first);
  }

  @Test
  public void citationsNeedANode() {
    ObjectCompiler compiler = new ObjectCompiler(graph, store);
    assertThrows(IndexOutOfBoundsException.class, () -> compiler.addCitation(0, "x"));
    assertThat(compiler.citationCount()).isEqualTo(0);
    assertThat(compiler.citations(0)).isEmpty();
  }
}
