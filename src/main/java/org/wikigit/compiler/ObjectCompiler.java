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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikigit.graph.CycleSafeWalker;
import org.wikigit.graph.LabelGraph;
import org.wikigit.graph.NodeId;
import org.wikigit.store.ObjectHash;
import org.wikigit.store.ObjectStore;
import org.wikigit.store.TreeBuilder;
import org.wikigit.store.TreeEntry;

/**
 * Compiles the part of a {@link LabelGraph} reachable from a root into trees in an {@link
 * ObjectStore}.
 *
 * <p>Each node becomes one tree containing
 *
 * <ul>
 *   <li>a blob with the node's name, called {@value #CATEGORY_MARKER} or {@value
 *       #ARTICLE_MARKER} depending on its kind,
 *   <li>one entry per outgoing edge that doesn't close a cycle, named by the edge label (or the
 *       child's name if the label is empty) and pointing to the child's tree, and
 *   <li>one blob per citation attached to the node, named {@code 1.txt}, {@code 2.txt}, ... with
 *       the ordinals in base 36.
 * </ul>
 *
 * <p>Nodes are compiled in post-order, so a child's tree always exists before its parent's.
 */
public final class ObjectCompiler {

  private static final Logger logger = LoggerFactory.getLogger(ObjectCompiler.class);

  public static final String CATEGORY_MARKER = "cat.txt";
  public static final String ARTICLE_MARKER = "art.txt";

  private static final CharMatcher UNSAFE_NAME_CHARS = CharMatcher.anyOf("/\0");

  private final LabelGraph graph;
  private final ObjectStore store;

  /** Citation blobs, keyed by the index of the article they were taken from. */
  private final ListMultimap<Integer, ObjectHash> citations = ArrayListMultimap.create();

  /** The tree of each node compiled by the last call to {@link #compile}. */
  private final Map<Integer, ObjectHash> trees = new HashMap<>();

  public ObjectCompiler(LabelGraph graph, ObjectStore store) {
    this.graph = graph;
    this.store = store;
  }

  /** Attaches an already-stored citation blob to {@code node}. */
  public void addCitation(int node, ObjectHash blob) {
    Preconditions.checkElementIndex(node, graph.size());
    citations.put(node, blob);
  }

  /** Stores {@code text} as a blob, attaches it to {@code node}, and returns its hash. */
  @CanIgnoreReturnValue
  public ObjectHash addCitation(int node, String text) {
    ObjectHash blob = store.putBlob(text.getBytes(UTF_8));
    addCitation(node, blob);
    return blob;
  }

  /** Returns the citations attached to {@code node}, in the order they were added. */
  public List<ObjectHash> citations(int node) {
    return citations.get(node);
  }

  /** Returns the total number of citations attached to nodes. */
  public int citationCount() {
    return citations.size();
  }

  /**
   * Compiles every node reachable from {@code root} and returns the root's tree.
   *
   * <p>If the store fails the walk stops, and the {@link
   * org.wikigit.store.ObjectStoreFailure} propagates.
   */
  public ObjectHash compile(int root) {
    trees.clear();
    CycleSafeWalker.WalkResult result =
        new CycleSafeWalker(graph)
            .walk(root, (node, forbidden) -> trees.put(node, compileNode(node, forbidden)));
    logger.debug("Compiled {} of {} nodes", result.visitedCount(), graph.size());
    return trees.get(root);
  }

  /**
   * Compiles from {@code root}, commits the result with no parents, and points {@code branch} at
   * the commit. Returns the commit.
   *
   * <p>No branch is created unless compilation succeeds.
   */
  public ObjectHash publish(int root, String message, String branch) {
    ObjectHash tree = compile(root);
    ObjectHash commit = store.putCommit(tree, message, ImmutableList.of());
    store.setRef(branch, commit);
    logger.info("Branch '{}' now points to {}", branch, commit);
    return commit;
  }

  /** Returns the tree {@code node} was compiled to by the last {@link #compile}, or null. */
  public @Nullable ObjectHash tree(int node) {
    return trees.get(node);
  }

  private ObjectHash compileNode(int node, List<Integer> forbidden) {
    NodeId id = graph.nodeId(node);
    TreeBuilder builder = new TreeBuilder(store);
    builder.insert(
        id.isCategory() ? CATEGORY_MARKER : ARTICLE_MARKER,
        TreeEntry.Mode.FILE,
        store.putBlob(id.name().getBytes(UTF_8)));
    for (int child : graph.outgoing(node)) {
      if (forbidden.contains(child)) {
        continue;
      }
      ObjectHash childTree = trees.get(child);
      Preconditions.checkState(childTree != null, "Node %s compiled before child %s", node, child);
      String label = graph.edgeLabel(node, child);
      String name = label.isEmpty() ? graph.nodeId(child).name() : label;
      builder.insert(entryName(name), TreeEntry.Mode.TREE, childTree);
    }
    List<ObjectHash> cites = citations.get(node);
    for (int i = 0; i < cites.size(); i++) {
      builder.insert(citationName(i + 1), TreeEntry.Mode.FILE, cites.get(i));
    }
    ObjectHash result = builder.write();
    logger.debug("Compiled {} to {} ({} entries)", id, result, builder.size());
    return result;
  }

  /** Makes {@code name} usable as a tree entry name. */
  static String entryName(String name) {
    String result = UNSAFE_NAME_CHARS.replaceFrom(name, '-');
    if (result.isEmpty()) {
      return "_";
    }
    // git refuses these names in a tree.
    if (result.equals(".") || result.equals("..") || Ascii.equalsIgnoreCase(result, ".git")) {
      return "_" + result;
    }
    return result;
  }

  static String citationName(int ordinal) {
    return Integer.toString(ordinal, 36) + ".txt";
  }
}
