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

package org.wikigit.graph;

import com.google.common.base.Preconditions;
import com.google.common.collect.BiMap;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.HashBiMap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Table;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * A directed graph whose nodes are identified by {@link NodeId} and whose edges carry a string
 * label.
 *
 * <p>Nodes are numbered densely from 0 in creation order. Each node records its outgoing and
 * incoming neighbors in insertion order. There is at most one edge from one node to another;
 * linking the same pair again replaces the label of the existing edge.
 *
 * <p>The graph may contain cycles; see {@link CycleSafeWalker} for a traversal that copes with
 * them.
 *
 * <p>A LabelGraph is built by a single thread and then only read, so it is not synchronized.
 */
public class LabelGraph {

  /** Per-node adjacency. */
  private static class Node {
    final List<Integer> outgoing = new ArrayList<>();
    final List<Integer> incoming = new ArrayList<>();
  }

  private final List<Node> nodes = new ArrayList<>();

  /**
   * Index to identity. Only written by {@link #addVertex}, so the two directions (this map and its
   * {@link BiMap#inverse}) cannot diverge.
   */
  private final BiMap<Integer, NodeId> nodeIds = HashBiMap.create();

  /** Edge labels, keyed by (from, to). */
  private final Table<Integer, Integer, String> edgeLabels = HashBasedTable.create();

  /** Returns the number of nodes in this graph. */
  public int size() {
    return nodes.size();
  }

  /**
   * Creates a new node with the given identity and returns its index.
   *
   * <p>Throws IllegalArgumentException if a node with the same identity already exists; use
   * {@link #findOrAddVertex} when the node may be present.
   */
  @CanIgnoreReturnValue
  public int addVertex(NodeId id) {
    int index = nodes.size();
    // BiMap.put rejects a value that is already bound to another key.
    nodeIds.put(index, id);
    nodes.add(new Node());
    return index;
  }

  /** Returns the index of the node with the given identity, or empty if there is none. */
  public OptionalInt findVertex(NodeId id) {
    Integer index = nodeIds.inverse().get(id);
    return (index == null) ? OptionalInt.empty() : OptionalInt.of(index);
  }

  /** Returns the index of the node with the given identity, creating it if necessary. */
  @CanIgnoreReturnValue
  public int findOrAddVertex(NodeId id) {
    Integer index = nodeIds.inverse().get(id);
    return (index != null) ? index : addVertex(id);
  }

  /**
   * Adds an edge from {@code from} to {@code to} with the given label, replacing the label of any
   * previous edge between the same two nodes (there is at most one edge from a node to another).
   *
   * <p>Both endpoints must already exist.
   */
  public void addEdge(int from, int to, String label) {
    Preconditions.checkArgument(
        from >= 0 && from < nodes.size(), "No node %s (graph has %s)", from, nodes.size());
    Preconditions.checkArgument(
        to >= 0 && to < nodes.size(), "No node %s (graph has %s)", to, nodes.size());
    Preconditions.checkNotNull(label);
    if (edgeLabels.put(from, to, label) == null) {
      nodes.get(from).outgoing.add(to);
      nodes.get(to).incoming.add(from);
    }
  }

  /**
   * Adds an edge from {@code a} to {@code b} with the given label, first creating either node if
   * it does not already exist.
   */
  public void add(NodeId a, String label, NodeId b) {
    int from = findOrAddVertex(a);
    int to = findOrAddVertex(b);
    addEdge(from, to, label);
  }

  /** Returns the indices of all nodes with no incoming edges, in creation order. */
  public ImmutableList<Integer> roots() {
    ImmutableList.Builder<Integer> result = ImmutableList.builder();
    for (int i = 0; i < nodes.size(); i++) {
      if (nodes.get(i).incoming.isEmpty()) {
        result.add(i);
      }
    }
    return result.build();
  }

  /** Returns the identity of the specified node. */
  public NodeId nodeId(int index) {
    NodeId result = nodeIds.get(index);
    Preconditions.checkArgument(result != null, "No node %s", index);
    return result;
  }

  /** Returns the label of the edge from {@code from} to {@code to}. */
  public String edgeLabel(int from, int to) {
    String result = edgeLabels.get(from, to);
    Preconditions.checkArgument(result != null, "No edge %s -> %s", from, to);
    return result;
  }

  /** Returns the targets of the specified node's outgoing edges, in the order they were added. */
  public List<Integer> outgoing(int index) {
    return Collections.unmodifiableList(node(index).outgoing);
  }

  /** Returns the sources of the specified node's incoming edges, in the order they were added. */
  public List<Integer> incoming(int index) {
    return Collections.unmodifiableList(node(index).incoming);
  }

  private Node node(int index) {
    Preconditions.checkElementIndex(index, nodes.size());
    return nodes.get(index);
  }

  @Override
  public String toString() {
    return String.format("LabelGraph(%s nodes, %s edges)", nodes.size(), edgeLabels.size());
  }
}
