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
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a {@link LabelGraph} depth-first, calling a {@link Visitor} on each reachable node after
 * all of its children (post-order).
 *
 * <p>The graph may contain cycles. An edge whose target is an ancestor of the current node on the
 * DFS path closes a cycle; such an edge is reported to the visitor as <i>forbidden</i> for its
 * source node and is not followed. Every reachable node is visited exactly once, and every
 * non-forbidden child of a node is visited before it.
 *
 * <p>Uses an explicit stack rather than recursion, since category graphs can be very deep.
 */
public class CycleSafeWalker {

  private static final Logger logger = LoggerFactory.getLogger(CycleSafeWalker.class);

  /**
   * Called once for each node reached by a walk, after all of its non-forbidden children.
   *
   * @param <E> the checked exception the visitor may throw; {@link RuntimeException} if none
   */
  @FunctionalInterface
  public interface Visitor<E extends Exception> {
    /**
     * Visits {@code node}. {@code forbidden} lists the targets of {@code node}'s outgoing edges
     * that close a cycle (a target appears once per such edge).
     */
    void visit(int node, List<Integer> forbidden) throws E;
  }

  /** A visitor that does nothing; walking with it just computes reachability and logs cycles. */
  public static final Visitor<RuntimeException> NO_OP = (node, forbidden) -> {};

  /** A stack entry: a node and the index of the next outgoing edge to examine. */
  private record Frame(int node, int nextChild) {}

  private final LabelGraph graph;

  public CycleSafeWalker(LabelGraph graph) {
    this.graph = graph;
  }

  /**
   * Walks the nodes reachable from {@code start}, calling {@code visitor} on each in post-order.
   * If the visitor throws, the walk stops and the exception propagates.
   */
  public <E extends Exception> WalkResult walk(int start, Visitor<E> visitor) throws E {
    Preconditions.checkElementIndex(start, graph.size());
    BitSet visited = new BitSet(graph.size());
    BitSet path = new BitSet(graph.size());
    Map<Integer, List<Integer>> forbiddenEdges = new HashMap<>();
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(start, 0));
    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      int node = frame.node;
      path.set(node);
      visited.set(node);
      List<Integer> outgoing = graph.outgoing(node);
      if (frame.nextChild < outgoing.size()) {
        stack.push(new Frame(node, frame.nextChild + 1));
        int child = outgoing.get(frame.nextChild);
        if (path.get(child)) {
          logger.info(
              "Found loop between '{}' ({}) and '{}' ({})",
              graph.nodeId(node).name(),
              node,
              graph.nodeId(child).name(),
              child);
          forbiddenEdges.computeIfAbsent(node, k -> new ArrayList<>()).add(child);
        }
        if (!visited.get(child)) {
          stack.push(new Frame(child, 0));
        }
      } else {
        List<Integer> forbidden = forbiddenEdges.get(node);
        visitor.visit(node, forbidden == null ? ImmutableList.of() : forbidden);
        path.clear(node);
      }
    }
    return new WalkResult(visited);
  }

  /** Walks from {@code start} with a no-op visitor. */
  public WalkResult walk(int start) {
    return walk(start, NO_OP);
  }

  /** The set of nodes reached by a walk. */
  public static final class WalkResult {
    private final BitSet visited;

    WalkResult(BitSet visited) {
      this.visited = visited;
    }

    public boolean isVisited(int node) {
      return visited.get(node);
    }

    /** Returns the number of nodes that were visited. */
    public int visitedCount() {
      return visited.cardinality();
    }

    /** Returns the indices of the nodes (of a graph with the given size) that were not visited. */
    public ImmutableList<Integer> unvisited(int graphSize) {
      ImmutableList.Builder<Integer> result = ImmutableList.builder();
      for (int i = visited.nextClearBit(0); i < graphSize; i = visited.nextClearBit(i + 1)) {
        result.add(i);
      }
      return result.build();
    }
  }
}
