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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LabelGraphTest {

  private static final NodeId A = NodeId.category("A");
  private static final NodeId B = NodeId.category("B");
  private static final NodeId C = NodeId.article("C");

  @Test
  public void findOrAddIsIdempotent() {
    LabelGraph graph = new LabelGraph();
    int first = graph.findOrAddVertex(A);
    int second = graph.findOrAddVertex(A);
    assertThat(second).isEqualTo(first);
    assertThat(graph.size()).isEqualTo(1);
    assertThat(graph.findVertex(A).getAsInt()).isEqualTo(first);
    assertThat(graph.nodeId(first)).isEqualTo(A);
  }

  @Test
  public void kindIsPartOfIdentity() {
    LabelGraph graph = new LabelGraph();
    int category = graph.findOrAddVertex(NodeId.category("Poland"));
    int article = graph.findOrAddVertex(NodeId.article("Poland"));
    assertThat(article).isNotEqualTo(category);
    assertThat(graph.size()).isEqualTo(2);
    assertThat(graph.findVertex(NodeId.category("Nowhere")).isPresent()).isFalse();
  }

  @Test
  public void addVertexRejectsDuplicateIdentity() {
    LabelGraph graph = new LabelGraph();
    graph.addVertex(A);
    assertThrows(IllegalArgumentException.class, () -> graph.addVertex(A));
    assertThat(graph.size()).isEqualTo(1);
  }

  @Test
  public void laterLabelReplacesEarlier() {
    LabelGraph graph = new LabelGraph();
    graph.add(A, "x", B);
    graph.add(A, "y", B);
    int a = graph.findVertex(A).getAsInt();
    int b = graph.findVertex(B).getAsInt();
    assertThat(graph.outgoing(a)).containsExactly(b);
    assertThat(graph.incoming(b)).containsExactly(a);
    assertThat(graph.edgeLabel(a, b)).isEqualTo("y");
  }

  @Test
  public void roots() {
    LabelGraph graph = new LabelGraph();
    graph.add(A, "", B);
    graph.add(B, "", C);
    assertThat(graph.roots()).containsExactly(graph.findVertex(A).getAsInt());
  }

  @Test
  public void rootsOfCycleAreEmpty() {
    LabelGraph graph = new LabelGraph();
    graph.add(A, "", B);
    graph.add(B, "", A);
    assertThat(graph.roots()).isEmpty();
  }

  @Test
  public void addEdgeRequiresExistingEndpoints() {
    LabelGraph graph = new LabelGraph();
    int a = graph.addVertex(A);
    assertThrows(IllegalArgumentException.class, () -> graph.addEdge(a, 1, "x"));
    assertThrows(IllegalArgumentException.class, () -> graph.addEdge(-1, a, "x"));
    assertThat(graph.outgoing(a)).isEmpty();
  }

  @Test
  public void missingEdgeLabel() {
    LabelGraph graph = new LabelGraph();
    graph.add(A, "", B);
    assertThat(graph.edgeLabel(0, 1)).isEmpty();
    assertThrows(IllegalArgumentException.class, () -> graph.edgeLabel(1, 0));
  }

  @Test
  public void adjacencyKeepsInsertionOrder() {
    LabelGraph graph = new LabelGraph();
    graph.add(A, "c", C);
    graph.add(A, "b", B);
    assertThat(graph.outgoing(0)).containsExactly(1, 2).inOrder();
    assertThat(graph.toString()).isEqualTo("LabelGraph(3 nodes, 2 edges)");
  }
}
