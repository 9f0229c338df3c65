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

import com.google.common.base.Strings;
import java.util.List;
import java.util.OptionalInt;
import org.jspecify.annotations.Nullable;
import org.wikigit.graph.LabelGraph;
import org.wikigit.graph.NodeId;

/** Chooses the node a compilation starts from. */
public final class RootSelector {

  /**
   * Returns the index of the category named {@code search} if there is one, otherwise the first
   * root of {@code graph}.
   *
   * @throws NoRootFound if {@code search} doesn't match and the graph has no roots
   */
  public static int select(LabelGraph graph, @Nullable String search) {
    if (!Strings.isNullOrEmpty(search)) {
      OptionalInt found = graph.findVertex(NodeId.category(search));
      if (found.isPresent()) {
        return found.getAsInt();
      }
    }
    List<Integer> roots = graph.roots();
    if (roots.isEmpty()) {
      throw new NoRootFound(graph.size());
    }
    return roots.get(0);
  }

  private RootSelector() {}
}
