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

package org.wikigit.extract;

import com.google.common.base.Preconditions;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.wikigit.graph.LabelGraph;
import org.wikigit.graph.NodeId;
import org.wikigit.markup.MarkupNode;
import org.wikigit.markup.MarkupNode.Category;
import org.wikigit.markup.MarkupNode.DefinitionList;
import org.wikigit.markup.MarkupNode.ExternalLink;
import org.wikigit.markup.MarkupNode.Heading;
import org.wikigit.markup.MarkupNode.Link;
import org.wikigit.markup.MarkupNode.ListItem;
import org.wikigit.markup.MarkupNode.OrderedList;
import org.wikigit.markup.MarkupNode.Preformatted;
import org.wikigit.markup.MarkupNode.Tag;
import org.wikigit.markup.MarkupNode.UnorderedList;
import org.wikigit.markup.Normalizer;
import org.wikigit.markup.TextFlattener;

/**
 * Finds the category links in parsed pages and records each as an edge from the category to the
 * page in a {@link LabelGraph}.
 *
 * <p>The edge label is the link's sort key, or the page's own name if the sort key is empty or a
 * single punctuation character (editors often write {@code [[Category:X| ]]} or {@code
 * [[Category:X|*]]} just to sort a page first).
 *
 * <p>Tables and templates are not searched.
 */
public class CategoryExtractor {

  private final LabelGraph graph;
  private final Normalizer normalizer;

  /** The page currently being processed. */
  private @Nullable NodeId document;

  public CategoryExtractor(LabelGraph graph, Normalizer normalizer) {
    this.graph = graph;
    this.normalizer = normalizer;
  }

  public LabelGraph graph() {
    return graph;
  }

  /** Sets the page whose categories will be extracted by subsequent calls to {@link #extract}. */
  public void setDocument(NodeId document) {
    this.document = document;
  }

  /** Adds an edge for each category link in {@code nodes}. */
  public void extract(List<? extends MarkupNode> nodes) {
    Preconditions.checkState(document != null, "setDocument() must be called first");
    for (MarkupNode node : nodes) {
      extract(node);
    }
  }

  private void extract(MarkupNode node) {
    if (node instanceof Category category) {
      addCategory(category);
    } else if (node instanceof DefinitionList list) {
      extract(list.items());
    } else if (node instanceof ExternalLink link) {
      extract(link.children());
    } else if (node instanceof Heading heading) {
      extract(heading.children());
    } else if (node instanceof Link link) {
      extract(link.children());
    } else if (node instanceof OrderedList list) {
      extract(list.items());
    } else if (node instanceof Preformatted pre) {
      extract(pre.children());
    } else if (node instanceof Tag tag) {
      extract(tag.children());
    } else if (node instanceof UnorderedList list) {
      extract(list.items());
    } else if (node instanceof ListItem item) {
      extract(item.children());
    }
  }

  private void addCategory(Category category) {
    NodeId target = normalizer.normalize(category.target());
    if (!target.isCategory()) {
      throw new MalformedCategoryTarget(category.target(), document.name());
    }
    String label = TextFlattener.flatten(category.children()).strip();
    if (label.isEmpty()
        || (label.codePointCount(0, label.length()) == 1
            && !Character.isLetterOrDigit(label.codePointAt(0)))) {
      label = document.name();
    }
    graph.add(target, label, document);
  }
}
