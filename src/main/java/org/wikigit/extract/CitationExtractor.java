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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.wikigit.extract.Citation.MetaData;
import org.wikigit.markup.MarkupNode;
import org.wikigit.markup.MarkupNode.Heading;
import org.wikigit.markup.MarkupNode.ListItem;
import org.wikigit.markup.MarkupNode.UnorderedList;
import org.wikigit.markup.TextFlattener;

/**
 * Extracts the quotes from a parsed Wikiquote article.
 *
 * <p>Each item of a top-level bulleted list is a quote. Its own text (without nested lists) is the
 * quote; a nested bulleted list holds notes such as the source, one {@code key: value} per item.
 * Headings between the lists give each quote its section path.
 */
public final class CitationExtractor {

  private CitationExtractor() {}

  /** Returns the quotes on the page titled {@code title}, in page order. */
  public static ImmutableList<Citation> extract(List<? extends MarkupNode> nodes, String title) {
    ImmutableList.Builder<Citation> result = ImmutableList.builder();
    Breadcrumbs breadcrumbs = new Breadcrumbs(title);
    for (MarkupNode node : nodes) {
      if (node instanceof UnorderedList list) {
        for (ListItem item : list.items()) {
          String text = new TextFlattener(false).add(item.children()).result();
          ImmutableList<String> sections = ImmutableList.copyOf(breadcrumbs.stack);
          result.add(new Citation(text, sections, readMeta(item.children())));
        }
      } else if (node instanceof Heading heading) {
        breadcrumbs.update(heading.level(), TextFlattener.flatten(heading.children()));
      }
    }
    return result.build();
  }

  /** Collects {@code key: value} items from the bulleted lists directly under a quote. */
  private static ImmutableList<MetaData> readMeta(List<MarkupNode> children) {
    ImmutableList.Builder<MetaData> meta = ImmutableList.builder();
    for (MarkupNode child : children) {
      if (child instanceof UnorderedList list) {
        for (ListItem item : list.items()) {
          String text = TextFlattener.flatten(item.children());
          int colon = text.indexOf(':');
          if (colon >= 0) {
            meta.add(new MetaData(text.substring(0, colon), text.substring(colon + 1).strip()));
          }
        }
      }
    }
    return meta.build();
  }

  /**
   * The headings enclosing the current position. Position 0 holds the page title (a level 1
   * heading replaces it); a heading at level n replaces position n-1 and discards everything
   * deeper. Skipped levels are filled with empty strings.
   */
  static final class Breadcrumbs {
    final List<String> stack = new ArrayList<>();

    Breadcrumbs(String title) {
      stack.add(title);
    }

    void update(int level, String text) {
      while (stack.size() < level) {
        stack.add("");
      }
      while (stack.size() > level) {
        stack.remove(stack.size() - 1);
      }
      stack.set(stack.size() - 1, text);
    }
  }
}
