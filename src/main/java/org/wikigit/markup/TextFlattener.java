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

package org.wikigit.markup;

import java.util.List;
import org.wikigit.markup.MarkupNode.CharacterEntity;
import org.wikigit.markup.MarkupNode.DefinitionList;
import org.wikigit.markup.MarkupNode.ExternalLink;
import org.wikigit.markup.MarkupNode.Heading;
import org.wikigit.markup.MarkupNode.Image;
import org.wikigit.markup.MarkupNode.Link;
import org.wikigit.markup.MarkupNode.ListItem;
import org.wikigit.markup.MarkupNode.OrderedList;
import org.wikigit.markup.MarkupNode.Preformatted;
import org.wikigit.markup.MarkupNode.StartTag;
import org.wikigit.markup.MarkupNode.Tag;
import org.wikigit.markup.MarkupNode.Text;
import org.wikigit.markup.MarkupNode.UnorderedList;

/**
 * Reduces a markup tree to its plain text, depth first.
 *
 * <p>Link and tag markup is dropped but its text kept; images are bracketed; {@code <br>} becomes a
 * newline; tables, templates and categories contribute nothing.
 */
public final class TextFlattener {

  private final StringBuilder text = new StringBuilder();
  private final boolean descendLists;

  /**
   * @param descendLists if false, the contents of ordered and unordered lists are skipped (used to
   *     take a list item's own text without the sub-list that holds its metadata)
   */
  public TextFlattener(boolean descendLists) {
    this.descendLists = descendLists;
  }

  public TextFlattener() {
    this(true);
  }

  /** Returns the flattened text of {@code nodes}. */
  public static String flatten(List<? extends MarkupNode> nodes) {
    return new TextFlattener().add(nodes).result();
  }

  /** Returns the text accumulated so far. */
  public String result() {
    return text.toString();
  }

  public TextFlattener add(List<? extends MarkupNode> nodes) {
    for (MarkupNode node : nodes) {
      add(node);
    }
    return this;
  }

  public TextFlattener add(MarkupNode node) {
    if (node instanceof Text t) {
      text.append(t.value());
    } else if (node instanceof CharacterEntity entity) {
      text.append(entity.character());
    } else if (node instanceof Heading heading) {
      add(heading.children());
    } else if (node instanceof DefinitionList list) {
      add(list.items());
    } else if (node instanceof ListItem item) {
      add(item.children());
    } else if (node instanceof Link link) {
      add(link.children());
    } else if (node instanceof ExternalLink link) {
      add(link.children());
    } else if (node instanceof Image image) {
      text.append('[');
      add(image.children());
      text.append(']');
    } else if (node instanceof UnorderedList list) {
      if (descendLists) {
        add(list.items());
      }
    } else if (node instanceof OrderedList list) {
      if (descendLists) {
        add(list.items());
      }
    } else if (node instanceof Preformatted pre) {
      add(pre.children());
    } else if (node instanceof Tag tag) {
      add(tag.children());
    } else if (node instanceof StartTag tag) {
      if (tag.name().equals("br")) {
        text.append('\n');
      }
    }
    return this;
  }
}
