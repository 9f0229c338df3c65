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

import com.google.common.collect.ImmutableList;

/**
 * A node in the tree produced by {@link MarkupParser}.
 *
 * <p>Consumers dispatch with {@code instanceof} and ignore variants they don't handle.
 */
public sealed interface MarkupNode {

  /** A run of plain text. */
  record Text(String value) implements MarkupNode {}

  /** A decoded character reference such as {@code &amp;}. */
  record CharacterEntity(String character) implements MarkupNode {}

  /** A section heading; {@code level} is the number of {@code =} signs, from 1 to 6. */
  record Heading(int level, ImmutableList<MarkupNode> children) implements MarkupNode {}

  /** One entry of a list; nested lists appear among its children. */
  record ListItem(ImmutableList<MarkupNode> children) implements MarkupNode {}

  /** Lines starting with {@code *}. */
  record UnorderedList(ImmutableList<ListItem> items) implements MarkupNode {}

  /** Lines starting with {@code #}. */
  record OrderedList(ImmutableList<ListItem> items) implements MarkupNode {}

  /** Lines starting with {@code ;} or {@code :}. */
  record DefinitionList(ImmutableList<ListItem> items) implements MarkupNode {}

  /** {@code [[target|text]]}; if no text was given, the children hold the target as text. */
  record Link(String target, ImmutableList<MarkupNode> children) implements MarkupNode {}

  /**
   * {@code [[Category:target|sort key]]}. The target keeps its namespace prefix; the children hold
   * the sort key, and are empty if none was given.
   */
  record Category(String target, ImmutableList<MarkupNode> children) implements MarkupNode {}

  /** {@code [[File:target|caption]]}. */
  record Image(String target, ImmutableList<MarkupNode> children) implements MarkupNode {}

  /** {@code [url text]}. */
  record ExternalLink(String target, ImmutableList<MarkupNode> children) implements MarkupNode {}

  /** A paired tag such as {@code <ref>...</ref>}. */
  record Tag(String name, ImmutableList<MarkupNode> children) implements MarkupNode {}

  /** An unpaired or self-closing tag such as {@code <br>}. */
  record StartTag(String name) implements MarkupNode {}

  /** Consecutive lines starting with a space. */
  record Preformatted(ImmutableList<MarkupNode> children) implements MarkupNode {}

  /** {@code {{name|...}}}; arguments are not parsed. */
  record Template(String name) implements MarkupNode {}

  /** {@code {| ... |}}; contents are not parsed. */
  record Table() implements MarkupNode {}

  /** {@code #REDIRECT [[target]]} at the start of a page. */
  record Redirect(String target) implements MarkupNode {}

  /** A blank line between paragraphs. */
  record ParagraphBreak() implements MarkupNode {}
}
