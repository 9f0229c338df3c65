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

import java.util.regex.Pattern;
import org.wikigit.graph.NodeId;

/**
 * Turns a page title (or category link target) into the {@link NodeId} it denotes.
 *
 * <p>A title whose text before the first colon names a category namespace (by {@link
 * MarkupConfig#isCategoryNamespace}, the same test the parser uses for category links) is a
 * category, and loses everything up to and including that colon. The remainder is trimmed, runs
 * of whitespace become single spaces, and left-to-right marks are removed.
 *
 * <p>Every node identity in a graph comes from here, so any change to these rules changes which
 * pages are considered the same.
 */
public final class Normalizer {

  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  /** Invisible characters that editors paste into titles by accident. */
  private static final String[] INVISIBLE = {"\u200e"};

  private final MarkupConfig config;

  public Normalizer(MarkupConfig config) {
    this.config = config;
  }

  public NodeId normalize(String title) {
    String s = title;
    int colon = s.indexOf(':');
    boolean isCategory = colon > 0 && config.isCategoryNamespace(s.substring(0, colon));
    if (isCategory) {
      s = s.substring(colon + 1);
    }
    s = WHITESPACE.matcher(s.strip()).replaceAll(" ");
    for (String ch : INVISIBLE) {
      s = s.replace(ch, "");
    }
    return new NodeId(s, isCategory);
  }
}
