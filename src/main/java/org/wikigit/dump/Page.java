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

package org.wikigit.dump;

import org.jspecify.annotations.Nullable;

/**
 * One page of a dump: its namespace number, title, and the text, format and content model of its
 * last revision. Format and model are null if the dump doesn't record them.
 */
public record Page(
    int namespace, String title, String text, @Nullable String format, @Nullable String model) {

  public static final int MAIN_NAMESPACE = 0;

  /** Returns true if this is an article (namespace 0) whose text is wikitext. */
  public boolean isWikitextArticle() {
    return namespace == MAIN_NAMESPACE && "text/x-wiki".equals(format) && "wikitext".equals(model);
  }

  /** Returns a one-line summary in the form "namespace title format model". */
  public String summary() {
    return String.format("%s %s %s %s", namespace, title, format, model);
  }
}
