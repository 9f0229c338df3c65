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

/**
 * The identity of a node in a {@link LabelGraph}: a normalized page name plus whether the page is a
 * category. A category and an article may share a name; two categories (or two articles) may not.
 */
public record NodeId(String name, boolean isCategory) {

  public NodeId {
    Preconditions.checkNotNull(name);
  }

  public static NodeId category(String name) {
    return new NodeId(name, true);
  }

  public static NodeId article(String name) {
    return new NodeId(name, false);
  }

  @Override
  public String toString() {
    return (isCategory ? "category:" : "article:") + name;
  }
}
