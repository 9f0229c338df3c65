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

package org.wikigit.store;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulates the entries of one tree and then writes it to an {@link ObjectStore}.
 *
 * <p>Inserting a name that is already present replaces the earlier entry.
 */
public final class TreeBuilder {

  private final ObjectStore store;
  private final Map<String, TreeEntry> entries = new LinkedHashMap<>();

  public TreeBuilder(ObjectStore store) {
    this.store = store;
  }

  @CanIgnoreReturnValue
  public TreeBuilder insert(String name, TreeEntry.Mode mode, ObjectHash id) {
    entries.put(name, new TreeEntry(name, mode, id));
    return this;
  }

  public int size() {
    return entries.size();
  }

  /** Stores the tree and returns its hash. */
  public ObjectHash write() {
    return store.putTree(ImmutableList.copyOf(entries.values()));
  }
}
