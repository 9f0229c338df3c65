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

import java.util.List;

/**
 * A content-addressable store of blobs, trees and commits, plus named branches pointing at
 * commits.
 *
 * <p>All methods throw {@link ObjectStoreFailure} if the underlying storage fails.
 */
public interface ObjectStore {

  /** Stores {@code content} as a blob and returns its hash. */
  ObjectHash putBlob(byte[] content);

  /**
   * Stores a tree with the given entries and returns its hash. Entry names must be distinct; the
   * store puts them in its canonical order, so the order they're given in doesn't matter.
   */
  ObjectHash putTree(List<TreeEntry> entries);

  /** Stores a commit of {@code tree} with the given message and parents and returns its hash. */
  ObjectHash putCommit(ObjectHash tree, String message, List<ObjectHash> parents);

  /**
   * Creates a branch named {@code branch} pointing to {@code commit}. Fails if the branch already
   * exists.
   */
  void setRef(String branch, ObjectHash commit);
}
