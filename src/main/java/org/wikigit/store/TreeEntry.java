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

import com.google.common.base.Preconditions;

/** A named reference from a tree to a blob or another tree. */
public record TreeEntry(String name, Mode mode, ObjectHash id) {

  /** The kind of object an entry refers to, with its git file mode. */
  public enum Mode {
    FILE(0100644),
    TREE(0040000);

    public final int bits;

    Mode(int bits) {
      this.bits = bits;
    }
  }

  public TreeEntry {
    Preconditions.checkArgument(!name.isEmpty(), "Empty entry name");
    Preconditions.checkArgument(
        name.indexOf('/') < 0 && name.indexOf('\0') < 0, "Bad entry name '%s'", name);
  }
}
