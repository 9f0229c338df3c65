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

package org.wikigit.compiler;

import org.wikigit.WikiGitException;

/** Thrown when there is no node to compile from: the graph has no node without a parent. */
public class NoRootFound extends WikiGitException {

  public NoRootFound(int graphSize) {
    super(format("No root category found! (graph has %s nodes)", graphSize));
  }
}
