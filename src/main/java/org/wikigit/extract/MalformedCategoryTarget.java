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

import org.wikigit.WikiGitException;

/**
 * Thrown when a category link's target does not normalize to a category. The parser and the
 * normalizer disagree about namespaces, so the graph can't be trusted.
 */
public class MalformedCategoryTarget extends WikiGitException {
  public final String target;

  public MalformedCategoryTarget(String target, String page) {
    super(format("Category target '%s' on page '%s' is not a category!", target, page));
    this.target = target;
  }
}
