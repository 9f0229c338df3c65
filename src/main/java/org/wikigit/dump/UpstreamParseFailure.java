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

import org.wikigit.WikiGitException;

/** Thrown when a dump file can't be read or isn't a well-formed MediaWiki export. */
public class UpstreamParseFailure extends WikiGitException {

  public UpstreamParseFailure(String msg) {
    super(format("Mediawiki parse error: %s", msg));
  }

  public UpstreamParseFailure(String msg, Throwable cause) {
    super(format("Mediawiki parse error: %s", msg), cause);
  }
}
