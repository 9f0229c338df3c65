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

package org.wikigit;

import com.google.errorprone.annotations.FormatMethod;

/**
 * The superclass of the errors that abort a run: bad input data, a graph with no root, or a failure
 * of the object store.
 *
 * <p>Detected cycles are not errors, and programmer errors (such as asking for a node that doesn't
 * exist) throw the usual IllegalArgumentException or IllegalStateException instead.
 */
public abstract class WikiGitException extends RuntimeException {

  protected WikiGitException(String msg) {
    super(msg);
  }

  protected WikiGitException(String msg, Throwable cause) {
    super(msg, cause);
  }

  @FormatMethod
  protected static String format(String fmt, Object... fmtArgs) {
    return String.format(fmt, fmtArgs);
  }
}
