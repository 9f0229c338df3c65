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

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

/**
 * The content hash of an object in an {@link ObjectStore}, as lower-case hex. Two objects with the
 * same content have the same hash.
 */
public record ObjectHash(String hex) {

  private static final CharMatcher HEX = CharMatcher.anyOf("0123456789abcdef");

  public ObjectHash {
    Preconditions.checkArgument(
        !hex.isEmpty() && HEX.matchesAllOf(hex), "Not a lower-case hex string: '%s'", hex);
  }

  public static ObjectHash of(String hex) {
    return new ObjectHash(Ascii.toLowerCase(hex));
  }

  @Override
  public String toString() {
    return hex;
  }
}
