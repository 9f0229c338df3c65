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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * A quote taken from an article: its text, the headings of the sections enclosing it (starting with
 * the article title), and any {@code key: value} notes listed under it.
 */
public record Citation(
    @JsonProperty("text") String text,
    @JsonProperty("sections") ImmutableList<String> sections,
    @JsonProperty("meta") ImmutableList<MetaData> meta) {

  /** A {@code key: value} note, e.g. {@code Źródło: ...}. */
  public record MetaData(
      @JsonProperty("key") String key,
      @JsonProperty("value") String value,
      @JsonProperty("links") ImmutableList<String> links) {

    public MetaData(String key, String value) {
      this(key, value, ImmutableList.of());
    }
  }

  /**
   * Returns the form in which the citation is stored: the section path in brackets (if there is
   * one), the text, then one {@code " * key: value"} line per note.
   */
  public String render() {
    StringBuilder sb = new StringBuilder();
    if (!sections.isEmpty()) {
      sb.append('[').append(String.join(" / ", sections)).append("]\n");
    }
    sb.append(text).append('\n');
    for (MetaData m : meta) {
      sb.append(" * ").append(m.key).append(": ").append(m.value).append('\n');
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return render();
  }
}
