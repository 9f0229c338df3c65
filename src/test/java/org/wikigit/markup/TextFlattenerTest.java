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

package org.wikigit.markup;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wikigit.markup.MarkupNode.ListItem;
import org.wikigit.markup.MarkupNode.Text;
import org.wikigit.markup.MarkupNode.UnorderedList;

@RunWith(JUnit4.class)
public class TextFlattenerTest {

  private final MarkupParser parser = new MarkupParser(MarkupConfig.plWikiquote());

  private String flatten(String wikitext) {
    return TextFlattener.flatten(parser.parse(wikitext));
  }

  @Test
  public void keepsLinkText() {
    assertThat(flatten("a [[b|c]] d [http://x.pl e]")).isEqualTo("a c d e");
  }

  @Test
  public void dropsTemplatesAndCategories() {
    assertThat(flatten("x{{szablon|1}}[[Kategoria:K|klucz]]y")).isEqualTo("xy");
  }

  @Test
  public void imagesAndBreaks() {
    assertThat(flatten("[[Plik:x.jpg|podpis]]")).isEqualTo("[podpis]");
    assertThat(flatten("a<br>b")).isEqualTo("a\nb");
    assertThat(flatten("a&nbsp;b")).isEqualTo("a\u00a0b");
  }

  @Test
  public void tagsAndHeadings() {
    assertThat(flatten("== Tytuł ==")).isEqualTo("Tytuł");
    assertThat(flatten("a<small>b</small>c")).isEqualTo("abc");
  }

  @Test
  public void listsAreOptional() {
    UnorderedList sublist =
        new UnorderedList(ImmutableList.of(new ListItem(ImmutableList.of(new Text(" meta")))));
    ListItem item = new ListItem(ImmutableList.of(new Text("cytat"), sublist));
    assertThat(new TextFlattener(false).add(item).result()).isEqualTo("cytat");
    assertThat(new TextFlattener(true).add(item).result()).isEqualTo("cytat meta");
  }

  @Test
  public void accumulates() {
    TextFlattener flattener = new TextFlattener();
    flattener.add(new Text("a")).add(ImmutableList.of(new Text("b"), new Text("c")));
    assertThat(flattener.result()).isEqualTo("abc");
  }
}
