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

import static com.google.common.truth.Truth.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wikigit.extract.Citation.MetaData;
import org.wikigit.markup.MarkupConfig;
import org.wikigit.markup.MarkupParser;

@RunWith(JUnit4.class)
public class CitationExtractorTest {

  private final MarkupParser parser = new MarkupParser(MarkupConfig.plWikiquote());

  private ImmutableList<Citation> extract(String title, String wikitext) {
    return CitationExtractor.extract(parser.parse(wikitext), title);
  }

  @Test
  public void quotesWithMetadata() {
    ImmutableList<Citation> cites =
        extract(
            "Adam Mickiewicz",
            "Polski poeta.\n"
                + "* Litwo! Ojczyzno moja!\n"
                + "** Źródło: ''Pan Tadeusz''\n"
                + "** Opis:   inwokacja \n"
                + "** bez dwukropka\n"
                + "* Drugi [[cytat]]");
    assertThat(cites).hasSize(2);
    Citation first = cites.get(0);
    assertThat(first.text()).isEqualTo("Litwo! Ojczyzno moja!");
    assertThat(first.sections()).containsExactly("Adam Mickiewicz");
    assertThat(first.meta())
        .containsExactly(new MetaData("Źródło", "Pan Tadeusz"), new MetaData("Opis", "inwokacja"))
        .inOrder();
    assertThat(cites.get(1).text()).isEqualTo("Drugi cytat");
    assertThat(cites.get(1).meta()).isEmpty();
  }

  @Test
  public void headingsBuildSectionPath() {
    ImmutableList<Citation> cites =
        extract(
            "Autor",
            "* wstęp\n"
                + "== Dzieła ==\n"
                + "=== Wiersze ===\n"
                + "* wiersz\n"
                + "== Inne ==\n"
                + "* inny\n"
                + "==== Głęboko ====\n"
                + "* głęboki\n"
                + "= Nowy tytuł =\n"
                + "* ostatni");
    assertThat(cites.get(0).sections()).containsExactly("Autor");
    assertThat(cites.get(1).sections()).containsExactly("Autor", "Dzieła", "Wiersze").inOrder();
    assertThat(cites.get(2).sections()).containsExactly("Autor", "Inne").inOrder();
    assertThat(cites.get(3).sections())
        .containsExactly("Autor", "Inne", "", "Głęboko")
        .inOrder();
    assertThat(cites.get(4).sections()).containsExactly("Nowy tytuł");
  }

  @Test
  public void onlyTopLevelBulletsAreQuotes() {
    assertThat(extract("T", "# numerowane\n: wcięte\nakapit")).isEmpty();
  }

  @Test
  public void breadcrumbs() {
    CitationExtractor.Breadcrumbs breadcrumbs = new CitationExtractor.Breadcrumbs("T");
    breadcrumbs.update(3, "c");
    assertThat(breadcrumbs.stack).containsExactly("T", "", "c").inOrder();
    breadcrumbs.update(2, "b");
    assertThat(breadcrumbs.stack).containsExactly("T", "b").inOrder();
  }

  @Test
  public void render() {
    Citation cite =
        new Citation(
            "Cytat",
            ImmutableList.of("Autor", "Dzieła"),
            ImmutableList.of(new MetaData("Źródło", "Księga")));
    assertThat(cite.render()).isEqualTo("[Autor / Dzieła]\nCytat\n * Źródło: Księga\n");
    assertThat(new Citation("Sam", ImmutableList.of(), ImmutableList.of()).render())
        .isEqualTo("Sam\n");
  }

  @Test
  public void json() throws Exception {
    Citation cite =
        new Citation("Cytat", ImmutableList.of("Autor"), ImmutableList.of(new MetaData("k", "v")));
    ObjectMapper mapper = new ObjectMapper();
    String text = mapper.writeValueAsString(ImmutableMap.of("cites", ImmutableList.of(cite)));
    JsonNode json = mapper.readTree(text);
    JsonNode first = json.get("cites").get(0);
    assertThat(first.get("text").asText()).isEqualTo("Cytat");
    assertThat(first.get("sections").get(0).asText()).isEqualTo("Autor");
    assertThat(first.get("meta").get(0).get("key").asText()).isEqualTo("k");
    assertThat(first.get("meta").get(0).get("value").asText()).isEqualTo("v");
    assertThat(first.get("meta").get(0).get("links").size()).isEqualTo(0);
  }
}
