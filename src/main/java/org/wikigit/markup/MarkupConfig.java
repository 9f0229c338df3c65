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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.Locale;

/**
 * The site-specific parts of a wikitext dialect: namespace names, recognized extension tags, URL
 * protocols, and magic words.
 *
 * <p>A MarkupConfig is immutable; create one at startup (usually with {@link #plWikiquote}) and
 * pass it to the {@link MarkupParser} and {@link Normalizer} that need it.
 */
public final class MarkupConfig {

  /** Namespace names are stored lower-cased; magic words upper-cased. */
  private final ImmutableSet<String> categoryNamespaces;

  private final ImmutableSet<String> fileNamespaces;
  private final ImmutableSet<String> extensionTags;
  private final ImmutableList<String> protocols;
  private final ImmutableSet<String> magicWords;
  private final ImmutableSet<String> redirectMagicWords;
  private final String linkTrail;

  private MarkupConfig(Builder builder) {
    this.categoryNamespaces = builder.categoryNamespaces.build();
    this.fileNamespaces = builder.fileNamespaces.build();
    this.extensionTags = builder.extensionTags.build();
    this.protocols = builder.protocols.build();
    this.magicWords = builder.magicWords.build();
    this.redirectMagicWords = builder.redirectMagicWords.build();
    this.linkTrail = builder.linkTrail;
  }

  /**
   * Returns true if {@code namespace} (in any case, ignoring surrounding whitespace) names the
   * category namespace.
   */
  public boolean isCategoryNamespace(String namespace) {
    return categoryNamespaces.contains(namespace.strip().toLowerCase(Locale.ROOT));
  }

  /** Returns true if {@code namespace} (in any case) names the file namespace. */
  public boolean isFileNamespace(String namespace) {
    return fileNamespaces.contains(namespace.strip().toLowerCase(Locale.ROOT));
  }

  /** Returns true if {@code name} (in any case) is a tag provided by an extension. */
  public boolean isExtensionTag(String name) {
    return extensionTags.contains(name.toLowerCase(Locale.ROOT));
  }

  /** Returns true if {@code word} (without surrounding underscores) is a behavior switch. */
  public boolean isMagicWord(String word) {
    return magicWords.contains(word.toUpperCase(Locale.ROOT));
  }

  public boolean isRedirectMagicWord(String word) {
    return redirectMagicWords.contains(word.toUpperCase(Locale.ROOT));
  }

  /** Returns true if {@code url} starts with one of the configured protocols. */
  public boolean hasProtocol(String url) {
    for (String protocol : protocols) {
      if (url.length() >= protocol.length()
          && Ascii.equalsIgnoreCase(url.substring(0, protocol.length()), protocol)) {
        return true;
      }
    }
    return false;
  }

  /** Returns true if {@code ch} may follow a link's closing brackets and extend its text. */
  public boolean isLinkTrailChar(char ch) {
    return linkTrail.indexOf(ch) >= 0;
  }

  /** The configuration of pl.wikiquote.org. */
  public static MarkupConfig plWikiquote() {
    return PL_WIKIQUOTE;
  }

  private static final MarkupConfig PL_WIKIQUOTE =
      new Builder()
          .addCategoryNamespaces("category", "kategoria")
          .addExtensionTags(
              "categorytree",
              "ce",
              "charinsert",
              "chem",
              "dynamicpagelist",
              "gallery",
              "graph",
              "hiero",
              "imagemap",
              "indicator",
              "inputbox",
              "mapframe",
              "maplink",
              "math",
              "nowiki",
              "poem",
              "pre",
              "ref",
              "references",
              "score",
              "section",
              "source",
              "syntaxhighlight",
              "templatedata",
              "templatestyles",
              "timeline")
          .addFileNamespaces("file", "grafika", "image", "plik")
          .setLinkTrail("ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyzÓóĄąĆćĘęŁłŃńŚśŹźŻż")
          .addMagicWords(
              "BEZEDYCJISEKCJI",
              "BEZGALERII",
              "BEZSPISU",
              "DISAMBIG",
              "EXPECTUNUSEDCATEGORY",
              "FORCETOC",
              "HIDDENCAT",
              "INDEKSUJ",
              "INDEX",
              "KATEGORIAUKRYTA",
              "LINKNOWEJSEKCJI",
              "NEWSECTIONLINK",
              "NIEINDEKSUJ",
              "NOCC",
              "NOCONTENTCONVERT",
              "NOEDITSECTION",
              "NOGALLERY",
              "NOGLOBAL",
              "NOINDEX",
              "NONEWSECTIONLINK",
              "NOTC",
              "NOTITLECONVERT",
              "NOTOC",
              "POZIOMZABEZPIECZEŃ",
              "SPIS",
              "STATICREDIRECT",
              "TOC",
              "WYMUŚSPIS",
              "ZESPISEM")
          .addProtocols(
              "//",
              "bitcoin:",
              "ftp://",
              "ftps://",
              "geo:",
              "git://",
              "gopher://",
              "http://",
              "https://",
              "irc://",
              "ircs://",
              "magnet:",
              "mailto:",
              "mms://",
              "news:",
              "nntp://",
              "redis://",
              "sftp://",
              "sip:",
              "sips:",
              "sms:",
              "ssh://",
              "svn://",
              "tel:",
              "telnet://",
              "urn:",
              "worldwind://",
              "xmpp:")
          .addRedirectMagicWords("PATRZ", "PRZEKIERUJ", "REDIRECT", "TAM")
          .build();

  /** Accumulates the parts of a MarkupConfig. */
  public static final class Builder {
    private final ImmutableSet.Builder<String> categoryNamespaces = ImmutableSet.builder();
    private final ImmutableSet.Builder<String> fileNamespaces = ImmutableSet.builder();
    private final ImmutableSet.Builder<String> extensionTags = ImmutableSet.builder();
    private final ImmutableList.Builder<String> protocols = ImmutableList.builder();
    private final ImmutableSet.Builder<String> magicWords = ImmutableSet.builder();
    private final ImmutableSet.Builder<String> redirectMagicWords = ImmutableSet.builder();
    private String linkTrail = "";

    @CanIgnoreReturnValue
    public Builder addCategoryNamespaces(String... names) {
      Arrays.stream(names).map(n -> n.toLowerCase(Locale.ROOT)).forEach(categoryNamespaces::add);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addFileNamespaces(String... names) {
      Arrays.stream(names).map(n -> n.toLowerCase(Locale.ROOT)).forEach(fileNamespaces::add);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addExtensionTags(String... tags) {
      Arrays.stream(tags).map(n -> n.toLowerCase(Locale.ROOT)).forEach(extensionTags::add);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addProtocols(String... protocols) {
      this.protocols.add(protocols);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addMagicWords(String... words) {
      Arrays.stream(words).map(w -> w.toUpperCase(Locale.ROOT)).forEach(magicWords::add);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addRedirectMagicWords(String... words) {
      Arrays.stream(words).map(w -> w.toUpperCase(Locale.ROOT)).forEach(redirectMagicWords::add);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLinkTrail(String linkTrail) {
      this.linkTrail = linkTrail;
      return this;
    }

    public MarkupConfig build() {
      return new MarkupConfig(this);
    }
  }
}
