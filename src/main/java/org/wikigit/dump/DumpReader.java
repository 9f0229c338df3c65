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

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.jspecify.annotations.Nullable;

/**
 * Streams the pages of a MediaWiki XML export, one at a time.
 *
 * <p>Only the last revision of each page is kept. Elements other than {@code title}, {@code ns} and
 * the revision's {@code model}, {@code format} and {@code text} are ignored.
 *
 * <p>Iteration throws {@link UpstreamParseFailure} if the XML is malformed or the underlying stream
 * fails; the reader can't continue past such an error.
 */
public final class DumpReader extends AbstractIterator<Page> implements AutoCloseable {

  /**
   * JDK parser limits on entity expansion. Dumps escape every markup character in page text, so a
   * full dump expands far more entities than the defaults allow; "0" removes the limit.
   */
  private static final ImmutableList<String> ENTITY_LIMITS =
      ImmutableList.of(
          "http://www.oracle.com/xml/jaxp/properties/totalEntitySizeLimit",
          "http://www.oracle.com/xml/jaxp/properties/maxGeneralEntitySizeLimit");

  private final InputStream input;
  private final XMLStreamReader xml;

  public DumpReader(InputStream input) {
    this.input = input;
    XMLInputFactory factory = XMLInputFactory.newFactory();
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    for (String limit : ENTITY_LIMITS) {
      if (factory.isPropertySupported(limit)) {
        factory.setProperty(limit, "0");
      }
    }
    try {
      this.xml = factory.createXMLStreamReader(input, "UTF-8");
    } catch (XMLStreamException e) {
      throw new UpstreamParseFailure(e.getMessage(), e);
    }
  }

  /** Opens a dump file; names ending in {@code .bz2} are decompressed on the fly. */
  public static DumpReader open(Path file) throws IOException {
    InputStream in = new BufferedInputStream(Files.newInputStream(file));
    if (file.getFileName().toString().endsWith(".bz2")) {
      try {
        // Wikimedia publishes multistream archives, so keep reading past the first stream.
        in = new BufferedInputStream(new BZip2CompressorInputStream(in, true));
      } catch (IOException e) {
        in.close();
        throw e;
      }
    }
    return new DumpReader(in);
  }

  @Override
  protected @Nullable Page computeNext() {
    try {
      while (xml.hasNext()) {
        if (xml.next() == XMLStreamConstants.START_ELEMENT
            && xml.getLocalName().equals("page")) {
          return readPage();
        }
      }
      return endOfData();
    } catch (XMLStreamException e) {
      throw new UpstreamParseFailure(e.getMessage(), e);
    }
  }

  /** Reads the contents of a {@code page} element; the reader is positioned at its start. */
  private Page readPage() throws XMLStreamException {
    String title = null;
    int namespace = -1;
    String text = "";
    String format = null;
    String model = null;
    int depth = 1;
    while (depth > 0) {
      int event = xml.next();
      if (event == XMLStreamConstants.END_ELEMENT) {
        depth--;
      } else if (event == XMLStreamConstants.START_ELEMENT) {
        // getElementText() consumes the end element, so those cases leave depth unchanged.
        switch (xml.getLocalName()) {
          case "title" -> title = xml.getElementText();
          case "ns" -> namespace = parseNamespace(xml.getElementText());
          case "model" -> model = xml.getElementText();
          case "format" -> format = xml.getElementText();
          case "text" -> text = xml.getElementText();
          default -> depth++;
        }
      } else if (event == XMLStreamConstants.END_DOCUMENT) {
        throw new UpstreamParseFailure("unexpected end of dump inside <page>");
      }
    }
    if (title == null) {
      throw new UpstreamParseFailure("<page> without <title>");
    }
    return new Page(namespace, title, text, format, model);
  }

  private static int parseNamespace(String ns) {
    try {
      return Integer.parseInt(ns.strip());
    } catch (NumberFormatException e) {
      throw new UpstreamParseFailure("bad namespace '" + ns + "'", e);
    }
  }

  @Override
  public void close() throws IOException {
    try {
      xml.close();
    } catch (XMLStreamException e) {
      throw new IOException(e);
    } finally {
      input.close();
    }
  }
}
