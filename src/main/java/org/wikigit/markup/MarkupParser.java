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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.IntPredicate;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.wikigit.markup.MarkupNode.CharacterEntity;
import org.wikigit.markup.MarkupNode.DefinitionList;
import org.wikigit.markup.MarkupNode.ExternalLink;
import org.wikigit.markup.MarkupNode.Heading;
import org.wikigit.markup.MarkupNode.ListItem;
import org.wikigit.markup.MarkupNode.OrderedList;
import org.wikigit.markup.MarkupNode.Text;
import org.wikigit.markup.MarkupNode.UnorderedList;

/**
 * Parses the subset of wikitext that matters for category and quote extraction into a tree of
 * {@link MarkupNode}s.
 *
 * <p>The text is first split into tokens by the generated {@code WikitextLexer}. Templates and
 * tables are then matched up so that they can span lines, the tokens are split into lines, and
 * each line (or run of lines) is parsed as a heading, list, preformatted block, table, or
 * paragraph.
 *
 * <p>Parsing never fails: anything that doesn't form a recognized construct is kept as text.
 */
public final class MarkupParser {

  /** A token from the lexer; the parser rewrites some of them, so we keep our own copy. */
  private record Tok(int type, String text) {}

  /** Tags whose content is kept verbatim rather than parsed. */
  /** HTML tags MediaWiki accepts in wikitext; any other tag must come from an extension. */
  private static final ImmutableSet<String> HTML_TAGS =
      ImmutableSet.of(
          "abbr", "b", "bdi", "bdo", "big", "blockquote", "br", "caption", "center", "cite",
          "code", "data", "dd", "del", "dfn", "div", "dl", "dt", "em", "font", "h1", "h2", "h3",
          "h4", "h5", "h6", "hr", "i", "ins", "kbd", "li", "mark", "ol", "p", "q", "rb", "rp",
          "rt", "rtc", "ruby", "s", "samp", "small", "span", "strike", "strong", "sub", "sup",
          "table", "td", "th", "time", "tr", "tt", "u", "ul", "var", "wbr");

  private static final ImmutableSet<String> RAW_TAGS =
      ImmutableSet.of("nowiki", "pre", "math", "source", "syntaxhighlight", "score", "chem");

  private static final ImmutableMap<String, String> NAMED_ENTITIES =
      ImmutableMap.<String, String>builder()
          .put("amp", "&")
          .put("lt", "<")
          .put("gt", ">")
          .put("quot", "\"")
          .put("apos", "'")
          .put("nbsp", "\u00a0")
          .put("thinsp", "\u2009")
          .put("shy", "\u00ad")
          .put("ndash", "\u2013")
          .put("mdash", "\u2014")
          .put("minus", "\u2212")
          .put("hellip", "\u2026")
          .put("laquo", "\u00ab")
          .put("raquo", "\u00bb")
          .put("lsquo", "\u2018")
          .put("rsquo", "\u2019")
          .put("ldquo", "\u201c")
          .put("rdquo", "\u201d")
          .put("bdquo", "\u201e")
          .put("middot", "\u00b7")
          .put("times", "\u00d7")
          .put("deg", "\u00b0")
          .put("copy", "\u00a9")
          .put("lrm", "\u200e")
          .put("rlm", "\u200f")
          .buildOrThrow();

  private final MarkupConfig config;

  public MarkupParser(MarkupConfig config) {
    this.config = config;
  }

  /** Parses a page's text. */
  public ImmutableList<MarkupNode> parse(String text) {
    List<Tok> tokens = tokenize(text);
    balance(tokens, WikitextLexer.TEMPLATE_OPEN, WikitextLexer.TEMPLATE_CLOSE, i -> true);
    balance(
        tokens,
        WikitextLexer.TABLE_OPEN,
        WikitextLexer.TABLE_CLOSE,
        i -> i == 0 || tokens.get(i - 1).type == WikitextLexer.NEWLINE);
    return new BlockParser(splitLines(tokens)).parse();
  }

  private static List<Tok> tokenize(String text) {
    CharStream input = CharStreams.fromString(text);
    WikitextLexer lexer = new WikitextLexer(input);
    lexer.removeErrorListeners();
    List<Tok> result = new ArrayList<>();
    for (Token token : lexer.getAllTokens()) {
      int after = token.getStopIndex() + 1;
      if (token.getType() == WikitextLexer.TABLE_CLOSE
          && after < input.size()
          && input.getText(Interval.of(after, after)).equals("}")) {
        // "|}}" is much more often an empty last template argument than the end of a table.
        result.add(new Tok(WikitextLexer.PIPE, "|"));
        result.add(new Tok(WikitextLexer.OTHER, "}"));
      } else {
        result.add(new Tok(token.getType(), token.getText()));
      }
    }
    // Reassemble the "}" + "}" produced above into a TEMPLATE_CLOSE.
    List<Tok> merged = new ArrayList<>(result.size());
    for (Tok tok : result) {
      int last = merged.size() - 1;
      if (tok.type == WikitextLexer.OTHER
          && tok.text.equals("}")
          && last >= 0
          && merged.get(last).text.equals("}")
          && merged.get(last).type == WikitextLexer.OTHER) {
        merged.set(last, new Tok(WikitextLexer.TEMPLATE_CLOSE, "}}"));
      } else {
        merged.add(tok);
      }
    }
    return merged;
  }

  /**
   * Pairs up {@code open} and {@code close} tokens (only counting opens for which {@code canOpen}
   * is true) and turns any that are left unpaired into text.
   */
  private static void balance(List<Tok> tokens, int open, int close, IntPredicate canOpen) {
    Deque<Integer> stack = new ArrayDeque<>();
    boolean[] matched = new boolean[tokens.size()];
    for (int i = 0; i < tokens.size(); i++) {
      int type = tokens.get(i).type;
      if (type == open && canOpen.test(i)) {
        stack.push(i);
      } else if (type == close && !stack.isEmpty()) {
        matched[stack.pop()] = true;
        matched[i] = true;
      }
    }
    for (int i = 0; i < tokens.size(); i++) {
      Tok tok = tokens.get(i);
      if ((tok.type == open || tok.type == close) && !matched[i]) {
        tokens.set(i, new Tok(WikitextLexer.TEXT, tok.text));
      }
    }
  }

  /** Splits at newlines that are not inside a template or table. */
  private static List<List<Tok>> splitLines(List<Tok> tokens) {
    List<List<Tok>> lines = new ArrayList<>();
    List<Tok> current = new ArrayList<>();
    int depth = 0;
    for (Tok tok : tokens) {
      if (tok.type == WikitextLexer.TEMPLATE_OPEN || tok.type == WikitextLexer.TABLE_OPEN) {
        depth++;
      } else if (tok.type == WikitextLexer.TEMPLATE_CLOSE
          || tok.type == WikitextLexer.TABLE_CLOSE) {
        depth--;
      } else if (tok.type == WikitextLexer.NEWLINE && depth == 0) {
        lines.add(current);
        current = new ArrayList<>();
        continue;
      }
      current.add(tok);
    }
    lines.add(current);
    return lines;
  }

  private static String rawText(List<Tok> tokens, int from, int to) {
    StringBuilder sb = new StringBuilder();
    for (int i = from; i < to; i++) {
      sb.append(tokens.get(i).text);
    }
    return sb.toString();
  }

  private static boolean isBlank(List<Tok> tokens, int from, int to) {
    for (int i = from; i < to; i++) {
      if (tokens.get(i).type != WikitextLexer.SPACE) {
        return false;
      }
    }
    return true;
  }

  /** Appends text to {@code nodes}, merging it with a preceding Text node if there is one. */
  private static void addText(List<MarkupNode> nodes, String text) {
    if (text.isEmpty()) {
      return;
    }
    int last = nodes.size() - 1;
    if (last >= 0 && nodes.get(last) instanceof Text prev) {
      nodes.set(last, new Text(prev.value() + text));
    } else {
      nodes.add(new Text(text));
    }
  }

  /**
   * Returns the index of the {@code close} token matching an {@code open} that precedes {@code
   * from}, or -1 if there is none before {@code to}.
   */
  private static int findClose(List<Tok> tokens, int from, int to, int open, int close) {
    int depth = 0;
    for (int i = from; i < to; i++) {
      int type = tokens.get(i).type;
      if (type == open) {
        depth++;
      } else if (type == close) {
        if (depth == 0) {
          return i;
        }
        depth--;
      }
    }
    return -1;
  }

  /** Returns the indices of the pipes in the range that are not nested in a link or template. */
  private static List<Integer> topLevelPipes(List<Tok> tokens, int from, int to) {
    List<Integer> result = new ArrayList<>();
    int depth = 0;
    for (int i = from; i < to; i++) {
      int type = tokens.get(i).type;
      if (type == WikitextLexer.LINK_OPEN || type == WikitextLexer.TEMPLATE_OPEN) {
        depth++;
      } else if (type == WikitextLexer.LINK_CLOSE || type == WikitextLexer.TEMPLATE_CLOSE) {
        depth = Math.max(0, depth - 1);
      } else if (type == WikitextLexer.PIPE && depth == 0) {
        result.add(i);
      }
    }
    return result;
  }

  /** Returns true if {@code name} is an HTML tag or one of the configured extension tags. */
  private boolean isKnownTag(String name) {
    return HTML_TAGS.contains(name) || config.isExtensionTag(name);
  }

  private static String tagName(String tagText) {
    int start = tagText.startsWith("</") ? 2 : 1;
    int end = start;
    while (end < tagText.length() && Character.isLetterOrDigit(tagText.charAt(end))) {
      end++;
    }
    return Ascii.toLowerCase(tagText.substring(start, end));
  }

  /** Parses lines into block-level nodes. */
  private class BlockParser {
    final List<List<Tok>> lines;
    final List<MarkupNode> nodes = new ArrayList<>();
    int next;
    boolean inParagraph;

    BlockParser(List<List<Tok>> lines) {
      this.lines = lines;
    }

    ImmutableList<MarkupNode> parse() {
      parseRedirect();
      while (next < lines.size()) {
        List<Tok> line = lines.get(next);
        if (isBlank(line, 0, line.size())) {
          if (inParagraph) {
            nodes.add(new MarkupNode.ParagraphBreak());
            inParagraph = false;
          }
          next++;
          continue;
        }
        Tok first = line.get(0);
        if (first.type == WikitextLexer.TABLE_OPEN) {
          nodes.add(new MarkupNode.Table());
          endParagraph();
          next++;
        } else if (first.type == WikitextLexer.LIST_MARKS) {
          parseLists();
        } else if (parseHeading(line)) {
          next++;
        } else if (first.type == WikitextLexer.SPACE) {
          parsePreformatted();
        } else {
          List<MarkupNode> inline = inline(line, 0, line.size());
          if (!inline.isEmpty()) {
            if (inParagraph) {
              addText(nodes, "\n");
            }
            for (MarkupNode node : inline) {
              if (node instanceof Text text) {
                addText(nodes, text.value());
              } else {
                nodes.add(node);
              }
            }
            inParagraph = true;
          }
          next++;
        }
      }
      return ImmutableList.copyOf(nodes);
    }

    void endParagraph() {
      inParagraph = false;
    }

    /** Handles {@code #REDIRECT [[target]]} on the first line. */
    void parseRedirect() {
      if (lines.isEmpty()) {
        return;
      }
      List<Tok> line = lines.get(0);
      if (line.size() < 3
          || line.get(0).type != WikitextLexer.LIST_MARKS
          || !line.get(0).text.equals("#")
          || line.get(1).type != WikitextLexer.TEXT
          || !config.isRedirectMagicWord(line.get(1).text)) {
        return;
      }
      int pos = 2;
      while (pos < line.size()
          && (line.get(pos).type == WikitextLexer.SPACE
              || line.get(pos).type == WikitextLexer.LIST_MARKS)) {
        pos++;
      }
      if (pos >= line.size() || line.get(pos).type != WikitextLexer.LINK_OPEN) {
        return;
      }
      int close =
          findClose(line, pos + 1, line.size(), WikitextLexer.LINK_OPEN, WikitextLexer.LINK_CLOSE);
      if (close < 0) {
        return;
      }
      List<Integer> pipes = topLevelPipes(line, pos + 1, close);
      int targetEnd = pipes.isEmpty() ? close : pipes.get(0);
      nodes.add(new MarkupNode.Redirect(rawText(line, pos + 1, targetEnd).strip()));
      nodes.addAll(inline(line, close + 1, line.size()));
      next = 1;
    }

    /** If {@code line} is a heading, adds it and returns true. */
    boolean parseHeading(List<Tok> line) {
      int end = line.size();
      while (end > 0 && line.get(end - 1).type == WikitextLexer.SPACE) {
        end--;
      }
      if (end < 2
          || line.get(0).type != WikitextLexer.EQUALS
          || line.get(end - 1).type != WikitextLexer.EQUALS) {
        return false;
      }
      int open = line.get(0).text.length();
      int close = line.get(end - 1).text.length();
      int level = Math.min(Math.min(open, close), 6);
      List<MarkupNode> children = new ArrayList<>();
      addText(children, "=".repeat(open - level));
      int from = 1;
      int to = end - 1;
      while (from < to && line.get(from).type == WikitextLexer.SPACE) {
        from++;
      }
      while (to > from && line.get(to - 1).type == WikitextLexer.SPACE) {
        to--;
      }
      for (MarkupNode node : inline(line, from, to)) {
        if (node instanceof Text text) {
          addText(children, text.value());
        } else {
          children.add(node);
        }
      }
      addText(children, "=".repeat(close - level));
      nodes.add(new Heading(level, ImmutableList.copyOf(children)));
      endParagraph();
      return true;
    }

    /** Consumes consecutive lines starting with a space. */
    void parsePreformatted() {
      List<MarkupNode> children = new ArrayList<>();
      while (next < lines.size()) {
        List<Tok> line = lines.get(next);
        if (line.isEmpty()
            || line.get(0).type != WikitextLexer.SPACE
            || isBlank(line, 0, line.size())) {
          break;
        }
        if (!children.isEmpty()) {
          addText(children, "\n");
        }
        // Only the first character of the leading space marks the block.
        String lead = line.get(0).text.substring(1);
        addText(children, lead);
        for (MarkupNode node : inline(line, 1, line.size())) {
          if (node instanceof Text text) {
            addText(children, text.value());
          } else {
            children.add(node);
          }
        }
        next++;
      }
      nodes.add(new MarkupNode.Preformatted(ImmutableList.copyOf(children)));
      endParagraph();
    }

    /** Consumes consecutive list lines and adds the (possibly nested) lists they form. */
    void parseLists() {
      List<ListLine> listLines = new ArrayList<>();
      while (next < lines.size()) {
        List<Tok> line = lines.get(next);
        if (line.isEmpty() || line.get(0).type != WikitextLexer.LIST_MARKS) {
          break;
        }
        int from = 1;
        while (from < line.size() && line.get(from).type == WikitextLexer.SPACE) {
          from++;
        }
        listLines.add(new ListLine(line.get(0).text, inline(line, from, line.size())));
        next++;
      }
      nodes.addAll(buildLists(listLines, 0));
      endParagraph();
    }

    ImmutableList<MarkupNode> inline(List<Tok> tokens, int from, int to) {
      return new InlineParser(tokens).parse(from, to);
    }
  }

  /** A list line: its markers (e.g. {@code "*#"}) and its parsed content. */
  private record ListLine(String marks, ImmutableList<MarkupNode> content) {}

  private enum ListKind {
    UNORDERED,
    ORDERED,
    DEFINITION;

    static ListKind of(char mark) {
      return switch (mark) {
        case '*' -> UNORDERED;
        case '#' -> ORDERED;
        default -> DEFINITION;
      };
    }
  }

  /**
   * Builds the lists formed by {@code lines}, all of which have at least {@code depth + 1}
   * markers. Lines with more markers are nested in the preceding item.
   */
  private static List<MarkupNode> buildLists(List<ListLine> lines, int depth) {
    List<MarkupNode> result = new ArrayList<>();
    ListKind kind = null;
    List<List<MarkupNode>> items = new ArrayList<>();
    int i = 0;
    while (i < lines.size()) {
      ListLine line = lines.get(i);
      ListKind lineKind = ListKind.of(line.marks.charAt(depth));
      if (lineKind != kind) {
        if (kind != null) {
          result.add(makeList(kind, items));
        }
        kind = lineKind;
        items = new ArrayList<>();
      }
      if (line.marks.length() == depth + 1) {
        items.add(new ArrayList<>(line.content));
        i++;
      } else {
        int j = i;
        while (j < lines.size()
            && lines.get(j).marks.length() > depth + 1
            && ListKind.of(lines.get(j).marks.charAt(depth)) == kind) {
          j++;
        }
        if (items.isEmpty()) {
          items.add(new ArrayList<>());
        }
        items.get(items.size() - 1).addAll(buildLists(lines.subList(i, j), depth + 1));
        i = j;
      }
    }
    if (kind != null) {
      result.add(makeList(kind, items));
    }
    return result;
  }

  private static MarkupNode makeList(ListKind kind, List<List<MarkupNode>> items) {
    ImmutableList<ListItem> listItems =
        items.stream()
            .map(children -> new ListItem(ImmutableList.copyOf(children)))
            .collect(ImmutableList.toImmutableList());
    return switch (kind) {
      case UNORDERED -> new UnorderedList(listItems);
      case ORDERED -> new OrderedList(listItems);
      case DEFINITION -> new DefinitionList(listItems);
    };
  }

  /** Parses links, templates, tags and text within part of a line. */
  private class InlineParser {
    final List<Tok> tokens;

    InlineParser(List<Tok> tokens) {
      this.tokens = tokens;
    }

    ImmutableList<MarkupNode> parse(int from, int to) {
      List<MarkupNode> result = new ArrayList<>();
      int pos = from;
      while (pos < to) {
        pos = parseOne(pos, to, result);
      }
      return ImmutableList.copyOf(result);
    }

    /** Parses the construct at {@code pos} into {@code out} and returns the next position. */
    int parseOne(int pos, int to, List<MarkupNode> out) {
      Tok tok = tokens.get(pos);
      switch (tok.type) {
        case WikitextLexer.LINK_OPEN:
          return parseLink(pos, to, out);
        case WikitextLexer.TEMPLATE_OPEN:
          {
            int close =
                findClose(
                    tokens, pos + 1, to, WikitextLexer.TEMPLATE_OPEN, WikitextLexer.TEMPLATE_CLOSE);
            if (close < 0) {
              break;
            }
            List<Integer> pipes = topLevelPipes(tokens, pos + 1, close);
            int nameEnd = pipes.isEmpty() ? close : pipes.get(0);
            out.add(new MarkupNode.Template(rawText(tokens, pos + 1, nameEnd).strip()));
            return close + 1;
          }
        case WikitextLexer.TABLE_OPEN:
          {
            int close =
                findClose(tokens, pos + 1, to, WikitextLexer.TABLE_OPEN, WikitextLexer.TABLE_CLOSE);
            if (close < 0) {
              break;
            }
            out.add(new MarkupNode.Table());
            return close + 1;
          }
        case WikitextLexer.BRACKET_OPEN:
          return parseExternalLink(pos, to, out);
        case WikitextLexer.START_TAG:
          return parseTag(pos, to, out);
        case WikitextLexer.END_TAG:
          // A stray end tag of a known tag contributes nothing.
          if (!isKnownTag(tagName(tok.text))) {
            addText(out, tok.text);
          }
          return pos + 1;
        case WikitextLexer.APOSTROPHES:
          // Bold and italic toggles contribute nothing.
          return pos + 1;
        case WikitextLexer.ENTITY:
          out.add(decodeEntity(tok.text));
          return pos + 1;
        case WikitextLexer.MAGIC_WORD:
          if (config.isMagicWord(tok.text.substring(2, tok.text.length() - 2))) {
            return pos + 1;
          }
          break;
        default:
          break;
      }
      addText(out, tok.text);
      return pos + 1;
    }

    int parseLink(int pos, int to, List<MarkupNode> out) {
      int close =
          findClose(tokens, pos + 1, to, WikitextLexer.LINK_OPEN, WikitextLexer.LINK_CLOSE);
      if (close < 0) {
        addText(out, tokens.get(pos).text);
        return pos + 1;
      }
      List<Integer> pipes = topLevelPipes(tokens, pos + 1, close);
      int targetEnd = pipes.isEmpty() ? close : pipes.get(0);
      String written = rawText(tokens, pos + 1, targetEnd).strip();
      boolean leadingColon = written.startsWith(":");
      String target = leadingColon ? written.substring(1).strip() : written;
      int colon = target.indexOf(':');
      String namespace = colon > 0 ? target.substring(0, colon) : "";
      if (!leadingColon && colon > 0 && config.isCategoryNamespace(namespace)) {
        ImmutableList<MarkupNode> sortKey =
            pipes.isEmpty() ? ImmutableList.of() : parse(pipes.get(0) + 1, close);
        out.add(new MarkupNode.Category(target, sortKey));
        return close + 1;
      }
      if (!leadingColon && colon > 0 && config.isFileNamespace(namespace)) {
        // The caption is the last argument; the others are display options.
        ImmutableList<MarkupNode> caption =
            pipes.isEmpty() ? ImmutableList.of() : parse(pipes.get(pipes.size() - 1) + 1, close);
        out.add(new MarkupNode.Image(target, caption));
        return close + 1;
      }
      List<MarkupNode> children = new ArrayList<>();
      if (pipes.isEmpty()) {
        addText(children, target);
      } else {
        children.addAll(parse(pipes.get(0) + 1, close));
      }
      int next = close + 1;
      if (next < to && tokens.get(next).type == WikitextLexer.TEXT) {
        String following = tokens.get(next).text;
        int trail = 0;
        while (trail < following.length() && config.isLinkTrailChar(following.charAt(trail))) {
          trail++;
        }
        if (trail > 0) {
          addText(children, following.substring(0, trail));
          if (trail == following.length()) {
            next++;
          } else {
            tokens.set(next, new Tok(WikitextLexer.TEXT, following.substring(trail)));
          }
        }
      }
      out.add(new MarkupNode.Link(target, ImmutableList.copyOf(children)));
      return next;
    }

    int parseExternalLink(int pos, int to, List<MarkupNode> out) {
      int close = -1;
      int space = -1;
      for (int i = pos + 1; i < to; i++) {
        int type = tokens.get(i).type;
        if (type == WikitextLexer.BRACKET_CLOSE) {
          close = i;
          break;
        } else if (type == WikitextLexer.SPACE && space < 0) {
          space = i;
        }
      }
      if (close < 0) {
        addText(out, tokens.get(pos).text);
        return pos + 1;
      }
      String url = rawText(tokens, pos + 1, space < 0 ? close : space);
      if (!config.hasProtocol(url)) {
        addText(out, tokens.get(pos).text);
        return pos + 1;
      }
      ImmutableList<MarkupNode> children =
          space < 0 ? ImmutableList.of() : parse(space + 1, close);
      out.add(new ExternalLink(url, children));
      return close + 1;
    }

    int parseTag(int pos, int to, List<MarkupNode> out) {
      String text = tokens.get(pos).text;
      String name = tagName(text);
      if (!isKnownTag(name)) {
        addText(out, text);
        return pos + 1;
      }
      if (text.endsWith("/>")) {
        out.add(new MarkupNode.StartTag(name));
        return pos + 1;
      }
      int depth = 0;
      int close = -1;
      for (int i = pos + 1; i < to && close < 0; i++) {
        Tok tok = tokens.get(i);
        if (tok.type == WikitextLexer.START_TAG
            && !tok.text.endsWith("/>")
            && tagName(tok.text).equals(name)) {
          depth++;
        } else if (tok.type == WikitextLexer.END_TAG && tagName(tok.text).equals(name)) {
          if (depth == 0) {
            close = i;
          } else {
            depth--;
          }
        }
      }
      if (close < 0) {
        out.add(new MarkupNode.StartTag(name));
        return pos + 1;
      }
      ImmutableList<MarkupNode> children =
          RAW_TAGS.contains(name)
              ? ImmutableList.of(new Text(rawText(tokens, pos + 1, close)))
              : parse(pos + 1, close);
      out.add(new MarkupNode.Tag(name, children));
      return close + 1;
    }
  }

  private static MarkupNode decodeEntity(String text) {
    String body = text.substring(1, text.length() - 1);
    if (body.startsWith("#")) {
      try {
        int codePoint =
            (body.length() > 1 && (body.charAt(1) == 'x' || body.charAt(1) == 'X'))
                ? Integer.parseInt(body.substring(2), 16)
                : Integer.parseInt(body.substring(1));
        if (Character.isValidCodePoint(codePoint)) {
          return new CharacterEntity(new String(Character.toChars(codePoint)));
        }
      } catch (NumberFormatException e) {
        // Too many digits for an int; keep the reference as written.
        return new Text(text);
      }
      return new Text(text);
    }
    String decoded = NAMED_ENTITIES.get(body);
    return (decoded != null) ? new CharacterEntity(decoded) : new Text(text);
  }
}
