package com.gentoro.docsearch.content.markdown;

import com.gentoro.docsearch.utility.TextUtility;
import com.vladsch.flexmark.ast.AutoLink;
import com.vladsch.flexmark.ast.BlockQuote;
import com.vladsch.flexmark.ast.BulletList;
import com.vladsch.flexmark.ast.Code;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.HardLineBreak;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.HtmlBlock;
import com.vladsch.flexmark.ast.HtmlCommentBlock;
import com.vladsch.flexmark.ast.HtmlInline;
import com.vladsch.flexmark.ast.HtmlInlineComment;
import com.vladsch.flexmark.ast.Image;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ast.ListItem;
import com.vladsch.flexmark.ast.MailLink;
import com.vladsch.flexmark.ast.OrderedList;
import com.vladsch.flexmark.ast.Paragraph;
import com.vladsch.flexmark.ast.Reference;
import com.vladsch.flexmark.ast.SoftLineBreak;
import com.vladsch.flexmark.ast.ThematicBreak;
import com.vladsch.flexmark.ext.tables.TableBlock;
import com.vladsch.flexmark.ext.tables.TableCell;
import com.vladsch.flexmark.ext.tables.TableRow;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured markdown conversion: parses with flexmark and walks the AST block by block, emitting
 * one paragraph per block. Tables are flattened row by row, lists item by item.
 */
public class FlexmarkMarkdownConverter implements MarkdownConverter {
  private final boolean keepSectionHeadings;
  private final Parser parser;

  public FlexmarkMarkdownConverter(boolean keepSectionHeadings) {
    this.keepSectionHeadings = keepSectionHeadings;
    MutableDataSet options = new MutableDataSet();
    options.set(Parser.EXTENSIONS, List.of(TablesExtension.create()));
    this.parser = Parser.builder(options).build();
  }

  @Override
  public String name() {
    return "flexmark";
  }

  @Override
  public String toPlainText(String markdown) {
    if (markdown == null || markdown.isBlank()) return "";
    Node root = parser.parse(markdown);
    List<String> blocks = new ArrayList<>();
    collectBlocks(root, blocks);
    return TextUtility.normalizeWhitespace(String.join("\n\n", blocks));
  }

  private void collectBlocks(Node parent, List<String> out) {
    for (Node node = parent.getFirstChild(); node != null; node = node.getNext()) {
      if (node instanceof Heading h) {
        String text = inlineText(h).trim();
        if (text.isEmpty()) continue;
        if (keepSectionHeadings && h.getLevel() >= 3) {
          out.add("#".repeat(h.getLevel()) + " " + text);
        } else {
          out.add(text);
        }
      } else if (node instanceof Paragraph) {
        addIfPresent(out, inlineText(node));
      } else if (node instanceof FencedCodeBlock code) {
        addIfPresent(out, codeText(code.getContentChars().toString()));
      } else if (node instanceof IndentedCodeBlock code) {
        addIfPresent(out, codeText(code.getContentChars().toString()));
      } else if (node instanceof BulletList || node instanceof OrderedList) {
        addIfPresent(out, listText(node));
      } else if (node instanceof TableBlock) {
        addIfPresent(out, tableText(node));
      } else if (node instanceof BlockQuote) {
        collectBlocks(node, out);
      } else if (node instanceof HtmlBlock
          || node instanceof HtmlCommentBlock
          || node instanceof ThematicBreak
          || node instanceof Reference) {
        // markup only
      } else if (node.hasChildren()) {
        collectBlocks(node, out);
      } else {
        addIfPresent(out, node.getChars().toString());
      }
    }
  }

  private String codeText(String code) {
    return keepSectionHeadings ? MarkdownConverter.escapeSectionMarkers(code) : code;
  }

  private String listText(Node list) {
    List<String> items = new ArrayList<>();
    for (Node item = list.getFirstChild(); item != null; item = item.getNext()) {
      if (!(item instanceof ListItem)) continue;
      List<String> parts = new ArrayList<>();
      collectBlocks(item, parts);
      if (!parts.isEmpty()) items.add(String.join("\n", parts));
    }
    return String.join("\n", items);
  }

  private String tableText(Node table) {
    List<String> rows = new ArrayList<>();
    for (Node node : table.getDescendants()) {
      if (!(node instanceof TableRow)) continue;
      List<String> cells = new ArrayList<>();
      for (Node cell = node.getFirstChild(); cell != null; cell = cell.getNext()) {
        if (cell instanceof TableCell) {
          String text = inlineText(cell).trim();
          if (!text.isEmpty()) cells.add(text);
        }
      }
      if (!cells.isEmpty()) rows.add(String.join(" ", cells));
    }
    return String.join("\n", rows);
  }

  private String inlineText(Node parent) {
    StringBuilder sb = new StringBuilder();
    appendInline(parent, sb);
    return sb.toString();
  }

  private void appendInline(Node parent, StringBuilder sb) {
    for (Node node = parent.getFirstChild(); node != null; node = node.getNext()) {
      if (node instanceof SoftLineBreak) {
        sb.append(' ');
      } else if (node instanceof HardLineBreak) {
        sb.append('\n');
      } else if (node instanceof Code code) {
        sb.append(code.getText());
      } else if (node instanceof Image image) {
        sb.append(image.getText());
      } else if (node instanceof AutoLink link) {
        sb.append(link.getText());
      } else if (node instanceof MailLink link) {
        sb.append(link.getText());
      } else if (node instanceof HtmlInline || node instanceof HtmlInlineComment) {
        // markup only
      } else if (node.hasChildren()) {
        appendInline(node, sb);
      } else {
        sb.append(node.getChars());
      }
    }
  }

  private static void addIfPresent(List<String> out, String text) {
    if (text != null && !text.isBlank()) {
      out.add(text.strip());
    }
  }
}
