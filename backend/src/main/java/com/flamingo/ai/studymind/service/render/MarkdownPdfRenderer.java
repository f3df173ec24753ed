package com.flamingo.ai.studymind.service.render;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.Text;
import org.commonmark.parser.Parser;
import org.springframework.stereotype.Component;

/**
 * Renders markdown to a simple paginated A4 PDF: headings in bold, paragraphs and list items
 * wrapped to the page width, code blocks in a monospace font.
 */
@Component
@Slf4j
public class MarkdownPdfRenderer {

  private static final Parser PARSER = Parser.builder().build();

  private static final float MARGIN = 56f;
  private static final float BODY_SIZE = 11f;
  private static final float LEADING = 1.4f;

  private final PDFont regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
  private final PDFont bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
  private final PDFont mono = new PDType1Font(Standard14Fonts.FontName.COURIER);

  /**
   * Renders a titled markdown document.
   *
   * @param title document title, printed as the first heading
   * @param markdown document body
   * @return PDF bytes
   * @throws IOException if PDFBox fails to write the document
   */
  public byte[] render(String title, String markdown) throws IOException {
    List<Block> blocks = new ArrayList<>();
    blocks.add(new Block(BlockKind.HEADING, 1, title));
    BlockCollector collector = new BlockCollector(blocks);
    PARSER.parse(markdown == null ? "" : markdown).accept(collector);

    try (PDDocument document = new PDDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      PageWriter writer = new PageWriter(document);
      try {
        for (Block block : blocks) {
          writeBlock(writer, block);
        }
      } finally {
        writer.close();
      }
      document.save(out);
      log.debug(
          "Rendered '{}' to PDF: {} blocks, {} pages",
          title,
          blocks.size(),
          document.getNumberOfPages());
      return out.toByteArray();
    }
  }

  private void writeBlock(PageWriter writer, Block block) throws IOException {
    switch (block.kind()) {
      case HEADING -> {
        float size = Math.max(BODY_SIZE + 1, 20f - (block.level() - 1) * 3f);
        writer.gap(size * 0.6f);
        writer.paragraph(bold, size, block.text(), 0f);
        writer.gap(size * 0.3f);
      }
      case LIST_ITEM -> writer.paragraph(regular, BODY_SIZE, block.text(), 14f);
      case CODE -> {
        for (String line : block.text().split("\n", -1)) {
          writer.paragraph(mono, BODY_SIZE - 1, line, 14f);
        }
        writer.gap(BODY_SIZE * 0.5f);
      }
      default -> {
        writer.paragraph(regular, BODY_SIZE, block.text(), 0f);
        writer.gap(BODY_SIZE * 0.5f);
      }
    }
  }

  /** Replaces characters the standard 14 fonts cannot encode. */
  private static String sanitize(PDFont font, String text) {
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      String ch =
          switch (c) {
            case '\u2018', '\u2019' -> "'";
            case '\u201C', '\u201D' -> "\"";
            case '\u2013', '\u2014' -> "-";
            case '\u2022' -> "*";
            case '\t' -> "    ";
            default -> String.valueOf(c);
          };
      try {
        font.encode(ch);
        sb.append(ch);
      } catch (IllegalArgumentException | IOException e) {
        sb.append('?');
      }
    }
    return sb.toString();
  }

  private enum BlockKind {
    HEADING,
    PARAGRAPH,
    LIST_ITEM,
    CODE
  }

  private record Block(BlockKind kind, int level, String text) {}

  /** Flattens the markdown tree into printable blocks. */
  private static final class BlockCollector extends AbstractVisitor {

    private final List<Block> blocks;

    BlockCollector(List<Block> blocks) {
      this.blocks = blocks;
    }

    @Override
    public void visit(Heading heading) {
      blocks.add(new Block(BlockKind.HEADING, heading.getLevel(), text(heading)));
    }

    @Override
    public void visit(Paragraph paragraph) {
      String text = text(paragraph);
      if (!text.isBlank()) {
        blocks.add(new Block(BlockKind.PARAGRAPH, 0, text));
      }
    }

    @Override
    public void visit(BulletList list) {
      addItems(list, false);
    }

    @Override
    public void visit(OrderedList list) {
      addItems(list, true);
    }

    @Override
    public void visit(FencedCodeBlock codeBlock) {
      blocks.add(new Block(BlockKind.CODE, 0, codeBlock.getLiteral().stripTrailing()));
    }

    @Override
    public void visit(IndentedCodeBlock codeBlock) {
      blocks.add(new Block(BlockKind.CODE, 0, codeBlock.getLiteral().stripTrailing()));
    }

    private void addItems(Node list, boolean ordered) {
      int number = 1;
      for (Node item = list.getFirstChild(); item != null; item = item.getNext()) {
        if (item instanceof ListItem) {
          String bullet = ordered ? (number++) + ". " : "- ";
          blocks.add(new Block(BlockKind.LIST_ITEM, 0, bullet + text(item)));
        }
      }
    }

    private static String text(Node node) {
      StringBuilder sb = new StringBuilder();
      collect(node, sb);
      return sb.toString().trim();
    }

    private static void collect(Node node, StringBuilder sb) {
      if (node instanceof Text text) {
        sb.append(text.getLiteral());
      } else if (node instanceof Code code) {
        sb.append(code.getLiteral());
      } else if (node instanceof SoftLineBreak || node instanceof HardLineBreak) {
        sb.append(' ');
      } else {
        for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
          if (child instanceof BulletList || child instanceof OrderedList) {
            sb.append(' ');
          }
          collect(child, sb);
        }
      }
    }
  }

  /** Writes wrapped lines top to bottom, opening a new page when the current one is full. */
  private static final class PageWriter {

    private final PDDocument document;
    private PDPageContentStream stream;
    private float y;
    private final float width = PDRectangle.A4.getWidth() - 2 * MARGIN;

    PageWriter(PDDocument document) throws IOException {
      this.document = document;
      newPage();
    }

    void paragraph(PDFont font, float size, String text, float indent) throws IOException {
      String safe = sanitize(font, text);
      for (String line : wrap(font, size, safe, width - indent)) {
        float lineHeight = size * LEADING;
        if (y - lineHeight < MARGIN) {
          newPage();
        }
        y -= lineHeight;
        stream.beginText();
        stream.setFont(font, size);
        stream.newLineAtOffset(MARGIN + indent, y);
        stream.showText(line);
        stream.endText();
      }
    }

    void gap(float height) {
      y -= height;
    }

    void close() throws IOException {
      if (stream != null) {
        stream.close();
        stream = null;
      }
    }

    private void newPage() throws IOException {
      close();
      PDPage page = new PDPage(PDRectangle.A4);
      document.addPage(page);
      stream = new PDPageContentStream(document, page);
      y = PDRectangle.A4.getHeight() - MARGIN;
    }

    private static List<String> wrap(PDFont font, float size, String text, float maxWidth)
        throws IOException {
      List<String> lines = new ArrayList<>();
      StringBuilder line = new StringBuilder();
      for (String word : text.split(" ")) {
        String candidate = line.length() == 0 ? word : line + " " + word;
        if (font.getStringWidth(candidate) / 1000 * size <= maxWidth || line.length() == 0) {
          line.setLength(0);
          line.append(candidate);
        } else {
          lines.add(line.toString());
          line.setLength(0);
          line.append(word);
        }
      }
      lines.add(line.toString());
      return lines;
    }
  }
}
