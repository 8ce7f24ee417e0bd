package com.acme.achnotify.job.render;

import com.acme.achnotify.core.PermanentException;
import com.acme.achnotify.core.TemplatePlaceholders;
import com.acme.achnotify.domain.PaymentRecord;
import com.acme.achnotify.domain.PrintTemplate;
import com.acme.achnotify.spi.PrintTemplateStore;
import com.acme.achnotify.spi.VoucherRenderer;
import jakarta.inject.Singleton;
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

/**
 * Renders a voucher by filling the print template with the payment's fields and laying the
 * result out as plain text on letter-sized pages.
 */
@Slf4j
@Singleton
public class PdfBoxVoucherRenderer implements VoucherRenderer {

  static final int MAX_LINE_CHARS = 90;

  private static final PDFont TITLE_FONT = PDType1Font.HELVETICA_BOLD;
  private static final PDFont BODY_FONT = PDType1Font.HELVETICA;
  private static final float TITLE_SIZE = 16f;
  private static final float BODY_SIZE = 11f;
  private static final float LEADING = 15f;
  private static final float MARGIN = 72f;

  private final PrintTemplateStore templateStore;

  public PdfBoxVoucherRenderer(PrintTemplateStore templateStore) {
    this.templateStore = templateStore;
  }

  @Override
  public byte[] renderVoucher(String printTemplateId, PaymentRecord payment) {
    PrintTemplate template = templateStore.findPrintTemplate(printTemplateId);
    String title = TemplatePlaceholders.fill(template.title(), payment.getFields());
    String body = TemplatePlaceholders.fill(template.body(), payment.getFields());
    try {
      byte[] pdf = layout(title, wrap(body));
      log.debug(
          "Rendered voucher for {} {} with template {} ({} bytes)",
          payment.getType(),
          payment.getId(),
          printTemplateId,
          pdf.length);
      return pdf;
    } catch (IOException e) {
      throw new PermanentException(
          "Unable to render voucher for " + payment.getId() + ": " + e.getMessage(), e);
    }
  }

  private byte[] layout(String title, List<String> lines) throws IOException {
    try (PDDocument document = new PDDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      PDRectangle pageSize = PDRectangle.LETTER;
      float top = pageSize.getHeight() - MARGIN;
      int linesPerPage = (int) ((top - MARGIN) / LEADING) - 2;

      int index = 0;
      boolean first = true;
      while (first || index < lines.size()) {
        PDPage page = new PDPage(pageSize);
        document.addPage(page);
        try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
          stream.beginText();
          stream.newLineAtOffset(MARGIN, top);
          stream.setLeading(LEADING);
          if (first) {
            stream.setFont(TITLE_FONT, TITLE_SIZE);
            stream.showText(printable(title));
            stream.newLine();
            stream.newLine();
          }
          stream.setFont(BODY_FONT, BODY_SIZE);
          int end = Math.min(lines.size(), index + linesPerPage);
          for (; index < end; index++) {
            stream.showText(printable(lines.get(index)));
            stream.newLine();
          }
          stream.endText();
        }
        first = false;
      }
      document.save(out);
      return out.toByteArray();
    }
  }

  static List<String> wrap(String text) {
    List<String> lines = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return lines;
    }
    for (String line : text.split("\\R", -1)) {
      String remaining = line.replace('\t', ' ');
      while (remaining.length() > MAX_LINE_CHARS) {
        int cut = remaining.lastIndexOf(' ', MAX_LINE_CHARS);
        if (cut <= 0) {
          cut = MAX_LINE_CHARS;
        }
        lines.add(remaining.substring(0, cut));
        remaining = remaining.substring(cut).stripLeading();
      }
      lines.add(remaining);
    }
    return lines;
  }

  /** Standard 14 fonts only encode WinAnsi; anything else becomes '?'. */
  static String printable(String text) {
    if (text == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      boolean ascii = c >= 0x20 && c <= 0x7E;
      boolean latin1 = c >= 0xA0 && c <= 0xFF;
      sb.append(ascii || latin1 ? c : '?');
    }
    return sb.toString();
  }
}
