package com.flamingo.ai.studyplanner.service.segmentation;

import com.flamingo.ai.studyplanner.exception.DocumentProcessingException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineNode;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/**
 * {@link DocumentLoader} for PDF documents, backed by Apache PDFBox 3.x.
 *
 * <p>Text is extracted one page at a time so a page that fails to decode only blanks that page.
 * Bookmarks are flattened depth-first with their nesting depth and resolved to 1-based page
 * numbers; bookmarks without a resolvable page are dropped.
 */
@Component
@Slf4j
public class PdfBoxDocumentLoader implements DocumentLoader {

  private static final int MAX_OUTLINE_DEPTH = 6;

  @Override
  public LoadedDocument load(byte[] content, String fileName) {
    try (PDDocument pdfDoc = Loader.loadPDF(content)) {
      int totalPages = pdfDoc.getNumberOfPages();
      List<String> pageTexts = extractPageTexts(pdfDoc, totalPages, fileName);
      List<OutlineEntry> outline = extractOutline(pdfDoc);
      log.debug(
          "Loaded {}: {} pages, {} outline entries", fileName, totalPages, outline.size());
      return new LoadedDocument(fileName, totalPages, pageTexts, outline);
    } catch (IOException e) {
      log.error("PDFBox could not open {}: {}", fileName, e.getMessage());
      throw new DocumentProcessingException(fileName, "Failed to open PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String mimeType) {
    return "application/pdf".equalsIgnoreCase(mimeType);
  }

  // ---- private helpers ----

  private List<String> extractPageTexts(PDDocument pdfDoc, int totalPages, String fileName)
      throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    List<String> texts = new ArrayList<>(totalPages);
    for (int page = 1; page <= totalPages; page++) {
      stripper.setStartPage(page);
      stripper.setEndPage(page);
      try {
        texts.add(stripper.getText(pdfDoc));
      } catch (IOException | RuntimeException e) {
        log.warn("Could not read page {} of {}: {}", page, fileName, e.getMessage());
        texts.add("");
      }
    }
    return texts;
  }

  private List<OutlineEntry> extractOutline(PDDocument pdfDoc) {
    PDDocumentOutline outline = pdfDoc.getDocumentCatalog().getDocumentOutline();
    List<OutlineEntry> entries = new ArrayList<>();
    if (outline != null) {
      collectOutline(pdfDoc, outline, 1, entries);
    }
    return entries;
  }

  private void collectOutline(
      PDDocument pdfDoc, PDOutlineNode node, int depth, List<OutlineEntry> entries) {
    if (depth > MAX_OUTLINE_DEPTH) {
      return;
    }
    for (PDOutlineItem item : node.children()) {
      String title = item.getTitle();
      int page = resolvePage(pdfDoc, item);
      if (title != null && page > 0) {
        entries.add(new OutlineEntry(title, depth, page));
      } else {
        log.debug("Skipping outline entry '{}' without a resolvable page", title);
      }
      collectOutline(pdfDoc, item, depth + 1, entries);
    }
  }

  private int resolvePage(PDDocument pdfDoc, PDOutlineItem item) {
    try {
      PDPage page = item.findDestinationPage(pdfDoc);
      if (page == null) {
        return -1;
      }
      int index = pdfDoc.getPages().indexOf(page);
      return index < 0 ? -1 : index + 1;
    } catch (IOException e) {
      log.warn("Could not resolve outline entry '{}': {}", item.getTitle(), e.getMessage());
      return -1;
    }
  }
}
