package com.flamingo.ai.studyplanner.service.segmentation;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Derives the ordered section boundaries of a document.
 *
 * <p>Three tiers are tried in order, each adding to the markers found so far:
 *
 * <ol>
 *   <li><strong>Outline</strong>: bookmarks up to depth 2 that are not front or back matter.
 *   <li><strong>Heading scan</strong>: when the outline produced fewer than 3 markers, the first
 *       lines of every page are matched against chapter, unit, module and numbered-heading forms. A
 *       running header repeated on every page counts once, at its first page.
 *   <li><strong>Fixed chunks</strong>: when fewer than 2 markers exist, the page range is cut into
 *       chunks of {@code max(20, pages / 10)} pages.
 * </ol>
 *
 * <p>The denylist is matched as a substring, so a real chapter named "Appendix: Worked Examples" is
 * dropped along with the appendix itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentStructureExtractor {

  static final Set<String> NON_CONTENT_SECTIONS =
      Set.of(
          "contents", "index", "bibliography", "references", "glossary", "acknowledgment",
          "preface", "foreword", "dedication", "about the author", "table of contents",
          "list of figures", "list of tables", "credits", "back cover", "front cover", "cover",
          "title page", "copyright", "copyright page", "appendix", "answers", "data sets",
          "websites", "odd-numbered", "even-numbered");

  private static final List<Pattern> HEADING_PATTERNS =
      List.of(
          Pattern.compile("^Chapter\\s+\\d+", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^Unit\\s+\\d+", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^Module\\s+\\d+", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\d+\\.\\s+[A-Z][a-z]"));

  private static final int MIN_HEADING_LENGTH = 5;
  private static final int MAX_HEADING_LENGTH = 80;

  private final PlannerConfig plannerConfig;

  /**
   * Extracts section markers, sorted by page and free of duplicates. Never empty.
   *
   * @param document the loaded document
   * @return section markers in page order
   */
  public List<SectionMarker> extract(LoadedDocument document) {
    PlannerConfig.Segmentation config = plannerConfig.getSegmentation();
    List<SectionMarker> markers = new ArrayList<>(fromOutline(document, config));
    log.debug("Outline tier found {} sections in {}", markers.size(), document.fileName());

    if (markers.size() < config.getMinOutlineEntries()) {
      List<SectionMarker> headings = scanHeadings(document, config);
      log.debug("Heading tier found {} sections in {}", headings.size(), document.fileName());
      markers.addAll(headings);
    }

    if (markers.size() < config.getMinHeadingEntries()) {
      List<SectionMarker> chunks = fixedChunks(document.totalPages(), config);
      log.debug("Falling back to {} page chunks for {}", chunks.size(), document.fileName());
      markers.addAll(chunks);
    }

    List<SectionMarker> ordered = new ArrayList<>(new LinkedHashSet<>(markers));
    ordered.sort(Comparator.comparingInt(SectionMarker::page));
    return ordered;
  }

  static boolean isNonContent(String title) {
    String lower = title.toLowerCase(Locale.ROOT);
    return NON_CONTENT_SECTIONS.stream().anyMatch(lower::contains);
  }

  // ---- tiers ----

  private List<SectionMarker> fromOutline(
      LoadedDocument document, PlannerConfig.Segmentation config) {
    List<SectionMarker> markers = new ArrayList<>();
    for (OutlineEntry entry : document.outline()) {
      String title = entry.title().trim();
      if (entry.depth() <= config.getMaxOutlineDepth()
          && title.length() > 2
          && !isNonContent(title)) {
        markers.add(new SectionMarker(title, entry.page()));
      }
    }
    return markers;
  }

  private List<SectionMarker> scanHeadings(
      LoadedDocument document, PlannerConfig.Segmentation config) {
    List<SectionMarker> markers = new ArrayList<>();
    Set<String> seen = new HashSet<>();

    for (int page = 1; page <= document.totalPages(); page++) {
      String[] lines = document.pageText(page).split("\\R");
      int limit = Math.min(lines.length, config.getHeadingScanLines());
      for (int i = 0; i < limit; i++) {
        String line = lines[i].trim();
        if (isHeading(line) && seen.add(line)) {
          markers.add(new SectionMarker(line, page));
        }
      }
    }
    return markers;
  }

  private boolean isHeading(String line) {
    if (line.length() <= MIN_HEADING_LENGTH || line.length() >= MAX_HEADING_LENGTH) {
      return false;
    }
    if (NON_CONTENT_SECTIONS.contains(line.toLowerCase(Locale.ROOT))) {
      return false;
    }
    return HEADING_PATTERNS.stream().anyMatch(p -> p.matcher(line).find());
  }

  private List<SectionMarker> fixedChunks(int totalPages, PlannerConfig.Segmentation config) {
    int pages = Math.max(1, totalPages);
    int pagesPerChunk = Math.max(config.getMinChunkPages(), pages / 10);
    List<SectionMarker> chunks = new ArrayList<>();
    for (int start = 0; start < pages; start += pagesPerChunk) {
      int end = Math.min(start + pagesPerChunk, pages);
      String title =
          String.format("Section %d (Pages %d-%d)", start / pagesPerChunk + 1, start + 1, end);
      chunks.add(new SectionMarker(title, start + 1));
    }
    return chunks;
  }
}
