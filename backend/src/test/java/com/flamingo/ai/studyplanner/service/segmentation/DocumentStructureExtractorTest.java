package com.flamingo.ai.studyplanner.service.segmentation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DocumentStructureExtractorTest {

  private DocumentStructureExtractor extractor;

  @BeforeEach
  void setUp() {
    extractor = new DocumentStructureExtractor(new PlannerConfig());
  }

  private static List<String> blankPages(int count) {
    return new ArrayList<>(Collections.nCopies(count, "Body text."));
  }

  @Nested
  @DisplayName("Outline tier")
  class OutlineTier {

    @Test
    @DisplayName("Should keep shallow content bookmarks and drop front and back matter")
    void shouldFilterOutline() {
      // Given
      List<OutlineEntry> outline =
          List.of(
              new OutlineEntry("Table of Contents", 1, 1),
              new OutlineEntry("Chapter 1 Kinematics", 1, 3),
              new OutlineEntry("1.1 Velocity", 2, 4),
              new OutlineEntry("1.1.1 Too Deep", 3, 5),
              new OutlineEntry("Ab", 1, 6),
              new OutlineEntry("Chapter 2 Dynamics", 1, 10),
              new OutlineEntry("Appendix A", 1, 20));
      LoadedDocument document = new LoadedDocument("book.pdf", 30, blankPages(30), outline);

      // When
      List<SectionMarker> markers = extractor.extract(document);

      // Then
      assertThat(markers)
          .containsExactly(
              new SectionMarker("Chapter 1 Kinematics", 3),
              new SectionMarker("1.1 Velocity", 4),
              new SectionMarker("Chapter 2 Dynamics", 10));
    }

    @Test
    @DisplayName("Should suppress a real chapter whose title contains a denylisted word")
    void shouldSuppressDenylistedSubstring() {
      assertThat(DocumentStructureExtractor.isNonContent("Appendix: Worked Examples")).isTrue();
      assertThat(DocumentStructureExtractor.isNonContent("Chapter 3 Thermodynamics")).isFalse();
    }
  }

  @Nested
  @DisplayName("Heading scan tier")
  class HeadingTier {

    @Test
    @DisplayName("Should detect chapter, unit, module and numbered headings near the top of pages")
    void shouldDetectHeadings() {
      // Given
      List<String> pages = blankPages(10);
      pages.set(0, "Preface\nSome words");
      pages.set(1, "Chapter 1: Introduction\nText");
      pages.set(3, "UNIT 2 Cells\nText");
      pages.set(5, "Module 3 Genetics\nText");
      pages.set(7, "4. Evolution basics\nText");
      pages.set(8, "5. evolution continued\nText");
      LoadedDocument document = new LoadedDocument("bio.pdf", 10, pages, List.of());

      // When
      List<SectionMarker> markers = extractor.extract(document);

      // Then
      assertThat(markers)
          .containsExactly(
              new SectionMarker("Chapter 1: Introduction", 2),
              new SectionMarker("UNIT 2 Cells", 4),
              new SectionMarker("Module 3 Genetics", 6),
              new SectionMarker("4. Evolution basics", 8));
    }

    @Test
    @DisplayName("Should count a running header once, at its first page")
    void shouldDeduplicateRunningHeaders() {
      // Given
      List<String> pages = blankPages(6);
      pages.set(1, "Chapter 1 Motion\nText");
      pages.set(2, "Chapter 1 Motion\nMore text");
      pages.set(4, "Chapter 2 Energy\nText");
      LoadedDocument document = new LoadedDocument("notes.pdf", 6, pages, List.of());

      // When
      List<SectionMarker> markers = extractor.extract(document);

      // Then
      assertThat(markers)
          .containsExactly(
              new SectionMarker("Chapter 1 Motion", 2), new SectionMarker("Chapter 2 Energy", 5));
    }

    @Test
    @DisplayName("Should ignore headings below the scanned lines and overlong lines")
    void shouldIgnoreDeepAndLongLines() {
      // Given
      List<String> pages = blankPages(4);
      pages.set(0, "1\n2\n3\n4\n5\n6\n7\n8\n9\n10\nChapter 9 Hidden");
      pages.set(1, "Chapter 1 " + "x".repeat(80));
      pages.set(2, "Chapter 2 Kept\nText");
      pages.set(3, "Chapter 3 Kept\nText");
      LoadedDocument document = new LoadedDocument("notes.pdf", 4, pages, List.of());

      // When
      List<SectionMarker> markers = extractor.extract(document);

      // Then
      assertThat(markers)
          .extracting(SectionMarker::title)
          .containsExactly("Chapter 2 Kept", "Chapter 3 Kept");
    }
  }

  @Nested
  @DisplayName("Fixed chunk tier")
  class ChunkTier {

    @Test
    @DisplayName("Should cut a document without structure into 20-page chunks")
    void shouldChunkSmallDocument() {
      LoadedDocument document = new LoadedDocument("scan.pdf", 45, blankPages(45), List.of());

      List<SectionMarker> markers = extractor.extract(document);

      assertThat(markers)
          .containsExactly(
              new SectionMarker("Section 1 (Pages 1-20)", 1),
              new SectionMarker("Section 2 (Pages 21-40)", 21),
              new SectionMarker("Section 3 (Pages 41-45)", 41));
    }

    @Test
    @DisplayName("Should use a tenth of the pages per chunk for long documents")
    void shouldChunkLongDocument() {
      LoadedDocument document = new LoadedDocument("long.pdf", 300, blankPages(300), List.of());

      List<SectionMarker> markers = extractor.extract(document);

      assertThat(markers).hasSize(10);
      assertThat(markers.get(1)).isEqualTo(new SectionMarker("Section 2 (Pages 31-60)", 31));
    }

    @Test
    @DisplayName("Should add chunks to a single outline entry and keep page order")
    void shouldAccumulateTiers() {
      // Given
      List<OutlineEntry> outline = List.of(new OutlineEntry("Chapter 1 Basics", 1, 1));
      LoadedDocument document = new LoadedDocument("thin.pdf", 40, blankPages(40), outline);

      // When
      List<SectionMarker> markers = extractor.extract(document);

      // Then
      assertThat(markers)
          .containsExactly(
              new SectionMarker("Chapter 1 Basics", 1),
              new SectionMarker("Section 1 (Pages 1-20)", 1),
              new SectionMarker("Section 2 (Pages 21-40)", 21));
    }

    @Test
    @DisplayName("Should produce one section for a document without pages")
    void shouldHandleEmptyDocument() {
      LoadedDocument document = new LoadedDocument("empty.pdf", 0, List.of(), List.of());

      List<SectionMarker> markers = extractor.extract(document);

      assertThat(markers).containsExactly(new SectionMarker("Section 1 (Pages 1-1)", 1));
    }
  }
}
