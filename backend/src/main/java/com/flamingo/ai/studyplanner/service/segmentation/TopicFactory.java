package com.flamingo.ai.studyplanner.service.segmentation;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.model.Topic;
import com.flamingo.ai.studyplanner.util.Rounding;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

/**
 * Converts detected sections into {@link Topic}s with estimated study hours.
 *
 * <p>Hours are {@code pages × 0.4 × (0.5 + complexity)}: roughly 25 minutes of study per page,
 * scaled between 0.8× and 1.4× by complexity. The result is rounded to one decimal and clamped to
 * [0.5, 8.0].
 */
@Component
@RequiredArgsConstructor
public class TopicFactory {

  static final double HOURS_PER_PAGE = 0.4;
  static final double MIN_HOURS = 0.5;
  static final double MAX_HOURS = 8.0;

  private final ComplexityEstimator complexityEstimator;
  private final PlannerConfig plannerConfig;

  /**
   * Fingerprints a document by filename and page count. Re-processing the same file yields the same
   * id; two different files only collide when both name and page count match.
   */
  public static String documentId(String fileName, int totalPages) {
    String key = fileName + "_" + totalPages;
    return DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8)).substring(0, 8);
  }

  /**
   * Creates one topic per section.
   *
   * @param sections section markers in page order
   * @param samples leading text of each section's start page, parallel to {@code sections}
   * @param subject subject to file the topics under
   * @param fileName bare filename of the document
   * @param totalPages number of pages in the document
   * @return topics in section order
   */
  public List<Topic> createTopics(
      List<SectionMarker> sections,
      List<String> samples,
      String subject,
      String fileName,
      int totalPages) {
    String documentId = documentId(fileName, totalPages);
    int maxTitleLength = plannerConfig.getSegmentation().getMaxTitleLength();
    List<Topic> topics = new ArrayList<>(sections.size());

    for (int i = 0; i < sections.size(); i++) {
      SectionMarker section = sections.get(i);
      int startPage = section.page();
      int endPage = i + 1 < sections.size() ? sections.get(i + 1).page() - 1 : totalPages;
      int pages = Math.max(1, endPage - startPage + 1);

      String sample = i < samples.size() ? samples.get(i) : "";
      double complexity = complexityEstimator.estimate(sample, subject);

      topics.add(
          new Topic(
              String.format("%s_%02d", documentId, i),
              subject,
              truncate(section.title(), maxTitleLength),
              startPage,
              endPage,
              estimateHours(pages, complexity),
              Rounding.round(complexity, 2)));
    }
    return topics;
  }

  static double estimateHours(int pages, double complexity) {
    double hours = Rounding.round(pages * HOURS_PER_PAGE * (0.5 + complexity), 1);
    return Math.max(MIN_HOURS, Math.min(hours, MAX_HOURS));
  }

  private static String truncate(String title, int maxLength) {
    return title.length() > maxLength ? title.substring(0, maxLength) : title;
  }
}
