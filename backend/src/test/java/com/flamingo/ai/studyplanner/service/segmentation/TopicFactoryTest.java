package com.flamingo.ai.studyplanner.service.segmentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.model.Topic;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TopicFactoryTest {

  @Mock private ComplexityEstimator complexityEstimator;

  private TopicFactory topicFactory;

  @BeforeEach
  void setUp() {
    topicFactory = new TopicFactory(complexityEstimator, new PlannerConfig());
    when(complexityEstimator.estimate(anyString(), eq("Math"))).thenReturn(0.5);
  }

  @Test
  @DisplayName("Should span each topic up to the page before the next section")
  void shouldComputePageSpans() {
    // Given
    List<SectionMarker> sections =
        List.of(
            new SectionMarker("Limits", 1),
            new SectionMarker("Derivatives", 5),
            new SectionMarker("Integrals", 9));

    // When
    List<Topic> topics =
        topicFactory.createTopics(sections, List.of("a", "b", "c"), "Math", "calc.pdf", 12);

    // Then
    String documentId = TopicFactory.documentId("calc.pdf", 12);
    assertThat(topics)
        .containsExactly(
            new Topic(documentId + "_00", "Math", "Limits", 1, 4, 1.6, 0.5),
            new Topic(documentId + "_01", "Math", "Derivatives", 5, 8, 1.6, 0.5),
            new Topic(documentId + "_02", "Math", "Integrals", 9, 12, 1.6, 0.5));
  }

  @Test
  @DisplayName("Should count at least one page when sections share a start page")
  void shouldUseAtLeastOnePage() {
    List<SectionMarker> sections =
        List.of(new SectionMarker("Intro", 3), new SectionMarker("Overview", 3));

    List<Topic> topics =
        topicFactory.createTopics(sections, List.of("", ""), "Math", "notes.pdf", 3);

    assertThat(topics.get(0).startPage()).isEqualTo(3);
    assertThat(topics.get(0).endPage()).isEqualTo(2);
    assertThat(topics.get(0).estimatedHours()).isEqualTo(0.5);
  }

  @Test
  @DisplayName("Should truncate titles to 60 characters and round complexity to two decimals")
  void shouldTruncateTitleAndRoundComplexity() {
    // Given
    when(complexityEstimator.estimate(anyString(), eq("Physics"))).thenReturn(0.5555);
    String longTitle = "A".repeat(75);

    // When
    List<Topic> topics =
        topicFactory.createTopics(
            List.of(new SectionMarker(longTitle, 1)), List.of("x"), "Physics", "p.pdf", 2);

    // Then
    assertThat(topics.get(0).title()).hasSize(60);
    assertThat(topics.get(0).complexity()).isEqualTo(0.56);
  }

  @Test
  @DisplayName("Should clamp estimated hours to [0.5, 8.0]")
  void shouldClampHours() {
    assertThat(TopicFactory.estimateHours(10, 0.5)).isEqualTo(4.0);
    assertThat(TopicFactory.estimateHours(1, 0.3)).isEqualTo(0.5);
    assertThat(TopicFactory.estimateHours(50, 0.9)).isEqualTo(8.0);
    assertThat(TopicFactory.estimateHours(3, 0.7)).isEqualTo(1.4);
  }

  @Test
  @DisplayName("Should fingerprint documents by filename and page count")
  void shouldFingerprintDocuments() {
    String id = TopicFactory.documentId("calc.pdf", 12);

    assertThat(id).hasSize(8).matches("[0-9a-f]{8}");
    assertThat(TopicFactory.documentId("calc.pdf", 12)).isEqualTo(id);
    assertThat(TopicFactory.documentId("calc.pdf", 13)).isNotEqualTo(id);
  }
}
