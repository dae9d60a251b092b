package com.flamingo.ai.studyplanner.service.segmentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.studyplanner.api.dto.response.SegmentationResponse;
import com.flamingo.ai.studyplanner.api.dto.response.TopicListResponse;
import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.model.SourceDocument;
import com.flamingo.ai.studyplanner.domain.model.Topic;
import com.flamingo.ai.studyplanner.exception.DocumentNotFoundException;
import com.flamingo.ai.studyplanner.exception.SessionNotFoundException;
import com.flamingo.ai.studyplanner.exception.UnsupportedFileException;
import com.flamingo.ai.studyplanner.service.session.InMemoryPlannerSessionService;
import com.flamingo.ai.studyplanner.service.session.PlannerSession;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import org.apache.tika.Tika;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

class SegmentationServiceImplTest {

  private PlannerConfig plannerConfig;
  private SimpleMeterRegistry meterRegistry;
  private InMemoryPlannerSessionService sessionService;
  private SegmentationServiceImpl segmentationService;
  private UUID sessionId;

  @BeforeEach
  void setUp() {
    plannerConfig = new PlannerConfig();
    meterRegistry = new SimpleMeterRegistry();
    sessionService = new InMemoryPlannerSessionService(meterRegistry);
    segmentationService =
        new SegmentationServiceImpl(
            sessionService,
            List.of(new PdfBoxDocumentLoader()),
            new DocumentStructureExtractor(plannerConfig),
            new TopicFactory(new ComplexityEstimator(), plannerConfig),
            plannerConfig,
            new Tika(),
            meterRegistry);
    sessionId = sessionService.createSession().getId();
  }

  private static byte[] textbook() {
    return PdfFixtures.builder()
        .bodyPages(12)
        .bookmark("Chapter 1 Limits", 1)
        .bookmark("Chapter 2 Derivatives", 5)
        .bookmark("Chapter 3 Integrals", 9)
        .build();
  }

  private static MockMultipartFile pdf(String name, byte[] content) {
    return new MockMultipartFile("file", name, "application/pdf", content);
  }

  @Test
  @DisplayName("Should segment an uploaded PDF into one topic per outline chapter")
  void shouldSegmentUploadedPdf() {
    // When
    SegmentationResponse response =
        segmentationService.uploadAndSegment(sessionId, pdf("calc.pdf", textbook()), "Calculus");

    // Then
    assertThat(response.getTopicsCreated()).isEqualTo(3);
    assertThat(response.getPages()).isEqualTo(12);
    assertThat(response.getSubject()).isEqualTo("Calculus");
    assertThat(response.getDocumentId()).isEqualTo(TopicFactory.documentId("calc.pdf", 12));
    assertThat(response.getTopics()).hasSize(3);
    assertThat(response.getTopics().get(0)).startsWith("Chapter 1 Limits (");

    List<Topic> topics = sessionService.getSession(sessionId).getTopics();
    assertThat(topics).extracting(Topic::startPage).containsExactly(1, 5, 9);
    assertThat(topics)
        .allSatisfy(
            t -> {
              assertThat(t.estimatedHours()).isBetween(0.5, 8.0);
              assertThat(t.complexity()).isBetween(0.3, 0.9);
            });
    assertThat(meterRegistry.counter("segmentation.documents.processed").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should file topics under General when no subject is given")
  void shouldDefaultSubject() {
    SegmentationResponse response =
        segmentationService.uploadAndSegment(sessionId, pdf("calc.pdf", textbook()), "  ");

    assertThat(response.getSubject()).isEqualTo("General");
  }

  @Test
  @DisplayName("Should strip directories from the uploaded filename")
  void shouldStripDirectories() {
    SegmentationResponse response =
        segmentationService.uploadAndSegment(
            sessionId, pdf("course/week1/calc.pdf", textbook()), "Math");

    assertThat(response.getFileName()).isEqualTo("calc.pdf");
  }

  @Test
  @DisplayName("Should append topics when the same document is processed twice")
  void shouldBeAdditive() {
    // When
    segmentationService.uploadAndSegment(sessionId, pdf("calc.pdf", textbook()), "Math");
    segmentationService.uploadAndSegment(sessionId, pdf("calc.pdf", textbook()), "Math");

    // Then
    assertThat(segmentationService.listTopics(sessionId).getTotalTopics()).isEqualTo(6);
    assertThat(segmentationService.listDocuments(sessionId)).hasSize(1);
  }

  @Test
  @DisplayName("Should reject files that are not documents")
  void shouldRejectTextFile() {
    MockMultipartFile text =
        new MockMultipartFile(
            "file", "notes.txt", "text/plain", "just notes".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> segmentationService.uploadAndSegment(sessionId, text, "Math"))
        .isInstanceOf(UnsupportedFileException.class);
    assertThat(sessionService.getSession(sessionId).getTopics()).isEmpty();
  }

  @Test
  @DisplayName("Should reject empty uploads")
  void shouldRejectEmptyFile() {
    assertThatThrownBy(
            () -> segmentationService.uploadAndSegment(sessionId, pdf("x.pdf", new byte[0]), "M"))
        .isInstanceOf(UnsupportedFileException.class);
  }

  @Test
  @DisplayName("Should reject uploads above the size limit")
  void shouldRejectOversizedFile() {
    plannerConfig.getSegmentation().setMaxFileSizeBytes(100);

    assertThatThrownBy(
            () -> segmentationService.uploadAndSegment(sessionId, pdf("calc.pdf", textbook()), "M"))
        .isInstanceOf(UnsupportedFileException.class)
        .hasMessageContaining("too large");
  }

  @Test
  @DisplayName("Should re-segment a previous upload by filename under another subject")
  void shouldSegmentPreviousUpload() {
    // Given
    segmentationService.uploadAndSegment(sessionId, pdf("calc.pdf", textbook()), "Math");

    // When
    SegmentationResponse response =
        segmentationService.segmentUploaded(sessionId, "calc.pdf", "Physics");

    // Then
    assertThat(response.getTopicsCreated()).isEqualTo(3);
    TopicListResponse topics = segmentationService.listTopics(sessionId);
    assertThat(topics.getBySubject()).containsOnlyKeys("Math", "Physics");
  }

  @Test
  @DisplayName("Should fail when segmenting a file that was never uploaded")
  void shouldFailForUnknownUpload() {
    assertThatThrownBy(() -> segmentationService.segmentUploaded(sessionId, "missing.pdf", "M"))
        .isInstanceOf(DocumentNotFoundException.class);
  }

  @Test
  @DisplayName("Should group topics by subject in first-seen order with totals")
  void shouldGroupTopicsBySubject() {
    // Given
    segmentationService.uploadAndSegment(sessionId, pdf("calc.pdf", textbook()), "Math");
    segmentationService.uploadAndSegment(sessionId, pdf("mech.pdf", textbook()), "Physics");

    // When
    TopicListResponse response = segmentationService.listTopics(sessionId);

    // Then
    assertThat(response.getTotalTopics()).isEqualTo(6);
    assertThat(response.getBySubject().keySet()).containsExactly("Math", "Physics");
    TopicListResponse.SubjectTopics math = response.getBySubject().get("Math");
    assertThat(math.getTopics()).hasSize(3);
    double mathHours =
        math.getTopics().stream().mapToDouble(TopicListResponse.TopicEntry::getHours).sum();
    assertThat(math.getTotalHours()).isCloseTo(mathHours, within(0.05));
  }

  @Test
  @DisplayName("Should clear topics, documents and uploads on reset")
  void shouldResetTopics() {
    // Given
    segmentationService.uploadAndSegment(sessionId, pdf("calc.pdf", textbook()), "Math");

    // When
    segmentationService.resetTopics(sessionId);

    // Then
    TopicListResponse response = segmentationService.listTopics(sessionId);
    assertThat(response.getTotalTopics()).isZero();
    assertThat(response.getTotalHours()).isZero();
    assertThat(segmentationService.listDocuments(sessionId)).isEmpty();
    PlannerSession session = sessionService.getSession(sessionId);
    assertThat(session.getUploadedFile("calc.pdf")).isEmpty();
  }

  @Test
  @DisplayName("Should record the processed document with its topic ids")
  void shouldRecordDocument() {
    segmentationService.uploadAndSegment(sessionId, pdf("calc.pdf", textbook()), "Math");

    List<SourceDocument> documents = segmentationService.listDocuments(sessionId);

    assertThat(documents).hasSize(1);
    assertThat(documents.get(0).topicIds()).hasSize(3);
    assertThat(documents.get(0).totalPages()).isEqualTo(12);
  }

  @Test
  @DisplayName("Should fail for an unknown session")
  void shouldFailForUnknownSession() {
    assertThatThrownBy(() -> segmentationService.listTopics(UUID.randomUUID()))
        .isInstanceOf(SessionNotFoundException.class);
  }
}
