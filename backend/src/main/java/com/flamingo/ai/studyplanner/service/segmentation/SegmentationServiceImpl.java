package com.flamingo.ai.studyplanner.service.segmentation;

import com.flamingo.ai.studyplanner.api.dto.response.SegmentationResponse;
import com.flamingo.ai.studyplanner.api.dto.response.TopicListResponse;
import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.model.SourceDocument;
import com.flamingo.ai.studyplanner.domain.model.Topic;
import com.flamingo.ai.studyplanner.exception.DocumentNotFoundException;
import com.flamingo.ai.studyplanner.exception.DocumentProcessingException;
import com.flamingo.ai.studyplanner.exception.UnsupportedFileException;
import com.flamingo.ai.studyplanner.service.session.PlannerSession;
import com.flamingo.ai.studyplanner.service.session.PlannerSessionService;
import com.flamingo.ai.studyplanner.util.Rounding;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the SegmentationService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SegmentationServiceImpl implements SegmentationService {

  static final String DEFAULT_SUBJECT = "General";
  private static final int PREVIEW_LIMIT = 15;

  private final PlannerSessionService sessionService;
  private final List<DocumentLoader> documentLoaders;
  private final DocumentStructureExtractor structureExtractor;
  private final TopicFactory topicFactory;
  private final PlannerConfig plannerConfig;
  private final Tika tika;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "segmentation.upload", description = "Time to upload and segment a document")
  public SegmentationResponse uploadAndSegment(
      UUID sessionId, MultipartFile file, String subject) {
    PlannerSession session = sessionService.getSession(sessionId);
    String fileName = bareFileName(file.getOriginalFilename());

    final byte[] content;
    try {
      content = file.getBytes();
    } catch (IOException e) {
      throw new DocumentProcessingException(fileName, "Failed to read upload", e);
    }
    return segment(session, fileName, content, subject);
  }

  @Override
  @Timed(value = "segmentation.reprocess", description = "Time to segment an uploaded document")
  public SegmentationResponse segmentUploaded(UUID sessionId, String fileName, String subject) {
    PlannerSession session = sessionService.getSession(sessionId);
    String name = bareFileName(fileName);
    byte[] content =
        session
            .withLock(() -> session.getUploadedFile(name))
            .orElseThrow(() -> new DocumentNotFoundException(name));
    return segment(session, name, content, subject);
  }

  @Override
  public TopicListResponse listTopics(UUID sessionId) {
    PlannerSession session = sessionService.getSession(sessionId);
    List<Topic> topics = session.withLock(session::getTopics);

    Map<String, List<TopicListResponse.TopicEntry>> entries = new LinkedHashMap<>();
    Map<String, Double> hours = new LinkedHashMap<>();
    double totalHours = 0;
    for (Topic topic : topics) {
      entries
          .computeIfAbsent(topic.subject(), s -> new ArrayList<>())
          .add(
              TopicListResponse.TopicEntry.builder()
                  .id(topic.id())
                  .title(topic.title())
                  .hours(topic.estimatedHours())
                  .build());
      hours.merge(topic.subject(), topic.estimatedHours(), Double::sum);
      totalHours += topic.estimatedHours();
    }

    Map<String, TopicListResponse.SubjectTopics> bySubject = new LinkedHashMap<>();
    entries.forEach(
        (subject, list) ->
            bySubject.put(
                subject,
                TopicListResponse.SubjectTopics.builder()
                    .topics(list)
                    .totalHours(Rounding.round(hours.get(subject), 1))
                    .build()));

    return TopicListResponse.builder()
        .totalTopics(topics.size())
        .totalHours(Rounding.round(totalHours, 1))
        .bySubject(bySubject)
        .build();
  }

  @Override
  public List<SourceDocument> listDocuments(UUID sessionId) {
    PlannerSession session = sessionService.getSession(sessionId);
    return session.withLock(session::getDocuments);
  }

  @Override
  public void resetTopics(UUID sessionId) {
    PlannerSession session = sessionService.getSession(sessionId);
    session.withLock(
        () -> {
          session.resetTopics();
          return null;
        });
    meterRegistry.counter("segmentation.topics.reset").increment();
    log.info("Cleared all topics and documents for session {}", sessionId);
  }

  // ---- private helpers ----

  private SegmentationResponse segment(
      PlannerSession session, String fileName, byte[] content, String subject) {
    String effectiveSubject = StringUtils.hasText(subject) ? subject.trim() : DEFAULT_SUBJECT;
    DocumentLoader loader = routeLoader(fileName, content);

    LoadedDocument document = loader.load(content, fileName);
    List<SectionMarker> sections = structureExtractor.extract(document);
    int sampleChars = plannerConfig.getSegmentation().getSampleChars();
    List<String> samples =
        sections.stream().map(section -> document.sample(section.page(), sampleChars)).toList();
    List<Topic> topics =
        topicFactory.createTopics(
            sections, samples, effectiveSubject, fileName, document.totalPages());

    SourceDocument sourceDocument =
        new SourceDocument(
            TopicFactory.documentId(fileName, document.totalPages()),
            fileName,
            effectiveSubject,
            document.totalPages(),
            topics.stream().map(Topic::id).toList());

    session.withLock(
        () -> {
          session.putUploadedFile(fileName, content);
          session.addTopics(topics);
          session.putDocument(sourceDocument);
          return null;
        });

    double totalHours = topics.stream().mapToDouble(Topic::estimatedHours).sum();
    meterRegistry.counter("segmentation.documents.processed").increment();
    meterRegistry.counter("segmentation.topics.created").increment(topics.size());
    log.info(
        "Segmented {} ({} pages) into {} topics for subject {} in session {}",
        fileName,
        document.totalPages(),
        topics.size(),
        effectiveSubject,
        session.getId());

    return SegmentationResponse.builder()
        .documentId(sourceDocument.id())
        .subject(effectiveSubject)
        .fileName(fileName)
        .pages(document.totalPages())
        .topicsCreated(topics.size())
        .totalHours(Rounding.round(totalHours, 1))
        .topics(
            topics.stream()
                .limit(PREVIEW_LIMIT)
                .map(t -> String.format("%s (%sh)", t.title(), t.estimatedHours()))
                .toList())
        .message(
            String.format(
                "Found %d topics requiring %.1f hours total", topics.size(), totalHours))
        .build();
  }

  private DocumentLoader routeLoader(String fileName, byte[] content) {
    if (content.length == 0) {
      throw new UnsupportedFileException(fileName, "File is empty", "Please upload a valid file");
    }
    long maxSize = plannerConfig.getSegmentation().getMaxFileSizeBytes();
    if (content.length > maxSize) {
      throw new UnsupportedFileException(
          fileName, "File too large: " + content.length, "Maximum file size is 50MB");
    }

    String mimeType = tika.detect(content, fileName);
    return documentLoaders.stream()
        .filter(loader -> loader.supports(mimeType))
        .findFirst()
        .orElseThrow(
            () ->
                new UnsupportedFileException(
                    fileName, "Unsupported file type: " + mimeType, "Supported formats: PDF"));
  }

  private static String bareFileName(String path) {
    String name = StringUtils.getFilename(path);
    return StringUtils.hasText(name) ? name : "document";
  }
}
