package com.flamingo.ai.studyplanner.service.segmentation;

import com.flamingo.ai.studyplanner.api.dto.response.SegmentationResponse;
import com.flamingo.ai.studyplanner.api.dto.response.TopicListResponse;
import com.flamingo.ai.studyplanner.domain.model.SourceDocument;
import java.util.List;
import java.util.UUID;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for turning documents into weighted study topics. */
public interface SegmentationService {

  /**
   * Stores an uploaded document in the session and segments it into topics.
   *
   * <p>Additive: processing the same file twice without {@link #resetTopics(UUID)} produces
   * duplicate topics.
   *
   * @param sessionId the planner session
   * @param file the uploaded document
   * @param subject subject to file the topics under
   * @return summary of the created topics
   */
  SegmentationResponse uploadAndSegment(UUID sessionId, MultipartFile file, String subject);

  /**
   * Segments a document previously uploaded to the session.
   *
   * @param sessionId the planner session
   * @param fileName name the document was uploaded under
   * @param subject subject to file the topics under
   * @return summary of the created topics
   * @throws com.flamingo.ai.studyplanner.exception.DocumentNotFoundException if no such upload
   */
  SegmentationResponse segmentUploaded(UUID sessionId, String fileName, String subject);

  /**
   * Lists all topics of the session grouped by subject.
   *
   * @param sessionId the planner session
   * @return grouped topics with per-subject and grand totals
   */
  TopicListResponse listTopics(UUID sessionId);

  /**
   * Lists the processed documents of the session.
   *
   * @param sessionId the planner session
   * @return documents in processing order
   */
  List<SourceDocument> listDocuments(UUID sessionId);

  /**
   * Clears every topic, document and upload of the session.
   *
   * @param sessionId the planner session
   */
  void resetTopics(UUID sessionId);
}
