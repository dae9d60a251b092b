package com.flamingo.ai.studyplanner.api.rest;

import com.flamingo.ai.studyplanner.api.dto.response.SegmentationResponse;
import com.flamingo.ai.studyplanner.api.dto.response.TopicListResponse;
import com.flamingo.ai.studyplanner.domain.model.SourceDocument;
import com.flamingo.ai.studyplanner.service.segmentation.SegmentationService;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for document segmentation and the resulting topics. */
@RestController
@RequestMapping("/api/sessions/{sessionId}")
@RequiredArgsConstructor
public class TopicController {

  private final SegmentationService segmentationService;

  /** Uploads a document and segments it into topics. */
  @PostMapping(value = "/documents", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<SegmentationResponse> uploadDocument(
      @PathVariable UUID sessionId,
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "subject", required = false) String subject) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(segmentationService.uploadAndSegment(sessionId, file, subject));
  }

  /** Segments a previously uploaded document again, optionally under another subject. */
  @PostMapping("/documents/{fileName:.+}/segment")
  public ResponseEntity<SegmentationResponse> segmentUploaded(
      @PathVariable UUID sessionId,
      @PathVariable String fileName,
      @RequestParam(value = "subject", required = false) String subject) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(segmentationService.segmentUploaded(sessionId, fileName, subject));
  }

  /** Lists the processed documents. */
  @GetMapping("/documents")
  public ResponseEntity<List<SourceDocument>> listDocuments(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(segmentationService.listDocuments(sessionId));
  }

  /** Lists topics grouped by subject. */
  @GetMapping("/topics")
  public ResponseEntity<TopicListResponse> listTopics(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(segmentationService.listTopics(sessionId));
  }

  /** Clears every topic and document. */
  @DeleteMapping("/topics")
  public ResponseEntity<Void> resetTopics(@PathVariable UUID sessionId) {
    segmentationService.resetTopics(sessionId);
    return ResponseEntity.noContent().build();
  }
}
