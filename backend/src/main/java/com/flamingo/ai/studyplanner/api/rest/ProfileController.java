package com.flamingo.ai.studyplanner.api.rest;

import com.flamingo.ai.studyplanner.api.dto.request.ExamRequest;
import com.flamingo.ai.studyplanner.api.dto.request.SubjectConfidenceRequest;
import com.flamingo.ai.studyplanner.api.dto.request.UpdateProfileRequest;
import com.flamingo.ai.studyplanner.api.dto.response.ExamResponse;
import com.flamingo.ai.studyplanner.domain.model.Exam;
import com.flamingo.ai.studyplanner.domain.model.LearnerProfile;
import com.flamingo.ai.studyplanner.service.profile.ProfileService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the learner profile and exam dates. */
@RestController
@RequestMapping("/api/sessions/{sessionId}")
@RequiredArgsConstructor
public class ProfileController {

  private final ProfileService profileService;

  /** Gets the learner profile. */
  @GetMapping("/profile")
  public ResponseEntity<LearnerProfile> getProfile(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(profileService.getProfile(sessionId));
  }

  /** Updates the learner profile. */
  @PutMapping("/profile")
  public ResponseEntity<LearnerProfile> updateProfile(
      @PathVariable UUID sessionId, @Valid @RequestBody UpdateProfileRequest request) {
    return ResponseEntity.ok(profileService.updateProfile(sessionId, request));
  }

  /** Records the learner's confidence in a subject. */
  @PutMapping("/profile/confidence")
  public ResponseEntity<LearnerProfile> updateConfidence(
      @PathVariable UUID sessionId, @Valid @RequestBody SubjectConfidenceRequest request) {
    return ResponseEntity.ok(
        profileService.updateSubjectConfidence(
            sessionId, request.getSubject(), request.getConfidence()));
  }

  /** Lists exams. */
  @GetMapping("/exams")
  public ResponseEntity<List<Exam>> listExams(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(profileService.listExams(sessionId));
  }

  /** Adds an exam or moves the existing exam of the same subject. */
  @PutMapping("/exams")
  public ResponseEntity<ExamResponse> addOrUpdateExam(
      @PathVariable UUID sessionId, @Valid @RequestBody ExamRequest request) {
    return ResponseEntity.ok(profileService.addOrUpdateExam(sessionId, request));
  }
}
