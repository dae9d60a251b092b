package com.flamingo.ai.studyplanner.service.profile;

import com.flamingo.ai.studyplanner.api.dto.request.ExamRequest;
import com.flamingo.ai.studyplanner.api.dto.request.UpdateProfileRequest;
import com.flamingo.ai.studyplanner.api.dto.response.ExamResponse;
import com.flamingo.ai.studyplanner.domain.model.Exam;
import com.flamingo.ai.studyplanner.domain.model.LearnerProfile;
import java.util.List;
import java.util.UUID;

/** Service interface for the learner's survey answers: profile, subject confidence and exams. */
public interface ProfileService {

  /** Returns the stored profile, or the configured default if none was saved. */
  LearnerProfile getProfile(UUID sessionId);

  /** Applies the non-null fields of {@code request} to the current profile. */
  LearnerProfile updateProfile(UUID sessionId, UpdateProfileRequest request);

  /** Records a subject's confidence, clamped into [0, 1]. */
  LearnerProfile updateSubjectConfidence(UUID sessionId, String subject, double confidence);

  /**
   * Adds an exam or moves the existing exam of the same subject.
   *
   * @throws com.flamingo.ai.studyplanner.exception.InvalidDateException for a malformed date
   */
  ExamResponse addOrUpdateExam(UUID sessionId, ExamRequest request);

  /** Returns the exams in the order their subjects were first added. */
  List<Exam> listExams(UUID sessionId);
}
