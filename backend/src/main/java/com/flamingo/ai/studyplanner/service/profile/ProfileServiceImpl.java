package com.flamingo.ai.studyplanner.service.profile;

import com.flamingo.ai.studyplanner.api.dto.request.ExamRequest;
import com.flamingo.ai.studyplanner.api.dto.request.UpdateProfileRequest;
import com.flamingo.ai.studyplanner.api.dto.response.ExamResponse;
import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.model.Exam;
import com.flamingo.ai.studyplanner.domain.model.LearnerProfile;
import com.flamingo.ai.studyplanner.service.session.PlannerSession;
import com.flamingo.ai.studyplanner.service.session.PlannerSessionService;
import com.flamingo.ai.studyplanner.util.IsoDates;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the ProfileService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfileServiceImpl implements ProfileService {

  private final PlannerSessionService sessionService;
  private final PlannerConfig plannerConfig;

  @Override
  public LearnerProfile getProfile(UUID sessionId) {
    PlannerSession session = sessionService.getSession(sessionId);
    return session.withLock(() -> currentProfile(session));
  }

  @Override
  public LearnerProfile updateProfile(UUID sessionId, UpdateProfileRequest request) {
    PlannerSession session = sessionService.getSession(sessionId);
    LearnerProfile updated =
        session.withLock(
            () -> {
              LearnerProfile.LearnerProfileBuilder builder = currentProfile(session).toBuilder();
              if (request.getMaxDailyDeepHours() != null) {
                builder.maxDailyDeepHours(request.getMaxDailyDeepHours());
              }
              if (request.getMaxSessionTime() != null) {
                builder.maxSessionTime(request.getMaxSessionTime());
              }
              if (request.getPeakWindows() != null) {
                builder.peakWindows(new ArrayList<>(request.getPeakWindows()));
              }
              LearnerProfile profile = builder.build();
              session.setProfile(profile);
              return profile;
            });
    log.info(
        "Updated profile for session {}: {}h/day, {}h sessions",
        sessionId,
        updated.getMaxDailyDeepHours(),
        updated.getMaxSessionTime());
    return updated;
  }

  @Override
  public LearnerProfile updateSubjectConfidence(
      UUID sessionId, String subject, double confidence) {
    PlannerSession session = sessionService.getSession(sessionId);
    double clamped = Math.max(0.0, Math.min(1.0, confidence));
    return session.withLock(
        () -> {
          LearnerProfile current = currentProfile(session);
          Map<String, Double> confidences = new LinkedHashMap<>(current.getSubjectConfidence());
          confidences.put(subject.trim(), clamped);
          LearnerProfile profile = current.toBuilder().subjectConfidence(confidences).build();
          session.setProfile(profile);
          return profile;
        });
  }

  @Override
  public ExamResponse addOrUpdateExam(UUID sessionId, ExamRequest request) {
    PlannerSession session = sessionService.getSession(sessionId);
    LocalDate examDate = IsoDates.parse(request.getExamDate(), "examDate");
    Exam exam = new Exam(request.getSubject().trim(), examDate);
    boolean updated = session.withLock(() -> session.upsertExam(exam));
    log.info(
        "{} exam for {} on {} in session {}",
        updated ? "Moved" : "Added",
        exam.subject(),
        examDate,
        sessionId);

    return ExamResponse.builder()
        .subject(exam.subject())
        .examDate(examDate)
        .updated(updated)
        .message(
            String.format(
                "%s exam for %s on %s", updated ? "Updated" : "Added", exam.subject(), examDate))
        .build();
  }

  @Override
  public List<Exam> listExams(UUID sessionId) {
    PlannerSession session = sessionService.getSession(sessionId);
    return session.withLock(session::getExams);
  }

  private LearnerProfile currentProfile(PlannerSession session) {
    return session
        .getProfile()
        .orElseGet(() -> plannerConfig.getProfileDefaults().toProfile());
  }
}
