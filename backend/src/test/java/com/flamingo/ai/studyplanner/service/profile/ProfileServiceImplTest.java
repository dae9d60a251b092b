package com.flamingo.ai.studyplanner.service.profile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.flamingo.ai.studyplanner.api.dto.request.ExamRequest;
import com.flamingo.ai.studyplanner.api.dto.request.UpdateProfileRequest;
import com.flamingo.ai.studyplanner.api.dto.response.ExamResponse;
import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.model.Exam;
import com.flamingo.ai.studyplanner.domain.model.LearnerProfile;
import com.flamingo.ai.studyplanner.exception.InvalidDateException;
import com.flamingo.ai.studyplanner.service.session.PlannerSession;
import com.flamingo.ai.studyplanner.service.session.PlannerSessionService;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
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
class ProfileServiceImplTest {

  @Mock private PlannerSessionService sessionService;

  private ProfileServiceImpl profileService;
  private PlannerSession session;
  private UUID sessionId;

  @BeforeEach
  void setUp() {
    profileService = new ProfileServiceImpl(sessionService, new PlannerConfig());
    sessionId = UUID.randomUUID();
    session = new PlannerSession(sessionId);
    when(sessionService.getSession(sessionId)).thenReturn(session);
  }

  @Test
  @DisplayName("Should return the configured default profile when none is stored")
  void shouldReturnDefaultProfile() {
    LearnerProfile profile = profileService.getProfile(sessionId);

    assertThat(profile.getMaxDailyDeepHours()).isEqualTo(6.0);
    assertThat(profile.getMaxSessionTime()).isEqualTo(1.5);
    assertThat(profile.getPeakWindows()).containsExactly("17:00");
    assertThat(session.getProfile()).isEmpty();
  }

  @Test
  @DisplayName("Should update only the fields that are present")
  void shouldApplyPartialUpdate() {
    // Given
    UpdateProfileRequest request = UpdateProfileRequest.builder().maxDailyDeepHours(4.0).build();

    // When
    LearnerProfile profile = profileService.updateProfile(sessionId, request);

    // Then
    assertThat(profile.getMaxDailyDeepHours()).isEqualTo(4.0);
    assertThat(profile.getMaxSessionTime()).isEqualTo(1.5);
    assertThat(session.getProfile()).contains(profile);
  }

  @Test
  @DisplayName("Should clamp subject confidence into [0, 1]")
  void shouldClampConfidence() {
    profileService.updateSubjectConfidence(sessionId, "Math", 1.7);
    LearnerProfile profile = profileService.updateSubjectConfidence(sessionId, "Physics", -0.2);

    assertThat(profile.getSubjectConfidence())
        .containsEntry("Math", 1.0)
        .containsEntry("Physics", 0.0);
  }

  @Test
  @DisplayName("Should add an exam and then move it")
  void shouldUpsertExam() {
    // When
    ExamResponse added =
        profileService.addOrUpdateExam(
            sessionId, ExamRequest.builder().subject("Math").examDate("2026-12-01").build());
    ExamResponse moved =
        profileService.addOrUpdateExam(
            sessionId, ExamRequest.builder().subject("Math").examDate("2026-12-08").build());

    // Then
    assertThat(added.isUpdated()).isFalse();
    assertThat(moved.isUpdated()).isTrue();
    List<Exam> exams = profileService.listExams(sessionId);
    assertThat(exams).containsExactly(new Exam("Math", LocalDate.of(2026, 12, 8)));
  }

  @Test
  @DisplayName("Should reject an exam date that does not parse")
  void shouldRejectInvalidExamDate() {
    ExamRequest request = ExamRequest.builder().subject("Math").examDate("12/01/2026").build();

    assertThatThrownBy(() -> profileService.addOrUpdateExam(sessionId, request))
        .isInstanceOf(InvalidDateException.class);
    assertThat(session.getExams()).isEmpty();
  }
}
