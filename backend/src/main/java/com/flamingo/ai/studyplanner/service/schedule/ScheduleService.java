package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.api.dto.request.AllocateScheduleRequest;
import com.flamingo.ai.studyplanner.api.dto.response.ExportResponse;
import com.flamingo.ai.studyplanner.api.dto.response.ScheduleSummaryResponse;
import com.flamingo.ai.studyplanner.domain.model.Schedule;
import java.util.UUID;

/** Service interface for generating, reading and exporting study schedules. */
public interface ScheduleService {

  /**
   * Plans every topic of the session over the requested range and stores the result, replacing
   * any previous schedule.
   *
   * @param sessionId the planner session
   * @param request the date range and optional policy override
   * @return summary of the new schedule
   */
  ScheduleSummaryResponse allocate(UUID sessionId, AllocateScheduleRequest request);

  /**
   * Returns the stored schedule.
   *
   * @throws com.flamingo.ai.studyplanner.exception.NoScheduleException if none was generated
   */
  Schedule getSchedule(UUID sessionId);

  /**
   * Serializes the stored schedule.
   *
   * @param sessionId the planner session
   * @param format {@code csv} or {@code markdown}
   * @return the document with a summary
   */
  ExportResponse export(UUID sessionId, String format);
}
