package com.flamingo.ai.studyplanner.api.rest;

import com.flamingo.ai.studyplanner.api.dto.request.AllocateScheduleRequest;
import com.flamingo.ai.studyplanner.api.dto.response.ExportResponse;
import com.flamingo.ai.studyplanner.api.dto.response.ScheduleSummaryResponse;
import com.flamingo.ai.studyplanner.domain.model.Schedule;
import com.flamingo.ai.studyplanner.service.schedule.ScheduleService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for generating and exporting schedules. */
@RestController
@RequestMapping("/api/sessions/{sessionId}/schedule")
@RequiredArgsConstructor
public class ScheduleController {

  private final ScheduleService scheduleService;

  /** Generates a schedule, replacing the previous one. */
  @PostMapping
  public ResponseEntity<ScheduleSummaryResponse> allocate(
      @PathVariable UUID sessionId, @Valid @RequestBody AllocateScheduleRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(scheduleService.allocate(sessionId, request));
  }

  /** Gets the full schedule. */
  @GetMapping
  public ResponseEntity<Schedule> getSchedule(@PathVariable UUID sessionId) {
    return ResponseEntity.ok(scheduleService.getSchedule(sessionId));
  }

  /** Exports the schedule as CSV or Markdown. */
  @GetMapping("/export")
  public ResponseEntity<ExportResponse> export(
      @PathVariable UUID sessionId, @RequestParam(defaultValue = "csv") String format) {
    return ResponseEntity.ok(scheduleService.export(sessionId, format));
  }
}
