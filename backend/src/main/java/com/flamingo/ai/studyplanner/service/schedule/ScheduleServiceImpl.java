package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.api.dto.request.AllocateScheduleRequest;
import com.flamingo.ai.studyplanner.api.dto.response.ExportResponse;
import com.flamingo.ai.studyplanner.api.dto.response.ScheduleSummaryResponse;
import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.model.LearnerProfile;
import com.flamingo.ai.studyplanner.domain.model.Schedule;
import com.flamingo.ai.studyplanner.domain.model.ScheduleSummary;
import com.flamingo.ai.studyplanner.exception.NoScheduleException;
import com.flamingo.ai.studyplanner.service.export.ExportFormat;
import com.flamingo.ai.studyplanner.service.export.ExportedSchedule;
import com.flamingo.ai.studyplanner.service.export.ScheduleExporter;
import com.flamingo.ai.studyplanner.service.session.PlannerSession;
import com.flamingo.ai.studyplanner.service.session.PlannerSessionService;
import com.flamingo.ai.studyplanner.util.IsoDates;
import com.flamingo.ai.studyplanner.util.Rounding;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

/** Implementation of the ScheduleService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleServiceImpl implements ScheduleService {

  private final PlannerSessionService sessionService;
  private final ScheduleAllocatorRouter allocatorRouter;
  private final ScheduleSummarizer summarizer;
  private final List<ScheduleExporter> exporters;
  private final PlannerConfig plannerConfig;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "schedule.allocate", description = "Time to generate a study schedule")
  public ScheduleSummaryResponse allocate(UUID sessionId, AllocateScheduleRequest request) {
    PlannerSession session = sessionService.getSession(sessionId);
    LocalDate startDate =
        StringUtils.hasText(request.getStartDate())
            ? IsoDates.parse(request.getStartDate(), "startDate")
            : LocalDate.now(clock);
    LocalDate endDate = IsoDates.parse(request.getEndDate(), "endDate");
    ScheduleAllocator allocator =
        StringUtils.hasText(request.getPolicy())
            ? allocatorRouter.route(request.getPolicy())
            : allocatorRouter.route();

    Schedule schedule =
        session.withLock(
            () -> {
              LearnerProfile profile =
                  session
                      .getProfile()
                      .orElseGet(() -> plannerConfig.getProfileDefaults().toProfile());
              AllocationResult result =
                  allocator.allocate(session.getTopics(), profile, startDate, endDate);
              Schedule planned =
                  new Schedule(
                      scheduleId(startDate, endDate),
                      startDate,
                      endDate,
                      result.days(),
                      summarizer.summarize(result));
              session.setSchedule(planned);
              return planned;
            });

    ScheduleSummary summary = schedule.summary();
    meterRegistry.counter("schedule.generated", "policy", allocator.policyName()).increment();
    log.info(
        "Generated schedule {} for session {}: {} days, {} minutes, {}/{} topics",
        schedule.id(),
        sessionId,
        summary.studyDays(),
        summary.totalStudyMinutes(),
        summary.topicsScheduled(),
        summary.totalTopics());

    return ScheduleSummaryResponse.builder()
        .scheduleId(schedule.id())
        .policy(allocator.policyName())
        .days(summary.studyDays())
        .totalHours(Rounding.round(summary.totalStudyHours(), 2))
        .hoursBySubject(roundedHours(summary))
        .topicsScheduled(summary.topicsScheduled())
        .totalTopics(summary.totalTopics())
        .message(
            String.format(
                "Scheduled %d of %d topics over %d days",
                summary.topicsScheduled(), summary.totalTopics(), summary.studyDays()))
        .build();
  }

  @Override
  public Schedule getSchedule(UUID sessionId) {
    PlannerSession session = sessionService.getSession(sessionId);
    return session
        .withLock(session::getSchedule)
        .orElseThrow(() -> new NoScheduleException(sessionId));
  }

  @Override
  public ExportResponse export(UUID sessionId, String format) {
    ExportFormat exportFormat = ExportFormat.fromValue(format);
    Schedule schedule = getSchedule(sessionId);
    ScheduleExporter exporter =
        exporters.stream()
            .filter(e -> e.format() == exportFormat)
            .findFirst()
            .orElseThrow(
                () -> new IllegalStateException("No ScheduleExporter for format: " + exportFormat));

    ExportedSchedule exported = exporter.export(schedule);
    ScheduleSummary summary = schedule.summary();
    meterRegistry.counter("schedule.exported", "format", exportFormat.getValue()).increment();
    log.info("Exported schedule {} as {}", schedule.id(), exportFormat.getValue());

    return ExportResponse.builder()
        .format(exportFormat.getValue())
        .fileName(exportFormat.getFileName())
        .rows(exported.rows())
        .content(exported.content())
        .summary(
            ExportResponse.ExportSummary.builder()
                .period(schedule.startDate() + " to " + schedule.endDate())
                .totalHours(Rounding.round(summary.totalStudyHours(), 2))
                .studyDays(summary.studyDays())
                .topicsScheduled(summary.topicsScheduled() + "/" + summary.totalTopics())
                .hoursPerSubject(roundedHours(summary))
                .build())
        .build();
  }

  static String scheduleId(LocalDate startDate, LocalDate endDate) {
    String key = startDate + "_" + endDate;
    return DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8)).substring(0, 8);
  }

  private static Map<String, Double> roundedHours(ScheduleSummary summary) {
    Map<String, Double> hours = new LinkedHashMap<>();
    summary.hoursPerSubject().forEach((subject, h) -> hours.put(subject, Rounding.round(h, 2)));
    return hours;
  }
}
