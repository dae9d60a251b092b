package com.flamingo.ai.studyplanner.service.export;

import com.flamingo.ai.studyplanner.domain.model.Schedule;

/** Serializes a schedule into one document format. */
public interface ScheduleExporter {

  ExportFormat format();

  ExportedSchedule export(Schedule schedule);
}
