package com.flamingo.ai.studyplanner.service.export;

import com.flamingo.ai.studyplanner.domain.model.Schedule;
import com.flamingo.ai.studyplanner.domain.model.StudyDay;
import com.flamingo.ai.studyplanner.domain.model.StudySession;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** One CSV row per session, durations in whole minutes. */
@Component
public class CsvScheduleExporter implements ScheduleExporter {

  public static final String HEADER = "Date,Day,Start,End,Subject,Topic,Minutes";
  private static final int MAX_TITLE_LENGTH = 50;

  @Override
  public ExportFormat format() {
    return ExportFormat.CSV;
  }

  @Override
  public ExportedSchedule export(Schedule schedule) {
    List<String> rows = new ArrayList<>();
    for (StudyDay day : schedule.days()) {
      String weekday = ExportFormatting.weekday(day.weekday());
      for (StudySession session : day.sessions()) {
        rows.add(
            String.join(
                ",",
                day.date().toString(),
                weekday,
                session.startTime().format(ExportFormatting.TIME),
                session.endTime().format(ExportFormatting.TIME),
                field(session.subject()),
                field(ExportFormatting.truncate(session.title(), MAX_TITLE_LENGTH)),
                String.valueOf(session.durationMinutes())));
      }
    }

    List<String> lines = new ArrayList<>(rows.size() + 1);
    lines.add(HEADER);
    lines.addAll(rows);
    return new ExportedSchedule(String.join("\n", lines), List.copyOf(rows));
  }

  // Commas would shift columns; the format has no quoting.
  private static String field(String value) {
    return value.replace(',', ';').replace('\n', ' ');
  }
}
