package com.flamingo.ai.studyplanner.service.export;

import com.flamingo.ai.studyplanner.domain.model.Schedule;
import com.flamingo.ai.studyplanner.domain.model.ScheduleSummary;
import com.flamingo.ai.studyplanner.domain.model.StudyDay;
import com.flamingo.ai.studyplanner.domain.model.StudySession;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * A readable plan: summary lines, an hours-by-subject table and one table per study day.
 *
 * <p>Durations under an hour print as minutes ({@code 45m}), longer ones as hours with one decimal
 * ({@code 1.5h}). The allocators emit long sessions in whole tenths of an hour, so the printed
 * hours are exact.
 */
@Component
public class MarkdownScheduleExporter implements ScheduleExporter {

  private static final int MAX_TITLE_LENGTH = 40;

  @Override
  public ExportFormat format() {
    return ExportFormat.MARKDOWN;
  }

  @Override
  public ExportedSchedule export(Schedule schedule) {
    ScheduleSummary summary = schedule.summary();
    StringBuilder md = new StringBuilder();

    md.append("# Study Schedule\n\n");
    md.append("**Period:** ")
        .append(schedule.startDate())
        .append(" to ")
        .append(schedule.endDate())
        .append("  \n");
    md.append("**Total Time:** ")
        .append(ExportFormatting.hours(summary.totalStudyHours()))
        .append(" hours  \n");
    md.append("**Topics:** ")
        .append(summary.topicsScheduled())
        .append('/')
        .append(summary.totalTopics())
        .append(" scheduled\n\n");

    md.append("## Hours by Subject\n\n");
    md.append("| Subject | Hours |\n");
    md.append("|---------|-------|\n");
    Map<String, Double> bySubject = new TreeMap<>(summary.hoursPerSubject());
    bySubject.forEach(
        (subject, hours) ->
            md.append("| ")
                .append(cell(subject))
                .append(" | ")
                .append(ExportFormatting.hours(hours))
                .append(" |\n"));

    md.append("\n## Daily Plan\n");
    for (StudyDay day : schedule.days()) {
      md.append("\n### ")
          .append(ExportFormatting.weekday(day.weekday()))
          .append(", ")
          .append(day.date())
          .append(" (")
          .append(ExportFormatting.hours(day.totalHours()))
          .append("h)\n\n");
      md.append("| Time | Subject | Topic | Duration |\n");
      md.append("|------|---------|-------|----------|\n");
      for (StudySession session : day.sessions()) {
        md.append("| ")
            .append(session.startTime().format(ExportFormatting.TIME))
            .append(" | ")
            .append(cell(session.subject()))
            .append(" | ")
            .append(cell(title(session.title())))
            .append(" | ")
            .append(duration(session.durationMinutes()))
            .append(" |\n");
      }
    }

    return new ExportedSchedule(md.toString(), List.of());
  }

  static String duration(int minutes) {
    if (minutes < 60) {
      return minutes + "m";
    }
    long tenths = Math.round(minutes / 6.0);
    return String.format("%d.%dh", tenths / 10, tenths % 10);
  }

  private static String title(String title) {
    return title.length() > MAX_TITLE_LENGTH
        ? title.substring(0, MAX_TITLE_LENGTH) + "..."
        : title;
  }

  private static String cell(String value) {
    return value.replace('|', '/').replace('\n', ' ');
  }
}
