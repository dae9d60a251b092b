package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.domain.model.StudyDay;
import com.flamingo.ai.studyplanner.domain.model.StudySession;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * The clock and session list of the day currently being planned.
 *
 * <p>Every session starts and ends within the calendar day: the capacity left shrinks to the
 * minutes between the next start and midnight.
 */
final class DayPlan {

  private static final int MINUTES_PER_DAY = 24 * 60;

  private final LocalDate date;
  private final int capacityMinutes;
  private final int lunchStart;
  private final int lunchEnd;
  private final int bufferMinutes;
  private final List<StudySession> sessions = new ArrayList<>();

  private int clock;
  private int usedMinutes;

  DayPlan(
      LocalDate date,
      int capacityMinutes,
      LocalTime dayStart,
      LocalTime lunchStart,
      LocalTime lunchEnd,
      int bufferMinutes) {
    this.date = date;
    this.capacityMinutes = capacityMinutes;
    this.clock = minuteOfDay(dayStart);
    this.lunchStart = minuteOfDay(lunchStart);
    this.lunchEnd = minuteOfDay(lunchEnd);
    this.bufferMinutes = bufferMinutes;
  }

  /** Minutes still available today, bounded by the day budget and by midnight. */
  int remainingMinutes() {
    int untilMidnight = Math.max(0, MINUTES_PER_DAY - nextStart());
    return Math.min(capacityMinutes - usedMinutes, untilMidnight);
  }

  int usedMinutes() {
    return usedMinutes;
  }

  boolean isEmpty() {
    return sessions.isEmpty();
  }

  /** Records a session for {@code topic} at the current clock time and advances the clock. */
  void schedule(WorkingTopic topic, int minutes) {
    clock = nextStart();
    if (clock + minutes > MINUTES_PER_DAY) {
      throw new IllegalArgumentException(
          String.format("Session of %d minutes at minute %d runs past midnight", minutes, clock));
    }
    sessions.add(
        new StudySession(
            topic.getTopic().id(),
            topic.getSubject(),
            topic.getTopic().title(),
            LocalTime.MIDNIGHT.plusMinutes(clock),
            minutes,
            topic.getTopic().complexity()));
    clock += minutes + bufferMinutes;
    usedMinutes += minutes;
    topic.consume(minutes);
  }

  StudyDay toStudyDay() {
    return new StudyDay(date, date.getDayOfWeek(), List.copyOf(sessions));
  }

  /** The current clock, moved out of the lunch break. */
  private int nextStart() {
    return clock >= lunchStart && clock < lunchEnd ? lunchEnd : clock;
  }

  private static int minuteOfDay(LocalTime time) {
    return time.getHour() * 60 + time.getMinute();
  }
}
