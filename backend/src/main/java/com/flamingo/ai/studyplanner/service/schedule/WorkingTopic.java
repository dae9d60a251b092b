package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.domain.model.Topic;

/** A topic's scaled budget during one allocation run, tracked in whole minutes. */
public final class WorkingTopic {

  private final Topic topic;
  private final int totalMinutes;
  private int remainingMinutes;

  WorkingTopic(Topic topic, double workingHours) {
    this.topic = topic;
    this.totalMinutes = (int) Math.round(workingHours * 60);
    this.remainingMinutes = totalMinutes;
  }

  public Topic getTopic() {
    return topic;
  }

  public String getSubject() {
    return topic.subject();
  }

  public int getTotalMinutes() {
    return totalMinutes;
  }

  public int getRemainingMinutes() {
    return remainingMinutes;
  }

  public double getTotalHours() {
    return totalMinutes / 60.0;
  }

  public double getRemainingHours() {
    return remainingMinutes / 60.0;
  }

  void consume(int minutes) {
    remainingMinutes -= minutes;
  }
}
