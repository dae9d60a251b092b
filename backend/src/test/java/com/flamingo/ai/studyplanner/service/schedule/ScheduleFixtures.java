package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.domain.model.LearnerProfile;
import com.flamingo.ai.studyplanner.domain.model.Topic;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/** Topic and profile builders shared by the allocator tests. */
final class ScheduleFixtures {

  private ScheduleFixtures() {}

  static Topic topic(String id, String subject, double hours) {
    return new Topic(id, subject, "Topic " + id, 1, 10, hours, 0.5);
  }

  static LearnerProfile profile(double maxDailyDeepHours, double maxSessionTime) {
    return LearnerProfile.builder()
        .maxDailyDeepHours(maxDailyDeepHours)
        .maxSessionTime(maxSessionTime)
        .build();
  }

  /** Random topics over a few subjects, hours within the estimator's [0.5, 8.0] range. */
  static List<Topic> randomTopics(Random random) {
    String[] subjects = {"Math", "Physics", "Biology", "History"};
    int subjectCount = 1 + random.nextInt(subjects.length);
    int topicCount = 1 + random.nextInt(40);
    List<Topic> topics = new ArrayList<>(topicCount);
    for (int i = 0; i < topicCount; i++) {
      double hours = (5 + random.nextInt(76)) / 10.0;
      topics.add(topic("t" + i, subjects[random.nextInt(subjectCount)], hours));
    }
    return topics;
  }
}
