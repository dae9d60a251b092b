package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.domain.model.LearnerProfile;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Interleaves topics of all subjects in a daily queue. The head topic gets one session and goes
 * back to the tail until it is finished or has reached its repeat limit for the day.
 */
@Component
@Order(2)
public class RoundRobinQueueAllocator extends AbstractScheduleAllocator {

  public static final String POLICY = "round-robin";

  public RoundRobinQueueAllocator(PlannerConfig plannerConfig) {
    super(plannerConfig);
  }

  @Override
  public String policyName() {
    return POLICY;
  }

  @Override
  protected DayPlanner createPlanner(List<WorkingTopic> workingTopics, LearnerProfile profile) {
    return new Planner(workingTopics, profile);
  }

  private final class Planner implements DayPlanner {

    private final Map<String, List<WorkingTopic>> bySubject = new LinkedHashMap<>();
    private final int minSession;
    private final int maxSession;
    private final int maxRepeats;

    Planner(List<WorkingTopic> workingTopics, LearnerProfile profile) {
      this.minSession = minSessionMinutes();
      this.maxSession = toMinutes(profile.getMaxSessionTime());
      this.maxRepeats = scheduling.getRoundRobinMaxRepeatsPerDay();
      for (WorkingTopic topic : workingTopics) {
        bySubject.computeIfAbsent(topic.getSubject(), s -> new ArrayList<>()).add(topic);
      }
    }

    @Override
    public boolean hasOutstandingWork() {
      return bySubject.values().stream()
          .flatMap(List::stream)
          .anyMatch(t -> t.getRemainingMinutes() >= minSession);
    }

    @Override
    public void planDay(DayPlan day) {
      Deque<WorkingTopic> queue = interleave();
      if (queue.isEmpty()) {
        return;
      }
      int popCap = Math.max(1, scheduling.getIterationCapMultiplier() * queue.size());
      Map<WorkingTopic, Integer> repeats = new HashMap<>();

      for (int pops = 0; pops < popCap && !queue.isEmpty(); pops++) {
        if (day.remainingMinutes() < minSession) {
          return;
        }
        WorkingTopic topic = queue.pollFirst();
        int minutes =
            sessionMinutes(
                Math.min(
                    Math.min(maxSession, topic.getRemainingMinutes()), day.remainingMinutes()));
        if (minutes < minSession) {
          continue;
        }
        day.schedule(topic, minutes);
        int count = repeats.merge(topic, 1, Integer::sum);
        if (topic.getRemainingMinutes() >= minSession && count < maxRepeats) {
          queue.addLast(topic);
        }
      }
    }

    /** Outstanding topics, taking the next one of each subject in turn. */
    private Deque<WorkingTopic> interleave() {
      List<List<WorkingTopic>> outstanding = new ArrayList<>();
      for (List<WorkingTopic> topics : bySubject.values()) {
        List<WorkingTopic> open =
            topics.stream().filter(t -> t.getRemainingMinutes() >= minSession).toList();
        if (!open.isEmpty()) {
          outstanding.add(open);
        }
      }
      Deque<WorkingTopic> queue = new ArrayDeque<>();
      int longest = outstanding.stream().mapToInt(List::size).max().orElse(0);
      for (int i = 0; i < longest; i++) {
        for (List<WorkingTopic> open : outstanding) {
          if (i < open.size()) {
            queue.addLast(open.get(i));
          }
        }
      }
      return queue;
    }
  }
}
