package com.flamingo.ai.studyplanner.service.schedule;

import com.flamingo.ai.studyplanner.config.PlannerConfig;
import com.flamingo.ai.studyplanner.exception.UnsupportedAllocationPolicyException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a policy name to the {@link ScheduleAllocator} registered under it.
 *
 * <p>Allocators are injected by Spring in {@code @Order} order. The service layer depends only on
 * this router, never on a concrete allocator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleAllocatorRouter {

  private final List<ScheduleAllocator> allocators;
  private final PlannerConfig plannerConfig;

  /**
   * Returns the allocator for the configured {@code planner.scheduling.policy}.
   *
   * @throws IllegalStateException if the configured policy has no allocator
   */
  public ScheduleAllocator route() {
    String configured = plannerConfig.getScheduling().getPolicy();
    return find(configured)
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "No ScheduleAllocator found for configured policy: " + configured));
  }

  /**
   * Returns the allocator registered under a policy named in a request.
   *
   * @param policy policy name, case-insensitive
   * @return the matching allocator
   * @throws UnsupportedAllocationPolicyException if no allocator is registered under that name
   */
  public ScheduleAllocator route(String policy) {
    return find(policy).orElseThrow(() -> new UnsupportedAllocationPolicyException(policy));
  }

  private Optional<ScheduleAllocator> find(String policy) {
    String normalized = policy == null ? "" : policy.trim().toLowerCase(Locale.ROOT);
    return allocators.stream().filter(a -> a.policyName().equals(normalized)).findFirst();
  }
}
