package com.flamingo.ai.studyplanner.config;

import java.time.Clock;
import org.apache.tika.Tika;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Infrastructure beans shared by the planner services. */
@Configuration
public class PlannerBeansConfig {

  /** Wall clock used to default an unspecified schedule start date. */
  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  /** Content sniffer for uploaded study material. */
  @Bean
  public Tika tika() {
    return new Tika();
  }
}
