package com.flamingo.ai.studyplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the study planner backend. */
@SpringBootApplication
public class StudyPlannerApplication {

  public static void main(String[] args) {
    SpringApplication.run(StudyPlannerApplication.class, args);
  }
}
