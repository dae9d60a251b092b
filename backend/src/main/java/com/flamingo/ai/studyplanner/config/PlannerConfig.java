package com.flamingo.ai.studyplanner.config;

import com.flamingo.ai.studyplanner.domain.model.LearnerProfile;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for document segmentation and schedule allocation. */
@Configuration
@ConfigurationProperties(prefix = "planner")
@Getter
@Setter
public class PlannerConfig {

  private Segmentation segmentation = new Segmentation();
  private Scheduling scheduling = new Scheduling();
  private ProfileDefaults profileDefaults = new ProfileDefaults();

  @Getter
  @Setter
  public static class Segmentation {
    /** Characters of a section's start page used for complexity estimation. */
    private int sampleChars = 1500;

    private int maxTitleLength = 60;

    /** Outline entries required before the outline is trusted over heading scanning. */
    private int minOutlineEntries = 3;

    /** Sections required before fixed page chunks are used instead. */
    private int minHeadingEntries = 2;

    private int maxOutlineDepth = 2;
    private int headingScanLines = 10;
    private int minChunkPages = 20;
    private long maxFileSizeBytes = 50 * 1024 * 1024L; // 50 MB
  }

  @Getter
  @Setter
  public static class Scheduling {
    /** Allocation policy: "proportional" (default) or "round-robin". */
    private String policy = "proportional";

    /** Operational cap on the number of topics a single allocation may consume. */
    private int maxTopics = 500;

    /** Per-day sweep limit, expressed as a multiple of the number of working topics. */
    private int iterationCapMultiplier = 3;

    private LocalTime dayStart = LocalTime.of(8, 0);
    private LocalTime lunchStart = LocalTime.of(12, 0);
    private LocalTime lunchEnd = LocalTime.of(13, 0);
    private int bufferMinutes = 15;
    private double minSessionHours = 0.25;

    /** Upper bound on stretching topics when capacity exceeds demand. */
    private double maxScale = 1.5;

    private int roundRobinMaxRepeatsPerDay = 2;
  }

  @Getter
  @Setter
  public static class ProfileDefaults {
    private double maxDailyDeepHours = 6;
    private double maxSessionTime = 1.5;
    private List<String> peakWindows = new ArrayList<>(List.of("17:00"));

    /** Builds a fresh profile from these defaults. */
    public LearnerProfile toProfile() {
      return LearnerProfile.builder()
          .maxDailyDeepHours(maxDailyDeepHours)
          .maxSessionTime(maxSessionTime)
          .peakWindows(new ArrayList<>(peakWindows))
          .subjectConfidence(new LinkedHashMap<>())
          .build();
    }
  }
}
