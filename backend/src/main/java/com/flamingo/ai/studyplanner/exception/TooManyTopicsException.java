package com.flamingo.ai.studyplanner.exception;

/** Exception thrown when the topic collection exceeds the configured allocation cap. */
public class TooManyTopicsException extends RuntimeException {

  private final int topicCount;
  private final int maxTopics;

  public TooManyTopicsException(int topicCount, int maxTopics) {
    super(String.format("Cannot schedule %d topics; the limit is %d", topicCount, maxTopics));
    this.topicCount = topicCount;
    this.maxTopics = maxTopics;
  }

  public int getTopicCount() {
    return topicCount;
  }

  public int getMaxTopics() {
    return maxTopics;
  }
}
