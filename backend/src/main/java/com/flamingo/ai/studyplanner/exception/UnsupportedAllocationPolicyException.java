package com.flamingo.ai.studyplanner.exception;

/** Exception thrown when a schedule is requested under a policy that has no allocator. */
public class UnsupportedAllocationPolicyException extends RuntimeException {

  private final String policy;

  public UnsupportedAllocationPolicyException(String policy) {
    super("Unsupported allocation policy: " + policy);
    this.policy = policy;
  }

  public String getPolicy() {
    return policy;
  }
}
