package com.flamingo.ai.studyplanner.service.segmentation;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Scores how demanding a passage of study material is, in [0.3, 0.9].
 *
 * <p>Starts from 0.4 and adds weight for mathematical symbols, inline formulas such as {@code
 * x = a + b}, definition-heavy prose, and quantitative subjects.
 */
@Component
public class ComplexityEstimator {

  static final double MIN_COMPLEXITY = 0.3;
  static final double MAX_COMPLEXITY = 0.9;
  static final double EMPTY_SAMPLE_COMPLEXITY = 0.5;

  private static final double BASE = 0.4;

  private static final Pattern MATH_SYMBOLS = Pattern.compile("[∑∫∂∇≤≥≠±×÷√∞∈∀∃=]");
  private static final Pattern FORMULAS = Pattern.compile("\\b[a-z]\\s*=\\s*[^,\\n]{3,}");
  private static final Pattern DEFINITIONS =
      Pattern.compile("\\b(defined?|means?|refers?\\s+to|is\\s+called)\\b");

  private static final List<String> QUANTITATIVE_SUBJECTS =
      List.of("physics", "math", "calculus", "chem");

  /**
   * Estimates the complexity of a text sample.
   *
   * @param sample leading text of a section; may be empty
   * @param subject subject the material belongs to
   * @return complexity in [0.3, 0.9]; 0.5 for an empty sample
   */
  public double estimate(String sample, String subject) {
    if (sample == null || sample.isEmpty()) {
      return EMPTY_SAMPLE_COMPLEXITY;
    }
    String lower = sample.toLowerCase(Locale.ROOT);

    double complexity = BASE;
    if (count(MATH_SYMBOLS, sample) > 3) {
      complexity += 0.15;
    }
    if (count(FORMULAS, lower) > 2) {
      complexity += 0.15;
    }
    if (count(DEFINITIONS, lower) > 3) {
      complexity += 0.1;
    }
    if (isQuantitative(subject)) {
      complexity += 0.1;
    }
    return Math.min(MAX_COMPLEXITY, Math.max(MIN_COMPLEXITY, complexity));
  }

  private boolean isQuantitative(String subject) {
    if (subject == null) {
      return false;
    }
    String lower = subject.toLowerCase(Locale.ROOT);
    return QUANTITATIVE_SUBJECTS.stream().anyMatch(lower::contains);
  }

  private static int count(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }
}
