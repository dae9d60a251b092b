package com.flamingo.ai.studyplanner.util;

import com.flamingo.ai.studyplanner.exception.InvalidDateException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/** Parsing of {@code yyyy-MM-dd} request dates. */
public final class IsoDates {

  private IsoDates() {}

  /**
   * Parses an ISO local date.
   *
   * @param value the raw request value
   * @param field name of the request field, used in the error message
   * @throws InvalidDateException if the value is blank or not a valid date
   */
  public static LocalDate parse(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new InvalidDateException(field + " is required");
    }
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException e) {
      throw new InvalidDateException(
          String.format("Invalid %s '%s', expected YYYY-MM-DD", field, value), e);
    }
  }
}
