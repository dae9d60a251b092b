package com.flamingo.ai.studyplanner.service.export;

import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.DayOfWeek;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Locale;

/** Text helpers shared by the exporters. */
final class ExportFormatting {

  static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");

  private ExportFormatting() {}

  static String weekday(DayOfWeek day) {
    return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
  }

  /** Hours with one or two decimals, e.g. {@code 6.0} or {@code 1.25}. */
  static String hours(double hours) {
    DecimalFormat format = new DecimalFormat("0.0#", DecimalFormatSymbols.getInstance(Locale.ROOT));
    format.setRoundingMode(RoundingMode.HALF_UP);
    return format.format(hours);
  }

  static String truncate(String text, int maxLength) {
    return text.length() <= maxLength ? text : text.substring(0, maxLength);
  }
}
