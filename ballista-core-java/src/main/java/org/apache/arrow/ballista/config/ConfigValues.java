package org.apache.arrow.ballista.config;

/** Parsing helpers for string-valued options. */
final class ConfigValues {

  private ConfigValues() {}

  static boolean parseBoolean(String key, String value) {
    if ("true".equalsIgnoreCase(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw new IllegalArgumentException("Option " + key + " expects true or false, got: " + value);
  }

  static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Option " + key + " expects an integer, got: " + value, e);
    }
  }
}
