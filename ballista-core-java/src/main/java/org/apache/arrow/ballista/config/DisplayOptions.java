package org.apache.arrow.ballista.config;

import java.util.Map;

/**
 * Options for rendering plans as text.
 *
 * @param maxDescriptionLength maximum number of code points kept from the generic description of a
 *     node without a dedicated rendering
 * @param indent the string repeated once per nesting level
 */
public record DisplayOptions(int maxDescriptionLength, String indent) {

  static final String PREFIX = "ballista.display.";

  public static final int DEFAULT_MAX_DESCRIPTION_LENGTH = 120;
  public static final String DEFAULT_INDENT = "  ";

  public DisplayOptions {
    if (maxDescriptionLength <= 0) {
      throw new IllegalArgumentException(
          "maxDescriptionLength must be positive, got " + maxDescriptionLength);
    }
    if (indent == null) {
      indent = DEFAULT_INDENT;
    }
  }

  /** Returns the default options: 120 code points, two-space indent. */
  public static DisplayOptions defaults() {
    return new DisplayOptions(DEFAULT_MAX_DESCRIPTION_LENGTH, DEFAULT_INDENT);
  }

  void writeTo(Map<String, String> map) {
    map.put(PREFIX + "max_description_length", Integer.toString(maxDescriptionLength));
    map.put(PREFIX + "indent", indent);
  }

  /** Applies one dotted-key option; {@code indent_width} is shorthand for that many spaces. */
  static DisplayOptions apply(DisplayOptions current, String key, String value) {
    return switch (key) {
      case PREFIX + "max_description_length" ->
          new DisplayOptions(ConfigValues.parseInt(key, value), current.indent());
      case PREFIX + "indent" -> new DisplayOptions(current.maxDescriptionLength(), value);
      case PREFIX + "indent_width" ->
          new DisplayOptions(
              current.maxDescriptionLength(), " ".repeat(ConfigValues.parseInt(key, value)));
      default -> null;
    };
  }
}
