package org.apache.arrow.ballista.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for the shuffle and plan display components.
 *
 * <p>Supports two modes of configuration, which produce identical results:
 *
 * <ul>
 *   <li><b>Typed builders</b> -- {@link ShuffleOptions} and {@link DisplayOptions}.
 *   <li><b>Raw string map</b> -- {@link #fromStringMap(Map)} with dotted keys such as {@code
 *       "ballista.shuffle.work_dir"} or {@code "ballista.display.max_description_length"}.
 * </ul>
 *
 * <p>Example:
 *
 * <pre>{@code
 * BallistaConfig config = BallistaConfig.builder()
 *     .shuffle(ShuffleOptions.builder()
 *         .workDir(Path.of("/var/lib/ballista"))
 *         .build())
 *     .build();
 *
 * ShuffleWriter writer = new ShuffleWriter(config.shuffle(), allocator);
 * }</pre>
 */
public final class BallistaConfig {

  private static final String KEY_PREFIX = "ballista.";

  private final ShuffleOptions shuffle;
  private final DisplayOptions display;

  private BallistaConfig(ShuffleOptions shuffle, DisplayOptions display) {
    this.shuffle = Objects.requireNonNull(shuffle, "shuffle");
    this.display = Objects.requireNonNull(display, "display");
  }

  /** Returns a configuration with every option at its default. */
  public static BallistaConfig defaults() {
    return builder().build();
  }

  /** Returns a new builder. */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a configuration from dotted-key options.
   *
   * @param options the options; every key must start with {@code ballista.}
   * @return the configuration
   * @throws IllegalArgumentException if a key is unknown or a value cannot be parsed
   */
  public static BallistaConfig fromStringMap(Map<String, String> options) {
    ShuffleOptions.Builder shuffle = ShuffleOptions.builder();
    DisplayOptions display = DisplayOptions.defaults();
    for (Map.Entry<String, String> entry : options.entrySet()) {
      String key = entry.getKey();
      String value = Objects.requireNonNull(entry.getValue(), () -> "value of " + key);
      if (!key.startsWith(KEY_PREFIX)) {
        throw new IllegalArgumentException("Unknown option: " + key);
      }
      if (ShuffleOptions.apply(shuffle, key, value)) {
        continue;
      }
      DisplayOptions updated = DisplayOptions.apply(display, key, value);
      if (updated == null) {
        throw new IllegalArgumentException("Unknown option: " + key);
      }
      display = updated;
    }
    return new BallistaConfig(shuffle.build(), display);
  }

  public ShuffleOptions shuffle() {
    return shuffle;
  }

  public DisplayOptions display() {
    return display;
  }

  /**
   * Returns every option as a dotted-key map that {@link #fromStringMap(Map)} accepts.
   *
   * @return an unmodifiable map in a stable order
   */
  public Map<String, String> toOptionsMap() {
    Map<String, String> map = new LinkedHashMap<>();
    shuffle.writeTo(map);
    display.writeTo(map);
    return Collections.unmodifiableMap(map);
  }

  /** Builder for {@link BallistaConfig}. */
  public static final class Builder {
    private ShuffleOptions shuffle = ShuffleOptions.defaults();
    private DisplayOptions display = DisplayOptions.defaults();

    private Builder() {}

    /** Sets the shuffle options. */
    public Builder shuffle(ShuffleOptions value) {
      this.shuffle = value;
      return this;
    }

    /** Sets the display options. */
    public Builder display(DisplayOptions value) {
      this.display = value;
      return this;
    }

    public BallistaConfig build() {
      return new BallistaConfig(shuffle, display);
    }
  }
}
