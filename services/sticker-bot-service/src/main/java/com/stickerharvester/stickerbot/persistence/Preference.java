package com.stickerharvester.stickerbot.persistence;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Per-user switches with their allowed values; the first value is the default. */
public enum Preference {
  GREEDY("greedy", List.of("no", "yes")),
  PROVIDE_STICKER_SET("provide_sticker_set", List.of("always", "once", "never")),
  SILENT("silent", List.of("no", "yes"));

  private final String key;
  private final List<String> allowed;

  Preference(String key, List<String> allowed) {
    this.key = key;
    this.allowed = allowed;
  }

  public String key() {
    return key;
  }

  public String defaultValue() {
    return allowed.get(0);
  }

  public List<String> allowedValues() {
    return allowed;
  }

  public static Optional<Preference> find(String key) {
    String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(p -> p.key.equals(normalized)).findFirst();
  }

  public static Preference fromKey(String key) {
    return find(key).orElseThrow(() -> new IllegalArgumentException("Unknown preference: " + key));
  }
}
