package com.stickerharvester.stickerbot.entity;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** Flat attribute map of one normalized entity. Values are the wire values as strings. */
public record EntityRecord(EntityKind kind, String id, Map<String, String> attributes) {

  public EntityRecord {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(id, "id");
    attributes = Collections.unmodifiableMap(new TreeMap<>(attributes));
  }

  public String get(String key) {
    return attributes.get(key);
  }

  public String getOrDefault(String key, String fallback) {
    return attributes.getOrDefault(key, fallback);
  }

  public boolean has(String key) {
    return attributes.containsKey(key);
  }

  public boolean isTrue(String key) {
    return "true".equals(attributes.get(key));
  }
}
