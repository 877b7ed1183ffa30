package com.stickerharvester.stickerbot.persistence;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserPreferenceRepository {

  private final JdbcTemplate jdbc;

  public String get(long userId, Preference preference) {
    List<String> values =
        jdbc.queryForList(
            "SELECT value FROM preferences WHERE user_id = ? AND key = ?",
            String.class,
            userId,
            preference.key());
    return values.isEmpty() || values.get(0) == null ? preference.defaultValue() : values.get(0);
  }

  public boolean is(long userId, Preference preference, String value) {
    return get(userId, preference).equals(value);
  }

  public Map<Preference, String> getAll(long userId) {
    Map<Preference, String> out = new EnumMap<>(Preference.class);
    for (Preference p : Preference.values()) {
      out.put(p, p.defaultValue());
    }
    jdbc.query(
        "SELECT key, value FROM preferences WHERE user_id = ?",
        rs -> {
          String value = rs.getString("value");
          Preference.find(rs.getString("key")).ifPresent(p -> out.put(p, value));
        },
        userId);
    return out;
  }

  public void set(long userId, Preference preference, String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    if (!preference.allowedValues().contains(normalized)) {
      throw new IllegalArgumentException(
          preference.key() + " must be one of " + preference.allowedValues());
    }
    jdbc.update(
        "INSERT INTO preferences (user_id, key, value) VALUES (?, ?, ?)"
            + " ON CONFLICT(user_id, key) DO UPDATE SET value = excluded.value",
        userId,
        preference.key(),
        normalized);
  }
}
