package com.stickerharvester.stickerbot.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.sqlite.SQLiteDataSource;

class UserPreferenceRepositoryTest {

  @TempDir Path root;

  private JdbcTemplate jdbc;
  private UserPreferenceRepository preferences;

  @BeforeEach
  void setUp() {
    SQLiteDataSource dataSource = new SQLiteDataSource();
    dataSource.setUrl("jdbc:sqlite:" + root.resolve("bot.db"));
    new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
    jdbc = new JdbcTemplate(dataSource);
    preferences = new UserPreferenceRepository(jdbc);
  }

  @Test
  void unsetPreferencesUseTheirDefault() {
    assertThat(preferences.get(5, Preference.GREEDY)).isEqualTo("no");
    assertThat(preferences.get(5, Preference.PROVIDE_STICKER_SET)).isEqualTo("always");
    assertThat(preferences.is(5, Preference.SILENT, "no")).isTrue();
  }

  @Test
  void valuesAreNormalisedAndOverwritten() {
    preferences.set(5, Preference.GREEDY, " YES ");
    assertThat(preferences.get(5, Preference.GREEDY)).isEqualTo("yes");

    preferences.set(5, Preference.GREEDY, "no");
    assertThat(preferences.get(5, Preference.GREEDY)).isEqualTo("no");
    assertThat(preferences.get(6, Preference.GREEDY)).isEqualTo("no");
  }

  @Test
  void disallowedValueIsRejected() {
    assertThatThrownBy(() -> preferences.set(5, Preference.PROVIDE_STICKER_SET, "sometimes"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("always");
  }

  @Test
  void allPreferencesIncludeDefaultsAndSkipUnknownRows() {
    preferences.set(5, Preference.SILENT, "yes");
    jdbc.update("INSERT INTO preferences (user_id, key, value) VALUES (5, 'legacy', 'x')");

    assertThat(preferences.getAll(5))
        .containsEntry(Preference.SILENT, "yes")
        .containsEntry(Preference.GREEDY, "no")
        .containsEntry(Preference.PROVIDE_STICKER_SET, "always")
        .hasSize(3);
  }

  @Test
  void preferenceKeysAreLookedUpLeniently() {
    assertThat(Preference.find(" Provide_Sticker_Set")).contains(Preference.PROVIDE_STICKER_SET);
    assertThat(Preference.find("colour")).isEmpty();
    assertThatThrownBy(() -> Preference.fromKey("colour"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
