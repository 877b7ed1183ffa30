package com.stickerharvester.stickerbot.config;

import com.stickerharvester.stickerbot.entity.EntityCache;
import com.stickerharvester.stickerbot.persistence.EntityStore;
import com.stickerharvester.stickerbot.persistence.LocalFileStore;
import com.stickerharvester.stickerbot.stickerset.ZipStickerSetAssembler;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteDataSource;

@Configuration
@Slf4j
public class StorageConfig {

  @Bean
  public DataSource dataSource(BotProperties properties) {
    BotProperties.Storage storage = properties.storage();
    createDirectory(storage.databaseFile().getParent());
    createDirectory(storage.filesDir());
    createDirectory(storage.stickerSetsDir());
    log.info("Bot storage root: {}", storage.rootPath());

    SQLiteDataSource dataSource = new SQLiteDataSource();
    dataSource.setUrl("jdbc:sqlite:" + storage.databaseFile());
    return dataSource;
  }

  @Bean
  public LocalFileStore localFileStore(BotProperties properties) {
    return new LocalFileStore(properties.storage().filesDir());
  }

  @Bean
  public ZipStickerSetAssembler stickerSetAssembler(
      BotProperties properties, LocalFileStore files, EntityCache cache) {
    return new ZipStickerSetAssembler(properties.storage().stickerSetsDir(), files, cache);
  }

  /** Loaded once at startup; the cache is authoritative from then on. */
  @Bean
  public EntityCache entityCache(EntityStore store) {
    EntityCache cache = new EntityCache();
    cache.loadFrom(store);
    return cache;
  }

  private static void createDirectory(Path dir) {
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create storage directory " + dir, e);
    }
  }
}
