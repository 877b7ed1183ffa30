package com.stickerharvester.stickerbot.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.stickerharvester.stickerbot.client.TelegramApiException;
import com.stickerharvester.stickerbot.client.TelegramBotClient;
import com.stickerharvester.stickerbot.config.BotEventLoop;
import com.stickerharvester.stickerbot.config.BotProperties;
import com.stickerharvester.stickerbot.entity.EntityNormalizer;
import com.stickerharvester.stickerbot.entity.EntityParseException;
import com.stickerharvester.stickerbot.persistence.LocalFileStore;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** {@code getFile}, then the bytes behind its {@code file_path}, written under the file id. */
@Component
@Slf4j
public class FileDownloadQueue extends RateLimitedQueue {

  private final TelegramBotClient bot;
  private final EntityNormalizer normalizer;
  private final LocalFileStore files;
  private final ApplicationEventPublisher events;
  private final BotEventLoop loop;

  public FileDownloadQueue(
      TelegramBotClient bot,
      EntityNormalizer normalizer,
      LocalFileStore files,
      ApplicationEventPublisher events,
      BotEventLoop loop,
      BotProperties properties) {
    super("file-download", loop, properties.queues().maxAttempts());
    this.bot = bot;
    this.normalizer = normalizer;
    this.files = files;
    this.events = events;
    this.loop = loop;
  }

  @Scheduled(
      fixedDelayString = "${bot.queues.interval:PT1S}",
      initialDelayString = "${bot.queues.interval:PT1S}")
  public void tick() {
    processNext();
  }

  @Override
  protected boolean isAvailable(String fileId) {
    return files.hasBeenDownloaded(fileId);
  }

  @Override
  protected void announceAvailable(String fileId) {
    events.publishEvent(new FileDownloadedEvent(fileId));
  }

  @Override
  protected CompletableFuture<?> fetch(String fileId) {
    return bot.getFile(fileId)
        .thenCompose(
            file -> {
              String filePath = file.path("file_path").asText("");
              if (filePath.isBlank()) {
                throw new TelegramApiException("getFile", 404, "no file_path for " + fileId);
              }
              return bot.downloadFile(filePath)
                  .thenApply(bytes -> files.write(fileId, bytes))
                  .thenApplyAsync(stored -> store(fileId, file), loop);
            });
  }

  private JsonNode store(String fileId, JsonNode file) {
    try {
      normalizer.parseFile(file);
    } catch (EntityParseException e) {
      log.warn("File {} stored without metadata: {}", fileId, e.getMessage());
    }
    log.info("Downloaded file {}", fileId);
    events.publishEvent(new FileDownloadedEvent(fileId));
    return file;
  }

  @Override
  protected void onFailure(String fileId, Throwable cause) {
    log.warn("Giving up on file {}: {}", fileId, cause.getMessage());
    events.publishEvent(new FileDownloadFailedEvent(fileId, cause.getMessage()));
  }
}
