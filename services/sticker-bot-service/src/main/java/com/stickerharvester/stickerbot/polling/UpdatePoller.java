package com.stickerharvester.stickerbot.polling;

import com.fasterxml.jackson.databind.JsonNode;
import com.stickerharvester.stickerbot.client.TelegramApiException;
import com.stickerharvester.stickerbot.client.TelegramBotClient;
import com.stickerharvester.stickerbot.config.BotEventLoop;
import com.stickerharvester.stickerbot.config.BotProperties;
import com.stickerharvester.stickerbot.entity.EntityCache;
import com.stickerharvester.stickerbot.entity.EntityKind;
import com.stickerharvester.stickerbot.entity.EntityNormalizer;
import com.stickerharvester.stickerbot.entity.EntityRecord;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Long-poll loop over {@code getUpdates}.
 *
 * <p>At most one request is outstanding. A batch is normalized in order; if any update fails to
 * parse the rest of the batch is dropped and the offset stays where it was, so Telegram delivers
 * it again. Updates already in the cache are not announced a second time.
 */
@Component
@Slf4j
public class UpdatePoller {

  private final TelegramBotClient bot;
  private final EntityNormalizer normalizer;
  private final EntityCache cache;
  private final ApplicationEventPublisher events;
  private final BotEventLoop loop;
  private final int timeoutSeconds;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private boolean requestInFlight;
  private Long offset;

  public UpdatePoller(
      TelegramBotClient bot,
      EntityNormalizer normalizer,
      EntityCache cache,
      ApplicationEventPublisher events,
      BotEventLoop loop,
      BotProperties properties) {
    this.bot = bot;
    this.normalizer = normalizer;
    this.cache = cache;
    this.events = events;
    this.loop = loop;
    this.timeoutSeconds = properties.polling().timeoutSeconds();
    OptionalLong lastSeen = cache.maxNumericId(EntityKind.UPDATE);
    this.offset = lastSeen.isPresent() ? lastSeen.getAsLong() + 1 : null;
  }

  public void start() {
    if (running.compareAndSet(false, true)) {
      log.info("Update polling started, offset={}", offset);
    }
  }

  public void stop() {
    if (running.compareAndSet(true, false)) {
      log.info("Update polling stopped, offset={}", offset);
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  /** Next update id to request; null until the first update was ever seen. */
  public Long offset() {
    return offset;
  }

  @Scheduled(fixedDelayString = "${bot.polling.interval:PT5S}")
  public void tick() {
    if (!running.get() || requestInFlight) {
      return;
    }
    requestInFlight = true;
    bot.getUpdates(offset, timeoutSeconds)
        .whenCompleteAsync(
            (result, error) -> {
              requestInFlight = false;
              if (error != null) {
                logFailure(TelegramBotClient.unwrap(error));
              } else {
                handleBatch(result);
              }
            },
            loop);
  }

  void handleBatch(JsonNode result) {
    if (result == null || !result.isArray()) {
      log.warn("getUpdates returned a non-array result");
      return;
    }
    if (result.isEmpty()) {
      return;
    }
    long maxUpdateId = -1;
    for (JsonNode upd : result) {
      EntityRecord update;
      boolean known = cache.contains(EntityKind.UPDATE, upd.path("update_id").asText(null));
      try {
        update = normalizer.parseUpdate(upd);
      } catch (RuntimeException e) {
        log.error(
            "Dropping update batch at update {}, offset stays {}: {}",
            upd.path("update_id").asText("?"),
            offset,
            e.getMessage());
        return;
      }
      maxUpdateId = Math.max(maxUpdateId, Long.parseLong(update.id()));
      if (!known) {
        try {
          announce(update);
        } catch (RuntimeException e) {
          log.error("Listener failed for update {}", update.id(), e);
        }
      }
    }
    advanceOffset(maxUpdateId + 1);
  }

  private void announce(EntityRecord update) {
    events.publishEvent(new UpdateReceivedEvent(update));
    String type = update.getOrDefault("type", "");
    String messageId = update.get("message_id");
    if ("message".equals(type)) {
      cache
          .get(EntityKind.MESSAGE, messageId)
          .ifPresent(m -> events.publishEvent(new MessageReceivedEvent(update, m)));
    } else if ("channel post".equals(type)) {
      cache
          .get(EntityKind.CHANNEL_POST, messageId)
          .ifPresent(p -> events.publishEvent(new ChannelPostReceivedEvent(update, p)));
    }
  }

  private void advanceOffset(long next) {
    if (offset == null || next > offset) {
      offset = next;
    }
  }

  private void logFailure(Throwable cause) {
    if (cause instanceof TelegramApiException api) {
      log.warn("getUpdates rejected ({}): {}", api.errorCode(), api.description());
    } else {
      log.warn("Telegram polling failed: {}", cause.getMessage());
    }
  }
}
