package com.stickerharvester.stickerbot.queue;

import com.stickerharvester.stickerbot.client.TelegramApiException;
import com.stickerharvester.stickerbot.client.TelegramBotClient;
import com.stickerharvester.stickerbot.client.TelegramTransportException;
import com.stickerharvester.stickerbot.config.BotEventLoop;
import com.stickerharvester.stickerbot.config.BotProperties;
import com.stickerharvester.stickerbot.entity.EntityCache;
import com.stickerharvester.stickerbot.entity.EntityKind;
import com.stickerharvester.stickerbot.entity.EntityNormalizer;
import com.stickerharvester.stickerbot.entity.EntityParseException;
import com.stickerharvester.stickerbot.entity.EntityRecord;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class StickerSetInfoQueue extends RateLimitedQueue {

  private final TelegramBotClient bot;
  private final EntityNormalizer normalizer;
  private final EntityCache cache;
  private final ApplicationEventPublisher events;
  private final BotEventLoop loop;

  public StickerSetInfoQueue(
      TelegramBotClient bot,
      EntityNormalizer normalizer,
      EntityCache cache,
      ApplicationEventPublisher events,
      BotEventLoop loop,
      BotProperties properties) {
    super("sticker-set-info", loop, properties.queues().maxAttempts());
    this.bot = bot;
    this.normalizer = normalizer;
    this.cache = cache;
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
  protected boolean isAvailable(String name) {
    return cache.contains(EntityKind.STICKER_SET, name);
  }

  @Override
  protected void announceAvailable(String name) {
    events.publishEvent(new StickerSetInfoReceivedEvent(name));
  }

  @Override
  protected CompletableFuture<?> fetch(String name) {
    return bot.getStickerSet(name)
        .thenAcceptAsync(
            result -> {
              EntityRecord set = normalizer.parseStickerSet(result);
              if (!set.id().equals(name)) {
                throw new EntityParseException(
                    "Sticker set " + name + " was answered as " + set.id());
              }
              log.info(
                  "Sticker set {} has {} files", name, cache.stickerSetFiles(name).size());
              events.publishEvent(new StickerSetInfoReceivedEvent(name));
            },
            loop);
  }

  @Override
  protected void onFailure(String name, Throwable cause) {
    StickerSetInfoFailedEvent.Reason reason;
    if (cause instanceof TelegramApiException api && api.isStickerSetInvalid()) {
      log.info("Sticker set {} does not exist", name);
      reason = StickerSetInfoFailedEvent.Reason.NOT_FOUND;
    } else if (cause instanceof TelegramTransportException) {
      log.warn("Sticker set {} unreachable: {}", name, cause.getMessage());
      reason = StickerSetInfoFailedEvent.Reason.UNREACHABLE;
    } else {
      log.warn("Sticker set {} request rejected: {}", name, cause.getMessage());
      reason = StickerSetInfoFailedEvent.Reason.REJECTED;
    }
    events.publishEvent(new StickerSetInfoFailedEvent(name, reason, cause.getMessage()));
  }
}
