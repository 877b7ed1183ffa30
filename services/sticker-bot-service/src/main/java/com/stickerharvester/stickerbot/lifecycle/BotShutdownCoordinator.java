package com.stickerharvester.stickerbot.lifecycle;

import com.stickerharvester.stickerbot.config.BotProperties;
import com.stickerharvester.stickerbot.polling.UpdatePoller;
import com.stickerharvester.stickerbot.stickerset.StickerSetDownloadOrchestrator;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * Graceful stop: new sticker-set requests are refused and polling stops, then the context close
 * is held until running downloads finish or the grace period runs out. The scheduler keeps
 * ticking meanwhile, so queued files still arrive.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class BotShutdownCoordinator implements ApplicationListener<ContextClosedEvent> {

  private static final long CHECK_INTERVAL_MS = 500;

  private final StickerSetDownloadOrchestrator orchestrator;
  private final UpdatePoller poller;
  private final Duration gracePeriod;
  private final AtomicBoolean shutdownInitiated = new AtomicBoolean(false);

  public BotShutdownCoordinator(
      StickerSetDownloadOrchestrator orchestrator, UpdatePoller poller, BotProperties properties) {
    this.orchestrator = orchestrator;
    this.poller = poller;
    this.gracePeriod = properties.shutdown().gracePeriod();
  }

  public boolean isShuttingDown() {
    return shutdownInitiated.get();
  }

  @Override
  public void onApplicationEvent(@NonNull ContextClosedEvent event) {
    if (!shutdownInitiated.compareAndSet(false, true)) {
      return;
    }
    log.info("Shutdown requested, refusing new sticker set requests");
    orchestrator.beginShutdown();
    poller.stop();

    if (awaitDownloads()) {
      log.info("No sticker set downloads running, shutting down");
    } else {
      log.warn(
          "{} sticker set download(s) still running after {}, shutting down anyway",
          orchestrator.activeDownloadCount(),
          gracePeriod);
    }
  }

  boolean awaitDownloads() {
    long deadline = System.currentTimeMillis() + gracePeriod.toMillis();
    while (orchestrator.activeDownloadCount() > 0) {
      if (System.currentTimeMillis() >= deadline) {
        return false;
      }
      log.info("Waiting for {} sticker set download(s)", orchestrator.activeDownloadCount());
      try {
        Thread.sleep(Math.min(CHECK_INTERVAL_MS, Math.max(1, deadline - System.currentTimeMillis())));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for sticker set downloads");
        return false;
      }
    }
    return true;
  }
}
