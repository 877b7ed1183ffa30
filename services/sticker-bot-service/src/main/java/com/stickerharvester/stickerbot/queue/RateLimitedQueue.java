package com.stickerharvester.stickerbot.queue;

import com.stickerharvester.stickerbot.client.TelegramApiException;
import com.stickerharvester.stickerbot.client.TelegramBotClient;
import com.stickerharvester.stickerbot.client.TelegramTransportException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;

/**
 * FIFO of ids fetched one request per tick. While a request is outstanding ticks do nothing, so
 * the request rate never exceeds one per tick interval. Loop-thread confined.
 */
@Slf4j
public abstract class RateLimitedQueue {

  private final String name;
  private final Executor loop;
  private final int maxAttempts;
  private final Deque<String> pending = new ArrayDeque<>();
  private final Map<String, Integer> failedAttempts = new HashMap<>();
  private String inFlight;

  protected RateLimitedQueue(String name, Executor loop, int maxAttempts) {
    this.name = name;
    this.loop = loop;
    this.maxAttempts = maxAttempts;
  }

  /**
   * Ids whose result is already available are announced right away; ids already pending or in
   * flight are not queued twice.
   */
  public void enqueue(String id) {
    if (isAvailable(id)) {
      announceAvailable(id);
      return;
    }
    if (id.equals(inFlight) || pending.contains(id)) {
      log.debug("{} queue already holds {}", name, id);
      return;
    }
    pending.addLast(id);
  }

  /** Issues at most one request. Subclasses call this from their {@code @Scheduled} tick. */
  protected void processNext() {
    if (inFlight != null || pending.isEmpty()) {
      return;
    }
    String id = pending.pollFirst();
    inFlight = id;
    CompletableFuture<?> request;
    try {
      request = fetch(id);
    } catch (RuntimeException e) {
      request = CompletableFuture.failedFuture(e);
    }
    request.whenCompleteAsync((ignored, error) -> complete(id, error), loop);
  }

  public int size() {
    return pending.size() + (inFlight == null ? 0 : 1);
  }

  public List<String> pendingIds() {
    return List.copyOf(pending);
  }

  private void complete(String id, Throwable error) {
    inFlight = null;
    if (error == null) {
      failedAttempts.remove(id);
      return;
    }
    Throwable cause = TelegramBotClient.unwrap(error);
    if (isRetryable(cause)) {
      int attempts = failedAttempts.merge(id, 1, Integer::sum);
      if (attempts < maxAttempts) {
        log.warn(
            "{} request for {} failed (attempt {}/{}), requeued: {}",
            name,
            id,
            attempts,
            maxAttempts,
            cause.getMessage());
        pending.addLast(id);
        return;
      }
    }
    failedAttempts.remove(id);
    onFailure(id, cause);
  }

  private static boolean isRetryable(Throwable cause) {
    if (cause instanceof TelegramApiException api) {
      return api.isRetryable();
    }
    return cause instanceof TelegramTransportException || cause instanceof UncheckedIOException;
  }

  protected abstract boolean isAvailable(String id);

  protected abstract void announceAvailable(String id);

  /** Completes once the result has been stored and announced. */
  protected abstract CompletableFuture<?> fetch(String id);

  /** Called once retries are exhausted or the failure is permanent. */
  protected abstract void onFailure(String id, Throwable cause);
}
