package com.stickerharvester.stickerbot.config;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * The single thread that owns the entity cache, the queues and the download orchestrator.
 *
 * <p>Completions of Telegram calls are handed back here with {@code whenCompleteAsync(.., loop)};
 * request threads use {@link #call(Supplier)} to read or mutate bot state.
 */
public class BotEventLoop implements Executor {

  private static final long CALL_TIMEOUT_SECONDS = 10;

  private final Executor delegate;

  public BotEventLoop(Executor delegate) {
    this.delegate = delegate;
  }

  @Override
  public void execute(Runnable command) {
    delegate.execute(command);
  }

  public <T> T call(Supplier<T> action) {
    CompletableFuture<T> future;
    try {
      future = CompletableFuture.supplyAsync(action, delegate);
    } catch (RejectedExecutionException e) {
      throw new BotLoopUnavailableException("Bot loop is not accepting work", e);
    }
    try {
      return future.get(CALL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BotLoopUnavailableException("Interrupted while waiting for the bot loop", e);
    } catch (TimeoutException e) {
      throw new BotLoopUnavailableException("Bot loop did not answer in time", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException re) {
        throw re;
      }
      if (e.getCause() instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException(e.getCause());
    }
  }
}
