package com.stickerharvester.stickerbot.config;

/** The bot loop did not run a request-thread call: it was busy, stopped or interrupted. */
public class BotLoopUnavailableException extends RuntimeException {
  public BotLoopUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
