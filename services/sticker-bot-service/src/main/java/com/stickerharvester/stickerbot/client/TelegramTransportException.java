package com.stickerharvester.stickerbot.client;

/** The request never produced a readable Telegram envelope (I/O error, timeout, non-JSON body). */
public class TelegramTransportException extends RuntimeException {
  public TelegramTransportException(String message) {
    super(message);
  }

  public TelegramTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
