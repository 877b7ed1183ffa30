package com.stickerharvester.stickerbot.queue;

public record StickerSetInfoFailedEvent(String name, Reason reason, String detail) {

  public enum Reason {
    /** Telegram reported {@code STICKERSET_INVALID}. */
    NOT_FOUND,
    /** Any other rejection or an unreadable answer. */
    REJECTED,
    /** Network failures outlasted the retry budget. */
    UNREACHABLE
  }
}
