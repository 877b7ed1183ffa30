package com.stickerharvester.stickerbot.client;

/** Telegram answered with {@code ok=false}. */
public class TelegramApiException extends RuntimeException {

  static final String STICKERSET_INVALID = "Bad Request: STICKERSET_INVALID";

  private final String method;
  private final int errorCode;
  private final String description;

  public TelegramApiException(String method, int errorCode, String description) {
    super(method + " failed with " + errorCode + ": " + description);
    this.method = method;
    this.errorCode = errorCode;
    this.description = description == null ? "" : description;
  }

  public String method() {
    return method;
  }

  public int errorCode() {
    return errorCode;
  }

  public String description() {
    return description;
  }

  public boolean isStickerSetInvalid() {
    return errorCode == 400 && STICKERSET_INVALID.equals(description);
  }

  /** Flood control and server-side failures are worth another attempt. */
  public boolean isRetryable() {
    return errorCode == 429 || errorCode >= 500;
  }
}
