package com.stickerharvester.stickerbot.entity;

public class EntityParseException extends RuntimeException {
  public EntityParseException(String message) {
    super(message);
  }

  public EntityParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
