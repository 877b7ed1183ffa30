package com.stickerharvester.stickerbot.api;

public class ConflictException extends RuntimeException {
  public ConflictException(String message) {
    super(message);
  }
}
