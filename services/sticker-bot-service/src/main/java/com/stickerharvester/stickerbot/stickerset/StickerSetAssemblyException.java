package com.stickerharvester.stickerbot.stickerset;

public class StickerSetAssemblyException extends RuntimeException {
  public StickerSetAssemblyException(String message) {
    super(message);
  }

  public StickerSetAssemblyException(String message, Throwable cause) {
    super(message, cause);
  }
}
