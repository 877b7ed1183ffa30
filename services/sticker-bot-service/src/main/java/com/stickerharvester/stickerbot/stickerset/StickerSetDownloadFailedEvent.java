package com.stickerharvester.stickerbot.stickerset;

import java.util.List;

public record StickerSetDownloadFailedEvent(
    String name, DownloadFailureReason reason, List<DownloadRequester> requesters) {

  public StickerSetDownloadFailedEvent {
    requesters = List.copyOf(requesters);
  }
}
