package com.stickerharvester.stickerbot.stickerset;

import java.nio.file.Path;
import java.util.List;

public record StickerSetDownloadCompletedEvent(
    String name, Path archive, List<DownloadRequester> requesters) {

  public StickerSetDownloadCompletedEvent {
    requesters = List.copyOf(requesters);
  }
}
