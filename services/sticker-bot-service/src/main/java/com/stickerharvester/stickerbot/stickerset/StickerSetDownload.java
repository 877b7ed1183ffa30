package com.stickerharvester.stickerbot.stickerset;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Mutable state of one running sticker-set download. */
final class StickerSetDownload {

  private final String name;
  private final List<DownloadRequester> requesters = new ArrayList<>();
  private final Set<String> remaining = new LinkedHashSet<>();
  private DownloadState state = DownloadState.METADATA_PENDING;

  StickerSetDownload(String name, DownloadRequester first) {
    this.name = name;
    this.requesters.add(first);
  }

  String name() {
    return name;
  }

  DownloadState state() {
    return state;
  }

  void state(DownloadState state) {
    this.state = state;
  }

  List<DownloadRequester> requesters() {
    return requesters;
  }

  void addRequester(DownloadRequester requester) {
    if (!requesters.contains(requester)) {
      requesters.add(requester);
    }
  }

  Set<String> remaining() {
    return remaining;
  }
}
