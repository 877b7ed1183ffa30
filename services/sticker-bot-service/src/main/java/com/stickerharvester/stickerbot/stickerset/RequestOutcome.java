package com.stickerharvester.stickerbot.stickerset;

public enum RequestOutcome {
  STARTED,
  /** A download of the same set was running; the requester was added to it. */
  COALESCED,
  /** The archive was already on disk and a completion was published at once. */
  ALREADY_AVAILABLE,
  REJECTED_SHUTTING_DOWN
}
