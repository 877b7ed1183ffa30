package com.stickerharvester.stickerbot.stickerset;

public enum DownloadFailureReason {
  STICKER_SET_NOT_FOUND,
  METADATA_UNAVAILABLE,
  FILE_UNAVAILABLE,
  ASSEMBLY_FAILED
}
