package com.stickerharvester.stickerbot.stickerset;

public enum DownloadState {
  METADATA_PENDING,
  FILES_PENDING,
  ASSEMBLY_PENDING,
  COMPLETE,
  FAILED
}
