package com.stickerharvester.stickerbot.stickerset;

import java.nio.file.Path;
import java.util.List;

/** Terminal step of a sticker-set download, run once every member file is on disk. */
public interface StickerSetAssembler {

  /** Where the finished archive of {@code name} lives, whether or not it exists yet. */
  Path archivePath(String name);

  /**
   * @throws StickerSetAssemblyException when the archive cannot be produced
   */
  Path assemble(String name, List<String> fileIds);
}
