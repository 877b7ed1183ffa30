package com.stickerharvester.stickerbot.stickerset;

import com.stickerharvester.stickerbot.entity.EntityCache;
import com.stickerharvester.stickerbot.entity.EntityKind;
import com.stickerharvester.stickerbot.entity.EntityRecord;
import com.stickerharvester.stickerbot.persistence.LocalFileStore;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import lombok.extern.slf4j.Slf4j;

/**
 * Copies the members to {@code <dir>/<name>/Sticker_001.webp ...} and zips that folder into
 * {@code <dir>/<name>.zip}.
 */
@Slf4j
public class ZipStickerSetAssembler implements StickerSetAssembler {

  private final Path directory;
  private final LocalFileStore files;
  private final EntityCache cache;

  public ZipStickerSetAssembler(Path directory, LocalFileStore files, EntityCache cache) {
    this.directory = directory;
    this.files = files;
    this.cache = cache;
  }

  @Override
  public Path archivePath(String name) {
    return directory.resolve(safeName(name) + ".zip");
  }

  @Override
  public Path assemble(String name, List<String> fileIds) {
    Path folder = directory.resolve(safeName(name));
    Path archive = archivePath(name);
    Path tmp = null;
    try {
      Files.createDirectories(folder);
      tmp = Files.createTempFile(directory, safeName(name), ".zip.part");
      try (OutputStream out = Files.newOutputStream(tmp);
          ZipOutputStream zip = new ZipOutputStream(out)) {
        for (int i = 0; i < fileIds.size(); i++) {
          String fileId = fileIds.get(i);
          if (!files.hasBeenDownloaded(fileId)) {
            throw new StickerSetAssemblyException(
                "Sticker set " + name + " is missing file " + fileId);
          }
          String entryName = String.format("Sticker_%03d.%s", i + 1, extensionOf(fileId));
          Path member = folder.resolve(entryName);
          Files.copy(files.pathFor(fileId), member, StandardCopyOption.REPLACE_EXISTING);

          zip.putNextEntry(new ZipEntry(safeName(name) + "/" + entryName));
          Files.copy(member, zip);
          zip.closeEntry();
        }
      }
      Files.move(tmp, archive, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new StickerSetAssemblyException("Cannot assemble sticker set " + name, e);
    } finally {
      if (tmp != null) {
        deleteLeftover(tmp);
      }
    }
    log.info("Assembled sticker set {} ({} files) into {}", name, fileIds.size(), archive);
    return archive;
  }

  String extensionOf(String fileId) {
    EntityRecord file = cache.get(EntityKind.FILE, fileId).orElse(null);
    if (file == null) {
      return "webp";
    }
    if (file.isTrue("is_video")) {
      return "webm";
    }
    return file.isTrue("is_animated") ? "tgs" : "webp";
  }

  private static void deleteLeftover(Path tmp) {
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.warn("Cannot delete leftover {}: {}", tmp, e.getMessage());
    }
  }

  /** Sticker set names are {@code [A-Za-z0-9_]}; anything else is replaced. */
  static String safeName(String name) {
    return name.replaceAll("[^A-Za-z0-9_]", "_");
  }
}
