package com.stickerharvester.stickerbot.persistence;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/** Raw downloaded files, one per Telegram {@code file_id}. */
@Slf4j
public class LocalFileStore {

  private static final Pattern FILE_ID = Pattern.compile("^[A-Za-z0-9_-]+$");

  private final Path directory;

  public LocalFileStore(Path directory) {
    this.directory = directory;
  }

  public Path directory() {
    return directory;
  }

  public Path pathFor(String fileId) {
    if (fileId == null || !FILE_ID.matcher(fileId).matches()) {
      throw new IllegalArgumentException("Invalid file id: " + fileId);
    }
    return directory.resolve(fileId);
  }

  public boolean hasBeenDownloaded(String fileId) {
    return Files.isRegularFile(pathFor(fileId));
  }

  public byte[] read(String fileId) {
    try {
      return Files.readAllBytes(pathFor(fileId));
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read file " + fileId, e);
    }
  }

  /** Writes through a temp file so a crash never leaves a partial file under the final name. */
  public Path write(String fileId, byte[] content) {
    Path target = pathFor(fileId);
    try {
      Files.createDirectories(directory);
      Path tmp = Files.createTempFile(directory, fileId, ".part");
      Files.write(tmp, content);
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.debug("Stored file {} ({} bytes)", fileId, content.length);
      return target;
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot write file " + fileId, e);
    }
  }
}
