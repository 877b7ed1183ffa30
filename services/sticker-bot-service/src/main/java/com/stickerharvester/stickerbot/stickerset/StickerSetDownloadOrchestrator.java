package com.stickerharvester.stickerbot.stickerset;

import com.stickerharvester.stickerbot.entity.EntityCache;
import com.stickerharvester.stickerbot.entity.EntityKind;
import com.stickerharvester.stickerbot.persistence.LocalFileStore;
import com.stickerharvester.stickerbot.queue.FileDownloadFailedEvent;
import com.stickerharvester.stickerbot.queue.FileDownloadQueue;
import com.stickerharvester.stickerbot.queue.FileDownloadedEvent;
import com.stickerharvester.stickerbot.queue.StickerSetInfoFailedEvent;
import com.stickerharvester.stickerbot.queue.StickerSetInfoQueue;
import com.stickerharvester.stickerbot.queue.StickerSetInfoReceivedEvent;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Drives sticker-set downloads: metadata, then every member file, then assembly.
 *
 * <p>Requests for a set that is already being downloaded join the running download. Each download
 * ends with exactly one {@link StickerSetDownloadCompletedEvent} or {@link
 * StickerSetDownloadFailedEvent} naming all of its requesters. Loop-thread confined, except for
 * {@link #activeDownloadCount()} and the shutdown flag.
 */
@Service
@Slf4j
public class StickerSetDownloadOrchestrator {

  private final EntityCache cache;
  private final LocalFileStore files;
  private final StickerSetInfoQueue infoQueue;
  private final FileDownloadQueue fileQueue;
  private final StickerSetAssembler assembler;
  private final ApplicationEventPublisher events;

  private final Map<String, StickerSetDownload> active = new LinkedHashMap<>();
  private final Map<String, Set<String>> setsWaitingForFile = new HashMap<>();
  private final AtomicInteger activeCount = new AtomicInteger();
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  public StickerSetDownloadOrchestrator(
      EntityCache cache,
      LocalFileStore files,
      StickerSetInfoQueue infoQueue,
      FileDownloadQueue fileQueue,
      StickerSetAssembler assembler,
      ApplicationEventPublisher events) {
    this.cache = cache;
    this.files = files;
    this.infoQueue = infoQueue;
    this.fileQueue = fileQueue;
    this.assembler = assembler;
    this.events = events;
  }

  public RequestOutcome request(String name, DownloadRequester requester) {
    if (shuttingDown.get()) {
      log.info("Refusing sticker set {} for chat {}: shutting down", name, requester.chatId());
      return RequestOutcome.REJECTED_SHUTTING_DOWN;
    }
    StickerSetDownload running = active.get(name);
    if (running != null) {
      running.addRequester(requester);
      log.info("Sticker set {} already downloading, chat {} joined", name, requester.chatId());
      return RequestOutcome.COALESCED;
    }
    Path archive = assembler.archivePath(name);
    if (Files.isRegularFile(archive)) {
      events.publishEvent(new StickerSetDownloadCompletedEvent(name, archive, List.of(requester)));
      return RequestOutcome.ALREADY_AVAILABLE;
    }

    StickerSetDownload download = new StickerSetDownload(name, requester);
    active.put(name, download);
    activeCount.incrementAndGet();
    log.info("Sticker set {} download started for chat {}", name, requester.chatId());
    if (cache.contains(EntityKind.STICKER_SET, name)) {
      fetchFiles(download);
    } else {
      infoQueue.enqueue(name);
    }
    return RequestOutcome.STARTED;
  }

  @EventListener
  public void onStickerSetInfoReceived(StickerSetInfoReceivedEvent event) {
    StickerSetDownload download = active.get(event.name());
    if (download != null && download.state() == DownloadState.METADATA_PENDING) {
      fetchFiles(download);
    }
  }

  @EventListener
  public void onStickerSetInfoFailed(StickerSetInfoFailedEvent event) {
    StickerSetDownload download = active.get(event.name());
    if (download == null || download.state() != DownloadState.METADATA_PENDING) {
      return;
    }
    fail(
        download,
        event.reason() == StickerSetInfoFailedEvent.Reason.NOT_FOUND
            ? DownloadFailureReason.STICKER_SET_NOT_FOUND
            : DownloadFailureReason.METADATA_UNAVAILABLE);
  }

  @EventListener
  public void onFileDownloaded(FileDownloadedEvent event) {
    Set<String> waiting = setsWaitingForFile.remove(event.fileId());
    if (waiting == null) {
      return;
    }
    for (String name : waiting) {
      StickerSetDownload download = active.get(name);
      if (download == null || download.state() != DownloadState.FILES_PENDING) {
        continue;
      }
      download.remaining().remove(event.fileId());
      if (download.remaining().isEmpty()) {
        assemble(download);
      }
    }
  }

  @EventListener
  public void onFileDownloadFailed(FileDownloadFailedEvent event) {
    Set<String> waiting = setsWaitingForFile.remove(event.fileId());
    if (waiting == null) {
      return;
    }
    for (String name : waiting) {
      StickerSetDownload download = active.get(name);
      if (download != null && download.state() == DownloadState.FILES_PENDING) {
        log.warn("Sticker set {} lost file {}: {}", name, event.fileId(), event.reason());
        fail(download, DownloadFailureReason.FILE_UNAVAILABLE);
      }
    }
  }

  public boolean isActive(String name) {
    return active.containsKey(name);
  }

  public Optional<DownloadState> state(String name) {
    return Optional.ofNullable(active.get(name)).map(StickerSetDownload::state);
  }

  public List<String> activeNames() {
    return List.copyOf(active.keySet());
  }

  /** Safe to read from any thread. */
  public int activeDownloadCount() {
    return activeCount.get();
  }

  public void beginShutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("No longer accepting sticker set requests, {} still running", activeCount.get());
    }
  }

  public boolean isShuttingDown() {
    return shuttingDown.get();
  }

  private void fetchFiles(StickerSetDownload download) {
    List<String> members = cache.stickerSetFiles(download.name());
    if (!cache.contains(EntityKind.STICKER_SET, download.name()) || members.isEmpty()) {
      log.warn("Sticker set {} has no cached member list", download.name());
      fail(download, DownloadFailureReason.METADATA_UNAVAILABLE);
      return;
    }
    for (String fileId : members) {
      if (!files.hasBeenDownloaded(fileId)) {
        download.remaining().add(fileId);
      }
    }
    if (download.remaining().isEmpty()) {
      assemble(download);
      return;
    }
    download.state(DownloadState.FILES_PENDING);
    List<String> toFetch = new ArrayList<>(download.remaining());
    for (String fileId : toFetch) {
      setsWaitingForFile.computeIfAbsent(fileId, k -> new LinkedHashSet<>()).add(download.name());
    }
    log.info(
        "Sticker set {}: {} of {} files to download",
        download.name(),
        toFetch.size(),
        members.size());
    for (String fileId : toFetch) {
      fileQueue.enqueue(fileId);
    }
  }

  private void assemble(StickerSetDownload download) {
    download.state(DownloadState.ASSEMBLY_PENDING);
    Path archive;
    try {
      archive = assembler.assemble(download.name(), cache.stickerSetFiles(download.name()));
    } catch (StickerSetAssemblyException | UncheckedIOException e) {
      log.error("Sticker set {} assembly failed: {}", download.name(), e.getMessage());
      fail(download, DownloadFailureReason.ASSEMBLY_FAILED);
      return;
    }
    download.state(DownloadState.COMPLETE);
    finish(download);
    log.info("Sticker set {} ready for {} requester(s)", download.name(), download.requesters().size());
    events.publishEvent(
        new StickerSetDownloadCompletedEvent(download.name(), archive, download.requesters()));
  }

  private void fail(StickerSetDownload download, DownloadFailureReason reason) {
    download.state(DownloadState.FAILED);
    finish(download);
    log.warn("Sticker set {} download failed: {}", download.name(), reason);
    events.publishEvent(
        new StickerSetDownloadFailedEvent(download.name(), reason, download.requesters()));
  }

  private void finish(StickerSetDownload download) {
    for (String fileId : download.remaining()) {
      Set<String> waiting = setsWaitingForFile.get(fileId);
      if (waiting != null) {
        waiting.remove(download.name());
        if (waiting.isEmpty()) {
          setsWaitingForFile.remove(fileId);
        }
      }
    }
    if (active.remove(download.name()) != null) {
      activeCount.decrementAndGet();
    }
  }
}
