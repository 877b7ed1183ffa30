package com.stickerharvester.stickerbot.api;

import com.stickerharvester.stickerbot.config.BotEventLoop;
import com.stickerharvester.stickerbot.entity.EntityCache;
import com.stickerharvester.stickerbot.entity.EntityKind;
import com.stickerharvester.stickerbot.entity.EntityRecord;
import com.stickerharvester.stickerbot.persistence.EntityStore;
import com.stickerharvester.stickerbot.persistence.LocalFileStore;
import com.stickerharvester.stickerbot.polling.UpdatePoller;
import com.stickerharvester.stickerbot.queue.FileDownloadQueue;
import com.stickerharvester.stickerbot.queue.StickerSetInfoQueue;
import com.stickerharvester.stickerbot.stickerset.DownloadRequester;
import com.stickerharvester.stickerbot.stickerset.RequestOutcome;
import com.stickerharvester.stickerbot.stickerset.StickerSetAssembler;
import com.stickerharvester.stickerbot.stickerset.StickerSetDownloadOrchestrator;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** Admin operations. Everything touching bot state runs on the bot loop. */
@Service
@Slf4j
public class BotAdminService {

  private static final Pattern SET_NAME = Pattern.compile("^[a-zA-Z0-9_]+$");

  private final BotEventLoop loop;
  private final UpdatePoller poller;
  private final FileDownloadQueue fileQueue;
  private final StickerSetInfoQueue infoQueue;
  private final StickerSetDownloadOrchestrator orchestrator;
  private final EntityCache cache;
  private final EntityStore store;
  private final LocalFileStore files;
  private final StickerSetAssembler assembler;
  private final Clock clock;
  private final Instant startedAt;

  @Autowired
  public BotAdminService(
      BotEventLoop loop,
      UpdatePoller poller,
      FileDownloadQueue fileQueue,
      StickerSetInfoQueue infoQueue,
      StickerSetDownloadOrchestrator orchestrator,
      EntityCache cache,
      EntityStore store,
      LocalFileStore files,
      StickerSetAssembler assembler) {
    this(loop, poller, fileQueue, infoQueue, orchestrator, cache, store, files, assembler,
        Clock.systemUTC());
  }

  BotAdminService(
      BotEventLoop loop,
      UpdatePoller poller,
      FileDownloadQueue fileQueue,
      StickerSetInfoQueue infoQueue,
      StickerSetDownloadOrchestrator orchestrator,
      EntityCache cache,
      EntityStore store,
      LocalFileStore files,
      StickerSetAssembler assembler,
      Clock clock) {
    this.loop = loop;
    this.poller = poller;
    this.fileQueue = fileQueue;
    this.infoQueue = infoQueue;
    this.orchestrator = orchestrator;
    this.cache = cache;
    this.store = store;
    this.files = files;
    this.assembler = assembler;
    this.clock = clock;
    this.startedAt = clock.instant();
  }

  public BotStatus status() {
    Duration uptime = Duration.between(startedAt, clock.instant());
    return loop.call(
        () ->
            new BotStatus(
                startedAt,
                formatUptime(uptime),
                poller.isRunning(),
                poller.offset(),
                fileQueue.size(),
                infoQueue.size(),
                orchestrator.activeNames(),
                cache.size(EntityKind.STICKER_SET),
                orchestrator.isShuttingDown()));
  }

  public List<StickerSetSummary> stickerSets() {
    return loop.call(
        () ->
            cache.all(EntityKind.STICKER_SET).stream()
                .sorted(Comparator.comparing(EntityRecord::id))
                .map(this::summarize)
                .toList());
  }

  public StickerSetSummary stickerSet(String name) {
    return loop.call(
        () ->
            cache
                .get(EntityKind.STICKER_SET, name)
                .map(this::summarize)
                .orElseThrow(() -> new NotFoundException("Unknown sticker set: " + name)));
  }

  /** Forgets a set's metadata and member list; downloaded files and archives stay on disk. */
  public void removeStickerSet(String name) {
    loop.call(
        () -> {
          if (orchestrator.isActive(name)) {
            throw new ConflictException("Sticker set " + name + " is being downloaded");
          }
          if (!cache.contains(EntityKind.STICKER_SET, name)) {
            throw new NotFoundException("Unknown sticker set: " + name);
          }
          store.removeStickerSet(name);
          cache.removeStickerSet(name);
          log.info("Removed sticker set {} from the cache", name);
          return null;
        });
  }

  public DownloadResponse requestDownload(String name, DownloadRequest request) {
    if (!SET_NAME.matcher(name).matches()) {
      throw new IllegalArgumentException("Invalid sticker set name: " + name);
    }
    long userId = request.userId() == null ? request.chatId() : request.userId();
    DownloadRequester requester = new DownloadRequester(userId, request.chatId(), null);
    RequestOutcome outcome = loop.call(() -> orchestrator.request(name, requester));
    return new DownloadResponse(name, outcome);
  }

  private StickerSetSummary summarize(EntityRecord set) {
    List<String> members = cache.stickerSetFiles(set.id());
    int downloaded = (int) members.stream().filter(files::hasBeenDownloaded).count();
    return new StickerSetSummary(
        set.id(),
        set.get("title"),
        members.size(),
        downloaded,
        Files.isRegularFile(assembler.archivePath(set.id())),
        orchestrator.state(set.id()).map(Enum::name).orElse(null));
  }

  static String formatUptime(Duration uptime) {
    long seconds = uptime.getSeconds();
    return String.format("%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
  }
}
