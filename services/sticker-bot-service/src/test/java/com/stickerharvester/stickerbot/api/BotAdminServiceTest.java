package com.stickerharvester.stickerbot.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import com.stickerharvester.stickerbot.config.BotEventLoop;
import com.stickerharvester.stickerbot.entity.EntityCache;
import com.stickerharvester.stickerbot.entity.EntityKind;
import com.stickerharvester.stickerbot.entity.EntityRecord;
import com.stickerharvester.stickerbot.persistence.LocalFileStore;
import com.stickerharvester.stickerbot.polling.UpdatePoller;
import com.stickerharvester.stickerbot.queue.FileDownloadQueue;
import com.stickerharvester.stickerbot.queue.StickerSetInfoQueue;
import com.stickerharvester.stickerbot.stickerset.DownloadRequester;
import com.stickerharvester.stickerbot.stickerset.RequestOutcome;
import com.stickerharvester.stickerbot.stickerset.StickerSetDownloadOrchestrator;
import com.stickerharvester.stickerbot.stickerset.ZipStickerSetAssembler;
import com.stickerharvester.stickerbot.support.InMemoryEntityStore;
import com.stickerharvester.stickerbot.support.RecordingEventPublisher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BotAdminServiceTest {

  @TempDir Path root;

  private UpdatePoller poller;
  private FileDownloadQueue fileQueue;
  private StickerSetInfoQueue infoQueue;
  private EntityCache cache;
  private InMemoryEntityStore store;
  private LocalFileStore files;
  private ZipStickerSetAssembler assembler;
  private StickerSetDownloadOrchestrator orchestrator;
  private BotAdminService admin;

  @BeforeEach
  void setUp() {
    poller = mock(UpdatePoller.class);
    fileQueue = mock(FileDownloadQueue.class);
    infoQueue = mock(StickerSetInfoQueue.class);
    cache = new EntityCache();
    store = new InMemoryEntityStore();
    files = new LocalFileStore(root.resolve("files"));
    assembler = new ZipStickerSetAssembler(root.resolve("sets"), files, cache);
    orchestrator =
        new StickerSetDownloadOrchestrator(
            cache, files, infoQueue, fileQueue, assembler, new RecordingEventPublisher());
    admin =
        new BotAdminService(
            new BotEventLoop(Runnable::run),
            poller,
            fileQueue,
            infoQueue,
            orchestrator,
            cache,
            store,
            files,
            assembler,
            Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
  }

  private void cachedSet(String name, String... fileIds) {
    EntityRecord set =
        new EntityRecord(EntityKind.STICKER_SET, name, Map.of("name", name, "title", name + "!"));
    store.saveStickerSet(set, List.of(fileIds));
    cache.putStickerSet(set, List.of(fileIds));
  }

  @Test
  void statusReportsPollerAndQueues() {
    given(poller.isRunning()).willReturn(true);
    given(poller.offset()).willReturn(43L);
    given(fileQueue.size()).willReturn(4);
    cachedSet("Cats", "S1");
    orchestrator.request("Dogs", new DownloadRequester(5, 3, null));

    BotStatus status = admin.status();

    assertThat(status.polling()).isTrue();
    assertThat(status.offset()).isEqualTo(43L);
    assertThat(status.fileQueueSize()).isEqualTo(4);
    assertThat(status.activeDownloads()).containsExactly("Dogs");
    assertThat(status.cachedStickerSets()).isEqualTo(1);
    assertThat(status.uptime()).isEqualTo("0:00:00");
    assertThat(status.shuttingDown()).isFalse();
  }

  @Test
  void summaryCountsDownloadedFilesAndArchive() throws IOException {
    cachedSet("Cats", "S1", "S2");
    files.write("S1", new byte[] {1});
    Files.createDirectories(root.resolve("sets"));
    Files.write(assembler.archivePath("Cats"), new byte[] {1});

    StickerSetSummary summary = admin.stickerSet("Cats");

    assertThat(summary.title()).isEqualTo("Cats!");
    assertThat(summary.files()).isEqualTo(2);
    assertThat(summary.downloadedFiles()).isEqualTo(1);
    assertThat(summary.archived()).isTrue();
    assertThat(summary.download()).isNull();
  }

  @Test
  void setsAreListedByName() {
    cachedSet("Zebras", "Z1");
    cachedSet("Ants", "A1");

    assertThat(admin.stickerSets())
        .extracting(StickerSetSummary::name)
        .containsExactly("Ants", "Zebras");
  }

  @Test
  void unknownSetIsNotFound() {
    assertThatThrownBy(() -> admin.stickerSet("Nope")).isInstanceOf(NotFoundException.class);
    assertThatThrownBy(() -> admin.removeStickerSet("Nope")).isInstanceOf(NotFoundException.class);
  }

  @Test
  void removalForgetsMetadataButKeepsFiles() {
    cachedSet("Cats", "S1");
    files.write("S1", new byte[] {1});

    admin.removeStickerSet("Cats");

    assertThat(cache.contains(EntityKind.STICKER_SET, "Cats")).isFalse();
    assertThat(store.storedStickerSetFiles("Cats")).isNull();
    assertThat(files.hasBeenDownloaded("S1")).isTrue();
  }

  @Test
  void setBeingDownloadedCannotBeRemoved() {
    cachedSet("Cats", "S1");
    orchestrator.request("Cats", new DownloadRequester(5, 3, null));

    assertThatThrownBy(() -> admin.removeStickerSet("Cats")).isInstanceOf(ConflictException.class);
    assertThat(cache.contains(EntityKind.STICKER_SET, "Cats")).isTrue();
  }

  @Test
  void downloadRequestDefaultsUserToChat() {
    DownloadResponse response = admin.requestDownload("Cats", new DownloadRequest(3L, null));

    assertThat(response.outcome()).isEqualTo(RequestOutcome.STARTED);
    assertThat(orchestrator.activeNames()).containsExactly("Cats");
  }

  @Test
  void invalidNameIsRejectedBeforeTouchingTheLoop() {
    assertThatThrownBy(() -> admin.requestDownload("../etc", new DownloadRequest(3L, null)))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(infoQueue);
  }

  @Test
  void uptimeIsHoursMinutesSeconds() {
    assertThat(BotAdminService.formatUptime(Duration.ofSeconds(3 * 3600 + 7 * 60 + 5)))
        .isEqualTo("3:07:05");
    assertThat(BotAdminService.formatUptime(Duration.ofHours(30))).isEqualTo("30:00:00");
  }
}
