package com.stickerharvester.stickerbot.stickerset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.stickerharvester.stickerbot.entity.EntityCache;
import com.stickerharvester.stickerbot.entity.EntityKind;
import com.stickerharvester.stickerbot.entity.EntityRecord;
import com.stickerharvester.stickerbot.persistence.LocalFileStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ZipStickerSetAssemblerTest {

  @TempDir Path root;

  private EntityCache cache;
  private LocalFileStore files;
  private ZipStickerSetAssembler assembler;

  @BeforeEach
  void setUp() {
    cache = new EntityCache();
    files = new LocalFileStore(root.resolve("files"));
    assembler = new ZipStickerSetAssembler(root.resolve("sets"), files, cache);
  }

  private void file(String id, String flag) {
    cache.put(new EntityRecord(EntityKind.FILE, id, Map.of("file_id", id, flag, "true")));
    files.write(id, id.getBytes());
  }

  @Test
  void extensionFollowsStickerFormat() {
    file("V", "is_video");
    file("A", "is_animated");
    file("P", "is_premium");

    assertThat(assembler.extensionOf("V")).isEqualTo("webm");
    assertThat(assembler.extensionOf("A")).isEqualTo("tgs");
    assertThat(assembler.extensionOf("P")).isEqualTo("webp");
    assertThat(assembler.extensionOf("unknown")).isEqualTo("webp");
  }

  @Test
  void archiveHoldsMembersInSetOrder() throws IOException {
    file("B", "is_animated");
    file("A", "is_video");

    Path archive = assembler.assemble("Fun", List.of("B", "A"));

    assertThat(archive).isEqualTo(root.resolve("sets").resolve("Fun.zip"));
    try (ZipFile zip = new ZipFile(archive.toFile())) {
      assertThat(zip.size()).isEqualTo(2);
      assertThat(zip.getInputStream(zip.getEntry("Fun/Sticker_001.tgs")).readAllBytes())
          .isEqualTo("B".getBytes());
      assertThat(zip.getEntry("Fun/Sticker_002.webm")).isNotNull();
    }
    assertThat(root.resolve("sets").resolve("Fun").resolve("Sticker_001.tgs")).exists();
  }

  @Test
  void missingMemberAbortsWithoutLeavingAnArchive() throws IOException {
    file("A", "is_video");

    assertThatThrownBy(() -> assembler.assemble("Half", List.of("A", "Gone")))
        .isInstanceOf(StickerSetAssemblyException.class)
        .hasMessageContaining("Gone");
    assertThat(assembler.archivePath("Half")).doesNotExist();
    try (var leftovers = Files.list(root.resolve("sets"))) {
      assertThat(leftovers.filter(p -> p.toString().endsWith(".part"))).isEmpty();
    }
  }

  @Test
  void unsafeCharactersAreReplacedInPaths() {
    assertThat(ZipStickerSetAssembler.safeName("a/../b c")).isEqualTo("a____b_c");
    assertThat(assembler.archivePath("a/b")).isEqualTo(root.resolve("sets").resolve("a_b.zip"));
  }
}
