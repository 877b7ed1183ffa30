package com.stickerharvester.stickerbot.api;

import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class BotAdminController {

  private final BotAdminService admin;

  @GetMapping("/status")
  public BotStatus status() {
    return admin.status();
  }

  @GetMapping("/sticker-sets")
  public List<StickerSetSummary> stickerSets() {
    return admin.stickerSets();
  }

  @GetMapping("/sticker-sets/{name}")
  public StickerSetSummary stickerSet(@PathVariable String name) {
    return admin.stickerSet(name);
  }

  @DeleteMapping("/sticker-sets/{name}")
  public ResponseEntity<Void> removeStickerSet(@PathVariable String name) {
    admin.removeStickerSet(name);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/sticker-sets/{name}/downloads")
  public ResponseEntity<DownloadResponse> requestDownload(
      @PathVariable String name, @Valid @RequestBody DownloadRequest request) {
    DownloadResponse response = admin.requestDownload(name, request);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
  }
}
