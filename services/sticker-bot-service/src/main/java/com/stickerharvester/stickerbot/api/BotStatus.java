package com.stickerharvester.stickerbot.api;

import java.time.Instant;
import java.util.List;

public record BotStatus(
    Instant startedAt,
    String uptime,
    boolean polling,
    Long offset,
    int fileQueueSize,
    int stickerSetQueueSize,
    List<String> activeDownloads,
    int cachedStickerSets,
    boolean shuttingDown) {}
