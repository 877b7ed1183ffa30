package com.stickerharvester.stickerbot.queue;

public record FileDownloadFailedEvent(String fileId, String reason) {}
