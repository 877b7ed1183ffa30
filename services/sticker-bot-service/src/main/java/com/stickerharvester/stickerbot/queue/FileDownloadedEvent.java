package com.stickerharvester.stickerbot.queue;

public record FileDownloadedEvent(String fileId) {}
