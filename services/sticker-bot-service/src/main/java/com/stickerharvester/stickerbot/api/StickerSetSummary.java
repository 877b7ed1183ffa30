package com.stickerharvester.stickerbot.api;

public record StickerSetSummary(
    String name, String title, int files, int downloadedFiles, boolean archived, String download) {}
