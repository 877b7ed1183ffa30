package com.stickerharvester.stickerbot.api;

import jakarta.validation.constraints.NotNull;

/** {@code userId} defaults to {@code chatId}, which is what private chats use. */
public record DownloadRequest(@NotNull Long chatId, Long userId) {}
