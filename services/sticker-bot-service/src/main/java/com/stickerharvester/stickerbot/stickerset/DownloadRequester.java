package com.stickerharvester.stickerbot.stickerset;

/** Who asked for a sticker set; {@code messageId} is the message to reply to, if any. */
public record DownloadRequester(long userId, long chatId, Long messageId) {}
