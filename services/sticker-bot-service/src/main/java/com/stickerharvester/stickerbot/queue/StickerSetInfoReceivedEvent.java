package com.stickerharvester.stickerbot.queue;

public record StickerSetInfoReceivedEvent(String name) {}
