package com.stickerharvester.stickerbot.entity;

/** A record was created or changed by the normalizer. */
public record EntityArrivedEvent(EntityKind kind, String id) {}
