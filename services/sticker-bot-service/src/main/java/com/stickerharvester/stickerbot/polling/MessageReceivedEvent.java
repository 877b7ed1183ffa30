package com.stickerharvester.stickerbot.polling;

import com.stickerharvester.stickerbot.entity.EntityRecord;

/** A new update delivered a (possibly edited) message. */
public record MessageReceivedEvent(EntityRecord update, EntityRecord message) {}
