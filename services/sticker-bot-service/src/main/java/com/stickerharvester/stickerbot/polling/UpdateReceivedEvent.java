package com.stickerharvester.stickerbot.polling;

import com.stickerharvester.stickerbot.entity.EntityRecord;

public record UpdateReceivedEvent(EntityRecord update) {}
