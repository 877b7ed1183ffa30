package com.stickerharvester.stickerbot.polling;

import com.stickerharvester.stickerbot.entity.EntityRecord;

public record ChannelPostReceivedEvent(EntityRecord update, EntityRecord post) {}
