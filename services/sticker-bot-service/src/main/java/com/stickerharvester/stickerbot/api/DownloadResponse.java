package com.stickerharvester.stickerbot.api;

import com.stickerharvester.stickerbot.stickerset.RequestOutcome;

public record DownloadResponse(String name, RequestOutcome outcome) {}
