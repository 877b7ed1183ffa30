package com.stickerharvester.stickerbot.command;

import com.stickerharvester.stickerbot.client.TelegramText;
import com.stickerharvester.stickerbot.persistence.Preference;
import com.stickerharvester.stickerbot.persistence.UserPreferenceRepository;
import com.stickerharvester.stickerbot.stickerset.DownloadRequester;
import com.stickerharvester.stickerbot.stickerset.StickerSetDownloadCompletedEvent;
import com.stickerharvester.stickerbot.stickerset.StickerSetDownloadFailedEvent;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Hands finished archives to the chats that asked for them. */
@Component
@Slf4j
@RequiredArgsConstructor
public class StickerSetDeliveryListener {

  private final UserPreferenceRepository preferences;
  private final ChatReplies replies;

  // set name -> users that already got the archive since startup
  private final Map<String, Set<Long>> deliveredTo = new HashMap<>();

  @EventListener
  public void onCompleted(StickerSetDownloadCompletedEvent event) {
    String safe = TelegramText.escapeHtml(event.name());
    Set<Long> uploadedChats = new LinkedHashSet<>();
    Set<Long> delivered = deliveredTo.computeIfAbsent(event.name(), k -> new HashSet<>());
    for (DownloadRequester r : event.requesters()) {
      String action = preferences.get(r.userId(), Preference.PROVIDE_STICKER_SET);
      if ("never".equals(action)) {
        replies.notice(
            r.userId(), r.chatId(), r.messageId(), "Sticker set <b>" + safe + "</b> was downloaded.");
      } else if ("once".equals(action) && delivered.contains(r.userId())) {
        replies.notice(
            r.userId(),
            r.chatId(),
            r.messageId(),
            "Sticker set <b>" + safe + "</b> has been sent to you before.");
      } else if (uploadedChats.add(r.chatId())) {
        replies.sendArchive(r.chatId(), event.archive());
        delivered.add(r.userId());
      } else {
        delivered.add(r.userId());
      }
    }
  }

  @EventListener
  public void onFailed(StickerSetDownloadFailedEvent event) {
    String safe = TelegramText.escapeHtml(event.name());
    String text =
        switch (event.reason()) {
          case STICKER_SET_NOT_FOUND -> "Sticker set <b>" + safe + "</b> does not exist.";
          case METADATA_UNAVAILABLE, FILE_UNAVAILABLE -> "Sticker set <b>"
              + safe
              + "</b> could not be downloaded from Telegram.";
          case ASSEMBLY_FAILED -> "Sticker set <b>" + safe + "</b> could not be packed.";
        };
    log.info("Notifying {} requester(s) of {}: {}", event.requesters().size(), event.name(), event.reason());
    Set<Long> chats = new LinkedHashSet<>();
    for (DownloadRequester r : event.requesters()) {
      if (chats.add(r.chatId())) {
        replies.reply(r.chatId(), r.messageId(), text);
      }
    }
  }
}
