package com.stickerharvester.stickerbot.command;

import com.stickerharvester.stickerbot.client.TelegramBotClient;
import com.stickerharvester.stickerbot.persistence.Preference;
import com.stickerharvester.stickerbot.persistence.UserPreferenceRepository;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Outgoing chat traffic. Failures are logged; nothing waits for Telegram's answer. */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChatReplies {

  private final TelegramBotClient bot;
  private final UserPreferenceRepository preferences;

  public void reply(long chatId, Long replyToMessageId, String html) {
    CompletableFuture<?> sent =
        replyToMessageId == null
            ? bot.sendMessage(chatId, html)
            : bot.sendReply(chatId, replyToMessageId, html);
    watch(sent, "Message", chatId);
  }

  /** Progress chatter, suppressed for users who set {@code silent yes}. */
  public void notice(long userId, long chatId, Long replyToMessageId, String html) {
    if (preferences.is(userId, Preference.SILENT, "yes")) {
      log.debug("Suppressed notice to silent user {}", userId);
      return;
    }
    reply(chatId, replyToMessageId, html);
  }

  public void sendArchive(long chatId, Path archive) {
    log.info("Uploading {} to chat {}", archive.getFileName(), chatId);
    watch(bot.sendDocument(chatId, archive), "Upload of " + archive.getFileName(), chatId);
  }

  private static void watch(CompletableFuture<?> future, String what, long chatId) {
    future.whenComplete(
        (result, error) -> {
          if (error != null) {
            log.warn(
                "{} to chat {} failed: {}",
                what,
                chatId,
                TelegramBotClient.unwrap(error).getMessage());
          }
        });
  }
}
