package com.stickerharvester.stickerbot.command;

import com.stickerharvester.stickerbot.client.TelegramText;
import com.stickerharvester.stickerbot.config.BotProperties;
import com.stickerharvester.stickerbot.entity.EntityCache;
import com.stickerharvester.stickerbot.entity.EntityKind;
import com.stickerharvester.stickerbot.entity.EntityRecord;
import com.stickerharvester.stickerbot.persistence.Preference;
import com.stickerharvester.stickerbot.persistence.UserPreferenceRepository;
import com.stickerharvester.stickerbot.polling.MessageReceivedEvent;
import com.stickerharvester.stickerbot.stickerset.DownloadRequester;
import com.stickerharvester.stickerbot.stickerset.RequestOutcome;
import com.stickerharvester.stickerbot.stickerset.StickerSetDownloadOrchestrator;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Chat front end of the sticker-set downloader.
 *
 * <p>Understands {@code /stickerset <name|link>}, a bare {@code /stickerset} followed by a
 * forwarded sticker, {@code /set <key> <value>} and {@code /help}. Stickers sent without a command
 * start a download for users with {@code greedy yes}. Messages from bots are ignored.
 */
@Component
@Slf4j
public class StickerSetCommandHandler {

  static final Pattern COMMAND =
      Pattern.compile("^/([a-zA-Z0-9_]+)(@([a-zA-Z0-9_]+))?( (.*))?$", Pattern.DOTALL);
  private static final Pattern SET_LINK = Pattern.compile("^https://t\\.me/addstickers/(.+)$");
  private static final Pattern SET_NAME = Pattern.compile("^[a-zA-Z0-9_]+$");
  private static final Pattern KEY_VALUE = Pattern.compile("^([a-zA-Z_]+) +([^ ].*)$");

  static final String HELP =
      "Send <b>/stickerset name</b> or <b>/stickerset https://t.me/addstickers/name</b> to get a"
          + " sticker set as a ZIP archive, or send <b>/stickerset</b> and then forward a sticker.\n"
          + "<b>/set</b> shows your preferences, <b>/set key value</b> changes one"
          + " (greedy, provide_sticker_set, silent).";

  private record AwaitedSticker(long chatId, long expectedMessageId) {}

  private final EntityCache cache;
  private final StickerSetDownloadOrchestrator orchestrator;
  private final UserPreferenceRepository preferences;
  private final ChatReplies replies;
  private final String botName;
  private final Map<Long, AwaitedSticker> awaitedStickers = new HashMap<>();

  public StickerSetCommandHandler(
      EntityCache cache,
      StickerSetDownloadOrchestrator orchestrator,
      UserPreferenceRepository preferences,
      ChatReplies replies,
      BotProperties properties) {
    this.cache = cache;
    this.orchestrator = orchestrator;
    this.preferences = preferences;
    this.replies = replies;
    this.botName = properties.name();
  }

  @EventListener
  public void onMessage(MessageReceivedEvent event) {
    EntityRecord message = event.message();
    String fromId = message.get("from_id");
    String chatId = message.get("chat_id");
    if (fromId == null || chatId == null) {
      log.debug("Message {} has no sender or chat", message.id());
      return;
    }
    if (cache.get(EntityKind.USER, fromId).map(u -> u.isTrue("is_bot")).orElse(false)) {
      log.debug("Ignoring message {} from bot {}", message.id(), fromId);
      return;
    }
    long userId = Long.parseLong(fromId);
    DownloadRequester requester =
        new DownloadRequester(userId, Long.parseLong(chatId), Long.valueOf(message.id()));

    AwaitedSticker awaited = awaitedStickers.remove(userId);
    String stickerId = message.get("sticker_id");
    if (stickerId != null) {
      boolean expected = awaited != null && Long.parseLong(message.id()) >= awaited.expectedMessageId();
      if (expected || preferences.is(userId, Preference.GREEDY, "yes")) {
        requestFromSticker(stickerId, requester);
      }
      return;
    }
    if (awaited != null) {
      replies.reply(
          requester.chatId(), requester.messageId(), "Could not find a sticker in that message.");
    }

    String text = message.get("text");
    if (text == null) {
      return;
    }
    Matcher m = COMMAND.matcher(text.trim());
    if (!m.matches()) {
      return;
    }
    String addressee = m.group(3);
    if (addressee != null && !botName.isBlank() && !addressee.equalsIgnoreCase(botName)) {
      return;
    }
    String command = m.group(1).toLowerCase(Locale.ROOT);
    String args = m.group(5) == null ? "" : m.group(5).trim();
    switch (command) {
      case "start", "help" -> replies.reply(requester.chatId(), null, HELP);
      case "stickerset" -> stickerSetCommand(args, requester);
      case "set" -> setCommand(args, requester);
      default -> replies.reply(
          requester.chatId(),
          requester.messageId(),
          "Unknown command <b>/" + TelegramText.escapeHtml(command) + "</b>. Try /help.");
    }
  }

  private void stickerSetCommand(String args, DownloadRequester requester) {
    if (args.isEmpty()) {
      awaitedStickers.put(
          requester.userId(),
          new AwaitedSticker(requester.chatId(), requester.messageId() + 1));
      return;
    }
    Matcher link = SET_LINK.matcher(args);
    String name = link.matches() ? link.group(1) : args;
    if (!SET_NAME.matcher(name).matches()) {
      replies.reply(
          requester.chatId(),
          requester.messageId(),
          "Could not identify the sticker set name from \""
              + TelegramText.escapeHtml(args)
              + "\".");
      return;
    }
    requestDownload(name, requester);
  }

  private void requestFromSticker(String stickerId, DownloadRequester requester) {
    Optional<String> setName =
        cache.get(EntityKind.FILE, stickerId).map(f -> f.get("set_name"));
    if (setName.isEmpty()) {
      replies.reply(
          requester.chatId(),
          requester.messageId(),
          "Could not find a sticker set for that sticker.");
      return;
    }
    requestDownload(setName.get(), requester);
  }

  private void requestDownload(String name, DownloadRequester requester) {
    RequestOutcome outcome = orchestrator.request(name, requester);
    String safe = TelegramText.escapeHtml(name);
    switch (outcome) {
      case STARTED -> replies.notice(
          requester.userId(),
          requester.chatId(),
          requester.messageId(),
          "Downloading sticker set <b>" + safe + "</b>...");
      case COALESCED -> replies.notice(
          requester.userId(),
          requester.chatId(),
          requester.messageId(),
          "Sticker set <b>" + safe + "</b> is already being downloaded. You will get it too.");
      case REJECTED_SHUTTING_DOWN -> replies.reply(
          requester.chatId(),
          requester.messageId(),
          "The bot is shutting down. Please try again later.");
      case ALREADY_AVAILABLE -> log.debug("Sticker set {} served from disk", name);
    }
  }

  private void setCommand(String args, DownloadRequester requester) {
    if (args.isEmpty()) {
      StringBuilder out = new StringBuilder("Your preferences:");
      preferences
          .getAll(requester.userId())
          .forEach((p, v) -> out.append('\n').append(p.key()).append(": ").append(v));
      replies.reply(requester.chatId(), requester.messageId(), out.toString());
      return;
    }
    Matcher kv = KEY_VALUE.matcher(args);
    if (!kv.matches()) {
      replies.reply(
          requester.chatId(),
          requester.messageId(),
          "\"" + TelegramText.escapeHtml(args) + "\" has an unexpected format.");
      return;
    }
    String answer;
    try {
      Preference preference = Preference.fromKey(kv.group(1));
      preferences.set(requester.userId(), preference, kv.group(2));
      answer = preference.key() + " set to \"" + preferences.get(requester.userId(), preference) + "\".";
    } catch (IllegalArgumentException e) {
      answer = TelegramText.escapeHtml(e.getMessage());
    }
    replies.reply(requester.chatId(), requester.messageId(), answer);
  }
}
