package com.stickerharvester.stickerbot.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.stickerharvester.stickerbot.config.BotProperties;
import com.stickerharvester.stickerbot.persistence.EntityStore;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Turns Bot API JSON fragments into flat {@link EntityRecord}s.
 *
 * <p>Every entity kind has a field table (wire key to handler). Keys that are not in the table are
 * logged and skipped. Nested objects are parsed recursively and referenced by id. A record whose
 * identity is already cached is returned as is, except files, which merge new attributes in.
 *
 * <p>Must only be called from the bot loop thread.
 */
@Service
@Slf4j
public class EntityNormalizer {

  static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private static final List<String> UPDATE_PAYLOADS =
      List.of("message", "edited_message", "channel_post", "edited_channel_post", "my_chat_member");

  @FunctionalInterface
  private interface FieldHandler {
    void apply(JsonNode value, Draft draft);
  }

  private static final class Draft {
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<String> members = new ArrayList<>();

    void put(String key, String value) {
      if (value != null) {
        attributes.put(key, value);
      }
    }
  }

  private final EntityCache cache;
  private final EntityStore store;
  private final ApplicationEventPublisher events;
  private final DateTimeFormatter dateTime;
  private final Map<EntityKind, Map<String, FieldHandler>> fields = new EnumMap<>(EntityKind.class);

  private long nextButtonId;
  private long nextButtonListId;

  public EntityNormalizer(
      EntityCache cache,
      EntityStore store,
      ApplicationEventPublisher events,
      BotProperties properties) {
    this.cache = cache;
    this.store = store;
    this.events = events;
    this.dateTime = DATE_TIME.withZone(properties.zoneId());
    this.nextButtonId = cache.maxNumericId(EntityKind.BUTTON).orElse(-1) + 1;
    this.nextButtonListId = cache.maxNumericId(EntityKind.BUTTON_LIST).orElse(-1) + 1;

    fields.put(EntityKind.UPDATE, updateFields());
    fields.put(EntityKind.MESSAGE, messageFields());
    fields.put(EntityKind.USER, userFields());
    fields.put(EntityKind.CHAT, chatFields());
    fields.put(EntityKind.MY_CHAT_MEMBER, myChatMemberFields());
    fields.put(EntityKind.FILE, fileFields());
    fields.put(EntityKind.STICKER_SET, stickerSetFields());
    fields.put(EntityKind.BUTTON, buttonFields());
    fields.put(EntityKind.CHANNEL_POST, channelPostFields());
  }

  public EntityRecord parse(EntityKind kind, JsonNode fragment) {
    return switch (kind) {
      case UPDATE -> parseUpdate(fragment);
      case MESSAGE -> parseMessage(fragment);
      case USER -> parseUser(fragment);
      case CHAT -> parseChat(fragment);
      case MY_CHAT_MEMBER -> parseMyChatMember(fragment);
      case FILE -> parseFile(fragment);
      case STICKER_SET -> parseStickerSet(fragment);
      case BUTTON_LIST -> parseButtonList(fragment);
      case BUTTON -> parseButton(fragment);
      case CHANNEL_POST -> parseChannelPost(fragment);
    };
  }

  public EntityRecord parseUpdate(JsonNode fragment) {
    requireObject(EntityKind.UPDATE, fragment);
    long payloads = UPDATE_PAYLOADS.stream().filter(k -> isPresent(fragment.get(k))).count();
    if (payloads > 1) {
      throw new EntityParseException(
          "Update " + fragment.path("update_id").asText("?") + " carries " + payloads + " payloads");
    }
    return parseKeyed(EntityKind.UPDATE, fragment, "update_id");
  }

  public EntityRecord parseMessage(JsonNode fragment) {
    return parseKeyed(EntityKind.MESSAGE, fragment, "message_id");
  }

  public EntityRecord parseUser(JsonNode fragment) {
    return parseKeyed(EntityKind.USER, fragment, "id");
  }

  public EntityRecord parseChat(JsonNode fragment) {
    return parseKeyed(EntityKind.CHAT, fragment, "id");
  }

  public EntityRecord parseMyChatMember(JsonNode fragment) {
    return parseKeyed(EntityKind.MY_CHAT_MEMBER, fragment, "date");
  }

  public EntityRecord parseChannelPost(JsonNode fragment) {
    return parseKeyed(EntityKind.CHANNEL_POST, fragment, "message_id");
  }

  /** Files merge: unseen attributes are added, conflicting ones keep the value seen first. */
  public EntityRecord parseFile(JsonNode fragment) {
    requireObject(EntityKind.FILE, fragment);
    String id = identity(EntityKind.FILE, fragment, "file_id");
    Draft draft = fill(EntityKind.FILE, fragment);
    Optional<EntityRecord> existing = cache.get(EntityKind.FILE, id);
    if (existing.isEmpty()) {
      return commit(new EntityRecord(EntityKind.FILE, id, draft.attributes));
    }
    return merge(existing.get(), draft.attributes);
  }

  public EntityRecord parseStickerSet(JsonNode fragment) {
    requireObject(EntityKind.STICKER_SET, fragment);
    String name = identity(EntityKind.STICKER_SET, fragment, "name");
    Optional<EntityRecord> cached = cache.get(EntityKind.STICKER_SET, name);
    if (cached.isPresent()) {
      return cached.get();
    }
    Draft draft = fill(EntityKind.STICKER_SET, fragment);
    EntityRecord record = new EntityRecord(EntityKind.STICKER_SET, name, draft.attributes);
    try {
      store.saveStickerSet(record, draft.members);
    } catch (DataAccessException | TransactionException e) {
      log.error("Failed to persist sticker set {}: {}", name, e.getMessage());
    }
    cache.putStickerSet(record, draft.members);
    events.publishEvent(new EntityArrivedEvent(EntityKind.STICKER_SET, name));
    return record;
  }

  /** Parses {@code reply_markup}; button lists have no wire identity and always get a new id. */
  public EntityRecord parseButtonList(JsonNode markup) {
    requireObject(EntityKind.BUTTON_LIST, markup);
    JsonNode keyboard = markup.path("inline_keyboard");
    if (!keyboard.isArray() || keyboard.isEmpty()) {
      throw new EntityParseException("Button list has no inline_keyboard rows");
    }
    for (int r = 0; r < keyboard.size(); r++) {
      JsonNode row = keyboard.get(r);
      if (!row.isArray() || row.isEmpty()) {
        throw new EntityParseException("Button list row " + r + " has no buttons");
      }
    }
    markup
        .fieldNames()
        .forEachRemaining(
            key -> {
              if (!"inline_keyboard".equals(key)) {
                warnUnknown(EntityKind.BUTTON_LIST, key);
              }
            });

    Draft draft = new Draft();
    draft.put("num_rows", Integer.toString(keyboard.size()));
    for (int r = 0; r < keyboard.size(); r++) {
      JsonNode row = keyboard.get(r);
      draft.put("row_" + r + "_num_cols", Integer.toString(row.size()));
      for (int c = 0; c < row.size(); c++) {
        draft.put("row_" + r + "_col_" + c + "_button_id", parseButton(row.get(c)).id());
      }
    }
    String id = Long.toString(nextButtonListId++);
    draft.put("id", id);
    return commit(new EntityRecord(EntityKind.BUTTON_LIST, id, draft.attributes));
  }

  public EntityRecord parseButton(JsonNode fragment) {
    requireObject(EntityKind.BUTTON, fragment);
    Draft draft = fill(EntityKind.BUTTON, fragment);
    String id = Long.toString(nextButtonId++);
    draft.put("id", id);
    return commit(new EntityRecord(EntityKind.BUTTON, id, draft.attributes));
  }

  public String formatDateTime(long epochSeconds) {
    return dateTime.format(Instant.ofEpochSecond(epochSeconds));
  }

  // ---- field tables ----

  private Map<String, FieldHandler> updateFields() {
    Map<String, FieldHandler> t = new HashMap<>();
    t.put("update_id", text("id"));
    FieldHandler message =
        (v, d) -> {
          EntityRecord m = parseMessage(v);
          d.put("type", "message");
          d.put("message_id", m.id());
          d.put("chat_id", m.get("chat_id"));
        };
    FieldHandler channelPost =
        (v, d) -> {
          EntityRecord p = parseChannelPost(v);
          d.put("type", "channel post");
          d.put("message_id", p.id());
          d.put("chat_id", p.get("chat_id"));
        };
    t.put("message", message);
    t.put("edited_message", message);
    t.put("channel_post", channelPost);
    t.put("edited_channel_post", channelPost);
    t.put(
        "my_chat_member",
        (v, d) -> {
          EntityRecord m = parseMyChatMember(v);
          d.put("type", "my_chat_member");
          d.put("my_chat_member_id", m.id());
          d.put("chat_id", m.get("chat_id"));
        });
    return t;
  }

  private Map<String, FieldHandler> messageFields() {
    Map<String, FieldHandler> t = new HashMap<>();
    t.put("animation", nested(EntityKind.FILE, "animation_file_id"));
    t.put("caption", text("caption"));
    t.put("caption_entities", ignore());
    t.put("chat", nested(EntityKind.CHAT, "chat_id"));
    t.put("date", dateTime("date_time"));
    t.put("document", nested(EntityKind.FILE, "document_id"));
    t.put("edit_date", dateTime("edit_date_time"));
    t.put("entities", ignore());
    t.put("forward_date", dateTime("forward_date_time"));
    t.put("forward_from", nested(EntityKind.USER, "forward_from_id"));
    t.put("forward_from_chat", nested(EntityKind.CHAT, "forward_from_chat_id"));
    t.put("forward_from_message_id", text("forward_from_message_id"));
    t.put("forward_origin", ignore());
    t.put("forward_sender_name", text("forward_sender_name"));
    t.put("forward_signature", text("forward_signature"));
    t.put("from", nested(EntityKind.USER, "from_id"));
    t.put("link_preview_options", ignore());
    t.put("message_id", text("id"));
    t.put("message_thread_id", text("message_thread_id"));
    t.put("new_chat_member", nested(EntityKind.USER, "new_chat_member_id"));
    t.put("new_chat_members", ignore());
    t.put("new_chat_participant", ignore());
    t.put("new_chat_photo", lastOf(EntityKind.FILE, "new_chat_photo_id"));
    t.put("new_chat_title", text("new_chat_title"));
    t.put("photo", lastOf(EntityKind.FILE, "photo_file_id"));
    t.put(
        "reply_markup",
        (v, d) -> {
          try {
            d.put("button_list_id", parseButtonList(v).id());
          } catch (EntityParseException e) {
            log.warn("Skipping reply_markup: {}", e.getMessage());
          }
        });
    t.put("reply_to_message", nested(EntityKind.MESSAGE, "reply_to_message_id"));
    t.put("sender_chat", nested(EntityKind.CHAT, "sender_chat_id"));
    t.put("sticker", nested(EntityKind.FILE, "sticker_id"));
    t.put("text", text("text"));
    return t;
  }

  private Map<String, FieldHandler> userFields() {
    Map<String, FieldHandler> t = new HashMap<>();
    t.put("first_name", text("first_name"));
    t.put("id", text("id"));
    t.put("is_bot", flag("is_bot"));
    t.put("is_premium", flag("is_premium"));
    t.put("language_code", text("language_code"));
    t.put("last_name", text("last_name"));
    t.put("username", text("username"));
    return t;
  }

  private Map<String, FieldHandler> chatFields() {
    Map<String, FieldHandler> t = new HashMap<>();
    t.put("all_members_are_administrators", flag("all_members_are_administrators"));
    t.put("first_name", text("first_name"));
    t.put("id", text("id"));
    t.put("last_name", text("last_name"));
    t.put("title", text("title"));
    t.put("type", text("type"));
    t.put("username", text("username"));
    return t;
  }

  private Map<String, FieldHandler> myChatMemberFields() {
    Map<String, FieldHandler> t = new HashMap<>();
    t.put("chat", nested(EntityKind.CHAT, "chat_id"));
    t.put(
        "date",
        (v, d) -> {
          d.put("id", v.asText());
          d.put("date_time", formatDateTime(v.asLong()));
        });
    t.put("from", nested(EntityKind.USER, "from_id"));
    t.put("old_chat_member", chatMember("old_chat_member_"));
    t.put("new_chat_member", chatMember("new_chat_member_"));
    return t;
  }

  private Map<String, FieldHandler> fileFields() {
    Map<String, FieldHandler> t = new HashMap<>();
    t.put("duration", text("duration"));
    t.put("emoji", text("emoji"));
    t.put(
        "file_id",
        (v, d) -> {
          d.put("file_id", v.asText());
          d.put("id", v.asText());
        });
    t.put("file_name", text("file_name"));
    // getFile paths expire, so they are never stored
    t.put("file_path", ignore());
    t.put("file_size", text("file_size"));
    t.put("file_unique_id", text("file_unique_id"));
    t.put("height", text("height"));
    t.put("is_animated", flag("is_animated"));
    t.put("is_video", flag("is_video"));
    t.put("mime_type", text("mime_type"));
    t.put("premium_animation", nested(EntityKind.FILE, "premium_animation_file_id"));
    t.put("set_name", text("set_name"));
    t.put("thumb", ignore());
    t.put("thumbnail", ignore());
    t.put("type", text("type"));
    t.put("width", text("width"));
    return t;
  }

  private Map<String, FieldHandler> stickerSetFields() {
    Map<String, FieldHandler> t = new HashMap<>();
    t.put("contains_masks", flag("contains_masks"));
    t.put("is_animated", flag("is_animated"));
    t.put("is_video", flag("is_video"));
    t.put("name", text("name"));
    t.put("sticker_type", text("sticker_type"));
    t.put(
        "stickers",
        (v, d) -> {
          if (!v.isArray()) {
            throw new EntityParseException("Sticker set 'stickers' is not an array");
          }
          for (JsonNode sticker : v) {
            d.members.add(parseFile(sticker).id());
          }
        });
    t.put("thumb", ignore());
    t.put("thumbnail", ignore());
    t.put("title", text("title"));
    return t;
  }

  private Map<String, FieldHandler> buttonFields() {
    Map<String, FieldHandler> t = new HashMap<>();
    t.put("callback_data", text("callback_data"));
    t.put("text", text("text"));
    t.put("url", text("url"));
    return t;
  }

  private Map<String, FieldHandler> channelPostFields() {
    Map<String, FieldHandler> t = new HashMap<>();
    t.put("author_signature", text("author_signature"));
    t.put("caption", text("caption"));
    t.put("caption_entities", ignore());
    t.put("chat", nested(EntityKind.CHAT, "chat_id"));
    t.put("date", dateTime("date_time"));
    t.put("document", nested(EntityKind.FILE, "document_file_id"));
    t.put("edit_date", dateTime("edit_date_time"));
    t.put("entities", ignore());
    t.put("media_group_id", text("media_group_id"));
    t.put(
        "message_id",
        (v, d) -> {
          d.put("id", v.asText());
          d.put("message_id", v.asText());
        });
    t.put("photo", lastOf(EntityKind.FILE, "photo_file_id"));
    t.put("sender_chat", nested(EntityKind.CHAT, "sender_chat_id"));
    t.put("text", text("text"));
    return t;
  }

  // ---- handler factories ----

  private static FieldHandler text(String attribute) {
    return (v, d) -> d.put(attribute, scalar(v));
  }

  private static FieldHandler flag(String attribute) {
    return (v, d) -> d.put(attribute, Boolean.toString(v.asBoolean()));
  }

  private static FieldHandler ignore() {
    return (v, d) -> {};
  }

  private FieldHandler dateTime(String attribute) {
    return (v, d) -> d.put(attribute, formatDateTime(v.asLong()));
  }

  private FieldHandler nested(EntityKind kind, String attribute) {
    return (v, d) -> d.put(attribute, parse(kind, v).id());
  }

  /** Photo arrays list sizes smallest first; only the largest is kept. */
  private FieldHandler lastOf(EntityKind kind, String attribute) {
    return (v, d) -> {
      if (!v.isArray() || v.isEmpty()) {
        log.warn("Expected a non-empty array for '{}', got {}", attribute, v.getNodeType());
        return;
      }
      d.put(attribute, parse(kind, v.get(v.size() - 1)).id());
    };
  }

  private FieldHandler chatMember(String prefix) {
    return (v, d) -> {
      requireObject(EntityKind.MY_CHAT_MEMBER, v);
      Iterator<Map.Entry<String, JsonNode>> it = v.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> field = it.next();
        JsonNode value = field.getValue();
        switch (field.getKey()) {
          case "user" -> d.put(prefix + "user_id", parseUser(value).id());
          case "until_date" -> d.put(
              prefix + "until_date", value.asLong() == 0 ? "" : formatDateTime(value.asLong()));
          default -> {
            if (value.isValueNode()) {
              d.put(prefix + field.getKey(), value.asText());
            } else {
              warnUnknown(EntityKind.MY_CHAT_MEMBER, prefix + field.getKey());
            }
          }
        }
      }
    };
  }

  // ---- core ----

  private EntityRecord parseKeyed(EntityKind kind, JsonNode fragment, String identityKey) {
    requireObject(kind, fragment);
    String id = identity(kind, fragment, identityKey);
    Optional<EntityRecord> cached = cache.get(kind, id);
    if (cached.isPresent()) {
      return cached.get();
    }
    Draft draft = fill(kind, fragment);
    draft.put("id", id);
    return commit(new EntityRecord(kind, id, draft.attributes));
  }

  private Draft fill(EntityKind kind, JsonNode fragment) {
    Map<String, FieldHandler> table = fields.get(kind);
    Draft draft = new Draft();
    Iterator<Map.Entry<String, JsonNode>> it = fragment.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> field = it.next();
      if (!isPresent(field.getValue())) {
        continue;
      }
      FieldHandler handler = table.get(field.getKey());
      if (handler == null) {
        warnUnknown(kind, field.getKey());
        continue;
      }
      handler.apply(field.getValue(), draft);
    }
    return draft;
  }

  private EntityRecord merge(EntityRecord current, Map<String, String> incoming) {
    Map<String, String> merged = new LinkedHashMap<>(current.attributes());
    boolean changed = false;
    for (Map.Entry<String, String> e : incoming.entrySet()) {
      String old = merged.get(e.getKey());
      if (old == null) {
        merged.put(e.getKey(), e.getValue());
        changed = true;
      } else if (!old.equals(e.getValue())) {
        log.warn(
            "File ID {} has data mismatch for key {}: keeping '{}', ignoring '{}'",
            current.id(),
            e.getKey(),
            old,
            e.getValue());
      }
    }
    return changed ? commit(new EntityRecord(EntityKind.FILE, current.id(), merged)) : current;
  }

  private EntityRecord commit(EntityRecord record) {
    try {
      store.save(record);
    } catch (DataAccessException | TransactionException e) {
      log.error("Failed to persist {} {}: {}", record.kind(), record.id(), e.getMessage());
    }
    cache.put(record);
    events.publishEvent(new EntityArrivedEvent(record.kind(), record.id()));
    return record;
  }

  private static String identity(EntityKind kind, JsonNode fragment, String key) {
    JsonNode node = fragment.get(key);
    if (!isPresent(node) || node.asText().isBlank()) {
      throw new MissingIdentityException(kind, key);
    }
    if (kind.numericId() && !node.canConvertToLong()) {
      throw new EntityParseException(kind + " identity '" + key + "' is not an integer: " + node);
    }
    return kind.numericId() ? Long.toString(node.asLong()) : node.asText();
  }

  private static void requireObject(EntityKind kind, JsonNode fragment) {
    if (fragment == null || !fragment.isObject()) {
      throw new EntityParseException(kind + " payload is not a JSON object");
    }
  }

  private static boolean isPresent(JsonNode node) {
    return node != null && !node.isNull() && !node.isMissingNode();
  }

  private static String scalar(JsonNode node) {
    return node.isValueNode() ? node.asText() : node.toString();
  }

  private static void warnUnknown(EntityKind kind, String key) {
    log.warn("Unknown {} attribute '{}' ignored", kind, key);
  }
}
