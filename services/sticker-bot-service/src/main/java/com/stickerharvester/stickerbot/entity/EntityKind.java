package com.stickerharvester.stickerbot.entity;

public enum EntityKind {
  UPDATE("update_info", true),
  MESSAGE("message_info", true),
  USER("user_info", true),
  CHAT("chat_info", true),
  MY_CHAT_MEMBER("my_chat_member_info", true),
  FILE("file_info", false),
  STICKER_SET("sticker_set_info", false),
  BUTTON_LIST("button_list_info", true),
  BUTTON("button_info", true),
  CHANNEL_POST("channel_post_info", true);

  private final String table;
  private final boolean numericId;

  EntityKind(String table, boolean numericId) {
    this.table = table;
    this.numericId = numericId;
  }

  public String table() {
    return table;
  }

  public boolean numericId() {
    return numericId;
  }
}
