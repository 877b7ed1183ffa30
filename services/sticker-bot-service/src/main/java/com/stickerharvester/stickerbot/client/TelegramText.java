package com.stickerharvester.stickerbot.client;

/** Helpers for text sent with {@code parse_mode=html}. */
public final class TelegramText {

  private TelegramText() {}

  public static String escapeHtml(String s) {
    if (s == null) return "";
    String out = s;
    out = out.replace("&", "&amp;");
    out = out.replace("<", "&lt;");
    out = out.replace(">", "&gt;");
    return out;
  }
}
