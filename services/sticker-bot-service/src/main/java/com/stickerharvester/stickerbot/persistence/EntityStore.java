package com.stickerharvester.stickerbot.persistence;

import com.stickerharvester.stickerbot.entity.EntityKind;
import com.stickerharvester.stickerbot.entity.EntityRecord;
import java.util.List;
import java.util.Map;

/** Durable copy of the entity cache. Implementations throw {@code DataAccessException}. */
public interface EntityStore {

  List<EntityRecord> loadAll(EntityKind kind);

  /** Sticker set name to ordered member file ids. */
  Map<String, List<String>> loadStickerSetFiles();

  /** Replaces every stored attribute of the record. Sticker sets go through saveStickerSet. */
  void save(EntityRecord record);

  /** Replaces a sticker set's metadata and member list together. */
  void saveStickerSet(EntityRecord record, List<String> fileIds);

  /** @return whether anything was stored under that name */
  boolean removeStickerSet(String name);
}
