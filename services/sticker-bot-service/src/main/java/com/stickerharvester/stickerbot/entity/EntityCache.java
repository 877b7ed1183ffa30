package com.stickerharvester.stickerbot.entity;

import com.stickerharvester.stickerbot.persistence.EntityStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import lombok.extern.slf4j.Slf4j;

/** In-memory copy of every normalized entity. Confined to the bot loop thread. */
@Slf4j
public class EntityCache {

  private final Map<EntityKind, Map<String, EntityRecord>> records = new EnumMap<>(EntityKind.class);
  private final Map<String, List<String>> stickerSetFiles = new HashMap<>();

  public EntityCache() {
    for (EntityKind kind : EntityKind.values()) {
      records.put(kind, new HashMap<>());
    }
  }

  public void loadFrom(EntityStore store) {
    for (EntityKind kind : EntityKind.values()) {
      for (EntityRecord record : store.loadAll(kind)) {
        put(record);
      }
    }
    store.loadStickerSetFiles().forEach((name, files) -> stickerSetFiles.put(name, List.copyOf(files)));
    log.info(
        "Entity cache loaded: {} updates, {} messages, {} files, {} sticker sets",
        size(EntityKind.UPDATE),
        size(EntityKind.MESSAGE),
        size(EntityKind.FILE),
        size(EntityKind.STICKER_SET));
  }

  public Optional<EntityRecord> get(EntityKind kind, String id) {
    return Optional.ofNullable(records.get(kind).get(id));
  }

  public boolean contains(EntityKind kind, String id) {
    return id != null && records.get(kind).containsKey(id);
  }

  public void put(EntityRecord record) {
    records.get(record.kind()).put(record.id(), record);
  }

  public void putStickerSet(EntityRecord record, List<String> fileIds) {
    put(record);
    stickerSetFiles.put(record.id(), List.copyOf(fileIds));
  }

  /** Ordered member file ids, empty when the set is unknown. */
  public List<String> stickerSetFiles(String name) {
    return stickerSetFiles.getOrDefault(name, List.of());
  }

  public boolean removeStickerSet(String name) {
    boolean removed = records.get(EntityKind.STICKER_SET).remove(name) != null;
    return stickerSetFiles.remove(name) != null || removed;
  }

  public Collection<EntityRecord> all(EntityKind kind) {
    return Collections.unmodifiableCollection(new ArrayList<>(records.get(kind).values()));
  }

  public int size(EntityKind kind) {
    return records.get(kind).size();
  }

  public OptionalLong maxNumericId(EntityKind kind) {
    if (!kind.numericId()) {
      throw new IllegalArgumentException(kind + " has no numeric identity");
    }
    return records.get(kind).keySet().stream().mapToLong(Long::parseLong).max();
  }
}
