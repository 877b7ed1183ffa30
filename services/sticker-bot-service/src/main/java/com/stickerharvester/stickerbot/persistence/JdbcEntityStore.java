package com.stickerharvester.stickerbot.persistence;

import com.stickerharvester.stickerbot.entity.EntityKind;
import com.stickerharvester.stickerbot.entity.EntityRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * One {@code (id, key, value)} table per entity kind. Sticker sets add a {@code sequence} column:
 * 0 holds the metadata, 1..n the {@code sticker_file_id} members in order.
 */
@Repository
@RequiredArgsConstructor
public class JdbcEntityStore implements EntityStore {

  static final String STICKER_FILE_KEY = "sticker_file_id";

  private final JdbcTemplate jdbc;
  private final TransactionTemplate tx;

  @Override
  public List<EntityRecord> loadAll(EntityKind kind) {
    String sql =
        kind == EntityKind.STICKER_SET
            ? "SELECT id, key, value FROM sticker_set_info WHERE sequence = 0 ORDER BY id"
            : "SELECT id, key, value FROM " + kind.table() + " ORDER BY id";
    Map<String, Map<String, String>> rows = new LinkedHashMap<>();
    jdbc.query(
        sql,
        rs -> {
          rows.computeIfAbsent(rs.getString("id"), k -> new LinkedHashMap<>())
              .put(rs.getString("key"), rs.getString("value"));
        });
    List<EntityRecord> out = new ArrayList<>(rows.size());
    rows.forEach((id, attributes) -> out.add(new EntityRecord(kind, id, attributes)));
    return out;
  }

  @Override
  public Map<String, List<String>> loadStickerSetFiles() {
    Map<String, List<String>> out = new LinkedHashMap<>();
    jdbc.query(
        "SELECT id, value FROM sticker_set_info WHERE sequence > 0 AND key = ?"
            + " ORDER BY id, sequence",
        rs -> {
          out.computeIfAbsent(rs.getString("id"), k -> new ArrayList<>())
              .add(rs.getString("value"));
        },
        STICKER_FILE_KEY);
    return out;
  }

  @Override
  public void save(EntityRecord record) {
    if (record.kind() == EntityKind.STICKER_SET) {
      throw new IllegalArgumentException("Sticker set " + record.id() + " needs its member list");
    }
    String table = record.kind().table();
    Object id = idParam(record);
    List<Object[]> args = new ArrayList<>();
    record.attributes().forEach((k, v) -> args.add(new Object[] {id, k, v}));
    tx.executeWithoutResult(
        s -> {
          jdbc.update("DELETE FROM " + table + " WHERE id = ?", id);
          jdbc.batchUpdate("INSERT INTO " + table + " (id, key, value) VALUES (?, ?, ?)", args);
        });
  }

  @Override
  public void saveStickerSet(EntityRecord record, List<String> fileIds) {
    List<Object[]> members = new ArrayList<>(fileIds.size());
    for (int i = 0; i < fileIds.size(); i++) {
      members.add(new Object[] {record.id(), i + 1, STICKER_FILE_KEY, fileIds.get(i)});
    }
    tx.executeWithoutResult(
        s -> {
          jdbc.update("DELETE FROM sticker_set_info WHERE id = ?", record.id());
          insertStickerSetInfo(record);
          jdbc.batchUpdate(
              "INSERT INTO sticker_set_info (id, sequence, key, value) VALUES (?, ?, ?, ?)",
              members);
        });
  }

  @Override
  public boolean removeStickerSet(String name) {
    Integer removed =
        tx.execute(s -> jdbc.update("DELETE FROM sticker_set_info WHERE id = ?", name));
    return removed != null && removed > 0;
  }

  private void insertStickerSetInfo(EntityRecord record) {
    List<Object[]> args = new ArrayList<>();
    record.attributes().forEach((k, v) -> args.add(new Object[] {record.id(), 0, k, v}));
    jdbc.batchUpdate(
        "INSERT INTO sticker_set_info (id, sequence, key, value) VALUES (?, ?, ?, ?)", args);
  }

  private static Object idParam(EntityRecord record) {
    return record.kind().numericId() ? (Object) Long.parseLong(record.id()) : record.id();
  }
}
