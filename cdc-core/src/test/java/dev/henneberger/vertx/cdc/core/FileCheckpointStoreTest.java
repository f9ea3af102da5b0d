package dev.henneberger.vertx.cdc.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonObject;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileCheckpointStoreTest {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-01T00:00:00Z"), ZoneOffset.UTC);

  @TempDir
  Path dir;

  @Test
  void persistsAndLoadsCheckpoint() throws Exception {
    Path file = dir.resolve("checkpoints.json");

    FileCheckpointStore writer = new FileCheckpointStore(file, CLOCK);
    writer.save("orders_slot", Lsn.valueOf("0/16B4F50"));

    FileCheckpointStore reader = new FileCheckpointStore(file, CLOCK);
    Checkpoint checkpoint = reader.load("orders_slot").orElseThrow();
    assertEquals(Lsn.valueOf("0/16B4F50"), checkpoint.confirmedLsn());
    assertEquals(Instant.parse("2026-02-01T00:00:00Z"), checkpoint.updatedAt());
  }

  @Test
  void returnsEmptyWhenMissing() throws Exception {
    FileCheckpointStore store = new FileCheckpointStore(dir.resolve("missing.json"));
    assertFalse(store.load("missing").isPresent());

    store.save("orders_slot", Lsn.of(103));
    assertTrue(store.load("orders_slot").isPresent());
    assertFalse(store.load("missing").isPresent());
  }

  @Test
  void keepsOneEntryPerSlot() throws Exception {
    Path file = dir.resolve("checkpoints.json");
    FileCheckpointStore store = new FileCheckpointStore(file, CLOCK);
    store.save("a_slot", Lsn.of(103));
    store.save("b_slot", Lsn.of(7));
    store.save("a_slot", Lsn.of(110));

    JsonObject json = new JsonObject(Files.readString(file, StandardCharsets.UTF_8));
    assertEquals(2, json.size());
    JsonObject entry = json.getJsonObject("a_slot");
    assertEquals("a_slot", entry.getString("slot_name"));
    assertEquals(110L, entry.getLong("confirmed_lsn"));
    assertEquals("0/6E", entry.getString("confirmed_lsn_text"));
    assertEquals("2026-02-01T00:00:00Z", entry.getString("updated_at"));
    assertFalse(Files.exists(dir.resolve("checkpoints.json.tmp")));
  }

  @Test
  void writesPositionsAboveSignedRangeAsUnsigned() throws Exception {
    Path file = dir.resolve("checkpoints.json");
    FileCheckpointStore store = new FileCheckpointStore(file, CLOCK);
    Lsn high = Lsn.valueOf("FFFFFFFF/FFFFFF00");
    store.save("orders_slot", high);

    JsonObject entry = new JsonObject(Files.readString(file, StandardCharsets.UTF_8)).getJsonObject("orders_slot");
    assertEquals("18446744073709551360", entry.getValue("confirmed_lsn").toString());
    assertEquals(high, new FileCheckpointStore(file, CLOCK).load("orders_slot").orElseThrow().confirmedLsn());
  }

  @Test
  void rejectsBackwardsSave() throws Exception {
    FileCheckpointStore store = new FileCheckpointStore(dir.resolve("checkpoints.json"));
    store.save("orders_slot", Lsn.of(103));

    assertThrows(IllegalStateException.class, () -> store.save("orders_slot", Lsn.of(102)));
    assertEquals(Lsn.of(103), store.load("orders_slot").orElseThrow().confirmedLsn());

    store.save("orders_slot", Lsn.of(103));
  }

  @Test
  void reportsCorruptFile() throws Exception {
    Path file = dir.resolve("checkpoints.json");
    Files.writeString(file, "{not json", StandardCharsets.UTF_8);

    assertThrows(java.io.IOException.class, () -> new FileCheckpointStore(file).load("orders_slot"));
  }
}
