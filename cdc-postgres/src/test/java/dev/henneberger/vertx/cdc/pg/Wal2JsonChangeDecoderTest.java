/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.henneberger.vertx.cdc.pg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.cdc.core.ChangeKind;
import dev.henneberger.vertx.cdc.core.ChangeRecord;
import dev.henneberger.vertx.cdc.core.Lsn;
import dev.henneberger.vertx.cdc.core.TransactionEnvelope;
import dev.henneberger.vertx.cdc.core.TransactionSequencer;
import dev.henneberger.vertx.cdc.core.ValueKind;
import dev.henneberger.vertx.cdc.core.WalDecodeException;
import dev.henneberger.vertx.cdc.core.WalMessage;
import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class Wal2JsonChangeDecoderTest {

  private final ChangeDecoder decoder = new Wal2JsonChangeDecoder();

  @Test
  void decodesTransactionBoundaries() {
    WalMessage begin = decoder.decode(
      "{\"action\":\"B\",\"xid\":5,\"lsn\":\"0/64\",\"timestamp\":\"2026-03-01 10:15:30.123456+00\"}", Lsn.INVALID);
    WalMessage commit = decoder.decode(
      "{\"action\":\"C\",\"xid\":5,\"lsn\":\"0/67\",\"timestamp\":\"2026-03-01 12:15:30+02\"}", Lsn.INVALID);

    assertEquals(WalMessage.Kind.BEGIN, begin.kind());
    assertEquals(5L, ((WalMessage.Begin) begin).xid());
    assertEquals(Lsn.of(100), begin.lsn());
    assertEquals(Instant.parse("2026-03-01T10:15:30.123456Z"), ((WalMessage.Begin) begin).timestamp());
    assertEquals(WalMessage.Kind.COMMIT, commit.kind());
    assertEquals(Lsn.of(103), commit.lsn());
    assertEquals(Instant.parse("2026-03-01T10:15:30Z"), ((WalMessage.Commit) commit).timestamp());
  }

  @Test
  void decodesRowChangesWithTypes() {
    WalMessage message = decoder.decode(
      "{\"action\":\"U\",\"schema\":\"public\",\"table\":\"accounts\",\"lsn\":\"0/16B6C50\","
        + "\"columns\":["
        + "{\"name\":\"id\",\"type\":\"bigint\",\"value\":7},"
        + "{\"name\":\"balance\",\"type\":\"numeric(12,2)\",\"value\":\"1024.50\"},"
        + "{\"name\":\"active\",\"type\":\"boolean\",\"value\":true},"
        + "{\"name\":\"meta\",\"type\":\"jsonb\",\"value\":\"{\\\"tier\\\":\\\"gold\\\"}\"},"
        + "{\"name\":\"note\",\"type\":\"text\",\"value\":null}],"
        + "\"identity\":[{\"name\":\"id\",\"type\":\"bigint\",\"value\":7}]}",
      Lsn.INVALID);

    WalMessage.RowChange row = (WalMessage.RowChange) message;
    ChangeRecord record = row.toRecord(42L);
    assertEquals(ChangeKind.UPDATE, record.kind());
    assertEquals("public.accounts", record.qualifiedTable());
    assertEquals(Lsn.valueOf("0/16B6C50"), record.lsn());
    assertEquals(7L, record.longValue("id"));
    assertEquals(new BigDecimal("1024.50"), record.column("balance").orElseThrow().value());
    assertEquals(Boolean.TRUE, record.column("active").orElseThrow().value());
    assertEquals(ValueKind.JSON, record.column("meta").orElseThrow().kind());
    assertEquals("gold", ((JsonObject) record.column("meta").orElseThrow().value()).getString("tier"));
    assertTrue(record.column("note").orElseThrow().isNull());
    assertEquals(7L, record.oldColumn("id").orElseThrow().asLong());
  }

  @Test
  void deleteCarriesIdentityOnly() {
    WalMessage.RowChange row = (WalMessage.RowChange) decoder.decode(
      "{\"action\":\"D\",\"schema\":\"public\",\"table\":\"users\",\"lsn\":\"0/70\","
        + "\"identity\":[{\"name\":\"id\",\"type\":\"integer\",\"value\":3}]}",
      Lsn.INVALID);

    ChangeRecord record = row.toRecord(9L);
    assertEquals(ChangeKind.DELETE, record.kind());
    assertTrue(record.columns().isEmpty());
    assertEquals(3L, record.oldColumn("id").orElseThrow().asLong());
  }

  @Test
  void fallsBackToReceivePosition() {
    WalMessage message = decoder.decode(
      "{\"action\":\"I\",\"schema\":\"public\",\"table\":\"users\","
        + "\"columns\":[{\"name\":\"id\",\"type\":\"integer\",\"value\":1}]}",
      Lsn.of(500));

    assertEquals(Lsn.of(500), message.lsn());
    assertNull(((WalMessage.RowChange) message).xid());
  }

  @Test
  void feedsSequencerIntoOneEnvelope() {
    TransactionSequencer sequencer = new TransactionSequencer(Lsn.INVALID);
    String[] payloads = {
      "{\"action\":\"B\",\"xid\":5,\"lsn\":\"0/64\"}",
      "{\"action\":\"I\",\"schema\":\"public\",\"table\":\"users\",\"lsn\":\"0/65\","
        + "\"columns\":[{\"name\":\"age\",\"type\":\"integer\",\"value\":30}]}",
      "{\"action\":\"U\",\"schema\":\"public\",\"table\":\"users\",\"lsn\":\"0/66\","
        + "\"columns\":[{\"name\":\"age\",\"type\":\"integer\",\"value\":31}]}",
      "{\"action\":\"C\",\"xid\":5,\"lsn\":\"0/67\"}"
    };

    Optional<TransactionEnvelope> envelope = Optional.empty();
    for (String payload : payloads) {
      envelope = sequencer.accept(decoder.decode(payload, Lsn.INVALID));
    }

    TransactionEnvelope tx = envelope.orElseThrow();
    assertEquals(Lsn.of(103), tx.commitLsn());
    assertEquals(ChangeKind.INSERT, tx.records().get(0).kind());
    assertEquals(ChangeKind.UPDATE, tx.records().get(1).kind());
    assertEquals(5L, tx.records().get(1).transactionId());
  }

  @Test
  void rejectsMalformedMessages() {
    assertThrows(WalDecodeException.class, () -> decoder.decode("not json", Lsn.INVALID));
    assertThrows(WalDecodeException.class, () -> decoder.decode("{\"xid\":5}", Lsn.INVALID));
    assertThrows(WalDecodeException.class, () -> decoder.decode("{\"action\":\"T\",\"lsn\":\"0/1\"}", Lsn.INVALID));
    assertThrows(WalDecodeException.class, () -> decoder.decode("{\"action\":\"B\",\"lsn\":\"0/1\"}", Lsn.INVALID));
    assertThrows(WalDecodeException.class, () -> decoder.decode(
      "{\"action\":\"I\",\"schema\":\"public\",\"table\":\"users\",\"lsn\":\"0/1\",\"columns\":[]}", Lsn.INVALID));
    assertThrows(WalDecodeException.class, () -> decoder.decode(
      "{\"action\":\"I\",\"schema\":\"public\",\"table\":\"users\",\"lsn\":\"0/1\","
        + "\"columns\":[{\"name\":\"n\",\"type\":\"integer\",\"value\":\"abc\"}]}", Lsn.INVALID));

    WalDecodeException error = assertThrows(WalDecodeException.class,
      () -> decoder.decode("{\"action\":\"C\",\"xid\":5}", Lsn.INVALID));
    assertEquals("{\"action\":\"C\",\"xid\":5}", error.payload());
  }

  @Test
  void readsAbortAsRollback() {
    WalMessage message = decoder.decode("{\"action\":\"A\",\"xid\":8,\"lsn\":\"0/90\"}", Lsn.INVALID);

    assertEquals(WalMessage.Kind.ROLLBACK, message.kind());
  }

  @Test
  void requestsFormatVersionTwo() {
    assertEquals(2, decoder.defaultSlotOptions().get("format-version"));
    assertTrue(decoder.supportsPlugin("wal2json"));
  }
}
