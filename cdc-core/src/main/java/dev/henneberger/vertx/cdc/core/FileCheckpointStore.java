package dev.henneberger.vertx.cdc.core;

import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists checkpoints in a JSON file keyed by slot name.
 *
 * <p>Each save writes a sibling temp file, forces it to disk and renames it over the target, so a
 * crash leaves either the previous or the new content behind.
 */
public final class FileCheckpointStore implements CheckpointStore {

  private static final Logger LOG = LoggerFactory.getLogger(FileCheckpointStore.class);

  private final Path file;
  private final Clock clock;
  private final Object monitor = new Object();

  public FileCheckpointStore(Path file) {
    this(file, Clock.systemUTC());
  }

  public FileCheckpointStore(Path file, Clock clock) {
    this.file = Objects.requireNonNull(file, "file");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Path file() {
    return file;
  }

  @Override
  public Optional<Checkpoint> load(String slotName) throws Exception {
    Objects.requireNonNull(slotName, "slotName");
    synchronized (monitor) {
      return Optional.ofNullable(readAll().get(slotName));
    }
  }

  @Override
  public Checkpoint save(String slotName, Lsn confirmedLsn) throws Exception {
    Objects.requireNonNull(slotName, "slotName");
    Objects.requireNonNull(confirmedLsn, "confirmedLsn");

    synchronized (monitor) {
      Map<String, Checkpoint> values = readAll();
      CheckpointStores.requireNotBehind(values.get(slotName), confirmedLsn);
      Checkpoint checkpoint = new Checkpoint(slotName, confirmedLsn, clock.instant());
      values.put(slotName, checkpoint);
      writeAll(values);
      return checkpoint;
    }
  }

  private Map<String, Checkpoint> readAll() throws IOException {
    if (Files.notExists(file)) {
      return new LinkedHashMap<>();
    }

    String raw = Files.readString(file, StandardCharsets.UTF_8);
    if (raw.isBlank()) {
      return new LinkedHashMap<>();
    }

    JsonObject json;
    try {
      json = new JsonObject(raw);
    } catch (RuntimeException e) {
      throw new IOException("Checkpoint file " + file + " is not valid JSON", e);
    }
    Map<String, Checkpoint> values = new LinkedHashMap<>();
    for (String key : json.fieldNames()) {
      JsonObject entry = json.getJsonObject(key);
      if (entry == null) {
        continue;
      }
      try {
        values.put(key, Checkpoint.fromJson(entry));
      } catch (RuntimeException e) {
        throw new IOException("Checkpoint entry '" + key + "' in " + file + " is malformed", e);
      }
    }
    return values;
  }

  private void writeAll(Map<String, Checkpoint> values) throws IOException {
    Path target = file.toAbsolutePath();
    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }

    JsonObject json = new JsonObject();
    values.forEach((slot, checkpoint) -> json.put(slot, checkpoint.toJson()));
    byte[] bytes = json.encodePrettily().getBytes(StandardCharsets.UTF_8);

    Path temp = target.resolveSibling(target.getFileName() + ".tmp");
    try (FileChannel channel = FileChannel.open(temp,
      StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
      ByteBuffer buffer = ByteBuffer.wrap(bytes);
      while (buffer.hasRemaining()) {
        channel.write(buffer);
      }
      channel.force(true);
    }

    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      LOG.warn("Atomic rename not supported for {}, falling back to replace", target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
    syncDirectory(parent);
  }

  private static void syncDirectory(Path directory) {
    if (directory == null) {
      return;
    }
    try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
      channel.force(true);
    } catch (IOException e) {
      // Not every platform allows opening a directory for sync.
      LOG.debug("Could not sync directory {}", directory, e);
    }
  }
}
