package dev.henneberger.vertx.cdc.core;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps checkpoints in memory. Not durable across restarts; meant for tests and local development.
 */
public final class InMemoryCheckpointStore implements CheckpointStore {
  private final Map<String, Checkpoint> storage = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryCheckpointStore() {
    this(Clock.systemUTC());
  }

  public InMemoryCheckpointStore(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Optional<Checkpoint> load(String slotName) {
    Objects.requireNonNull(slotName, "slotName");
    return Optional.ofNullable(storage.get(slotName));
  }

  @Override
  public Checkpoint save(String slotName, Lsn confirmedLsn) {
    Objects.requireNonNull(slotName, "slotName");
    Objects.requireNonNull(confirmedLsn, "confirmedLsn");
    return storage.compute(slotName, (key, previous) -> {
      CheckpointStores.requireNotBehind(previous, confirmedLsn);
      return new Checkpoint(slotName, confirmedLsn, clock.instant());
    });
  }
}
