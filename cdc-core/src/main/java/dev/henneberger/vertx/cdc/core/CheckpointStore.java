package dev.henneberger.vertx.cdc.core;

import java.util.Optional;

/**
 * Durable record of the last position whose changes the consumer has fully processed.
 *
 * <p>{@link #save} must be durable when it returns: the stream acknowledges the same position to the
 * server right afterwards, which allows the server to discard the WAL. Implementations reject saves that
 * would move a slot backwards.
 */
public interface CheckpointStore {
  Optional<Checkpoint> load(String slotName) throws Exception;
  Checkpoint save(String slotName, Lsn confirmedLsn) throws Exception;
}
