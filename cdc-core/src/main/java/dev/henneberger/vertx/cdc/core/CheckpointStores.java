package dev.henneberger.vertx.cdc.core;

final class CheckpointStores {

  private CheckpointStores() {
  }

  static void requireNotBehind(Checkpoint previous, Lsn next) {
    if (previous != null && next.isBefore(previous.confirmedLsn())) {
      throw new IllegalStateException("Checkpoint for slot '" + previous.slotName() + "' cannot move back from "
        + previous.confirmedLsn() + " to " + next);
    }
  }
}
