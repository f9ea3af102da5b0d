package dev.henneberger.vertx.cdc.core;

public interface ReplicationMetricsListener {
  void onEnvelope(TransactionEnvelope envelope);
  void onDecodeFailure(String payload, Throwable error);
  void onStateChange(ReplicationStateChange stateChange);
  void onCheckpointSaved(Checkpoint checkpoint);
  void onAcknowledged(String slotName, Lsn lsn);
}
