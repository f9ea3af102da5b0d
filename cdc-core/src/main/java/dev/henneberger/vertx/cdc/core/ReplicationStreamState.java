package dev.henneberger.vertx.cdc.core;

public enum ReplicationStreamState {
  DISCONNECTED,
  CONNECTING,
  STREAMING,
  FAILED,
  STOPPED
}
