package dev.henneberger.vertx.cdc.core;

public enum ChangeKind {
  INSERT,
  UPDATE,
  DELETE
}
