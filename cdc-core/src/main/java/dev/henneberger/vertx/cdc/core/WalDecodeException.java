package dev.henneberger.vertx.cdc.core;

/**
 * An output plugin message could not be decoded. The stream halts instead of skipping it.
 */
public class WalDecodeException extends ReplicationException {

  private final String payload;

  public WalDecodeException(String message, String payload) {
    this(message, payload, null);
  }

  public WalDecodeException(String message, String payload, Throwable cause) {
    super(message, null, null, cause);
    this.payload = payload;
  }

  public String payload() {
    return payload;
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
