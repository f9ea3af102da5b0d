package dev.henneberger.vertx.cdc.core;

/**
 * A slot with the requested name exists but cannot be used with the configured output plugin.
 */
public class SlotConflictException extends ReplicationException {

  private final String expectedPlugin;
  private final String actualPlugin;

  public SlotConflictException(String slotName, String expectedPlugin, String actualPlugin) {
    this(slotName, expectedPlugin, actualPlugin,
      "it uses plugin '" + actualPlugin + "' but '" + expectedPlugin + "' is required");
  }

  public SlotConflictException(String slotName, String expectedPlugin, String actualPlugin, String reason) {
    super("Replication slot '" + slotName + "' cannot be used: " + reason, slotName, null, null);
    this.expectedPlugin = expectedPlugin;
    this.actualPlugin = actualPlugin;
  }

  public String expectedPlugin() {
    return expectedPlugin;
  }

  public String actualPlugin() {
    return actualPlugin;
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
