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

import dev.henneberger.vertx.cdc.core.Lsn;
import dev.henneberger.vertx.cdc.core.WalMessage;
import java.util.Map;

/**
 * Decodes the payload of one logical replication message into a {@link WalMessage}.
 */
public interface ChangeDecoder {

  /**
   * @param payload the message text as sent by the output plugin
   * @param receiveLsn position reported by the stream for this message, used when the payload carries none
   * @throws dev.henneberger.vertx.cdc.core.WalDecodeException when the payload is malformed
   */
  WalMessage decode(String payload, Lsn receiveLsn);

  boolean supportsPlugin(String plugin);

  /**
   * Slot options the decoder depends on. User supplied plugin options are applied on top.
   */
  Map<String, Object> defaultSlotOptions();
}
