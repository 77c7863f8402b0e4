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

package dev.henneberger.vertx.cdc.app;

import static org.junit.jupiter.api.Assertions.assertEquals;

import dev.henneberger.vertx.cdc.core.DecodeException;
import dev.henneberger.vertx.cdc.core.WorkerFailure;
import dev.henneberger.vertx.cdc.core.WorkerOutcome;
import dev.henneberger.vertx.cdc.core.WorkerState;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReplicationAppTest {

  @Test
  void missingConfigurationExitsWithConfigCode() {
    assertEquals(ReplicationApp.EXIT_INVALID_CONFIG, ReplicationApp.run(Map.of(), noSignals()));
  }

  @Test
  void invalidSlotNameExitsWithConfigCode() {
    Map<String, String> env = ReplicationAppConfigTest.required();
    env.put("REPLICATION_SLOT_NAME", "Orders-Slot");
    assertEquals(ReplicationApp.EXIT_INVALID_CONFIG, ReplicationApp.run(env, noSignals()));
  }

  @Test
  void mapsOutcomeToExitCode() {
    ReplicationAppConfig config = ReplicationAppConfig.fromMap(ReplicationAppConfigTest.required());

    assertEquals(ReplicationApp.EXIT_STOPPED,
      ReplicationApp.report(config, new WorkerOutcome(WorkerState.STOPPED, 0x100, null)));
    assertEquals(ReplicationApp.EXIT_FAILED, ReplicationApp.report(config, new WorkerOutcome(WorkerState.FAILED, 0x100,
      new WorkerFailure(WorkerState.STREAMING, 0x100, new DecodeException("bad payload", "{", 0x120)))));
  }

  private static ShutdownSignalHandler noSignals() {
    return new ShutdownSignalHandler(code -> {
      throw new AssertionError("unexpected halt with " + code);
    }, Duration.ofSeconds(1));
  }
}
