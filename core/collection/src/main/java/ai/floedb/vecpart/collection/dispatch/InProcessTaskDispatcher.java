/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.vecpart.collection.dispatch;

import ai.floedb.vecpart.engine.spi.Partition;
import ai.floedb.vecpart.engine.spi.PartitionTask;
import ai.floedb.vecpart.engine.spi.TaskDispatcher;
import java.util.Objects;

/** Runs tasks on the caller's thread against the original partition. */
public final class InProcessTaskDispatcher implements TaskDispatcher {

  @Override
  public <P extends Partition, R> R dispatch(P partition, PartitionTask<P, R> task) {
    Objects.requireNonNull(partition, "partition");
    Objects.requireNonNull(task, "task");
    return task.run(partition);
  }
}
