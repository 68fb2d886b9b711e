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

package ai.floedb.vecpart.engine.spi;

/**
 * Hands a partition to a task.
 *
 * <p>A dispatcher decides where the task runs. When the task runs outside the process that owns
 * the partition, the dispatcher moves the partition through Java serialization and the task sees
 * the reconstructed copy, never the original. Failures raised while moving the partition or while
 * running the task propagate to the caller; dispatchers do not retry.
 */
public interface TaskDispatcher {

  <P extends Partition, R> R dispatch(P partition, PartitionTask<P, R> task);
}
