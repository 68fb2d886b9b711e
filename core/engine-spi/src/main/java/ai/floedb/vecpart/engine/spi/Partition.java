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

import java.io.Serializable;

/**
 * A unit of distributed data and scheduling.
 *
 * <p>The engine keys its caches and schedules by partition identity, so implementations must
 * define {@code equals}/{@code hashCode} from their position in the owning collection rather than
 * from their payload.
 */
public interface Partition extends Serializable {

  /** Zero-based position of this partition within its collection. */
  int index();
}
