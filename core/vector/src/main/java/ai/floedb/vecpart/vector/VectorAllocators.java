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

package ai.floedb.vecpart.vector;

import ai.floedb.vecpart.vector.config.VecPartConfigs;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.jboss.logging.Logger;

/**
 * Holder for the process-wide allocator that partitions reconstructed by Java deserialization
 * allocate from.
 *
 * <p>Deserialization gives the codec no way to receive an allocator from its caller, so one is
 * created lazily with the configured {@code vecpart.allocator.limit}. Embedders that manage their
 * own allocator tree install a parent with {@link #setDecodeAllocator}.
 */
public final class VectorAllocators {

  private static final Logger LOG = Logger.getLogger(VectorAllocators.class);

  private static volatile BufferAllocator decodeAllocator;
  private static boolean owned;

  private VectorAllocators() {}

  public static BufferAllocator decodeAllocator() {
    BufferAllocator alloc = decodeAllocator;
    if (alloc != null) {
      return alloc;
    }
    synchronized (VectorAllocators.class) {
      if (decodeAllocator == null) {
        long limit = VecPartConfigs.current().allocator().limit();
        decodeAllocator = new RootAllocator(limit);
        owned = true;
        LOG.debugf("Created decode allocator with limit %d", limit);
      }
      return decodeAllocator;
    }
  }

  /**
   * Installs the allocator used for decoding. The caller keeps ownership and must close it after
   * calling {@link #clear}.
   */
  public static synchronized void setDecodeAllocator(BufferAllocator allocator) {
    if (allocator == null) {
      throw new IllegalArgumentException("Decode allocator cannot be null");
    }
    releaseOwned();
    decodeAllocator = allocator;
    owned = false;
  }

  /** Drops the current allocator, closing it if it was created here. */
  public static synchronized void clear() {
    releaseOwned();
    decodeAllocator = null;
    owned = false;
  }

  private static void releaseOwned() {
    if (owned && decodeAllocator != null) {
      decodeAllocator.close();
    }
  }
}
