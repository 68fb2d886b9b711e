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
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Moves every partition through Java serialization before running the task, the way a remote task
 * launch would.
 *
 * <p>The task receives the deserialized copy. If the copy is {@link AutoCloseable} it is closed
 * once the task returns, so task results must not reference the copy's memory.
 */
public final class SerializingTaskDispatcher implements TaskDispatcher {

  private static final Logger LOG = Logger.getLogger(SerializingTaskDispatcher.class);

  @Override
  public <P extends Partition, R> R dispatch(P partition, PartitionTask<P, R> task) {
    Objects.requireNonNull(partition, "partition");
    Objects.requireNonNull(task, "task");
    byte[] bytes = serialize(partition);
    LOG.debugf("Shipping partition %d as %d bytes", partition.index(), bytes.length);
    P copy = deserialize(partition, bytes);
    try {
      return task.run(copy);
    } finally {
      release(copy);
    }
  }

  private static byte[] serialize(Partition partition) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(partition);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to serialize partition " + partition.index(), e);
    }
    return bytes.toByteArray();
  }

  @SuppressWarnings("unchecked")
  private static <P extends Partition> P deserialize(P original, byte[] bytes) {
    try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
      return (P) original.getClass().cast(in.readObject());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to deserialize partition " + original.index(), e);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Failed to deserialize partition " + original.index(), e);
    }
  }

  private static void release(Object copy) {
    if (copy instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        throw new IllegalStateException("Failed to release partition copy", e);
      }
    }
  }
}
