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

import java.io.Externalizable;
import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInput;
import java.io.ObjectOutput;
import java.io.ObjectStreamException;
import org.jboss.logging.Logger;

/**
 * Serialized form of a {@link VectorPartition}.
 *
 * <p>Java serialization writes this object in place of the partition. {@code readExternal} decodes
 * into memory from {@link VectorAllocators#decodeAllocator()} and {@code readResolve} hands the new
 * partition back to the stream, so the receiving side only ever sees fully built partitions.
 */
public final class VectorPartitionExternalForm implements Externalizable {

  private static final long serialVersionUID = 1L;

  private static final Logger LOG = Logger.getLogger(VectorPartitionExternalForm.class);

  private VectorPartition<?> partition;

  /** Required by {@link Externalizable}. */
  public VectorPartitionExternalForm() {}

  VectorPartitionExternalForm(VectorPartition<?> partition) {
    this.partition = partition;
  }

  @Override
  public void writeExternal(ObjectOutput out) throws IOException {
    if (partition == null) {
      throw new IllegalStateException("No partition to write");
    }
    VectorPartitionCodec.shared().write(out, partition);
  }

  @Override
  public void readExternal(ObjectInput in) throws IOException {
    VectorPartition<?> decoded =
        VectorPartitionCodec.shared().read(in, VectorAllocators.decodeAllocator());
    // read() returns -1 only at the end of this object's external data
    if (in.read() != -1) {
      int valueCount = decoded.valueCount();
      decoded.close();
      LOG.warnf(
          "Rejecting partition collection=%d index=%d with data after %d elements",
          decoded.collectionId(), decoded.index(), valueCount);
      throw VectorPartitionException.streamCorruption(
              "Unread data after " + valueCount + " elements")
          .forPartition(decoded.collectionId(), decoded.index());
    }
    partition = decoded;
  }

  private Object readResolve() throws ObjectStreamException {
    if (partition == null) {
      throw new InvalidObjectException("External form was not read");
    }
    return partition;
  }
}
