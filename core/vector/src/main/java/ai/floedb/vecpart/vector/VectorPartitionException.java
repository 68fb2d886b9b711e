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

import java.util.Objects;

/**
 * Structured runtime error raised while wrapping, iterating or externalizing a vector partition.
 *
 * <p>Every kind is fatal for the partition it names. The identity of the offending partition is
 * attached whenever it is known at the point of failure.
 */
public final class VectorPartitionException extends RuntimeException {

  public enum Kind {
    /** The vector's minor type has no registry entry. */
    UNSUPPORTED_TYPE,
    /** The encoded stream does not match the layout it declares. */
    STREAM_CORRUPTION,
    /** A typed view was requested with an element type other than the vector's. */
    TYPE_MISMATCH,
    /** The allocator could not provide the memory a vector needs. */
    ALLOCATION_FAILURE
  }

  private final Kind kind;
  private final String detail;
  private final Long collectionId;
  private final Integer index;

  public VectorPartitionException(Kind kind, String detail) {
    this(kind, detail, null, null, null);
  }

  public VectorPartitionException(Kind kind, String detail, Throwable cause) {
    this(kind, detail, cause, null, null);
  }

  public VectorPartitionException(
      Kind kind, String detail, Throwable cause, Long collectionId, Integer index) {
    super(message(kind, detail, collectionId, index), cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.detail = detail;
    this.collectionId = collectionId;
    this.index = index;
  }

  static VectorPartitionException unsupportedType(String tag) {
    return new VectorPartitionException(Kind.UNSUPPORTED_TYPE, "Unsupported vector type: " + tag);
  }

  static VectorPartitionException streamCorruption(String detail) {
    return new VectorPartitionException(Kind.STREAM_CORRUPTION, detail);
  }

  static VectorPartitionException streamCorruption(String detail, Throwable cause) {
    return new VectorPartitionException(Kind.STREAM_CORRUPTION, detail, cause);
  }

  static VectorPartitionException typeMismatch(String expected, String actual) {
    return new VectorPartitionException(
        Kind.TYPE_MISMATCH, "Expected " + expected + " vector but found " + actual);
  }

  static VectorPartitionException allocationFailure(String detail, Throwable cause) {
    return new VectorPartitionException(Kind.ALLOCATION_FAILURE, detail, cause);
  }

  /**
   * Returns this error attributed to the given partition. Errors that already name a partition
   * are returned unchanged.
   */
  public VectorPartitionException forPartition(long collectionId, int index) {
    if (hasPartition()) {
      return this;
    }
    VectorPartitionException attributed =
        new VectorPartitionException(kind, detail, getCause(), collectionId, index);
    attributed.setStackTrace(getStackTrace());
    return attributed;
  }

  public Kind kind() {
    return kind;
  }

  public String detail() {
    return detail;
  }

  public boolean hasPartition() {
    return collectionId != null && index != null;
  }

  public Long collectionId() {
    return collectionId;
  }

  public Integer index() {
    return index;
  }

  private static String message(Kind kind, String detail, Long collectionId, Integer index) {
    StringBuilder sb = new StringBuilder().append(kind).append(": ").append(detail);
    if (collectionId != null && index != null) {
      sb.append(" (collection=").append(collectionId).append(", index=").append(index).append(')');
    }
    return sb.toString();
  }
}
