/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.tidelake.metadata;

import java.util.Objects;

/**
 * Envelope of an immutable chunk of encoded events. The {@code insertTime} decides the materialization window of the
 * block, because ingestion is monotonic only in insertion order.
 */
public class BlockMetadata {
  private final String blockId;
  private final String streamId;
  private final String processId;
  private final long   beginTime;
  private final long   endTime;
  private final long   beginTicks;
  private final long   endTicks;
  private final long   nbObjects;
  private final long   objectOffset;
  private final long   payloadSize;
  private final long   insertTime;

  private BlockMetadata(final Builder builder) {
    this.blockId = Objects.requireNonNull(builder.blockId, "blockId");
    this.streamId = Objects.requireNonNull(builder.streamId, "streamId");
    this.processId = Objects.requireNonNull(builder.processId, "processId");
    if (builder.endTime < builder.beginTime)
      throw new IllegalArgumentException("Block " + builder.blockId + " ends before it begins");
    this.beginTime = builder.beginTime;
    this.endTime = builder.endTime;
    this.beginTicks = builder.beginTicks;
    this.endTicks = builder.endTicks;
    this.nbObjects = builder.nbObjects;
    this.objectOffset = builder.objectOffset;
    this.payloadSize = builder.payloadSize;
    this.insertTime = builder.insertTime;
  }

  public static Builder builder(final String blockId, final String streamId, final String processId) {
    return new Builder(blockId, streamId, processId);
  }

  public String getBlockId() {
    return blockId;
  }

  public String getStreamId() {
    return streamId;
  }

  public String getProcessId() {
    return processId;
  }

  public long getBeginTime() {
    return beginTime;
  }

  public long getEndTime() {
    return endTime;
  }

  public long getBeginTicks() {
    return beginTicks;
  }

  public long getEndTicks() {
    return endTicks;
  }

  public long getNbObjects() {
    return nbObjects;
  }

  public long getObjectOffset() {
    return objectOffset;
  }

  public long getPayloadSize() {
    return payloadSize;
  }

  public long getInsertTime() {
    return insertTime;
  }

  /**
   * Object storage path of the encoded events of the block.
   */
  public String getPayloadPath() {
    return payloadPath(processId, streamId, blockId);
  }

  public static String payloadPath(final String processId, final String streamId, final String blockId) {
    return "blobs/" + processId + "/" + streamId + "/" + blockId;
  }

  @Override
  public String toString() {
    return "Block{" + blockId + ", stream=" + streamId + ", objects=" + nbObjects + ", insertTime=" + insertTime + "}";
  }

  public static class Builder {
    private final String blockId;
    private final String streamId;
    private final String processId;
    private       long   beginTime;
    private       long   endTime;
    private       long   beginTicks;
    private       long   endTicks;
    private       long   nbObjects;
    private       long   objectOffset;
    private       long   payloadSize;
    private       long   insertTime;

    private Builder(final String blockId, final String streamId, final String processId) {
      this.blockId = blockId;
      this.streamId = streamId;
      this.processId = processId;
    }

    public Builder timeRange(final long beginTime, final long endTime) {
      this.beginTime = beginTime;
      this.endTime = endTime;
      return this;
    }

    public Builder ticks(final long beginTicks, final long endTicks) {
      this.beginTicks = beginTicks;
      this.endTicks = endTicks;
      return this;
    }

    public Builder nbObjects(final long nbObjects) {
      this.nbObjects = nbObjects;
      return this;
    }

    public Builder objectOffset(final long objectOffset) {
      this.objectOffset = objectOffset;
      return this;
    }

    public Builder payloadSize(final long payloadSize) {
      this.payloadSize = payloadSize;
      return this;
    }

    public Builder insertTime(final long insertTime) {
      this.insertTime = insertTime;
      return this;
    }

    public BlockMetadata build() {
      return new BlockMetadata(this);
    }
  }
}
